package com.rackplay.solver;

import com.rackplay.solver.play.BestPlay;
import java.util.concurrent.CompletableFuture;

public interface RackOptimizer {

    /**
     * Finds the best play for a rack written in tile notation, e.g. {@code "(qu) o t e"}.
     *
     * <p>The future completes with an empty play when no word can be laid; it only fails on an
     * internal fault.
     */
    CompletableFuture<BestPlay> optimize(final String rawTiles, final OptimizeOptions options);
}
