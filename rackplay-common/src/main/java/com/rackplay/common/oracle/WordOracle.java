package com.rackplay.common.oracle;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/** An external authority on whether plain words exist. */
public interface WordOracle {

    WordOracle NOOP = words -> CompletableFuture.completedFuture(new OracleVerdict(Set.copyOf(words), Set.of()));

    /**
     * Checks a batch of plain lowercase words. The returned future never completes exceptionally: a
     * word that could not be checked is reported valid.
     */
    CompletableFuture<OracleVerdict> checkBatch(final List<String> words);
}
