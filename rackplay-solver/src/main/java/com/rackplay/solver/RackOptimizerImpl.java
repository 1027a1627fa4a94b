package com.rackplay.solver;

import com.rackplay.common.config.RackplayConfig;
import com.rackplay.common.frequency.CommonWordGate;
import com.rackplay.common.frequency.FrequencyCorpus;
import com.rackplay.common.frequency.Lemmatizer;
import com.rackplay.common.oracle.OracleVerdict;
import com.rackplay.common.oracle.WordOracle;
import com.rackplay.common.tile.TileParser;
import com.rackplay.common.tile.TileTable;
import com.rackplay.solver.candidate.Candidate;
import com.rackplay.solver.candidate.CandidateGenerator;
import com.rackplay.solver.dictionary.TrieCache;
import com.rackplay.solver.play.BestPlay;
import com.rackplay.solver.play.BestPlaySelector;
import com.rackplay.solver.play.PlayParameters;
import com.rackplay.solver.rack.RackCounts;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class RackOptimizerImpl implements RackOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(RackOptimizerImpl.class);

    private final RackplayConfig config;
    private final TileTable table;
    private final TrieCache tries;
    private final CandidateGenerator generator;
    private final BestPlaySelector selector;
    private final FrequencyCorpus corpus;
    private final Lemmatizer lemmatizer;
    private final WordOracle oracle;
    private final Executor executor;

    @Inject
    public RackOptimizerImpl(
            final RackplayConfig config,
            final TileTable table,
            final TrieCache tries,
            final CandidateGenerator generator,
            final BestPlaySelector selector,
            final FrequencyCorpus corpus,
            final Lemmatizer lemmatizer,
            final WordOracle oracle,
            final @Named("work") Executor executor) {
        this.config = config;
        this.table = table;
        this.tries = tries;
        this.generator = generator;
        this.selector = selector;
        this.corpus = corpus;
        this.lemmatizer = lemmatizer;
        this.oracle = oracle;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<BestPlay> optimize(final String rawTiles, final OptimizeOptions options) {
        return CompletableFuture.supplyAsync(() -> this.search(rawTiles, options), this.executor)
                .thenCompose(pass -> options.verifyOnline()
                        ? this.refine(pass, 0)
                        : CompletableFuture.completedFuture(pass.play()));
    }

    private Pass search(final String rawTiles, final OptimizeOptions options) {
        final var rack = RackCounts.count(TileParser.parseNormalized(rawTiles), this.table);
        final var game = this.config.game();
        final var trie = this.tries.get(game.maxWordLength());
        final var candidates = this.generator.generate(trie, rack, game.minWordLength(), this.createGate(options));
        final var params = new PlayParameters(
                options.noDiscard(),
                PlayParameters.threshold(options.currentLongest()),
                PlayParameters.threshold(options.currentMost()),
                game.longestWordBonus(),
                game.mostWordsBonus(),
                game.leftoverPolicy());
        final var play = this.selector.choose(candidates, rack, params);
        LOGGER.debug("Found {} candidates for {}, best play scores {}", candidates.size(), rawTiles, play.totalScore());
        return new Pass(rack, params, candidates, play);
    }

    private CommonWordGate createGate(final OptimizeOptions options) {
        if (!options.commonOnly() || this.corpus.isEmpty()) {
            return CommonWordGate.ANY;
        }
        final var frequency = this.config.frequency();
        return new CommonWordGate.Frequency(
                this.corpus,
                this.lemmatizer,
                frequency.mode(),
                options.minZipf() > 0 ? options.minZipf() : frequency.minZipf(),
                frequency.topK(),
                options.shortWordOverride());
    }

    private CompletableFuture<BestPlay> refine(final Pass pass, final int iteration) {
        if (pass.play().isEmpty() || iteration >= this.config.oracle().maxRefinements()) {
            return CompletableFuture.completedFuture(pass.play());
        }
        final var plain = pass.play().words().stream().map(Candidate::plain).distinct().toList();
        return this.oracle
                .checkBatch(plain)
                .exceptionally(throwable -> {
                    LOGGER.warn("Word check of {} failed, assuming every word is valid", plain, throwable);
                    return new OracleVerdict(Set.copyOf(plain), Set.of());
                })
                .thenComposeAsync(
                        verdict -> {
                            if (verdict.allValid()) {
                                return CompletableFuture.completedFuture(pass.play());
                            }
                            LOGGER.debug("Refinement {} rejected {}", iteration + 1, verdict.invalid());
                            final var remaining = pass.candidates().stream()
                                    .filter(candidate -> !verdict.invalid().contains(candidate.plain()))
                                    .toList();
                            if (remaining.isEmpty()) {
                                return CompletableFuture.completedFuture(BestPlay.empty(pass.rack(), this.table));
                            }
                            final var play = this.selector.choose(remaining, pass.rack(), pass.params());
                            return this.refine(new Pass(pass.rack(), pass.params(), remaining, play), iteration + 1);
                        },
                        this.executor);
    }

    private record Pass(RackCounts rack, PlayParameters params, List<Candidate> candidates, BestPlay play) {}
}
