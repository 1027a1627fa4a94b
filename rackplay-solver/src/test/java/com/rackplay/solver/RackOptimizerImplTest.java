package com.rackplay.solver;

import static org.assertj.core.api.Assertions.assertThat;

import com.rackplay.common.config.RackplayConfig;
import com.rackplay.common.frequency.FrequencyCorpus;
import com.rackplay.common.frequency.FrequencyEntry;
import com.rackplay.common.frequency.Lemmatizer;
import com.rackplay.common.oracle.OracleVerdict;
import com.rackplay.common.oracle.WordOracle;
import com.rackplay.common.tile.TileTable;
import com.rackplay.solver.candidate.Candidate;
import com.rackplay.solver.candidate.CandidateGenerator;
import com.rackplay.solver.dictionary.Dictionary;
import com.rackplay.solver.dictionary.TrieCache;
import com.rackplay.solver.play.BestPlay;
import com.rackplay.solver.play.BestPlaySelector;
import java.io.IOException;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Test;

final class RackOptimizerImplTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5L);
    private static final TileTable TABLE = TileTable.defaults();
    private static final Dictionary DICTIONARY = Dictionary.of(List.of("QUOTE", "TOE", "TO"));

    private final RecordingOracle oracle = new RecordingOracle();

    @Test
    void finds_best_play() {
        final var play = optimize(new RackplayConfig(), FrequencyCorpus.EMPTY, "(qu) o t e", OptimizeOptions.DEFAULT);
        assertThat(play.words()).extracting(Candidate::plain).containsExactly("quote");
        assertThat(play.totalScore()).isEqualTo(16);
        assertThat(this.oracle.calls).isEmpty();
    }

    @Test
    void thresholds_enable_bonuses() {
        final var play = optimize(
                new RackplayConfig(), FrequencyCorpus.EMPTY, "(qu)ote", OptimizeOptions.DEFAULT.withThresholds(4, 0));
        assertThat(play.bonus()).isEqualTo(new BestPlay.Bonus(10, 0));
        assertThat(play.totalScore()).isEqualTo(26);
    }

    @Test
    void verification_drops_rejected_words() {
        this.oracle.rejected.add("quote");
        final var play = optimize(
                new RackplayConfig(), FrequencyCorpus.EMPTY, "(qu)ote", OptimizeOptions.DEFAULT.withVerifyOnline(true));
        assertThat(play.words()).extracting(Candidate::plain).containsExactly("toe");
        assertThat(play.discardTile()).isEqualTo("qu");
        assertThat(this.oracle.calls).containsExactly(List.of("quote"), List.of("toe"));
    }

    @Test
    void verification_can_exhaust_candidates() {
        this.oracle.rejected.addAll(List.of("quote", "toe", "to"));
        final var play = optimize(
                new RackplayConfig(), FrequencyCorpus.EMPTY, "(qu)ote", OptimizeOptions.DEFAULT.withVerifyOnline(true));
        assertThat(play.isEmpty()).isTrue();
        assertThat(play.unusedTiles()).containsExactly("e", "o", "t", "qu");
        assertThat(play.leftoverPenalty()).isEqualTo(16);
        assertThat(play.totalScore()).isZero();
    }

    @Test
    void verification_stops_at_the_cap() {
        this.oracle.rejected.addAll(List.of("quote", "toe", "to"));
        final var config = new RackplayConfig(null, null, null, new RackplayConfig.OracleConfig(null, 8, 1));
        final var play = optimize(config, FrequencyCorpus.EMPTY, "(qu)ote", OptimizeOptions.DEFAULT.withVerifyOnline(true));
        assertThat(this.oracle.calls).hasSize(1);
        assertThat(play.words()).extracting(Candidate::plain).containsExactly("toe");
    }

    @Test
    void failed_verification_keeps_the_play() {
        this.oracle.failure = new IOException("network down");
        final var play = optimize(
                new RackplayConfig(), FrequencyCorpus.EMPTY, "(qu)ote", OptimizeOptions.DEFAULT.withVerifyOnline(true));
        assertThat(play.words()).extracting(Candidate::plain).containsExactly("quote");
        assertThat(play.totalScore()).isEqualTo(16);
        assertThat(this.oracle.calls).containsExactly(List.of("quote"));
    }

    @Test
    void common_words_only() {
        final var corpus = FrequencyCorpus.of(List.of(new FrequencyEntry("toe", 4.1, 6000)));
        final var play = optimize(
                new RackplayConfig(), corpus, "(qu)ote", OptimizeOptions.DEFAULT.withCommonOnly(false, 0));
        assertThat(play.words()).extracting(Candidate::plain).containsExactly("toe");
    }

    @Test
    void common_filter_is_ignored_without_corpus() {
        final var play = optimize(
                new RackplayConfig(), FrequencyCorpus.EMPTY, "(qu)ote", OptimizeOptions.DEFAULT.withCommonOnly(false, 0));
        assertThat(play.words()).extracting(Candidate::plain).containsExactly("quote");
    }

    @Test
    void unknown_letters_yield_empty_play() {
        final var play = optimize(new RackplayConfig(), FrequencyCorpus.EMPTY, "zzx", OptimizeOptions.DEFAULT);
        assertThat(play.isEmpty()).isTrue();
        assertThat(play.discardTile()).isEqualTo("z");
        assertThat(play.leftoverPenalty()).isEqualTo(26);
    }

    private BestPlay optimize(
            final RackplayConfig config, final FrequencyCorpus corpus, final String rack, final OptimizeOptions options) {
        final var optimizer = new RackOptimizerImpl(
                config,
                TABLE,
                new TrieCache(DICTIONARY),
                new CandidateGenerator(TABLE),
                new BestPlaySelector(TABLE),
                corpus,
                Lemmatizer.IDENTITY,
                this.oracle,
                Runnable::run);
        return optimizer.optimize(rack, options).orTimeout(TIMEOUT.toSeconds(), TimeUnit.SECONDS).join();
    }

    private static final class RecordingOracle implements WordOracle {

        private final List<List<String>> calls = new CopyOnWriteArrayList<>();
        private final Set<String> rejected = new HashSet<>();
        private @Nullable Throwable failure = null;

        @Override
        public CompletableFuture<OracleVerdict> checkBatch(final List<String> words) {
            this.calls.add(List.copyOf(words));
            if (this.failure != null) {
                return CompletableFuture.failedFuture(this.failure);
            }
            final Set<String> valid = new HashSet<>(words);
            valid.removeAll(this.rejected);
            final Set<String> invalid = new HashSet<>(words);
            invalid.retainAll(this.rejected);
            return CompletableFuture.completedFuture(new OracleVerdict(valid, invalid));
        }
    }
}
