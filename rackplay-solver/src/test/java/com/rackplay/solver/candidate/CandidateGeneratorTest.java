package com.rackplay.solver.candidate;

import static org.assertj.core.api.Assertions.assertThat;

import com.rackplay.common.collection.CharTrie;
import com.rackplay.common.frequency.CommonWordGate;
import com.rackplay.common.frequency.FrequencyCorpus;
import com.rackplay.common.frequency.FrequencyEntry;
import com.rackplay.common.frequency.Lemmatizer;
import com.rackplay.common.tile.TileParser;
import com.rackplay.common.tile.TileTable;
import com.rackplay.solver.rack.RackCounts;
import com.rackplay.solver.rack.TileUsage;
import java.util.List;
import org.junit.jupiter.api.Test;

final class CandidateGeneratorTest {

    private static final TileTable TABLE = TileTable.defaults();

    private final CandidateGenerator generator = new CandidateGenerator(TABLE);

    @Test
    void word_with_digraph() {
        final var candidates = generate(List.of("QUOTE"), "(qu)ote");
        assertThat(candidates).singleElement().satisfies(candidate -> {
            assertThat(candidate.plain()).isEqualTo("quote");
            assertThat(candidate.display()).isEqualTo("(qu)ote");
            assertThat(candidate.score()).isEqualTo(16);
            assertThat(candidate.length()).isEqualTo(5);
            assertThat(candidate.usage()).isEqualTo(TileUsage.of(List.of("qu", "o", "t", "e")));
        });
    }

    @Test
    void word_from_single_letters() {
        assertThat(generate(List.of("QUOTE"), "quote"))
                .singleElement()
                .satisfies(candidate -> assertThat(candidate.score()).isEqualTo(26));
    }

    @Test
    void lone_digraph_is_never_a_word() {
        assertThat(generate(List.of("QU", "IN", "TH"), "(qu)(in)(th)")).isEmpty();
        assertThat(generate(List.of("INN"), "(in)n"))
                .extracting(Candidate::display)
                .containsExactly("(in)n");
    }

    @Test
    void distinct_usages_are_kept() {
        final var candidates = generate(List.of("QUIT"), "(qu)quit");
        assertThat(candidates)
                .extracting(candidate -> candidate.usage().signature())
                .containsExactlyInAnyOrder("i1t1|qu1", "i1q1t1u1|");
        assertThat(candidates).extracting(Candidate::plain).containsOnly("quit");
    }

    @Test
    void same_usage_is_reported_once() {
        assertThat(generate(List.of("TOT", "AT"), "ttoaa"))
                .extracting(Candidate::plain)
                .containsExactlyInAnyOrder("tot", "at");
    }

    @Test
    void min_length() {
        final var trie = CharTrie.build(List.of("AT", "CAT", "A"), 10);
        final var rack = rack("cat");
        assertThat(this.generator.generate(trie, rack, 2))
                .extracting(Candidate::plain)
                .containsExactlyInAnyOrder("at", "cat");
        assertThat(this.generator.generate(trie, rack, 3))
                .extracting(Candidate::plain)
                .containsExactly("cat");
    }

    @Test
    void depth_cap_drops_long_words() {
        final var trie = CharTrie.build(List.of("CAT", "CATS"), 3);
        assertThat(this.generator.generate(trie, rack("cats"), 2))
                .extracting(Candidate::plain)
                .containsExactly("cat");
    }

    @Test
    void gate_filters_words() {
        final var trie = CharTrie.build(List.of("AT", "CAT", "ACT"), 10);
        final var corpus = FrequencyCorpus.of(List.of(new FrequencyEntry("cat", 4.2, 2000)));
        final var gate =
                new CommonWordGate.Frequency(corpus, Lemmatizer.IDENTITY, CommonWordGate.Mode.ZIPF, 3.8, 10_000, false);
        assertThat(this.generator.generate(trie, rack("cat"), 2, gate))
                .extracting(Candidate::plain)
                .containsExactly("cat");
    }

    @Test
    void empty_inputs() {
        assertThat(generate(List.of(), "cat")).isEmpty();
        assertThat(generate(List.of("CAT"), "")).isEmpty();
        assertThat(generate(List.of("CAT"), "dog")).isEmpty();
    }

    private List<Candidate> generate(final List<String> words, final String rack) {
        return this.generator.generate(CharTrie.build(words, 10), rack(rack), 2);
    }

    private static RackCounts rack(final String raw) {
        return RackCounts.count(TileParser.parseNormalized(raw), TABLE);
    }
}
