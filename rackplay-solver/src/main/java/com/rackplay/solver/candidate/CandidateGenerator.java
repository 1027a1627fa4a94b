package com.rackplay.solver.candidate;

import com.rackplay.common.collection.CharTrie;
import com.rackplay.common.frequency.CommonWordGate;
import com.rackplay.common.tile.TileParser;
import com.rackplay.common.tile.TileTable;
import com.rackplay.solver.rack.RackCounts;
import com.rackplay.solver.rack.RackLedger;
import com.rackplay.solver.rack.TileUsage;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds every dictionary word that can be spelled from a rack. The trie is walked depth first while
 * tiles are taken from a private ledger, so a word is reached once per distinct way of laying it.
 */
public final class CandidateGenerator {

    private final TileTable table;

    @Inject
    public CandidateGenerator(final TileTable table) {
        this.table = table;
    }

    public List<Candidate> generate(final CharTrie trie, final RackCounts rack, final int minLength) {
        return this.generate(trie, rack, minLength, CommonWordGate.ANY);
    }

    /**
     * Lists the playable words of at least {@code minLength} letters admitted by the gate. The same
     * word appears once per distinct {@link TileUsage}; the order of the result is unspecified.
     */
    public List<Candidate> generate(
            final CharTrie trie, final RackCounts rack, final int minLength, final CommonWordGate gate) {
        final var generation = new Generation(new RackLedger(rack, this.table), minLength, gate);
        generation.visit(trie);
        final List<Candidate> candidates = new ArrayList<>();
        for (final var bucket : generation.words.values()) {
            candidates.addAll(bucket.values());
        }
        return candidates;
    }

    private final class Generation {

        private final RackLedger ledger;
        private final int minLength;
        private final CommonWordGate gate;
        private final List<String> tiles = new ArrayList<>();
        private int letters = 0;
        private final Map<String, Map<TileUsage, Candidate>> words = new LinkedHashMap<>();

        private Generation(final RackLedger ledger, final int minLength, final CommonWordGate gate) {
            this.ledger = ledger;
            this.minLength = minLength;
            this.gate = gate;
        }

        private void visit(final CharTrie node) {
            if (node.terminal() && this.letters >= this.minLength) {
                this.record();
            }

            for (int slot = 0; slot < this.ledger.slots(); slot++) {
                if (this.ledger.count(slot) == 0) {
                    continue;
                }
                final var token = this.ledger.token(slot);
                CharTrie next = node;
                for (int i = 0; i < token.length() && next != null; i++) {
                    next = next.child(token.charAt(i));
                }
                if (next == null) {
                    continue;
                }
                this.ledger.take(slot);
                this.letters += token.length();
                this.tiles.add(token);
                this.visit(next);
                this.tiles.remove(this.tiles.size() - 1);
                this.letters -= token.length();
                this.ledger.restore(slot);
            }
        }

        private void record() {
            final var usage = TileUsage.of(this.tiles);
            // A lone digraph tile is not a word
            if (usage.isLoneDigraph()) {
                return;
            }
            final var plain = TileParser.plain(this.tiles);
            if (!this.gate.admits(plain)) {
                return;
            }
            final var bucket = this.words.computeIfAbsent(plain, ignored -> new LinkedHashMap<>());
            if (bucket.containsKey(usage)) {
                return;
            }
            int score = 0;
            for (final var tile : this.tiles) {
                score += CandidateGenerator.this.table.points(tile);
            }
            bucket.put(usage, new Candidate(plain, TileParser.display(this.tiles), score, plain.length(), usage));
        }
    }
}
