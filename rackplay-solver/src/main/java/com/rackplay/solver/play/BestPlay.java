package com.rackplay.solver.play;

import com.rackplay.common.tile.TileTable;
import com.rackplay.solver.candidate.Candidate;
import com.rackplay.solver.rack.RackCounts;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of a best-play search.
 *
 * @param words the chosen words
 * @param baseScore the summed score of the chosen words
 * @param leftoverPenalty the value of the unused tiles, the discarded one excluded
 * @param discardTile the tile discarded at the end of the round, if any
 * @param unusedTiles the penalized tiles
 * @param longestWordLength the letter count of the longest chosen word
 * @param wordCount the number of chosen words
 * @param bonus the bonuses awarded
 * @param totalScore {@code max(baseScore - leftoverPenalty, 0)} plus the bonuses
 */
public record BestPlay(
        List<Candidate> words,
        int baseScore,
        int leftoverPenalty,
        @Nullable String discardTile,
        List<String> unusedTiles,
        int longestWordLength,
        int wordCount,
        Bonus bonus,
        int totalScore) {

    public BestPlay {
        words = List.copyOf(words);
        unusedTiles = List.copyOf(unusedTiles);
    }

    /** A play without words, where every tile of the rack is left over. */
    public static BestPlay empty(final RackCounts rack, final TileTable table) {
        return new BestPlay(List.of(), 0, rack.value(table), null, rack.tiles(), 0, 0, Bonus.NONE, 0);
    }

    public boolean isEmpty() {
        return this.words.isEmpty();
    }

    public record Bonus(int longest, int most) {

        public static final Bonus NONE = new Bonus(0, 0);

        public int total() {
            return this.longest + this.most;
        }
    }
}
