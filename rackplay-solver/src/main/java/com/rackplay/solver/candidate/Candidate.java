package com.rackplay.solver.candidate;

import com.rackplay.solver.rack.TileUsage;

/**
 * A word that can be laid from the rack, together with the tiles it takes.
 *
 * @param plain the lowercase letters of the word
 * @param display the word with digraph tiles in parentheses, e.g. {@code (qu)ote}
 * @param score the summed points of the tiles
 * @param length the number of letters, a digraph counting as two
 * @param usage the tiles consumed
 */
public record Candidate(String plain, String display, int score, int length, TileUsage usage) {

    /** Points per letter, the ordering key of the best-play search. */
    public double density() {
        return (double) this.score / Math.max(1, this.length);
    }
}
