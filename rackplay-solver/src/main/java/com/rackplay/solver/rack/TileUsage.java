package com.rackplay.solver.rack;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The exact tiles a word consumes. Two usages are equal when they consume the same multiset of
 * single letters and digraphs, whatever order the tiles were laid in.
 */
public record TileUsage(SortedMap<String, Integer> singles, SortedMap<String, Integer> digraphs) {

    public TileUsage {
        singles = Collections.unmodifiableSortedMap(new TreeMap<>(singles));
        digraphs = Collections.unmodifiableSortedMap(new TreeMap<>(digraphs));
    }

    /** Splits tokens into single letters and digraphs by their length. */
    public static TileUsage of(final List<String> tokens) {
        final SortedMap<String, Integer> singles = new TreeMap<>();
        final SortedMap<String, Integer> digraphs = new TreeMap<>();
        for (final var token : tokens) {
            (token.length() > 1 ? digraphs : singles).merge(token, 1, Integer::sum);
        }
        return new TileUsage(singles, digraphs);
    }

    int tileCount() {
        return sum(this.singles) + sum(this.digraphs);
    }

    /** True if the usage is exactly one digraph tile and nothing else. */
    public boolean isLoneDigraph() {
        return this.singles.isEmpty() && sum(this.digraphs) == 1;
    }

    /** The consumed tiles, singles first. */
    public List<String> tiles() {
        final List<String> tiles = new ArrayList<>();
        for (final var entry : this.singles.entrySet()) {
            tiles.addAll(Collections.nCopies(entry.getValue(), entry.getKey()));
        }
        for (final var entry : this.digraphs.entrySet()) {
            tiles.addAll(Collections.nCopies(entry.getValue(), entry.getKey()));
        }
        return tiles;
    }

    /** The compact signature, e.g. {@code e1o1t1|qu1}. */
    public String signature() {
        final var builder = new StringBuilder();
        this.singles.forEach((token, count) -> builder.append(token).append(count));
        builder.append('|');
        this.digraphs.forEach((token, count) -> builder.append(token).append(count));
        return builder.toString();
    }

    private static int sum(final Map<String, Integer> counts) {
        int total = 0;
        for (final var count : counts.values()) {
            total += count;
        }
        return total;
    }
}
