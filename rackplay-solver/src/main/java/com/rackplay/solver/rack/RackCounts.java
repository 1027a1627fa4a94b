package com.rackplay.solver.rack;

import com.rackplay.common.tile.TileTable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * An immutable rack, as tile counts split into single letters and digraphs. Both maps iterate in
 * tile table order, followed by tokens the table does not know in the order they were first seen.
 */
public record RackCounts(Map<String, Integer> singles, Map<String, Integer> digraphs) {

    public static final RackCounts EMPTY = new RackCounts(Map.of(), Map.of());

    public RackCounts {
        singles = Collections.unmodifiableMap(new LinkedHashMap<>(singles));
        digraphs = Collections.unmodifiableMap(new LinkedHashMap<>(digraphs));
    }

    /**
     * Counts normalized rack tokens. A token the table registers as a digraph counts as one digraph
     * tile, anything else is taken as a run of single letters.
     */
    public static RackCounts count(final List<String> tokens, final TileTable table) {
        final Map<String, Integer> singles = new LinkedHashMap<>();
        final Map<String, Integer> digraphs = new LinkedHashMap<>();
        for (final var raw : tokens) {
            final var token = raw.toLowerCase(Locale.ROOT);
            if (table.isDigraph(token)) {
                digraphs.merge(token, 1, Integer::sum);
                continue;
            }
            for (int i = 0; i < token.length(); i++) {
                final var c = token.charAt(i);
                if (Character.isLetter(c)) {
                    singles.merge(String.valueOf(c), 1, Integer::sum);
                }
            }
        }
        return new RackCounts(inTableOrder(singles, table), inTableOrder(digraphs, table));
    }

    private static Map<String, Integer> inTableOrder(final Map<String, Integer> counts, final TileTable table) {
        final Map<String, Integer> ordered = new LinkedHashMap<>();
        for (final var token : table.tokens()) {
            final var count = counts.get(token);
            if (count != null) {
                ordered.put(token, count);
            }
        }
        for (final var entry : counts.entrySet()) {
            ordered.putIfAbsent(entry.getKey(), entry.getValue());
        }
        return ordered;
    }

    public int tileCount() {
        int total = 0;
        for (final var count : this.singles.values()) {
            total += count;
        }
        for (final var count : this.digraphs.values()) {
            total += count;
        }
        return total;
    }

    public boolean isEmpty() {
        return tileCount() == 0;
    }

    /** Every tile as a flat list, singles first. */
    public List<String> tiles() {
        final List<String> tiles = new ArrayList<>();
        this.singles.forEach((token, count) -> tiles.addAll(Collections.nCopies(count, token)));
        this.digraphs.forEach((token, count) -> tiles.addAll(Collections.nCopies(count, token)));
        return tiles;
    }

    public int value(final TileTable table) {
        int total = 0;
        for (final var tile : tiles()) {
            total += table.points(tile);
        }
        return total;
    }
}
