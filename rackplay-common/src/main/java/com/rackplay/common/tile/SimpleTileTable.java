package com.rackplay.common.tile;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

final class SimpleTileTable implements TileTable {

    private final Map<String, Integer> points;
    private final List<String> tokens;
    private final Set<String> digraphs;

    SimpleTileTable(final Map<String, Integer> points) {
        Preconditions.checkNotNull(points, "points");
        final Map<String, Integer> normalized = new LinkedHashMap<>();
        final Set<String> digraphs = new LinkedHashSet<>();
        for (final var entry : points.entrySet()) {
            final var token = entry.getKey().toLowerCase(Locale.ROOT);
            Preconditions.checkArgument(!token.isEmpty(), "Empty token in tile table");
            Preconditions.checkArgument(
                    token.length() <= 2, "Token %s is longer than a digraph", token);
            Preconditions.checkNotNull(entry.getValue(), "No points for token %s", token);
            normalized.put(token, entry.getValue());
            if (token.length() > 1) {
                digraphs.add(token);
            }
        }
        this.points = Collections.unmodifiableMap(normalized);
        this.tokens = List.copyOf(new ArrayList<>(normalized.keySet()));
        this.digraphs = Collections.unmodifiableSet(digraphs);
    }

    @Override
    public int points(final String token) {
        return this.points.getOrDefault(token, 0);
    }

    @Override
    public boolean contains(final String token) {
        return this.points.containsKey(token);
    }

    @Override
    public boolean isDigraph(final String token) {
        return this.digraphs.contains(token);
    }

    @Override
    public List<String> tokens() {
        return this.tokens;
    }

    @Override
    public Set<String> digraphs() {
        return this.digraphs;
    }

    @Override
    public String toString() {
        return "TileTable" + this.points;
    }
}
