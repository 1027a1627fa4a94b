package com.rackplay.common.tile;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The point value of every tile token, in a stable iteration order.
 *
 * <p>Tokens are lowercase. A token longer than one letter is a digraph: it is played and scored as a
 * single tile.
 */
public interface TileTable {

    String DEFAULT_RESOURCE = "/com/rackplay/common/tile/default-tiles.json";

    static TileTable of(final Map<String, Integer> points) {
        return new SimpleTileTable(points);
    }

    static TileTable defaults() {
        try (final var stream = TileTable.class.getResourceAsStream(DEFAULT_RESOURCE);
                final var reader =
                        new InputStreamReader(Objects.requireNonNull(stream), StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to load the default tile table", e);
        }
    }

    static TileTable load(final Path file) {
        try (final var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to load the tile table " + file, e);
        }
    }

    private static TileTable read(final Reader reader) {
        final Map<String, Integer> points;
        try {
            points = new Gson().fromJson(reader, new TypeToken<LinkedHashMap<String, Integer>>() {}.getType());
        } catch (final JsonParseException e) {
            throw new IllegalStateException("Malformed tile table", e);
        }
        if (points == null) {
            throw new IllegalStateException("Empty tile table");
        }
        return of(points);
    }

    /** The value of the token, or 0 for a token the table does not know. */
    int points(final String token);

    boolean contains(final String token);

    boolean isDigraph(final String token);

    /** Every token in table order. */
    List<String> tokens();

    Set<String> digraphs();
}
