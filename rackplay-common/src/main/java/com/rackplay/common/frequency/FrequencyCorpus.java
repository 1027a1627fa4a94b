package com.rackplay.common.frequency;

import com.google.common.base.Preconditions;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Word frequencies keyed by lemma. */
public final class FrequencyCorpus {

    public static final FrequencyCorpus EMPTY = new FrequencyCorpus(Map.of());

    private static final Logger LOGGER = LoggerFactory.getLogger(FrequencyCorpus.class);

    private final Map<String, FrequencyEntry> entries;

    private FrequencyCorpus(final Map<String, FrequencyEntry> entries) {
        this.entries = entries;
    }

    public static FrequencyCorpus of(final Collection<FrequencyEntry> entries) {
        final Map<String, FrequencyEntry> map = new HashMap<>();
        for (final var entry : entries) {
            map.put(entry.lemma().toLowerCase(Locale.ROOT), entry);
        }
        return new FrequencyCorpus(Map.copyOf(map));
    }

    /** Reads a JSON array of {@code [lemma, zipf, rank]} triples. */
    public static FrequencyCorpus load(final Path file) {
        final long start = System.nanoTime();
        try (final var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            final var corpus = read(reader);
            LOGGER.info(
                    "Loaded {} frequency entries from {} in {}ms",
                    corpus.size(),
                    file,
                    (System.nanoTime() - start) / 1_000_000L);
            return corpus;
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to load the frequency list " + file, e);
        }
    }

    static FrequencyCorpus read(final Reader reader) {
        final JsonArray rows;
        try {
            rows = new Gson().fromJson(reader, JsonArray.class);
        } catch (final JsonParseException e) {
            throw new IllegalStateException("Malformed frequency list", e);
        }
        if (rows == null) {
            return EMPTY;
        }
        final Map<String, FrequencyEntry> map = new HashMap<>();
        for (final var element : rows) {
            final var row = element.getAsJsonArray();
            Preconditions.checkState(row.size() >= 3, "Frequency row %s needs 3 columns", row);
            final var lemma = row.get(0).getAsString().toLowerCase(Locale.ROOT);
            map.putIfAbsent(
                    lemma,
                    new FrequencyEntry(lemma, row.get(1).getAsDouble(), row.get(2).getAsInt()));
        }
        return new FrequencyCorpus(Map.copyOf(map));
    }

    public Optional<FrequencyEntry> lookup(final String lemma) {
        return Optional.ofNullable(this.entries.get(lemma));
    }

    public int size() {
        return this.entries.size();
    }

    public boolean isEmpty() {
        return this.entries.isEmpty();
    }
}
