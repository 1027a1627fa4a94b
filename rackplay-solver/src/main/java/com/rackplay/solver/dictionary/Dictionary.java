package com.rackplay.solver.dictionary;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The static list of playable words, stored uppercase. */
public final class Dictionary {

    public static final Dictionary EMPTY = new Dictionary(Set.of());

    private static final Logger LOGGER = LoggerFactory.getLogger(Dictionary.class);

    private final Set<String> words;

    private Dictionary(final Set<String> words) {
        this.words = words;
    }

    public static Dictionary of(final Collection<String> words) {
        Preconditions.checkNotNull(words, "words");
        final Set<String> normalized = new HashSet<>();
        for (final var word : words) {
            final var trimmed = word.trim();
            if (!trimmed.isEmpty()) {
                normalized.add(trimmed.toUpperCase(Locale.ROOT));
            }
        }
        return new Dictionary(Set.copyOf(normalized));
    }

    /** Reads one word per line, skipping blank lines and lines starting with {@code #}. */
    public static Dictionary load(final Path file) {
        final long start = System.nanoTime();
        final Set<String> words = new HashSet<>();
        try (final var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                words.add(line.toUpperCase(Locale.ROOT));
            }
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to load the word list " + file, e);
        }
        LOGGER.info("Loaded {} words from {} in {}ms", words.size(), file, (System.nanoTime() - start) / 1_000_000L);
        return new Dictionary(Set.copyOf(words));
    }

    public boolean contains(final String word) {
        return this.words.contains(word.toUpperCase(Locale.ROOT));
    }

    public Set<String> words() {
        return this.words;
    }

    public int size() {
        return this.words.size();
    }
}
