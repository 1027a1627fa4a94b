package com.rackplay.common.frequency;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Reduces inflected words to their base form. Each part of speech may return {@code null} when it
 * has no opinion about the word.
 */
public interface Lemmatizer {

    Lemmatizer IDENTITY = new Lemmatizer() {};

    default @Nullable String noun(final String word) {
        return null;
    }

    default @Nullable String verb(final String word) {
        return null;
    }

    default @Nullable String adjective(final String word) {
        return null;
    }

    default @Nullable String adverb(final String word) {
        return null;
    }

    /** The shortest base form proposed by any part of speech, or the word itself. */
    default String lemma(final String word) {
        var best = word.toLowerCase(Locale.ROOT);
        final String[] forms = {noun(best), verb(best), adjective(best), adverb(best)};
        for (final var form : forms) {
            if (form != null && !form.isEmpty() && form.length() < best.length()) {
                best = form;
            }
        }
        return best;
    }
}
