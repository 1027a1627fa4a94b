package com.rackplay.common.collection;

import org.jspecify.annotations.Nullable;

/**
 * A prefix tree over lowercase words whose depth is capped at construction.
 *
 * <p>Each node is itself a {@link CharTrie}, so a search can walk the tree by repeatedly calling
 * {@link #child(char)}. Words longer than {@link #maxDepth()} are stored as truncated prefixes that
 * are never {@link #terminal() terminal}.
 */
public interface CharTrie {

    static CharTrie.Mutable create(final int maxDepth) {
        return new CharTrieImpl(maxDepth);
    }

    static CharTrie build(final Iterable<String> words, final int maxDepth) {
        final var trie = create(maxDepth);
        for (final var word : words) {
            trie.insert(word);
        }
        return trie;
    }

    int maxDepth();

    @Nullable CharTrie child(final char c);

    boolean terminal();

    boolean isEmpty();

    boolean contains(final CharSequence chars, final boolean partial);

    interface Mutable extends CharTrie {

        /**
         * Inserts the lowercase form of the word.
         *
         * @return {@code true} if the word was marked complete, {@code false} if it was truncated
         */
        boolean insert(final CharSequence word);
    }
}
