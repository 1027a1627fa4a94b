package com.rackplay.solver.dictionary;

import com.google.common.base.Preconditions;
import com.rackplay.common.collection.CharTrie;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds the word trie of a dictionary once per depth and hands out the shared, read-only result. */
@Singleton
public final class TrieCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(TrieCache.class);

    private final Dictionary dictionary;
    private final Map<Integer, CharTrie> tries = new ConcurrentHashMap<>();

    @Inject
    public TrieCache(final Dictionary dictionary) {
        this.dictionary = dictionary;
    }

    public CharTrie get(final int maxDepth) {
        Preconditions.checkArgument(maxDepth > 0, "maxDepth must be positive, got %s", maxDepth);
        return this.tries.computeIfAbsent(maxDepth, this::build);
    }

    void invalidate() {
        this.tries.clear();
    }

    private CharTrie build(final int maxDepth) {
        final long start = System.nanoTime();
        final var trie = CharTrie.build(this.dictionary.words(), maxDepth);
        LOGGER.info(
                "Built word trie of {} words with depth {} in {}ms",
                this.dictionary.size(),
                maxDepth,
                (System.nanoTime() - start) / 1_000_000L);
        return trie;
    }
}
