package com.rackplay.common.collection;

import com.google.common.base.Preconditions;
import gnu.trove.map.TCharObjectMap;
import gnu.trove.map.hash.TCharObjectHashMap;
import org.jspecify.annotations.Nullable;

final class CharTrieImpl implements CharTrie.Mutable {

    private final int maxDepth;
    private @Nullable TCharObjectMap<CharTrieImpl> children = null;
    private boolean terminal = false;

    CharTrieImpl(final int maxDepth) {
        Preconditions.checkArgument(maxDepth >= 0, "maxDepth must not be negative, got %s", maxDepth);
        this.maxDepth = maxDepth;
    }

    @Override
    public boolean insert(final CharSequence word) {
        Preconditions.checkNotNull(word, "word");

        CharTrieImpl node = this;
        int depth = 0;
        for (int i = 0; i < word.length() && depth < this.maxDepth; i++, depth++) {
            final var c = Character.toLowerCase(word.charAt(i));
            if (node.children == null) {
                node.children = new TCharObjectHashMap<>();
            }
            var next = node.children.get(c);
            if (next == null) {
                next = new CharTrieImpl(this.maxDepth);
                node.children.put(c, next);
            }
            node = next;
        }

        // A truncated word can never be played in full
        if (word.length() > this.maxDepth) {
            return false;
        }
        node.terminal = true;
        return true;
    }

    @Override
    public int maxDepth() {
        return this.maxDepth;
    }

    @Override
    public @Nullable CharTrie child(final char c) {
        return this.children == null ? null : this.children.get(c);
    }

    @Override
    public boolean terminal() {
        return this.terminal;
    }

    @Override
    public boolean isEmpty() {
        return !this.terminal && (this.children == null || this.children.isEmpty());
    }

    @Override
    public boolean contains(final CharSequence chars, final boolean partial) {
        Preconditions.checkNotNull(chars, "chars");

        CharTrie node = this;
        for (int i = 0; i < chars.length(); i++) {
            node = node.child(Character.toLowerCase(chars.charAt(i)));
            if (node == null) {
                return false;
            }
        }

        return node.terminal() || partial;
    }
}
