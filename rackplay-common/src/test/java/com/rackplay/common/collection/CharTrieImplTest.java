package com.rackplay.common.collection;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class CharTrieImplTest {

    @Test
    void test_insert_contains() {
        final var trie = new CharTrieImpl(10);
        trie.insert("test");
        trie.insert("test1");
        Assertions.assertTrue(trie.contains("test", false));
        Assertions.assertTrue(trie.contains("test", true));
        Assertions.assertFalse(trie.contains("te", false));
        Assertions.assertTrue(trie.contains("te", true));
        Assertions.assertFalse(trie.contains("tex", false));
        Assertions.assertFalse(trie.contains("tex", true));
        Assertions.assertTrue(trie.contains("test1", false));
    }

    @Test
    void test_insert_lowercases() {
        final var trie = new CharTrieImpl(10);
        trie.insert("QUOTE");
        Assertions.assertTrue(trie.contains("quote", false));
        Assertions.assertTrue(trie.contains("QuOtE", false));
    }

    @Test
    void test_truncated_word_is_never_terminal() {
        final var trie = new CharTrieImpl(3);
        Assertions.assertFalse(trie.insert("cats"));
        Assertions.assertTrue(trie.insert("dog"));
        Assertions.assertFalse(trie.contains("cat", false));
        Assertions.assertTrue(trie.contains("cat", true));
        Assertions.assertFalse(trie.contains("cats", true));
        Assertions.assertTrue(trie.contains("dog", false));
    }

    @Test
    void test_truncated_prefix_of_real_word() {
        final var trie = CharTrie.build(List.of("CATS", "CAT"), 3);
        Assertions.assertTrue(trie.contains("cat", false));
    }

    @Test
    void test_child_walk() {
        final var trie = CharTrie.build(List.of("at"), 5);
        final var a = trie.child('a');
        Assertions.assertNotNull(a);
        Assertions.assertFalse(a.terminal());
        final var t = a.child('t');
        Assertions.assertNotNull(t);
        Assertions.assertTrue(t.terminal());
        Assertions.assertNull(t.child('e'));
        Assertions.assertNull(trie.child('b'));
    }

    @Test
    void test_empty() {
        final var trie = CharTrie.build(List.of(), 10);
        Assertions.assertTrue(trie.isEmpty());
        Assertions.assertFalse(trie.terminal());
        Assertions.assertNull(trie.child('a'));
        Assertions.assertEquals(10, trie.maxDepth());
    }

    @Test
    void test_negative_depth() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new CharTrieImpl(-1));
    }
}
