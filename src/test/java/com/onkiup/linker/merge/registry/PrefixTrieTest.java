package com.onkiup.linker.merge.registry;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

public class PrefixTrieTest {

  @Test
  public void testDeepestMatchWins() {
    PrefixTrie trie = new PrefixTrie();
    trie.insert("inset", UtilityGroup.INSET, Collections.emptyList());
    trie.insert("inset-x", UtilityGroup.INSET_X, Collections.emptyList());

    PrefixTrie.Match match = trie.lookup("inset-x-4").get();
    assertEquals(UtilityGroup.INSET_X, match.group());
    assertEquals("4", match.value());
    assertEquals(2, match.depth());

    match = trie.lookup("inset-4").get();
    assertEquals(UtilityGroup.INSET, match.group());
    assertEquals("4", match.value());
    assertEquals(2, trie.size());
  }

  @Test
  public void testWhitelistPreferred() {
    PrefixTrie trie = new PrefixTrie();
    trie.insert("font", UtilityGroup.FONT_FAMILY, Arrays.asList("sans", "mono"));
    trie.insert("font", UtilityGroup.FONT_WEIGHT, Arrays.asList("bold"));
    trie.insert("font", UtilityGroup.FONT_STRETCH, Collections.emptyList());

    assertEquals(UtilityGroup.FONT_FAMILY, trie.lookup("font-mono").get().group());
    assertEquals(UtilityGroup.FONT_WEIGHT, trie.lookup("font-bold").get().group());
    assertEquals(UtilityGroup.FONT_STRETCH, trie.lookup("font-anything").get().group());
  }

  @Test
  public void testWhitelistOnly() {
    PrefixTrie trie = new PrefixTrie();
    trie.insert("snap", UtilityGroup.SNAP_TYPE, Arrays.asList("x", "none"));

    assertEquals(UtilityGroup.SNAP_TYPE, trie.lookup("snap-x").get().group());
    assertFalse(trie.lookup("snap-start").isPresent());
    assertFalse(trie.lookup("unrelated").isPresent());
  }

  @Test
  public void testShallowerMatchKeptWhenDeeperFails() {
    PrefixTrie trie = new PrefixTrie();
    trie.insert("overflow", UtilityGroup.OVERFLOW, Collections.emptyList());
    trie.insert("overflow-x", UtilityGroup.OVERFLOW_X, Arrays.asList("auto"));

    assertEquals(UtilityGroup.OVERFLOW_X, trie.lookup("overflow-x-auto").get().group());
    PrefixTrie.Match match = trie.lookup("overflow-x-weird").get();
    assertEquals(UtilityGroup.OVERFLOW, match.group());
    assertEquals("x-weird", match.value());
  }

  @Test
  public void testEmptyRemainder() {
    PrefixTrie trie = new PrefixTrie();
    trie.insert("grow", UtilityGroup.GROW, Collections.emptyList());
    PrefixTrie.Match match = trie.lookup("grow").get();
    assertEquals("", match.value());
    assertEquals(1, match.depth());
  }
}
