package com.onkiup.linker.merge.registry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;

/**
 * Trie keyed by dash-separated prefix segments.
 * Nodes that terminate one or more prefix declarations hold the candidate groups in declaration order.
 */
public class PrefixTrie {

  private static final Splitter DASH = Splitter.on('-');
  private static final Joiner DASH_JOINER = Joiner.on('-');

  private final Node root = new Node();
  private int size;

  /**
   * Registers a group under given prefix
   * @param prefix dash-separated prefix, like "inset-x"
   * @param group group that owns the prefix
   * @param whitelist allowed remainders, or an empty collection to accept any remainder
   */
  public void insert(String prefix, UtilityGroup group, Collection<String> whitelist) {
    Node node = root;
    for (String segment : DASH.split(prefix)) {
      node = node.children.computeIfAbsent(segment, key -> new Node());
    }
    node.candidates.add(new Candidate(group, whitelist.isEmpty() ? null : ImmutableSet.copyOf(whitelist)));
    size++;
  }

  /**
   * @return number of registered prefix declarations
   */
  public int size() {
    return size;
  }

  /**
   * Walks the dash segments of given base identifier through the trie.
   * At every node with candidates a whitelisted candidate matching the remainder wins over an unconstrained one;
   * deeper matches override shallower ones.
   * @param base base identifier to look up
   * @return the deepest match or empty when nothing matched
   */
  public Optional<Match> lookup(String base) {
    List<String> segments = DASH.splitToList(base);
    Match best = null;
    Node node = root;
    int depth = 0;
    while (node != null) {
      if (!node.candidates.isEmpty()) {
        String remainder = DASH_JOINER.join(segments.subList(depth, segments.size()));
        Match match = node.pick(remainder, depth);
        if (match != null) {
          best = match;
        }
      }
      if (depth == segments.size()) {
        break;
      }
      node = node.children.get(segments.get(depth++));
    }
    return Optional.ofNullable(best);
  }

  /**
   * Result of a trie walk
   */
  public static class Match {
    private final UtilityGroup group;
    private final String value;
    private final int depth;

    Match(UtilityGroup group, String value, int depth) {
      this.group = group;
      this.value = value;
      this.depth = depth;
    }

    public UtilityGroup group() {
      return group;
    }

    /**
     * @return dash-joined segments left after the matched prefix
     */
    public String value() {
      return value;
    }

    /**
     * @return number of segments consumed by the matched prefix
     */
    public int depth() {
      return depth;
    }

    @Override
    public String toString() {
      return "Match[" + group + " @" + depth + ": '" + value + "']";
    }
  }

  private static class Candidate {
    private final UtilityGroup group;
    private final Set<String> whitelist;

    Candidate(UtilityGroup group, Set<String> whitelist) {
      this.group = group;
      this.whitelist = whitelist;
    }
  }

  private static class Node {
    private final Map<String, Node> children = new HashMap<>();
    private final List<Candidate> candidates = new ArrayList<>();

    private Match pick(String remainder, int depth) {
      Candidate unconstrained = null;
      for (Candidate candidate : candidates) {
        if (candidate.whitelist == null) {
          if (unconstrained == null) {
            unconstrained = candidate;
          }
        } else if (candidate.whitelist.contains(remainder)) {
          return new Match(candidate.group, remainder, depth);
        }
      }
      return unconstrained == null ? null : new Match(unconstrained.group, remainder, depth);
    }
  }
}
