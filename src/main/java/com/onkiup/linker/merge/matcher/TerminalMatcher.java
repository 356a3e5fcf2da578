package com.onkiup.linker.merge.matcher;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * Matches values from a fixed vocabulary
 */
public class TerminalMatcher implements ValueMatcher {

  private final Set<String> terminals;

  public TerminalMatcher(String... terminals) {
    this(Arrays.asList(terminals));
  }

  public TerminalMatcher(Collection<String> terminals) {
    this.terminals = ImmutableSet.copyOf(terminals);
  }

  @Override
  public boolean matches(CharSequence value) {
    return value != null && terminals.contains(value.toString());
  }

  /**
   * @return a matcher that accepts this vocabulary plus given extra terminals
   */
  public TerminalMatcher extend(Collection<String> extra) {
    if (extra.isEmpty()) {
      return this;
    }
    return new TerminalMatcher(ImmutableSet.<String>builder().addAll(terminals).addAll(extra).build());
  }

  public Set<String> terminals() {
    return terminals;
  }

  @Override
  public String toString() {
    return "TerminalMatcher" + terminals;
  }
}
