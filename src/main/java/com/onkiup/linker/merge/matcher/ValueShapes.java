package com.onkiup.linker.merge.matcher;

/**
 * Value vocabularies and grammars used to tell apart classes that share a prefix
 */
public final class ValueShapes {
  private ValueShapes() {

  }

  public static final TerminalMatcher TSHIRT_SIZE = new TerminalMatcher(
      "xs", "sm", "base", "md", "lg", "xl", "2xl", "3xl", "4xl", "5xl", "6xl", "7xl", "8xl", "9xl");

  public static final TerminalMatcher SHADOW_KEYWORD = new TerminalMatcher("none", "inner");

  public static final ValueMatcher NUMBER = new PatternMatcher("-?\\d+\\.?\\d*");

  public static final ValueMatcher LENGTH = NUMBER.or(new PatternMatcher(
      "-?\\d*\\.?\\d+(px|rem|em|%|vw|vh|dvw|dvh|svw|svh|lvw|lvh|ch|ex|cap|lh|rlh|vmin|vmax|cqw|cqh|cqi|cqb|cqmin|cqmax)"));

  /**
   * Explicit type hint for arbitrary values, like {@code text-[length:var(--size)]}
   */
  public static final String LENGTH_TAG = "length:";

  /**
   * Explicit type hint for arbitrary values, like {@code text-[color:var(--brand)]}
   */
  public static final String COLOR_TAG = "color:";
}
