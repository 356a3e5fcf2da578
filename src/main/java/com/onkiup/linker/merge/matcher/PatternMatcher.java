package com.onkiup.linker.merge.matcher;

import java.util.regex.Pattern;

/**
 * Matches values that fully match a regular expression
 */
public class PatternMatcher implements ValueMatcher {
  private final Pattern pattern;

  public PatternMatcher(String pattern) {
    this(Pattern.compile(pattern));
  }

  public PatternMatcher(Pattern pattern) {
    this.pattern = pattern;
  }

  @Override
  public boolean matches(CharSequence value) {
    return value != null && pattern.matcher(value).matches();
  }

  @Override
  public String toString() {
    return "PatternMatcher[" + pattern + "]";
  }
}
