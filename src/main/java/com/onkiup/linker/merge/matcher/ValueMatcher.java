package com.onkiup.linker.merge.matcher;

/**
 * Tests whether a class value has a particular shape (a size keyword, a number, a color...)
 */
@FunctionalInterface
public interface ValueMatcher {

  boolean matches(CharSequence value);

  default ValueMatcher or(ValueMatcher other) {
    return value -> matches(value) || other.matches(value);
  }
}
