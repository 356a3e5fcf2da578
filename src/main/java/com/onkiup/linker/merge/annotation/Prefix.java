package com.onkiup.linker.merge.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares dash-separated prefixes that route class names to the annotated group.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Prefix {
  /**
   * Accepts one or more prefixes, like "p" or "flex-grow".
   * Every prefix is split on dashes and inserted into the registry trie
   */
  String[] value();

  /**
   * Restricts the remaining value to the listed literals.
   * When empty, any remainder (including an empty one) is accepted
   */
  String[] only() default {};
}
