package com.onkiup.linker.merge.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a closed enumeration of class names that belong to the annotated group.
 * Exact names are looked up before any prefix matching takes place.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Exact {
  /**
   * Literal base identifiers (without variants, prefix or modifiers)
   */
  String[] value();
}
