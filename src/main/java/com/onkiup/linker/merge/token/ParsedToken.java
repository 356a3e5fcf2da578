package com.onkiup.linker.merge.token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.google.common.collect.ImmutableMultiset;

/**
 * Structured form of a single class token, like {@code md:hover:-mt-4!}.
 * Instances are immutable.
 */
public class ParsedToken {

  private final String raw;
  private final String classPrefix;
  private final List<String> variants;
  private final ImmutableMultiset<String> variantKey;
  private final String base;
  private final boolean important;
  private final boolean negative;
  private final String modifier;
  private final String arbitraryValue;
  private final String arbitraryVariable;
  private final boolean remove;
  private final boolean removeAll;

  public ParsedToken(String raw, String classPrefix, List<String> variants, String base, boolean important,
      boolean negative, String modifier, String arbitraryValue, String arbitraryVariable, boolean remove,
      boolean removeAll) {
    if (arbitraryValue != null && arbitraryVariable != null) {
      throw new IllegalArgumentException("Token cannot carry both an arbitrary value and an arbitrary variable");
    }
    if (remove && removeAll) {
      throw new IllegalArgumentException("remove and removeAll are mutually exclusive");
    }
    this.raw = raw;
    this.classPrefix = classPrefix == null ? "" : classPrefix;
    this.variants = Collections.unmodifiableList(new ArrayList<>(variants));
    this.variantKey = variantKey(variants);
    this.base = base;
    this.important = important;
    this.negative = negative;
    this.modifier = modifier;
    this.arbitraryValue = arbitraryValue;
    this.arbitraryVariable = arbitraryVariable;
    this.remove = remove;
    this.removeAll = removeAll;
  }

  /**
   * Computes an order-independent identity of a variant list.
   * Repeated variants are kept, so {@code hover:hover:} is a different scope than {@code hover:}
   * @param variants variants in written order
   * @return multiset of the variants
   */
  public static ImmutableMultiset<String> variantKey(List<String> variants) {
    return ImmutableMultiset.copyOf(variants);
  }

  /**
   * Creates a copy of this token that targets another base identifier.
   * The copy keeps prefix, variants, flags, modifier and arbitrary payload but has no raw text,
   * so it is always rebuilt from its parts
   * @param newBase base identifier of the copy
   * @return synthesized token
   */
  public ParsedToken withBase(String newBase) {
    return new ParsedToken(null, classPrefix, variants, newBase, important, negative, modifier, arbitraryValue,
        arbitraryVariable, false, false);
  }

  /**
   * @return original text of the token (without any removal directive), empty for synthesized tokens
   */
  public Optional<String> raw() {
    return Optional.ofNullable(raw);
  }

  public String classPrefix() {
    return classPrefix;
  }

  public List<String> variants() {
    return variants;
  }

  public ImmutableMultiset<String> variantKey() {
    return variantKey;
  }

  public String base() {
    return base;
  }

  public boolean important() {
    return important;
  }

  public boolean negative() {
    return negative;
  }

  public Optional<String> modifier() {
    return Optional.ofNullable(modifier);
  }

  public Optional<String> arbitraryValue() {
    return Optional.ofNullable(arbitraryValue);
  }

  public Optional<String> arbitraryVariable() {
    return Optional.ofNullable(arbitraryVariable);
  }

  /**
   * @return true if this token carries either kind of arbitrary payload
   */
  public boolean arbitrary() {
    return arbitraryValue != null || arbitraryVariable != null;
  }

  public boolean remove() {
    return remove;
  }

  public boolean removeAll() {
    return removeAll;
  }

  /**
   * @return true if both tokens share the same variant scope
   */
  public boolean sameScope(ParsedToken other) {
    return variantKey.equals(other.variantKey);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ParsedToken)) {
      return false;
    }
    ParsedToken that = (ParsedToken) o;
    return important == that.important &&
        negative == that.negative &&
        remove == that.remove &&
        removeAll == that.removeAll &&
        Objects.equals(raw, that.raw) &&
        classPrefix.equals(that.classPrefix) &&
        variants.equals(that.variants) &&
        Objects.equals(base, that.base) &&
        Objects.equals(modifier, that.modifier) &&
        Objects.equals(arbitraryValue, that.arbitraryValue) &&
        Objects.equals(arbitraryVariable, that.arbitraryVariable);
  }

  @Override
  public int hashCode() {
    return Objects.hash(raw, classPrefix, variants, base, important, negative, modifier, arbitraryValue,
        arbitraryVariable, remove, removeAll);
  }

  @Override
  public String toString() {
    return "ParsedToken[" + (raw == null ? "<synthesized> " + base : raw) + "]";
  }
}
