package com.onkiup.linker.merge;

import java.util.Objects;
import java.util.Optional;

import com.onkiup.linker.merge.registry.UtilityGroup;

/**
 * Result of classifying a token: its group (if any) and the value that follows the matched prefix
 */
public class Classification {

  public static final Classification UNKNOWN = new Classification(null, "");

  private final UtilityGroup group;
  private final String value;

  public Classification(UtilityGroup group, String value) {
    this.group = group;
    this.value = value == null ? "" : value;
  }

  public static Classification of(UtilityGroup group, String value) {
    return new Classification(Objects.requireNonNull(group, "group"), value);
  }

  public Optional<UtilityGroup> group() {
    return Optional.ofNullable(group);
  }

  public boolean isUnknown() {
    return group == null;
  }

  /**
   * @return dash-joined value that follows the matched prefix, like "4" for "px-4"; empty for exact names
   */
  public String value() {
    return value;
  }

  public boolean is(UtilityGroup test) {
    return group != null && group == test;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Classification)) {
      return false;
    }
    Classification that = (Classification) o;
    return group == that.group && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(group, value);
  }

  @Override
  public String toString() {
    return group == null ? "unknown" : group.id() + (value.isEmpty() ? "" : "(" + value + ")");
  }
}
