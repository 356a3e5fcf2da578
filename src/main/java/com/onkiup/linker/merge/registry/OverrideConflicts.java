package com.onkiup.linker.merge.registry;

import static com.onkiup.linker.merge.registry.UtilityGroup.*;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Groups that fully invalidate other, hierarchy-unrelated groups when they override them.
 * For example {@code size-8} sets both width and height, so it removes {@code w-*} and {@code h-*}.
 */
public class OverrideConflicts {

  private final Map<UtilityGroup, Set<UtilityGroup>> invalidates;

  private OverrideConflicts(Map<UtilityGroup, Set<UtilityGroup>> invalidates) {
    this.invalidates = Collections.unmodifiableMap(invalidates);
  }

  public static OverrideConflicts declared() {
    return builder()
        .dominates(SIZE, W, H)
        .dominates(FLEX, BASIS, GROW, SHRINK)
        .dominates(LINE_CLAMP, DISPLAY, OVERFLOW, OVERFLOW_X, OVERFLOW_Y)
        .dominates(FVN_NORMAL, FVN_ORDINAL, FVN_SLASHED_ZERO, FVN_FIGURE, FVN_SPACING, FVN_FRACTION)
        .dominates(FVN_ORDINAL, FVN_NORMAL)
        .dominates(FVN_SLASHED_ZERO, FVN_NORMAL)
        .dominates(FVN_FIGURE, FVN_NORMAL)
        .dominates(FVN_SPACING, FVN_NORMAL)
        .dominates(FVN_FRACTION, FVN_NORMAL)
        .dominates(TRANSLATE_NONE, TRANSLATE, TRANSLATE_X, TRANSLATE_Y, TRANSLATE_Z)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @param dominant group of an overriding class
   * @return groups that should be removed from the same scope, possibly empty
   */
  public Set<UtilityGroup> invalidatedBy(UtilityGroup dominant) {
    return invalidates.getOrDefault(dominant, Collections.emptySet());
  }

  public static class Builder {
    private final Map<UtilityGroup, Set<UtilityGroup>> invalidates = new EnumMap<>(UtilityGroup.class);

    public Builder dominates(UtilityGroup dominant, UtilityGroup first, UtilityGroup... rest) {
      invalidates.computeIfAbsent(dominant, key -> EnumSet.noneOf(UtilityGroup.class))
          .addAll(EnumSet.of(first, rest));
      return this;
    }

    public OverrideConflicts build() {
      Map<UtilityGroup, Set<UtilityGroup>> result = new EnumMap<>(UtilityGroup.class);
      invalidates.forEach((key, value) -> result.put(key, Collections.unmodifiableSet(EnumSet.copyOf(value))));
      return new OverrideConflicts(result);
    }
  }
}
