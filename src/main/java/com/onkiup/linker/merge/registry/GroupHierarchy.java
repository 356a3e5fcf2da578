package com.onkiup.linker.merge.registry;

import static com.onkiup.linker.merge.registry.UtilityGroup.*;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.onkiup.linker.merge.util.RegistryError;

/**
 * Shorthand to longhand relations between groups.
 * Every shorthand lists its direct longhands in order, each with the text prefix used to rebuild a class for it.
 */
public class GroupHierarchy {

  private final Map<UtilityGroup, List<Longhand>> longhands;
  private final Map<UtilityGroup, Set<UtilityGroup>> ancestors;

  private GroupHierarchy(Map<UtilityGroup, List<Longhand>> longhands) {
    this.longhands = Collections.unmodifiableMap(longhands);
    this.ancestors = Collections.unmodifiableMap(closure(longhands));
  }

  /**
   * @return hierarchy declared for the built-in groups
   */
  public static GroupHierarchy declared() {
    return builder()
        .shorthand(P, longhand(PX, "px"), longhand(PY, "py"))
        .shorthand(PX, longhand(PR, "pr"), longhand(PL, "pl"))
        .shorthand(PY, longhand(PT, "pt"), longhand(PB, "pb"))

        .shorthand(M, longhand(MX, "mx"), longhand(MY, "my"))
        .shorthand(MX, longhand(MR, "mr"), longhand(ML, "ml"))
        .shorthand(MY, longhand(MT, "mt"), longhand(MB, "mb"))

        .shorthand(INSET, longhand(INSET_X, "inset-x"), longhand(INSET_Y, "inset-y"))
        .shorthand(INSET_X, longhand(RIGHT, "right"), longhand(LEFT, "left"))
        .shorthand(INSET_Y, longhand(TOP, "top"), longhand(BOTTOM, "bottom"))

        .shorthand(GAP, longhand(GAP_X, "gap-x"), longhand(GAP_Y, "gap-y"))

        .shorthand(BORDER_W, longhand(BORDER_W_X, "border-x"), longhand(BORDER_W_Y, "border-y"))
        .shorthand(BORDER_W_X, longhand(BORDER_W_R, "border-r"), longhand(BORDER_W_L, "border-l"))
        .shorthand(BORDER_W_Y, longhand(BORDER_W_T, "border-t"), longhand(BORDER_W_B, "border-b"))

        .shorthand(BORDER_COLOR, longhand(BORDER_COLOR_X, "border-x"), longhand(BORDER_COLOR_Y, "border-y"))
        .shorthand(BORDER_COLOR_X, longhand(BORDER_COLOR_R, "border-r"), longhand(BORDER_COLOR_L, "border-l"))
        .shorthand(BORDER_COLOR_Y, longhand(BORDER_COLOR_T, "border-t"), longhand(BORDER_COLOR_B, "border-b"))

        .shorthand(ROUNDED, longhand(ROUNDED_T, "rounded-t"), longhand(ROUNDED_R, "rounded-r"),
            longhand(ROUNDED_B, "rounded-b"), longhand(ROUNDED_L, "rounded-l"))
        .shorthand(ROUNDED_T, longhand(ROUNDED_TL, "rounded-tl"), longhand(ROUNDED_TR, "rounded-tr"))
        .shorthand(ROUNDED_R, longhand(ROUNDED_TR, "rounded-tr"), longhand(ROUNDED_BR, "rounded-br"))
        .shorthand(ROUNDED_B, longhand(ROUNDED_BL, "rounded-bl"), longhand(ROUNDED_BR, "rounded-br"))
        .shorthand(ROUNDED_L, longhand(ROUNDED_TL, "rounded-tl"), longhand(ROUNDED_BL, "rounded-bl"))

        .shorthand(OVERFLOW, longhand(OVERFLOW_X, "overflow-x"), longhand(OVERFLOW_Y, "overflow-y"))
        .shorthand(OVERSCROLL, longhand(OVERSCROLL_X, "overscroll-x"), longhand(OVERSCROLL_Y, "overscroll-y"))

        .shorthand(SCALE, longhand(SCALE_X, "scale-x"), longhand(SCALE_Y, "scale-y"))
        .shorthand(TRANSLATE, longhand(TRANSLATE_X, "translate-x"), longhand(TRANSLATE_Y, "translate-y"),
            longhand(TRANSLATE_Z, "translate-z"))

        .shorthand(SCROLL_M, longhand(SCROLL_MX, "scroll-mx"), longhand(SCROLL_MY, "scroll-my"))
        .shorthand(SCROLL_MX, longhand(SCROLL_MR, "scroll-mr"), longhand(SCROLL_ML, "scroll-ml"))
        .shorthand(SCROLL_MY, longhand(SCROLL_MT, "scroll-mt"), longhand(SCROLL_MB, "scroll-mb"))

        .shorthand(SCROLL_P, longhand(SCROLL_PX, "scroll-px"), longhand(SCROLL_PY, "scroll-py"))
        .shorthand(SCROLL_PX, longhand(SCROLL_PR, "scroll-pr"), longhand(SCROLL_PL, "scroll-pl"))
        .shorthand(SCROLL_PY, longhand(SCROLL_PT, "scroll-pt"), longhand(SCROLL_PB, "scroll-pb"))

        .shorthand(BORDER_SPACING, longhand(BORDER_SPACING_X, "border-spacing-x"),
            longhand(BORDER_SPACING_Y, "border-spacing-y"))
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static Longhand longhand(UtilityGroup group, String prefix) {
    return new Longhand(group, prefix);
  }

  /**
   * @param shorthand group to get direct longhands for
   * @return ordered direct longhands, empty for groups that are not shorthands
   */
  public List<Longhand> longhandsOf(UtilityGroup shorthand) {
    return longhands.getOrDefault(shorthand, Collections.emptyList());
  }

  /**
   * @param group group to get ancestors for
   * @return every shorthand that directly or transitively covers given group
   */
  public Set<UtilityGroup> ancestorsOf(UtilityGroup group) {
    return ancestors.getOrDefault(group, Collections.emptySet());
  }

  /**
   * @return true if {@code shorthand} is a strict ancestor of {@code longhand}
   */
  public boolean isAncestor(UtilityGroup shorthand, UtilityGroup longhand) {
    return ancestorsOf(longhand).contains(shorthand);
  }

  /**
   * @return true if the groups are equal or one of them is an ancestor of the other
   */
  public boolean related(UtilityGroup a, UtilityGroup b) {
    return a == b || isAncestor(a, b) || isAncestor(b, a);
  }

  private static Map<UtilityGroup, Set<UtilityGroup>> closure(Map<UtilityGroup, List<Longhand>> longhands) {
    Map<UtilityGroup, Set<UtilityGroup>> parents = new EnumMap<>(UtilityGroup.class);
    longhands.forEach((parent, children) -> children.forEach(child ->
        parents.computeIfAbsent(child.group(), key -> EnumSet.noneOf(UtilityGroup.class)).add(parent)));

    Map<UtilityGroup, Set<UtilityGroup>> result = new EnumMap<>(UtilityGroup.class);
    for (UtilityGroup group : parents.keySet()) {
      Set<UtilityGroup> found = EnumSet.noneOf(UtilityGroup.class);
      Deque<UtilityGroup> queue = new ArrayDeque<>(parents.get(group));
      while (!queue.isEmpty()) {
        UtilityGroup next = queue.pop();
        if (next == group) {
          throw new RegistryError("Shorthand hierarchy contains a cycle", group);
        }
        if (found.add(next)) {
          queue.addAll(parents.getOrDefault(next, Collections.emptySet()));
        }
      }
      result.put(group, Collections.unmodifiableSet(found));
    }
    return result;
  }

  /**
   * A longhand entry of a shorthand group
   */
  public static class Longhand {
    private final UtilityGroup group;
    private final String prefix;

    Longhand(UtilityGroup group, String prefix) {
      this.group = group;
      this.prefix = prefix;
    }

    public UtilityGroup group() {
      return group;
    }

    /**
     * @return class prefix used to rebuild a class for this longhand, like "px"
     */
    public String prefix() {
      return prefix;
    }

    @Override
    public String toString() {
      return group.id() + "(" + prefix + ")";
    }
  }

  public static class Builder {
    private final Map<UtilityGroup, List<Longhand>> longhands = new LinkedHashMap<>();

    public Builder shorthand(UtilityGroup shorthand, Longhand... children) {
      if (longhands.containsKey(shorthand)) {
        throw new RegistryError("Shorthand declared twice", shorthand);
      }
      longhands.put(shorthand, ImmutableList.copyOf(children));
      return this;
    }

    public GroupHierarchy build() {
      Map<UtilityGroup, List<Longhand>> declared = new EnumMap<>(UtilityGroup.class);
      declared.putAll(longhands);
      return new GroupHierarchy(declared);
    }
  }
}
