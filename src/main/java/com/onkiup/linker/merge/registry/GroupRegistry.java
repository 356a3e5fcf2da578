package com.onkiup.linker.merge.registry;

import java.lang.reflect.Field;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.onkiup.linker.merge.annotation.Exact;
import com.onkiup.linker.merge.annotation.Prefix;
import com.onkiup.linker.merge.util.RegistryError;

/**
 * Owns the lookup structures compiled from {@link UtilityGroup} declarations:
 * the prefix trie, the exact-name table, the shorthand hierarchy and the override conflicts.
 * Use {@link #get()} to obtain the shared instance, which is built once on first use and never modified afterwards.
 */
public class GroupRegistry {
  private static final Logger logger = LoggerFactory.getLogger(GroupRegistry.class);

  private final PrefixTrie trie;
  private final Map<String, UtilityGroup> exact;
  private final GroupHierarchy hierarchy;
  private final OverrideConflicts conflicts;

  private static class Holder {
    private static final GroupRegistry INSTANCE = new GroupRegistry(UtilityGroup.values(),
        GroupHierarchy.declared(), OverrideConflicts.declared());
  }

  /**
   * @return shared registry built from the built-in declarations
   */
  public static GroupRegistry get() {
    return Holder.INSTANCE;
  }

  @VisibleForTesting
  GroupRegistry(UtilityGroup[] groups, GroupHierarchy hierarchy, OverrideConflicts conflicts) {
    this.trie = new PrefixTrie();
    Map<String, UtilityGroup> exact = new HashMap<>();
    for (UtilityGroup group : groups) {
      Field field = declaration(group);
      Exact names = field.getAnnotation(Exact.class);
      Prefix prefix = field.getAnnotation(Prefix.class);
      if (names != null && prefix != null) {
        throw new RegistryError("Group cannot declare both exact names and prefixes", group);
      }
      if (names != null) {
        for (String name : names.value()) {
          UtilityGroup previous = exact.put(name, group);
          if (previous != null) {
            throw new RegistryError("Class name '" + name + "' is already declared by " + previous.id(), group);
          }
        }
      } else if (prefix != null) {
        for (String value : prefix.value()) {
          trie.insert(value, group, Arrays.asList(prefix.only()));
        }
      }
    }
    this.exact = Collections.unmodifiableMap(exact);
    this.hierarchy = hierarchy;
    this.conflicts = conflicts;
    logger.debug("Compiled {} exact names and {} prefixes", exact.size(), trie.size());
  }

  private static Field declaration(UtilityGroup group) {
    try {
      return UtilityGroup.class.getField(group.name());
    } catch (NoSuchFieldException e) {
      throw new RegistryError("Failed to read declaration", group, e);
    }
  }

  /**
   * @param base base identifier
   * @return group that lists given identifier as one of its exact names
   */
  public Optional<UtilityGroup> exact(String base) {
    return Optional.ofNullable(exact.get(base));
  }

  /**
   * @param base base identifier
   * @return deepest prefix match for given identifier
   * @see PrefixTrie#lookup(String)
   */
  public Optional<PrefixTrie.Match> lookup(String base) {
    return trie.lookup(base);
  }

  public GroupHierarchy hierarchy() {
    return hierarchy;
  }

  public OverrideConflicts conflicts() {
    return conflicts;
  }
}
