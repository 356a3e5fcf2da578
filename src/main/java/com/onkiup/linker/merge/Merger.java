package com.onkiup.linker.merge;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.onkiup.linker.merge.registry.GroupHierarchy;
import com.onkiup.linker.merge.registry.GroupRegistry;
import com.onkiup.linker.merge.registry.OverrideConflicts;
import com.onkiup.linker.merge.registry.UtilityGroup;
import com.onkiup.linker.merge.token.ParsedToken;

/**
 * Folds override tokens into a base token list.
 *
 * Overrides are applied left to right, each one against the result accumulated so far:
 * <ul>
 *   <li>{@code remove:*} clears the result, except for tokens configured to never merge;</li>
 *   <li>{@code remove:x} drops every {@code x} with the same variants;</li>
 *   <li>unknown tokens are appended;</li>
 *   <li>otherwise same-scope tokens whose group equals, covers, is covered by or is invalidated by
 *   the override's group are dropped, and the override is appended.</li>
 * </ul>
 * With decomposition enabled a covering shorthand is split into the longhands that the override does not touch.
 */
public class Merger {
  private static final Logger logger = LoggerFactory.getLogger(Merger.class);

  /**
   * MDC key under which the override being processed is published
   */
  public static final String MDC_TOKEN = "token";

  private final Classifier classifier;
  private final GroupHierarchy hierarchy;
  private final OverrideConflicts conflicts;
  private final boolean decompose;

  public Merger(MergeConfig config) {
    this(new Classifier(config), GroupRegistry.get(), config.decompose());
  }

  public Merger(Classifier classifier, GroupRegistry registry, boolean decompose) {
    this.classifier = classifier;
    this.hierarchy = registry.hierarchy();
    this.conflicts = registry.conflicts();
    this.decompose = decompose;
  }

  /**
   * @param base tokens to start from
   * @param overrides tokens to fold into the base, left to right
   * @return resulting tokens in order
   */
  public List<ParsedToken> merge(List<ParsedToken> base, List<ParsedToken> overrides) {
    List<Entry> result = base.stream()
        .map(token -> new Entry(token, classifier.classify(token)))
        .collect(Collectors.toList());

    for (ParsedToken override : overrides) {
      MDC.put(MDC_TOKEN, override.raw().orElse(override.base()));
      try {
        result = apply(result, override);
      } finally {
        MDC.remove(MDC_TOKEN);
      }
    }

    return result.stream()
        .map(Entry::token)
        .collect(Collectors.toList());
  }

  private List<Entry> apply(List<Entry> current, ParsedToken override) {
    if (override.removeAll()) {
      List<Entry> pinned = current.stream()
          .filter(entry -> classifier.pinned(entry.token()))
          .collect(Collectors.toList());
      logger.debug("Clearing {} token(s), keeping {} pinned", current.size() - pinned.size(), pinned.size());
      return pinned;
    }

    if (override.remove()) {
      List<Entry> result = current.stream()
          .filter(entry -> !(entry.token().base().equals(override.base()) && entry.token().sameScope(override)))
          .collect(Collectors.toList());
      logger.debug("Removed {} token(s)", current.size() - result.size());
      return result;
    }

    Classification classification = classifier.classify(override);
    Entry incoming = new Entry(override, classification);
    if (classification.isUnknown()) {
      logger.debug("Unknown group, appending");
      List<Entry> result = new ArrayList<>(current);
      result.add(incoming);
      return result;
    }

    UtilityGroup group = incoming.group();
    List<Entry> remaining = pruneInvalidated(current, incoming);
    List<Entry> result = new ArrayList<>(remaining.size() + 1);
    for (int i = 0; i < remaining.size(); i++) {
      Entry entry = remaining.get(i);
      UtilityGroup existing = entry.group();
      if (existing == null || !entry.token().sameScope(override)) {
        result.add(entry);
      } else if (existing == group) {
        logger.debug("Replacing {}", entry);
      } else if (hierarchy.isAncestor(existing, group)) {
        if (decompose) {
          List<Entry> longhands = decompose(entry, existing, group);
          List<Entry> upcoming = remaining.subList(i + 1, remaining.size());
          List<Entry> kept = new ArrayList<>(result);
          for (Entry longhand : longhands) {
            if (conflicts(longhand, kept) || conflicts(longhand, upcoming)) {
              logger.debug("Skipping {} from decomposed {}: already covered", longhand, entry);
            } else {
              result.add(longhand);
            }
          }
          logger.debug("Decomposed shorthand {} into {}", entry, longhands);
        } else {
          logger.debug("Dropping shorthand {}", entry);
        }
      } else if (hierarchy.isAncestor(group, existing)) {
        logger.debug("Dropping longhand {}", entry);
      } else {
        result.add(entry);
      }
    }
    result.add(incoming);
    return result;
  }

  private List<Entry> pruneInvalidated(List<Entry> current, Entry incoming) {
    Set<UtilityGroup> invalidated = conflicts.invalidatedBy(incoming.group());
    if (invalidated.isEmpty()) {
      return current;
    }
    return current.stream()
        .filter(entry -> {
          boolean drop = entry.group() != null && entry.token().sameScope(incoming.token()) &&
              invalidated.contains(entry.group());
          if (drop) {
            logger.debug("Invalidating {}", entry);
          }
          return !drop;
        })
        .collect(Collectors.toList());
  }

  /**
   * Splits a shorthand into its longhands, leaving out the path to the target group
   * @param entry shorthand entry
   * @param shorthand group of the entry (or of the longhand being expanded)
   * @param target group of the override
   * @return synthesized longhand entries
   */
  private List<Entry> decompose(Entry entry, UtilityGroup shorthand, UtilityGroup target) {
    List<Entry> result = new ArrayList<>();
    for (GroupHierarchy.Longhand longhand : hierarchy.longhandsOf(shorthand)) {
      UtilityGroup child = longhand.group();
      if (child == target) {
        continue;
      }
      Entry synthesized = synthesize(entry, longhand);
      if (hierarchy.isAncestor(child, target)) {
        result.addAll(decompose(synthesized, child, target));
      } else {
        result.add(synthesized);
      }
    }
    return result;
  }

  private static Entry synthesize(Entry entry, GroupHierarchy.Longhand longhand) {
    String value = entry.classification().value();
    ParsedToken token = entry.token();
    String base = token.arbitrary() || value.isEmpty() ? longhand.prefix() : longhand.prefix() + "-" + value;
    return new Entry(token.withBase(base), Classification.of(longhand.group(), value));
  }

  private boolean conflicts(Entry candidate, List<Entry> context) {
    for (Entry other : context) {
      if (other.group() != null && other.token().sameScope(candidate.token()) &&
          hierarchy.related(other.group(), candidate.group())) {
        return true;
      }
    }
    return false;
  }

  public Classifier classifier() {
    return classifier;
  }

  public boolean decomposes() {
    return decompose;
  }

  /**
   * A token paired with its classification, computed once per merge
   */
  private static class Entry {
    private final ParsedToken token;
    private final Classification classification;

    Entry(ParsedToken token, Classification classification) {
      this.token = token;
      this.classification = classification;
    }

    ParsedToken token() {
      return token;
    }

    Classification classification() {
      return classification;
    }

    UtilityGroup group() {
      return classification.group().orElse(null);
    }

    @Override
    public String toString() {
      return Reconstructor.reconstruct(token) + " <" + classification + ">";
    }
  }
}
