package com.onkiup.linker.merge;

import static com.onkiup.linker.merge.registry.UtilityGroup.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.onkiup.linker.merge.matcher.ColorMatcher;
import com.onkiup.linker.merge.matcher.TerminalMatcher;
import com.onkiup.linker.merge.matcher.ValueShapes;
import com.onkiup.linker.merge.registry.GroupRegistry;
import com.onkiup.linker.merge.registry.UtilityGroup;
import com.onkiup.linker.merge.token.ParsedToken;

/**
 * Maps parsed tokens to groups.
 *
 * Exact names are checked first, unless the token carries an arbitrary payload. Prefixes that are shared by unrelated properties
 * ({@code text}, {@code border}, {@code ring}, {@code shadow}, {@code stroke}, {@code bg}, {@code outline},
 * {@code divide}, and {@code flex} with a payload) are resolved by looking at the shape of the value; everything else goes through the prefix trie.
 */
public class Classifier {
  private static final Logger logger = LoggerFactory.getLogger(Classifier.class);

  private static final Splitter DASH = Splitter.on('-');
  private static final Joiner DASH_JOINER = Joiner.on('-');

  private static final TerminalMatcher BORDER_SIDE = new TerminalMatcher("x", "y", "t", "r", "b", "l", "s", "e");
  private static final TerminalMatcher BG_PREFIXED = new TerminalMatcher("gradient", "linear", "conic", "radial",
      "blend");

  private static final Map<String, UtilityGroup> BORDER_WIDTH = ImmutableMap.<String, UtilityGroup>builder()
      .put("", BORDER_W).put("x", BORDER_W_X).put("y", BORDER_W_Y)
      .put("t", BORDER_W_T).put("r", BORDER_W_R).put("b", BORDER_W_B).put("l", BORDER_W_L)
      .put("s", BORDER_W_S).put("e", BORDER_W_E)
      .build();

  private static final Map<String, UtilityGroup> BORDER_COLOR_SIDE = ImmutableMap.<String, UtilityGroup>builder()
      .put("", BORDER_COLOR).put("x", BORDER_COLOR_X).put("y", BORDER_COLOR_Y)
      .put("t", BORDER_COLOR_T).put("r", BORDER_COLOR_R).put("b", BORDER_COLOR_B).put("l", BORDER_COLOR_L)
      .put("s", BORDER_COLOR_S).put("e", BORDER_COLOR_E)
      .build();

  private final GroupRegistry registry;
  private final ColorMatcher colors;
  private final Set<String> noMerge;

  public Classifier(MergeConfig config) {
    this(GroupRegistry.get(), config);
  }

  public Classifier(GroupRegistry registry, MergeConfig config) {
    this.registry = registry;
    this.colors = config.customColors().isEmpty() ? ColorMatcher.DEFAULT : new ColorMatcher(config.customColors());
    this.noMerge = config.noMerge();
  }

  /**
   * @param token token to classify
   * @return token's group and value, or {@link Classification#UNKNOWN}
   */
  public Classification classify(ParsedToken token) {
    if (token.remove() || token.removeAll() || pinned(token)) {
      return Classification.UNKNOWN;
    }

    String base = token.base();
    // exact names never carry a payload
    UtilityGroup exact = token.arbitrary() ? null : registry.exact(base).orElse(null);
    if (exact != null) {
      return Classification.of(exact, "");
    }

    List<String> segments = DASH.splitToList(base);
    Classification resolved = resolveShared(segments.get(0), segments.subList(1, segments.size()), token);
    if (resolved != null) {
      return resolved;
    }

    return registry.lookup(base)
        .map(match -> Classification.of(match.group(), match.value()))
        .orElse(Classification.UNKNOWN);
  }

  /**
   * @return true if the token's base is configured to never take part in merging
   */
  public boolean pinned(ParsedToken token) {
    return noMerge.contains(token.base());
  }

  /**
   * @return true if the value follows color grammar, taking configured custom colors into account
   */
  public boolean isColor(String value) {
    return colors.matches(value);
  }

  private Classification resolveShared(String head, List<String> rest, ParsedToken token) {
    String arbitrary = token.arbitraryValue().orElse(null);
    String variable = token.arbitraryVariable().orElse(null);
    String first = rest.isEmpty() ? "" : rest.get(0);
    String value = DASH_JOINER.join(rest);

    switch (head) {
      case "text":
        if ("shadow".equals(first)) {
          return null;
        }
        return Classification.of(text(value, arbitrary, variable), value);
      case "border":
        if ("spacing".equals(first)) {
          return null;
        }
        String side = "";
        if (BORDER_SIDE.matches(first)) {
          side = first;
          value = tail(rest);
        }
        return Classification.of(width(value, arbitrary, variable) ?
            BORDER_WIDTH.get(side) : BORDER_COLOR_SIDE.get(side), value);
      case "ring":
        if ("offset".equals(first)) {
          String offset = tail(rest);
          return Classification.of(width(offset, arbitrary, variable) ? RING_OFFSET_W : RING_OFFSET_COLOR, offset);
        }
        return Classification.of(width(value, arbitrary, variable) ? RING_W : RING_COLOR, value);
      case "shadow":
        return Classification.of(shadow(value, arbitrary, variable), value);
      case "stroke":
        return Classification.of(width(value, arbitrary, variable) ? STROKE_W : STROKE_COLOR, value);
      case "outline":
        if ("offset".equals(first)) {
          return Classification.of(OUTLINE_OFFSET, tail(rest));
        }
        return Classification.of(width(value, arbitrary, variable) ? OUTLINE_W : OUTLINE_COLOR, value);
      case "divide":
        if ("x".equals(first)) {
          return Classification.of(DIVIDE_X, tail(rest));
        } else if ("y".equals(first)) {
          return Classification.of(DIVIDE_Y, tail(rest));
        }
        return Classification.of(DIVIDE_COLOR, value);
      case "bg":
        if (BG_PREFIXED.matches(first)) {
          return null;
        }
        if (arbitrary != null && (arbitrary.startsWith("url(") || arbitrary.startsWith("image:"))) {
          return Classification.of(BG_IMAGE, value);
        }
        return Classification.of(BG_COLOR, value);
      case "flex":
        return rest.isEmpty() && (arbitrary != null || variable != null) ? Classification.of(FLEX, "") : null;
      default:
        return null;
    }
  }

  private static String tail(List<String> rest) {
    return DASH_JOINER.join(rest.subList(1, rest.size()));
  }

  /**
   * Font size or text color
   */
  private UtilityGroup text(String value, String arbitrary, String variable) {
    String payload = arbitrary != null ? arbitrary : variable;
    if (payload != null) {
      if (payload.startsWith(ValueShapes.LENGTH_TAG)) {
        return FONT_SIZE;
      } else if (payload.startsWith(ValueShapes.COLOR_TAG)) {
        return TEXT_COLOR;
      }
      return arbitrary != null && ValueShapes.LENGTH.matches(arbitrary) ? FONT_SIZE : TEXT_COLOR;
    }
    if (ValueShapes.TSHIRT_SIZE.matches(value)) {
      return FONT_SIZE;
    }
    colorFallback("text", value);
    return TEXT_COLOR;
  }

  /**
   * Decides between the width and the color flavour of border, ring, outline and stroke classes
   * @return true for width
   */
  private boolean width(String value, String arbitrary, String variable) {
    String payload = arbitrary != null ? arbitrary : variable;
    if (payload != null) {
      if (payload.startsWith(ValueShapes.LENGTH_TAG)) {
        return true;
      } else if (payload.startsWith(ValueShapes.COLOR_TAG)) {
        return false;
      }
      return arbitrary != null && ValueShapes.LENGTH.matches(arbitrary);
    }
    if (value.isEmpty() || ValueShapes.NUMBER.matches(value)) {
      return true;
    }
    colorFallback("width", value);
    return false;
  }

  /**
   * Shadow size or shadow color
   */
  private UtilityGroup shadow(String value, String arbitrary, String variable) {
    String payload = arbitrary != null ? arbitrary : variable;
    if (payload != null) {
      if (payload.startsWith(ValueShapes.LENGTH_TAG)) {
        return SHADOW_SIZE;
      } else if (payload.startsWith(ValueShapes.COLOR_TAG)) {
        return SHADOW_COLOR;
      }
      // bracketed shadows are usually full shadow definitions
      return arbitrary != null && !isColor(arbitrary) ? SHADOW_SIZE : SHADOW_COLOR;
    }
    if (value.isEmpty() || ValueShapes.TSHIRT_SIZE.matches(value) || ValueShapes.SHADOW_KEYWORD.matches(value)) {
      return SHADOW_SIZE;
    }
    colorFallback("shadow", value);
    return SHADOW_COLOR;
  }

  private void colorFallback(String kind, String value) {
    if (logger.isTraceEnabled() && !isColor(value)) {
      logger.trace("{} value '{}' is neither a size nor a known color, treating it as a color", kind, value);
    }
  }
}
