package com.onkiup.linker.merge.matcher;

import java.util.Collection;
import java.util.Collections;

/**
 * Matches color values: CSS named colors, palette colors with an optional shade ({@code red}, {@code red-500}),
 * hex literals and color functions. An opacity suffix ({@code red-500/50}) is ignored.
 */
public class ColorMatcher implements ValueMatcher {

  public static final TerminalMatcher PALETTE = new TerminalMatcher(
      "slate", "gray", "zinc", "neutral", "stone", "red", "orange", "amber", "yellow", "lime", "green", "emerald",
      "teal", "cyan", "sky", "blue", "indigo", "violet", "purple", "fuchsia", "pink", "rose");

  public static final TerminalMatcher SHADES = new TerminalMatcher(
      "50", "100", "150", "200", "250", "300", "350", "400", "450", "500", "550", "600", "650", "700", "750", "800",
      "850", "900", "950");

  public static final TerminalMatcher NAMED = new TerminalMatcher(
      "black", "white", "transparent", "current", "inherit",
      "aliceblue", "antiquewhite", "aqua", "aquamarine", "azure", "beige", "bisque", "blanchedalmond",
      "blue", "blueviolet", "brown", "burlywood", "cadetblue", "chartreuse", "chocolate", "coral",
      "cornflowerblue", "cornsilk", "crimson", "cyan", "darkblue", "darkcyan", "darkgoldenrod",
      "darkgray", "darkgreen", "darkgrey", "darkkhaki", "darkmagenta", "darkolivegreen", "darkorange",
      "darkorchid", "darkred", "darksalmon", "darkseagreen", "darkslateblue", "darkslategray",
      "darkslategrey", "darkturquoise", "darkviolet", "deeppink", "deepskyblue", "dimgray", "dimgrey",
      "dodgerblue", "firebrick", "floralwhite", "forestgreen", "fuchsia", "gainsboro", "ghostwhite",
      "gold", "goldenrod", "gray", "green", "greenyellow", "grey", "honeydew", "hotpink", "indianred", "indigo",
      "ivory", "khaki", "lavender", "lavenderblush", "lawngreen", "lemonchiffon", "lightblue",
      "lightcoral", "lightcyan", "lightgoldenrodyellow", "lightgray", "lightgreen", "lightgrey",
      "lightpink", "lightsalmon", "lightseagreen", "lightskyblue", "lightslategray",
      "lightslategrey", "lightsteelblue", "lightyellow", "lime", "limegreen", "linen", "magenta",
      "maroon", "mediumaquamarine", "mediumblue", "mediumorchid", "mediumpurple", "mediumseagreen",
      "mediumslateblue", "mediumspringgreen", "mediumturquoise", "mediumvioletred",
      "midnightblue", "mintcream", "mistyrose", "moccasin", "navajowhite", "navy", "oldlace", "olive",
      "olivedrab", "orange", "orangered", "orchid", "palegoldenrod", "palegreen", "paleturquoise",
      "palevioletred", "papayawhip", "peachpuff", "peru", "pink", "plum", "powderblue", "purple",
      "rebeccapurple", "red", "rosybrown", "royalblue", "saddlebrown", "salmon", "sandybrown",
      "seagreen", "seashell", "sienna", "silver", "skyblue", "slateblue", "slategray", "slategrey",
      "snow", "springgreen", "steelblue", "tan", "teal", "thistle", "tomato", "turquoise", "violet", "wheat",
      "white", "whitesmoke", "yellow", "yellowgreen");

  public static final ValueMatcher HEX = new PatternMatcher(
      "#([0-9a-fA-F]{3}|[0-9a-fA-F]{4}|[0-9a-fA-F]{6}|[0-9a-fA-F]{8})");

  public static final ValueMatcher FUNCTION = new PatternMatcher("(rgba?|hsla?|oklch|oklab|lab|lch|color)\\(.*");

  public static final ColorMatcher DEFAULT = new ColorMatcher(Collections.emptySet());

  private final TerminalMatcher palette;

  /**
   * @param customPalette additional palette names (may contain dashes, like "brand-blue")
   */
  public ColorMatcher(Collection<String> customPalette) {
    this.palette = PALETTE.extend(customPalette);
  }

  @Override
  public boolean matches(CharSequence value) {
    if (value == null) {
      return false;
    }
    String color = value.toString();
    int opacity = color.indexOf('/');
    if (opacity > -1) {
      color = color.substring(0, opacity);
    }
    return NAMED.matches(color) || paletteColor(color) || HEX.matches(color) || FUNCTION.matches(color);
  }

  private boolean paletteColor(String color) {
    if (palette.matches(color)) {
      return true;
    }
    for (int dash = color.indexOf('-'); dash > -1; dash = color.indexOf('-', dash + 1)) {
      if (palette.matches(color.substring(0, dash)) && SHADES.matches(color.substring(dash + 1))) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "ColorMatcher" + palette.terminals();
  }
}
