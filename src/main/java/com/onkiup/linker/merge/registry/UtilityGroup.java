package com.onkiup.linker.merge.registry;

import java.util.Locale;

import com.onkiup.linker.merge.annotation.Exact;
import com.onkiup.linker.merge.annotation.Prefix;

/**
 * Semantic property buckets. Two classes conflict only when they resolve to the same group
 * (or to groups related through {@link GroupHierarchy}) within the same variant scope.
 *
 * Constants annotated with {@link Exact} or {@link Prefix} are loaded into the registry;
 * constants without annotations are only produced by the classifier's value-shape checks.
 */
public enum UtilityGroup {

  // layout
  @Exact({"block", "inline-block", "inline", "flex", "inline-flex", "table", "inline-table", "table-caption",
      "table-cell", "table-column", "table-column-group", "table-footer-group", "table-header-group",
      "table-row-group", "table-row", "flow-root", "grid", "inline-grid", "contents", "list-item", "hidden"})
  DISPLAY,
  @Exact({"static", "fixed", "absolute", "relative", "sticky"})
  POSITION,
  @Exact({"visible", "invisible", "collapse"})
  VISIBILITY,
  @Prefix("inset") INSET,
  @Prefix("inset-x") INSET_X,
  @Prefix("inset-y") INSET_Y,
  @Prefix("top") TOP,
  @Prefix("right") RIGHT,
  @Prefix("bottom") BOTTOM,
  @Prefix("left") LEFT,
  @Prefix("start") START,
  @Prefix("end") END,
  @Prefix("z") Z,
  @Exact({"float-left", "float-right", "float-start", "float-end", "float-none"})
  FLOAT,
  @Exact({"clear-left", "clear-right", "clear-start", "clear-end", "clear-both", "clear-none"})
  CLEAR,
  @Exact({"isolate", "isolation-auto"})
  ISOLATION,
  @Exact({"object-contain", "object-cover", "object-fill", "object-none", "object-scale-down"})
  OBJECT_FIT,
  @Prefix(value = "object", only = {"bottom", "center", "left", "left-bottom", "left-top", "right", "right-bottom",
      "right-top", "top"})
  OBJECT_POSITION,
  @Prefix(value = "overflow", only = {"auto", "hidden", "clip", "visible", "scroll"})
  OVERFLOW,
  @Prefix(value = "overflow-x", only = {"auto", "hidden", "clip", "visible", "scroll"})
  OVERFLOW_X,
  @Prefix(value = "overflow-y", only = {"auto", "hidden", "clip", "visible", "scroll"})
  OVERFLOW_Y,
  @Prefix(value = "overscroll", only = {"auto", "contain", "none"})
  OVERSCROLL,
  @Prefix(value = "overscroll-x", only = {"auto", "contain", "none"})
  OVERSCROLL_X,
  @Prefix(value = "overscroll-y", only = {"auto", "contain", "none"})
  OVERSCROLL_Y,
  @Exact({"box-border", "box-content"})
  BOX_SIZING,
  @Exact({"box-decoration-slice", "box-decoration-clone", "decoration-slice", "decoration-clone"})
  BOX_DECORATION,
  @Prefix("aspect") ASPECT,
  @Prefix("columns") COLUMNS,
  @Prefix("break-before") BREAK_BEFORE,
  @Prefix("break-after") BREAK_AFTER,
  @Prefix("break-inside") BREAK_INSIDE,
  @Exact("container")
  CONTAINER,

  // flexbox and grid
  @Exact({"flex-row", "flex-row-reverse", "flex-col", "flex-col-reverse"})
  FLEX_DIRECTION,
  @Exact({"flex-wrap", "flex-wrap-reverse", "flex-nowrap"})
  FLEX_WRAP,
  @Prefix(value = "flex", only = {"1", "auto", "initial", "none"})
  FLEX,
  @Prefix({"grow", "flex-grow"}) GROW,
  @Prefix({"shrink", "flex-shrink"}) SHRINK,
  @Prefix("basis") BASIS,
  @Prefix("order") ORDER,
  @Prefix("grid-cols") GRID_COLS,
  @Prefix("col-span") COL_SPAN,
  @Prefix("col-start") COL_START,
  @Prefix("col-end") COL_END,
  @Prefix("grid-rows") GRID_ROWS,
  @Prefix("row-span") ROW_SPAN,
  @Prefix("row-start") ROW_START,
  @Prefix("row-end") ROW_END,
  @Exact({"grid-flow-row", "grid-flow-col", "grid-flow-dense", "grid-flow-row-dense", "grid-flow-col-dense"})
  GRID_FLOW,
  @Prefix("auto-cols") AUTO_COLS,
  @Prefix("auto-rows") AUTO_ROWS,
  @Prefix("gap") GAP,
  @Prefix("gap-x") GAP_X,
  @Prefix("gap-y") GAP_Y,
  @Prefix(value = "justify", only = {"normal", "start", "end", "center", "between", "around", "evenly", "stretch"})
  JUSTIFY_CONTENT,
  @Prefix("justify-items") JUSTIFY_ITEMS,
  @Prefix("justify-self") JUSTIFY_SELF,
  @Prefix(value = "content", only = {"normal", "center", "start", "end", "between", "around", "evenly", "baseline",
      "stretch"})
  ALIGN_CONTENT,
  @Prefix("items") ALIGN_ITEMS,
  @Prefix("self") ALIGN_SELF,
  @Prefix("place-content") PLACE_CONTENT,
  @Prefix("place-items") PLACE_ITEMS,
  @Prefix("place-self") PLACE_SELF,

  // spacing
  @Prefix("p") P,
  @Prefix("px") PX,
  @Prefix("py") PY,
  @Prefix("ps") PS,
  @Prefix("pe") PE,
  @Prefix("pt") PT,
  @Prefix("pr") PR,
  @Prefix("pb") PB,
  @Prefix("pl") PL,
  @Prefix("m") M,
  @Prefix("mx") MX,
  @Prefix("my") MY,
  @Prefix("ms") MS,
  @Prefix("me") ME,
  @Prefix("mt") MT,
  @Prefix("mr") MR,
  @Prefix("mb") MB,
  @Prefix("ml") ML,
  @Prefix("space-x") SPACE_X,
  @Prefix("space-y") SPACE_Y,
  @Exact("space-x-reverse")
  SPACE_X_REVERSE,
  @Exact("space-y-reverse")
  SPACE_Y_REVERSE,

  // sizing
  @Prefix("size") SIZE,
  @Prefix("w") W,
  @Prefix("min-w") MIN_W,
  @Prefix("max-w") MAX_W,
  @Prefix("h") H,
  @Prefix("min-h") MIN_H,
  @Prefix("max-h") MAX_H,

  // typography
  @Prefix(value = "font", only = {"sans", "serif", "mono"})
  FONT_FAMILY,
  @Prefix(value = "font", only = {"thin", "extralight", "light", "normal", "medium", "semibold", "bold", "extrabold",
      "black"})
  FONT_WEIGHT,
  FONT_SIZE,
  @Exact({"italic", "not-italic"})
  FONT_STYLE,
  @Prefix("font-stretch") FONT_STRETCH,
  @Exact({"antialiased", "subpixel-antialiased"})
  FONT_SMOOTHING,
  @Exact("normal-nums")
  FVN_NORMAL,
  @Exact("ordinal")
  FVN_ORDINAL,
  @Exact("slashed-zero")
  FVN_SLASHED_ZERO,
  @Exact({"lining-nums", "oldstyle-nums"})
  FVN_FIGURE,
  @Exact({"proportional-nums", "tabular-nums"})
  FVN_SPACING,
  @Exact({"diagonal-fractions", "stacked-fractions"})
  FVN_FRACTION,
  @Prefix("tracking") TRACKING,
  @Prefix("leading") LEADING,
  @Prefix("line-clamp") LINE_CLAMP,
  @Exact({"list-inside", "list-outside"})
  LIST_STYLE_POSITION,
  @Prefix(value = "list", only = {"none", "disc", "decimal"})
  LIST_STYLE_TYPE,
  @Prefix("list-image") LIST_IMAGE,
  @Exact({"text-left", "text-center", "text-right", "text-justify", "text-start", "text-end"})
  TEXT_ALIGN,
  TEXT_COLOR,
  @Exact({"underline", "overline", "line-through", "no-underline"})
  TEXT_DECORATION,
  @Prefix("decoration") DECORATION_COLOR,
  @Prefix(value = "decoration", only = {"solid", "double", "dotted", "dashed", "wavy"})
  DECORATION_STYLE,
  @Prefix(value = "decoration", only = {"auto", "from-font", "0", "1", "2", "4", "8"})
  DECORATION_THICKNESS,
  @Prefix("underline-offset") UNDERLINE_OFFSET,
  @Exact({"uppercase", "lowercase", "capitalize", "normal-case"})
  TEXT_TRANSFORM,
  @Exact({"truncate", "text-ellipsis", "text-clip"})
  TEXT_OVERFLOW,
  @Exact({"text-wrap", "text-nowrap", "text-balance", "text-pretty"})
  TEXT_WRAP,
  @Exact({"wrap-normal", "wrap-break-word", "wrap-anywhere"})
  OVERFLOW_WRAP,
  @Prefix("indent") INDENT,
  @Prefix("align") VERTICAL_ALIGN,
  @Prefix("whitespace") WHITESPACE,
  @Exact({"break-normal", "break-all", "break-keep"})
  WORD_BREAK,
  @Prefix("hyphens") HYPHENS,
  @Prefix("content") CONTENT,
  @Prefix("text-shadow") TEXT_SHADOW,

  // backgrounds
  @Exact({"bg-fixed", "bg-local", "bg-scroll"})
  BG_ATTACHMENT,
  @Exact({"bg-clip-border", "bg-clip-padding", "bg-clip-content", "bg-clip-text"})
  BG_CLIP,
  @Exact({"bg-origin-border", "bg-origin-padding", "bg-origin-content"})
  BG_ORIGIN,
  @Exact({"bg-bottom", "bg-center", "bg-left", "bg-left-bottom", "bg-left-top", "bg-right", "bg-right-bottom",
      "bg-right-top", "bg-top"})
  BG_POSITION,
  @Exact({"bg-repeat", "bg-no-repeat", "bg-repeat-x", "bg-repeat-y", "bg-repeat-round", "bg-repeat-space"})
  BG_REPEAT,
  @Exact({"bg-auto", "bg-cover", "bg-contain"})
  BG_SIZE,
  @Exact("bg-none")
  BG_IMAGE,
  BG_COLOR,
  @Prefix({"bg-gradient-to", "bg-linear-to", "bg-linear"})
  GRADIENT_DIRECTION,
  @Prefix("bg-conic") BG_CONIC,
  @Prefix("bg-radial") BG_RADIAL,
  @Prefix("bg-blend") BG_BLEND,
  @Prefix("from") FROM_COLOR,
  @Prefix(value = "from", only = {"0%", "5%", "10%", "15%", "20%", "25%", "30%", "35%", "40%", "45%", "50%", "55%",
      "60%", "65%", "70%", "75%", "80%", "85%", "90%", "95%", "100%"})
  FROM_POSITION,
  @Prefix("via") VIA_COLOR,
  @Prefix(value = "via", only = {"0%", "5%", "10%", "15%", "20%", "25%", "30%", "35%", "40%", "45%", "50%", "55%",
      "60%", "65%", "70%", "75%", "80%", "85%", "90%", "95%", "100%"})
  VIA_POSITION,
  @Prefix("to") TO_COLOR,
  @Prefix(value = "to", only = {"0%", "5%", "10%", "15%", "20%", "25%", "30%", "35%", "40%", "45%", "50%", "55%",
      "60%", "65%", "70%", "75%", "80%", "85%", "90%", "95%", "100%"})
  TO_POSITION,

  // borders
  @Prefix("rounded") ROUNDED,
  @Prefix("rounded-s") ROUNDED_S,
  @Prefix("rounded-e") ROUNDED_E,
  @Prefix("rounded-t") ROUNDED_T,
  @Prefix("rounded-r") ROUNDED_R,
  @Prefix("rounded-b") ROUNDED_B,
  @Prefix("rounded-l") ROUNDED_L,
  @Prefix("rounded-ss") ROUNDED_SS,
  @Prefix("rounded-se") ROUNDED_SE,
  @Prefix("rounded-ee") ROUNDED_EE,
  @Prefix("rounded-es") ROUNDED_ES,
  @Prefix("rounded-tl") ROUNDED_TL,
  @Prefix("rounded-tr") ROUNDED_TR,
  @Prefix("rounded-br") ROUNDED_BR,
  @Prefix("rounded-bl") ROUNDED_BL,
  BORDER_W,
  BORDER_W_X,
  BORDER_W_Y,
  BORDER_W_T,
  BORDER_W_R,
  BORDER_W_B,
  BORDER_W_L,
  BORDER_W_S,
  BORDER_W_E,
  BORDER_COLOR,
  BORDER_COLOR_X,
  BORDER_COLOR_Y,
  BORDER_COLOR_T,
  BORDER_COLOR_R,
  BORDER_COLOR_B,
  BORDER_COLOR_L,
  BORDER_COLOR_S,
  BORDER_COLOR_E,
  @Exact({"border-solid", "border-dashed", "border-dotted", "border-double", "border-hidden", "border-none"})
  BORDER_STYLE,
  DIVIDE_X,
  DIVIDE_Y,
  @Exact("divide-x-reverse")
  DIVIDE_X_REVERSE,
  @Exact("divide-y-reverse")
  DIVIDE_Y_REVERSE,
  @Exact({"divide-solid", "divide-dashed", "divide-dotted", "divide-double", "divide-none"})
  DIVIDE_STYLE,
  DIVIDE_COLOR,
  @Exact({"outline-none", "outline-hidden", "outline", "outline-dashed", "outline-dotted", "outline-double"})
  OUTLINE_STYLE,
  OUTLINE_W,
  OUTLINE_COLOR,
  OUTLINE_OFFSET,
  RING_W,
  RING_COLOR,
  RING_OFFSET_W,
  RING_OFFSET_COLOR,
  @Exact("ring-inset")
  RING_INSET,
  @Prefix("inset-ring") INSET_RING,

  // effects
  SHADOW_SIZE,
  SHADOW_COLOR,
  @Prefix("inset-shadow") INSET_SHADOW,
  @Prefix("opacity") OPACITY,
  @Prefix("mix-blend") MIX_BLEND,

  // filters
  @Prefix("blur") BLUR,
  @Prefix("brightness") BRIGHTNESS,
  @Prefix("contrast") CONTRAST,
  @Prefix("drop-shadow") DROP_SHADOW,
  @Prefix("grayscale") GRAYSCALE,
  @Prefix("hue-rotate") HUE_ROTATE,
  @Prefix("invert") INVERT,
  @Prefix("saturate") SATURATE,
  @Prefix("sepia") SEPIA,
  @Prefix("backdrop-blur") BACKDROP_BLUR,
  @Prefix("backdrop-brightness") BACKDROP_BRIGHTNESS,
  @Prefix("backdrop-contrast") BACKDROP_CONTRAST,
  @Prefix("backdrop-grayscale") BACKDROP_GRAYSCALE,
  @Prefix("backdrop-hue-rotate") BACKDROP_HUE_ROTATE,
  @Prefix("backdrop-invert") BACKDROP_INVERT,
  @Prefix("backdrop-opacity") BACKDROP_OPACITY,
  @Prefix("backdrop-saturate") BACKDROP_SATURATE,
  @Prefix("backdrop-sepia") BACKDROP_SEPIA,

  // transforms
  @Exact({"transform-cpu", "transform-gpu", "transform-none", "transform-3d"})
  TRANSFORM,
  @Prefix("rotate") ROTATE,
  @Prefix("rotate-x") ROTATE_X,
  @Prefix("rotate-y") ROTATE_Y,
  @Prefix("rotate-z") ROTATE_Z,
  @Prefix("scale") SCALE,
  @Prefix("scale-x") SCALE_X,
  @Prefix("scale-y") SCALE_Y,
  @Prefix("scale-z") SCALE_Z,
  @Prefix("skew-x") SKEW_X,
  @Prefix("skew-y") SKEW_Y,
  @Prefix("translate") TRANSLATE,
  @Prefix("translate-x") TRANSLATE_X,
  @Prefix("translate-y") TRANSLATE_Y,
  @Prefix("translate-z") TRANSLATE_Z,
  @Exact("translate-none")
  TRANSLATE_NONE,
  @Prefix("perspective") PERSPECTIVE,
  @Prefix("perspective-origin") PERSPECTIVE_ORIGIN,
  @Prefix("origin") TRANSFORM_ORIGIN,
  @Exact({"backface-visible", "backface-hidden"})
  BACKFACE,

  // transitions and animation
  @Exact({"transition", "transition-all", "transition-colors", "transition-opacity", "transition-shadow",
      "transition-transform", "transition-none"})
  TRANSITION_PROPERTY,
  @Prefix("duration") DURATION,
  @Prefix("ease") EASE,
  @Prefix("delay") DELAY,
  @Prefix("animate") ANIMATE,

  // interactivity
  @Prefix("accent") ACCENT,
  @Prefix("appearance") APPEARANCE,
  @Prefix("caret") CARET,
  @Exact({"color-scheme-normal", "color-scheme-dark", "color-scheme-light"})
  COLOR_SCHEME,
  @Prefix("cursor") CURSOR,
  @Exact({"field-sizing-content", "field-sizing-fixed"})
  FIELD_SIZING,
  @Exact({"pointer-events-none", "pointer-events-auto"})
  POINTER_EVENTS,
  @Exact({"resize-none", "resize-y", "resize-x", "resize"})
  RESIZE,
  @Exact({"scroll-auto", "scroll-smooth"})
  SCROLL_BEHAVIOR,
  @Prefix("scroll-m") SCROLL_M,
  @Prefix("scroll-mx") SCROLL_MX,
  @Prefix("scroll-my") SCROLL_MY,
  @Prefix("scroll-ms") SCROLL_MS,
  @Prefix("scroll-me") SCROLL_ME,
  @Prefix("scroll-mt") SCROLL_MT,
  @Prefix("scroll-mr") SCROLL_MR,
  @Prefix("scroll-mb") SCROLL_MB,
  @Prefix("scroll-ml") SCROLL_ML,
  @Prefix("scroll-p") SCROLL_P,
  @Prefix("scroll-px") SCROLL_PX,
  @Prefix("scroll-py") SCROLL_PY,
  @Prefix("scroll-ps") SCROLL_PS,
  @Prefix("scroll-pe") SCROLL_PE,
  @Prefix("scroll-pt") SCROLL_PT,
  @Prefix("scroll-pr") SCROLL_PR,
  @Prefix("scroll-pb") SCROLL_PB,
  @Prefix("scroll-pl") SCROLL_PL,
  @Prefix(value = "snap", only = {"start", "end", "center", "align-none"})
  SNAP_ALIGN,
  @Prefix(value = "snap", only = {"normal", "always"})
  SNAP_STOP,
  @Prefix(value = "snap", only = {"none", "x", "y", "both", "mandatory", "proximity"})
  SNAP_TYPE,
  @Exact({"touch-auto", "touch-none", "touch-manipulation"})
  TOUCH,
  @Exact({"touch-pan-x", "touch-pan-left", "touch-pan-right"})
  TOUCH_X,
  @Exact({"touch-pan-y", "touch-pan-up", "touch-pan-down"})
  TOUCH_Y,
  @Exact("touch-pinch-zoom")
  TOUCH_PZ,
  @Prefix("select") SELECT,
  @Prefix("will-change") WILL_CHANGE,

  // svg
  @Prefix("fill") FILL,
  STROKE_W,
  STROKE_COLOR,

  // tables
  @Exact({"border-collapse", "border-separate"})
  BORDER_COLLAPSE,
  @Prefix("border-spacing") BORDER_SPACING,
  @Prefix("border-spacing-x") BORDER_SPACING_X,
  @Prefix("border-spacing-y") BORDER_SPACING_Y,
  @Exact({"table-auto", "table-fixed"})
  TABLE_LAYOUT,
  @Prefix("caption") CAPTION,

  // accessibility
  @Exact({"sr-only", "not-sr-only"})
  SR_ONLY,
  @Exact({"forced-color-adjust-auto", "forced-color-adjust-none"})
  FORCED_COLOR_ADJUST;

  /**
   * @return lowercase identifier of this group, like "font_size"
   */
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
