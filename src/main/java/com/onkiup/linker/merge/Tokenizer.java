package com.onkiup.linker.merge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.onkiup.linker.merge.token.ParsedToken;
import com.onkiup.linker.merge.util.TextUtils;

/**
 * Parses class strings into {@link ParsedToken}s.
 *
 * <pre>
 *   token := [remove-directive] [class-prefix] (variant ':')* ['!'] ['-'] base ['/' modifier] ['!']
 *   base  := name | name '[' value ']' | name '(' value ')'
 * </pre>
 */
public class Tokenizer {

  public static final String REMOVE_DIRECTIVE = "remove:";
  public static final String REMOVE_ALL_DIRECTIVE = "remove:*";

  private static final Pattern ARBITRARY_VALUE = Pattern.compile("^(.+?)\\[(.+)\\]$", Pattern.DOTALL);
  private static final Pattern ARBITRARY_VARIABLE = Pattern.compile("^(.+?)\\((.+)\\)$", Pattern.DOTALL);

  private final String classPrefix;

  public Tokenizer(MergeConfig config) {
    this.classPrefix = config.classPrefix();
  }

  /**
   * Parses a whitespace-separated class string
   * @param classes class string, null is treated as empty
   * @return parsed tokens in source order
   */
  public List<ParsedToken> parseMany(String classes) {
    return TextUtils.splitClasses(classes).stream()
        .map(this::parse)
        .collect(Collectors.toList());
  }

  /**
   * Parses a single class token
   * @param text class token without surrounding whitespace
   * @return parsed token; malformed nesting is tolerated
   */
  public ParsedToken parse(String text) {
    if (text.startsWith(REMOVE_ALL_DIRECTIVE)) {
      return new ParsedToken("", "", Collections.emptyList(), "", false, false, null, null, null, false, true);
    }

    boolean remove = text.startsWith(REMOVE_DIRECTIVE);
    String raw = remove ? text.substring(REMOVE_DIRECTIVE.length()) : text;

    String rest = raw;
    String prefix = "";
    if (!classPrefix.isEmpty() && rest.startsWith(classPrefix)) {
      prefix = classPrefix;
      rest = rest.substring(classPrefix.length());
    }

    List<String> parts = splitVariants(rest);
    String base = parts.remove(parts.size() - 1);
    List<String> variants = parts;

    boolean important = false;
    if (base.startsWith("!")) {
      important = true;
      base = base.substring(1);
    } else if (base.endsWith("!")) {
      important = true;
      base = base.substring(0, base.length() - 1);
    }

    boolean negative = false;
    if (base.startsWith("-")) {
      negative = true;
      base = base.substring(1);
    }

    String modifier = null;
    if (base.indexOf('[') < 0) {
      int slash = TextUtils.indexOfUnnested(base, '/');
      if (slash > -1 && slash < base.length() - 1) {
        modifier = base.substring(slash + 1);
        base = base.substring(0, slash);
      }
    }

    String arbitraryValue = null;
    String arbitraryVariable = null;
    Matcher matcher = ARBITRARY_VALUE.matcher(base);
    if (matcher.matches()) {
      base = trimTrailingDashes(matcher.group(1));
      arbitraryValue = matcher.group(2);
    } else {
      matcher = ARBITRARY_VARIABLE.matcher(base);
      if (matcher.matches()) {
        base = trimTrailingDashes(matcher.group(1));
        arbitraryVariable = matcher.group(2);
      }
    }

    return new ParsedToken(raw, prefix, variants, base, important, negative, modifier, arbitraryValue,
        arbitraryVariable, remove, false);
  }

  /**
   * Splits on colons that are not nested in brackets or parentheses
   * @return variants followed by the base as the last element
   */
  static List<String> splitVariants(String text) {
    List<String> parts = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      char character = text.charAt(i);
      if (character == '[' || character == '(') {
        depth++;
      } else if (character == ']' || character == ')') {
        depth = Math.max(depth - 1, 0);
      } else if (character == ':' && depth == 0) {
        parts.add(text.substring(start, i));
        start = i + 1;
      }
    }
    parts.add(text.substring(start));
    return parts;
  }

  private static String trimTrailingDashes(String name) {
    int end = name.length();
    while (end > 0 && name.charAt(end - 1) == '-') {
      end--;
    }
    return name.substring(0, end);
  }

  public String classPrefix() {
    return classPrefix;
  }
}
