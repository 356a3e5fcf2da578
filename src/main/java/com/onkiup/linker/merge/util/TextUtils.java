package com.onkiup.linker.merge.util;

import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;

public interface TextUtils {
  Splitter WHITESPACE = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
  Joiner SPACE = Joiner.on(' ');

  /**
   * Splits a class string on runs of whitespace
   * @param classes class string, may be null
   * @return non-empty class names in order
   */
  static List<String> splitClasses(String classes) {
    return WHITESPACE.splitToList(Strings.nullToEmpty(classes));
  }

  static String joinClasses(Iterable<?> classes) {
    return SPACE.join(classes);
  }

  /**
   * Finds the first occurrence of a character that is not nested in brackets or parentheses
   * @param text text to search
   * @param target character to look for
   * @return position of the character or -1
   */
  static int indexOfUnnested(CharSequence text, char target) {
    int depth = 0;
    for (int i = 0; i < text.length(); i++) {
      char character = text.charAt(i);
      if (character == '[' || character == '(') {
        depth++;
      } else if (character == ']' || character == ')') {
        depth = Math.max(depth - 1, 0);
      } else if (character == target && depth == 0) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Escapes line breaks and tabs so that a value fits into a single log line
   */
  static String sanitize(Object what) {
    return what == null ? "null" : what.toString().replaceAll("\n", "\\\\n").replaceAll("\t", "\\\\t");
  }
}
