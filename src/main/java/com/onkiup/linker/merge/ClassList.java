package com.onkiup.linker.merge;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.onkiup.linker.merge.util.TextUtils;

/**
 * Flattens mixed class inputs into a list of class names.
 * Accepted inputs: strings (split on whitespace), arrays and iterables (flattened recursively),
 * maps of class string to condition (a key is kept when its value is neither null nor {@code false}).
 * Nulls and booleans are skipped; any other object contributes its string form.
 */
public final class ClassList {

  private ClassList() {
  }

  public static List<String> flatten(Object... inputs) {
    List<String> result = new ArrayList<>();
    for (Object input : inputs) {
      collect(input, result);
    }
    return result;
  }

  public static String join(Object... inputs) {
    return TextUtils.joinClasses(flatten(inputs));
  }

  private static void collect(Object input, List<String> target) {
    if (input == null || input instanceof Boolean) {
      return;
    }
    if (input instanceof CharSequence) {
      target.addAll(TextUtils.splitClasses(input.toString()));
    } else if (input instanceof Map) {
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) input).entrySet()) {
        if (truthy(entry.getValue())) {
          collect(entry.getKey(), target);
        }
      }
    } else if (input instanceof Iterable) {
      for (Object item : (Iterable<?>) input) {
        collect(item, target);
      }
    } else if (input.getClass().isArray()) {
      int length = Array.getLength(input);
      for (int i = 0; i < length; i++) {
        collect(Array.get(input, i), target);
      }
    } else {
      target.addAll(TextUtils.splitClasses(input.toString()));
    }
  }

  private static boolean truthy(Object condition) {
    return condition != null && !Boolean.FALSE.equals(condition);
  }
}
