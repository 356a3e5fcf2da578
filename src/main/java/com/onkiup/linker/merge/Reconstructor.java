package com.onkiup.linker.merge;

import java.util.List;
import java.util.stream.Collectors;

import com.onkiup.linker.merge.token.ParsedToken;
import com.onkiup.linker.merge.util.TextUtils;

/**
 * Serializes tokens back into class text
 */
public interface Reconstructor {

  /**
   * @param token token to serialize
   * @return token's raw text when it has one, otherwise the text rebuilt from its parts
   */
  static String reconstruct(ParsedToken token) {
    return token.raw().orElseGet(() -> rebuild(token));
  }

  /**
   * Rebuilds class text from token parts, ignoring the raw text
   * @param token token to serialize
   * @return prefix, variants, sign, base with payload, modifier and important marker
   */
  static String rebuild(ParsedToken token) {
    StringBuilder result = new StringBuilder(token.classPrefix());
    for (String variant : token.variants()) {
      result.append(variant).append(':');
    }
    if (token.negative()) {
      result.append('-');
    }
    result.append(token.base());
    token.arbitraryValue().ifPresent(value -> result.append("-[").append(value).append(']'));
    token.arbitraryVariable().ifPresent(value -> result.append("-(").append(value).append(')'));
    token.modifier().ifPresent(modifier -> result.append('/').append(modifier));
    if (token.important()) {
      result.append('!');
    }
    return result.toString();
  }

  /**
   * @return serialized tokens separated with single spaces
   */
  static String join(List<ParsedToken> tokens) {
    return TextUtils.joinClasses(tokens.stream()
        .map(Reconstructor::reconstruct)
        .collect(Collectors.toList()));
  }
}
