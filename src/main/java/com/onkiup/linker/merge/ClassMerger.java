package com.onkiup.linker.merge;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import com.onkiup.linker.merge.registry.GroupRegistry;
import com.onkiup.linker.merge.token.ParsedToken;
import com.onkiup.linker.merge.util.TextUtils;

/**
 * Main entry point for merging class strings.
 * Please use {@link #defaults()} or {@link #forConfig(MergeConfig)} to create instances.
 * Instances are immutable and can be shared between threads.
 */
public class ClassMerger {
  private static final Logger logger = LoggerFactory.getLogger(ClassMerger.class);

  private final MergeConfig config;
  private final Tokenizer tokenizer;
  private final Classifier classifier;
  private final Merger merger;

  /**
   * @return merger configured with {@link MergeConfig#DEFAULT}
   */
  public static ClassMerger defaults() {
    return forConfig(MergeConfig.DEFAULT);
  }

  /**
   * @return merger configured from {@link MergeConfig#load()}
   */
  public static ClassMerger fromEnvironment() {
    return forConfig(MergeConfig.load());
  }

  public static ClassMerger forConfig(MergeConfig config) {
    return new ClassMerger(Preconditions.checkNotNull(config, "config"));
  }

  protected ClassMerger(MergeConfig config) {
    this.config = config;
    this.tokenizer = new Tokenizer(config);
    this.classifier = new Classifier(GroupRegistry.get(), config);
    this.merger = new Merger(classifier, GroupRegistry.get(), config.decompose());
  }

  /**
   * Merges override classes into base classes, dropping base classes that the overrides supersede
   * @param base base class string, null is treated as empty
   * @param overrides override class string, null is treated as empty
   * @return merged class string
   */
  public String merge(String base, String overrides) {
    List<ParsedToken> baseTokens = tokenizer.parseMany(Strings.nullToEmpty(base));
    List<ParsedToken> overrideTokens = tokenizer.parseMany(Strings.nullToEmpty(overrides));
    String result = Reconstructor.join(merger.merge(baseTokens, overrideTokens));
    logger.debug("'{}' + '{}' = '{}'", base, overrides, result);
    return result;
  }

  /**
   * Removes classes by their exact text, without classifying them
   * @param classes class string
   * @param literal classes to remove
   * @return remaining classes separated with single spaces
   */
  public String remove(String classes, String literal) {
    Set<String> removed = ImmutableSet.copyOf(TextUtils.splitClasses(literal));
    return TextUtils.joinClasses(TextUtils.splitClasses(classes).stream()
        .filter(name -> !removed.contains(name))
        .collect(Collectors.toList()));
  }

  /**
   * Flattens mixed inputs (see {@link ClassList}) and resolves conflicts between the resulting classes
   * @return merged class string
   */
  public String classes(Object... inputs) {
    return merge("", ClassList.join(inputs));
  }

  /**
   * Resolves conflicts inside a single class string
   */
  public String literal(String text) {
    return merge("", text);
  }

  /**
   * @param token single class token
   * @return the token's group and value
   */
  public Classification classify(String token) {
    return classifier.classify(tokenizer.parse(token.trim()));
  }

  public MergeConfig config() {
    return config;
  }

  public Tokenizer tokenizer() {
    return tokenizer;
  }

  public Classifier classifier() {
    return classifier;
  }
}
