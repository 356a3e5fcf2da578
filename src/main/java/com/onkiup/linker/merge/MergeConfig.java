package com.onkiup.linker.merge;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.Properties;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import com.onkiup.linker.merge.util.TextUtils;

/**
 * Options consumed by {@link ClassMerger}. Instances are immutable and can be shared between threads,
 * so callers that need different settings simply use different configurations.
 */
public class MergeConfig {
  private static final Logger logger = LoggerFactory.getLogger(MergeConfig.class);

  public static final String PREFIX_PROPERTY = "linker.merge.prefix";
  public static final String COLORS_PROPERTY = "linker.merge.colors";
  public static final String DECOMPOSE_PROPERTY = "linker.merge.decompose";
  public static final String NO_MERGE_PROPERTY = "linker.merge.no-merge";

  /**
   * System property that points to an external properties file
   */
  public static final String CONFIG_PATH_PROPERTY = "linker.merge.config";
  public static final String DEFAULT_RESOURCE = "linker-merge.properties";

  public static final MergeConfig DEFAULT = builder().build();

  private final String classPrefix;
  private final Set<String> customColors;
  private final boolean decompose;
  private final Set<String> noMerge;

  private MergeConfig(Builder builder) {
    this.classPrefix = builder.classPrefix;
    this.customColors = builder.customColors.build();
    this.decompose = builder.decompose;
    this.noMerge = builder.noMerge.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads configuration from properties. Missing keys keep their defaults;
   * list values are separated with commas or whitespace
   * @param properties source properties
   * @return parsed configuration
   */
  public static MergeConfig fromProperties(Properties properties) {
    Builder builder = builder()
        .classPrefix(properties.getProperty(PREFIX_PROPERTY, "").trim())
        .customColors(list(properties.getProperty(COLORS_PROPERTY)))
        .noMerge(list(properties.getProperty(NO_MERGE_PROPERTY)));
    String decompose = properties.getProperty(DECOMPOSE_PROPERTY);
    if (!Strings.isNullOrEmpty(decompose)) {
      builder.decompose(Boolean.parseBoolean(decompose.trim()));
    }
    return builder.build();
  }

  private static Collection<String> list(String value) {
    return TextUtils.splitClasses(Strings.nullToEmpty(value).replace(',', ' '));
  }

  /**
   * Loads configuration from the file named by the {@value #CONFIG_PATH_PROPERTY} system property,
   * or from the {@value #DEFAULT_RESOURCE} classpath resource.
   * @return loaded configuration or {@link #DEFAULT} when neither source exists
   */
  public static MergeConfig load() {
    String path = System.getProperty(CONFIG_PATH_PROPERTY);
    if (!Strings.isNullOrEmpty(path)) {
      return load(Paths.get(path));
    }

    InputStream resource = MergeConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
    if (resource == null) {
      logger.debug("No {} on classpath, using defaults", DEFAULT_RESOURCE);
      return DEFAULT;
    }
    try (InputStream is = resource) {
      Properties properties = new Properties();
      properties.load(is);
      logger.info("Loaded merge configuration from classpath resource {}", DEFAULT_RESOURCE);
      return fromProperties(properties);
    } catch (IOException e) {
      throw new IllegalArgumentException("Failed to read classpath resource " + DEFAULT_RESOURCE, e);
    }
  }

  /**
   * Loads configuration from a properties file
   * @param path file to read
   * @return loaded configuration
   */
  public static MergeConfig load(Path path) {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Properties properties = new Properties();
      properties.load(reader);
      logger.info("Loaded merge configuration from {}", path);
      return fromProperties(properties);
    } catch (IOException e) {
      throw new IllegalArgumentException("Failed to read merge configuration " + path, e);
    }
  }

  /**
   * @return framework class prefix (like "tw-"), empty when not configured
   */
  public String classPrefix() {
    return classPrefix;
  }

  /**
   * @return palette names that are treated as colors in addition to the built-in palette
   */
  public Set<String> customColors() {
    return customColors;
  }

  /**
   * @return true if shorthand classes should be split into longhands instead of being dropped
   */
  public boolean decompose() {
    return decompose;
  }

  /**
   * @return base identifiers that never take part in conflict resolution
   */
  public Set<String> noMerge() {
    return noMerge;
  }

  public Builder toBuilder() {
    return builder()
        .classPrefix(classPrefix)
        .customColors(customColors)
        .decompose(decompose)
        .noMerge(noMerge);
  }

  @Override
  public String toString() {
    return "MergeConfig[prefix='" + classPrefix + "', colors=" + customColors + ", decompose=" + decompose +
        ", noMerge=" + noMerge + "]";
  }

  public static class Builder {
    private String classPrefix = "";
    private ImmutableSet.Builder<String> customColors = ImmutableSet.builder();
    private boolean decompose;
    private ImmutableSet.Builder<String> noMerge = ImmutableSet.builder();

    private Builder() {

    }

    public Builder classPrefix(String classPrefix) {
      this.classPrefix = Preconditions.checkNotNull(classPrefix, "classPrefix");
      return this;
    }

    public Builder customColors(Collection<String> colors) {
      customColors.addAll(Preconditions.checkNotNull(colors, "customColors"));
      return this;
    }

    public Builder customColors(String... colors) {
      customColors.add(colors);
      return this;
    }

    public Builder decompose(boolean decompose) {
      this.decompose = decompose;
      return this;
    }

    public Builder noMerge(Collection<String> classes) {
      noMerge.addAll(Preconditions.checkNotNull(classes, "noMerge"));
      return this;
    }

    public Builder noMerge(String... classes) {
      noMerge.add(classes);
      return this;
    }

    public MergeConfig build() {
      return new MergeConfig(this);
    }
  }
}
