package com.onkiup.linker.merge;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Properties;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.collect.ImmutableSet;

public class MergeConfigTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @After
  public void clearProperty() {
    System.clearProperty(MergeConfig.CONFIG_PATH_PROPERTY);
  }

  @Test
  public void testDefaults() {
    MergeConfig config = MergeConfig.DEFAULT;
    assertEquals("", config.classPrefix());
    assertTrue(config.customColors().isEmpty());
    assertFalse(config.decompose());
    assertTrue(config.noMerge().isEmpty());
  }

  @Test
  public void testFromProperties() {
    Properties properties = new Properties();
    properties.setProperty(MergeConfig.PREFIX_PROPERTY, " tw- ");
    properties.setProperty(MergeConfig.COLORS_PROPERTY, "brand, accent  neon");
    properties.setProperty(MergeConfig.DECOMPOSE_PROPERTY, "true");
    properties.setProperty(MergeConfig.NO_MERGE_PROPERTY, "sr-only,container");

    MergeConfig config = MergeConfig.fromProperties(properties);
    assertEquals("tw-", config.classPrefix());
    assertEquals(ImmutableSet.of("brand", "accent", "neon"), config.customColors());
    assertTrue(config.decompose());
    assertEquals(ImmutableSet.of("sr-only", "container"), config.noMerge());
  }

  @Test
  public void testToBuilder() {
    MergeConfig config = MergeConfig.builder().classPrefix("tw-").noMerge("x").build();
    MergeConfig copy = config.toBuilder().decompose(true).build();
    assertEquals("tw-", copy.classPrefix());
    assertEquals(ImmutableSet.of("x"), copy.noMerge());
    assertTrue(copy.decompose());
    assertFalse(config.decompose());
  }

  @Test(expected = NullPointerException.class)
  public void testNullPrefix() {
    MergeConfig.builder().classPrefix(null);
  }

  @Test
  public void testLoadPath() throws IOException {
    File file = folder.newFile("merge.properties");
    Files.write(file.toPath(), "linker.merge.decompose=true\nlinker.merge.prefix=ui-\n".getBytes(StandardCharsets.UTF_8));

    MergeConfig config = MergeConfig.load(file.toPath());
    assertTrue(config.decompose());
    assertEquals("ui-", config.classPrefix());
  }

  @Test
  public void testLoadMissingPath() {
    try {
      MergeConfig.load(new File(folder.getRoot(), "missing.properties").toPath());
      fail("Missing file should not load");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getCause() instanceof IOException);
      assertTrue(e.getMessage().contains("missing.properties"));
    }
  }

  @Test
  public void testLoadFromSystemProperty() throws IOException {
    File file = folder.newFile("system.properties");
    Files.write(file.toPath(), "linker.merge.colors=brand\n".getBytes(StandardCharsets.UTF_8));
    System.setProperty(MergeConfig.CONFIG_PATH_PROPERTY, file.getAbsolutePath());

    MergeConfig config = MergeConfig.load();
    assertEquals(ImmutableSet.of("brand"), config.customColors());
    assertTrue(ClassMerger.fromEnvironment().classifier().isColor("brand-500"));
  }

  @Test
  public void testLoadDefaults() {
    assertSame(MergeConfig.DEFAULT, MergeConfig.load());
  }
}
