package com.onkiup.linker.merge.registry;

import static org.junit.Assert.*;

import org.junit.Test;

import com.onkiup.linker.merge.util.RegistryError;

public class GroupRegistryTest {

  @Test
  public void testSharedInstance() {
    GroupRegistry registry = GroupRegistry.get();
    assertSame(registry, GroupRegistry.get());
    assertNotNull(registry.hierarchy());
    assertNotNull(registry.conflicts());
  }

  @Test
  public void testExact() {
    GroupRegistry registry = GroupRegistry.get();
    assertEquals(UtilityGroup.DISPLAY, registry.exact("flex").get());
    assertEquals(UtilityGroup.BG_IMAGE, registry.exact("bg-none").get());
    assertFalse(registry.exact("flex-1").isPresent());
  }

  @Test
  public void testLookup() {
    GroupRegistry registry = GroupRegistry.get();
    assertEquals(UtilityGroup.FLEX, registry.lookup("flex-1").get().group());
    assertEquals(UtilityGroup.GROW, registry.lookup("flex-grow").get().group());
    assertEquals(UtilityGroup.GRADIENT_DIRECTION, registry.lookup("bg-gradient-to-r").get().group());
    assertEquals("r", registry.lookup("bg-gradient-to-r").get().value());
    assertFalse(registry.lookup("nothing-here").isPresent());
  }

  @Test
  public void testSubset() {
    GroupRegistry registry = new GroupRegistry(new UtilityGroup[] {UtilityGroup.P, UtilityGroup.DISPLAY},
        GroupHierarchy.builder().build(), OverrideConflicts.builder().build());
    assertEquals(UtilityGroup.P, registry.lookup("p-4").get().group());
    assertFalse(registry.lookup("m-4").isPresent());
    assertTrue(registry.exact("grid").isPresent());
    assertTrue(registry.hierarchy().longhandsOf(UtilityGroup.P).isEmpty());
  }

  @Test
  public void testDuplicateExactName() {
    try {
      new GroupRegistry(new UtilityGroup[] {UtilityGroup.DISPLAY, UtilityGroup.DISPLAY},
          GroupHierarchy.declared(), OverrideConflicts.declared());
      fail("Duplicate exact names should be rejected");
    } catch (RegistryError e) {
      assertEquals(UtilityGroup.DISPLAY, e.source());
    }
  }
}
