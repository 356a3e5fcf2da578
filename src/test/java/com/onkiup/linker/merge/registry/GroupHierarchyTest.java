package com.onkiup.linker.merge.registry;

import static com.onkiup.linker.merge.registry.GroupHierarchy.longhand;
import static com.onkiup.linker.merge.registry.UtilityGroup.*;
import static org.junit.Assert.*;

import java.util.EnumSet;
import java.util.List;

import org.junit.Test;

import com.onkiup.linker.merge.util.RegistryError;

public class GroupHierarchyTest {

  private final GroupHierarchy hierarchy = GroupHierarchy.declared();

  @Test
  public void testLonghands() {
    List<GroupHierarchy.Longhand> longhands = hierarchy.longhandsOf(P);
    assertEquals(2, longhands.size());
    assertEquals(PX, longhands.get(0).group());
    assertEquals("px", longhands.get(0).prefix());
    assertEquals(PY, longhands.get(1).group());
    assertTrue(hierarchy.longhandsOf(PT).isEmpty());
  }

  @Test
  public void testClosure() {
    assertEquals(EnumSet.of(P, PY), hierarchy.ancestorsOf(PT));
    assertTrue(hierarchy.isAncestor(P, PT));
    assertTrue(hierarchy.isAncestor(BORDER_W, BORDER_W_L));
    assertFalse(hierarchy.isAncestor(PT, P));
    assertFalse(hierarchy.isAncestor(P, P));
    assertFalse(hierarchy.isAncestor(P, MT));
    assertTrue(hierarchy.ancestorsOf(DISPLAY).isEmpty());
  }

  @Test
  public void testMultipleParents() {
    assertEquals(EnumSet.of(ROUNDED, ROUNDED_T, ROUNDED_R), hierarchy.ancestorsOf(ROUNDED_TR));
    assertFalse(hierarchy.isAncestor(ROUNDED_T, ROUNDED_BR));
  }

  @Test
  public void testRelated() {
    assertTrue(hierarchy.related(P, P));
    assertTrue(hierarchy.related(P, PX));
    assertTrue(hierarchy.related(PX, P));
    assertFalse(hierarchy.related(PX, PY));
    assertFalse(hierarchy.related(BORDER_W, BORDER_COLOR_T));
  }

  @Test(expected = RegistryError.class)
  public void testCycle() {
    GroupHierarchy.builder()
        .shorthand(P, longhand(PX, "px"))
        .shorthand(PX, longhand(PT, "pt"))
        .shorthand(PT, longhand(P, "p"))
        .build();
  }

  @Test
  public void testDuplicateShorthand() {
    try {
      GroupHierarchy.builder()
          .shorthand(P, longhand(PX, "px"))
          .shorthand(P, longhand(PY, "py"));
      fail("Duplicate shorthand should be rejected");
    } catch (RegistryError e) {
      assertEquals(P, e.source());
      assertTrue(e.toString().startsWith("Registry error at group p:"));
    }
  }
}
