package com.onkiup.linker.merge.registry;

import static com.onkiup.linker.merge.registry.UtilityGroup.*;
import static org.junit.Assert.*;

import java.util.EnumSet;

import org.junit.Test;

public class OverrideConflictsTest {

  @Test
  public void testDeclared() {
    OverrideConflicts conflicts = OverrideConflicts.declared();
    assertEquals(EnumSet.of(W, H), conflicts.invalidatedBy(SIZE));
    assertEquals(EnumSet.of(BASIS, GROW, SHRINK), conflicts.invalidatedBy(FLEX));
    assertTrue(conflicts.invalidatedBy(FVN_NORMAL).contains(FVN_FRACTION));
    assertEquals(EnumSet.of(FVN_NORMAL), conflicts.invalidatedBy(FVN_FIGURE));
    assertTrue(conflicts.invalidatedBy(W).isEmpty());
  }

  @Test
  public void testBuilderAccumulates() {
    OverrideConflicts conflicts = OverrideConflicts.builder()
        .dominates(SIZE, W)
        .dominates(SIZE, H, MIN_W)
        .build();
    assertEquals(EnumSet.of(W, H, MIN_W), conflicts.invalidatedBy(SIZE));
  }
}
