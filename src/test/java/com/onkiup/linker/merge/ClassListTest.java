package com.onkiup.linker.merge;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

public class ClassListTest {

  @Test
  public void testStrings() {
    assertEquals(Arrays.asList("p-4", "m-2", "hover:p-2"), ClassList.flatten("p-4  m-2", "hover:p-2"));
    assertEquals("p-4 m-2", ClassList.join(" p-4\tm-2 "));
  }

  @Test
  public void testConditionals() {
    Map<String, Object> conditions = new LinkedHashMap<>();
    conditions.put("a", true);
    conditions.put("b", false);
    conditions.put("c", null);
    conditions.put("d", 1);
    conditions.put("e f", "yes");
    assertEquals(Arrays.asList("a", "d", "e", "f"), ClassList.flatten(conditions));
  }

  @Test
  public void testNested() {
    Object[] inputs = {"a", new String[] {"b", "c"}, Arrays.asList("d", Arrays.asList("e"), null), null, false, true};
    assertEquals(Arrays.asList("a", "b", "c", "d", "e"), ClassList.flatten(inputs));
  }

  @Test
  public void testEmpty() {
    assertEquals(Collections.emptyList(), ClassList.flatten());
    assertEquals("", ClassList.join((Object) null));
  }

  @Test
  public void testOtherObjects() {
    assertEquals(Arrays.asList("z-10"), ClassList.flatten(new StringBuilder("z-10")));
    assertEquals(Arrays.asList("42"), ClassList.flatten(42));
  }
}
