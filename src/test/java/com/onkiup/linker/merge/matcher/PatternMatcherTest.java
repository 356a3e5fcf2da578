package com.onkiup.linker.merge.matcher;

import static org.junit.Assert.*;

import org.junit.Test;

public class PatternMatcherTest {

  @Test
  public void testFullMatch() {
    PatternMatcher matcher = new PatternMatcher("\\d+px");
    assertTrue(matcher.matches("12px"));
    assertFalse(matcher.matches("12px solid"));
    assertFalse(matcher.matches(null));
  }

  @Test
  public void testValueShapes() {
    assertTrue(ValueShapes.NUMBER.matches("2"));
    assertTrue(ValueShapes.NUMBER.matches("-0.5"));
    assertFalse(ValueShapes.NUMBER.matches("px"));
    assertTrue(ValueShapes.LENGTH.matches("3px"));
    assertTrue(ValueShapes.LENGTH.matches(".5rem"));
    assertTrue(ValueShapes.LENGTH.matches("100%"));
    assertTrue(ValueShapes.LENGTH.matches("4"));
    assertFalse(ValueShapes.LENGTH.matches("#fff"));
    assertTrue(ValueShapes.TSHIRT_SIZE.matches("2xl"));
    assertFalse(ValueShapes.TSHIRT_SIZE.matches("10xl"));
  }
}
