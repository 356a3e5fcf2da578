package com.onkiup.linker.merge.matcher;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

public class TerminalMatcherTest {

  @Test
  public void testMatching() {
    TerminalMatcher matcher = new TerminalMatcher("sm", "lg");
    assertTrue(matcher.matches("sm"));
    assertFalse(matcher.matches("SM"));
    assertFalse(matcher.matches("s"));
    assertFalse(matcher.matches(null));
  }

  @Test
  public void testCollection() {
    TerminalMatcher matcher = new TerminalMatcher(Arrays.asList("red", "red"));
    assertTrue(matcher.matches(new StringBuilder("red")));
    assertEquals(1, matcher.terminals().size());
  }

  @Test
  public void testExtend() {
    TerminalMatcher matcher = new TerminalMatcher("a");
    assertSame(matcher, matcher.extend(Collections.emptyList()));
    TerminalMatcher extended = matcher.extend(Arrays.asList("b"));
    assertTrue(extended.matches("a"));
    assertTrue(extended.matches("b"));
    assertFalse(matcher.matches("b"));
    assertEquals(2, extended.terminals().size());
  }

  @Test
  public void testOr() {
    ValueMatcher matcher = new TerminalMatcher("auto").or(ValueShapes.NUMBER);
    assertTrue(matcher.matches("auto"));
    assertTrue(matcher.matches("1.5"));
    assertFalse(matcher.matches("full"));
  }
}
