package com.onkiup.linker.merge.token;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

public class ParsedTokenTest {

  private static ParsedToken token(String raw, String base, String... variants) {
    return new ParsedToken(raw, "", Arrays.asList(variants), base, false, false, null, null, null, false, false);
  }

  @Test
  public void testVariantKey() {
    assertEquals(ParsedToken.variantKey(Arrays.asList("focus", "hover")),
        ParsedToken.variantKey(Arrays.asList("hover", "focus")));
    assertEquals(2, ParsedToken.variantKey(Arrays.asList("hover", "hover")).count("hover"));
    assertTrue(ParsedToken.variantKey(Collections.emptyList()).isEmpty());
  }

  @Test
  public void testSameScope() {
    assertTrue(token("a", "a", "hover", "md").sameScope(token("b", "b", "md", "hover")));
    assertFalse(token("a", "a", "hover").sameScope(token("b", "b")));
    assertFalse(token("a", "a", "hover").sameScope(token("b", "b", "hover", "hover")));
    assertFalse(token("a", "a", "x|y").sameScope(token("b", "b", "x", "y")));
    assertFalse(token("a", "a", "x,y").sameScope(token("b", "b", "x", "y")));
  }

  @Test
  public void testWithBase() {
    ParsedToken original = new ParsedToken("hover:!-p-[3px]/50", "tw-", Arrays.asList("hover"), "p", true, true,
        "50", "3px", null, false, false);
    ParsedToken copy = original.withBase("px");

    assertFalse(copy.raw().isPresent());
    assertEquals("px", copy.base());
    assertEquals("tw-", copy.classPrefix());
    assertEquals(original.variants(), copy.variants());
    assertTrue(copy.important());
    assertTrue(copy.negative());
    assertEquals("50", copy.modifier().get());
    assertEquals("3px", copy.arbitraryValue().get());
    assertFalse(copy.remove());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testExclusivePayloads() {
    new ParsedToken("x", "", Collections.emptyList(), "x", false, false, null, "a", "b", false, false);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testExclusiveRemovals() {
    new ParsedToken("x", "", Collections.emptyList(), "x", false, false, null, null, null, true, true);
  }

  @Test
  public void testEquality() {
    assertEquals(token("p-4", "p-4", "hover"), token("p-4", "p-4", "hover"));
    assertEquals(token("p-4", "p-4", "hover").hashCode(), token("p-4", "p-4", "hover").hashCode());
    assertNotEquals(token("p-4", "p-4", "hover"), token("p-4", "p-4", "focus"));
  }

  @Test
  public void testVariantsAreImmutable() {
    ParsedToken token = token("a", "a", "hover");
    try {
      token.variants().add("focus");
      fail("Variants should be read-only");
    } catch (UnsupportedOperationException e) {
      assertEquals(1, token.variants().size());
    }
  }
}
