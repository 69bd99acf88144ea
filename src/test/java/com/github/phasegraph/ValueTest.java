package com.github.phasegraph;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

/**
 * Tests to maintain the sanity of the scalar value domain.
 */
public class ValueTest {

  @Test
  public void testVariants() {
    assertEquals(Value.Type.INT64, Value.of(42L).getType());
    assertEquals(Value.Type.FLOAT64, Value.of(42.0).getType());
    assertEquals(Value.Type.BOOL, Value.of(true).getType());
    assertEquals(Value.Type.STRING, Value.of("42").getType());

    assertEquals(42L, Value.of(42L).asLong());
    assertEquals(42.5, Value.of(42.5).asDouble(), 0.0);
    assertTrue(Value.of(true).asBoolean());
    assertEquals("hello", Value.of("hello").asString());
  }

  @Test
  public void testTruthiness() {
    assertFalse(Value.of(0L).isTruthy());
    assertFalse(Value.of(0.0).isTruthy());
    assertFalse(Value.of(-0.0).isTruthy());
    assertFalse(Value.of("").isTruthy());
    assertFalse(Value.of(false).isTruthy());

    assertTrue(Value.of(-1L).isTruthy());
    assertTrue(Value.of(0.001).isTruthy());
    assertTrue(Value.of(" ").isTruthy());
    assertTrue(Value.of(true).isTruthy());
  }

  @Test
  public void testNumericPromotion() {
    assertTrue(Value.of(7L).isNumeric());
    assertTrue(Value.of(7.5).isNumeric());
    assertFalse(Value.of(true).isNumeric());
    assertFalse(Value.of("7").isNumeric());
    assertEquals(7.0, Value.of(7L).toDouble(), 0.0);
    assertEquals(7.5, Value.of(7.5).toDouble(), 0.0);
  }

  @Test(expected = IllegalStateException.class)
  public void testNonNumericPromotionIsRejected() {
    Value.of("7").toDouble();
  }

  @Test(expected = IllegalStateException.class)
  public void testWrongAccessorIsRejected() {
    Value.of(7L).asDouble();
  }

  @Test
  public void testStrictEquality() {
    assertEquals(Value.of(3L), Value.of(3L));
    assertEquals(Value.of(3L).hashCode(), Value.of(3L).hashCode());
    assertEquals(Value.of("a"), Value.of("a"));
    // strict equality never crosses variants, comparisons do their own promotion
    assertNotEquals(Value.of(3L), Value.of(3.0));
    assertNotEquals(Value.of(1L), Value.of(true));
    assertNotEquals(Value.of("true"), Value.of(true));
  }

  @Test
  public void testRendering() {
    assertEquals("42", Value.of(42L).toString());
    assertEquals("2.5", Value.of(2.5).toString());
    assertEquals("false", Value.of(false).toString());
    assertEquals("\"text\"", Value.of("text").toString());
  }

}
