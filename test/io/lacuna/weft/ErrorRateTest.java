package io.lacuna.weft;

import io.lacuna.bifurcan.*;
import org.junit.Test;

import static org.junit.Assert.*;

public class ErrorRateTest {

  @Test
  public void testDistance() {
    assertEquals(3, ErrorRate.distance("kitten", "sitting"));
    assertEquals(3, ErrorRate.distance("", "abc"));
    assertEquals(3, ErrorRate.distance("abc", ""));
    assertEquals(0, ErrorRate.distance("abc", "abc"));
    assertEquals(1, ErrorRate.distance("abc", "abd"));
  }

  @Test
  public void testDistanceOverSymbols() {
    assertEquals(1, ErrorRate.distance(LinearList.of("the", "cat", "sat"), LinearList.of("the", "sat")));
  }

  @Test
  public void testRate() {
    double rate = ErrorRate.rate(LinearList.of("kitten", "abc"), LinearList.of("sitting", "abc"));
    assertEquals(3.0 / 9, rate, 1e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRateRequiresAlignedInputs() {
    ErrorRate.rate(LinearList.of("a", "b"), LinearList.of("a"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRateRequiresReferences() {
    ErrorRate.rate(LinearList.of(""), LinearList.of("abc"));
  }
}
