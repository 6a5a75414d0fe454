package io.lacuna.weft;

import io.lacuna.bifurcan.*;
import org.junit.Test;

import static org.junit.Assert.*;

public class UtilsTest {

  private static final double DELTA = 1e-12;

  @Test
  public void testLogAddExp() {
    assertEquals(Math.log(0.3), Utils.logAddExp(Math.log(0.1), Math.log(0.2)), DELTA);
    assertEquals(Math.log(0.3), Utils.logAddExp(Math.log(0.2), Math.log(0.1)), DELTA);
    assertEquals(1000 + Math.log(2), Utils.logAddExp(1000, 1000), DELTA);
    assertEquals(-5.0, Utils.logAddExp(Double.NEGATIVE_INFINITY, -5.0), DELTA);
    assertEquals(Double.NEGATIVE_INFINITY,
            Utils.logAddExp(Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY), 0);
  }

  @Test
  public void testSemirings() {
    assertEquals(6.0, Semiring.PRODUCT.times(2, 3), DELTA);
    assertEquals(5.0, Semiring.PRODUCT.plus(2, 3), DELTA);
    assertEquals(5.0, Semiring.LOG.times(2, 3), DELTA);
    assertEquals(Math.log(5), Semiring.LOG.plus(Math.log(2), Math.log(3)), DELTA);
    assertEquals(7.0, Semiring.LOG.plus(Semiring.LOG.zero(), 7.0), DELTA);
    assertEquals(7.0, Semiring.PRODUCT.times(Semiring.PRODUCT.one(), 7.0), DELTA);
  }

  @Test
  public void testReverse() {
    assertEquals(LinearList.of(3, 2, 1), Utils.reverse(LinearList.of(1, 2, 3)));
    assertEquals(0, Utils.reverse(new LinearList<Integer>()).size());
  }

  @Test
  public void testGroupBy() {
    IMap<Integer, IList<String>> groups = Utils.groupBy(LinearList.of("a", "bb", "c", "dd", "eee"), String::length);
    assertEquals(LinearList.of("a", "c"), groups.get(1).get());
    assertEquals(LinearList.of("bb", "dd"), groups.get(2).get());
    assertEquals(LinearList.of("eee"), groups.get(3).get());
  }
}
