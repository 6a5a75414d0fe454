package io.lacuna.weft;

import io.lacuna.bifurcan.*;

import java.util.function.Function;

public class Utils {

  /**
   * @return {@code log(exp(x) + exp(y))}, computed without overflow or underflow
   */
  public static double logAddExp(double x, double y) {
    if (x < y) {
      double tmp = x;
      x = y;
      y = tmp;
    }
    if (x == Double.NEGATIVE_INFINITY) {
      return x;
    }
    return x + Math.log1p(Math.exp(y - x));
  }

  public static <V> LinearList<V> reverse(IList<V> list) {
    LinearList<V> result = new LinearList<>();
    for (long i = list.size() - 1; i >= 0; i--) {
      result.addLast(list.nth(i));
    }
    return result;
  }

  public static <K, V> IMap<K, IList<V>> groupBy(Iterable<V> vals, Function<V, K> f) {
    LinearMap<K, IList<V>> m = new LinearMap<>();
    vals.forEach(v -> m.getOrCreate(f.apply(v), LinearList::new).addLast(v));
    return m;
  }
}
