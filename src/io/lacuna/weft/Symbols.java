package io.lacuna.weft;

import java.util.Objects;

/**
 * The reserved symbols of an automaton.
 *
 * @param <A> the symbol type
 */
public class Symbols<A> {

  private static final Symbols<String> STRINGS = new Symbols<>("ε", "</s>", "<s>");

  private final A epsilon, stop, begin;

  /**
   * @param epsilon the symbol denoting that nothing is consumed or produced
   * @param stop the symbol which ends every sequence
   * @param begin the symbol used to pad n-gram histories before the first real symbol
   */
  public Symbols(A epsilon, A stop, A begin) {
    if (epsilon == null || stop == null || begin == null) {
      throw new NullPointerException("reserved symbols cannot be null");
    }
    if (epsilon.equals(stop) || epsilon.equals(begin) || stop.equals(begin)) {
      throw new IllegalArgumentException("reserved symbols must be distinct");
    }
    this.epsilon = epsilon;
    this.stop = stop;
    this.begin = begin;
  }

  /**
   * @return the default markers for string symbols: {@code ε}, {@code </s>} and {@code <s>}
   */
  public static Symbols<String> strings() {
    return STRINGS;
  }

  public A epsilon() {
    return epsilon;
  }

  public A stop() {
    return stop;
  }

  public A begin() {
    return begin;
  }

  public boolean isEpsilon(A symbol) {
    return epsilon.equals(symbol);
  }

  public boolean isReserved(A symbol) {
    return epsilon.equals(symbol) || stop.equals(symbol) || begin.equals(symbol);
  }

  @Override
  public int hashCode() {
    return Objects.hash(epsilon, stop, begin);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (obj instanceof Symbols) {
      Symbols<?> s = (Symbols<?>) obj;
      return epsilon.equals(s.epsilon) && stop.equals(s.stop) && begin.equals(s.begin);
    }
    return false;
  }

  @Override
  public String toString() {
    return "symbols[" + epsilon + ", " + stop + ", " + begin + "]";
  }
}
