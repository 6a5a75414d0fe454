package io.lacuna.weft;

import java.util.Objects;

/**
 * A state of a {@link ComposedAutomaton}, pairing a state of each operand.
 *
 * @param <Q1> the state type of the left operand
 * @param <Q2> the state type of the right operand
 */
public final class StatePair<Q1, Q2> {

  private final Q1 left;
  private final Q2 right;

  private StatePair(Q1 left, Q2 right) {
    this.left = left;
    this.right = right;
  }

  public static <Q1, Q2> StatePair<Q1, Q2> of(Q1 left, Q2 right) {
    return new StatePair<>(Objects.requireNonNull(left), Objects.requireNonNull(right));
  }

  public Q1 left() {
    return left;
  }

  public Q2 right() {
    return right;
  }

  @Override
  public int hashCode() {
    return 31 * left.hashCode() + right.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (obj instanceof StatePair) {
      StatePair<?, ?> p = (StatePair<?, ?>) obj;
      return left.equals(p.left) && right.equals(p.right);
    }
    return false;
  }

  @Override
  public String toString() {
    return "(" + left + ", " + right + ")";
  }
}
