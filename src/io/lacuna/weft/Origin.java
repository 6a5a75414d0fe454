package io.lacuna.weft;

import java.util.Objects;

/**
 * One way in which a composed transition arises from the operands of a composition. Either side may be absent,
 * meaning that operand stayed in place while the other one moved, but never both.
 *
 * @param <Q1> the state type of the left operand
 * @param <Q2> the state type of the right operand
 * @param <A> the symbol type
 */
public final class Origin<Q1, Q2, A> {

  private final Transition<Q1, A> left;
  private final Transition<Q2, A> right;

  Origin(Transition<Q1, A> left, Transition<Q2, A> right) {
    if (left == null && right == null) {
      throw new IllegalArgumentException("an origin needs at least one transition");
    }
    this.left = left;
    this.right = right;
  }

  /**
   * @return the transition taken by the left operand, or {@code null} if it didn't move
   */
  public Transition<Q1, A> left() {
    return left;
  }

  /**
   * @return the transition taken by the right operand, or {@code null} if it didn't move
   */
  public Transition<Q2, A> right() {
    return right;
  }

  public boolean hasLeft() {
    return left != null;
  }

  public boolean hasRight() {
    return right != null;
  }

  @Override
  public int hashCode() {
    return Objects.hash(left, right);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (obj instanceof Origin) {
      Origin<?, ?, ?> o = (Origin<?, ?, ?>) obj;
      return Objects.equals(left, o.left) && Objects.equals(right, o.right);
    }
    return false;
  }

  @Override
  public String toString() {
    return "origin[" + left + ", " + right + "]";
  }
}
