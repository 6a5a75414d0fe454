package io.lacuna.weft;

import java.util.Objects;

/**
 * A transition of a transducer.
 * <pre>
 *        a:b
 *     q -----> r
 * </pre>
 * Equality and hashing are defined over the four fields only. Weights are kept by the owning
 * {@link Automaton}, so replacing a weight never changes a transition's identity.
 *
 * @param <Q> the state type
 * @param <A> the symbol type
 */
public final class Transition<Q, A> {

  private final Q from, to;
  private final A input, output;
  private final int hash;

  public Transition(Q from, A input, A output, Q to) {
    this.from = Objects.requireNonNull(from, "from");
    this.input = Objects.requireNonNull(input, "input");
    this.output = Objects.requireNonNull(output, "output");
    this.to = Objects.requireNonNull(to, "to");
    this.hash = Objects.hash(from, input, output, to);
  }

  public Q from() {
    return from;
  }

  public A input() {
    return input;
  }

  public A output() {
    return output;
  }

  public Q to() {
    return to;
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (obj instanceof Transition) {
      Transition<?, ?> t = (Transition<?, ?>) obj;
      return hash == t.hash
              && from.equals(t.from)
              && input.equals(t.input)
              && output.equals(t.output)
              && to.equals(t.to);
    }
    return false;
  }

  @Override
  public String toString() {
    return from + " -[" + input + ":" + output + "]-> " + to;
  }
}
