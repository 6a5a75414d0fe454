package io.lacuna.weft;

import io.lacuna.bifurcan.*;

import java.util.function.ToDoubleFunction;

/**
 * The result of a {@link Composition}. Every transition also records its provenance, the list of operand
 * transitions which justify it.
 *
 * @param <Q1> the state type of the left operand
 * @param <Q2> the state type of the right operand
 * @param <A> the symbol type
 */
public class ComposedAutomaton<Q1, Q2, A> extends Automaton<StatePair<Q1, Q2>, A> {

  private final IMap<Transition<StatePair<Q1, Q2>, A>, IList<Origin<Q1, Q2, A>>> provenance = new LinearMap<>();

  boolean deletions, insertions;

  ComposedAutomaton(Symbols<A> symbols) {
    super(symbols);
  }

  void addTransition(Transition<StatePair<Q1, Q2>, A> t, double weight, Origin<Q1, Q2, A> origin) {
    super.addTransition(t, weight);
    provenance.getOrCreate(t, LinearList::new).addLast(origin);
  }

  /**
   * Always throws, since a composed transition can only be added along with the operand transitions it came from.
   * Existing transitions can still be reweighted.
   *
   * @throws PreconditionException always
   */
  @Override
  public ComposedAutomaton<Q1, Q2, A> addTransition(Transition<StatePair<Q1, Q2>, A> t, double delta) {
    throw new PreconditionException("can't add " + t + " to a composed automaton without its provenance");
  }

  /**
   * @return every pair of operand transitions which give rise to {@code t}, in the order they were found, or an
   * empty list if {@code t} isn't a transition of this automaton
   */
  public IList<Origin<Q1, Q2, A>> provenance(Transition<StatePair<Q1, Q2>, A> t) {
    IList<Origin<Q1, Q2, A>> origins = provenance.get(t, null);
    return origins == null ? new LinearList<>() : origins.forked();
  }

  /**
   * @return true if the left operand emitted epsilon somewhere in the reachable product
   */
  public boolean hasDeletions() {
    return deletions;
  }

  /**
   * @return true if the right operand consumed epsilon somewhere in the reachable product
   */
  public boolean hasInsertions() {
    return insertions;
  }

  /**
   * Combines per-transition values of the two operands into values over this automaton, computed on demand. For
   * each transition, every origin contributes {@code times(v1(t1), v2(t2))}, with a missing side contributing
   * {@code one()}, and the contributions are folded together with {@code plus}, starting from {@code zero()}.
   *
   * @param v1 values of the left operand's transitions
   * @param v2 values of the right operand's transitions
   * @param semiring how values are combined, {@link Semiring#LOG} if they are log-values
   * @return a function from this automaton's transitions to their combined values
   */
  public ToDoubleFunction<Transition<StatePair<Q1, Q2>, A>> values(
          ToDoubleFunction<Transition<Q1, A>> v1,
          ToDoubleFunction<Transition<Q2, A>> v2,
          Semiring semiring) {

    return t -> {
      double v = semiring.zero();
      for (Origin<Q1, Q2, A> o : provenance(t)) {
        double left = o.hasLeft() ? v1.applyAsDouble(o.left()) : semiring.one();
        double right = o.hasRight() ? v2.applyAsDouble(o.right()) : semiring.one();
        v = semiring.plus(v, semiring.times(left, right));
      }
      return v;
    };
  }
}
