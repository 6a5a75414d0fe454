package io.lacuna.weft;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composition of transducers, feeding the output of the left operand into the input of the right one.
 * <p>
 * The product is built breadth-first from the pair of start states, so only reachable pairs are explored. For
 * states {@code q1} and {@code q2}:
 * <ul>
 *   <li>{@code (q1,a,b,r1)} and {@code (q2,b,c,r2)}, for {@code b} other than epsilon, give
 *   {@code ((q1,q2),a,c,(r1,r2))} weighted by the product of both weights</li>
 *   <li>{@code (q1,a,ε,r1)} gives {@code ((q1,q2),a,ε,(r1,q2))}, the left operand deleting</li>
 *   <li>{@code (q2,ε,c,r2)} gives {@code ((q1,q2),ε,c,(q1,r2))}, the right operand inserting</li>
 * </ul>
 * A left operand that deletes can't be composed with a right operand that inserts, since the interleaving of
 * those steps is undetermined; doing so throws {@link AmbiguousCompositionException}.
 */
public class Composition {

  private static final Logger LOG = LoggerFactory.getLogger(Composition.class);

  private enum Driver {
    LEFT,
    RIGHT,
    SMALLER
  }

  private Composition() {
  }

  /**
   * @return the composition of {@code m1} and {@code m2}, matching symbols from whichever side has fewer distinct
   * symbols at each state
   */
  public static <Q1, Q2, A> ComposedAutomaton<Q1, Q2, A> compose(Automaton<Q1, A> m1, Automaton<Q2, A> m2) {
    return compose(m1, m2, Driver.SMALLER);
  }

  /**
   * @return the composition of {@code m1} and {@code m2}, enumerated from the symbols {@code m1} produces, which is
   * cheaper when {@code m1} is the smaller operand
   */
  public static <Q1, Q2, A> ComposedAutomaton<Q1, Q2, A> composeByInput(Automaton<Q1, A> m1, Automaton<Q2, A> m2) {
    return compose(m1, m2, Driver.LEFT);
  }

  /**
   * @return the composition of {@code m1} and {@code m2}, enumerated from the symbols {@code m2} consumes, which is
   * cheaper when {@code m2} is the smaller operand
   */
  public static <Q1, Q2, A> ComposedAutomaton<Q1, Q2, A> composeByOutput(Automaton<Q1, A> m1, Automaton<Q2, A> m2) {
    return compose(m1, m2, Driver.RIGHT);
  }

  ///

  private static <Q1, Q2, A> ComposedAutomaton<Q1, Q2, A> compose(
          Automaton<Q1, A> m1,
          Automaton<Q2, A> m2,
          Driver driver) {

    if (!m1.symbols().equals(m2.symbols())) {
      throw new PreconditionException("can't compose automata with different reserved symbols: "
              + m1.symbols() + " and " + m2.symbols());
    }

    Symbols<A> symbols = m1.symbols();
    A epsilon = symbols.epsilon();

    StatePair<Q1, Q2> init = StatePair.of(m1.requireStart(), m2.requireStart());
    StatePair<Q1, Q2> accept = StatePair.of(m1.requireAccept(), m2.requireAccept());

    ComposedAutomaton<Q1, Q2, A> m = new ComposedAutomaton<>(symbols);
    m.setStart(init);

    LinearList<StatePair<Q1, Q2>> queue = LinearList.of(init);
    LinearSet<StatePair<Q1, Q2>> seen = LinearSet.of(init);

    while (queue.size() > 0) {
      StatePair<Q1, Q2> q = queue.popFirst();
      Q1 q1 = q.left();
      Q2 q2 = q.right();

      IMap<A, ISet<Transition<Q1, A>>> produced = m1.outputIndex(q1);
      IMap<A, ISet<Transition<Q2, A>>> consumed = m2.inputIndex(q2);

      boolean leftDriven = driver == Driver.LEFT
              || (driver == Driver.SMALLER && produced.size() <= consumed.size());

      ISet<A> shared = leftDriven ? produced.keys() : consumed.keys();
      for (A b : shared) {
        if (symbols.isEpsilon(b)) {
          continue;
        }

        ISet<Transition<Q1, A>> ts1 = produced.get(b, (ISet<Transition<Q1, A>>) Sets.EMPTY);
        ISet<Transition<Q2, A>> ts2 = consumed.get(b, (ISet<Transition<Q2, A>>) Sets.EMPTY);
        for (Transition<Q1, A> t1 : ts1) {
          for (Transition<Q2, A> t2 : ts2) {
            Transition<StatePair<Q1, Q2>, A> t =
                    new Transition<>(q, t1.input(), t2.output(), StatePair.of(t1.to(), t2.to()));
            add(m, t, m1.weight(t1) * m2.weight(t2), new Origin<>(t1, t2), queue, seen);
          }
        }
      }

      for (Transition<Q1, A> t1 : produced.get(epsilon, (ISet<Transition<Q1, A>>) Sets.EMPTY)) {
        m.deletions = true;
        Transition<StatePair<Q1, Q2>, A> t = new Transition<>(q, t1.input(), epsilon, StatePair.of(t1.to(), q2));
        add(m, t, m1.weight(t1), new Origin<>(t1, null), queue, seen);
      }

      for (Transition<Q2, A> t2 : consumed.get(epsilon, (ISet<Transition<Q2, A>>) Sets.EMPTY)) {
        m.insertions = true;
        Transition<StatePair<Q1, Q2>, A> t = new Transition<>(q, epsilon, t2.output(), StatePair.of(q1, t2.to()));
        add(m, t, m2.weight(t2), new Origin<>(null, t2), queue, seen);
      }

      if (m.deletions && m.insertions) {
        throw new AmbiguousCompositionException();
      }
    }

    m.setAccept(accept);

    if (LOG.isDebugEnabled()) {
      LOG.debug("composed {} and {} into {}", m1, m2, m);
    }

    return m;
  }

  private static <Q1, Q2, A> void add(
          ComposedAutomaton<Q1, Q2, A> m,
          Transition<StatePair<Q1, Q2>, A> t,
          double weight,
          Origin<Q1, Q2, A> origin,
          LinearList<StatePair<Q1, Q2>> queue,
          LinearSet<StatePair<Q1, Q2>> seen) {

    m.addTransition(t, weight, origin);
    if (!seen.contains(t.to())) {
      seen.add(t.to());
      queue.addLast(t.to());
    }
  }
}
