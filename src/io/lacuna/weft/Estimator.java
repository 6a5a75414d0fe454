package io.lacuna.weft;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates and renormalizes the weights of an automaton in place. None of these operations change the states,
 * transitions, or alphabets of the automaton, only its weights.
 */
public class Estimator {

  private static final Logger LOG = LoggerFactory.getLogger(Estimator.class);

  private Estimator() {
  }

  /**
   * Walks each sequence through {@code m}, followed by the stop symbol, and sets every transition's weight to its
   * maximum-likelihood estimate: the number of times it was taken, divided by the number of times any transition
   * leaving the same state was taken. Transitions leaving states which were never left get a weight of 0.
   *
   * @throws UntrainableSequenceException if a sequence isn't accepted by {@code m}
   */
  public static <Q, A> void trainJoint(Automaton<Q, A> m, Iterable<? extends Iterable<A>> sequences) {
    reweight(m, count(m, sequences));
    normalizeJoint(m, 0);
  }

  /**
   * Walks each sequence through {@code m}, followed by the stop symbol, and sets every transition's weight to the
   * conditional probability of its output given its input, as with {@link #normalizeCond(Automaton, double)}.
   *
   * @param add the smoothing constant added to every count
   * @throws UntrainableSequenceException if a sequence isn't accepted by {@code m}
   */
  public static <Q, A> void trainCond(Automaton<Q, A> m, Iterable<? extends Iterable<A>> sequences, double add) {
    reweight(m, count(m, sequences));
    normalizeCond(m, add);
  }

  /**
   * Treats the current weights as scores, and rescales them so the weights leaving each state sum to 1.
   */
  public static <Q, A> void normalizeJoint(Automaton<Q, A> m) {
    normalizeJoint(m, 0);
  }

  /**
   * Rescales the weights leaving each state to {@code (w + add) / sum(w' + add)}, so that they sum to 1. States
   * whose smoothed total is zero are left unchanged.
   */
  public static <Q, A> void normalizeJoint(Automaton<Q, A> m, double add) {
    for (Q q : m.states()) {
      ISet<Transition<Q, A>> ts = m.outgoing(q);

      double z = 0;
      for (Transition<Q, A> t : ts) {
        z += m.weight(t) + add;
      }
      if (z == 0) {
        continue;
      }

      for (Transition<Q, A> t : ts) {
        m.reweightTransition(t, (m.weight(t) + add) / z);
      }
    }
  }

  /**
   * Rescales the weights leaving each state into conditional probabilities of the output given the input. Epsilon
   * transitions get {@code (w + add) / total}, and every other transition on input {@code a} gets
   * {@code (w + add) / mass(a) * (1 - mass(ε) / total)}, where {@code total} and {@code mass} are the smoothed
   * sums of weights leaving the state, overall and restricted to one input. Transitions whose smoothed weight is
   * zero are left unchanged.
   *
   * @param add the smoothing constant added to every weight
   */
  public static <Q, A> void normalizeCond(Automaton<Q, A> m, double add) {
    A epsilon = m.symbols().epsilon();

    for (Q q : m.states()) {
      IMap<A, ISet<Transition<Q, A>>> index = m.inputIndex(q);

      IMap<A, Double> mass = new LinearMap<>();
      double total = 0;
      for (IEntry<A, ISet<Transition<Q, A>>> e : index) {
        double sum = 0;
        for (Transition<Q, A> t : e.value()) {
          sum += m.weight(t) + add;
        }
        mass.put(e.key(), sum);
        total += sum;
      }

      double remaining = 1 - mass.get(epsilon, 0.0) / total;

      for (IEntry<A, ISet<Transition<Q, A>>> e : index) {
        boolean isEpsilon = epsilon.equals(e.key());
        double z = mass.get(e.key()).get();
        for (Transition<Q, A> t : e.value()) {
          double w = m.weight(t) + add;
          if (w == 0) {
            continue;
          }
          m.reweightTransition(t, isEpsilon ? w / total : w / z * remaining);
        }
      }
    }
  }

  ///

  private static <Q, A> void reweight(Automaton<Q, A> m, IMap<Transition<Q, A>, Double> counts) {
    for (Q q : m.states()) {
      for (Transition<Q, A> t : m.outgoing(q)) {
        m.reweightTransition(t, counts.get(t, 0.0));
      }
    }
  }

  private static <Q, A> IMap<Transition<Q, A>, Double> count(
          Automaton<Q, A> m,
          Iterable<? extends Iterable<A>> sequences) {

    Q init = m.requireStart();
    A stop = m.symbols().stop();

    IMap<Transition<Q, A>, Double> counts = new LinearMap<>();
    long n = 0;

    for (Iterable<A> sequence : sequences) {
      IList<A> symbols = new LinearList<>();
      sequence.forEach(symbols::addLast);
      symbols.addLast(stop);

      Q q = init;
      for (long i = 0; i < symbols.size(); i++) {
        ISet<Transition<Q, A>> ts = m.transitions(q, symbols.nth(i));
        if (ts.size() == 0) {
          throw new UntrainableSequenceException(symbols, i, q);
        }

        Transition<Q, A> t = ts.iterator().next();
        counts.put(t, counts.get(t, 0.0) + 1);
        q = t.to();
      }
      n++;
    }

    LOG.debug("counted {} transitions over {} sequences", counts.size(), n);

    return counts;
  }
}
