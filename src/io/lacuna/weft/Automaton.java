package io.lacuna.weft;

import io.lacuna.bifurcan.*;

import java.util.function.ToDoubleFunction;

/**
 * A weighted finite-state transducer with a single start state and a single accept state.
 * <p>
 * Transitions are indexed four ways: outgoing and incoming by state, and outgoing by input and by output symbol.
 * Weights live in a side table keyed by transition identity. Transitions are never removed, and an automaton is
 * meant to be mutated by one caller at a time. Queries return forked views, which reflect later changes to the
 * automaton but can't be used to change it.
 *
 * @param <Q> the state type
 * @param <A> the symbol type
 */
public class Automaton<Q, A> {

  private final Symbols<A> symbols;

  private final LinearSet<Q> states = new LinearSet<>();
  private final LinearSet<A> inputAlphabet = new LinearSet<>();
  private final LinearSet<A> outputAlphabet = new LinearSet<>();

  private final IMap<Q, ISet<Transition<Q, A>>> outgoing = new LinearMap<>();
  private final IMap<Q, ISet<Transition<Q, A>>> incoming = new LinearMap<>();
  private final IMap<Q, IMap<A, ISet<Transition<Q, A>>>> byInput = new LinearMap<>();
  private final IMap<Q, IMap<A, ISet<Transition<Q, A>>>> byOutput = new LinearMap<>();

  private final LinearMap<Transition<Q, A>, Double> weights = new LinearMap<>();

  private Q start, accept;

  public Automaton(Symbols<A> symbols) {
    if (symbols == null) {
      throw new NullPointerException("symbols");
    }
    this.symbols = symbols;
  }

  /**
   * @return an empty automaton over strings, using {@link Symbols#strings()}
   */
  public static <Q> Automaton<Q, String> create() {
    return new Automaton<>(Symbols.strings());
  }

  /// construction

  public Automaton<Q, A> addState(Q q) {
    if (q == null) {
      throw new NullPointerException("states cannot be null");
    }
    states.add(q);
    return this;
  }

  /**
   * Sets the start state, adding it if it isn't already a state.
   */
  public Automaton<Q, A> setStart(Q q) {
    addState(q);
    start = q;
    return this;
  }

  /**
   * Sets the accept state, adding it if it isn't already a state.
   */
  public Automaton<Q, A> setAccept(Q q) {
    addState(q);
    accept = q;
    return this;
  }

  /**
   * Adds {@code t} with a weight of 1, or increments its weight by 1 if it's already present.
   */
  public Automaton<Q, A> addTransition(Transition<Q, A> t) {
    return addTransition(t, 1.0);
  }

  /**
   * Adds {@code t}, or increments its weight by {@code delta} if it's already present. The endpoints and symbols of
   * a new transition are added to the states and alphabets.
   */
  public Automaton<Q, A> addTransition(Transition<Q, A> t, double delta) {
    if (!weights.contains(t)) {
      addState(t.from());
      addState(t.to());
      inputAlphabet.add(t.input());
      outputAlphabet.add(t.output());

      outgoing.getOrCreate(t.from(), LinearSet::new).add(t);
      incoming.getOrCreate(t.to(), LinearSet::new).add(t);
      byInput.getOrCreate(t.from(), LinearMap::new).getOrCreate(t.input(), LinearSet::new).add(t);
      byOutput.getOrCreate(t.from(), LinearMap::new).getOrCreate(t.output(), LinearSet::new).add(t);
    }
    weights.put(t, weights.get(t, 0.0) + delta);
    return this;
  }

  /**
   * Replaces the weight of {@code t}, which must already be a transition of this automaton.
   */
  public Automaton<Q, A> reweightTransition(Transition<Q, A> t, double weight) {
    if (!weights.contains(t)) {
      throw new PreconditionException("can't reweight " + t + ", it isn't a transition of this automaton");
    }
    weights.put(t, weight);
    return this;
  }

  /// queries

  public Symbols<A> symbols() {
    return symbols;
  }

  /**
   * @return the start state, or {@code null} if it hasn't been set
   */
  public Q start() {
    return start;
  }

  /**
   * @return the accept state, or {@code null} if it hasn't been set
   */
  public Q accept() {
    return accept;
  }

  public ISet<Q> states() {
    return states.forked();
  }

  public ISet<A> inputAlphabet() {
    return inputAlphabet.forked();
  }

  public ISet<A> outputAlphabet() {
    return outputAlphabet.forked();
  }

  /**
   * @return every transition, in the order they were first added
   */
  public ISet<Transition<Q, A>> transitions() {
    return weights.keys().forked();
  }

  public boolean contains(Transition<Q, A> t) {
    return weights.contains(t);
  }

  /**
   * @return the transitions leaving {@code q} which consume {@code a}
   */
  public ISet<Transition<Q, A>> transitions(Q q, A a) {
    return lookup(byInput, q, a);
  }

  /**
   * @return the transitions leaving {@code q} which produce {@code b}
   */
  public ISet<Transition<Q, A>> transitionsOnOutput(Q q, A b) {
    return lookup(byOutput, q, b);
  }

  public ISet<Transition<Q, A>> outgoing(Q q) {
    return outgoing.get(q, (ISet<Transition<Q, A>>) Sets.EMPTY).forked();
  }

  public ISet<Transition<Q, A>> incoming(Q q) {
    return incoming.get(q, (ISet<Transition<Q, A>>) Sets.EMPTY).forked();
  }

  /**
   * @return the transitions leaving {@code q}, grouped by input symbol, as a copy whose values are forked views
   */
  public IMap<A, ISet<Transition<Q, A>>> inputIndex(Q q) {
    return index(byInput, q);
  }

  /**
   * @return the transitions leaving {@code q}, grouped by output symbol, as a copy whose values are forked views
   */
  public IMap<A, ISet<Transition<Q, A>>> outputIndex(Q q) {
    return index(byOutput, q);
  }

  /**
   * @return the weight of {@code t}, or 0 if it isn't a transition of this automaton
   */
  public double weight(Transition<Q, A> t) {
    return weights.get(t, 0.0);
  }

  /**
   * @return a function from transitions to their current weights
   */
  public ToDoubleFunction<Transition<Q, A>> weights() {
    return this::weight;
  }

  ///

  Q requireStart() {
    if (start == null) {
      throw new PreconditionException("start state has not been set");
    }
    return start;
  }

  Q requireAccept() {
    if (accept == null) {
      throw new PreconditionException("accept state has not been set");
    }
    return accept;
  }

  private IMap<A, ISet<Transition<Q, A>>> index(IMap<Q, IMap<A, ISet<Transition<Q, A>>>> m, Q q) {
    IMap<A, ISet<Transition<Q, A>>> result = new LinearMap<>();
    IMap<A, ISet<Transition<Q, A>>> index = m.get(q, null);
    if (index != null) {
      for (IEntry<A, ISet<Transition<Q, A>>> e : index) {
        result.put(e.key(), e.value().forked());
      }
    }
    return result;
  }

  private ISet<Transition<Q, A>> lookup(IMap<Q, IMap<A, ISet<Transition<Q, A>>>> m, Q q, A a) {
    IMap<A, ISet<Transition<Q, A>>> index = m.get(q, null);
    if (index == null) {
      return (ISet<Transition<Q, A>>) Sets.EMPTY;
    }
    return index.get(a, (ISet<Transition<Q, A>>) Sets.EMPTY).forked();
  }

  @Override
  public String toString() {
    return "automaton[states=" + states.size() + ", transitions=" + weights.size()
            + ", start=" + start + ", accept=" + accept + "]";
  }
}
