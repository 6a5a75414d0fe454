package io.lacuna.weft;

import io.lacuna.bifurcan.*;

/**
 * Builds an automaton which follows a single chain of states {@code 0, 1, 2, ...}, ending with the stop symbol.
 * Also the home of the other ways of constructing base automata.
 *
 * @param <A> the symbol type
 */
public class AutomatonBuilder<A> {

  private final Automaton<Integer, A> automaton;
  private int last = 0;
  private boolean built = false;

  public AutomatonBuilder(Symbols<A> symbols) {
    automaton = new Automaton<>(symbols);
    automaton.setStart(last);
  }

  /// combinators

  /**
   * @return the acceptor of {@code sequence}, mapping it to itself, with every transition weighted 1
   */
  public static <A> Automaton<Integer, A> string(Symbols<A> symbols, Iterable<A> sequence) {
    AutomatonBuilder<A> builder = new AutomatonBuilder<>(symbols);
    sequence.forEach(builder::match);
    return builder.build();
  }

  /**
   * @return the acceptor of the characters of {@code s}, using {@link Symbols#strings()}
   */
  public static Automaton<Integer, String> string(String s) {
    AutomatonBuilder<String> builder = new AutomatonBuilder<>(Symbols.strings());
    s.codePoints().forEach(c -> builder.match(new String(Character.toChars(c))));
    return builder.build();
  }

  /**
   * Builds the skeleton of an n-gram model, to be trained with {@link Estimator}. Each state is the list of the
   * last {@code n - 1} symbols seen, padded with the begin symbol at the start of a sequence. Every vocabulary
   * symbol leads from a history to the history shifted by that symbol, and the stop symbol leads from every history
   * to the accept state {@code [stop]}. All weights start at 0.
   *
   * @param n the order of the model, at least 1
   * @param vocabulary the symbols of the model, not including any reserved symbol
   */
  public static <A> Automaton<IList<A>, A> ngram(Symbols<A> symbols, int n, Iterable<A> vocabulary) {
    if (n < 1) {
      throw new IllegalArgumentException("n-gram order must be at least 1, was " + n);
    }

    ISet<A> vocab = new LinearSet<>();
    for (A a : vocabulary) {
      if (symbols.isReserved(a)) {
        throw new PreconditionException("vocabulary can't contain the reserved symbol " + a);
      }
      vocab.add(a);
    }

    // histories are state keys, so they're forked before use
    LinearList<A> padding = new LinearList<>();
    for (int i = 0; i < n - 1; i++) {
      padding.addLast(symbols.begin());
    }
    IList<A> init = padding.forked();
    IList<A> accept = LinearList.of(symbols.stop()).forked();

    Automaton<IList<A>, A> m = new Automaton<>(symbols);
    m.setStart(init);
    m.setAccept(accept);

    LinearList<IList<A>> queue = LinearList.of(init);
    ISet<IList<A>> seen = LinearSet.of(init);

    while (queue.size() > 0) {
      IList<A> history = queue.popFirst();

      for (A a : vocab) {
        IList<A> next = shift(history, a);
        m.addTransition(new Transition<>(history, a, a, next), 0);
        if (!seen.contains(next)) {
          seen.add(next);
          queue.addLast(next);
        }
      }
      m.addTransition(new Transition<>(history, symbols.stop(), symbols.stop(), accept), 0);
    }

    return m;
  }

  ///

  /**
   * @return the current builder, extended to map {@code symbol} to itself
   */
  public AutomatonBuilder<A> match(A symbol) {
    return transduce(symbol, symbol);
  }

  /**
   * @return the current builder, extended to map {@code input} to {@code output}
   */
  public AutomatonBuilder<A> transduce(A input, A output) {
    if (built) {
      throw new IllegalStateException("automaton has already been built");
    }
    automaton.addTransition(new Transition<>(last, input, output, last + 1));
    last++;
    return this;
  }

  /**
   * @return the automaton, terminated by a transition on the stop symbol into the accept state
   */
  public Automaton<Integer, A> build() {
    if (!built) {
      A stop = automaton.symbols().stop();
      automaton.addTransition(new Transition<>(last, stop, stop, last + 1));
      automaton.setAccept(last + 1);
      built = true;
    }
    return automaton;
  }

  private static <A> IList<A> shift(IList<A> history, A symbol) {
    LinearList<A> next = new LinearList<>();
    for (long i = 1; i < history.size(); i++) {
      next.addLast(history.nth(i));
    }
    if (history.size() > 0) {
      next.addLast(symbol);
    }
    return next.forked();
  }
}
