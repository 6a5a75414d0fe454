package io.lacuna.weft;

/**
 * Thrown when an operation is invoked on an automaton that isn't ready for it, such as one without a start or
 * accept state, or a pair of automata with conflicting reserved symbols.
 */
public class PreconditionException extends AutomatonException {

  public PreconditionException(String message) {
    super(message);
  }
}
