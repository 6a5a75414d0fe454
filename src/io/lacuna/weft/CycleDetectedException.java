package io.lacuna.weft;

/**
 * Thrown by {@link TopologicalSort} when the automaton has a cycle reachable from its start state.
 */
public class CycleDetectedException extends AutomatonException {

  private final Object state;

  public CycleDetectedException(Object state) {
    super("automaton must be acyclic, but " + state + " is reachable from itself");
    this.state = state;
  }

  /**
   * @return the state which was re-entered while still on the active path
   */
  public Object state() {
    return state;
  }
}
