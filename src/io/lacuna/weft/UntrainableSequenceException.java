package io.lacuna.weft;

import io.lacuna.bifurcan.IList;

/**
 * Thrown when a training sequence reaches a state with no outgoing transition on the next symbol.
 */
public class UntrainableSequenceException extends AutomatonException {

  private final IList<?> sequence;
  private final long position;
  private final Object state;

  public UntrainableSequenceException(IList<?> sequence, long position, Object state) {
    super("training sequence is not in the language: no transition from " + state
            + " on " + sequence.nth(position) + " at position " + position);
    this.sequence = sequence;
    this.position = position;
    this.state = state;
  }

  /**
   * @return the sequence being walked, including the trailing stop symbol
   */
  public IList<?> sequence() {
    return sequence;
  }

  public long position() {
    return position;
  }

  public Object state() {
    return state;
  }
}
