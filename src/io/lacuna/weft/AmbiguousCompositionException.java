package io.lacuna.weft;

/**
 * Thrown when the left operand of a composition deletes (emits epsilon) and the right operand inserts (consumes
 * epsilon), since the relative order of those steps is not determined by the product construction.
 */
public class AmbiguousCompositionException extends AutomatonException {

  public AmbiguousCompositionException() {
    super("can't compose a deleting transducer with an inserting transducer");
  }
}
