package io.lacuna.weft;

/**
 * The common supertype of every failure raised by the automaton core. None of these are transient: each one
 * reflects structural misuse or input the core does not support.
 */
public abstract class AutomatonException extends RuntimeException {

  AutomatonException(String message) {
    super(message);
  }
}
