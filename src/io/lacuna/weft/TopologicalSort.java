package io.lacuna.weft;

import io.lacuna.bifurcan.*;

import java.util.Iterator;

/**
 * Orders the states of an acyclic automaton so that no state can reach one which precedes it.
 */
public class TopologicalSort {

  private TopologicalSort() {
  }

  private static class Frame<Q, A> {
    final Q state;
    final Iterator<Transition<Q, A>> transitions;

    Frame(Q state, Iterator<Transition<Q, A>> transitions) {
      this.state = state;
      this.transitions = transitions;
    }
  }

  /**
   * @return the states reachable from the start state of {@code m}, ancestors before descendants
   * @throws CycleDetectedException if a cycle is reachable from the start state
   */
  public static <Q, A> IList<Q> sort(Automaton<Q, A> m) {
    Q init = m.requireStart();

    ISet<Q> inProgress = new LinearSet<>();
    ISet<Q> done = new LinearSet<>();
    LinearList<Q> postOrder = new LinearList<>();

    // depth-first, with an explicit stack so long chains don't overflow
    LinearList<Frame<Q, A>> stack = new LinearList<>();
    stack.addLast(new Frame<>(init, m.outgoing(init).iterator()));
    inProgress.add(init);

    while (stack.size() > 0) {
      Frame<Q, A> frame = stack.nth(stack.size() - 1);

      if (frame.transitions.hasNext()) {
        Q next = frame.transitions.next().to();
        if (done.contains(next)) {
          continue;
        } else if (inProgress.contains(next)) {
          throw new CycleDetectedException(next);
        }
        inProgress.add(next);
        stack.addLast(new Frame<>(next, m.outgoing(next).iterator()));
      } else {
        stack.popLast();
        inProgress.remove(frame.state);
        done.add(frame.state);
        postOrder.addLast(frame.state);
      }
    }

    return Utils.reverse(postOrder);
  }
}
