package io.lacuna.weft;

import io.lacuna.bifurcan.*;
import org.junit.Test;

import static org.junit.Assert.*;

public class AutomatonTest {

  private static final double DELTA = 1e-12;

  @Test
  public void testRepeatedTransitionAccumulatesWeight() {
    Automaton<String, String> m = Automaton.create();
    Transition<String, String> t = new Transition<>("q", "a", "b", "r");

    m.addTransition(t, 2.0);
    m.addTransition(new Transition<>("q", "a", "b", "r"), 3.5);

    assertEquals(1, m.transitions().size());
    assertEquals(5.5, m.weight(t), DELTA);
    assertEquals(2, m.states().size());
    assertEquals(1, m.inputAlphabet().size());
    assertEquals(1, m.outputAlphabet().size());
    assertEquals(1, m.outgoing("q").size());
    assertEquals(1, m.incoming("r").size());
    assertEquals(1, m.transitions("q", "a").size());
    assertEquals(1, m.transitionsOnOutput("q", "b").size());
  }

  @Test
  public void testDefaultWeightIsOne() {
    Automaton<Integer, String> m = Automaton.create();
    Transition<Integer, String> t = new Transition<>(0, "a", "a", 1);
    m.addTransition(t);
    m.addTransition(t);
    assertEquals(2.0, m.weight(t), DELTA);
  }

  @Test
  public void testIndices() {
    Automaton<Integer, String> m = Automaton.create();
    Transition<Integer, String> ab = new Transition<>(0, "a", "b", 1);
    Transition<Integer, String> ac = new Transition<>(0, "a", "c", 2);
    Transition<Integer, String> db = new Transition<>(0, "d", "b", 2);
    Transition<Integer, String> back = new Transition<>(2, "e", "e", 0);
    m.addTransition(ab).addTransition(ac).addTransition(db).addTransition(back);

    assertEquals(LinearSet.of(0, 1, 2), m.states());
    assertEquals(LinearSet.of("a", "d", "e"), m.inputAlphabet());
    assertEquals(LinearSet.of("b", "c", "e"), m.outputAlphabet());

    assertEquals(LinearSet.of(ab, ac, db), m.outgoing(0));
    assertEquals(LinearSet.of(ac, db), m.incoming(2));
    assertEquals(LinearSet.of(back), m.incoming(0));
    assertEquals(LinearSet.of(ab, ac), m.transitions(0, "a"));
    assertEquals(LinearSet.of(ab, db), m.transitionsOnOutput(0, "b"));
    assertEquals(2, m.inputIndex(0).size());
    assertEquals(2, m.outputIndex(0).size());

    assertEquals(0, m.transitions(0, "z").size());
    assertEquals(0, m.transitions(1, "a").size());
    assertEquals(0, m.outgoing(1).size());
    assertEquals(0, m.inputIndex(7).size());
  }

  @Test
  public void testWeightIsNotPartOfIdentity() {
    Transition<Integer, String> a = new Transition<>(0, "a", "b", 1);
    Transition<Integer, String> b = new Transition<>(0, "a", "b", 1);
    Transition<Integer, String> c = new Transition<>(0, "a", "c", 1);

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);

    Automaton<Integer, String> m = Automaton.create();
    m.addTransition(a, 4.0);
    m.reweightTransition(b, 0.25);
    assertEquals(0.25, m.weight(a), DELTA);
    assertEquals(1, m.transitions().size());
  }

  @Test
  public void testStartAndAcceptAreAdded() {
    Automaton<String, String> m = Automaton.create();
    assertNull(m.start());
    assertNull(m.accept());

    m.setStart("s").setAccept("f").addState("s");
    assertEquals("s", m.start());
    assertEquals("f", m.accept());
    assertEquals(LinearSet.of("s", "f"), m.states());
  }

  @Test
  public void testQueriesCantChangeTheAutomaton() {
    Automaton<Integer, String> m = Automaton.create();
    Transition<Integer, String> t = new Transition<>(0, "a", "a", 1);
    m.addTransition(t);

    Transition<Integer, String> stray = new Transition<>(0, "z", "z", 9);
    m.outgoing(0).add(stray);
    m.incoming(9).add(stray);
    m.transitions(0, "a").add(stray);
    m.transitionsOnOutput(0, "z").add(stray);
    m.transitions().add(stray);
    m.states().add(42);
    m.inputAlphabet().add("q");
    m.outputAlphabet().add("q");
    m.inputIndex(0).put("z", LinearSet.of(stray));
    m.inputIndex(0).get("a").get().add(stray);
    m.outputIndex(0).get("a").get().add(stray);

    assertEquals(1, m.outgoing(0).size());
    assertEquals(0, m.incoming(9).size());
    assertEquals(1, m.transitions(0, "a").size());
    assertEquals(0, m.transitionsOnOutput(0, "z").size());
    assertEquals(1, m.transitions().size());
    assertFalse(m.contains(stray));
    assertEquals(LinearSet.of(0, 1), m.states());
    assertEquals(LinearSet.of("a"), m.inputAlphabet());
    assertEquals(LinearSet.of("a"), m.outputAlphabet());
    assertEquals(1, m.inputIndex(0).size());
  }

  @Test
  public void testQueriesReflectLaterChanges() {
    Automaton<Integer, String> m = Automaton.create();
    m.addTransition(new Transition<>(0, "a", "a", 1));
    ISet<Integer> states = m.states();
    ISet<Transition<Integer, String>> outgoing = m.outgoing(0);

    m.addTransition(new Transition<>(0, "b", "b", 2));
    assertEquals(3, states.size());
    assertEquals(2, outgoing.size());
  }

  @Test(expected = PreconditionException.class)
  public void testReweightUnknownTransition() {
    Automaton<Integer, String> m = Automaton.create();
    m.reweightTransition(new Transition<>(0, "a", "a", 1), 1.0);
  }

  @Test
  public void testUnknownWeightIsZero() {
    Automaton<Integer, String> m = Automaton.create();
    Transition<Integer, String> t = new Transition<>(0, "a", "a", 1);
    assertFalse(m.contains(t));
    assertEquals(0.0, m.weight(t), DELTA);
    assertEquals(0.0, m.weights().applyAsDouble(t), DELTA);
  }

  @Test
  public void testCustomSymbols() {
    Symbols<Character> symbols = new Symbols<>('~', '$', '^');
    Automaton<Integer, Character> m = new Automaton<>(symbols);
    assertEquals(Character.valueOf('~'), m.symbols().epsilon());
    assertTrue(m.symbols().isReserved('$'));
    assertFalse(m.symbols().isReserved('a'));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSymbolsMustBeDistinct() {
    new Symbols<>("x", "x", "y");
  }
}
