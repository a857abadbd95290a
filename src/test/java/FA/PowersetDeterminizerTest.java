package FA;

import FA.Model.DFA;
import FA.Model.FSM;
import FA.Model.NFA;
import FA.Model.NFAe;
import FA.Model.State;
import FA.Model.Symbol;
import FA.Model.Transition;
import FA.Registry.ConfigurationRegistry;
import FA.Registry.Registry;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.fsa.NFAs;
import net.automatalib.word.Word;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class PowersetDeterminizerTest {
  private static final Symbol A = Symbol.of("a");
  private static final Symbol B = Symbol.of("b");

  @Test
  void testSecondToLastSymbol() {
    // (a|b)*a(a|b): 4 reachable subsets {0}, {0,1}, {0,1,2}, {0,2}
    NFA<Character> nfa = new NFA<>();
    State q0 = nfa.addInitialState(false);
    State q1 = nfa.addState(false);
    State q2 = nfa.addState(true);
    nfa.addTransition(q0, 'a', q0);
    nfa.addTransition(q0, 'b', q0);
    nfa.addTransition(q0, 'a', q1);
    nfa.addTransition(q1, 'a', q2);
    nfa.addTransition(q1, 'b', q2);

    DFA<Character> dfa = nfa.toDFA();
    Assertions.assertEquals(4, dfa.size());
    Assertions.assertEquals(8, dfa.getTransitions().size()); // total: no empty successor
    Assertions.assertEquals(2, dfa.getAcceptingStates().size());
    Assertions.assertEquals(dfa.getState(0), dfa.getInitialState());
    assertSameLanguage(nfa, dfa, List.of('a', 'b'), 6);
  }

  @Test
  void testEmptySuccessorIsOmitted() {
    NFA<Symbol> nfa = new NFA<>();
    State q0 = nfa.addState(true, false);
    State q1 = nfa.addState(false, true);
    nfa.addTransition(q0, A, q1);
    nfa.addTransition(q1, B, q1);

    DFA<Symbol> dfa = nfa.toDFA();
    Assertions.assertEquals(2, dfa.size()); // no dead state
    Assertions.assertNull(dfa.getSuccessor(dfa.getInitialState(), B));
    Assertions.assertTrue(dfa.accepts(List.of(A, B, B)));
    Assertions.assertFalse(dfa.accepts(List.of(B)));
  }

  @Test
  void testNoInitialStates() {
    NFA<Symbol> nfa = new NFA<>();
    State q0 = nfa.addState(false, true);
    nfa.addTransition(q0, A, q0);

    DFA<Symbol> dfa = nfa.toDFA();
    Assertions.assertEquals(1, dfa.size());
    Assertions.assertTrue(dfa.getTransitions().isEmpty());
    Assertions.assertFalse(dfa.accepts(List.of()));
    Assertions.assertFalse(dfa.accepts(List.of(A)));
  }

  @Test
  void testEpsilonCycleTerminates() {
    NFAe<Symbol> nfae = new NFAe<>();
    State q0 = nfae.addState(true, false);
    State q1 = nfae.addState(false, false);
    State q2 = nfae.addState(false, true);
    nfae.addEpsilonTransition(q0, q1);
    nfae.addEpsilonTransition(q1, q0);
    nfae.addTransition(q1, A, q2);
    nfae.addTransition(q2, A, q0);

    DFA<Symbol> dfa = nfae.toDFA();
    Assertions.assertEquals(2, dfa.size()); // {0,1} and {2}
    Assertions.assertTrue(dfa.accepts(List.of(A)));
    Assertions.assertTrue(dfa.accepts(List.of(A, A, A)));
    Assertions.assertFalse(dfa.accepts(List.of(A, A)));

    // after elimination q0 and q1 are separate NFA states, so {0} and {0,1} are distinct configurations
    DFA<Symbol> viaNFA = nfae.toNFA().toDFA();
    Assertions.assertEquals(3, viaNFA.size());
    assertSameLanguage(dfa, viaNFA, List.of(A), 6);
  }

  @Test
  void testDeduplicationBySetEquality() {
    // a and b both lead to {1, 2}, reached through different states
    NFA<Symbol> nfa = new NFA<>();
    State q0 = nfa.addState(true, false);
    State q1 = nfa.addState(false, false);
    State q2 = nfa.addState(false, true);
    nfa.addTransition(q0, A, q1);
    nfa.addTransition(q0, A, q2);
    nfa.addTransition(q0, B, q2);
    nfa.addTransition(q0, B, q1);

    Registry registry = new ConfigurationRegistry();
    DFA<Symbol> dfa = PowersetDeterminizer.determinize(nfa.powersetView(), nfa.getInputAlphabet(), registry);
    Assertions.assertEquals(2, dfa.size());
    Assertions.assertEquals(2, registry.size());
    Assertions.assertEquals(dfa.getSuccessor(dfa.getInitialState(), A), dfa.getSuccessor(dfa.getInitialState(), B));
  }

  @Test
  void testDeterministicNumbering() {
    NFA<Integer> nfa = TabakovVardiRandomNFA.getRandomNFA(7, 10);
    DFA<Integer> first = nfa.toDFA();
    DFA<Integer> second = nfa.toDFA();
    Assertions.assertEquals(first.size(), second.size());
    Assertions.assertEquals(first.getTransitions().toString(), second.getTransitions().toString());
  }

  @Test
  void testRandomNFALanguage() {
    for (int seed = 0; seed < 30; seed++) {
      NFA<Integer> nfa = TabakovVardiRandomNFA.getRandomNFA(seed, 6);
      DFA<Integer> dfa = nfa.toDFA();
      assertDeterministic(dfa);
      Assertions.assertTrue(dfa.size() <= 1 << nfa.size());
      assertSameLanguage(nfa, dfa, TabakovVardiRandomNFA.ALPHABET, 7);
    }
  }

  @Test
  void testRandomNFAeLanguage() {
    for (int seed = 0; seed < 30; seed++) {
      NFAe<Integer> nfae = TabakovVardiRandomNFA.getRandomNFAe(seed, 6);
      DFA<Integer> direct = nfae.toDFA();
      DFA<Integer> composed = nfae.toNFA().toDFA();
      assertDeterministic(direct);
      assertDeterministic(composed);
      assertSameLanguage(nfae, direct, TabakovVardiRandomNFA.ALPHABET, 7);
      assertSameLanguage(nfae, composed, TabakovVardiRandomNFA.ALPHABET, 7);
    }
  }

  @Test
  void testAgainstAutomataLib() {
    for (int seed = 0; seed < 10; seed++) {
      NFA<Integer> nfa = TabakovVardiRandomNFA.getRandomNFA(seed, 8);
      CompactNFA<Integer> compactNFA = AutomataLibExport.toCompactNFA(nfa);
      CompactDFA<Integer> reference = NFAs.determinize(compactNFA, compactNFA.getInputAlphabet(), false, false);
      DFA<Integer> dfa = nfa.toDFA();
      for (Word<Integer> w : Words.allWords(TabakovVardiRandomNFA.ALPHABET, 7)) {
        Assertions.assertEquals(reference.accepts(w), dfa.accepts(w), "seed " + seed + ", word " + w);
      }
    }
  }

  static <I> void assertDeterministic(DFA<I> dfa) {
    Set<List<Object>> seen = new HashSet<>();
    for (Transition<I> t : dfa.getTransitions()) {
      Assertions.assertFalse(t.label().isEpsilon());
      Assertions.assertTrue(seen.add(List.of(t.source(), t.label())), "duplicate " + t);
    }
    Assertions.assertEquals(1, dfa.getInitialStates().size());
  }

  static <I> void assertSameLanguage(FSM<I> expected, FSM<I> actual, List<I> alphabet, int maxLength) {
    for (Word<I> w : Words.allWords(alphabet, maxLength)) {
      Assertions.assertEquals(expected.accepts(w), actual.accepts(w), "word " + w);
    }
  }
}
