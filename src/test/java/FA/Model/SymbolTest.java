package FA.Model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class SymbolTest {
  @Test
  void testWord() {
    Assertions.assertEquals(List.of(Symbol.of("a"), Symbol.of("b"), Symbol.of("a")), Symbol.word("aba"));
    Assertions.assertTrue(Symbol.word("").isEmpty());
    Assertions.assertEquals(List.of(Symbol.of("ε")), Symbol.word("ε"));
    Assertions.assertEquals("x", Symbol.of("x").toString());
    Assertions.assertThrows(NullPointerException.class, () -> Symbol.of(null));
  }

  @Test
  void testLabels() {
    Label<Symbol> a = Label.symbol(Symbol.of("a"));
    Assertions.assertEquals(a, Label.symbol(Symbol.of("a")));
    Assertions.assertNotEquals(a, Label.symbol(Symbol.of("b")));
    Assertions.assertNotEquals(a, Label.epsilon());
    Assertions.assertTrue(Label.<Symbol>epsilon().isEpsilon());
    Assertions.assertNull(Label.<Symbol>epsilon().getSymbol());
    Assertions.assertSame(Label.<Symbol>epsilon(), Label.<Integer>epsilon());
    Assertions.assertThrows(NullPointerException.class, () -> Label.symbol(null));
  }

  @Test
  void testStateAndTransitionText() {
    NFA<Symbol> nfa = new NFA<>();
    State q0 = nfa.addState(true, false);
    State q1 = nfa.addState(false, true);
    nfa.addTransition(q0, Symbol.of("a"), q1);
    Assertions.assertEquals("q0*", q0.toString());
    Assertions.assertEquals("q1#", q1.toString());
    Assertions.assertEquals("0 --a--> 1", nfa.getTransitions().get(0).toString());
  }
}
