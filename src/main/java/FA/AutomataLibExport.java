package FA;

import FA.Model.DFA;
import FA.Model.FSM;
import FA.Model.NFA;
import FA.Model.NFAe;
import FA.Model.State;
import FA.Model.Transition;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Copies automata into AutomataLib's compact representations. State ids are preserved.
 */
public class AutomataLibExport {
    private AutomataLibExport() {}

    public static <I> CompactDFA<I> toCompactDFA(DFA<I> dfa) {
        return toCompactDFA(dfa, dfa.getInputAlphabet());
    }

    /**
     * @param alphabet - must contain every symbol used by dfa
     * @throws FA.Model.MissingInitialStateException if dfa has no initial state
     */
    public static <I> CompactDFA<I> toCompactDFA(DFA<I> dfa, Alphabet<I> alphabet) {
        dfa.getInitialState(); // fails fast before allocating
        final CompactDFA<I> out = new CompactDFA<>(alphabet, dfa.size());
        for (State s : dfa.getStates()) {
            if (s.isInitial()) {
                out.addInitialState(s.isAccepting());
            } else {
                out.addState(s.isAccepting());
            }
        }
        for (Transition<I> t : dfa.getTransitions()) {
            out.setTransition(t.source().getId(), alphabet.getSymbolIndex(t.label().getSymbol()),
                              t.destination().getId());
        }
        return out;
    }

    public static <I> CompactNFA<I> toCompactNFA(NFA<I> nfa) {
        return toCompactNFA(nfa, nfa.getInputAlphabet());
    }

    /**
     * Epsilon transitions are eliminated first.
     */
    public static <I> CompactNFA<I> toCompactNFA(NFAe<I> nfae) {
        final NFA<I> nfa = nfae.toNFA();
        return toCompactNFA(nfa, nfa.getInputAlphabet());
    }

    /**
     * @param nfa - an epsilon-free automaton
     * @param alphabet - must contain every symbol used by nfa
     */
    public static <I> CompactNFA<I> toCompactNFA(FSM<I> nfa, Alphabet<I> alphabet) {
        final CompactNFA<I> out = new CompactNFA<>(alphabet, nfa.size());
        for (State s : nfa.getStates()) {
            int id = out.addState(s.isAccepting());
            out.setInitial(id, s.isInitial());
        }
        for (Transition<I> t : nfa.getTransitions()) {
            if (t.label().isEpsilon()) {
                throw new IllegalArgumentException("Epsilon transition " + t + "; eliminate epsilon transitions first");
            }
            out.addTransition(t.source().getId(), t.label().getSymbol(), t.destination().getId());
        }
        return out;
    }
}
