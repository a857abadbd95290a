package FA;

import FA.Model.NFA;
import FA.Model.State;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;

import java.io.*;
import java.util.*;

public class BAFormat {
    /*
    We just use the Automatalib parser and convert from a CompactNFA<String>
     */
    public static NFA<String> convertBAToNFA(InputStream is) throws IOException, FormatException {
        final CompactNFA<String> automaton = BAParsers.nfa().readModel(is).model;
        final Alphabet<String> alphabet = automaton.getInputAlphabet();
        int states = automaton.getStates().size();
        Set<Integer> initialStates = automaton.getInitialStates();
        NFA<String> nfa = new NFA<>();
        for (String a: alphabet) {
            nfa.addSymbol(a);
        }
        for(int i=0;i<states;i++) {
            nfa.addState(initialStates.contains(i), automaton.isAccepting(i));
        }
        for(int i=0;i<states;i++) {
            State source = nfa.getState(i);
            for(String a: alphabet) {
                for(int t: automaton.getTransitions(i, a)) {
                    nfa.addTransition(source, a, nfa.getState(t));
                }
            }
        }
        return nfa;
    }

    static NFA<String> getBAFile(String filePath) {
        try (InputStream is = new FileInputStream(filePath)) {
            return convertBAToNFA(is);
        } catch (Exception ex) {
            throw new RuntimeException(ex);
        }
    }
}
