package FA;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;

import FA.Model.DFA;
import FA.Model.DeterminizeRecord;
import FA.Model.SupportsPowerset;
import FA.Registry.ConfigurationRegistry;
import FA.Registry.Registry;
import net.automatalib.ts.AcceptorPowersetViewTS;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset construction: every reachable configuration of the source automaton becomes one DFA state.
 * Configurations are discovered breadth-first and numbered in discovery order, so the output is
 * the same for the same input. An empty successor configuration produces no transition.
 */
public class PowersetDeterminizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(PowersetDeterminizer.class);

    private PowersetDeterminizer() {}

    /**
     * Determinize an NFA or NFAe. For an NFAe, configurations are epsilon-closed.
     * @param nfa - source automaton; not modified
     * @return - fresh DFA over the same alphabet
     * @param <I> - Input symbol type
     */
    public static <I> DFA<I> determinize(SupportsPowerset<I> nfa) {
        return determinize(nfa.powersetView(), nfa.getInputAlphabet(), new ConfigurationRegistry());
    }

    /**
     * Main worklist loop.
     * @param powerset - powerset view of the source automaton
     * @param inputs - Input symbols, visited in iteration order
     * @param registry - configuration to DFA state mapping; should be empty
     * @return - DFA whose states are the reachable configurations
     * @param <I> - Input symbol type
     */
    public static <I> DFA<I> determinize(AcceptorPowersetViewTS<BitSet, I, ?> powerset,
                                         Collection<? extends I> inputs,
                                         Registry registry) {
        final DFA<I> out = new DFA<>();
        for (I sym : inputs) {
            out.addSymbol(sym);
        }
        final Deque<DeterminizeRecord> queue = new ArrayDeque<>();

        BitSet init = powerset.getInitialState();
        int initOut = out.addInitialState(powerset.isAccepting(init)).getId();

        registry.put(init, initOut);
        queue.offer(new DeterminizeRecord(init, initOut));

        while (!queue.isEmpty()) {
            DeterminizeRecord curr = queue.poll();
            BitSet inState = curr.inputState();
            int outState = curr.outputAddress();

            for (I sym : inputs) {
                BitSet succ = powerset.getTransition(inState, sym);
                if (succ == null) {
                    continue; // implicit rejection, no dead state
                }
                int outSucc = registry.get(succ);
                if (outSucc == Registry.MISSING_ELEMENT) {
                    // add new state to DFA and to queue
                    outSucc = out.addState(powerset.isAccepting(succ)).getId();
                    registry.put(succ, outSucc);
                    queue.offer(new DeterminizeRecord(succ, outSucc));
                }
                out.addTransition(out.getState(outState), sym, out.getState(outSucc));
            }
        }

        LOGGER.debug("Subset construction: {} configurations, {} transitions", out.size(), out.getTransitions().size());
        return out;
    }
}
