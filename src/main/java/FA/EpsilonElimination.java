package FA;

import java.util.BitSet;

import FA.Model.NFA;
import FA.Model.NFAe;
import FA.Model.State;
import net.automatalib.alphabet.Alphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes epsilon transitions while keeping the state set.
 * <p>
 * State q of the result keeps the id and initial flag of q in the source. It accepts iff its epsilon-closure
 * contains an accepting state, and on symbol a it moves to the closure of every a-successor of its closure.
 */
public class EpsilonElimination {
    private static final Logger LOGGER = LoggerFactory.getLogger(EpsilonElimination.class);

    private EpsilonElimination() {}

    public static <I> NFA<I> eliminate(NFAe<I> nfae) {
        final int size = nfae.size();
        final Alphabet<I> alphabet = nfae.getInputAlphabet();
        final BitSet accepting = new BitSet(size);
        for (State s : nfae.getAcceptingStates()) {
            accepting.set(s.getId());
        }

        final BitSet[] closures = new BitSet[size];
        final NFA<I> out = new NFA<>();
        for (I sym : alphabet) {
            out.addSymbol(sym);
        }
        for (State q : nfae.getStates()) {
            final BitSet single = new BitSet(size);
            single.set(q.getId());
            closures[q.getId()] = nfae.epsilonClosure(single);
            out.addState(q.isInitial(), closures[q.getId()].intersects(accepting));
        }

        for (int q = 0; q < size; q++) {
            final State source = out.getState(q);
            for (I sym : alphabet) {
                final BitSet targets = nfae.epsilonClosure(nfae.step(closures[q], sym));
                for (int t = targets.nextSetBit(0); t >= 0; t = targets.nextSetBit(t + 1)) {
                    out.addTransition(source, sym, out.getState(t));
                }
            }
        }

        LOGGER.debug("Epsilon elimination: {} transitions -> {} transitions",
                     nfae.getTransitions().size(), out.getTransitions().size());
        return out;
    }
}
