package FA.Model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.function.UnaryOperator;

import net.automatalib.ts.AcceptorPowersetViewTS;

/**
 * Powerset view over a state table. The closure operator is applied to the initial configuration and after every
 * step; it is the identity for epsilon-free automata.
 */
final class PowersetView<I> implements AcceptorPowersetViewTS<BitSet, I, State> {

    private final StateTable<I> table;
    private final UnaryOperator<BitSet> closure;

    PowersetView(StateTable<I> table, UnaryOperator<BitSet> closure) {
        this.table = table;
        this.closure = closure;
    }

    @Override
    public Collection<State> getOriginalStates(BitSet state) {
        return getOriginalTransitions(state);
    }

    @Override
    public Collection<State> getOriginalTransitions(BitSet state) {
        final List<State> result = new ArrayList<>(state.cardinality());

        for (int i = state.nextSetBit(0); i >= 0; i = state.nextSetBit(i + 1)) {
            result.add(table.getState(i));
        }

        return result;
    }

    @Override
    public BitSet getTransition(BitSet state, I in) {
        final BitSet result = closure.apply(table.step(state, Label.symbol(in)));
        return result.isEmpty() ? null : result;
    }

    @Override
    public boolean isAccepting(BitSet state) {
        return table.isAccepting(state);
    }

    @Override
    public BitSet getInitialState() {
        return closure.apply(table.initialConfiguration());
    }

    /**
     * Simulate the view over the input. Runs die as soon as the configuration becomes empty.
     */
    static <I> boolean accepts(AcceptorPowersetViewTS<BitSet, I, ?> view, Iterable<? extends I> input) {
        BitSet current = view.getInitialState();
        for (I sym : input) {
            current = view.getTransition(current, sym);
            if (current == null) {
                return false;
            }
        }
        return view.isAccepting(current);
    }
}
