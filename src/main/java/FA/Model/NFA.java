package FA.Model;

import java.util.BitSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

import FA.PowersetDeterminizer;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.ts.AcceptorPowersetViewTS;

/**
 * Epsilon-free non-deterministic automaton. Any number of initial states; a (state, symbol) pair may have any
 * number of successors.
 * @param <I> - Input symbol type
 */
public class NFA<I> implements SupportsPowerset<I> {
    private final StateTable<I> table = new StateTable<>();

    @Override
    public State addState(boolean initial, boolean accepting) {
        return table.addState(initial, accepting);
    }

    /**
     * @throws IllegalArgumentException on epsilon; use {@link NFAe} for epsilon transitions
     */
    @Override
    public void addTransition(State source, Label<I> label, State destination) {
        table.check(source);
        table.check(destination);
        if (label.isEpsilon()) {
            throw new IllegalArgumentException("NFA transitions cannot be labeled with epsilon");
        }
        table.addTransition(source, label, destination);
    }

    /**
     * @throws InvalidStateException if the handle was issued by another automaton
     */
    public Set<State> getSuccessors(State state, I input) {
        table.check(state);
        final BitSet config = new BitSet();
        config.set(state.getId());
        return table.toStates(table.step(config, Label.symbol(input)));
    }

    @Override
    public BitSet step(BitSet config, I symbol) {
        return table.step(config, Label.symbol(symbol));
    }

    @Override
    public AcceptorPowersetViewTS<BitSet, I, State> powersetView() {
        return new PowersetView<>(table, UnaryOperator.identity());
    }

    @Override
    public boolean accepts(Iterable<? extends I> input) {
        return PowersetView.accepts(powersetView(), input);
    }

    @Override
    public State getState(int id) {
        return table.getState(id);
    }

    @Override
    public List<State> getStates() {
        return table.states();
    }

    @Override
    public List<Transition<I>> getTransitions() {
        return table.transitions();
    }

    @Override
    public Set<State> getInitialStates() {
        return table.initialStates();
    }

    @Override
    public Set<State> getAcceptingStates() {
        return table.acceptingStates();
    }

    @Override
    public boolean isAccepting(State state) {
        return table.check(state).isAccepting();
    }

    @Override
    public void addSymbol(I symbol) {
        table.addSymbol(symbol);
    }

    @Override
    public Alphabet<I> getInputAlphabet() {
        return table.alphabet();
    }

    @Override
    public int size() {
        return table.size();
    }

    /**
     * Subset construction.
     */
    @Override
    public DFA<I> toDFA() {
        return PowersetDeterminizer.determinize(this);
    }

    @Override
    public String toString() {
        return "NFA" + getStates() + getTransitions();
    }
}
