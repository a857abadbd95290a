package FA.Model;

import java.util.List;
import java.util.Set;

import it.unimi.dsi.fastutil.ints.IntList;
import net.automatalib.alphabet.Alphabet;

/**
 * Deterministic automaton: one initial state and at most one transition per (state, symbol).
 * A missing transition rejects; there is no implicit sink state.
 * @param <I> - Input symbol type
 */
public class DFA<I> implements FSM<I> {
    private final StateTable<I> table = new StateTable<>();
    private State initialState;

    /**
     * @throws DeterminismViolationException if initial is set and the DFA already has an initial state
     */
    @Override
    public State addState(boolean initial, boolean accepting) {
        if (initial && initialState != null) {
            throw new DeterminismViolationException("DFA already has initial state " + initialState);
        }
        final State state = table.addState(initial, accepting);
        if (initial) {
            initialState = state;
        }
        return state;
    }

    /**
     * @throws DeterminismViolationException on epsilon, or if source already has a different successor for label
     */
    @Override
    public void addTransition(State source, Label<I> label, State destination) {
        table.check(source);
        table.check(destination);
        if (label.isEpsilon()) {
            throw new DeterminismViolationException("DFA transitions cannot be labeled with epsilon");
        }
        final IntList existing = table.successors(source.getId(), label);
        if (!existing.isEmpty()) {
            if (existing.getInt(0) == destination.getId()) {
                return;
            }
            throw new DeterminismViolationException("State " + source + " already has a transition on '" + label
                                                    + "' to " + table.getState(existing.getInt(0)));
        }
        table.addTransition(source, label, destination);
    }

    /**
     * @return the initial state
     * @throws MissingInitialStateException if no state was added as initial
     */
    public State getInitialState() {
        if (initialState == null) {
            throw new MissingInitialStateException();
        }
        return initialState;
    }

    /**
     * @return the successor of state on input, or null if there is none
     * @throws InvalidStateException if the handle was issued by another automaton
     */
    public State getSuccessor(State state, I input) {
        table.check(state);
        final IntList succ = table.successors(state.getId(), Label.symbol(input));
        return succ.isEmpty() ? null : table.getState(succ.getInt(0));
    }

    /**
     * Deterministic walk from the initial state. O(|input|) time.
     * @throws MissingInitialStateException if no state was added as initial
     */
    @Override
    public boolean accepts(Iterable<? extends I> input) {
        State current = getInitialState();
        for (I sym : input) {
            current = getSuccessor(current, sym);
            if (current == null) {
                return false; // run dies; rest of input is not read
            }
        }
        return current.isAccepting();
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
     * @return a copy with freshly allocated states
     */
    @Override
    public DFA<I> toDFA() {
        return copyInto(new DFA<>());
    }

    /**
     * @return an NFA with the same states and transitions
     */
    public NFA<I> toNFA() {
        return copyInto(new NFA<>());
    }

    /**
     * Reverse every transition and swap the roles of initial and accepting states.
     * The result accepts exactly the reversals of the words this DFA accepts.
     * @return a fresh NFA with the same state ids; its initial states are the accepting states of this DFA
     */
    public NFA<I> toTranspose() {
        final NFA<I> out = new NFA<>();
        for (I sym : getInputAlphabet()) {
            out.addSymbol(sym);
        }
        for (State s : getStates()) {
            out.addState(s.isAccepting(), s.isInitial());
        }
        for (Transition<I> t : getTransitions()) {
            out.addTransition(out.getState(t.destination().getId()), t.label(), out.getState(t.source().getId()));
        }
        return out;
    }

    private <A extends FSM<I>> A copyInto(A copy) {
        for (I sym : getInputAlphabet()) {
            copy.addSymbol(sym);
        }
        for (State s : getStates()) {
            copy.addState(s.isInitial(), s.isAccepting());
        }
        for (Transition<I> t : getTransitions()) {
            copy.addTransition(copy.getState(t.source().getId()), t.label(), copy.getState(t.destination().getId()));
        }
        return copy;
    }

    @Override
    public String toString() {
        return "DFA" + getStates() + getTransitions();
    }
}
