package FA.Model;

import java.util.List;
import java.util.Set;

import net.automatalib.automaton.concept.FiniteRepresentation;
import net.automatalib.automaton.concept.InputAlphabetHolder;

/**
 * Operations shared by {@link DFA}, {@link NFA} and {@link NFAe}.
 * <p>
 * An automaton is built once through {@link #addState(boolean, boolean)} and
 * {@link #addTransition(State, Label, State)} and is read-only afterwards. Queries never mutate it, so they may
 * run concurrently as long as nobody is still adding states or transitions.
 *
 * @param <I> - Input symbol type, e.g., {@link Symbol}
 */
public interface FSM<I> extends InputAlphabetHolder<I>, FiniteRepresentation {

    /**
     * Add a state to the table of this automaton.
     * <p>
     * A {@link DFA} may be built without an initial state; queries that need one
     * ({@link DFA#getInitialState()}, {@link #accepts(Iterable)}) then throw {@link MissingInitialStateException}.
     * @param initial - whether runs start here
     * @param accepting - whether runs ending here accept
     * @return handle, valid for this automaton only
     * @throws DeterminismViolationException if initial is set on a DFA that already has an initial state
     */
    State addState(boolean initial, boolean accepting);

    default State addState(boolean accepting) {
        return addState(false, accepting);
    }

    default State addInitialState(boolean accepting) {
        return addState(true, accepting);
    }

    /**
     * Add a transition. Nothing is added if the call fails.
     * @throws InvalidStateException if either handle was issued by another automaton
     */
    void addTransition(State source, Label<I> label, State destination);

    default void addTransition(State source, I symbol, State destination) {
        addTransition(source, Label.symbol(symbol), destination);
    }

    /**
     * Declare an input symbol, whether or not any transition uses it.
     * Symbols of added transitions are declared implicitly.
     */
    void addSymbol(I symbol);

    /**
     * Run the automaton over the whole input.
     * @param input - symbols, consumed in order
     * @return whether some run ends in an accepting state
     */
    boolean accepts(Iterable<? extends I> input);

    /**
     * @param id - index of a state, as returned by {@link State#getId()}
     * @throws InvalidStateException if there is no such state
     */
    State getState(int id);

    /**
     * @return states in insertion order
     */
    List<State> getStates();

    /**
     * @return transitions in insertion order
     */
    List<Transition<I>> getTransitions();

    Set<State> getInitialStates();

    Set<State> getAcceptingStates();

    /**
     * @throws InvalidStateException if the handle was issued by another automaton
     */
    boolean isAccepting(State state);

    /**
     * @return an equivalent, freshly allocated DFA
     */
    DFA<I> toDFA();
}
