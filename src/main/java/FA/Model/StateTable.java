package FA.Model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

/**
 * Flat state and transition storage owned by exactly one automaton.
 * States are referenced by index; the table is the owner token of the handles it issues.
 * @param <I> - Input symbol type
 */
final class StateTable<I> {
    private final List<State> states = new ArrayList<>();
    private final List<Transition<I>> transitions = new ArrayList<>();
    // successors.get(q).get(label) = destination indices, in insertion order
    private final List<Map<Label<I>, IntList>> successors = new ArrayList<>();
    private final BitSet initial = new BitSet();
    private final BitSet accepting = new BitSet();
    private final Set<I> symbols = new LinkedHashSet<>();

    State addState(boolean isInitial, boolean isAccepting) {
        final int id = states.size();
        final State state = new State(this, id, isInitial, isAccepting);
        states.add(state);
        successors.add(new HashMap<>());
        initial.set(id, isInitial);
        accepting.set(id, isAccepting);
        return state;
    }

    State check(State state) {
        Objects.requireNonNull(state, "state");
        if (!state.isOwnedBy(this) || state.getId() >= states.size()) {
            throw InvalidStateException.foreign(state);
        }
        return state;
    }

    State getState(int id) {
        if (id < 0 || id >= states.size()) {
            throw new InvalidStateException("No state with id " + id + " (size " + states.size() + ")");
        }
        return states.get(id);
    }

    /**
     * @throws InvalidStateException if config names an id this table never issued
     */
    BitSet checkConfiguration(BitSet config) {
        Objects.requireNonNull(config, "config");
        if (config.length() > states.size()) {
            throw new InvalidStateException("No state with id " + (config.length() - 1) + " (size " + states.size() + ")");
        }
        return config;
    }

    IntList successors(int id, Label<I> label) {
        final IntList result = successors.get(id).get(label);
        return result == null ? IntLists.emptyList() : IntLists.unmodifiable(result);
    }

    /**
     * Add a transition between two checked states.
     * @return false if the exact transition was already present
     */
    boolean addTransition(State source, Label<I> label, State destination) {
        final IntList targets = successors.get(source.getId()).computeIfAbsent(label, l -> new IntArrayList(2));
        if (targets.contains(destination.getId())) {
            return false;
        }
        targets.add(destination.getId());
        transitions.add(new Transition<>(source, label, destination));
        if (!label.isEpsilon()) {
            symbols.add(label.getSymbol());
        }
        return true;
    }

    /**
     * Union of the destinations of all states in config via label.
     */
    BitSet step(BitSet config, Label<I> label) {
        checkConfiguration(config);
        final BitSet result = new BitSet(states.size());
        for (int q = config.nextSetBit(0); q >= 0; q = config.nextSetBit(q + 1)) {
            final IntList targets = successors.get(q).get(label);
            if (targets != null) {
                for (int i = 0; i < targets.size(); i++) {
                    result.set(targets.getInt(i));
                }
            }
        }
        return result;
    }

    BitSet initialConfiguration() {
        return (BitSet) initial.clone();
    }

    boolean isAccepting(BitSet config) {
        return checkConfiguration(config).intersects(accepting);
    }

    List<State> states() {
        return Collections.unmodifiableList(states);
    }

    List<Transition<I>> transitions() {
        return Collections.unmodifiableList(transitions);
    }

    Set<State> initialStates() {
        return toStates(initial);
    }

    Set<State> acceptingStates() {
        return toStates(accepting);
    }

    Set<State> toStates(BitSet config) {
        final Set<State> result = new LinkedHashSet<>();
        for (int q = config.nextSetBit(0); q >= 0; q = config.nextSetBit(q + 1)) {
            result.add(getState(q));
        }
        return result;
    }

    BitSet toBitSet(Iterable<State> config) {
        final BitSet result = new BitSet(states.size());
        for (State s : config) {
            result.set(check(s).getId());
        }
        return result;
    }

    void addSymbol(I symbol) {
        symbols.add(Objects.requireNonNull(symbol, "symbol"));
    }

    Alphabet<I> alphabet() {
        return Alphabets.fromCollection(symbols);
    }

    int size() {
        return states.size();
    }
}
