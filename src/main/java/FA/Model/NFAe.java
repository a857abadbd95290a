package FA.Model;

import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import FA.EpsilonElimination;
import FA.PowersetDeterminizer;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.ts.AcceptorPowersetViewTS;

/**
 * Non-deterministic automaton with epsilon transitions.
 * Simulation closes the configuration under epsilon edges at the start and after every symbol.
 * @param <I> - Input symbol type
 */
public class NFAe<I> implements SupportsPowerset<I> {
    private final StateTable<I> table = new StateTable<>();

    @Override
    public State addState(boolean initial, boolean accepting) {
        return table.addState(initial, accepting);
    }

    @Override
    public void addTransition(State source, Label<I> label, State destination) {
        table.check(source);
        table.check(destination);
        table.addTransition(source, label, destination);
    }

    public void addEpsilonTransition(State source, State destination) {
        addTransition(source, Label.epsilon(), destination);
    }

    /**
     * Smallest superset of states closed under epsilon edges.
     * Every state is expanded at most once, so epsilon cycles terminate.
     * @param states - bit set of state ids; not modified
     * @return a new bit set
     * @throws InvalidStateException if states names an id this automaton never issued
     */
    public BitSet epsilonClosure(BitSet states) {
        table.checkConfiguration(states);
        final Label<I> epsilon = Label.epsilon();
        final BitSet closure = (BitSet) states.clone();
        final IntArrayList worklist = new IntArrayList();
        for (int q = states.nextSetBit(0); q >= 0; q = states.nextSetBit(q + 1)) {
            worklist.add(q);
        }
        while (!worklist.isEmpty()) {
            final int q = worklist.popInt();
            final IntList targets = table.successors(q, epsilon);
            for (int i = 0; i < targets.size(); i++) {
                final int t = targets.getInt(i);
                if (!closure.get(t)) {
                    closure.set(t);
                    worklist.push(t);
                }
            }
        }
        return closure;
    }

    /**
     * @throws InvalidStateException if a handle was issued by another automaton
     */
    public Set<State> epsilonClosure(Collection<State> states) {
        return table.toStates(epsilonClosure(table.toBitSet(states)));
    }

    /**
     * Symbol step without closure; the caller closes the result if needed.
     */
    @Override
    public BitSet step(BitSet config, I symbol) {
        return table.step(config, Label.symbol(symbol));
    }

    @Override
    public AcceptorPowersetViewTS<BitSet, I, State> powersetView() {
        return new PowersetView<>(table, this::epsilonClosure);
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

    /**
     * @return declared symbols and symbols of non-epsilon transitions
     */
    @Override
    public Alphabet<I> getInputAlphabet() {
        return table.alphabet();
    }

    @Override
    public int size() {
        return table.size();
    }

    /**
     * Epsilon elimination.
     */
    public NFA<I> toNFA() {
        return EpsilonElimination.eliminate(this);
    }

    /**
     * Subset construction over epsilon-closed configurations.
     */
    @Override
    public DFA<I> toDFA() {
        return PowersetDeterminizer.determinize(this);
    }

    @Override
    public String toString() {
        return "NFAe" + getStates() + getTransitions();
    }
}
