package FA.Model;

/**
 * Opaque handle for a state of one automaton.
 * Handles are issued by {@link FSM#addState(boolean, boolean)} and are only valid for the issuing automaton;
 * passing one to another automaton fails with {@link InvalidStateException}.
 */
public final class State {
    private final Object owner;
    private final int id;
    private final boolean initial;
    private final boolean accepting;

    State(Object owner, int id, boolean initial, boolean accepting) {
        this.owner = owner;
        this.id = id;
        this.initial = initial;
        this.accepting = accepting;
    }

    /**
     * @return index of this state in its automaton's state table, starting at 0
     */
    public int getId() {
        return id;
    }

    public boolean isInitial() {
        return initial;
    }

    public boolean isAccepting() {
        return accepting;
    }

    boolean isOwnedBy(Object table) {
        return owner == table;
    }

    @Override
    public String toString() {
        return "q" + id + (initial ? "*" : "") + (accepting ? "#" : "");
    }
}
