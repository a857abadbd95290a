package FA.Model;

/**
 * A state handle was used with an automaton that did not issue it.
 */
public class InvalidStateException extends FSMException {
    public InvalidStateException(String message) {
        super(message);
    }

    static InvalidStateException foreign(State state) {
        return new InvalidStateException("State " + state + " does not belong to this automaton");
    }
}
