package FA.Model;

/**
 * Base of all errors raised by automaton construction and queries.
 * Errors are raised before the automaton is mutated.
 */
public class FSMException extends RuntimeException {
    public FSMException(String message) {
        super(message);
    }
}
