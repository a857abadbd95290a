package FA.Model;

public class MissingInitialStateException extends FSMException {
    public MissingInitialStateException() {
        super("DFA has no initial state");
    }
}
