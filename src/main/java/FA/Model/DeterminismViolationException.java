package FA.Model;

public class DeterminismViolationException extends FSMException {
    public DeterminismViolationException(String message) {
        super(message);
    }
}
