package dumb.logics;

/**
 * A formula or term could not be built because one of its construction invariants does not hold.
 */
public class ValidationException extends LogicsException {
    public ValidationException(String message) {
        super(message);
    }

    static void enforce(boolean condition, String message) {
        if (!condition) throw new ValidationException(message);
    }
}
