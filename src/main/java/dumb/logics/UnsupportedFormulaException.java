package dumb.logics;

/**
 * Thrown by printers and evaluators that have no handler for a node kind.
 */
public class UnsupportedFormulaException extends LogicsException {
    public UnsupportedFormulaException(String message) {
        super(message);
    }

    public static UnsupportedFormulaException of(Formula formula, String operation) {
        return new UnsupportedFormulaException("formula '" + formula + "' cannot be processed by " + operation);
    }
}
