package dumb.logics;

public class LogicsException extends RuntimeException {
    public LogicsException(String message) {
        super(message);
    }

    public LogicsException(String message, Throwable cause) {
        super(message, cause);
    }
}
