package warden.spi;

/**
 * Exception thrown when the counter store cannot be reached or does not answer in time.
 *
 * <p>This is a transient infrastructure failure. Callers resolve it through the
 * failure policy of the rule being evaluated and never surface it to end users.
 */
public class StoreUnavailableException extends RuntimeException {

    private final String operation;

    public StoreUnavailableException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public StoreUnavailableException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /** Returns the store operation that failed. */
    public String getOperation() {
        return operation;
    }
}
