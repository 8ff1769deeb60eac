package prodcons;

/**
 * Raised on join when a worker aborted instead of reaching its natural terminal state.
 */
public class WorkerFailedException extends RuntimeException {

    public WorkerFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
