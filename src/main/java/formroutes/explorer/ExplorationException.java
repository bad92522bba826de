package formroutes.explorer;

/**
 * Unchecked exception for failures that end an exploration run, such as a
 * form state that can no longer be restored.
 */
public class ExplorationException extends RuntimeException {

    public ExplorationException(String msg) {
        super(msg);
    }

    public ExplorationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
