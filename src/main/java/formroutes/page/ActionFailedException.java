package formroutes.page;

import formroutes.model.PrimitiveAction;

/**
 * A single interaction could not be carried out (element missing, hidden,
 * detached or not interactable). Callers skip the field or branch and go on.
 */
public class ActionFailedException extends RuntimeException {

    public ActionFailedException(PrimitiveAction action, Throwable cause) {
        super("Action failed: " + action, cause);
    }

    public ActionFailedException(String msg) {
        super(msg);
    }
}
