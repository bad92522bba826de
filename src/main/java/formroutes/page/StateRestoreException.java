package formroutes.page;

import formroutes.explorer.ExplorationException;
import formroutes.model.StateHandle;

/**
 * The observer could not return the form to a previously captured state.
 * Navigation is out of sync with the work stack, so the run cannot continue.
 */
public class StateRestoreException extends ExplorationException {

    private final transient StateHandle handle;

    public StateRestoreException(StateHandle handle, Throwable cause) {
        super("Could not restore form state " + handle.url(), cause);
        this.handle = handle;
    }

    public StateRestoreException(StateHandle handle, String reason) {
        super("Could not restore form state " + handle.url() + ": " + reason);
        this.handle = handle;
    }

    public StateHandle getHandle() {
        return handle;
    }
}
