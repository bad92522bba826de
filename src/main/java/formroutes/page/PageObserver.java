package formroutes.page;

import formroutes.model.FieldDescriptor;
import formroutes.model.InteractionStage;
import formroutes.model.PrimitiveAction;
import formroutes.model.StateHandle;
import formroutes.model.TerminalOutcome;

import java.util.List;

/**
 * The explorer's only view of a live form. Implementations wrap a browser
 * session (see {@link formroutes.page.selenium.SeleniumPageObserver}) or, in
 * tests, a synthetic form.
 *
 * <p>Calls are made from a single thread, one at a time. Ordinary
 * interaction failures are reported through return values, never thrown;
 * only {@link #restoreState} may fail the whole run.
 */
public interface PageObserver {

    /**
     * Fields that are currently visible and enterable, in page order.
     */
    List<FieldDescriptor> currentInteractableFields();

    /**
     * Executes one primitive action.
     *
     * @return true when the action was carried out
     */
    boolean performAction(PrimitiveAction action);

    /**
     * Executes actions in order, stopping at the first failure.
     *
     * @return true when every action succeeded
     */
    default boolean performAll(List<PrimitiveAction> actions) {
        for (PrimitiveAction a : actions) {
            if (!performAction(a)) return false;
        }
        return true;
    }

    /** Snapshot of the current form state. */
    StateHandle captureStateHandle();

    /**
     * Returns the form to a previously captured state.
     *
     * @throws StateRestoreException if the state cannot be reached
     */
    void restoreState(StateHandle handle);

    /**
     * Tries the form's "next" control.
     *
     * @return true when the form moved to a further step
     */
    boolean advanceIfPossible();

    /** Tries the save/submit control and reports validation errors shown afterwards. */
    TerminalOutcome attemptTerminalAction();

    /**
     * Pure interactions (popup dismissal, frame switch, hover) the observer
     * performed since the last call, so they can be recorded in the route.
     * The returned list is cleared on every call.
     */
    default List<InteractionStage> drainInteractions() {
        return List.of();
    }
}
