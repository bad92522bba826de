package formroutes.explorer;

import formroutes.inference.FieldConsolidation;
import formroutes.model.BranchAction;
import formroutes.model.ExplorationResult;
import formroutes.model.FieldDescriptor;
import formroutes.model.FieldObservation;
import formroutes.model.FieldStage;
import formroutes.model.Precondition;
import formroutes.model.PrimitiveAction;
import formroutes.model.Stage;
import formroutes.model.StateHandle;
import formroutes.model.TerminalOutcome;
import formroutes.page.ActionFailedException;
import formroutes.page.PageObserver;
import formroutes.page.StateRestoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Depth-first explorer of a dynamic form.
 *
 * <p>For each popped work item the engine:
 * <ol>
 *   <li>Restores the form to the item's {@link StateHandle}.</li>
 *   <li>Commits one value to every visible field not yet decided on this
 *       route, queueing each untaken alternative (other select options,
 *       other radio values, the opposite checkbox state) as a new work
 *       item whose signature has not been seen.</li>
 *   <li>Follows "next" controls, repeating step 2 per form step.</li>
 *   <li>Attempts the save action and records the route whatever the outcome.</li>
 * </ol>
 *
 * <p>Interaction failures skip the field or branch involved. A failed
 * restore raises {@link StateRestoreException} and aborts the run.
 */
public class TraversalEngine {

    private static final Logger log = LoggerFactory.getLogger(TraversalEngine.class);

    /** Bound on discovery passes within one form step. */
    static final int MAX_FIELD_PASSES = 200;

    private final ExplorerConfig config;
    private final String formName;
    private final ValueSuggester suggester;
    private final RouteRecorder recorder;

    /** Pending traversal path: stages taken so far and the state to resume from. */
    record WorkItem(List<Stage> stagesSoFar, StateHandle handle) {
        WorkItem {
            stagesSoFar = List.copyOf(stagesSoFar);
        }
    }

    // ── Construction ──────────────────────────────────────────────────────

    public TraversalEngine(ExplorerConfig config, String formName) {
        this(config, formName, new ValueSuggester(), new RouteRecorder());
    }

    public TraversalEngine(ExplorerConfig config, String formName,
                           ValueSuggester suggester, RouteRecorder recorder) {
        this.config    = config;
        this.formName  = formName;
        this.suggester = suggester;
        this.recorder  = recorder;
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Explores every reachable route and consolidates the result.
     *
     * @throws ExplorationException when the run has to be aborted
     */
    public ExplorationResult explore(PageObserver observer) {
        ExplorationContext context = run(observer);
        return new FieldConsolidation(config.getSummaryColumns()).consolidate(context);
    }

    /** Explores every reachable route and returns the raw run state. */
    public ExplorationContext run(PageObserver observer) {
        ExplorationContext context = new ExplorationContext(formName);
        Deque<WorkItem> stack = new ArrayDeque<>();
        stack.push(new WorkItem(List.of(), observer.captureStateHandle()));
        log.info("Exploring form '{}' (max {} routes)", formName, config.getMaxRoutes());

        while (!stack.isEmpty()) {
            if (context.routeCount() >= config.getMaxRoutes()) {
                log.warn("Route cap of {} reached - {} queued branch(es) left unexplored",
                        config.getMaxRoutes(), stack.size());
                break;
            }
            exploreRoute(observer, context, stack.pop(), stack);
        }

        log.info("Exploration of '{}' finished: {} route(s), {} field(s)",
                formName, context.routeCount(), context.tracker().fieldIds().size());
        return context;
    }

    // ── Route exploration ─────────────────────────────────────────────────

    private void exploreRoute(PageObserver observer, ExplorationContext context,
                              WorkItem item, Deque<WorkItem> stack) {
        restore(observer, item.handle());
        List<Stage> stages = new ArrayList<>(item.stagesSoFar());
        stages.addAll(observer.drainInteractions());

        RouteState state = new RouteState(entityName(item.stagesSoFar()));
        int advances = 0;
        while (true) {
            commitVisibleFields(observer, context, stages, stack, state);
            if (advances >= config.getMaxStepsPerRoute()) {
                log.warn("Step limit of {} reached on form '{}'", config.getMaxStepsPerRoute(), formName);
                break;
            }
            if (!advanceSafely(observer)) break;
            advances++;
            stages.addAll(observer.drainInteractions());
            log.debug("Advanced to step {}", advances + 1);
        }

        TerminalOutcome outcome = terminalSafely(observer);
        stages.addAll(observer.drainInteractions());
        recorder.record(context, stages, branchPreconditions(stages), outcome);
    }

    /** Repeatedly picks the first undecided field so fields revealed by a commit are picked up. */
    private void commitVisibleFields(PageObserver observer, ExplorationContext context,
                                     List<Stage> stages, Deque<WorkItem> stack, RouteState state) {
        for (int pass = 0; pass < MAX_FIELD_PASSES; pass++) {
            List<FieldDescriptor> fields = discover(observer);
            stages.addAll(observer.drainInteractions());

            FieldDescriptor next = null;
            for (FieldDescriptor f : fields) {
                if (!isDecided(stages, f.getFieldId()) && !state.skipped.contains(f.getFieldId())) {
                    next = f;
                    break;
                }
            }
            if (next == null) return;

            if (!commitField(observer, context, next, stages, stack, state)) {
                state.skipped.add(next.getFieldId());
            }
        }
        log.warn("Gave up after {} discovery passes on form '{}'", MAX_FIELD_PASSES, formName);
    }

    /**
     * Commits one value to {@code field} and queues its alternatives.
     *
     * @return false when the field could not be set
     */
    private boolean commitField(PageObserver observer, ExplorationContext context, FieldDescriptor field,
                                List<Stage> stages, Deque<WorkItem> stack, RouteState state) {
        List<Precondition> preconditions = priorValues(stages);
        List<BranchAction> alternatives = new ArrayList<>();
        String value;

        switch (field.getFieldType()) {
            case SELECT -> {
                if (field.getOptions().isEmpty()) {
                    log.debug("Select '{}' has no options - skipping", field.getFieldId());
                    return false;
                }
                value = field.getOptions().get(0);
                if (!perform(observer, List.of(
                        PrimitiveAction.click(field.getLocatorHint()),
                        PrimitiveAction.selectByText(field.getLocatorHint(), value)))) {
                    return false;
                }
                for (String option : field.getOptions().subList(1, field.getOptions().size())) {
                    alternatives.add(BranchAction.select(field, option));
                }
            }
            case RADIO -> {
                value = null;
                for (String option : field.getOptions()) {
                    if (perform(observer, List.of(PrimitiveAction.click(field.locatorFor(option))))) {
                        value = option;
                        break;
                    }
                }
                if (value == null) return false;
                for (String option : field.getOptions()) {
                    if (!option.equals(value)) alternatives.add(BranchAction.radio(field, option));
                }
            }
            case CHECKBOX -> {
                if (!field.isChecked()
                        && !perform(observer, List.of(PrimitiveAction.toggle(field.getLocatorHint())))) {
                    return false;
                }
                value = "true";
                alternatives.add(BranchAction.checkbox(field, false));
            }
            case OTHER -> value = field.getCurrentValue();
            default -> {
                value = freeTextValue(field, state);
                if (!perform(observer, List.of(PrimitiveAction.setValue(field.getLocatorHint(), value)))) {
                    return false;
                }
            }
        }

        FieldObservation observation = observation(field, value, preconditions);
        List<Stage> prefix = List.copyOf(stages);
        stages.add(FieldStage.committed(observation));
        log.debug("Committed {} = '{}'", field.getFieldId(), value);

        for (BranchAction branch : alternatives) {
            queueBranch(observer, context, field, branch, prefix, preconditions, stack);
        }
        return true;
    }

    private void queueBranch(PageObserver observer, ExplorationContext context, FieldDescriptor field,
                             BranchAction branch, List<Stage> prefix, List<Precondition> preconditions,
                             Deque<WorkItem> stack) {
        if (!context.markVisited(BranchSignature.of(prefix, branch))) {
            log.debug("Branch {} already queued - skipping", branch);
            return;
        }
        StateHandle preBranch = observer.captureStateHandle();
        try {
            if (!perform(observer, branch.getActions())) {
                log.warn("Could not perform {} - branch skipped", branch);
                return;
            }
            StateHandle branched = observer.captureStateHandle();
            List<Stage> stagesSoFar = new ArrayList<>(prefix);
            stagesSoFar.add(new FieldStage(observation(field, branch.getValue(), preconditions), branch));
            stack.push(new WorkItem(stagesSoFar, branched));
            log.debug("Queued {}", branch);
        } finally {
            restore(observer, preBranch);
            observer.drainInteractions();
        }
    }

    // ── Observer calls ────────────────────────────────────────────────────

    private void restore(PageObserver observer, StateHandle handle) {
        try {
            observer.restoreState(handle);
        } catch (StateRestoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StateRestoreException(handle, e);
        }
    }

    /**
     * Queries the visible fields, retrying once. A route recorded without
     * discovery would report every field as hidden, so a second failure
     * aborts the run.
     */
    private List<FieldDescriptor> discover(PageObserver observer) {
        try {
            return observer.currentInteractableFields();
        } catch (RuntimeException first) {
            log.warn("Field discovery failed, retrying: {}", first.getMessage());
            try {
                return observer.currentInteractableFields();
            } catch (RuntimeException e) {
                throw new ExplorationException("Field discovery failed twice on form '" + formName + "'", e);
            }
        }
    }

    private static boolean perform(PageObserver observer, List<PrimitiveAction> actions) {
        try {
            return observer.performAll(actions);
        } catch (ActionFailedException e) {
            log.warn("Action failed: {}", e.getMessage());
            return false;
        }
    }

    private static boolean advanceSafely(PageObserver observer) {
        try {
            return observer.advanceIfPossible();
        } catch (ActionFailedException e) {
            log.warn("Next action failed: {}", e.getMessage());
            return false;
        }
    }

    private static TerminalOutcome terminalSafely(PageObserver observer) {
        try {
            return observer.attemptTerminalAction();
        } catch (ActionFailedException e) {
            log.warn("Save action failed: {}", e.getMessage());
            return TerminalOutcome.notAttempted();
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private String freeTextValue(FieldDescriptor field, RouteState state) {
        if (config.isFillNameField() && !state.nameFilled && suggester.isEntityNameField(field)) {
            state.nameFilled = true;
            return state.entityName;
        }
        return suggester.suggest(field);
    }

    /** {@code <prefix><form>_<branch choices or "base">}, e.g. {@code tested_orders_country_UK}. */
    String entityName(List<Stage> stagesSoFar) {
        List<Precondition> choices = branchPreconditions(stagesSoFar);
        String hint = choices.isEmpty()
                ? RouteRecorder.BASE_ROUTE_NAME
                : choices.stream().map(p -> p.fieldId() + "_" + p.value()).collect(Collectors.joining("_"));
        return config.getEntityPrefix() + slug(formName) + "_" + slug(hint);
    }

    private static String slug(String s) {
        if (s == null || s.isBlank()) return "form";
        return s.trim().replaceAll("[^A-Za-z0-9]+", "_").toLowerCase(Locale.ROOT);
    }

    private static FieldObservation observation(FieldDescriptor field, String value,
                                                List<Precondition> preconditions) {
        return new FieldObservation(field.getFieldId(), field.getLabel(), field.getLocatorHint(),
                field.getFieldType(), value, preconditions);
    }

    private static boolean isDecided(List<Stage> stages, String fieldId) {
        for (Stage s : stages) {
            if (s instanceof FieldStage fs && fs.getFieldId().equals(fieldId)) return true;
        }
        return false;
    }

    /** Every field value set so far on the route, in stage order; a later value replaces an earlier one. */
    static List<Precondition> priorValues(List<Stage> stages) {
        Map<String, String> values = new LinkedHashMap<>();
        for (Stage s : stages) {
            if (s instanceof FieldStage fs && fs.getValue() != null) {
                values.put(fs.getFieldId(), fs.getValue());
            }
        }
        List<Precondition> out = new ArrayList<>();
        values.forEach((id, value) -> out.add(new Precondition(id, value)));
        return out;
    }

    /** The branch choices among {@code stages}, in stage order. */
    static List<Precondition> branchPreconditions(List<Stage> stages) {
        List<Precondition> out = new ArrayList<>();
        for (Stage s : stages) {
            if (s instanceof FieldStage fs && fs.fromBranch()) {
                out.add(new Precondition(fs.getFieldId(), fs.getValue()));
            }
        }
        return out;
    }

    /** Per-route mutable bookkeeping. */
    private static final class RouteState {
        final Set<String> skipped = new HashSet<>();
        final String entityName;
        boolean nameFilled;

        RouteState(String entityName) {
            this.entityName = entityName;
        }
    }
}
