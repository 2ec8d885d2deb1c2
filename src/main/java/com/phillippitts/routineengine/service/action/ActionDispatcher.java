package com.phillippitts.routineengine.service.action;

import com.phillippitts.routineengine.domain.ActionResult;
import com.phillippitts.routineengine.domain.Routine;
import com.phillippitts.routineengine.domain.RoutineAction;
import com.phillippitts.routineengine.exception.ActionExecutionException;
import com.phillippitts.routineengine.service.connector.ConnectorHandler;
import com.phillippitts.routineengine.service.connector.ConnectorRegistry;
import com.phillippitts.routineengine.service.connector.ConnectorResult;
import com.phillippitts.routineengine.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs a routine's actions strictly in order and returns one {@link ActionResult} per action.
 *
 * <p>A failing action never stops the pipeline and never throws; its failure is recorded in the
 * result list.
 */
public class ActionDispatcher {

    private static final Logger LOG = LogManager.getLogger(ActionDispatcher.class);

    static final String MISSING_SERVICE_OR_METHOD = "Connector action missing service or method";
    static final String STATE_CHANGE_REQUIRES_SERVICE = "State change action requires a service";
    static final String DEFAULT_STATE_METHOD = "set_state";

    private final ConnectorRegistry registry;
    private final NotificationSender notifications;

    public ActionDispatcher(ConnectorRegistry registry, NotificationSender notifications) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.notifications = Objects.requireNonNull(notifications, "notifications");
    }

    public List<ActionResult> run(List<RoutineAction> actions, Routine routine) {
        List<ActionResult> results = new ArrayList<>(actions.size());
        for (int i = 0; i < actions.size(); i++) {
            RoutineAction action = actions.get(i);
            ActionResult result = runOne(action, routine);
            if (!result.success()) {
                LOG.warn("Action {} ({}) of routine {} failed: {}", i + 1, action.type(), routine.id(), result.error());
            }
            results.add(result);
        }
        return results;
    }

    ActionResult runOne(RoutineAction action, Routine routine) {
        return switch (action.kind()) {
            case CONNECTOR_CALL -> connectorCall(action);
            case NOTIFICATION -> notification(action, routine);
            case STATE_CHANGE -> stateChange(action);
            case CUSTOM -> ActionResult.failed("Unsupported action type: " + action.type());
            case UNKNOWN -> ActionResult.failed("Unknown action type: " + action.type());
        };
    }

    private ActionResult connectorCall(RoutineAction action) {
        if (isBlank(action.service()) || isBlank(action.method())) {
            return ActionResult.failed(MISSING_SERVICE_OR_METHOD);
        }
        return invoke(action.type(), action.service(), action.method(), action.parameters());
    }

    private ActionResult stateChange(RoutineAction action) {
        if (isBlank(action.service())) {
            return ActionResult.failed(STATE_CHANGE_REQUIRES_SERVICE);
        }
        Object method = action.parameters().get("method");
        String m = method == null || method.toString().isBlank() ? DEFAULT_STATE_METHOD : method.toString();
        return invoke(action.type(), action.service(), m, action.parameters());
    }

    private ActionResult notification(RoutineAction action, Routine routine) {
        Object raw = action.parameters().get("message");
        String message = raw == null || raw.toString().isBlank()
                ? "Routine \"" + routine.name() + "\" executed"
                : raw.toString();
        notifications.send(routine.name(), message);
        return ActionResult.ok(message);
    }

    private ActionResult invoke(String type, String service, String method, Map<String, Object> params) {
        Optional<ConnectorHandler> handler = registry.find(service);
        if (handler.isEmpty()) {
            return ActionResult.failed("No handler found for service: " + service);
        }
        LOG.debug("Invoking {}.{} with parameters {}", service, method, LogSanitizer.keysOnly(params));
        try {
            ConnectorResult result = handler.get().handle(method, params);
            if (result == null) {
                return ActionResult.failed("Connector " + service + " returned no result");
            }
            return toActionResult(service, method, result);
        } catch (RuntimeException e) {
            ActionExecutionException failure = new ActionExecutionException(type,
                    e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), e);
            LOG.warn("Connector {}.{} threw: {}", service, method, failure.getMessage(), failure);
            return ActionResult.failed(failure.getMessage());
        }
    }

    static ActionResult toActionResult(String service, String method, ConnectorResult result) {
        String message = result.success() ? service + "." + method + " succeeded" : null;
        return new ActionResult(result.success(), message, result.error(), result.data(),
                result.requiresSetup(), result.setupInstructions());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
