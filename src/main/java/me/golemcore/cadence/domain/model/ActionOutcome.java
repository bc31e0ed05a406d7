package me.golemcore.cadence.domain.model;

import lombok.Value;

/**
 * An executed request paired with its result, in plan order.
 */
@Value
public class ActionOutcome {

    ActionRequest request;
    ActionResult result;

    public ExecutedAction toExecutedAction() {
        return ExecutedAction.of(request, result);
    }
}
