package me.golemcore.cadence.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Trace entry of an action executed during a turn.
 */
@Value
@Builder
public class ExecutedAction {

    ActionType type;
    String description;
    boolean success;
    String summary;
    String error;

    public static ExecutedAction of(ActionRequest request, ActionResult result) {
        return ExecutedAction.builder()
                .type(request.getActionType())
                .description(request.getDescription())
                .success(result.isSuccess())
                .summary(result.getSummary())
                .error(result.getError())
                .build();
    }
}
