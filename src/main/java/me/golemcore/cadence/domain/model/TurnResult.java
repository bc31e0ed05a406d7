package me.golemcore.cadence.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What one coordinator turn returns: the reply, the trace of executed actions,
 * the payloads of successful ones and any actions left awaiting approval.
 */
@Value
@Builder
public class TurnResult {

    String response;

    @Singular("actionTaken")
    List<ExecutedAction> actionsTaken;

    @Singular("dataItem")
    List<Object> data;

    boolean requiresApproval;

    @Singular
    List<ActionRequest> pendingActions;

    @Builder.Default
    PlanMeta meta = PlanMeta.empty();
}
