package me.golemcore.cadence.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Model, token, latency and cost figures of the planning call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanMeta {

    private String model;
    private int inputTokens;
    private int outputTokens;
    private long latencyMs;
    private double costUsd;

    public static PlanMeta empty() {
        return PlanMeta.builder().build();
    }
}
