package me.golemcore.cadence.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Validated plan produced for one coordinator message.
 *
 * <p>
 * {@code rawText} marks a plan built from unparseable model output or from a
 * failed model call: its response template is returned to the coordinator as
 * is. The plan-level {@code requiresApproval} flag is informational; only the
 * per-action flags gate execution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionPlan {

    private String thinking;

    @Builder.Default
    private List<ActionRequest> actions = new ArrayList<>();

    private String responseTemplate;
    private boolean requiresApproval;
    private boolean rawText;

    @Builder.Default
    private PlanMeta meta = PlanMeta.empty();

    public static ActionPlan fallback(String thinking, String text, PlanMeta meta) {
        return ActionPlan.builder()
                .thinking(thinking)
                .responseTemplate(text)
                .rawText(true)
                .meta(meta != null ? meta : PlanMeta.empty())
                .build();
    }
}
