package org.carball.showplan.model.plan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One finding attached to a statement or an operator. Severity and message
 * stay mutable so later passes can escalate a warning in place.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PlanWarning {
    private String category;
    private String message;
    private WarningSeverity severity;
    private SpillDetail spillDetail;

    public static PlanWarning of(String category, String message, WarningSeverity severity) {
        return PlanWarning.builder()
                .category(category)
                .message(message)
                .severity(severity)
                .build();
    }

    public boolean hasSpillDetail() {
        return spillDetail != null;
    }
}
