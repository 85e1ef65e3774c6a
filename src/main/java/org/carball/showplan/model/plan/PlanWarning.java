package org.carball.showplan.model.plan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanWarning {
    private String warningType;
    private String message;
    private PlanWarningSeverity severity;
    private SpillDetail spillDetail;

    public boolean hasSpillDetail() {
        return spillDetail != null;
    }
}
