package org.carball.showplan.model.plan;

public enum PlanWarningSeverity {
    INFO,
    WARNING,
    CRITICAL
}
