package org.carball.showplan.model.plan;

public enum FunctionPlanKind {
    UDF,
    STORED_PROCEDURE
}
