package org.carball.showplan.model.plan;

import lombok.Data;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Plan of a UDF or stored procedure invoked by a statement. Self-contained: its statements never
 * reference the statement that owns it.
 */
@Data
@RequiredArgsConstructor
public class FunctionPlan {
    private final String procName;
    private final FunctionPlanKind kind;
    private boolean nativelyCompiled;
    private List<PlanStatement> statements = new ArrayList<>();

    public void addStatement(PlanStatement statement) {
        statements.add(statement);
    }
}
