package org.carball.showplan.model.plan;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class PlanBatch {
    private List<PlanStatement> statements = new ArrayList<>();

    public void addStatement(PlanStatement statement) {
        statements.add(statement);
    }
}
