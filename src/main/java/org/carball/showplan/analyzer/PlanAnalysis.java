package org.carball.showplan.analyzer;

import org.carball.showplan.layout.StatementLayout;
import org.carball.showplan.model.plan.ParsedPlan;

import java.util.List;

/**
 * A parsed plan together with the layout of each of its statements, in document order.
 */
public record PlanAnalysis(ParsedPlan plan, List<StatementLayout> layouts) {

    public PlanAnalysis {
        layouts = List.copyOf(layouts);
    }
}
