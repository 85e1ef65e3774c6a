package org.carball.showplan.layout;

import org.carball.showplan.model.plan.PlanStatement;

public record StatementLayout(PlanStatement statement, CanvasExtents extents) {}
