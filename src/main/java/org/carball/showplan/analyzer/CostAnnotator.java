package org.carball.showplan.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.showplan.config.PlanThresholds;
import org.carball.showplan.model.plan.FunctionPlan;
import org.carball.showplan.model.plan.ParsedPlan;
import org.carball.showplan.model.plan.PlanBatch;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;

/**
 * Computes each operator's share of its statement's cost.
 * <p>
 * {@code costPercent = round(100 * subtreeCost / rootSubtreeCost)}, clamped to [0, 100]. A root subtree
 * cost of exactly zero yields 0 for every node of the statement. An operator is expensive when its
 * percentage reaches the configured threshold.
 */
@Slf4j
public class CostAnnotator {

    private final int expensiveOperatorPercent;

    public CostAnnotator() {
        this(PlanThresholds.defaults());
    }

    public CostAnnotator(PlanThresholds thresholds) {
        this.expensiveOperatorPercent = thresholds.getExpensiveOperatorPercent();
    }

    public int getExpensiveOperatorPercent() {
        return expensiveOperatorPercent;
    }

    /**
     * Annotates every statement of the plan, including the statements of nested function plans.
     */
    public void annotate(ParsedPlan plan) {
        for (PlanBatch batch : plan.getBatches()) {
            for (PlanStatement statement : batch.getStatements()) {
                annotate(statement);
            }
        }
    }

    public void annotate(PlanStatement statement) {
        if (statement.hasRootNode()) {
            PlanNode root = statement.getRootNode();
            double rootCost = root.getEstimatedTotalSubtreeCost();
            if (rootCost == 0) {
                log.debug("Statement '{}' has zero subtree cost, all operators get 0%", statement.getStatementType());
            }
            for (PlanNode node : root.descendantsAndSelf()) {
                annotateNode(node, rootCost);
            }
        }

        for (FunctionPlan functionPlan : statement.getFunctionPlans()) {
            for (PlanStatement nested : functionPlan.getStatements()) {
                annotate(nested);
            }
        }
    }

    private void annotateNode(PlanNode node, double rootCost) {
        double childrenCost = 0;
        for (PlanNode child : node.getChildren()) {
            childrenCost += child.getEstimatedTotalSubtreeCost();
        }
        node.setEstimatedOperatorCost(Math.max(0, node.getEstimatedTotalSubtreeCost() - childrenCost));

        int percent = rootCost == 0 ? 0 : clamp(Math.round(100 * node.getEstimatedTotalSubtreeCost() / rootCost));
        node.setCostPercent(percent);
        node.setExpensive(percent >= expensiveOperatorPercent);
    }

    private static int clamp(long percent) {
        return (int) Math.min(100, Math.max(0, percent));
    }
}
