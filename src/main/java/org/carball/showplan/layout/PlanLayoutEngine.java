package org.carball.showplan.layout;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.showplan.model.plan.FunctionPlan;
import org.carball.showplan.model.plan.ParsedPlan;
import org.carball.showplan.model.plan.PlanBatch;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns diagram coordinates to a statement's operators, root on the left and data flowing in from
 * the right.
 * <p>
 * X depends only on depth. Y is assigned bottom-up: each leaf takes the next free row and each
 * internal node sits level with its first child, so the primary data path forms a straight spine and
 * secondary inputs fan out below it. Rows are as tall as the node's content needs.
 * <p>
 * The engine keeps no state between calls and may be shared between threads. Running it twice on the
 * same tree yields the same coordinates.
 */
@Slf4j
public class PlanLayoutEngine {

    @Getter
    private final LayoutSettings settings;

    public PlanLayoutEngine() {
        this(LayoutSettings.defaults());
    }

    public PlanLayoutEngine(LayoutSettings settings) {
        this.settings = settings;
    }

    /**
     * Lays out one statement in place and returns the canvas it needs. A statement without a root
     * operator is left untouched and gets {@link CanvasExtents#EMPTY}.
     */
    public CanvasExtents layout(PlanStatement statement) {
        if (statement == null || !statement.hasRootNode()) {
            return CanvasExtents.EMPTY;
        }
        PlanNode root = statement.getRootNode();

        assignX(root, 0);
        assignY(root, new RowCursor(settings.getPadding()));

        double width = 0;
        double height = 0;
        for (PlanNode node : root.descendantsAndSelf()) {
            width = Math.max(width, node.getX() + settings.getNodeWidth() + settings.getPadding());
            height = Math.max(height, node.getY() + nodeHeight(node) + settings.getPadding());
        }

        log.debug("Laid out {} statement: {}x{}", statement.getStatementType(), width, height);
        return new CanvasExtents(width, height);
    }

    /**
     * Lays out every statement of the plan in document order. Statements of a function plan follow
     * the statement that invokes it.
     */
    public List<StatementLayout> layoutAll(ParsedPlan plan) {
        List<StatementLayout> layouts = new ArrayList<>();
        for (PlanBatch batch : plan.getBatches()) {
            for (PlanStatement statement : batch.getStatements()) {
                layoutWithFunctionPlans(statement, layouts);
            }
        }
        return layouts;
    }

    private void layoutWithFunctionPlans(PlanStatement statement, List<StatementLayout> layouts) {
        layouts.add(new StatementLayout(statement, layout(statement)));
        for (FunctionPlan functionPlan : statement.getFunctionPlans()) {
            for (PlanStatement nested : functionPlan.getStatements()) {
                layoutWithFunctionPlans(nested, layouts);
            }
        }
    }

    /**
     * Height of a node's box: icon, name and cost lines, plus three lines of actual runtime figures
     * and one line for the object name when present. Never below the minimum height.
     */
    public double nodeHeight(PlanNode node) {
        double height = settings.getIconRow() + 2 * settings.getPrimaryLine() + settings.getNodePadding();
        if (node.isHasActualStats()) {
            height += settings.getPrimaryLine() + 2 * settings.getSecondaryLine();
        }
        if (node.hasObjectName()) {
            height += settings.getSecondaryLine();
        }
        return Math.max(settings.getMinNodeHeight(), height);
    }

    private void assignX(PlanNode node, int depth) {
        node.setX(settings.getPadding() + depth * settings.getHorizontalSpacing());
        for (PlanNode child : node.getChildren()) {
            assignX(child, depth + 1);
        }
    }

    private void assignY(PlanNode node, RowCursor cursor) {
        if (node.isLeaf()) {
            node.setY(cursor.nextY);
            cursor.nextY += nodeHeight(node) + settings.getVerticalSpacing();
            return;
        }
        for (PlanNode child : node.getChildren()) {
            assignY(child, cursor);
        }
        node.setY(node.getChildren().get(0).getY());
        // A parent taller than its subtree's rows must not reach into the next row of its column
        cursor.nextY = Math.max(cursor.nextY, node.getY() + nodeHeight(node) + settings.getVerticalSpacing());
    }

    // Per-call state of the Y pass
    private static final class RowCursor {
        private double nextY;

        private RowCursor(double start) {
            this.nextY = start;
        }
    }
}
