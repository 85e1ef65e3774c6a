package org.carball.showplan.analyzer;

import org.carball.showplan.config.PlanThresholds;
import org.carball.showplan.model.plan.FunctionPlan;
import org.carball.showplan.model.plan.FunctionPlanKind;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class CostAnnotatorTest {

    @Test
    public void shouldGiveSingleScanTheWholeCost() {
        PlanNode root = node(PlanNode.STATEMENT_NODE_ID, 0.25);
        PlanNode scan = node(0, 0.25);
        root.addChild(scan);

        new CostAnnotator().annotate(statement(root));

        assertThat(root.getCostPercent()).isEqualTo(100);
        assertThat(scan.getCostPercent()).isEqualTo(100);
        assertThat(scan.getEstimatedOperatorCost()).isEqualTo(0.25);
        assertThat(root.getEstimatedOperatorCost()).isZero();
    }

    @Test
    public void shouldComputeShareOfRootSubtreeCost() {
        PlanNode root = node(PlanNode.STATEMENT_NODE_ID, 4.0);
        PlanNode join = node(0, 4.0);
        PlanNode build = node(1, 1.0);
        PlanNode probe = node(2, 2.0);
        root.addChild(join);
        join.addChild(build);
        join.addChild(probe);

        new CostAnnotator().annotate(statement(root));

        assertThat(join.getCostPercent()).isEqualTo(100);
        assertThat(build.getCostPercent()).isEqualTo(25);
        assertThat(probe.getCostPercent()).isEqualTo(50);
        assertThat(join.getEstimatedOperatorCost()).isCloseTo(1.0, within(1e-9));
        assertThat(build.isExpensive()).isTrue();
        assertThat(probe.isExpensive()).isTrue();
    }

    @Test
    public void shouldFlagOperatorsAgainstConfiguredThreshold() {
        PlanNode root = node(PlanNode.STATEMENT_NODE_ID, 10.0);
        PlanNode sort = node(0, 10.0);
        PlanNode scan = node(1, 3.0);
        root.addChild(sort);
        sort.addChild(scan);

        CostAnnotator annotator = new CostAnnotator(PlanThresholds.builder().expensiveOperatorPercent(40).build());
        annotator.annotate(statement(root));

        assertThat(annotator.getExpensiveOperatorPercent()).isEqualTo(40);
        assertThat(sort.isExpensive()).isTrue();
        assertThat(scan.getCostPercent()).isEqualTo(30);
        assertThat(scan.isExpensive()).isFalse();
    }

    @Test
    public void shouldGiveEveryNodeZeroWhenRootCostIsZero() {
        PlanNode root = node(PlanNode.STATEMENT_NODE_ID, 0);
        PlanNode scan = node(0, 0);
        root.addChild(scan);

        new CostAnnotator().annotate(statement(root));

        assertThat(root.getCostPercent()).isZero();
        assertThat(scan.getCostPercent()).isZero();
        assertThat(root.isExpensive()).isFalse();
    }

    @Test
    public void shouldClampPercentWhenChildStatesMoreThanRoot() {
        PlanNode root = node(PlanNode.STATEMENT_NODE_ID, 1.0);
        PlanNode spool = node(0, 3.0);
        root.addChild(spool);

        new CostAnnotator().annotate(statement(root));

        assertThat(spool.getCostPercent()).isEqualTo(100);
        assertThat(root.getEstimatedOperatorCost()).isZero();
    }

    @Test
    public void shouldAnnotateFunctionPlanStatements() {
        PlanNode nestedRoot = node(PlanNode.STATEMENT_NODE_ID, 2.0);
        PlanNode nestedScan = node(0, 1.0);
        nestedRoot.addChild(nestedScan);

        FunctionPlan udf = new FunctionPlan("dbo.fn_Tax", FunctionPlanKind.UDF);
        udf.addStatement(statement(nestedRoot));
        PlanStatement caller = new PlanStatement();
        caller.addFunctionPlan(udf);

        new CostAnnotator().annotate(caller);

        assertThat(nestedRoot.getCostPercent()).isEqualTo(100);
        assertThat(nestedScan.getCostPercent()).isEqualTo(50);
    }

    private static PlanNode node(int nodeId, double subtreeCost) {
        PlanNode node = new PlanNode();
        node.setNodeId(nodeId);
        node.setEstimatedTotalSubtreeCost(subtreeCost);
        return node;
    }

    private static PlanStatement statement(PlanNode root) {
        PlanStatement statement = new PlanStatement();
        statement.setStatementType("SELECT");
        statement.setRootNode(root);
        return statement;
    }
}
