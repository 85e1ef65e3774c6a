package org.carball.showplan.parser;

import org.carball.showplan.PlanFixtures;
import org.carball.showplan.model.plan.FunctionPlan;
import org.carball.showplan.model.plan.FunctionPlanKind;
import org.carball.showplan.model.plan.ParsedPlan;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class ShowPlanParserTest {

    private ShowPlanParser parser;

    @BeforeEach
    void setUp() {
        parser = new ShowPlanParser();
    }

    @Test
    public void shouldParseSingleScanStatement() {
        ParsedPlan plan = parser.parse(PlanFixtures.load(PlanFixtures.SIMPLE_SCAN));

        assertThat(plan.getBuild()).isEqualTo("16.0.1000.6");
        assertThat(plan.getBuildVersion()).isEqualTo("1.564");
        assertThat(plan.getBatches()).hasSize(1);
        assertThat(plan.getStatementCount()).isEqualTo(1);
        assertThat(plan.getSkippedStatementCount()).isZero();

        PlanStatement statement = plan.getBatches().get(0).getStatements().get(0);
        assertThat(statement.getStatementText()).isEqualTo("SELECT Id, Name FROM dbo.Customers");
        assertThat(statement.getStatementType()).isEqualTo("SELECT");
        assertThat(statement.getStatementSubTreeCost()).isEqualTo(0.0032831);
        assertThat(statement.getStatementEstRows()).isEqualTo(42);
        assertThat(statement.getCardinalityEstimationModelVersion()).isEqualTo(160);
        assertThat(statement.getQueryHash()).isEqualTo("0x1A2B3C4D5E6F7081");
        assertThat(statement.getNonParallelPlanReason()).isEqualTo("NoParallelPlansInDesktopOrExpressEdition");
        assertThat(statement.getCompileMemoryKB()).isEqualTo(104);
        assertThat(statement.getSetOptions().ansiNulls()).isTrue();
        assertThat(statement.getSetOptions().numericRoundAbort()).isFalse();
        assertThat(statement.getHardwareProperties().estimatedAvailableDop()).isEqualTo(4);
        assertThat(statement.getMissingIndexes()).isNotNull().isEmpty();
    }

    @Test
    public void shouldWrapFirstOperatorInStatementNode() {
        ParsedPlan plan = parser.parse(PlanFixtures.load(PlanFixtures.SIMPLE_SCAN));
        PlanNode root = plan.getBatches().get(0).getStatements().get(0).getRootNode();

        assertThat(root.getNodeId()).isEqualTo(PlanNode.STATEMENT_NODE_ID);
        assertThat(root.getPhysicalOp()).isEqualTo("SELECT");
        assertThat(root.getLogicalOp()).isEqualTo("SELECT");
        assertThat(root.getEstimatedTotalSubtreeCost()).isEqualTo(0.0032831);
        assertThat(root.getEstimateRows()).isEqualTo(42);
        assertThat(root.getParent()).isNull();
        assertThat(root.getChildren()).hasSize(1);

        PlanNode scan = root.getChildren().get(0);
        assertThat(scan.getParent()).isSameAs(root);
        assertThat(scan.getNodeId()).isZero();
        assertThat(scan.getPhysicalOp()).isEqualTo("Clustered Index Scan");
        assertThat(scan.getObjectName()).isEqualTo("dbo.Customers");
        assertThat(scan.getFullObjectName()).isEqualTo("Shop.dbo.Customers.PK_Customers");
        assertThat(scan.getIndexName()).isEqualTo("PK_Customers");
        assertThat(scan.getIndexKind()).isEqualTo("Clustered");
        assertThat(scan.getStorageType()).isEqualTo("RowStore");
        assertThat(scan.getOutputColumns()).isEqualTo("Customers.Id, Customers.Name");
        assertThat(scan.getDefinedValues()).isEqualTo("Customers.Id; Customers.Name");
        assertThat(scan.getEstimatedRowSize()).isEqualTo(61);
        assertThat(scan.getTableCardinality()).isEqualTo(42);
        assertThat(scan.getExecutionMode()).isEqualTo("Row");
        assertThat(scan.isHasActualStats()).isFalse();
        assertThat(scan.isLeaf()).isTrue();
    }

    @Test
    public void shouldKeepJoinInputsInDocumentOrder() {
        ParsedPlan plan = parser.parse(PlanFixtures.load(PlanFixtures.HASH_JOIN));
        PlanNode join = plan.getBatches().get(0).getStatements().get(0).getRootNode().getChildren().get(0);

        assertThat(join.getPhysicalOp()).isEqualTo("Hash Match");
        assertThat(join.getLogicalOp()).isEqualTo("Inner Join");
        assertThat(join.hasObjectName()).isFalse();
        assertThat(join.getHashKeysBuild()).isEqualTo("Customers.Id");
        assertThat(join.getHashKeysProbe()).isEqualTo("Orders.CustomerId");
        assertThat(join.getProbeResidual()).contains("[Customers].[Id]");
        assertThat(join.getMemoryFractionInput()).isEqualTo(1.0);

        assertThat(join.getChildren()).extracting(PlanNode::getNodeId).containsExactly(1, 2);
        PlanNode build = join.getChildren().get(0);
        PlanNode probe = join.getChildren().get(1);
        assertThat(build.getObjectName()).isEqualTo("dbo.Customers");
        assertThat(build.getObjectAlias()).isEqualTo("c");
        assertThat(probe.getPhysicalOp()).isEqualTo("Index Seek");
        assertThat(probe.getSeekPredicates()).isEqualTo("'2024-01-01'");
        assertThat(probe.getPredicate()).isEqualTo("[Shop].[dbo].[Orders].[Status] as [o].[Status]=N'Open'");
        assertThat(probe.isOrdered()).isTrue();
        assertThat(probe.getScanDirection()).isEqualTo("FORWARD");
    }

    @Test
    public void shouldAnnotateCostsWhileParsing() {
        ParsedPlan plan = parser.parse(PlanFixtures.load(PlanFixtures.HASH_JOIN));
        PlanNode root = plan.getBatches().get(0).getStatements().get(0).getRootNode();
        PlanNode join = root.getChildren().get(0);

        assertThat(root.getCostPercent()).isEqualTo(100);
        assertThat(join.getCostPercent()).isEqualTo(100);
        assertThat(join.getChildren().get(0).getCostPercent()).isEqualTo(10);
        assertThat(join.getChildren().get(1).getCostPercent()).isEqualTo(50);
        assertThat(join.getEstimatedOperatorCost()).isCloseTo(0.4, within(1e-9));
    }

    @Test
    public void shouldAggregateActualRuntimeCountersAcrossThreads() {
        ParsedPlan plan = parser.parse(PlanFixtures.load(PlanFixtures.ACTUAL_SORT_SPILL));
        PlanStatement statement = plan.getBatches().get(0).getStatements().get(0);
        PlanNode sort = statement.getRootNode().getChildren().get(0);

        assertThat(sort.isHasActualStats()).isTrue();
        assertThat(sort.getActualRows()).isEqualTo(1000);
        assertThat(sort.getActualExecutions()).isEqualTo(2);
        assertThat(sort.getActualCpuMs()).isEqualTo(22);
        assertThat(sort.getActualElapsedMs()).isEqualTo(45);
        assertThat(sort.getActualLogicalReads()).isEqualTo(300);
        assertThat(sort.getActualPhysicalReads()).isEqualTo(3);
        assertThat(sort.getActualExecutionMode()).isEqualTo("Row");
        assertThat(sort.getPerThreadStats()).hasSize(2);
        assertThat(sort.getPerThreadStats().get(1).getThreadId()).isEqualTo(2);
        assertThat(sort.isParallel()).isTrue();
        assertThat(sort.getOrderBy()).isEqualTo("Orders.OrderDate DESC");

        PlanNode scan = sort.getChildren().get(0);
        assertThat(scan.getActualRowsRead()).isEqualTo(1000);
        assertThat(scan.getActualReadAheads()).isEqualTo(48);
    }

    @Test
    public void shouldReadStatementLevelRuntimeDetails() {
        ParsedPlan plan = parser.parse(PlanFixtures.load(PlanFixtures.ACTUAL_SORT_SPILL));
        PlanStatement statement = plan.getBatches().get(0).getStatements().get(0);

        assertThat(statement.getDegreeOfParallelism()).isEqualTo(2);
        assertThat(statement.getMemoryGrant().getGrantedMemoryKB()).isEqualTo(1024);
        assertThat(statement.getMemoryGrant().getMaxUsedMemoryKB()).isEqualTo(16);
        assertThat(statement.getQueryTimeStats().cpuTimeMs()).isEqualTo(40);
        assertThat(statement.getQueryTimeStats().elapsedTimeMs()).isEqualTo(55);
        assertThat(statement.getWaitStats()).hasSize(1);
        assertThat(statement.getWaitStats().get(0).waitType()).isEqualTo("IO_COMPLETION");
        assertThat(statement.getThreadStats().usedThreads()).isEqualTo(2);
        assertThat(statement.getThreadStats().reservations()).hasSize(1);
        assertThat(statement.getPlanWarnings()).hasSize(3);
    }

    @Test
    public void shouldFlattenConditionalCursorAndFunctionStatements() {
        ParsedPlan plan = parser.parse(PlanFixtures.load(PlanFixtures.MULTI_STATEMENT));

        List<PlanStatement> statements = plan.getBatches().get(0).getStatements();
        assertThat(statements).extracting(PlanStatement::getStatementType)
                .containsExactly("COND", "UPDATE", "SELECT", "SELECT", "EXECUTE PROC", "SELECT");

        PlanStatement condition = statements.get(0);
        assertThat(condition.getStatementText()).startsWith("IF EXISTS");
        assertThat(condition.getRootNode().getPhysicalOp()).isEqualTo("COND");

        PlanNode update = statements.get(1).getRootNode().getChildren().get(0);
        assertThat(update.getPhysicalOp()).isEqualTo("Clustered Index Update");
        assertThat(update.getChildren()).hasSize(1);
        assertThat(update.getObjectName()).isEqualTo("dbo.Orders");
        assertThat(update.getChildren().get(0).getIndexName()).isEqualTo("IX_Orders_Status");
    }

    @Test
    public void shouldCarryCursorMetadata() {
        ParsedPlan plan = parser.parse(PlanFixtures.load(PlanFixtures.MULTI_STATEMENT));
        PlanStatement cursor = plan.getBatches().get(0).getStatements().get(3);

        assertThat(cursor.getStatementText()).isEqualTo("Cursor: order_cursor (FetchQuery)");
        assertThat(cursor.getStatementType()).isEqualTo("SELECT");
        assertThat(cursor.getStatementSubTreeCost()).isEqualTo(0.0032831);
        assertThat(cursor.getCursor().cursorName()).isEqualTo("order_cursor");
        assertThat(cursor.getCursor().operationType()).isEqualTo("FetchQuery");
        assertThat(cursor.getCursor().actualType()).isEqualTo("Dynamic");
        assertThat(cursor.getCursor().forwardOnly()).isTrue();
    }

    @Test
    public void shouldKeepStoredProcedureCallerWithoutOwnPlan() {
        ParsedPlan plan = parser.parse(PlanFixtures.load(PlanFixtures.MULTI_STATEMENT));
        PlanStatement exec = plan.getBatches().get(0).getStatements().get(4);

        assertThat(exec.hasRootNode()).isFalse();
        assertThat(exec.getFunctionPlans()).hasSize(1);

        FunctionPlan procedure = exec.getFunctionPlans().get(0);
        assertThat(procedure.getProcName()).isEqualTo("dbo.usp_RefreshTotals");
        assertThat(procedure.getKind()).isEqualTo(FunctionPlanKind.STORED_PROCEDURE);
        assertThat(procedure.getStatements()).hasSize(1);

        PlanNode aggregate = procedure.getStatements().get(0).getRootNode().getChildren().get(0);
        assertThat(aggregate.getPhysicalOp()).isEqualTo("Stream Aggregate");
        assertThat(aggregate.getCostPercent()).isEqualTo(100);
        assertThat(aggregate.getChildren().get(0).getCostPercent()).isEqualTo(90);
    }

    @Test
    public void shouldAttachUdfPlansAndScalarUdfReferences() {
        ParsedPlan plan = parser.parse(PlanFixtures.load(PlanFixtures.MULTI_STATEMENT));
        PlanStatement select = plan.getBatches().get(0).getStatements().get(5);

        PlanNode compute = select.getRootNode().getChildren().get(0);
        assertThat(compute.getScalarUdfs()).hasSize(1);
        assertThat(compute.getScalarUdfs().get(0).functionName()).isEqualTo("Shop.dbo.fn_Tax");
        assertThat(compute.getDefinedValues()).startsWith("Expr1001 = ");

        assertThat(select.getFunctionPlans()).hasSize(1);
        FunctionPlan udf = select.getFunctionPlans().get(0);
        assertThat(udf.getKind()).isEqualTo(FunctionPlanKind.UDF);
        assertThat(udf.getStatements()).hasSize(1);
        assertThat(udf.getStatements().get(0).getRootNode().getChildren().get(0).getObjectName())
                .isEqualTo("dbo.TaxRates");
    }

    @Test
    public void shouldCountStatementsWithoutRootOperator() {
        ParsedPlan plan = parser.parse(PlanFixtures.load(PlanFixtures.MULTI_STATEMENT));

        // SET NOCOUNT, the cursor's PopulateQuery and the UDF's RETURN
        assertThat(plan.getSkippedStatementCount()).isEqualTo(3);
        assertThat(plan.getStatementCount()).isEqualTo(6);
    }

    @Test
    public void shouldFallBackToStatementsOutsideBatches() {
        String xml = """
                <ShowPlanXML xmlns="http://schemas.microsoft.com/sqlserver/2004/07/showplan" Version="1.5" Build="15.0.2000.5">
                  <StmtSimple StatementText="SELECT 1" StatementType="SELECT" StatementSubTreeCost="0">
                    <QueryPlan>
                      <RelOp NodeId="0" PhysicalOp="Constant Scan" LogicalOp="Constant Scan" EstimateRows="1" EstimatedTotalSubtreeCost="0.0000011">
                        <ConstantScan />
                      </RelOp>
                    </QueryPlan>
                  </StmtSimple>
                </ShowPlanXML>
                """;

        ParsedPlan plan = parser.parse(xml);

        assertThat(plan.getBatches()).hasSize(1);
        PlanStatement statement = plan.getBatches().get(0).getStatements().get(0);
        assertThat(statement.getRootNode().getChildren().get(0).getPhysicalOp()).isEqualTo("Constant Scan");
        // A statement without its own cost takes the cost of its first operator
        assertThat(statement.getStatementSubTreeCost()).isEqualTo(0.0000011);
        assertThat(statement.getRootNode().getEstimatedTotalSubtreeCost()).isEqualTo(0.0000011);
    }

    @Test
    public void shouldKeepUdfStatementsInsideCallerWhenFallingBack() {
        String xml = """
                <ShowPlanXML xmlns="http://schemas.microsoft.com/sqlserver/2004/07/showplan" Version="1.5" Build="15.0.2000.5">
                  <StmtSimple StatementText="SELECT dbo.f(1)" StatementType="SELECT" StatementSubTreeCost="0.1">
                    <QueryPlan>
                      <RelOp NodeId="0" PhysicalOp="Compute Scalar" LogicalOp="Compute Scalar" EstimateRows="1" EstimatedTotalSubtreeCost="0.1">
                        <ComputeScalar>
                          <RelOp NodeId="1" PhysicalOp="Constant Scan" LogicalOp="Constant Scan" EstimateRows="1" EstimatedTotalSubtreeCost="0.05">
                            <ConstantScan />
                          </RelOp>
                        </ComputeScalar>
                      </RelOp>
                    </QueryPlan>
                    <UDF ProcName="dbo.f">
                      <Statements>
                        <StmtSimple StatementText="RETURN 1" StatementType="RETURN" StatementSubTreeCost="0.01">
                          <QueryPlan>
                            <RelOp NodeId="0" PhysicalOp="Constant Scan" LogicalOp="Constant Scan" EstimateRows="1" EstimatedTotalSubtreeCost="0.01">
                              <ConstantScan />
                            </RelOp>
                          </QueryPlan>
                        </StmtSimple>
                      </Statements>
                    </UDF>
                  </StmtSimple>
                </ShowPlanXML>
                """;

        ParsedPlan plan = parser.parse(xml);

        assertThat(plan.getBatches()).hasSize(1);
        List<PlanStatement> statements = plan.getBatches().get(0).getStatements();
        assertThat(statements).extracting(PlanStatement::getStatementText).containsExactly("SELECT dbo.f(1)");
        assertThat(plan.getStatementCount()).isEqualTo(1);

        List<FunctionPlan> functionPlans = statements.get(0).getFunctionPlans();
        assertThat(functionPlans).hasSize(1);
        assertThat(functionPlans.get(0).getKind()).isEqualTo(FunctionPlanKind.UDF);
        assertThat(functionPlans.get(0).getStatements()).extracting(PlanStatement::getStatementText)
                .containsExactly("RETURN 1");
    }

    @Test
    public void shouldReturnEmptyPlanWhenNoStatementHasOperators() {
        String xml = """
                <ShowPlanXML xmlns="http://schemas.microsoft.com/sqlserver/2004/07/showplan" Version="1.5" Build="15.0.2000.5">
                  <BatchSequence>
                    <Batch>
                      <Statements>
                        <StmtSimple StatementText="SET NOCOUNT ON" StatementType="SET ON/OFF" />
                      </Statements>
                    </Batch>
                  </BatchSequence>
                </ShowPlanXML>
                """;

        ParsedPlan plan = parser.parse(xml);

        assertThat(plan.getBatches()).isEmpty();
        assertThat(plan.getAllMissingIndexes()).isEmpty();
    }

    @Test
    public void shouldIgnoreUnknownElementsAndBadNumbers() {
        String xml = """
                <ShowPlanXML xmlns="http://schemas.microsoft.com/sqlserver/2004/07/showplan" Version="1.5" Build="15.0.2000.5">
                  <BatchSequence>
                    <Batch>
                      <Statements>
                        <StmtSimple StatementText="SELECT 1" StatementType="SELECT" StatementSubTreeCost="0.5" StatementEstRows="not-a-number">
                          <QueryPlan FutureAttribute="x">
                            <SomethingNew />
                            <RelOp NodeId="0" PhysicalOp="Constant Scan" LogicalOp="Constant Scan" EstimateRows="NaN" EstimatedTotalSubtreeCost="0.5">
                              <ConstantScan />
                            </RelOp>
                          </QueryPlan>
                        </StmtSimple>
                      </Statements>
                    </Batch>
                  </BatchSequence>
                </ShowPlanXML>
                """;

        ParsedPlan plan = parser.parse(xml);

        PlanStatement statement = plan.getBatches().get(0).getStatements().get(0);
        assertThat(statement.getStatementEstRows()).isZero();
        assertThat(statement.getRootNode().getChildren().get(0).getEstimateRows()).isZero();
    }

    @Test
    public void shouldAcceptLeadingByteOrderMark() {
        ParsedPlan plan = parser.parse("\uFEFF" + PlanFixtures.load(PlanFixtures.SIMPLE_SCAN));

        assertThat(plan.getStatementCount()).isEqualTo(1);
    }

    @Test
    public void shouldRejectMalformedXml() {
        assertThatThrownBy(() -> parser.parse("<ShowPlanXML><BatchSequence>"))
                .isInstanceOf(MalformedPlanXmlException.class)
                .isInstanceOf(ShowPlanParseException.class)
                .hasMessageContaining("not well-formed")
                .hasCauseInstanceOf(org.xml.sax.SAXException.class);
    }

    @Test
    public void shouldRejectEmptyInput() {
        assertThatThrownBy(() -> parser.parse("   "))
                .isInstanceOf(MalformedPlanXmlException.class)
                .hasMessage("Showplan XML is empty");
        assertThatThrownBy(() -> parser.parse(null))
                .isInstanceOf(MalformedPlanXmlException.class);
    }

    @Test
    public void shouldRejectDocumentWithOtherRoot() {
        assertThatThrownBy(() -> parser.parse("<DeadlockGraph><Victim/></DeadlockGraph>"))
                .isInstanceOf(UnsupportedSchemaException.class)
                .hasMessageContaining("DeadlockGraph");
    }

    @Test
    public void shouldRejectShowPlanRootOutsideShowplanNamespace() {
        assertThatThrownBy(() -> parser.parse("<ShowPlanXML xmlns=\"urn:something-else\"/>"))
                .isInstanceOf(UnsupportedSchemaException.class)
                .hasMessageContaining("urn:something-else");
    }

    @Test
    public void shouldRejectDocumentTypeDeclarations() {
        String xml = """
                <?xml version="1.0"?>
                <!DOCTYPE ShowPlanXML [<!ENTITY boom "boom">]>
                <ShowPlanXML xmlns="http://schemas.microsoft.com/sqlserver/2004/07/showplan">&boom;</ShowPlanXML>
                """;

        assertThatThrownBy(() -> parser.parse(xml))
                .isInstanceOf(MalformedPlanXmlException.class);
    }

    @Test
    public void shouldProduceIndependentResultsForRepeatedParses() {
        String xml = PlanFixtures.load(PlanFixtures.HASH_JOIN);

        ParsedPlan first = parser.parse(xml);
        ParsedPlan second = parser.parse(xml);

        PlanNode firstRoot = first.getBatches().get(0).getStatements().get(0).getRootNode();
        PlanNode secondRoot = second.getBatches().get(0).getStatements().get(0).getRootNode();
        assertThat(firstRoot).isNotSameAs(secondRoot);
        assertThat(firstRoot.descendantsAndSelf()).extracting(PlanNode::getNodeId)
                .containsExactlyElementsOf(secondRoot.descendantsAndSelf().stream().map(PlanNode::getNodeId).toList());
    }
}
