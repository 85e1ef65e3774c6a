package org.carball.showplan.parser;

import org.carball.showplan.model.plan.CursorInfo;
import org.carball.showplan.model.plan.FunctionPlan;
import org.carball.showplan.model.plan.FunctionPlanKind;
import org.carball.showplan.model.plan.MemoryGrantInfo;
import org.carball.showplan.model.plan.OptimizerHardwareInfo;
import org.carball.showplan.model.plan.OptimizerStatsUsageItem;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanParameter;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.QueryTimeInfo;
import org.carball.showplan.model.plan.SetOptionsInfo;
import org.carball.showplan.model.plan.ThreadReservation;
import org.carball.showplan.model.plan.ThreadStatInfo;
import org.carball.showplan.model.plan.TraceFlagInfo;
import org.carball.showplan.model.plan.WaitStatInfo;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.carball.showplan.parser.ShowPlanXml.*;

/**
 * Turns statement elements (StmtSimple, StmtCond, StmtCursor and friends) into {@link PlanStatement}s.
 * A statement without a root operator is dropped and counted, unless it only exists to carry
 * function plans.
 */
class StatementParser {

    private final ParseContext context;
    private final RelOpParser relOpParser;

    StatementParser(ParseContext context) {
        this.context = context;
        this.relOpParser = new RelOpParser(context);
    }

    /**
     * Parses one child of a {@code Statements} element. Conditional blocks are flattened in source order.
     */
    List<PlanStatement> parseStatementAndChildren(Element stmtEl) {
        List<PlanStatement> results = new ArrayList<>();

        switch (stmtEl.getLocalName()) {
            case "StmtCond" -> {
                // The condition's own plan sits directly under Condition, with the attributes on StmtCond
                Element condition = child(stmtEl, "Condition");
                if (condition != null && child(condition, "QueryPlan") != null) {
                    PlanStatement conditionStatement = parseStatement(stmtEl, condition);
                    if (conditionStatement != null) {
                        results.add(conditionStatement);
                    }
                } else if (condition != null) {
                    parseAll(childElements(condition), results);
                }
                Element thenStatements = child(child(stmtEl, "Then"), "Statements");
                if (thenStatements != null) {
                    parseAll(childElements(thenStatements), results);
                }
                Element elseStatements = child(child(stmtEl, "Else"), "Statements");
                if (elseStatements != null) {
                    parseAll(childElements(elseStatements), results);
                }
            }
            case "StmtCursor" -> results.addAll(parseCursor(stmtEl));
            default -> {
                PlanStatement statement = parseStatement(stmtEl);
                if (statement != null) {
                    results.add(statement);
                }
            }
        }
        return results;
    }

    private void parseAll(List<Element> statementElements, List<PlanStatement> results) {
        for (Element element : statementElements) {
            results.addAll(parseStatementAndChildren(element));
        }
    }

    /**
     * Returns null when the statement was dropped.
     */
    PlanStatement parseStatement(Element stmtEl) {
        return parseStatement(stmtEl, stmtEl);
    }

    private PlanStatement parseStatement(Element stmtEl, Element planHolder) {
        context.beginStatement();
        PlanStatement statement = new PlanStatement();
        statement.setStatementText(attr(stmtEl, "StatementText", ""));
        statement.setStatementType(attr(stmtEl, "StatementType", ""));
        statement.setStatementSubTreeCost(attrDouble(stmtEl, "StatementSubTreeCost"));
        statement.setStatementEstRows(attrDouble(stmtEl, "StatementEstRows"));

        Element queryPlan = child(planHolder, "QueryPlan");
        if (queryPlan != null) {
            readStatementAttributes(statement, stmtEl);
            readQueryPlan(statement, queryPlan);

            Element relOp = child(queryPlan, "RelOp");
            if (relOp != null) {
                statement.setRootNode(wrapInStatementNode(statement, relOpParser.parse(relOp)));
            }
        }

        for (Element udf : children(planHolder, "UDF")) {
            statement.addFunctionPlan(parseFunctionPlan(udf, FunctionPlanKind.UDF));
        }
        Element storedProc = child(planHolder, "StoredProc");
        if (storedProc != null) {
            statement.addFunctionPlan(parseFunctionPlan(storedProc, FunctionPlanKind.STORED_PROCEDURE));
        }

        if (!statement.hasRootNode() && statement.getFunctionPlans().isEmpty()) {
            context.statementSkipped(statement.getStatementType(), statement.getStatementText());
            return null;
        }
        context.statementParsed();
        return statement;
    }

    private List<PlanStatement> parseCursor(Element stmtEl) {
        List<PlanStatement> results = new ArrayList<>();
        Element cursorPlan = child(stmtEl, "CursorPlan");
        if (cursorPlan == null) {
            context.statementSkipped(attr(stmtEl, "StatementType", ""), attr(stmtEl, "StatementText", ""));
            return results;
        }

        String cursorName = attr(cursorPlan, "CursorName");
        for (Element operation : children(cursorPlan, "Operation")) {
            String operationType = attr(operation, "OperationType", "CursorOp");
            Element queryPlan = child(operation, "QueryPlan");
            Element relOp = child(queryPlan, "RelOp");
            if (relOp == null) {
                context.statementSkipped("cursor " + operationType, cursorName);
                continue;
            }

            context.beginStatement();
            PlanStatement statement = new PlanStatement();
            statement.setStatementText(attr(stmtEl, "StatementText", ""));
            statement.setStatementType(attr(stmtEl, "StatementType", "SELECT"));
            statement.setStatementSubTreeCost(attrDouble(stmtEl, "StatementSubTreeCost"));
            readStatementAttributes(statement, stmtEl);
            readQueryPlan(statement, queryPlan);
            statement.setRootNode(wrapInStatementNode(statement, relOpParser.parse(relOp)));

            if (statement.getStatementText().isEmpty()) {
                statement.setStatementText("Cursor: " + cursorName + " (" + operationType + ")");
            }
            statement.setCursor(new CursorInfo(
                    cursorName,
                    operationType,
                    attr(cursorPlan, "CursorActualType"),
                    attr(cursorPlan, "CursorRequestedType"),
                    attr(cursorPlan, "CursorConcurrency"),
                    attrBool(cursorPlan, "ForwardOnly")));

            context.statementParsed();
            results.add(statement);
        }
        return results;
    }

    /**
     * Puts a node standing for the statement itself (SELECT, INSERT, ...) above the first operator.
     * When the statement states no subtree cost, the operator's cost is used for both.
     */
    private PlanNode wrapInStatementNode(PlanStatement statement, PlanNode operator) {
        String type = statement.getStatementType().isEmpty()
                ? "QUERY"
                : statement.getStatementType().toUpperCase(Locale.ROOT);

        if (statement.getStatementSubTreeCost() <= 0) {
            statement.setStatementSubTreeCost(operator.getEstimatedTotalSubtreeCost());
        }

        PlanNode statementNode = new PlanNode();
        statementNode.setNodeId(PlanNode.STATEMENT_NODE_ID);
        statementNode.setPhysicalOp(type);
        statementNode.setLogicalOp(type);
        statementNode.setEstimatedTotalSubtreeCost(statement.getStatementSubTreeCost());
        statementNode.setEstimateRows(statement.getStatementEstRows());
        statementNode.addChild(operator);
        return statementNode;
    }

    private FunctionPlan parseFunctionPlan(Element element, FunctionPlanKind kind) {
        FunctionPlan functionPlan = new FunctionPlan(attr(element, "ProcName", ""), kind);
        functionPlan.setNativelyCompiled(attrBool(element, "IsNativelyCompiled"));

        Element statements = child(element, "Statements");
        if (statements != null) {
            for (Element stmtEl : childElements(statements)) {
                parseStatementAndChildren(stmtEl).forEach(functionPlan::addStatement);
            }
        }
        return functionPlan;
    }

    private void readStatementAttributes(PlanStatement statement, Element stmtEl) {
        statement.setStatementId(attrInt(stmtEl, "StatementId"));
        statement.setStatementCompId(attrInt(stmtEl, "StatementCompId"));
        statement.setStatementOptmLevel(attr(stmtEl, "StatementOptmLevel"));
        statement.setStatementOptmEarlyAbortReason(attr(stmtEl, "StatementOptmEarlyAbortReason"));
        statement.setStatementParameterizationType(attrInt(stmtEl, "StatementParameterizationType"));
        statement.setStatementSqlHandle(attr(stmtEl, "StatementSqlHandle"));
        statement.setDatabaseContextSettingsId(attrLong(stmtEl, "DatabaseContextSettingsId"));
        statement.setParentObjectId(attrInt(stmtEl, "ParentObjectId"));
        statement.setSecurityPolicyApplied(attrBool(stmtEl, "SecurityPolicyApplied"));
        statement.setBatchModeOnRowStoreUsed(attrBool(stmtEl, "BatchModeOnRowStoreUsed"));
        statement.setQueryHash(attr(stmtEl, "QueryHash"));
        statement.setQueryPlanHash(attr(stmtEl, "QueryPlanHash"));
        statement.setCardinalityEstimationModelVersion(attrInt(stmtEl, "CardinalityEstimationModelVersion"));
        statement.setQueryStoreStatementHintId(attrInt(stmtEl, "QueryStoreStatementHintId"));
        statement.setQueryStoreStatementHintText(attr(stmtEl, "QueryStoreStatementHintText"));
        statement.setQueryStoreStatementHintSource(attr(stmtEl, "QueryStoreStatementHintSource"));

        Element setOptions = child(stmtEl, "StatementSetOptions");
        if (setOptions != null) {
            statement.setSetOptions(new SetOptionsInfo(
                    attrBool(setOptions, "ANSI_NULLS"),
                    attrBool(setOptions, "ANSI_PADDING"),
                    attrBool(setOptions, "ANSI_WARNINGS"),
                    attrBool(setOptions, "ARITHABORT"),
                    attrBool(setOptions, "CONCAT_NULL_YIELDS_NULL"),
                    attrBool(setOptions, "NUMERIC_ROUNDABORT"),
                    attrBool(setOptions, "QUOTED_IDENTIFIER")));
        }
    }

    private void readQueryPlan(PlanStatement statement, Element queryPlan) {
        statement.setCachedPlanSizeKB(attrLong(queryPlan, "CachedPlanSize"));
        statement.setCompileTimeMs(attrLong(queryPlan, "CompileTime"));
        statement.setCompileCpuMs(attrLong(queryPlan, "CompileCPU"));
        statement.setCompileMemoryKB(attrLong(queryPlan, "CompileMemory"));
        statement.setRetrievedFromCache(attrBool(queryPlan, "RetrievedFromCache"));
        statement.setDegreeOfParallelism(attrInt(queryPlan, "DegreeOfParallelism"));
        statement.setEffectiveDegreeOfParallelism(attrInt(queryPlan, "EffectiveDegreeOfParallelism"));
        statement.setNonParallelPlanReason(attr(queryPlan, "NonParallelPlanReason"));
        statement.setDopFeedbackAdjusted(attr(queryPlan, "IsDOPFeedbackAdjusted"));
        statement.setMaxQueryMemoryKB(attrLong(queryPlan, "MaxQueryMemory"));
        statement.setPlanGuideDb(attr(queryPlan, "PlanGuideDB"));
        statement.setPlanGuideName(attr(queryPlan, "PlanGuideName"));
        statement.setUsePlan(attrBool(queryPlan, "UsePlan"));

        // Older plans carry the CE version on QueryPlan instead of the statement
        if (statement.getCardinalityEstimationModelVersion() == 0) {
            statement.setCardinalityEstimationModelVersion(attrInt(queryPlan, "CardinalityEstimationModelVersion"));
        }

        Element parameterizedText = child(queryPlan, "ParameterizedText");
        if (parameterizedText != null) {
            statement.setParameterizedText(parameterizedText.getTextContent());
        }

        statement.setMissingIndexes(MissingIndexParser.parse(queryPlan));
        statement.setPlanWarnings(WarningParser.parse(child(queryPlan, "Warnings")));

        readMemoryGrant(statement, child(queryPlan, "MemoryGrantInfo"));

        Element hardware = child(queryPlan, "OptimizerHardwareDependentProperties");
        if (hardware != null) {
            statement.setHardwareProperties(new OptimizerHardwareInfo(
                    attrLong(hardware, "EstimatedAvailableMemoryGrant"),
                    attrLong(hardware, "EstimatedPagesCached"),
                    attrInt(hardware, "EstimatedAvailableDegreeOfParallelism"),
                    attrLong(hardware, "MaxCompileMemory")));
        }

        Element statsUsage = child(queryPlan, "OptimizerStatsUsage");
        if (statsUsage != null) {
            for (Element stat : children(statsUsage, "StatisticsInfo")) {
                statement.getStatsUsage().add(new OptimizerStatsUsageItem(
                        bracketFreeAttr(stat, "Statistics"),
                        bracketFreeAttr(stat, "Database"),
                        bracketFreeAttr(stat, "Schema"),
                        bracketFreeAttr(stat, "Table"),
                        attrLong(stat, "ModificationCount"),
                        attrDouble(stat, "SamplingPercent"),
                        attr(stat, "LastUpdate")));
            }
        }

        Element threadStat = child(queryPlan, "ThreadStat");
        if (threadStat != null) {
            List<ThreadReservation> reservations = new ArrayList<>();
            for (Element reservation : children(threadStat, "ThreadReservation")) {
                reservations.add(new ThreadReservation(attrInt(reservation, "NodeId"), attrInt(reservation, "ReservedThreads")));
            }
            statement.setThreadStats(new ThreadStatInfo(
                    attrInt(threadStat, "Branches"), attrInt(threadStat, "UsedThreads"), reservations));
        }

        Element parameterList = child(queryPlan, "ParameterList");
        if (parameterList != null) {
            for (Element parameter : children(parameterList, "ColumnReference")) {
                statement.getParameters().add(new PlanParameter(
                        attr(parameter, "Column", ""),
                        attr(parameter, "ParameterDataType", ""),
                        attr(parameter, "ParameterCompiledValue"),
                        attr(parameter, "ParameterRuntimeValue")));
            }
        }

        Element waitStats = child(queryPlan, "WaitStats");
        if (waitStats != null) {
            for (Element wait : children(waitStats, "Wait")) {
                statement.getWaitStats().add(new WaitStatInfo(
                        attr(wait, "WaitType", ""), attrLong(wait, "WaitTimeMs"), attrLong(wait, "WaitCount")));
            }
        }

        Element queryTime = child(queryPlan, "QueryTimeStats");
        if (queryTime != null) {
            statement.setQueryTimeStats(new QueryTimeInfo(
                    attrLong(queryTime, "CpuTime"),
                    attrLong(queryTime, "ElapsedTime"),
                    attrLong(queryTime, "UdfCpuTime"),
                    attrLong(queryTime, "UdfElapsedTime")));
        }

        for (Element traceFlags : children(queryPlan, "TraceFlags")) {
            boolean compileTime = attrBool(traceFlags, "IsCompileTime");
            for (Element flag : children(traceFlags, "TraceFlag")) {
                statement.getTraceFlags().add(new TraceFlagInfo(attrInt(flag, "Value"), attr(flag, "Scope", ""), compileTime));
            }
        }

        Element indexedViews = child(queryPlan, "IndexedViewInfo");
        if (indexedViews != null) {
            for (Element object : children(indexedViews, "Object")) {
                String name = dotted(
                        bracketFreeAttr(object, "Database"),
                        bracketFreeAttr(object, "Schema"),
                        bracketFreeAttr(object, "Table"),
                        bracketFreeAttr(object, "Index"));
                if (name != null) {
                    statement.getIndexedViews().add(name);
                }
            }
        }
    }

    private void readMemoryGrant(PlanStatement statement, Element memoryGrant) {
        if (memoryGrant == null) {
            return;
        }
        statement.setMemoryGrant(MemoryGrantInfo.builder()
                .serialRequiredMemoryKB(attrLong(memoryGrant, "SerialRequiredMemory"))
                .serialDesiredMemoryKB(attrLong(memoryGrant, "SerialDesiredMemory"))
                .requiredMemoryKB(attrLong(memoryGrant, "RequiredMemory"))
                .desiredMemoryKB(attrLong(memoryGrant, "DesiredMemory"))
                .requestedMemoryKB(attrLong(memoryGrant, "RequestedMemory"))
                .grantedMemoryKB(attrLong(memoryGrant, "GrantedMemory"))
                .maxUsedMemoryKB(attrLong(memoryGrant, "MaxUsedMemory"))
                .grantWaitTimeMs(attrLong(memoryGrant, "GrantWaitTime"))
                .lastRequestedMemoryKB(attrLong(memoryGrant, "LastRequestedMemory"))
                .memoryGrantFeedbackAdjusted(attr(memoryGrant, "IsMemoryGrantFeedbackAdjusted"))
                .build());
    }
}
