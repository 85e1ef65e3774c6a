package org.carball.showplan.parser;

import lombok.RequiredArgsConstructor;
import org.carball.showplan.model.plan.PerThreadRuntimeInfo;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.ScalarUdfReference;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.carball.showplan.parser.ShowPlanXml.*;

/**
 * Builds a {@link PlanNode} subtree from a {@code RelOp} element. Children keep document order.
 */
@RequiredArgsConstructor
class RelOpParser {

    // RelOp children that describe the operator rather than being the operator element itself
    private static final Set<String> NON_OPERATOR_ELEMENTS = Set.of(
            "OutputList", "RunTimeInformation", "Warnings", "MemoryFractions",
            "RunTimePartitionSummary", "MemoryGrant", "InternalInfo");

    private final ParseContext context;

    PlanNode parse(Element relOpEl) {
        PlanNode node = new PlanNode();
        readRelOpAttributes(node, relOpEl);

        Element operatorEl = operatorElement(relOpEl);
        if (operatorEl != null) {
            readObject(node, operatorEl);
            readPredicates(node, operatorEl);
            readColumnLists(node, operatorEl);
            readOperatorAttributes(node, operatorEl);
            readScalarUdfs(node, operatorEl);
        }

        node.setOutputColumns(columnList(relOpEl, "OutputList"));
        WarningParser.parse(child(relOpEl, "Warnings")).forEach(node::addWarning);
        readMemory(node, relOpEl);
        readPartitionSummary(node, relOpEl);
        readRuntime(node, child(relOpEl, "RunTimeInformation"));

        context.operatorParsed(node);

        for (Element childRelOp : childRelOps(operatorEl)) {
            node.addChild(parse(childRelOp));
        }
        return node;
    }

    static Element operatorElement(Element relOpEl) {
        for (Element child : childElements(relOpEl)) {
            if (!NON_OPERATOR_ELEMENTS.contains(child.getLocalName())) {
                return child;
            }
        }
        return null;
    }

    /**
     * RelOps directly under the operator element, or one level down inside a wrapper, in document order.
     */
    static List<Element> childRelOps(Element operatorEl) {
        List<Element> result = new ArrayList<>();
        if (operatorEl == null) {
            return result;
        }
        for (Element child : childElements(operatorEl)) {
            if (is(child, "RelOp")) {
                result.add(child);
            } else {
                result.addAll(children(child, "RelOp"));
            }
        }
        return result;
    }

    private void readRelOpAttributes(PlanNode node, Element relOp) {
        node.setNodeId(attrInt(relOp, "NodeId"));
        node.setPhysicalOp(attr(relOp, "PhysicalOp", ""));
        node.setLogicalOp(attr(relOp, "LogicalOp", ""));
        node.setEstimatedTotalSubtreeCost(attrDouble(relOp, "EstimatedTotalSubtreeCost"));
        node.setEstimateRows(attrDouble(relOp, "EstimateRows"));
        node.setEstimateIO(attrDouble(relOp, "EstimateIO"));
        node.setEstimateCPU(attrDouble(relOp, "EstimateCPU"));
        node.setEstimateRebinds(attrDouble(relOp, "EstimateRebinds"));
        node.setEstimateRewinds(attrDouble(relOp, "EstimateRewinds"));
        node.setEstimatedRowSize(attrInt(relOp, "AvgRowSize"));
        node.setTableCardinality(attrDouble(relOp, "TableCardinality"));
        double rowsRead = attrDouble(relOp, "EstimatedRowsRead");
        node.setEstimatedRowsRead(rowsRead != 0 ? rowsRead : attrDouble(relOp, "EstimateRowsWithoutRowGoal"));

        node.setParallel(attrBool(relOp, "Parallel"));
        node.setPartitioned(attrBool(relOp, "Partitioned"));
        node.setExecutionMode(attr(relOp, "EstimatedExecutionMode"));
        node.setEstimatedDop(attrInt(relOp, "EstimatedAvailableDegreeOfParallelism"));

        node.setAdaptive(attrBool(relOp, "IsAdaptive"));
        node.setAdaptiveThresholdRows(attrDouble(relOp, "AdaptiveThresholdRows"));
        node.setEstimatedJoinType(attr(relOp, "EstimatedJoinType"));
    }

    private void readObject(PlanNode node, Element operatorEl) {
        List<Element> objects = scopedDescendants(operatorEl, "Object");
        if (objects.isEmpty()) {
            return;
        }
        Element object = objects.get(0);
        String database = bracketFreeAttr(object, "Database");
        String schema = bracketFreeAttr(object, "Schema");
        String table = bracketFreeAttr(object, "Table");
        String index = bracketFreeAttr(object, "Index");

        node.setDatabaseName(database);
        node.setIndexName(index);
        node.setObjectName(dotted(schema, table));
        node.setFullObjectName(dotted(database, schema, table, index));
        node.setStorageType(attr(object, "Storage"));
        node.setObjectAlias(bracketFreeAttr(object, "Alias"));
        node.setIndexKind(attr(object, "IndexKind"));
        node.setFilteredIndex(attrBool(object, "Filtered"));
    }

    private void readPredicates(PlanNode node, Element operatorEl) {
        List<String> seekParts = new ArrayList<>();
        List<Element> seekPredicates = new ArrayList<>(scopedDescendants(operatorEl, "SeekPredicateNew"));
        seekPredicates.addAll(scopedDescendants(operatorEl, "SeekPredicate"));
        for (Element seek : seekPredicates) {
            for (Element scalar : descendants(seek, "ScalarOperator")) {
                String value = attr(scalar, "ScalarString");
                if (value != null && !value.isEmpty()) {
                    seekParts.add(value);
                }
            }
        }
        if (!seekParts.isEmpty()) {
            node.setSeekPredicates(String.join(" AND ", seekParts));
        }

        node.setPredicate(scalarString(child(operatorEl, "Predicate")));
        node.setBuildResidual(scalarString(child(operatorEl, "BuildResidual")));
        node.setProbeResidual(scalarString(child(operatorEl, "ProbeResidual")));
        node.setMergeResidual(scalarString(child(operatorEl, "Residual")));
        node.setPassThru(scalarString(child(operatorEl, "PassThru")));
        node.setSetPredicate(scalarString(child(operatorEl, "SetPredicate")));
        node.setTopExpression(scalarString(child(operatorEl, "TopExpression")));
        node.setOffsetExpression(scalarString(child(operatorEl, "OffsetExpression")));
    }

    private void readColumnLists(PlanNode node, Element operatorEl) {
        node.setHashKeysBuild(columnList(operatorEl, "HashKeysBuild"));
        node.setHashKeysProbe(columnList(operatorEl, "HashKeysProbe"));
        node.setHashKeys(columnList(operatorEl, "HashKeys"));
        node.setOuterReferences(columnList(operatorEl, "OuterReferences"));
        node.setInnerSideJoinColumns(columnList(operatorEl, "InnerSideJoinColumns"));
        node.setOuterSideJoinColumns(columnList(operatorEl, "OuterSideJoinColumns"));
        node.setGroupBy(columnList(operatorEl, "GroupBy"));
        node.setPartitionColumns(columnList(operatorEl, "PartitionColumns"));

        Element segment = child(child(operatorEl, "SegmentColumn"), "ColumnReference");
        if (segment != null) {
            node.setSegmentColumn(formatColumnRef(segment));
        }
        Element action = child(child(operatorEl, "ActionColumn"), "ColumnReference");
        if (action != null) {
            node.setActionColumn(formatColumnRef(action));
        }

        Element orderBy = child(operatorEl, "OrderBy");
        if (orderBy != null) {
            String columns = children(orderBy, "OrderByColumn").stream()
                    .map(RelOpParser::formatOrderByColumn)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.joining(", "));
            node.setOrderBy(columns.isEmpty() ? null : columns);
        }

        Element definedValues = child(operatorEl, "DefinedValues");
        if (definedValues != null) {
            String values = children(definedValues, "DefinedValue").stream()
                    .map(RelOpParser::formatDefinedValue)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.joining("; "));
            node.setDefinedValues(values.isEmpty() ? null : values);
        }
    }

    private static String formatOrderByColumn(Element orderByColumn) {
        Element columnRef = child(orderByColumn, "ColumnReference");
        String name = columnRef != null ? formatColumnRef(columnRef) : "";
        if (name.isEmpty()) {
            return "";
        }
        boolean ascending = attr(orderByColumn, "Ascending") == null || attrBool(orderByColumn, "Ascending");
        return name + (ascending ? " ASC" : " DESC");
    }

    private static String formatDefinedValue(Element definedValue) {
        Element columnRef = child(definedValue, "ColumnReference");
        String column = columnRef != null ? formatColumnRef(columnRef) : "";
        String expression = attr(child(definedValue, "ScalarOperator"), "ScalarString", "");
        if (!column.isEmpty() && !expression.isEmpty()) {
            return column + " = " + expression;
        }
        return expression.isEmpty() ? column : expression;
    }

    private void readOperatorAttributes(PlanNode node, Element op) {
        node.setOrdered(attrBool(op, "Ordered"));
        node.setScanDirection(attr(op, "ScanDirection"));
        node.setForcedIndex(attrBool(op, "ForcedIndex"));
        node.setForceScan(attrBool(op, "ForceScan"));
        node.setForceSeek(attrBool(op, "ForceSeek"));
        node.setNoExpandHint(attrBool(op, "NoExpandHint"));
        node.setLookup(attrBool(op, "Lookup"));
        node.setDynamicSeek(attrBool(op, "DynamicSeek"));

        node.setPartitioningType(attr(op, "PartitioningType"));
        node.setRemoting(attrBool(op, "Remoting"));
        node.setLocalParallelism(attrBool(op, "LocalParallelism"));

        node.setPercent(attrBool(op, "IsPercent"));
        node.setWithTies(attrBool(op, "WithTies"));
        node.setTopRows(attrInt(op, "Rows"));
        node.setSortDistinct(attrBool(op, "Distinct"));
        node.setStartupExpression(attrBool(op, "StartupExpression"));
        node.setNestedLoopsOptimized(attrBool(op, "Optimized"));
        node.setWithOrderedPrefetch(attrBool(op, "WithOrderedPrefetch"));
        node.setWithUnorderedPrefetch(attrBool(op, "WithUnorderedPrefetch"));
        node.setManyToMany(attrBool(op, "ManyToMany"));
        node.setBitmapCreator(attrBool(op, "BitmapCreator"));
        node.setSpoolStack(attrBool(op, "Stack"));
        node.setPrimaryNodeId(attrInt(op, "PrimaryNodeId"));
        node.setDmlRequestSort(attrBool(op, "DMLRequestSort"));
        node.setActualJoinType(attr(op, "ActualJoinType"));
    }

    private void readScalarUdfs(PlanNode node, Element operatorEl) {
        List<ScalarUdfReference> udfs = new ArrayList<>();
        for (Element udf : scopedDescendants(operatorEl, "UserDefinedFunction")) {
            String name = bracketFreeAttr(udf, "FunctionName");
            if (name == null || name.isEmpty()) {
                continue;
            }
            Element clr = child(udf, "CLRFunction");
            udfs.add(new ScalarUdfReference(name, attrBool(udf, "IsClrFunction"),
                    attr(clr, "Assembly"), attr(clr, "Class"), attr(clr, "Method")));
        }
        node.setScalarUdfs(udfs);
    }

    private void readMemory(PlanNode node, Element relOp) {
        Element fractions = child(relOp, "MemoryFractions");
        if (fractions != null) {
            node.setMemoryFractionInput(attrDouble(fractions, "Input"));
            node.setMemoryFractionOutput(attrDouble(fractions, "Output"));
        }

        Element grant = child(relOp, "MemoryGrant");
        if (grant != null) {
            node.setMemoryGrantKB(attrLong(grant, "GrantedMemory"));
            node.setDesiredMemoryKB(attrLong(grant, "DesiredMemory"));
            node.setMaxUsedMemoryKB(attrLong(grant, "MaxUsedMemory"));
        }
    }

    private void readPartitionSummary(PlanNode node, Element relOp) {
        Element accessed = child(child(relOp, "RunTimePartitionSummary"), "PartitionsAccessed");
        if (accessed == null) {
            return;
        }
        node.setPartitionsAccessed(attrInt(accessed, "PartitionCount"));
        String ranges = children(accessed, "PartitionRange").stream()
                .map(r -> attr(r, "Start", "") + "-" + attr(r, "End", ""))
                .collect(Collectors.joining(", "));
        node.setPartitionRanges(ranges.isEmpty() ? null : ranges);
    }

    /**
     * Totals per-thread counters. Elapsed times are wall clock per thread, so they take the maximum
     * instead of the sum.
     */
    private void readRuntime(PlanNode node, Element runtime) {
        if (runtime == null) {
            return;
        }
        node.setHasActualStats(true);

        List<PerThreadRuntimeInfo> perThread = new ArrayList<>();
        for (Element thread : children(runtime, "RunTimeCountersPerThread")) {
            node.setActualRows(node.getActualRows() + attrLong(thread, "ActualRows"));
            node.setActualExecutions(node.getActualExecutions() + attrLong(thread, "ActualExecutions"));
            node.setActualRowsRead(node.getActualRowsRead() + attrLong(thread, "ActualRowsRead"));
            node.setActualRebinds(node.getActualRebinds() + attrLong(thread, "ActualRebinds"));
            node.setActualRewinds(node.getActualRewinds() + attrLong(thread, "ActualRewinds"));
            node.setActualCpuMs(node.getActualCpuMs() + attrLong(thread, "ActualCPUms"));
            node.setActualLogicalReads(node.getActualLogicalReads() + attrLong(thread, "ActualLogicalReads"));
            node.setActualPhysicalReads(node.getActualPhysicalReads() + attrLong(thread, "ActualPhysicalReads"));
            node.setActualScans(node.getActualScans() + attrLong(thread, "ActualScans"));
            node.setActualReadAheads(node.getActualReadAheads() + attrLong(thread, "ActualReadAheads"));
            node.setActualLobLogicalReads(node.getActualLobLogicalReads() + attrLong(thread, "ActualLobLogicalReads"));
            node.setActualLobPhysicalReads(node.getActualLobPhysicalReads() + attrLong(thread, "ActualLobPhysicalReads"));
            node.setActualLobReadAheads(node.getActualLobReadAheads() + attrLong(thread, "ActualLobReadAheads"));
            node.setActualSegmentReads(node.getActualSegmentReads() + attrLong(thread, "ActualSegmentReads"));
            node.setActualSegmentSkips(node.getActualSegmentSkips() + attrLong(thread, "ActualSegmentSkips"));
            node.setUdfCpuTimeMs(node.getUdfCpuTimeMs() + attrLong(thread, "UdfCpuTime"));
            node.setUdfElapsedTimeMs(Math.max(node.getUdfElapsedTimeMs(), attrLong(thread, "UdfElapsedTime")));
            node.setActualElapsedMs(Math.max(node.getActualElapsedMs(), attrLong(thread, "ActualElapsedms")));
            if (node.getActualExecutionMode() == null) {
                node.setActualExecutionMode(attr(thread, "ActualExecutionMode"));
            }
            perThread.add(threadInfo(thread));
        }
        node.setPerThreadStats(perThread);
    }

    private static PerThreadRuntimeInfo threadInfo(Element thread) {
        return PerThreadRuntimeInfo.builder()
                .threadId(attrInt(thread, "Thread"))
                .actualRows(attrLong(thread, "ActualRows"))
                .actualExecutions(attrLong(thread, "ActualExecutions"))
                .actualElapsedMs(attrLong(thread, "ActualElapsedms"))
                .actualCpuMs(attrLong(thread, "ActualCPUms"))
                .actualRowsRead(attrLong(thread, "ActualRowsRead"))
                .actualLogicalReads(attrLong(thread, "ActualLogicalReads"))
                .actualPhysicalReads(attrLong(thread, "ActualPhysicalReads"))
                .actualScans(attrLong(thread, "ActualScans"))
                .actualReadAheads(attrLong(thread, "ActualReadAheads"))
                .firstActiveTime(attrLong(thread, "FirstActiveTime"))
                .lastActiveTime(attrLong(thread, "LastActiveTime"))
                .openTime(attrLong(thread, "OpenTime"))
                .firstRowTime(attrLong(thread, "FirstRowTime"))
                .lastRowTime(attrLong(thread, "LastRowTime"))
                .closeTime(attrLong(thread, "CloseTime"))
                .inputMemoryGrant(attrLong(thread, "InputMemoryGrant"))
                .outputMemoryGrant(attrLong(thread, "OutputMemoryGrant"))
                .usedMemoryGrant(attrLong(thread, "UsedMemoryGrant"))
                .batches(attrLong(thread, "Batches"))
                .actualEndOfScans(attrLong(thread, "ActualEndOfScans"))
                .actualLocallyAggregatedRows(attrLong(thread, "ActualLocallyAggregatedRows"))
                .interleavedExecuted(attrBool(thread, "IsInterleavedExecuted"))
                .rowRequalifications(attrLong(thread, "RowRequalifications"))
                .build();
    }
}
