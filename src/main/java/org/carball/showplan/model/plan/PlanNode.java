package org.carball.showplan.model.plan;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * One operator of a statement's plan tree.
 * <p>
 * Children are owned by their node and kept in document order. The parent link is navigation only and
 * is set exclusively by {@link #addChild(PlanNode)}, which refuses a node that is already attached
 * somewhere else. That keeps every statement tree free of cycles and shared subtrees.
 * <p>
 * Equality is identity: two operators with the same attributes are still distinct nodes.
 */
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class PlanNode {

    public static final int STATEMENT_NODE_ID = -1;

    // Identity
    @ToString.Include
    private int nodeId;
    @ToString.Include
    private String physicalOp = "";
    @ToString.Include
    private String logicalOp = "";

    // Estimated costs
    private double estimatedTotalSubtreeCost;
    private double estimatedOperatorCost;
    private double estimateRows;
    private double estimateIO;
    private double estimateCPU;
    private double estimateRebinds;
    private double estimateRewinds;
    private int estimatedRowSize;
    private double tableCardinality;
    private double estimatedRowsRead;

    // Actual runtime stats, only meaningful when hasActualStats is set
    private boolean hasActualStats;
    private long actualRows;
    private long actualExecutions;
    private long actualRowsRead;
    private long actualRebinds;
    private long actualRewinds;
    private long actualElapsedMs;
    private long actualCpuMs;
    private long actualLogicalReads;
    private long actualPhysicalReads;
    private long actualScans;
    private long actualReadAheads;
    private long actualLobLogicalReads;
    private long actualLobPhysicalReads;
    private long actualLobReadAheads;
    private long actualSegmentReads;
    private long actualSegmentSkips;
    private long udfCpuTimeMs;
    private long udfElapsedTimeMs;
    private String actualExecutionMode;
    private List<PerThreadRuntimeInfo> perThreadStats = new ArrayList<>();

    // Parallelism
    private boolean parallel;
    private boolean partitioned;
    private int estimatedDop;
    private String executionMode;
    private String partitioningType;
    private String partitionColumns;
    private String hashKeys;
    private boolean remoting;
    private boolean localParallelism;

    // Adaptive joins
    private boolean adaptive;
    private double adaptiveThresholdRows;
    private String estimatedJoinType;
    private String actualJoinType;

    // Object accessed
    private String databaseName;
    private String objectName;
    private String fullObjectName;
    private String indexName;
    private String indexKind;
    private String objectAlias;
    private String storageType;
    private boolean filteredIndex;

    // Predicates and column lists
    private String seekPredicates;
    private String predicate;
    private String hashKeysBuild;
    private String hashKeysProbe;
    private String buildResidual;
    private String probeResidual;
    private String mergeResidual;
    private String passThru;
    private String outputColumns;
    private String orderBy;
    private String groupBy;
    private String outerReferences;
    private String innerSideJoinColumns;
    private String outerSideJoinColumns;
    private String definedValues;
    private String setPredicate;
    private String segmentColumn;
    private String actionColumn;

    // Scan and seek
    private boolean ordered;
    private String scanDirection;
    private boolean forcedIndex;
    private boolean forceScan;
    private boolean forceSeek;
    private boolean noExpandHint;
    private boolean lookup;
    private boolean dynamicSeek;

    // Operator specific
    private String topExpression;
    private String offsetExpression;
    private boolean percent;
    private boolean withTies;
    private int topRows;
    private boolean sortDistinct;
    private boolean startupExpression;
    private boolean nestedLoopsOptimized;
    private boolean withOrderedPrefetch;
    private boolean withUnorderedPrefetch;
    private boolean manyToMany;
    private boolean bitmapCreator;
    private boolean spoolStack;
    private int primaryNodeId;
    private boolean dmlRequestSort;
    private List<ScalarUdfReference> scalarUdfs = new ArrayList<>();

    // Memory
    private Long memoryGrantKB;
    private Long desiredMemoryKB;
    private Long maxUsedMemoryKB;
    private double memoryFractionInput;
    private double memoryFractionOutput;

    // Partitions
    private int partitionsAccessed;
    private String partitionRanges;

    private List<PlanWarning> warnings = new ArrayList<>();

    // Set by CostAnnotator
    private int costPercent;
    private boolean expensive;

    // Set by PlanLayoutEngine
    private double x;
    private double y;

    @Setter(AccessLevel.NONE)
    private final List<PlanNode> children = new ArrayList<>();

    @JsonIgnore
    @Setter(AccessLevel.NONE)
    private PlanNode parent;

    /**
     * Appends a child, keeping document order.
     *
     * @throws IllegalArgumentException if the child is this node
     * @throws IllegalStateException if the child already has a parent
     */
    public void addChild(PlanNode child) {
        if (child == this) {
            throw new IllegalArgumentException("A plan node cannot be its own child: " + this);
        }
        if (child.parent != null) {
            throw new IllegalStateException("Plan node " + child + " is already attached to " + child.parent);
        }
        child.parent = this;
        children.add(child);
    }

    public List<PlanNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean hasObjectName() {
        return objectName != null && !objectName.isEmpty();
    }

    public void addWarning(PlanWarning warning) {
        warnings.add(warning);
    }

    /**
     * Returns this node and all of its descendants in pre-order.
     */
    public List<PlanNode> descendantsAndSelf() {
        List<PlanNode> result = new ArrayList<>();
        Deque<PlanNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            PlanNode node = stack.pop();
            result.add(node);
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return result;
    }
}
