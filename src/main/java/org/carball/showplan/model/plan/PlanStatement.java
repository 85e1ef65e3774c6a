package org.carball.showplan.model.plan;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class PlanStatement {
    private String statementText = "";
    private String statementType = "";
    private int statementId;
    private int statementCompId;
    private double statementSubTreeCost;
    private double statementEstRows;
    private PlanNode rootNode;
    private List<MissingIndex> missingIndexes = new ArrayList<>();
    private MemoryGrantInfo memoryGrant;
    private List<PlanWarning> planWarnings = new ArrayList<>();

    // Compilation
    private int cardinalityEstimationModelVersion;
    private long compileTimeMs;
    private long compileCpuMs;
    private long compileMemoryKB;
    private String statementOptmLevel;
    private String statementOptmEarlyAbortReason;
    private int statementParameterizationType;
    private String queryHash;
    private String queryPlanHash;
    private String statementSqlHandle;
    private long cachedPlanSizeKB;
    private boolean retrievedFromCache;
    private long databaseContextSettingsId;
    private int parentObjectId;
    private boolean securityPolicyApplied;
    private boolean batchModeOnRowStoreUsed;

    // Parallelism
    private int degreeOfParallelism;
    private int effectiveDegreeOfParallelism;
    private String nonParallelPlanReason;
    private String dopFeedbackAdjusted;

    // Plan guides, hints, parameterization
    private String planGuideDb;
    private String planGuideName;
    private boolean usePlan;
    private String parameterizedText;
    private int queryStoreStatementHintId;
    private String queryStoreStatementHintText;
    private String queryStoreStatementHintSource;

    // QueryPlan sub elements
    private long maxQueryMemoryKB;
    private OptimizerHardwareInfo hardwareProperties;
    private SetOptionsInfo setOptions;
    private ThreadStatInfo threadStats;
    private QueryTimeInfo queryTimeStats;
    private List<OptimizerStatsUsageItem> statsUsage = new ArrayList<>();
    private List<PlanParameter> parameters = new ArrayList<>();
    private List<WaitStatInfo> waitStats = new ArrayList<>();
    private List<TraceFlagInfo> traceFlags = new ArrayList<>();
    private List<String> indexedViews = new ArrayList<>();

    private CursorInfo cursor;
    private List<FunctionPlan> functionPlans = new ArrayList<>();

    public boolean hasRootNode() {
        return rootNode != null;
    }

    public void addFunctionPlan(FunctionPlan functionPlan) {
        functionPlans.add(functionPlan);
    }
}
