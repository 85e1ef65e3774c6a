package org.carball.showplan.analyzer;

import org.carball.showplan.model.plan.FunctionPlan;
import org.carball.showplan.model.plan.ParsedPlan;
import org.carball.showplan.model.plan.PlanBatch;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.PlanWarningSeverity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed mapping from showplan warning types to severities.
 */
public final class WarningClassifier {

    public static final String NO_JOIN_PREDICATE = "No Join Predicate";
    public static final String SPATIAL_GUESS = "Spatial Guess";
    public static final String UNMATCHED_INDEXES = "Unmatched Indexes";
    public static final String FULL_UPDATE_FOR_ONLINE_INDEX_BUILD = "Full Update for Online Index Build";
    public static final String SPILL_TO_TEMPDB = "Spill to TempDb";
    public static final String SORT_SPILL = "Sort Spill";
    public static final String HASH_SPILL = "Hash Spill";
    public static final String EXCHANGE_SPILL = "Exchange Spill";
    public static final String SPILL_OCCURRED = "Spill Occurred";
    public static final String MEMORY_GRANT = "Memory Grant";
    public static final String IMPLICIT_CONVERSION = "Implicit Conversion";
    public static final String MISSING_STATISTICS = "Missing Statistics";
    public static final String STALE_STATISTICS = "Stale Statistics";
    public static final String WAIT = "Wait";

    private static final Map<String, PlanWarningSeverity> SEVERITIES = Map.ofEntries(
            Map.entry(NO_JOIN_PREDICATE, PlanWarningSeverity.CRITICAL),
            Map.entry(IMPLICIT_CONVERSION, PlanWarningSeverity.CRITICAL),
            Map.entry(SPILL_TO_TEMPDB, PlanWarningSeverity.WARNING),
            Map.entry(SORT_SPILL, PlanWarningSeverity.WARNING),
            Map.entry(HASH_SPILL, PlanWarningSeverity.WARNING),
            Map.entry(EXCHANGE_SPILL, PlanWarningSeverity.WARNING),
            Map.entry(SPILL_OCCURRED, PlanWarningSeverity.WARNING),
            Map.entry(MEMORY_GRANT, PlanWarningSeverity.WARNING),
            Map.entry(MISSING_STATISTICS, PlanWarningSeverity.WARNING),
            Map.entry(STALE_STATISTICS, PlanWarningSeverity.WARNING),
            Map.entry(UNMATCHED_INDEXES, PlanWarningSeverity.WARNING),
            Map.entry(SPATIAL_GUESS, PlanWarningSeverity.INFO),
            Map.entry(FULL_UPDATE_FOR_ONLINE_INDEX_BUILD, PlanWarningSeverity.INFO),
            Map.entry(WAIT, PlanWarningSeverity.INFO)
    );

    private WarningClassifier() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the severity for a warning type. Unknown or missing types are {@code INFO}.
     * A conversion whose issue is a cardinality estimate is a {@code WARNING}, any other
     * plan-affecting conversion is {@code CRITICAL}.
     *
     * @param detail the conversion issue, or a message that starts with it; only read for conversions
     */
    public static PlanWarningSeverity classify(String warningType, String detail) {
        if (warningType == null) {
            return PlanWarningSeverity.INFO;
        }
        // The expression part of a conversion message can name columns containing "Cardinality"
        if (IMPLICIT_CONVERSION.equals(warningType) && detail != null && detail.startsWith("Cardinality")) {
            return PlanWarningSeverity.WARNING;
        }
        return SEVERITIES.getOrDefault(warningType, PlanWarningSeverity.INFO);
    }

    /**
     * Statement and operator warnings of the whole plan, function plans included, keyed
     * CRITICAL, WARNING, INFO in that order. Every severity is present, possibly with an empty list.
     */
    public static Map<PlanWarningSeverity, List<PlanWarning>> groupBySeverity(ParsedPlan plan) {
        Map<PlanWarningSeverity, List<PlanWarning>> grouped = new LinkedHashMap<>();
        grouped.put(PlanWarningSeverity.CRITICAL, new ArrayList<>());
        grouped.put(PlanWarningSeverity.WARNING, new ArrayList<>());
        grouped.put(PlanWarningSeverity.INFO, new ArrayList<>());

        for (PlanWarning warning : collectWarnings(plan)) {
            PlanWarningSeverity severity = warning.getSeverity() != null
                    ? warning.getSeverity()
                    : classify(warning.getWarningType(), warning.getMessage());
            grouped.get(severity).add(warning);
        }
        return grouped;
    }

    public static List<PlanWarning> collectWarnings(ParsedPlan plan) {
        List<PlanWarning> warnings = new ArrayList<>();
        for (PlanBatch batch : plan.getBatches()) {
            for (PlanStatement statement : batch.getStatements()) {
                collectWarnings(statement, warnings);
            }
        }
        return warnings;
    }

    public static List<PlanWarning> collectWarnings(PlanStatement statement) {
        List<PlanWarning> warnings = new ArrayList<>();
        collectWarnings(statement, warnings);
        return warnings;
    }

    private static void collectWarnings(PlanStatement statement, List<PlanWarning> warnings) {
        warnings.addAll(statement.getPlanWarnings());
        if (statement.hasRootNode()) {
            for (PlanNode node : statement.getRootNode().descendantsAndSelf()) {
                warnings.addAll(node.getWarnings());
            }
        }
        for (FunctionPlan functionPlan : statement.getFunctionPlans()) {
            for (PlanStatement nested : functionPlan.getStatements()) {
                collectWarnings(nested, warnings);
            }
        }
    }
}
