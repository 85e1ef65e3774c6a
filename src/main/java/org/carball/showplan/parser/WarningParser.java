package org.carball.showplan.parser;

import org.carball.showplan.analyzer.WarningClassifier;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.SpillDetail;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import static org.carball.showplan.analyzer.WarningClassifier.*;
import static org.carball.showplan.parser.ShowPlanXml.*;

/**
 * Reads a {@code Warnings} element of a RelOp or QueryPlan.
 */
final class WarningParser {

    private WarningParser() {
        // Utility class - prevent instantiation
    }

    static List<PlanWarning> parse(Element warningsEl) {
        List<PlanWarning> result = new ArrayList<>();
        if (warningsEl == null) {
            return result;
        }

        if (attrBool(warningsEl, "NoJoinPredicate")) {
            result.add(warning(NO_JOIN_PREDICATE, "This join has no join predicate (possible cross join)"));
        }
        if (attrBool(warningsEl, "SpatialGuess")) {
            result.add(warning(SPATIAL_GUESS, "Spatial index selectivity was guessed"));
        }
        if (attrBool(warningsEl, "UnmatchedIndexes")) {
            result.add(warning(UNMATCHED_INDEXES, "Indexes could not be matched due to parameterization"));
        }
        if (attrBool(warningsEl, "FullUpdateForOnlineIndexBuild")) {
            result.add(warning(FULL_UPDATE_FOR_ONLINE_INDEX_BUILD, "Full update required for online index build operation"));
        }

        for (Element spill : children(warningsEl, "SpillToTempDb")) {
            result.add(tempDbSpill(spill));
        }
        for (Element spill : children(warningsEl, "SortSpillDetails")) {
            result.add(operatorSpill(SORT_SPILL, "Sort", spill));
        }
        for (Element spill : children(warningsEl, "HashSpillDetails")) {
            result.add(operatorSpill(HASH_SPILL, "Hash", spill));
        }
        for (Element spill : children(warningsEl, "ExchangeSpillDetails")) {
            long writes = attrLong(spill, "WritesToTempDb");
            SpillDetail detail = new SpillDetail("Exchange", 0, 0, 0, 0, writes, 0);
            result.add(warning(EXCHANGE_SPILL, "Exchange spill, Writes: " + number(writes), detail));
        }

        if (child(warningsEl, "SpillOccurred") != null) {
            result.add(warning(SPILL_OCCURRED, "Spill occurred during execution (from last query plan stats)"));
        }

        Element memoryWarning = child(warningsEl, "MemoryGrantWarning");
        if (memoryWarning != null) {
            String message = String.format("%s: Requested %s KB, Granted %s KB, Used %s KB",
                    attr(memoryWarning, "GrantWarningKind", "Unknown"),
                    number(attrLong(memoryWarning, "RequestedMemory")),
                    number(attrLong(memoryWarning, "GrantedMemory")),
                    number(attrLong(memoryWarning, "MaxUsedMemory")));
            result.add(warning(MEMORY_GRANT, message));
        }

        for (Element convert : children(warningsEl, "PlanAffectingConvert")) {
            String issue = attr(convert, "ConvertIssue", "Unknown");
            result.add(PlanWarning.builder()
                    .warningType(IMPLICIT_CONVERSION)
                    .message(issue + ": " + attr(convert, "Expression", ""))
                    .severity(WarningClassifier.classify(IMPLICIT_CONVERSION, issue))
                    .build());
        }

        Element noStats = child(warningsEl, "ColumnsWithNoStatistics");
        if (noStats != null) {
            result.add(warning(MISSING_STATISTICS, "No statistics on: " + columnNames(noStats)));
        }
        Element staleStats = child(warningsEl, "ColumnsWithStaleStatistics");
        if (staleStats != null) {
            result.add(warning(STALE_STATISTICS, "Stale statistics on: " + columnNames(staleStats)));
        }

        for (Element wait : children(warningsEl, "Wait")) {
            result.add(warning(WAIT, attr(wait, "WaitType", "") + ": " + attr(wait, "WaitTime", "0") + "ms"));
        }

        return result;
    }

    private static PlanWarning tempDbSpill(Element spill) {
        int level = attrInt(spill, "SpillLevel");
        int threads = attrInt(spill, "SpilledThreadCount");
        long granted = attrLong(spill, "GrantedMemoryKB");
        long used = attrLong(spill, "UsedMemoryKB");
        long writes = attrLong(spill, "WritesToTempDb");
        long reads = attrLong(spill, "ReadsFromTempDb");

        StringBuilder message = new StringBuilder()
                .append("Spill level ").append(attr(spill, "SpillLevel", "?"))
                .append(", ").append(attr(spill, "SpilledThreadCount", "?")).append(" thread(s)");
        if (granted > 0 || writes > 0) {
            message.append(", Granted: ").append(number(granted)).append(" KB, Used: ").append(number(used)).append(" KB");
            if (writes > 0) {
                message.append(", Writes: ").append(number(writes));
            }
            if (reads > 0) {
                message.append(", Reads: ").append(number(reads));
            }
        }

        SpillDetail detail = new SpillDetail("TempDb", level, threads, granted, used, writes, reads);
        return warning(SPILL_TO_TEMPDB, message.toString(), detail);
    }

    // Sort and hash spill details spell the memory attributes "Kb"
    private static PlanWarning operatorSpill(String warningType, String spillType, Element spill) {
        long granted = attrLong(spill, "GrantedMemoryKb");
        long used = attrLong(spill, "UsedMemoryKb");
        long writes = attrLong(spill, "WritesToTempDb");
        long reads = attrLong(spill, "ReadsFromTempDb");
        String message = String.format("%s spill, Granted: %s KB, Used: %s KB, Writes: %s, Reads: %s",
                spillType, number(granted), number(used), number(writes), number(reads));
        return warning(warningType, message, new SpillDetail(spillType, 0, 0, granted, used, writes, reads));
    }

    private static String columnNames(Element parent) {
        return children(parent, "ColumnReference").stream()
                .map(c -> attr(c, "Column", ""))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(", "));
    }

    private static String number(long value) {
        return String.format(Locale.ROOT, "%,d", value);
    }

    private static PlanWarning warning(String type, String message) {
        return warning(type, message, null);
    }

    private static PlanWarning warning(String type, String message, SpillDetail detail) {
        return PlanWarning.builder()
                .warningType(type)
                .message(message)
                .severity(WarningClassifier.classify(type, message))
                .spillDetail(detail)
                .build();
    }
}
