package org.carball.showplan.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.showplan.analyzer.MissingIndexAggregator;
import org.carball.showplan.analyzer.MissingIndexEntry;
import org.carball.showplan.analyzer.PlanAnalysis;
import org.carball.showplan.analyzer.WarningClassifier;
import org.carball.showplan.config.PlanThresholds;
import org.carball.showplan.layout.StatementLayout;
import org.carball.showplan.model.plan.MemoryGrantInfo;
import org.carball.showplan.model.plan.MissingIndex;
import org.carball.showplan.model.plan.ParsedPlan;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.PlanWarningSeverity;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class PlanReport {

    private final PlanAnalysis analysis;
    private final PlanThresholds thresholds;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public PlanReport(PlanAnalysis analysis, PlanThresholds thresholds) {
        this.analysis = analysis;
        this.thresholds = thresholds;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        ParsedPlan plan = analysis.plan();
        Map<PlanWarningSeverity, List<PlanWarning>> warnings = WarningClassifier.groupBySeverity(plan);
        List<MissingIndexEntry> missingIndexes = MissingIndexAggregator.withSources(plan);

        StringBuilder md = new StringBuilder();

        // Header
        md.append("# SQL Server Execution Plan Analysis Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        if (plan.getBuild() != null) {
            md.append("**SQL Server Build:** ").append(plan.getBuild()).append("  \n");
        }
        md.append("**Thresholds:** ").append(thresholds.getConfigurationSummary()).append("  \n\n");

        // Overview
        md.append("## Plan Overview\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Batches | ").append(plan.getBatches().size()).append(" |\n");
        md.append("| Statements | ").append(plan.getStatementCount()).append(" |\n");
        md.append("| Statements Without Operators (skipped) | ").append(plan.getSkippedStatementCount()).append(" |\n");
        md.append("| Critical Warnings | ").append(warnings.get(PlanWarningSeverity.CRITICAL).size()).append(" |\n");
        md.append("| Warnings | ").append(warnings.get(PlanWarningSeverity.WARNING).size()).append(" |\n");
        md.append("| Informational | ").append(warnings.get(PlanWarningSeverity.INFO).size()).append(" |\n");
        md.append("| Missing Index Suggestions | ").append(missingIndexes.size()).append(" |\n\n");

        // Statements
        md.append("## Statements\n\n");
        md.append("| # | Type | Subtree Cost | Est. Rows | DOP | Actual Plan | Statement |\n");
        md.append("|---|------|--------------|-----------|-----|-------------|-----------|\n");
        int number = 1;
        for (StatementLayout layout : analysis.layouts()) {
            PlanStatement statement = layout.statement();
            md.append("| ").append(number++)
                    .append(" | ").append(statement.getStatementType().isEmpty() ? "-" : statement.getStatementType())
                    .append(" | ").append(formatCost(statement.getStatementSubTreeCost()))
                    .append(" | ").append(formatRows(statement.getStatementEstRows()))
                    .append(" | ").append(statement.getDegreeOfParallelism())
                    .append(" | ").append(hasActualStats(statement) ? "Yes" : "No")
                    .append(" | ").append(tableCell(preview(statement.getStatementText())))
                    .append(" |\n");
        }
        md.append("\n");

        // Expensive operators
        md.append("## Most Expensive Operators\n\n");
        List<StatementLayout> layouts = analysis.layouts();
        for (int i = 0; i < layouts.size(); i++) {
            PlanStatement statement = layouts.get(i).statement();
            List<PlanNode> top = topOperators(statement);
            if (top.isEmpty()) {
                continue;
            }
            md.append("### Statement ").append(i + 1).append(": ").append(statement.getStatementType()).append("\n\n");
            md.append("| Node | Operator | Object | Cost % | Operator Cost | Est. Rows |\n");
            md.append("|------|----------|--------|--------|---------------|-----------|\n");
            for (PlanNode node : top) {
                md.append("| ").append(node.getNodeId())
                        .append(" | ").append(node.isExpensive() ? "**" + node.getPhysicalOp() + "**" : node.getPhysicalOp())
                        .append(" | ").append(node.hasObjectName() ? tableCell(node.getObjectName()) : "-")
                        .append(" | ").append(node.getCostPercent()).append("%")
                        .append(" | ").append(formatCost(node.getEstimatedOperatorCost()))
                        .append(" | ").append(formatRows(node.getEstimateRows()))
                        .append(" |\n");
            }
            md.append("\n");
        }

        // Warnings
        md.append("## Warnings\n\n");
        boolean anyWarnings = false;
        for (Map.Entry<PlanWarningSeverity, List<PlanWarning>> entry : warnings.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            anyWarnings = true;
            md.append("### ").append(entry.getKey()).append(" (").append(entry.getValue().size()).append(")\n\n");
            for (PlanWarning warning : entry.getValue()) {
                md.append("- **").append(warning.getWarningType()).append(":** ").append(warning.getMessage()).append("\n");
            }
            md.append("\n");
        }
        if (!anyWarnings) {
            md.append("**The plan states no warnings.**\n\n");
        }

        // Missing indexes
        md.append("## Missing Index Suggestions\n\n");
        if (missingIndexes.isEmpty()) {
            md.append("**The optimizer suggested no missing indexes.**\n\n");
        }
        number = 1;
        for (MissingIndexEntry entry : missingIndexes) {
            MissingIndex index = entry.index();
            md.append("### ").append(number++).append(". ").append(index.schema()).append(".").append(index.table())
                    .append(" (impact ").append(String.format(Locale.ROOT, "%.1f", index.impact())).append("%)\n\n");
            md.append("- **Statement:** batch ").append(entry.batchIndex() + 1)
                    .append(", statement ").append(entry.statementIndex() + 1).append("\n");
            md.append("- **Equality Columns:** ").append(columnsOrDash(index.equalityColumns())).append("\n");
            md.append("- **Inequality Columns:** ").append(columnsOrDash(index.inequalityColumns())).append("\n");
            md.append("- **Include Columns:** ").append(columnsOrDash(index.includeColumns())).append("\n\n");
            if (!index.createStatement().isEmpty()) {
                md.append("```sql\n").append(index.createStatement()).append("\n```\n\n");
            }
        }

        return md.toString();
    }

    /**
     * Operators with the highest own cost, the statement node excluded.
     */
    List<PlanNode> topOperators(PlanStatement statement) {
        if (!statement.hasRootNode()) {
            return List.of();
        }
        return statement.getRootNode().descendantsAndSelf().stream()
                .filter(node -> node.getNodeId() != PlanNode.STATEMENT_NODE_ID)
                .sorted(Comparator.comparingDouble(PlanNode::getEstimatedOperatorCost).reversed()
                        .thenComparingInt(PlanNode::getNodeId))
                .limit(Math.max(0, thresholds.getTopOperatorCount()))
                .collect(Collectors.toList());
    }

    private ReportData buildReportData() {
        ParsedPlan plan = analysis.plan();
        ReportData report = new ReportData();

        report.setMetadata(new ReportMetadata(
                timestamp,
                plan.getBuild(),
                plan.getBuildVersion(),
                plan.getStatementCount(),
                plan.getSkippedStatementCount(),
                thresholds.getConfigurationSummary()
        ));

        report.setStatements(analysis.layouts().stream()
                .map(this::toStatementReport)
                .collect(Collectors.toList()));
        report.setWarnings(WarningClassifier.groupBySeverity(plan));
        report.setMissingIndexes(MissingIndexAggregator.withSources(plan));
        return report;
    }

    private StatementReport toStatementReport(StatementLayout layout) {
        PlanStatement statement = layout.statement();
        StatementReport report = new StatementReport();
        report.setStatementType(statement.getStatementType());
        report.setStatementText(preview(statement.getStatementText()));
        report.setSubtreeCost(statement.getStatementSubTreeCost());
        report.setEstimatedRows(statement.getStatementEstRows());
        report.setDegreeOfParallelism(statement.getDegreeOfParallelism());
        report.setCompileTimeMs(statement.getCompileTimeMs());
        report.setQueryHash(statement.getQueryHash());
        report.setQueryPlanHash(statement.getQueryPlanHash());
        report.setMemoryGrant(statement.getMemoryGrant());
        report.setWarningCount(WarningClassifier.collectWarnings(statement).size());
        report.setCanvasWidth(layout.extents().width());
        report.setCanvasHeight(layout.extents().height());
        report.setTopOperators(topOperators(statement).stream()
                .map(node -> new OperatorSummary(node.getNodeId(), node.getPhysicalOp(), node.getObjectName(),
                        node.getCostPercent(), node.getEstimatedOperatorCost(), node.isExpensive()))
                .collect(Collectors.toList()));
        report.setRootNode(statement.getRootNode());
        return report;
    }

    private boolean hasActualStats(PlanStatement statement) {
        return statement.hasRootNode()
                && statement.getRootNode().descendantsAndSelf().stream().anyMatch(PlanNode::isHasActualStats);
    }

    private String preview(String text) {
        if (text == null) {
            return "";
        }
        String collapsed = text.replaceAll("\\s+", " ").trim();
        int max = thresholds.getStatementPreviewLength();
        return max > 3 && collapsed.length() > max ? collapsed.substring(0, max - 3) + "..." : collapsed;
    }

    private static String tableCell(String text) {
        return text.replace("|", "\\|");
    }

    private static String columnsOrDash(List<String> columns) {
        return columns.isEmpty() ? "-" : String.join(", ", columns);
    }

    private static String formatCost(double cost) {
        return String.format(Locale.ROOT, "%.4f", cost);
    }

    private static String formatRows(double rows) {
        return String.format(Locale.ROOT, "%,.0f", rows);
    }

    @lombok.Data
    private static class ReportData {
        private ReportMetadata metadata;
        private List<StatementReport> statements;
        private Map<PlanWarningSeverity, List<PlanWarning>> warnings;
        private List<MissingIndexEntry> missingIndexes;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class ReportMetadata {
        private LocalDateTime timestamp;
        private String sqlServerBuild;
        private String showplanVersion;
        private int statementCount;
        private int skippedStatementCount;
        private String thresholds;
    }

    @lombok.Data
    private static class StatementReport {
        private String statementType;
        private String statementText;
        private double subtreeCost;
        private double estimatedRows;
        private int degreeOfParallelism;
        private long compileTimeMs;
        private String queryHash;
        private String queryPlanHash;
        private MemoryGrantInfo memoryGrant;
        // Statement and operator warnings, those of invoked function plans included
        private int warningCount;
        private double canvasWidth;
        private double canvasHeight;
        private List<OperatorSummary> topOperators;
        private PlanNode rootNode;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class OperatorSummary {
        private int nodeId;
        private String physicalOp;
        private String objectName;
        private int costPercent;
        private double operatorCost;
        private boolean expensive;
    }
}
