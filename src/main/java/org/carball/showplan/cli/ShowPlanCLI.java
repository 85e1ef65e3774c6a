package org.carball.showplan.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.showplan.analyzer.MissingIndexAggregator;
import org.carball.showplan.analyzer.PlanAnalysis;
import org.carball.showplan.analyzer.ShowPlanAnalyzer;
import org.carball.showplan.analyzer.WarningClassifier;
import org.carball.showplan.config.ConfigurationLoader;
import org.carball.showplan.config.OutputFormat;
import org.carball.showplan.config.PlanThresholds;
import org.carball.showplan.config.PlanViewerConfig;
import org.carball.showplan.layout.StatementLayout;
import org.carball.showplan.model.plan.ParsedPlan;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.PlanWarningSeverity;
import org.carball.showplan.output.PlanReport;
import org.carball.showplan.parser.ShowPlanParseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
public class ShowPlanCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║            SQL Server Showplan Analyzer v%s                ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 1 ? 1 : 0);
        }

        try {
            PlanViewerConfig config = parseArgs(args);

            System.out.println("\n🔍 Starting analysis...");
            System.out.println("   Plan file: " + config.getPlanFile());
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output: " + baseFileName + ".json, " + baseFileName + ".md");
            } else {
                System.out.println("   Output: " + config.getOutputFile());
            }
            System.out.println();

            ShowPlanAnalyzer analyzer = new ShowPlanAnalyzer(config);

            System.out.print("📊 Parsing and laying out the plan... ");
            PlanAnalysis analysis = analyzer.analyze();
            System.out.println("✓");

            System.out.print("📝 Writing results... ");
            outputResults(analysis, config);
            System.out.println("✓");

            printSummary(analysis);

            System.out.println("\n✅ Analysis complete!");
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output files:");
                System.out.println("     - " + baseFileName + ".json");
                System.out.println("     - " + baseFileName + ".md");
            } else {
                System.out.println("   Output file: " + config.getOutputFile());
            }

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (ShowPlanParseException e) {
            System.err.println("\n❌ Plan error: " + e.getMessage());
            log.debug("Plan parse error details", e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar showplan-analyzer.jar <plan-file> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  plan-file           Execution plan saved from SSMS (.sqlplan) or raw showplan XML");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for the report (default: plan-analysis.json)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --thresholds        YAML file with custom thresholds (optional)");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getThresholdHelp());
        System.out.println("Examples:");
        System.out.println("  # JSON report next to the plan");
        System.out.println("  java -jar showplan-analyzer.jar slow-query.sqlplan");
        System.out.println();
        System.out.println("  # Markdown and JSON, flag operators above 40% of the statement cost");
        System.out.println("  java -jar showplan-analyzer.jar slow-query.sqlplan -f both --thresholds.expensive-percent 40");
    }

    static PlanViewerConfig parseArgs(String[] args) {
        return parseArgs(args, new ConfigurationLoader());
    }

    static PlanViewerConfig parseArgs(String[] args, ConfigurationLoader loader) {
        PlanViewerConfig config = new PlanViewerConfig();
        config.setPlanFile(Paths.get(args[0]));

        // Set defaults
        config.setOutputFile("plan-analysis.json");
        config.setOutputFormat(OutputFormat.JSON);
        config.setVerbose(false);

        String thresholdFile = null;

        // Parse optional arguments
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                case "-o":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output file not specified");
                    }
                    config.setOutputFile(args[++i]);
                    break;

                case "--format":
                case "-f":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output format not specified");
                    }
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(args[++i].toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                case "--thresholds":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Threshold file not specified");
                    }
                    thresholdFile = args[++i];
                    break;

                case "--thresholds.expensive-percent":
                case "--thresholds.top-operators":
                case "--thresholds.preview-length":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Value not specified for " + args[i]);
                    }
                    // Value is applied by ConfigurationLoader
                    i++;
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        PlanThresholds base = thresholdFile != null
                ? loader.loadFromYaml(Paths.get(thresholdFile))
                : PlanThresholds.defaults();
        config.setThresholds(loader.loadConfiguration(base, args));

        // Apply correct file extension based on format
        String baseFileName = removeFileExtension(config.getOutputFile());
        if (config.getOutputFormat() == OutputFormat.MARKDOWN) {
            config.setOutputFile(baseFileName + ".md");
        } else {
            config.setOutputFile(baseFileName + ".json");
        }

        validateConfig(config);

        return config;
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            // Check if this is a path with directories
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void validateConfig(PlanViewerConfig config) {
        if (!Files.exists(config.getPlanFile())) {
            throw new IllegalArgumentException("Plan file not found: " + config.getPlanFile());
        }

        if (!Files.isRegularFile(config.getPlanFile())) {
            throw new IllegalArgumentException("Plan path must be a file: " + config.getPlanFile());
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private static void outputResults(PlanAnalysis analysis, PlanViewerConfig config) throws IOException {
        PlanReport report = new PlanReport(analysis, config.getThresholds());
        String baseFileName = removeFileExtension(config.getOutputFile());

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            String jsonFile = config.getOutputFormat() == OutputFormat.BOTH ?
                baseFileName + ".json" : config.getOutputFile();
            Files.writeString(Paths.get(jsonFile), report.toJson());
        }

        if (config.getOutputFormat() == OutputFormat.MARKDOWN || config.getOutputFormat() == OutputFormat.BOTH) {
            String markdownFile = config.getOutputFormat() == OutputFormat.BOTH ?
                baseFileName + ".md" : config.getOutputFile();
            Files.writeString(Paths.get(markdownFile), report.toMarkdown());
        }
    }

    private static void printSummary(PlanAnalysis analysis) {
        ParsedPlan plan = analysis.plan();
        Map<PlanWarningSeverity, List<PlanWarning>> warnings = WarningClassifier.groupBySeverity(plan);

        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 PLAN SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nStatements: " + plan.getStatementCount());
        if (plan.getSkippedStatementCount() > 0) {
            System.out.println("Statements without operators (skipped): " + plan.getSkippedStatementCount());
        }
        System.out.println("Missing index suggestions: " + MissingIndexAggregator.flatten(plan).size());

        System.out.println("\nWarnings:");
        System.out.println("  🔴 Critical: " + warnings.get(PlanWarningSeverity.CRITICAL).size());
        System.out.println("  🟡 Warning: " + warnings.get(PlanWarningSeverity.WARNING).size());
        System.out.println("  ⚪ Info: " + warnings.get(PlanWarningSeverity.INFO).size());

        System.out.println("\n🎯 Statements by cost:");
        System.out.println("-".repeat(60));
        analysis.layouts().stream()
                .map(StatementLayout::statement)
                .sorted((a, b) -> Double.compare(b.getStatementSubTreeCost(), a.getStatementSubTreeCost()))
                .limit(3)
                .forEach(statement -> System.out.printf("%-10s cost %.4f%n",
                        statement.getStatementType(), statement.getStatementSubTreeCost()));
    }
}
