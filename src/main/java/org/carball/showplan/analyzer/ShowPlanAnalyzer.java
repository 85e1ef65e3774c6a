package org.carball.showplan.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.showplan.config.PlanThresholds;
import org.carball.showplan.config.PlanViewerConfig;
import org.carball.showplan.layout.PlanLayoutEngine;
import org.carball.showplan.layout.StatementLayout;
import org.carball.showplan.model.plan.ParsedPlan;
import org.carball.showplan.parser.ShowPlanParser;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs the parse, annotate and layout pipeline.
 */
@Slf4j
public class ShowPlanAnalyzer {

    private final PlanViewerConfig config;
    private final ShowPlanParser parser;
    private final PlanLayoutEngine layoutEngine;

    public ShowPlanAnalyzer(PlanViewerConfig config) {
        this.config = config;

        PlanThresholds thresholds = config.getThresholds() != null
                ? config.getThresholds() : PlanThresholds.defaults();

        this.parser = new ShowPlanParser(thresholds);
        this.layoutEngine = new PlanLayoutEngine();

        log.info("Initialized ShowPlanAnalyzer with config: {}", config);
        log.info("Using thresholds: {}", thresholds.getConfigurationSummary());
    }

    /**
     * Analyzes the plan file named in the configuration.
     */
    public PlanAnalysis analyze() throws IOException {
        if (config.getPlanFile() == null) {
            throw new IllegalArgumentException("No plan file configured");
        }
        return analyzeFile(config.getPlanFile());
    }

    public PlanAnalysis analyzeFile(Path planFile) throws IOException {
        log.info("Reading plan file {}", planFile);
        return analyze(readPlanFile(planFile));
    }

    public PlanAnalysis analyze(String xml) {
        if (config.isVerbose()) {
            System.out.println("  - Parsing showplan XML...");
        }
        ParsedPlan plan = parser.parse(xml);

        if (config.isVerbose()) {
            System.out.println("  - Computing diagram layout...");
        }
        List<StatementLayout> layouts = layoutEngine.layoutAll(plan);

        log.info("Analysis complete: {} statements laid out, {} missing index suggestions",
                layouts.size(), plan.getAllMissingIndexes().size());
        return new PlanAnalysis(plan, layouts);
    }

    /**
     * Reads a plan file, honouring a byte order mark. SSMS saves .sqlplan files as UTF-16.
     * Without a BOM the content is read as UTF-8.
     */
    static String readPlanFile(Path planFile) throws IOException {
        byte[] bytes = Files.readAllBytes(planFile);

        Charset charset = StandardCharsets.UTF_8;
        int offset = 0;
        if (bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF) {
            offset = 3;
        } else if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xFE) {
            charset = StandardCharsets.UTF_16LE;
            offset = 2;
        } else if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFE && (bytes[1] & 0xFF) == 0xFF) {
            charset = StandardCharsets.UTF_16BE;
            offset = 2;
        }

        log.debug("Decoding {} as {}", planFile, charset);
        return new String(bytes, offset, bytes.length - offset, charset);
    }
}
