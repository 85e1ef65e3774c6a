package org.carball.showplan.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class PlanViewerConfig {
    private Path planFile;
    private String outputFile;
    private OutputFormat outputFormat = OutputFormat.JSON;
    private boolean verbose;
    private PlanThresholds thresholds = PlanThresholds.defaults();
}
