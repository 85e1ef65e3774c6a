package org.carball.showplan.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.IntConsumer;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public PlanThresholds loadConfiguration(String[] args) {
        return loadConfiguration(PlanThresholds.defaults(), args);
    }

    /**
     * Overlays env vars and CLI args on top of an existing base, e.g. thresholds read from YAML.
     */
    public PlanThresholds loadConfiguration(PlanThresholds base, String[] args) {
        log.debug("Loading configuration");

        PlanThresholds.PlanThresholdsBuilder builder = base.toBuilder();

        // 1. Apply environment variables
        applyEnvironmentVariables(builder);

        // 2. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        PlanThresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded: {}", thresholds.getConfigurationSummary());
        return thresholds;
    }

    /**
     * Reads snake_case thresholds from a YAML file. A missing or unreadable file yields the defaults.
     */
    public PlanThresholds loadFromYaml(Path yamlFile) {
        if (!Files.isRegularFile(yamlFile)) {
            log.warn("Threshold file not found: {}. Using defaults", yamlFile);
            return PlanThresholds.defaults();
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            PlanThresholds thresholds = mapper.readValue(yamlFile.toFile(), PlanThresholds.class);
            log.info("Loaded thresholds from {}: {}", yamlFile, thresholds.getConfigurationSummary());
            return thresholds;
        } catch (IOException e) {
            log.warn("Could not read threshold file {}: {}. Using defaults", yamlFile, e.getMessage());
            return PlanThresholds.defaults();
        }
    }

    private void applyEnvironmentVariables(PlanThresholds.PlanThresholdsBuilder builder) {
        String value = environment.get("SHOWPLAN_EXPENSIVE_PERCENT");
        if (value != null) {
            parseInt("SHOWPLAN_EXPENSIVE_PERCENT", value, builder::expensiveOperatorPercent);
        }
        value = environment.get("SHOWPLAN_TOP_OPERATORS");
        if (value != null) {
            parseInt("SHOWPLAN_TOP_OPERATORS", value, builder::topOperatorCount);
        }
        value = environment.get("SHOWPLAN_PREVIEW_LENGTH");
        if (value != null) {
            parseInt("SHOWPLAN_PREVIEW_LENGTH", value, builder::statementPreviewLength);
        }
    }

    private void applyCLIArguments(PlanThresholds.PlanThresholdsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            switch (arg) {
                case "--thresholds.expensive-percent":
                    parseInt(arg, value, builder::expensiveOperatorPercent);
                    break;
                case "--thresholds.top-operators":
                    parseInt(arg, value, builder::topOperatorCount);
                    break;
                case "--thresholds.preview-length":
                    parseInt(arg, value, builder::statementPreviewLength);
                    break;
            }
        }
    }

    private void parseInt(String source, String value, IntConsumer target) {
        try {
            target.accept(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            CLI Arguments:
              --thresholds <file.yaml>               Load thresholds from a YAML file
              --thresholds.expensive-percent <num>   Cost share at which an operator is expensive (default 25)
              --thresholds.top-operators <num>       Operators listed per statement in the report (default 5)
              --thresholds.preview-length <num>      Statement text preview length in the report (default 150)

            Environment Variables:
              SHOWPLAN_EXPENSIVE_PERCENT             Same as --thresholds.expensive-percent
              SHOWPLAN_TOP_OPERATORS                 Same as --thresholds.top-operators
              SHOWPLAN_PREVIEW_LENGTH                Same as --thresholds.preview-length

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML file or built-in defaults
            """;
    }
}
