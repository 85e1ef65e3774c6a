package org.carball.showplan.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@Slf4j
public class PlanThresholds {

    // Operators at or above this share of the statement cost are flagged expensive
    @Builder.Default
    @JsonProperty("expensive_operator_percent")
    private int expensiveOperatorPercent = 25;

    // Report settings
    @Builder.Default
    @JsonProperty("top_operator_count")
    private int topOperatorCount = 5;

    @Builder.Default
    @JsonProperty("statement_preview_length")
    private int statementPreviewLength = 150;

    @Builder.Default
    @JsonProperty("profile_name")
    private String profileName = "default";

    /**
     * Creates the built-in thresholds.
     */
    public static PlanThresholds defaults() {
        return PlanThresholds.builder()
                .profileName("default")
                .build();
    }

    /**
     * Validates the threshold configuration and logs warnings for values that will behave oddly.
     */
    public void validate() {
        if (expensiveOperatorPercent < 0 || expensiveOperatorPercent > 100) {
            log.warn("Expensive operator percent ({}) should be between 0 and 100", expensiveOperatorPercent);
        }

        if (expensiveOperatorPercent == 0) {
            log.warn("Expensive operator percent is 0, every operator will be flagged as expensive");
        }

        if (topOperatorCount <= 0) {
            log.warn("Top operator count ({}) should be positive", topOperatorCount);
        }

        if (statementPreviewLength < 20) {
            log.warn("Statement preview length ({}) is too short to be readable", statementPreviewLength);
        }

        log.debug("Using thresholds - Expensive: {}%, Top operators: {}, Preview: {}, Profile: {}",
                expensiveOperatorPercent, topOperatorCount, statementPreviewLength, profileName);
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Profile: %s | Expensive: %d%% | Top operators: %d | Preview length: %d",
                profileName, expensiveOperatorPercent, topOperatorCount, statementPreviewLength);
    }
}
