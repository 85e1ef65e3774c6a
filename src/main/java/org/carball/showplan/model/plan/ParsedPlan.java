package org.carball.showplan.model.plan;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.ToString;
import org.carball.showplan.analyzer.MissingIndexAggregator;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a parsed showplan document.
 */
@Data
public class ParsedPlan {
    @JsonIgnore
    @ToString.Exclude
    private String rawXml = "";
    private String buildVersion;
    private String build;
    private boolean clusteredMode;
    private List<PlanBatch> batches = new ArrayList<>();

    // Statements dropped because they had no root operator
    private int skippedStatementCount;

    public void addBatch(PlanBatch batch) {
        batches.add(batch);
    }

    /**
     * Missing indexes of all top level statements in document order. Recomputed on every call.
     */
    public List<MissingIndex> getAllMissingIndexes() {
        return MissingIndexAggregator.flatten(this);
    }

    public int getStatementCount() {
        return batches.stream().mapToInt(b -> b.getStatements().size()).sum();
    }
}
