package org.carball.showplan.analyzer;

import org.carball.showplan.model.plan.MissingIndex;
import org.carball.showplan.model.plan.ParsedPlan;
import org.carball.showplan.model.plan.PlanBatch;
import org.carball.showplan.model.plan.PlanStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens per-statement missing index suggestions in batch then statement order. Identical
 * suggestions from different statements are all kept so each stays traceable to its statement.
 */
public final class MissingIndexAggregator {

    private MissingIndexAggregator() {
        // Utility class - prevent instantiation
    }

    public static List<MissingIndex> flatten(ParsedPlan plan) {
        List<MissingIndex> result = new ArrayList<>();
        for (PlanBatch batch : plan.getBatches()) {
            for (PlanStatement statement : batch.getStatements()) {
                result.addAll(statement.getMissingIndexes());
            }
        }
        return result;
    }

    public static List<MissingIndexEntry> withSources(ParsedPlan plan) {
        List<MissingIndexEntry> result = new ArrayList<>();
        List<PlanBatch> batches = plan.getBatches();
        for (int b = 0; b < batches.size(); b++) {
            List<PlanStatement> statements = batches.get(b).getStatements();
            for (int s = 0; s < statements.size(); s++) {
                PlanStatement statement = statements.get(s);
                for (MissingIndex index : statement.getMissingIndexes()) {
                    result.add(new MissingIndexEntry(b, s, statement.getStatementText(), index));
                }
            }
        }
        return result;
    }
}
