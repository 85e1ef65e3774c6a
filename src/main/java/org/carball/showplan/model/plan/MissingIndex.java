package org.carball.showplan.model.plan;

import java.util.List;

/**
 * Index suggestion as stated by the optimizer for one statement.
 */
public record MissingIndex(
        String database,
        String schema,
        String table,
        double impact,
        List<String> equalityColumns,
        List<String> inequalityColumns,
        List<String> includeColumns,
        String createStatement
) {
    public MissingIndex {
        equalityColumns = List.copyOf(equalityColumns);
        inequalityColumns = List.copyOf(inequalityColumns);
        includeColumns = List.copyOf(includeColumns);
    }
}
