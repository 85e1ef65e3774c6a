package org.carball.showplan.model.plan;

public record OptimizerStatsUsageItem(
        String statisticsName,
        String databaseName,
        String schemaName,
        String tableName,
        long modificationCount,
        double samplingPercent,
        String lastUpdate
) {}
