package org.carball.showplan.model.plan;

/**
 * A statistics object the optimizer loaded while compiling the statement.
 */
public record StatisticsUsage(
        String statisticsName,
        String databaseName,
        String schemaName,
        String tableName,
        long modificationCount,
        double samplingPercent,
        String lastUpdate
) {}
