package com.dnobretech.bigdumpbackend.sqlimport;

public record BatcherStatistics(
        long rowsBatched,
        long statementsEmitted,
        long bytesProcessed,
        long extendedInsertCount,
        double reductionRatio,
        double efficiency,
        long avgRowSize,
        int effectiveBatchSize,
        int bufferCount,
        boolean enabled
) {
}
