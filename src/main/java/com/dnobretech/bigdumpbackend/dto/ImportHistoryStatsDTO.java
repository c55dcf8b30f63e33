package com.dnobretech.bigdumpbackend.dto;

public record ImportHistoryStatsDTO(
        int totalImports,
        int successfulImports,
        int failedImports,
        long totalQueries,
        long totalBytes,
        String totalBytesFormatted,
        double avgDurationSeconds,
        ImportHistoryDTO lastImport     // null sem histórico
) {}
