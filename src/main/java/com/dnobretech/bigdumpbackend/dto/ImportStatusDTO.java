package com.dnobretech.bigdumpbackend.dto;

import java.time.LocalDateTime;

public record ImportStatusDTO(
        String filename,
        String state,
        long linesDone,
        long bytesDone,
        long queriesDone,
        long fileSize,
        String compressionType,
        Double percentDone,             // só para arquivo não comprimido
        Long linesTotalEstimate,        // congelado ao passar de 5%
        Long queriesTotalEstimate,
        int batchSize,
        long memoryUsage,
        int memoryPercentage,
        double speedLps,
        String profile,
        String errorMessage,
        String errorStatement,
        Long errorLine,
        String errorTable,
        boolean canDropAndRetry,
        LocalDateTime updatedAt
) {}
