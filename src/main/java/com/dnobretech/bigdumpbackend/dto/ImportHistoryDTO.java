package com.dnobretech.bigdumpbackend.dto;

import java.time.LocalDateTime;

public record ImportHistoryDTO(
        Long id,
        String filename,
        LocalDateTime finishedAt,
        long queriesExecuted,
        long linesProcessed,
        long bytesProcessed,
        String sizeFormatted,
        boolean success,
        String error,
        double durationSeconds
) {}
