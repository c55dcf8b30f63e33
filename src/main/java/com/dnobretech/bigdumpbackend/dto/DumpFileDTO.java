package com.dnobretech.bigdumpbackend.dto;

import java.time.Instant;

public record DumpFileDTO(
        String filename,
        long size,
        String sizeFormatted,
        String compressionType,
        boolean codecAvailable,
        Instant lastModified
) {}
