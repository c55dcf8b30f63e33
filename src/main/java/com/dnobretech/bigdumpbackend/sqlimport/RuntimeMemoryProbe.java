package com.dnobretech.bigdumpbackend.sqlimport;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Memória do heap via {@link Runtime}; RAM do host via /proc/meminfo (Linux). Fora do Linux, ou se a
 * leitura falhar, usa o heap como aproximação.
 */
@Slf4j
public class RuntimeMemoryProbe implements MemoryProbe {

    private static final Path MEMINFO = Paths.get("/proc/meminfo");

    private final Runtime runtime = Runtime.getRuntime();
    private final Path meminfo;

    public RuntimeMemoryProbe() {
        this(MEMINFO);
    }

    RuntimeMemoryProbe(Path meminfo) {
        this.meminfo = meminfo;
    }

    @Override
    public long heapUsage() {
        return runtime.totalMemory() - runtime.freeMemory();
    }

    @Override
    public long heapLimit() {
        long max = runtime.maxMemory();
        return max == Long.MAX_VALUE ? runtime.totalMemory() : max;
    }

    @Override
    public long totalRam() {
        long v = readMeminfo("MemTotal:");
        return v > 0 ? v : heapLimit();
    }

    @Override
    public long availableRam() {
        long v = readMeminfo("MemAvailable:");
        if (v <= 0) v = readMeminfo("MemFree:");
        return v > 0 ? v : Math.max(0, heapLimit() - heapUsage());
    }

    @Override
    public String detectionMethod() {
        return readMeminfo("MemTotal:") > 0 ? "proc-meminfo" : "jvm-runtime";
    }

    /** Valor em bytes da chave (o arquivo traz kB), ou -1. */
    private long readMeminfo(String key) {
        if (!Files.isReadable(meminfo)) return -1;
        try {
            List<String> lines = Files.readAllLines(meminfo, StandardCharsets.US_ASCII);
            for (String l : lines) {
                if (l.startsWith(key)) {
                    String[] parts = l.substring(key.length()).trim().split("\\s+");
                    return Long.parseLong(parts[0]) * 1024L;
                }
            }
        } catch (IOException | NumberFormatException e) {
            log.debug("Falha lendo {}: {}", meminfo, e.toString());
        }
        return -1;
    }
}
