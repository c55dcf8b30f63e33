package com.dnobretech.bigdumpbackend.sqlimport;

import java.util.Locale;

/** Faixa de tamanho do dump. A ordem das constantes é o índice da tabela de referência do {@link AutoTuner}. */
public enum FileCategory {
    TINY("Tiny (< 10 MB)", 10L * 1024 * 1024, 0.15),
    SMALL("Small (< 50 MB)", 50L * 1024 * 1024, 0.20),
    MEDIUM("Medium (< 500 MB)", 500L * 1024 * 1024, 0.40),
    LARGE("Large (< 2 GB)", 2L * 1024 * 1024 * 1024, 0.60),
    MASSIVE("Massive (>= 2 GB)", Long.MAX_VALUE, 0.75);

    private final String label;
    private final long upperBoundExclusive;
    private final double targetRamUsage;

    FileCategory(String label, long upperBoundExclusive, double targetRamUsage) {
        this.label = label;
        this.upperBoundExclusive = upperBoundExclusive;
        this.targetRamUsage = targetRamUsage;
    }

    public String label() {
        return label;
    }

    public double targetRamUsage() {
        return targetRamUsage;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FileCategory fromSize(long bytes) {
        for (FileCategory c : values()) {
            if (bytes < c.upperBoundExclusive) return c;
        }
        return MASSIVE;
    }

    /** Chave desconhecida cai em MEDIUM. */
    public static FileCategory fromKey(String key) {
        if (key == null) return MEDIUM;
        for (FileCategory c : values()) {
            if (c.name().equalsIgnoreCase(key)) return c;
        }
        return MEDIUM;
    }
}
