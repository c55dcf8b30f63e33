package com.dnobretech.bigdumpbackend.sqlimport;

import java.util.Locale;

/**
 * Codec do dump, decidido só pela extensão (case-insensitive). Qualquer outra extensão é texto puro,
 * inclusive .sql e .csv.
 */
public enum CompressionType {
    NONE("none", 1.5),
    GZIP("gzip", 1.0),
    BZIP2("bzip2", 0.7);

    private final String label;
    private final double batchMultiplier;

    CompressionType(String label, double batchMultiplier) {
        this.label = label;
        this.batchMultiplier = batchMultiplier;
    }

    public String label() {
        return label;
    }

    /** Multiplicador aplicado ao batch calculado pelo {@link AutoTuner}. */
    public double batchMultiplier() {
        return batchMultiplier;
    }

    public boolean isCompressed() {
        return this != NONE;
    }

    public static CompressionType fromFilename(String filename) {
        if (filename == null) return NONE;
        String lower = filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".gz")) return GZIP;
        if (lower.endsWith(".bz2")) return BZIP2;
        return NONE;
    }

    /** Tipo desconhecido cai em NONE. */
    public static CompressionType fromLabel(String label) {
        if (label == null) return NONE;
        for (CompressionType t : values()) {
            if (t.label.equalsIgnoreCase(label) || t.name().equalsIgnoreCase(label)) return t;
        }
        return NONE;
    }
}
