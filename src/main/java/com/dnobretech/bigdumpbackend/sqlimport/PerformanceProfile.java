package com.dnobretech.bigdumpbackend.sqlimport;

import com.dnobretech.bigdumpbackend.exception.InvalidProfileException;

import java.util.Locale;

public enum PerformanceProfile {
    CONSERVATIVE(0.8, 1_500_000, 1.0, 1),
    AGGRESSIVE(0.7, 2_000_000, 1.3, 3);

    /** Folga mínima de memória para o perfil agressivo. */
    public static final long AGGRESSIVE_MIN_HEADROOM = 128L * 1024 * 1024;

    private final double safetyMargin;
    private final int maxBatchSize;
    private final double multiplier;
    private final int commitFrequency;

    PerformanceProfile(double safetyMargin, int maxBatchSize, double multiplier, int commitFrequency) {
        this.safetyMargin = safetyMargin;
        this.maxBatchSize = maxBatchSize;
        this.multiplier = multiplier;
        this.commitFrequency = commitFrequency;
    }

    public double safetyMargin() {
        return safetyMargin;
    }

    public int maxBatchSize() {
        return maxBatchSize;
    }

    public double multiplier() {
        return multiplier;
    }

    /** Quantos statements rodam entre commits. */
    public int commitFrequency() {
        return commitFrequency;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PerformanceProfile fromName(String name) {
        if (name != null) {
            for (PerformanceProfile p : values()) {
                if (p.name().equalsIgnoreCase(name.strip())) return p;
            }
        }
        throw new InvalidProfileException(name);
    }
}
