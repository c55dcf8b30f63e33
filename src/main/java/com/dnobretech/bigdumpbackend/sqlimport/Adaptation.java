package com.dnobretech.bigdumpbackend.sqlimport;

/** Decisão de uma chamada a {@link AutoTuner#adaptBatchSize}. */
public record Adaptation(
        String action,
        String reason,
        int oldBatchSize,
        int newBatchSize,
        double avgSpeed,
        double avgMemory,
        double compressionMultiplier
) {

    public boolean changed() {
        return oldBatchSize != newBatchSize;
    }
}
