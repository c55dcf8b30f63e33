package com.dnobretech.bigdumpbackend.sqlimport;

import lombok.Builder;

/**
 * Knobs do {@link AutoTuner}. {@code forceBatchSize > 0} desliga todo o cálculo.
 */
@Builder(toBuilder = true)
public record AutoTunerSettings(
        String profile,
        boolean enabled,
        boolean fileAwareTuning,
        int minBatchSize,
        int initialBatchSize,
        int forceBatchSize,
        long memoryCacheTtlMillis,
        long systemResourcesTtlMillis
) {

    public static AutoTunerSettings defaults() {
        return AutoTunerSettings.builder()
                .profile("conservative")
                .enabled(true)
                .fileAwareTuning(true)
                .minBatchSize(10_000)
                .initialBatchSize(50_000)
                .forceBatchSize(0)
                .memoryCacheTtlMillis(1_000)
                .systemResourcesTtlMillis(60_000)
                .build();
    }
}
