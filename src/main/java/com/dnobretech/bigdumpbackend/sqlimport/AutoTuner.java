package com.dnobretech.bigdumpbackend.sqlimport;

import com.dnobretech.bigdumpbackend.exception.InvalidProfileException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Recomenda o tamanho do batch (linhas por invocação) a partir da memória disponível, da categoria do
 * arquivo, do codec e do perfil de performance, e reajusta a recomendação conforme a memória e a
 * velocidade observadas.
 * <p>
 * Toda recomendação fica em [minBatchSize, teto do perfil]. Nunca lança exceção: perfil inválido vira
 * conservative com warning.
 */
@Slf4j
public class AutoTuner {

    private static final int GIB = 1024 * 1024 * 1024;

    // RAM (GB) x categoria (tiny..massive)
    private static final int[] RAM_TIERS_GB = {1, 2, 3, 4, 5, 6, 8, 12, 16};
    private static final int[][] BATCH_REFERENCE = {
            {10_000, 30_000, 50_000, 80_000, 100_000},
            {20_000, 50_000, 80_000, 150_000, 250_000},
            {25_000, 70_000, 120_000, 200_000, 350_000},
            {30_000, 80_000, 150_000, 250_000, 400_000},
            {40_000, 100_000, 200_000, 350_000, 500_000},
            {45_000, 120_000, 250_000, 400_000, 600_000},
            {50_000, 150_000, 300_000, 500_000, 750_000},
            {50_000, 175_000, 350_000, 575_000, 875_000},
            {50_000, 200_000, 400_000, 650_000, 1_000_000},
    };

    // RAM disponível (limite exclusivo, em GB) -> linhas; acima de 16 GB vale RAM_PROFILE_TOP
    private static final double[] RAM_PROFILE_LIMITS_GB = {0.5, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16};
    private static final int[] RAM_PROFILE_BATCH = {
            30_000, 80_000, 150_000, 220_000, 300_000, 380_000, 460_000, 540_000, 620_000,
            700_000, 780_000, 860_000, 940_000, 1_020_000, 1_100_000, 1_180_000, 1_260_000};
    private static final int RAM_PROFILE_TOP = 1_500_000;

    private static final double BULK_INSERT_MULTIPLIER = 1.3;
    private static final double BASELINE_RAM_USAGE = 0.40;
    private static final int BYTES_PER_LINE = 150;

    private static final int HISTORY_SIZE = 5;
    private static final int MIN_SAMPLES = 3;
    private static final int LOW_MEMORY_PERCENT = 30;
    private static final int MAX_INCREASE = 100_000;

    private final AutoTunerSettings settings;
    private final MemoryProbe probe;
    private final LongSupplier clock;

    private final String requestedProfile;
    private final PerformanceProfile effectiveProfile;
    private final boolean profileDowngraded;

    private CompressionType compressionType = CompressionType.NONE;
    private FileAnalysisResult fileAnalysis;
    private int currentBatchSize;

    private final Deque<Double> speedHistory = new ArrayDeque<>();
    private final Deque<Integer> memoryHistory = new ArrayDeque<>();
    private String lastAdjustment;
    private long lastSampleAt;
    private double lastBytesPerSecond;

    private MemoryPressure cachedPressure;
    private long pressureReadAt;
    private SystemResources cachedResources;
    private long resourcesReadAt;

    public AutoTuner(AutoTunerSettings settings) {
        this(settings, new RuntimeMemoryProbe(), System::currentTimeMillis);
    }

    public AutoTuner(AutoTunerSettings settings, MemoryProbe probe, LongSupplier clock) {
        this.settings = settings;
        this.probe = probe;
        this.clock = clock;
        this.requestedProfile = settings.profile();

        PerformanceProfile requested;
        try {
            requested = PerformanceProfile.fromName(settings.profile());
        } catch (InvalidProfileException e) {
            log.warn("{}. Usando 'conservative'.", e.getMessage());
            requested = PerformanceProfile.CONSERVATIVE;
        }

        boolean downgraded = false;
        if (requested == PerformanceProfile.AGGRESSIVE) {
            long headroom = memoryHeadroom();
            if (headroom < PerformanceProfile.AGGRESSIVE_MIN_HEADROOM) {
                log.warn("Perfil aggressive sem folga de memória ({} MB livres, mínimo {} MB): usando conservative",
                        headroom / (1024 * 1024), PerformanceProfile.AGGRESSIVE_MIN_HEADROOM / (1024 * 1024));
                requested = PerformanceProfile.CONSERVATIVE;
                downgraded = true;
            }
        }
        this.effectiveProfile = requested;
        this.profileDowngraded = downgraded;

        this.currentBatchSize = settings.forceBatchSize() > 0
                ? settings.forceBatchSize()
                : clamp(settings.initialBatchSize());
        this.lastSampleAt = clock.getAsLong();
    }

    // ===================== cálculo =====================

    public int calculateOptimalBatchSize() {
        if (settings.forceBatchSize() > 0) {
            currentBatchSize = settings.forceBatchSize();
            return currentBatchSize;
        }
        if (!settings.enabled()) {
            return currentBatchSize;
        }
        currentBatchSize = (settings.fileAwareTuning() && fileAnalysis != null)
                ? fileAwareBatchSize()
                : ramOnlyBatchSize();
        return currentBatchSize;
    }

    private int fileAwareBatchSize() {
        SystemResources res = systemResources();
        int ramGb = (int) Math.max(1, res.availableRam() / GIB);
        int tierIndex = RAM_TIERS_GB.length - 1;
        for (int i = 0; i < RAM_TIERS_GB.length; i++) {
            if (ramGb <= RAM_TIERS_GB[i]) {
                tierIndex = i;
                break;
            }
        }
        FileCategory category = fileAnalysis.category() == null ? FileCategory.MEDIUM : fileAnalysis.category();
        double batch = BATCH_REFERENCE[tierIndex][category.ordinal()];
        if (fileAnalysis.bulkInsert()) {
            batch *= BULK_INSERT_MULTIPLIER;
        }
        double targetUsage = fileAnalysis.targetRamUsage() > 0 ? fileAnalysis.targetRamUsage() : BASELINE_RAM_USAGE;
        batch *= targetUsage / BASELINE_RAM_USAGE;
        batch *= effectiveProfile.multiplier();
        batch *= compressionType.batchMultiplier();
        return clamp((long) batch);
    }

    private int ramOnlyBatchSize() {
        SystemResources res = systemResources();
        long heapHeadroom = Math.max(0, res.heapLimit() - res.heapUsage());
        long effectiveLimit = Math.min(res.availableRam(), heapHeadroom);
        long safeBuffer = (long) (effectiveLimit * effectiveProfile.safetyMargin());
        double multipliers = effectiveProfile.multiplier() * compressionType.batchMultiplier();

        double calculated = (double) (safeBuffer / BYTES_PER_LINE) * multipliers;
        double profileBatch = ramProfileBatch(res.availableRam()) * multipliers;
        return clamp((long) Math.min(calculated, profileBatch));
    }

    private static int ramProfileBatch(long availableRam) {
        double gb = (double) availableRam / GIB;
        for (int i = 0; i < RAM_PROFILE_LIMITS_GB.length; i++) {
            if (gb < RAM_PROFILE_LIMITS_GB[i]) return RAM_PROFILE_BATCH[i];
        }
        return RAM_PROFILE_TOP;
    }

    private int clamp(long value) {
        return (int) Math.max(settings.minBatchSize(), Math.min(value, effectiveProfile.maxBatchSize()));
    }

    // ===================== memória =====================

    /** Uso do heap, com cache de TTL curto. */
    public MemoryPressure checkMemoryPressure() {
        long now = clock.getAsLong();
        if (cachedPressure != null && now - pressureReadAt < settings.memoryCacheTtlMillis()) {
            MemoryPressure p = cachedPressure;
            return new MemoryPressure(p.usage(), p.limit(), p.ratio(), p.percentage(), true);
        }
        long usage = probe.heapUsage();
        long limit = Math.max(1, probe.heapLimit());
        double ratio = (double) usage / limit;
        cachedPressure = new MemoryPressure(usage, limit, ratio, (int) (ratio * 100), false);
        pressureReadAt = now;
        return cachedPressure;
    }

    public void clearCache() {
        cachedPressure = null;
        cachedResources = null;
    }

    private SystemResources systemResources() {
        long now = clock.getAsLong();
        if (cachedResources == null || now - resourcesReadAt >= settings.systemResourcesTtlMillis()) {
            cachedResources = new SystemResources(probe.totalRam(), probe.availableRam(),
                    probe.heapLimit(), probe.heapUsage(), probe.detectionMethod());
            resourcesReadAt = now;
        }
        return cachedResources;
    }

    private long memoryHeadroom() {
        long heapHeadroom = Math.max(0, probe.heapLimit() - probe.heapUsage());
        return Math.min(probe.availableRam(), heapHeadroom);
    }

    // ===================== adaptação =====================

    /**
     * Registra uma amostra (velocidade desde a amostra anterior e memória atual) e reajusta o batch.
     * Chamar depois de cada batch executado.
     */
    public Adaptation adaptBatchSize(long bytesProcessed, long rowsProcessed) {
        long now = clock.getAsLong();
        double seconds = Math.max(0.001, (now - lastSampleAt) / 1000.0);
        lastSampleAt = now;
        lastBytesPerSecond = bytesProcessed / seconds;
        return adaptBatchSize(rowsProcessed / seconds, checkMemoryPressure().percentage());
    }

    public Adaptation adaptBatchSize(double linesPerSecond, int memoryPercent) {
        speedHistory.addLast(linesPerSecond);
        memoryHistory.addLast(memoryPercent);
        while (speedHistory.size() > HISTORY_SIZE) speedHistory.removeFirst();
        while (memoryHistory.size() > HISTORY_SIZE) memoryHistory.removeFirst();

        double compression = compressionType.batchMultiplier();
        int oldBatch = currentBatchSize;
        if (settings.forceBatchSize() > 0) {
            return new Adaptation("stable", "forced", oldBatch, oldBatch, 0, 0, compression);
        }
        if (speedHistory.size() < MIN_SAMPLES) {
            return new Adaptation("stable", "collecting_samples", oldBatch, oldBatch, 0, 0, compression);
        }

        List<Double> speeds = new ArrayList<>(speedHistory);
        double avgSpeed = speeds.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double variance = variance(speeds, avgSpeed);
        double avgMemory = memoryHistory.stream().mapToInt(Integer::intValue).average().orElse(0);

        int ceiling = (int) Math.min(effectiveProfile.maxBatchSize(), effectiveProfile.maxBatchSize() * compression);
        int newBatch = oldBatch;
        String action = "stable";
        String reason = "optimal";

        if (avgMemory < LOW_MEMORY_PERCENT && variance < 0.1 * avgSpeed * avgSpeed) {
            newBatch = (int) Math.min(oldBatch * 1.5, (double) oldBatch + MAX_INCREASE);
            newBatch = Math.min(newBatch, ceiling);
            action = "increase";
            reason = "ram_underutilized";
        } else if (avgMemory > memoryHighThreshold()) {
            newBatch = (int) Math.max(oldBatch * 0.7, settings.minBatchSize());
            action = "decrease";
            reason = "memory_pressure";
        } else if (speeds.size() >= 4) {
            int n = speeds.size();
            double recent = (speeds.get(n - 1) + speeds.get(n - 2)) / 2;
            double earlier = (speeds.get(0) + speeds.get(1)) / 2;
            if (earlier > 0 && recent < earlier * 0.7) {
                newBatch = (int) Math.max(oldBatch * 0.8, settings.minBatchSize());
                action = "decrease";
                reason = "speed_degradation";
            }
        }
        newBatch = Math.max(settings.minBatchSize(), Math.min(newBatch, effectiveProfile.maxBatchSize()));

        if (newBatch != oldBatch) {
            currentBatchSize = newBatch;
            lastAdjustment = String.format("Batch %s: %,d -> %,d (%s)",
                    newBatch > oldBatch ? "aumentado" : "reduzido", oldBatch, newBatch, reason.replace('_', ' '));
            log.info("AutoTuner: {}", lastAdjustment);
        } else if (!"stable".equals(action)) {
            action = "stable";
        }
        return new Adaptation(action, reason, oldBatch, newBatch, avgSpeed, avgMemory, compression);
    }

    /** Memória (%) acima da qual o batch diminui: 10 pontos abaixo da margem do perfil. */
    public int memoryHighThreshold() {
        return (int) Math.round((effectiveProfile.safetyMargin() - 0.1) * 100);
    }

    public String getSpeedTrend() {
        if (speedHistory.size() < MIN_SAMPLES) return "calculating";
        List<Double> speeds = new ArrayList<>(speedHistory);
        int n = speeds.size();
        double recent = (speeds.get(n - 1) + speeds.get(n - 2)) / 2;
        double earlier = (speeds.get(0) + speeds.get(1)) / 2;
        if (earlier == 0) return "stable";
        double change = recent / earlier;
        if (change > 1.1) return "increasing";
        if (change < 0.9) return "decreasing";
        return "stable";
    }

    private static double variance(List<Double> values, double mean) {
        if (values.size() < 2) return 0;
        double sum = 0;
        for (double v : values) sum += (v - mean) * (v - mean);
        return sum / (values.size() - 1);
    }

    // ===================== estado / métricas =====================

    public Map<String, Object> getMetrics() {
        MemoryPressure pressure = checkMemoryPressure();
        SystemResources res = systemResources();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("enabled", settings.enabled());
        m.put("profile", requestedProfile);
        m.put("effectiveProfile", effectiveProfile.key());
        m.put("profileDowngraded", profileDowngraded);
        m.put("safetyMargin", effectiveProfile.safetyMargin());
        m.put("profileMultiplier", effectiveProfile.multiplier());
        m.put("compressionType", compressionType.label());
        m.put("compressionMultiplier", compressionType.batchMultiplier());
        m.put("batchSize", currentBatchSize);
        m.put("minBatchSize", settings.minBatchSize());
        m.put("maxBatchSize", effectiveProfile.maxBatchSize());
        m.put("forcedBatchSize", settings.forceBatchSize() > 0 ? settings.forceBatchSize() : null);
        m.put("memoryUsage", pressure.usage());
        m.put("memoryLimit", pressure.limit());
        m.put("memoryPercentage", pressure.percentage());
        m.put("totalRam", res.totalRam());
        m.put("availableRam", res.availableRam());
        m.put("detectionMethod", res.detectionMethod());
        m.put("speedLps", speedHistory.isEmpty() ? 0.0 : speedHistory.peekLast());
        m.put("bytesPerSecond", lastBytesPerSecond);
        m.put("speedTrend", getSpeedTrend());
        m.put("lastAdjustment", lastAdjustment);
        m.put("fileAwareEnabled", settings.fileAwareTuning());
        m.put("fileCategory", fileAnalysis == null || fileAnalysis.category() == null ? null : fileAnalysis.category().key());
        m.put("targetRamUsage", fileAnalysis == null ? null : fileAnalysis.targetRamUsage());
        m.put("bulkInsert", fileAnalysis != null && fileAnalysis.bulkInsert());
        return m;
    }

    public void setCompressionType(CompressionType type) {
        this.compressionType = type == null ? CompressionType.NONE : type;
    }

    public CompressionType getCompressionType() {
        return compressionType;
    }

    public void setFileAnalysis(FileAnalysisResult analysis) {
        this.fileAnalysis = analysis;
    }

    public FileAnalysisResult getFileAnalysis() {
        return fileAnalysis;
    }

    public int getCurrentBatchSize() {
        return currentBatchSize;
    }

    /** Valor vindo da sessão; respeita o intervalo do perfil. */
    public void setBatchSize(int batchSize) {
        if (settings.forceBatchSize() > 0) return;
        this.currentBatchSize = clamp(batchSize);
    }

    public PerformanceProfile getEffectiveProfile() {
        return effectiveProfile;
    }

    public boolean isProfileDowngraded() {
        return profileDowngraded;
    }

    public String getLastAdjustment() {
        return lastAdjustment;
    }

    private record SystemResources(long totalRam, long availableRam, long heapLimit, long heapUsage,
                                   String detectionMethod) {
    }
}
