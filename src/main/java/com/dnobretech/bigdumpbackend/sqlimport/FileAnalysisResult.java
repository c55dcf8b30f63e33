package com.dnobretech.bigdumpbackend.sqlimport;

/**
 * Snapshot produzido pela análise por amostragem de um dump. Imutável; calculado uma vez por sessão.
 *
 * @param compressed dump gzip/bzip2: tamanho e contagem de linhas são estimativas
 * @param estimated  os números vieram de amostra, não de leitura completa
 */
public record FileAnalysisResult(
        long fileSize,
        FileCategory category,
        String categoryLabel,
        long estimatedLines,
        double avgBytesPerLine,
        boolean bulkInsert,
        double targetRamUsage,
        boolean compressed,
        boolean estimated
) {
}
