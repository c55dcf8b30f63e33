package com.dnobretech.bigdumpbackend.service.impl;

import com.dnobretech.bigdumpbackend.exception.DumpImportException;
import com.dnobretech.bigdumpbackend.service.FileAnalysisService;
import com.dnobretech.bigdumpbackend.sqlimport.CodecCapabilities;
import com.dnobretech.bigdumpbackend.sqlimport.CompressionType;
import com.dnobretech.bigdumpbackend.sqlimport.DumpReader;
import com.dnobretech.bigdumpbackend.sqlimport.FileAnalysisResult;
import com.dnobretech.bigdumpbackend.sqlimport.FileCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class SamplingFileAnalysisService implements FileAnalysisService {

    private static final double DEFAULT_BYTES_PER_LINE = 200.0;

    // INSERT INTO t [(cols)] VALUES (...),
    private static final Pattern BULK_INSERT = Pattern.compile(
            "INSERT\\s+INTO\\s+\\S+\\s+(?:\\([^)]+\\)\\s+)?VALUES\\s*\\([^)]+\\)\\s*,",
            Pattern.CASE_INSENSITIVE);

    private final CodecCapabilities codecs;

    @Value("${bigdump.analysis.sample-bytes:1048576}")
    private long sampleBytes;

    @Value("${bigdump.analysis.create-table-scan-bytes:10485760}")
    private long createTableScanBytes;

    @Override
    public FileAnalysisResult analyze(Path file) {
        CompressionType type = CompressionType.fromFilename(file.getFileName().toString());
        long fileSize = sizeOf(file);

        long lines = 0;
        long bytes = 0;
        boolean bulk = false;
        try (DumpReader reader = new DumpReader(DumpReader.DEFAULT_BUFFER_SIZE, codecs)) {
            reader.open(file);
            String line;
            while (bytes < sampleBytes && (line = reader.readLine()) != null) {
                lines++;
                bytes = reader.tell();
                if (!bulk && BULK_INSERT.matcher(line).find()) bulk = true;
            }
        } catch (DumpImportException e) {
            log.warn("Análise de '{}' sem amostra: {}", file.getFileName(), e.getMessage());
        }

        double avg = lines > 0 ? (double) bytes / lines : DEFAULT_BYTES_PER_LINE;
        // comprimido: tamanho em disco não diz o tamanho real, fica em medium
        FileCategory category = (type.isCompressed() || fileSize == 0) ? FileCategory.MEDIUM : FileCategory.fromSize(fileSize);
        long estimatedLines = (!type.isCompressed() && fileSize > 0) ? (long) Math.ceil(fileSize / avg) : 0;

        FileAnalysisResult result = new FileAnalysisResult(fileSize, category, category.label(), estimatedLines, avg,
                bulk, category.targetRamUsage(), type.isCompressed(), true);
        log.info("Análise de '{}': categoria={} linhas~{} bytes/linha={} bulk={}",
                file.getFileName(), category.key(), estimatedLines, Math.round(avg), bulk);
        return result;
    }

    @Override
    public boolean hasCreateTableFor(Path file, String table) {
        if (table == null || table.isBlank()) return false;
        Pattern create = Pattern.compile(
                "CREATE\\s+TABLE\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?" + quotedNamePattern(table) + "\\s*\\(",
                Pattern.CASE_INSENSITIVE);
        try (DumpReader reader = new DumpReader(DumpReader.DEFAULT_BUFFER_SIZE, codecs)) {
            reader.open(file);
            String line;
            StringBuilder window = new StringBuilder();
            while (reader.tell() < createTableScanBytes && (line = reader.readLine()) != null) {
                // "CREATE TABLE `t`" e o "(" podem estar em linhas diferentes
                window.append(line);
                if (create.matcher(window).find()) return true;
                if (window.length() > 4096) window.delete(0, window.length() - 512);
            }
        } catch (DumpImportException e) {
            log.warn("Não foi possível procurar CREATE TABLE {} em '{}': {}", table, file.getFileName(), e.getMessage());
        }
        return false;
    }

    /** "db.t" casa com db.t, `db`.`t`, "db"."t" e misturas; cada parte com aspas opcionais. */
    static String quotedNamePattern(String table) {
        StringBuilder sb = new StringBuilder();
        for (String part : table.split("\\.", -1)) {
            if (sb.length() > 0) sb.append("\\s*\\.\\s*");
            sb.append("[`\"]?").append(Pattern.quote(part)).append("[`\"]?");
        }
        return sb.toString();
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return 0L;
        }
    }
}
