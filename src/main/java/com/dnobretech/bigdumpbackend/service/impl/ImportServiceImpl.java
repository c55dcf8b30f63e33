package com.dnobretech.bigdumpbackend.service.impl;

import com.dnobretech.bigdumpbackend.domain.ImportSession;
import com.dnobretech.bigdumpbackend.domain.ImportState;
import com.dnobretech.bigdumpbackend.dto.ImportProgressDTO;
import com.dnobretech.bigdumpbackend.dto.ImportStatusDTO;
import com.dnobretech.bigdumpbackend.exception.DumpFileNotFoundException;
import com.dnobretech.bigdumpbackend.exception.DumpImportException;
import com.dnobretech.bigdumpbackend.repository.ImportSessionRepository;
import com.dnobretech.bigdumpbackend.service.FileAnalysisService;
import com.dnobretech.bigdumpbackend.service.FileService;
import com.dnobretech.bigdumpbackend.service.ImportHistoryService;
import com.dnobretech.bigdumpbackend.service.ImportService;
import com.dnobretech.bigdumpbackend.sqlimport.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class ImportServiceImpl implements ImportService {

    private static final Pattern SAFE_TABLE = Pattern.compile("^[\\w$]+(?:\\.[\\w$]+)?$");
    private static final double FREEZE_ESTIMATES_AT_PERCENT = 5.0;

    private final ImportSessionRepository sessions;
    private final FileService files;
    private final FileAnalysisService analysis;
    private final JdbcStatementExecutorFactory executors;
    private final CodecCapabilities codecs;
    private final MemoryProbe memoryProbe;
    private final ObjectMapper objectMapper;
    private final ImportHistoryService history;

    // estado vivo por arquivo (tuner, flag de parada, lock); a sessão persistida é a fonte da verdade
    private final Map<String, ImportRuntime> runtimes = new ConcurrentHashMap<>();

    @Value("${bigdump.import.lines-per-invocation:3000}")
    private long linesPerInvocation;
    @Value("${bigdump.import.max-time-ms:25000}")
    private long maxTimeMillis;
    @Value("${bigdump.import.max-overrun-lines:50000}")
    private long maxOverrunLines;
    @Value("${bigdump.import.log-every-lines:100000}")
    private long logEveryLines;
    @Value("${bigdump.import.profile:conservative}")
    private String profile;
    @Value("${bigdump.import.auto-tuning:true}")
    private boolean autoTuning;
    @Value("${bigdump.import.file-aware-tuning:true}")
    private boolean fileAwareTuning;
    @Value("${bigdump.import.force-batch-size:0}")
    private int forceBatchSize;
    @Value("${bigdump.import.min-batch-size:10000}")
    private int minBatchSize;
    @Value("${bigdump.import.auto-aggressive-threshold:104857600}")
    private long autoAggressiveThreshold;
    @Value("${bigdump.import.memory-cache-ttl-ms:1000}")
    private long memoryCacheTtlMillis;

    @Value("${bigdump.reader.buffer-size:131072}")
    private int bufferSize;
    @Value("${bigdump.parser.max-statement-bytes:10485760}")
    private int maxStatementBytes;
    @Value("${bigdump.parser.max-statement-lines:10000}")
    private int maxStatementLines;

    @Value("${bigdump.batcher.conservative.rows:2000}")
    private int conservativeRows;
    @Value("${bigdump.batcher.conservative.bytes:16777216}")
    private long conservativeBytes;
    @Value("${bigdump.batcher.aggressive.rows:5000}")
    private int aggressiveRows;
    @Value("${bigdump.batcher.aggressive.bytes:33554432}")
    private long aggressiveBytes;

    // separados por ';' (ex.: "SET foreign_key_checks = 0; SET unique_checks = 0")
    @Value("${bigdump.db.pre-queries:}")
    private String preQueries;

    // ===================== staggered =====================

    @Override
    public ImportProgressDTO start(String filename) {
        Path path = files.resolve(filename);
        String key = path.getFileName().toString();

        ImportSession session = ImportSession.start(key);
        session.setFileSize(sizeOf(path));
        CompressionType type = CompressionType.fromFilename(key);
        session.setCompressionType(type.label());

        FileAnalysisResult fa = analysis.analyze(path);
        session.setFileAnalysisJson(writeAnalysis(fa));

        String requestedProfile = resolveProfile(session.getFileSize());
        ImportRuntime runtime = newRuntime(requestedProfile, type, fa);

        // o runtime anterior fica travado até o fim desta invocação
        ImportRuntime[] replaced = new ImportRuntime[1];
        runtimes.compute(key, (k, previous) -> {
            if (previous != null && !previous.lock.tryLock()) {
                throw new IllegalStateException("Import de '" + key + "' já está em andamento");
            }
            replaced[0] = previous;
            runtime.lock.lock();
            return runtime;
        });

        try {
            session.setProfile(runtime.tuner.getEffectiveProfile().key());
            session.setBatchSize(runtime.tuner.calculateOptimalBatchSize());
            log.info("Import iniciado: '{}' tamanho={} codec={} perfil={} batch={}",
                    key, session.getFileSize(), type.label(), session.getProfile(), session.getBatchSize());

            sessions.save(session);
            return invoke(session, path, runtime);
        } finally {
            runtime.lock.unlock();
            if (replaced[0] != null) replaced[0].lock.unlock();
        }
    }

    @Override
    public ImportProgressDTO resume(String filename) {
        ImportSession session = load(filename);
        if (session.getState() == ImportState.FINISHED) {
            return new ImportProgressDTO(toStatus(session), null);
        }
        Path path = files.resolve(session.getFilename());
        ImportRuntime runtime = runtimeFor(session);
        return invoke(session, path, runtime);
    }

    @Override
    public ImportStatusDTO status(String filename) {
        return toStatus(load(filename));
    }

    @Override
    public ImportStatusDTO stop(String filename) {
        ImportSession session = load(filename);
        ImportRuntime runtime = runtimes.get(session.getFilename());
        if (runtime != null && runtime.lock.isLocked()) {
            // invocação em andamento: ela mesma grava STOPPED no próximo fim de linha
            runtime.stopRequested.set(true);
            log.info("Parada solicitada para '{}'", session.getFilename());
            return toStatus(session);
        }
        if (session.getState() != ImportState.FINISHED) {
            session.setState(ImportState.STOPPED);
            sessions.save(session);
        }
        return toStatus(session);
    }

    @Override
    public void forget(String filename) {
        ImportSession session = load(filename);
        ImportRuntime runtime = runtimes.get(session.getFilename());
        if (runtime != null && runtime.lock.isLocked()) {
            throw new IllegalStateException("Import de '" + session.getFilename() + "' em andamento; pare antes de remover");
        }
        runtimes.remove(session.getFilename());
        sessions.delete(session);
        log.info("Sessão de import removida: '{}'", session.getFilename());
    }

    @Override
    public void deleteDump(String filename) throws IOException {
        String key = FileServiceImpl.sanitize(filename);
        ImportRuntime runtime = runtimes.get(key);
        boolean running = (runtime != null && runtime.lock.isLocked())
                || sessions.findById(key).map(s -> s.getState() == ImportState.RUNNING).orElse(false);
        if (running) {
            throw new IllegalStateException("Import de '" + key + "' em andamento; pare antes de remover o arquivo");
        }
        files.deleteDump(key);
        runtimes.remove(key);
        if (sessions.existsById(key)) {
            sessions.deleteById(key);
        }
    }

    @Override
    public ImportProgressDTO dropAndRetry(String filename) {
        ImportSession session = load(filename);
        String table = session.getErrorTable();
        if (session.getState() != ImportState.ERROR || table == null) {
            throw new IllegalStateException("A sessão de '" + session.getFilename() + "' não parou em 'tabela já existe'");
        }
        if (!SAFE_TABLE.matcher(table).matches()) {
            throw new IllegalArgumentException("Nome de tabela inválido: '" + table + "'");
        }
        Path path = files.resolve(session.getFilename());
        if (!analysis.hasCreateTableFor(path, table)) {
            throw new IllegalStateException("O dump não contém CREATE TABLE para '" + table + "'; DROP recusado");
        }

        try (JdbcStatementExecutor exec = executors.create()) {
            ExecutionResult r = exec.execute("DROP TABLE IF EXISTS " + table);
            if (!r.success()) {
                throw new DumpImportException("DROP TABLE " + table + " falhou: " + r.error());
            }
            exec.commit();
        }
        log.warn("Tabela '{}' removida para retomar '{}' na linha {}", table, session.getFilename(), session.getErrorLine());
        session.clearError();
        sessions.save(session);
        return invoke(session, path, runtimeFor(session));
    }

    @Override
    public Map<String, Object> metrics(String filename) {
        ImportSession session = load(filename);
        ImportRuntime runtime = runtimeFor(session);
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("filename", session.getFilename());
        m.put("autoTuner", runtime.tuner.getMetrics());
        m.put("batcher", runtime.lastBatcherStatistics);
        return m;
    }

    // ===================== CLI =====================

    @Override
    public InvocationResult runToCompletion(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new DumpFileNotFoundException(file.toString());
        }
        CompressionType type = CompressionType.fromFilename(file.getFileName().toString());
        FileAnalysisResult fa = analysis.analyze(file);
        ImportRuntime runtime = newRuntime(resolveProfile(sizeOf(file)), type, fa);
        runtime.tuner.calculateOptimalBatchSize();

        ImportSession session = ImportSession.start(file.getFileName().toString());
        session.setFileSize(sizeOf(file));
        session.setCompressionType(type.label());
        session.setProfile(runtime.tuner.getEffectiveProfile().key());

        InvocationBudget budget = InvocationBudget.unlimited().toBuilder()
                .maxOverrunLines(maxOverrunLines)
                .logEveryLines(logEveryLines)
                .commitFrequency(runtime.tuner.getEffectiveProfile().commitFrequency())
                .build();
        try (JdbcStatementExecutor exec = executors.create()) {
            while (true) {
                long offsetBefore = session.getCurrentOffset();
                InvocationResult result = orchestrator(runtime, exec, budget).run(session, file);
                if (result.finished() || result.failed() || session.getState() != ImportState.RUNNING) {
                    recordIfDone(session);
                    return result;
                }
                if (session.getCurrentOffset() <= offsetBefore) {
                    throw new DumpImportException("Import de '" + file.getFileName() + "' parou sem avançar no offset "
                            + offsetBefore + " (linha " + session.getCurrentLine() + ")");
                }
                log.info("CLI: invocação pausada na linha {}, continuando '{}'", session.getCurrentLine(), file.getFileName());
            }
        }
    }

    // ===================== internos =====================

    private ImportProgressDTO invoke(ImportSession session, Path path, ImportRuntime runtime) {
        if (!runtime.lock.tryLock()) {
            throw new IllegalStateException("Import de '" + session.getFilename() + "' já está em andamento");
        }
        try {
            runtime.stopRequested.set(false);
            long lineBudget = (autoTuning && forceBatchSize <= 0)
                    ? Math.max(linesPerInvocation, session.getBatchSize())
                    : (forceBatchSize > 0 ? forceBatchSize : linesPerInvocation);
            InvocationBudget budget = InvocationBudget.builder()
                    .maxLines(lineBudget)
                    .maxTimeMillis(maxTimeMillis)
                    .maxOverrunLines(maxOverrunLines)
                    .commitFrequency(runtime.tuner.getEffectiveProfile().commitFrequency())
                    .logEveryLines(logEveryLines)
                    .memoryCheckEvery(1_000)
                    .build();

            InvocationResult result;
            try (JdbcStatementExecutor exec = executors.create()) {
                result = orchestrator(runtime, exec, budget).run(session, path);
            }
            runtime.lastBatcherStatistics = result.batcherStatistics();
            freezeEstimates(session);
            sessions.save(session);
            recordIfDone(session);
            return new ImportProgressDTO(toStatus(session), result.statistics());
        } finally {
            runtime.lock.unlock();
        }
    }

    private void recordIfDone(ImportSession session) {
        if (session.getState() == ImportState.FINISHED || session.getState() == ImportState.ERROR) {
            history.record(session);
        }
    }

    private ImportOrchestrator orchestrator(ImportRuntime runtime, StatementExecutor exec, InvocationBudget budget) {
        InsertBatcher batcher = runtime.tuner.getEffectiveProfile() == PerformanceProfile.AGGRESSIVE
                ? new InsertBatcher(aggressiveRows, aggressiveBytes)
                : new InsertBatcher(conservativeRows, conservativeBytes);
        return ImportOrchestrator.builder()
                .reader(new DumpReader(bufferSize, codecs))
                .parser(new SqlStatementParser(maxStatementBytes, maxStatementLines))
                .batcher(batcher)
                .executor(exec)
                .tuner(runtime.tuner)
                .budget(budget)
                .preQueries(parsePreQueries())
                .stopRequested(runtime.stopRequested::get)
                .build();
    }

    private ImportRuntime runtimeFor(ImportSession session) {
        return runtimes.computeIfAbsent(session.getFilename(), k -> {
            CompressionType type = CompressionType.fromLabel(session.getCompressionType());
            // análise cacheada na sessão: não recalcula
            ImportRuntime r = newRuntime(session.getProfile(), type, readAnalysis(session.getFileAnalysisJson()));
            if (session.getBatchSize() > 0) r.tuner.setBatchSize(session.getBatchSize());
            return r;
        });
    }

    private ImportRuntime newRuntime(String requestedProfile, CompressionType type, FileAnalysisResult fa) {
        AutoTunerSettings settings = AutoTunerSettings.defaults().toBuilder()
                .profile(requestedProfile)
                .enabled(autoTuning)
                .fileAwareTuning(fileAwareTuning)
                .minBatchSize(minBatchSize)
                .initialBatchSize((int) Math.min(Integer.MAX_VALUE, linesPerInvocation))
                .forceBatchSize(forceBatchSize)
                .memoryCacheTtlMillis(memoryCacheTtlMillis)
                .build();
        AutoTuner tuner = new AutoTuner(settings, memoryProbe, System::currentTimeMillis);
        tuner.setCompressionType(type);
        tuner.setFileAnalysis(fa);
        return new ImportRuntime(tuner);
    }

    /** Arquivo grande sob conservative sobe para aggressive; o tuner rebaixa se faltar memória. */
    private String resolveProfile(long fileSize) {
        if ("conservative".equalsIgnoreCase(profile) && autoAggressiveThreshold > 0 && fileSize > autoAggressiveThreshold) {
            log.info("Arquivo de {} bytes acima de {}: usando perfil aggressive", fileSize, autoAggressiveThreshold);
            return "aggressive";
        }
        return profile;
    }

    private void freezeEstimates(ImportSession s) {
        if (s.getFrozenLinesTotal() != null) return;
        if (CompressionType.fromLabel(s.getCompressionType()).isCompressed()) return;
        if (s.getFileSize() <= 0 || s.getCurrentOffset() <= 0) return;
        double pct = s.getCurrentOffset() * 100.0 / s.getFileSize();
        if (pct < FREEZE_ESTIMATES_AT_PERCENT) return;
        double factor = (double) s.getFileSize() / s.getCurrentOffset();
        s.setFrozenLinesTotal((long) Math.ceil(s.getCurrentLine() * factor));
        s.setFrozenQueriesTotal((long) Math.ceil(s.getTotalStatementsExecuted() * factor));
    }

    private ImportStatusDTO toStatus(ImportSession s) {
        Double pct = null;
        if (!CompressionType.fromLabel(s.getCompressionType()).isCompressed() && s.getFileSize() > 0) {
            pct = Math.min(100.0, s.getCurrentOffset() * 100.0 / s.getFileSize());
        }
        return new ImportStatusDTO(
                s.getFilename(),
                s.getState().name(),
                s.getCurrentLine(),
                s.getCurrentOffset(),
                s.getTotalStatementsExecuted(),
                s.getFileSize(),
                s.getCompressionType(),
                pct,
                s.getFrozenLinesTotal(),
                s.getFrozenQueriesTotal(),
                s.getBatchSize(),
                s.getMemoryUsage(),
                s.getMemoryPercentage(),
                s.getSpeedLps(),
                s.getProfile(),
                s.getErrorMessage(),
                s.getErrorStatement(),
                s.getErrorLine(),
                s.getErrorTable(),
                s.getState() == ImportState.ERROR && s.getErrorTable() != null,
                s.getUpdatedAt());
    }

    private ImportSession load(String filename) {
        String key = FileServiceImpl.sanitize(filename);
        return sessions.findById(key)
                .orElseThrow(() -> new EntityNotFoundException("Sessão de import não encontrada: " + key));
    }

    private List<String> parsePreQueries() {
        if (preQueries == null || preQueries.isBlank()) return List.of();
        return Arrays.stream(preQueries.split(";"))
                .map(String::strip)
                .filter(q -> !q.isEmpty())
                .toList();
    }

    private String writeAnalysis(FileAnalysisResult fa) {
        try {
            return objectMapper.writeValueAsString(fa);
        } catch (JsonProcessingException e) {
            log.warn("Não foi possível serializar a análise: {}", e.getMessage());
            return null;
        }
    }

    private FileAnalysisResult readAnalysis(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, FileAnalysisResult.class);
        } catch (JsonProcessingException e) {
            log.warn("Análise salva ilegível, seguindo sem ela: {}", e.getMessage());
            return null;
        }
    }

    private static long sizeOf(Path p) {
        try {
            return Files.size(p);
        } catch (IOException e) {
            return 0L;
        }
    }

    private static final class ImportRuntime {
        final AutoTuner tuner;
        final AtomicBoolean stopRequested = new AtomicBoolean(false);
        final ReentrantLock lock = new ReentrantLock();
        volatile BatcherStatistics lastBatcherStatistics;

        ImportRuntime(AutoTuner tuner) {
            this.tuner = tuner;
        }
    }
}
