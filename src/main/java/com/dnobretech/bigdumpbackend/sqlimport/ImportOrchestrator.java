package com.dnobretech.bigdumpbackend.sqlimport;

import com.dnobretech.bigdumpbackend.domain.ImportSession;
import com.dnobretech.bigdumpbackend.domain.ImportState;
import com.dnobretech.bigdumpbackend.exception.DumpImportException;
import com.dnobretech.bigdumpbackend.exception.StatementExecutionException;
import com.dnobretech.bigdumpbackend.exception.StatementParseException;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;

/**
 * Loop de uma invocação: lê linhas, monta statements, agrupa INSERTs e executa, até o fim do arquivo,
 * o fim do orçamento (linhas/tempo/memória), um pedido de parada ou uma falha.
 * <p>
 * Checkpoints só acontecem em ponto limpo: fim de linha, buffer de INSERTs vazio e commit feito. A sessão
 * só avança nesses pontos, então banco e sessão sempre concordam; uma falha faz rollback e a sessão fica no
 * último checkpoint, antes do statement que falhou.
 * <p>
 * Uma instância atende uma invocação; reader, parser e batcher não são compartilhados.
 */
@Slf4j
public class ImportOrchestrator {

    private final DumpReader reader;
    private final SqlStatementParser parser;
    private final InsertBatcher batcher;
    private final StatementExecutor executor;
    private final AutoTuner tuner;
    private final InvocationBudget budget;
    private final List<String> preQueries;
    private final BooleanSupplier stopRequested;
    private final LongSupplier clock;

    // estado da invocação
    private ImportSession session;
    private long lineNo;
    private long queries;
    private long sinceCommit;

    @Builder
    public ImportOrchestrator(DumpReader reader,
                              SqlStatementParser parser,
                              InsertBatcher batcher,
                              StatementExecutor executor,
                              AutoTuner tuner,
                              InvocationBudget budget,
                              List<String> preQueries,
                              BooleanSupplier stopRequested,
                              LongSupplier clock) {
        if (executor == null) throw new IllegalArgumentException("executor é obrigatório");
        this.reader = reader != null ? reader : new DumpReader();
        this.parser = parser != null ? parser : new SqlStatementParser();
        this.batcher = batcher != null ? batcher : new InsertBatcher(0, 0);
        this.executor = executor;
        this.tuner = tuner;
        this.budget = budget != null ? budget : InvocationBudget.unlimited();
        this.preQueries = preQueries != null ? preQueries : List.of();
        this.stopRequested = stopRequested != null ? stopRequested : () -> false;
        this.clock = clock != null ? clock : System::currentTimeMillis;
    }

    public InvocationResult run(ImportSession importSession, Path file) {
        this.session = importSession;
        long started = clock.getAsLong();
        long startLine = session.getCurrentLine();
        long startOffset = session.getCurrentOffset();
        long startQueries = session.getTotalStatementsExecuted();

        session.setStartLine(startLine);
        session.setStartOffset(startOffset);
        session.setState(ImportState.RUNNING);
        session.clearError();

        DumpImportException failure = null;
        try {
            failure = runLoop(file, started);
        } catch (DumpImportException e) {
            // leitura/codec: a sessão fica no último checkpoint
            log.error("Falha lendo '{}': {}", session.getFilename(), e.getMessage());
            failure = fail(e);
        } finally {
            reader.close();
        }

        if (tuner != null) {
            long lines = session.getCurrentLine() - startLine;
            long bytes = session.getCurrentOffset() - startOffset;
            tuner.adaptBatchSize(bytes, lines);
            MemoryPressure pressure = tuner.checkMemoryPressure();
            session.setBatchSize(tuner.getCurrentBatchSize());
            session.setMemoryUsage(pressure.usage());
            session.setMemoryPercentage(pressure.percentage());
        }
        long elapsed = Math.max(1, clock.getAsLong() - started);
        session.setSpeedLps((session.getCurrentLine() - startLine) * 1000.0 / elapsed);
        session.setUpdatedAt(LocalDateTime.now());

        InvocationStatistics stats = new InvocationStatistics(
                session.getCurrentLine() - startLine,
                session.getTotalStatementsExecuted() - startQueries,
                session.getCurrentOffset() - startOffset,
                session.getCurrentLine(),
                session.getTotalStatementsExecuted(),
                session.getState() == ImportState.FINISHED,
                session.getErrorMessage());
        log.info("Invocação encerrada: arquivo='{}' estado={} linhas={} queries={} bytes={} em {} ms",
                session.getFilename(), session.getState(), stats.linesThisInvocation(),
                stats.queriesThisInvocation(), stats.bytesThisInvocation(), elapsed);
        return new InvocationResult(session, stats, batcher.getStatistics(), failure);
    }

    private DumpImportException runLoop(Path file, long started) {
        reader.open(file);
        if (session.getCurrentOffset() > 0) {
            log.info("Retomando '{}' no offset {} (linha {})",
                    session.getFilename(), session.getCurrentOffset(), session.getCurrentLine());
            reader.seek(session.getCurrentOffset(), (done, target) ->
                    log.debug("Posicionando '{}': {}/{} bytes", session.getFilename(), done, target));
        }

        parser.restore(session.getDelimiter(), session.getPendingStatement(), session.isInString(),
                session.activeQuoteChar());
        String restored = parser.getPendingStatement();
        if (restored != null && !SqlStatementParser.looksLikeStatementStart(restored)) {
            log.warn("Statement pendente inválido descartado ao retomar '{}': {}",
                    session.getFilename(), StatementExecutionException.abbreviate(restored.strip()));
            parser.discardPending();
        }
        batcher.restoreRowSamples(session.getRowSampleCount(), session.getRowSampleBytes());

        lineNo = session.getCurrentLine();
        queries = session.getTotalStatementsExecuted();
        sinceCommit = 0;

        for (String pre : preQueries) {
            ExecutionResult r = executor.execute(pre);
            if (!r.success()) {
                return fail(new StatementExecutionException(pre, lineNo, r.error(), r.existingTable()));
            }
        }

        long linesThisRun = 0;
        long overrun = 0;
        boolean budgetExhausted = false;

        while (true) {
            if (stopRequested.getAsBoolean()) {
                log.info("Parada solicitada para '{}' na linha {}", session.getFilename(), lineNo);
                DumpImportException f = flushBatch();
                if (f != null) return f;
                checkpoint();
                session.setState(ImportState.STOPPED);
                return null;
            }

            if (!budgetExhausted && isBudgetExhausted(linesThisRun, started)) {
                budgetExhausted = true;
            }
            if (budgetExhausted) {
                if (!batcher.hasPending()) break;
                if (overrun >= budget.maxOverrunLines()) {
                    log.debug("Sem ponto limpo após {} linhas extras: forçando flush", overrun);
                    DumpImportException f = flushBatch();
                    if (f != null) return f;
                    break;
                }
                overrun++;
            }

            String line = reader.readLine();
            if (line == null) {
                return finishAtEof();
            }
            lineNo++;
            linesThisRun++;

            ParseResult parsed = parser.parseLine(line);
            for (ParsedStatement statement : parsed.statements()) {
                DumpImportException f = executeAll(batcher.process(statement).statements());
                if (f != null) return f;
            }
            if (parsed.hasError()) {
                return fail(new StatementParseException(parsed.error(), lineNo));
            }

            if (!batcher.hasPending() && sinceCommit >= commitFrequency()) {
                checkpoint();
            }
            if (budget.logEveryLines() > 0 && linesThisRun % budget.logEveryLines() == 0) {
                log.info("Progresso '{}': linha {} offset {} queries {}",
                        session.getFilename(), lineNo, reader.tell(), queries);
            }
        }

        checkpoint();
        log.info("Pausa em ponto limpo: '{}' linha {} offset {}", session.getFilename(), lineNo, reader.tell());
        return null;
    }

    private boolean isBudgetExhausted(long linesThisRun, long started) {
        if (budget.maxLines() > 0 && linesThisRun >= budget.maxLines()) return true;
        if (budget.maxTimeMillis() > 0 && clock.getAsLong() - started >= budget.maxTimeMillis()) return true;
        if (tuner != null && !budget.isUnbounded() && budget.memoryCheckEvery() > 0 && linesThisRun > 0
                && linesThisRun % budget.memoryCheckEvery() == 0) {
            MemoryPressure p = tuner.checkMemoryPressure();
            if (p.ratio() >= tuner.getEffectiveProfile().safetyMargin()) {
                log.warn("Memória em {}% na linha {}: pausando a invocação", p.percentage(), lineNo);
                return true;
            }
        }
        return false;
    }

    private DumpImportException finishAtEof() {
        if (parser.isInString()) {
            DumpImportException f = flushBatch();
            if (f != null) return f;
            checkpoint();
            return fail(new StatementParseException(
                    "string sem fechar no fim do arquivo (aspa " + parser.getActiveQuote()
                            + "); o dump pode estar truncado", lineNo));
        }

        String pending = parser.getPendingStatement();
        if (pending != null) {
            if (SqlStatementParser.looksLikeStatementStart(pending)) {
                log.info("Executando último statement sem delimitador de '{}'", session.getFilename());
                DumpImportException f = executeAll(batcher.process(StatementClassifier.classify(pending.strip())).statements());
                if (f != null) return f;
            } else {
                log.warn("Texto sem delimitador no fim de '{}' descartado: {}",
                        session.getFilename(), StatementExecutionException.abbreviate(pending.strip()));
            }
            parser.discardPending();
        }

        DumpImportException f = flushBatch();
        if (f != null) return f;
        checkpoint();
        session.setState(ImportState.FINISHED);
        log.info("Import concluído: '{}' ({} linhas, {} queries)", session.getFilename(), lineNo, queries);
        return null;
    }

    private DumpImportException flushBatch() {
        return executeAll(batcher.flush().statements());
    }

    private DumpImportException executeAll(List<String> statements) {
        for (String sql : statements) {
            ExecutionResult r = executor.execute(sql);
            if (!r.success()) {
                log.error("Falha na linha {} de '{}': {}", lineNo, session.getFilename(), r.error());
                return fail(new StatementExecutionException(sql, lineNo, r.error(), r.existingTable()));
            }
            queries++;
            sinceCommit++;
        }
        return null;
    }

    /** Commit e avanço da sessão. Só chamar com o buffer de INSERTs vazio. */
    private void checkpoint() {
        executor.commit();
        sinceCommit = 0;
        session.setCurrentLine(lineNo);
        session.setCurrentOffset(reader.tell());
        session.setTotalStatementsExecuted(queries);
        session.setDelimiter(parser.getDelimiter());
        session.setPendingStatement(parser.getPendingStatement());
        session.setInString(parser.isInString());
        Character quote = parser.getActiveQuote();
        session.setActiveQuote(quote == null ? null : String.valueOf(quote));
        session.setRowSampleCount(batcher.getRowSampleCount());
        session.setRowSampleBytes(batcher.getRowSampleBytes());
    }

    private DumpImportException fail(DumpImportException failure) {
        executor.rollback();
        session.setState(ImportState.ERROR);
        session.setErrorMessage(failure.getMessage());
        if (failure instanceof StatementExecutionException) {
            StatementExecutionException see = (StatementExecutionException) failure;
            session.setErrorStatement(see.getStatement());
            session.setErrorLine(see.getLineNumber());
            session.setErrorTable(see.getExistingTable());
        } else if (failure instanceof StatementParseException) {
            session.setErrorLine(((StatementParseException) failure).getLineNumber());
        }
        return failure;
    }

    private int commitFrequency() {
        if (budget.commitFrequency() > 0) return budget.commitFrequency();
        return tuner != null ? tuner.getEffectiveProfile().commitFrequency() : 1;
    }
}
