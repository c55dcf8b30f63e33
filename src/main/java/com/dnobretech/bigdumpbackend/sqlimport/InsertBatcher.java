package com.dnobretech.bigdumpbackend.sqlimport;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Junta INSERTs de uma tupla com o mesmo prefixo em um único INSERT multi-row.
 * <p>
 * Todas as tuplas no buffer compartilham o prefixo ({@code INSERT [IGNORE] INTO t [(cols)] VALUES}).
 * Troca de prefixo, qualquer statement que não seja INSERT simples, ou estouro do limite de linhas/bytes
 * forçam o flush antes do próximo statement, então a ordem relativa dos statements nunca muda.
 * Nunca lança exceção: o que não é classificado com segurança passa direto.
 */
@Slf4j
public class InsertBatcher {

    public static final int ROW_SAMPLE_LIMIT = 100;
    private static final int TUPLE_SEPARATOR_BYTES = 2; // ", "

    private final int rowLimit;
    private final long byteLimit;

    private String currentPrefix;
    private final List<String> tuples = new ArrayList<>();
    private long bufferBytes;

    // amostra do tamanho das primeiras linhas, para o tamanho efetivo do batch
    private long sampleCount;
    private long sampleBytes;

    private long rowsBatched;
    private long statementsEmitted;
    private long bytesProcessed;
    private long extendedInsertCount;

    /**
     * @param rowLimit  máximo de tuplas por INSERT gerado; 0 ou negativo desliga o agrupamento
     * @param byteLimit máximo aproximado de bytes das tuplas de um INSERT gerado
     */
    public InsertBatcher(int rowLimit, long byteLimit) {
        this.rowLimit = rowLimit;
        this.byteLimit = byteLimit > 0 ? byteLimit : Long.MAX_VALUE;
    }

    public boolean isEnabled() {
        return rowLimit > 0;
    }

    public BatchResult process(String statement) {
        return process(StatementClassifier.classify(statement));
    }

    public BatchResult process(ParsedStatement statement) {
        if (statement == null || statement.text() == null || statement.text().isEmpty()) {
            return BatchResult.EMPTY;
        }
        if (statement.isExtendedInsert()) {
            extendedInsertCount++;
        }
        if (!isEnabled() || !statement.isSingleRowInsert()) {
            List<String> out = new ArrayList<>(2);
            flushInto(out);
            out.add(statement.text());
            return new BatchResult(out, false);
        }

        List<String> out = new ArrayList<>(1);
        String prefix = statement.prefix();
        String tuple = statement.tuples();
        long tupleBytes = SqlStatementParser.utf8Length(tuple);

        if (!tuples.isEmpty() && !prefix.equals(currentPrefix)) {
            flushInto(out);
        }
        if (!tuples.isEmpty() && bufferBytes + tupleBytes + TUPLE_SEPARATOR_BYTES > byteLimit) {
            flushInto(out);
        }

        if (sampleCount < ROW_SAMPLE_LIMIT) {
            sampleCount++;
            sampleBytes += tupleBytes;
        }
        currentPrefix = prefix;
        tuples.add(tuple);
        bufferBytes += tupleBytes + TUPLE_SEPARATOR_BYTES;
        rowsBatched++;
        bytesProcessed += tupleBytes;

        if (tuples.size() >= effectiveBatchSize() || bufferBytes >= byteLimit) {
            flushInto(out);
        }
        return new BatchResult(out, true);
    }

    /** Emite o buffer (se houver) como um único INSERT multi-row. */
    public BatchResult flush() {
        List<String> out = new ArrayList<>(1);
        flushInto(out);
        return new BatchResult(out, false);
    }

    public boolean hasPending() {
        return !tuples.isEmpty();
    }

    public int getBufferCount() {
        return tuples.size();
    }

    /**
     * min(rowLimit, byteLimit / (média + separador)), nunca menor que 1. Sem amostra, vale o rowLimit.
     */
    public int effectiveBatchSize() {
        if (!isEnabled()) return 0;
        long avg = averageRowSize();
        if (avg <= 0) return rowLimit;
        long byBytes = byteLimit / (avg + TUPLE_SEPARATOR_BYTES);
        return (int) Math.max(1, Math.min(rowLimit, byBytes));
    }

    public long averageRowSize() {
        return sampleCount == 0 ? 0 : sampleBytes / sampleCount;
    }

    public long getRowSampleCount() {
        return sampleCount;
    }

    public long getRowSampleBytes() {
        return sampleBytes;
    }

    /** Restaura a amostra salva na sessão, para o tamanho efetivo não depender de onde a invocação parou. */
    public void restoreRowSamples(long count, long bytes) {
        this.sampleCount = Math.max(0, Math.min(count, ROW_SAMPLE_LIMIT));
        this.sampleBytes = this.sampleCount == 0 ? 0 : Math.max(0, bytes);
    }

    public BatcherStatistics getStatistics() {
        double reduction = statementsEmitted == 0 ? 0.0 : (double) rowsBatched / statementsEmitted;
        double efficiency = rowsBatched == 0 ? 0.0 : Math.max(0.0, 1.0 - (double) statementsEmitted / rowsBatched);
        return new BatcherStatistics(rowsBatched, statementsEmitted, bytesProcessed, extendedInsertCount,
                reduction, efficiency, averageRowSize(), effectiveBatchSize(), tuples.size(), isEnabled());
    }

    public int getRowLimit() {
        return rowLimit;
    }

    public long getByteLimit() {
        return byteLimit;
    }

    private void flushInto(List<String> out) {
        if (tuples.isEmpty()) return;
        StringBuilder sb = new StringBuilder((int) Math.min(Integer.MAX_VALUE - 16L, bufferBytes + currentPrefix.length() + 2));
        sb.append(currentPrefix).append(' ');
        for (int i = 0; i < tuples.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(tuples.get(i));
        }
        sb.append(';');
        out.add(sb.toString());
        statementsEmitted++;
        if (log.isTraceEnabled()) {
            log.trace("Flush de batch: {} linhas, {} bytes, prefixo '{}'", tuples.size(), bufferBytes, currentPrefix);
        }
        tuples.clear();
        bufferBytes = 0;
        currentPrefix = null;
    }
}
