package com.dnobretech.bigdumpbackend.sqlimport;

import com.dnobretech.bigdumpbackend.exception.DumpImportException;
import com.dnobretech.bigdumpbackend.exception.StatementParseException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Modo CLI: uma passada só (sem orçamento, sem sessão) que lê o dump em qualquer codec, agrupa os INSERTs
 * e grava o SQL reescrito em um arquivo texto. Diretivas DELIMITER são preservadas na saída.
 */
@Slf4j
public class SqlDumpOptimizer {

    public record Report(long linesRead, long statementsIn, long statementsOut, long bytesWritten,
                         long elapsedMillis, BatcherStatistics batcher) {
    }

    private final DumpReader reader;
    private final SqlStatementParser parser;
    private final InsertBatcher batcher;

    public SqlDumpOptimizer(DumpReader reader, SqlStatementParser parser, InsertBatcher batcher) {
        this.reader = reader;
        this.parser = parser;
        this.batcher = batcher;
    }

    /** Batcher com os limites do perfil (conservative 2000 linhas/16 MB, aggressive 5000/32 MB). */
    public static SqlDumpOptimizer forProfile(PerformanceProfile profile, int bufferSize) {
        InsertBatcher batcher = profile == PerformanceProfile.AGGRESSIVE
                ? new InsertBatcher(5_000, 32L * 1024 * 1024)
                : new InsertBatcher(2_000, 16L * 1024 * 1024);
        return new SqlDumpOptimizer(new DumpReader(bufferSize, CodecCapabilities.probe()),
                new SqlStatementParser(), batcher);
    }

    public Report optimize(Path input, Path output, boolean force) {
        if (Files.exists(output) && !force) {
            throw new DumpImportException("Arquivo de saída já existe: " + output + " (use force para sobrescrever)");
        }
        long started = System.currentTimeMillis();
        boolean ok = false;
        try (BufferedWriter out = Files.newBufferedWriter(output, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            Counter c = new Counter();
            reader.open(input);
            String line;
            while ((line = reader.readLine()) != null) {
                c.lines++;
                String delimiterBefore = parser.getDelimiter();
                ParseResult r = parser.parseLine(line);
                for (ParsedStatement s : r.statements()) {
                    c.in++;
                    write(out, batcher.process(s).statements(), delimiterBefore, c);
                }
                if (r.delimiterChanged()) {
                    write(out, batcher.flush().statements(), delimiterBefore, c);
                    writeRaw(out, "DELIMITER " + parser.getDelimiter() + "\n", c);
                }
                if (r.hasError()) {
                    throw new StatementParseException(r.error(), c.lines);
                }
            }
            if (parser.isInString()) {
                throw new StatementParseException("string sem fechar no fim do arquivo; o dump pode estar truncado", c.lines);
            }
            String pending = parser.getPendingStatement();
            if (pending != null) {
                c.in++;
                write(out, batcher.process(pending.strip()).statements(), parser.getDelimiter(), c);
            }
            write(out, batcher.flush().statements(), parser.getDelimiter(), c);
            ok = true;

            Report report = new Report(c.lines, c.in, c.out, c.bytes, System.currentTimeMillis() - started,
                    batcher.getStatistics());
            log.info("Otimização concluída: {} -> {} ({} linhas, {} statements -> {}, {} ms)",
                    input.getFileName(), output.getFileName(), c.lines, c.in, c.out, report.elapsedMillis());
            return report;
        } catch (IOException e) {
            throw new UncheckedIOException("Falha gravando " + output, e);
        } finally {
            reader.close();
            if (!ok) deletePartial(output);
        }
    }

    private static void write(BufferedWriter out, List<String> statements, String delimiter, Counter c)
            throws IOException {
        for (String sql : statements) {
            boolean terminated = ";".equals(delimiter) && sql.endsWith(";");
            writeRaw(out, terminated ? sql + "\n" : sql + delimiter + "\n", c);
            c.out++;
        }
    }

    private static void writeRaw(BufferedWriter out, String text, Counter c) throws IOException {
        out.write(text);
        c.bytes += SqlStatementParser.utf8Length(text);
    }

    private static void deletePartial(Path output) {
        try {
            if (Files.deleteIfExists(output)) {
                log.warn("Saída parcial removida: {}", output);
            }
        } catch (IOException e) {
            log.warn("Não foi possível remover a saída parcial {}: {}", output, e.getMessage());
        }
    }

    private static final class Counter {
        long lines;
        long in;
        long out;
        long bytes;
    }
}
