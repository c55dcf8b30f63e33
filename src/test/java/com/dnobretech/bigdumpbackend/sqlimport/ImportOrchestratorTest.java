package com.dnobretech.bigdumpbackend.sqlimport;

import com.dnobretech.bigdumpbackend.domain.ImportSession;
import com.dnobretech.bigdumpbackend.domain.ImportState;
import com.dnobretech.bigdumpbackend.exception.StatementExecutionException;
import com.dnobretech.bigdumpbackend.exception.StatementParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class ImportOrchestratorTest {

    @TempDir
    Path dir;

    /** Executor em memória: só o que foi commitado conta como executado. */
    static final class RecordingExecutor implements StatementExecutor {
        final List<String> committed = new ArrayList<>();
        final List<String> uncommitted = new ArrayList<>();
        Predicate<String> failOn = s -> false;
        String existingTable;
        int commits;
        int rollbacks;

        @Override
        public ExecutionResult execute(String statement) {
            if (failOn.test(statement)) {
                return ExecutionResult.failure("rejeitado pelo teste", 1050, "42S01", existingTable);
            }
            uncommitted.add(statement);
            return ExecutionResult.ok(1);
        }

        @Override
        public void commit() {
            committed.addAll(uncommitted);
            uncommitted.clear();
            commits++;
        }

        @Override
        public void rollback() {
            uncommitted.clear();
            rollbacks++;
        }
    }

    static String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append("-- MySQL dump\n");
        sb.append("/*!40101 SET NAMES utf8 */;\n");
        sb.append("DROP TABLE IF EXISTS `t`;\n");
        sb.append("CREATE TABLE `t` (\n  `id` int NOT NULL,\n  `txt` text\n);\n");
        for (int i = 1; i <= 40; i++) {
            if (i % 7 == 0) {
                sb.append("INSERT INTO `t` VALUES (").append(i).append(",'linha\nquebrada; com -- e # dentro');\n");
            } else {
                sb.append("INSERT INTO `t` VALUES (").append(i).append(",'valor ").append(i).append("');\n");
            }
        }
        sb.append("INSERT INTO `u` VALUES (1),(2),(3);\n");
        sb.append("\n# comentário\n");
        sb.append("DELIMITER //\n");
        sb.append("CREATE PROCEDURE p()\nBEGIN\n  SELECT 1;\nEND//\n");
        sb.append("DELIMITER ;\n");
        sb.append("INSERT INTO `t` VALUES (100,'fim');\n");
        return sb.toString();
    }

    private static ImportOrchestrator orchestrator(RecordingExecutor executor, InvocationBudget budget) {
        return ImportOrchestrator.builder()
                .parser(new SqlStatementParser())
                .batcher(new InsertBatcher(3, 0))
                .executor(executor)
                .budget(budget)
                .build();
    }

    private List<String> singleRun(Path file) {
        RecordingExecutor executor = new RecordingExecutor();
        InvocationResult r = orchestrator(executor, InvocationBudget.unlimited()).run(ImportSession.start("x"), file);
        assertTrue(r.finished());
        return executor.committed;
    }

    @ParameterizedTest(name = "{0} em blocos de {1} linhas")
    @CsvSource({"dump.sql, 1", "dump.sql, 4", "dump.sql, 13", "dump.sql.gz, 5", "dump.sql.bz2, 7"})
    @DisplayName("N invocações executam a mesma sequência que uma invocação só")
    void staggeredRunMatchesSingleRun(String name, int linesPerInvocation) throws IOException {
        Path file = DumpReaderTest.write(dir, name, dump());
        List<String> expected = singleRun(file);

        RecordingExecutor executor = new RecordingExecutor();
        ImportSession session = ImportSession.start(name);
        long lines = 0;
        int invocations = 0;
        while (session.getState() != ImportState.FINISHED) {
            assertTrue(++invocations < 500, "import não terminou");
            InvocationResult r = orchestrator(executor, InvocationBudget.lines(linesPerInvocation)).run(session, file);
            assertFalse(r.failed(), () -> String.valueOf(r.failure()));
            lines += r.statistics().linesThisInvocation();
        }

        assertEquals(expected, executor.committed);
        assertEquals(lines, session.getCurrentLine());
        assertEquals(expected.size(), session.getTotalStatementsExecuted());
        assertTrue(invocations > 1);
    }

    @Test
    void singleRunBatchesInsertsAndKeepsOrder() throws IOException {
        Path file = DumpReaderTest.write(dir, "dump.sql", dump());
        List<String> executed = singleRun(file);

        assertEquals("/*!40101 SET NAMES utf8 */", executed.get(0));
        assertEquals("DROP TABLE IF EXISTS `t`", executed.get(1));
        assertTrue(executed.get(2).startsWith("CREATE TABLE `t`"));
        assertEquals("INSERT INTO `t` VALUES (1,'valor 1'), (2,'valor 2'), (3,'valor 3');", executed.get(3));
        assertTrue(executed.contains("INSERT INTO `u` VALUES (1),(2),(3)"));
        assertTrue(executed.contains("CREATE PROCEDURE p()\nBEGIN\n  SELECT 1;\nEND"));
        assertEquals("INSERT INTO `t` VALUES (100,'fim');", executed.get(executed.size() - 1));
        assertTrue(executed.stream().anyMatch(s -> s.contains("'linha\nquebrada; com -- e # dentro'")));
    }

    @Test
    @DisplayName("falha para no statement e a retomada continua nele, sem repetir o que foi commitado")
    void errorKeepsResumablePosition() throws IOException {
        Path file = DumpReaderTest.write(dir, "dump.sql",
                "CREATE TABLE t (id INT);\nINSERT INTO t VALUES (1);\nINSERT INTO t VALUES (2);\nCREATE TABLE u (id INT);\nINSERT INTO u VALUES (1);\n");
        RecordingExecutor executor = new RecordingExecutor();
        executor.failOn = s -> s.startsWith("CREATE TABLE u");
        executor.existingTable = "u";
        ImportSession session = ImportSession.start("dump.sql");

        InvocationResult first = orchestrator(executor, InvocationBudget.unlimited()).run(session, file);

        assertEquals(ImportState.ERROR, session.getState());
        StatementExecutionException ex = assertInstanceOf(StatementExecutionException.class, first.failure());
        assertTrue(ex.isTargetAlreadyExists());
        assertEquals(4L, session.getErrorLine());
        assertEquals("CREATE TABLE u (id INT)", session.getErrorStatement());
        assertEquals("u", session.getErrorTable());
        assertTrue(session.getErrorMessage().contains("rejeitado pelo teste"));
        // último checkpoint: antes dos INSERTs que ainda estavam no buffer
        assertEquals(1, session.getCurrentLine());
        assertEquals(List.of("CREATE TABLE t (id INT)"), executor.committed);
        assertTrue(executor.rollbacks > 0);

        executor.failOn = s -> false;
        InvocationResult second = orchestrator(executor, InvocationBudget.unlimited()).run(session, file);

        assertTrue(second.finished());
        assertNull(session.getErrorMessage());
        assertEquals(List.of("CREATE TABLE t (id INT)", "INSERT INTO t VALUES (1), (2);",
                "CREATE TABLE u (id INT)", "INSERT INTO u VALUES (1);"), executor.committed);
        assertEquals(4, session.getTotalStatementsExecuted());
    }

    @Test
    void lastStatementWithoutDelimiterIsExecuted() throws IOException {
        Path file = DumpReaderTest.write(dir, "dump.sql", "SET a = 1;\nUPDATE t SET b = 2");
        RecordingExecutor executor = new RecordingExecutor();
        ImportSession session = ImportSession.start("dump.sql");
        orchestrator(executor, InvocationBudget.unlimited()).run(session, file);

        assertEquals(ImportState.FINISHED, session.getState());
        assertEquals(List.of("SET a = 1", "UPDATE t SET b = 2"), executor.committed);
        assertNull(session.getPendingStatement());
    }

    @Test
    void trailingGarbageIsDiscarded() throws IOException {
        Path file = DumpReaderTest.write(dir, "dump.sql", "SET a = 1;\n'abc', 2)\n");
        RecordingExecutor executor = new RecordingExecutor();
        ImportSession session = ImportSession.start("dump.sql");
        orchestrator(executor, InvocationBudget.unlimited()).run(session, file);

        assertEquals(ImportState.FINISHED, session.getState());
        assertEquals(List.of("SET a = 1"), executor.committed);
    }

    @Test
    void unclosedStringAtEofIsAnError() throws IOException {
        Path file = DumpReaderTest.write(dir, "dump.sql", "INSERT INTO t VALUES (1);\nINSERT INTO t VALUES ('abc\n");
        RecordingExecutor executor = new RecordingExecutor();
        ImportSession session = ImportSession.start("dump.sql");
        InvocationResult r = orchestrator(executor, InvocationBudget.unlimited()).run(session, file);

        assertEquals(ImportState.ERROR, session.getState());
        assertInstanceOf(StatementParseException.class, r.failure());
        assertTrue(session.getErrorMessage().contains("truncado"));
        // o que vinha antes foi aplicado
        assertEquals(List.of("INSERT INTO t VALUES (1);"), executor.committed);
    }

    @Test
    void parserLimitHaltsTheImport() throws IOException {
        Path file = DumpReaderTest.write(dir, "dump.sql", "SELECT\n1,\n2,\n3;\n");
        RecordingExecutor executor = new RecordingExecutor();
        ImportSession session = ImportSession.start("dump.sql");
        InvocationResult r = ImportOrchestrator.builder()
                .parser(new SqlStatementParser(1024, 2))
                .executor(executor)
                .build()
                .run(session, file);

        assertEquals(ImportState.ERROR, session.getState());
        StatementParseException ex = assertInstanceOf(StatementParseException.class, r.failure());
        assertEquals(3, ex.getLineNumber());
    }

    @Test
    void stopRequestCheckpointsAndStops() throws IOException {
        Path file = DumpReaderTest.write(dir, "dump.sql", dump());
        RecordingExecutor executor = new RecordingExecutor();
        AtomicInteger checks = new AtomicInteger();
        ImportSession session = ImportSession.start("dump.sql");

        InvocationResult r = ImportOrchestrator.builder()
                .batcher(new InsertBatcher(3, 0))
                .executor(executor)
                .stopRequested(() -> checks.incrementAndGet() > 12)
                .build()
                .run(session, file);

        assertEquals(ImportState.STOPPED, session.getState());
        assertFalse(r.finished());
        assertEquals(12, session.getCurrentLine());
        assertTrue(executor.uncommitted.isEmpty());
        assertEquals(session.getTotalStatementsExecuted(), executor.committed.size());
    }

    @Test
    void failingPreQueryHaltsBeforeTheDump() throws IOException {
        Path file = DumpReaderTest.write(dir, "dump.sql", "SET a = 1;\n");
        RecordingExecutor executor = new RecordingExecutor();
        executor.failOn = s -> s.startsWith("SET foreign_key_checks");
        ImportSession session = ImportSession.start("dump.sql");

        ImportOrchestrator.builder()
                .executor(executor)
                .preQueries(List.of("SET foreign_key_checks = 0"))
                .build()
                .run(session, file);

        assertEquals(ImportState.ERROR, session.getState());
        assertEquals("SET foreign_key_checks = 0", session.getErrorStatement());
        assertEquals(0, session.getCurrentLine());
        assertTrue(executor.committed.isEmpty());
    }

    @Test
    void timeBudgetPausesTheInvocation() throws IOException {
        Path file = DumpReaderTest.write(dir, "dump.sql", dump());
        RecordingExecutor executor = new RecordingExecutor();
        AtomicInteger ticks = new AtomicInteger();
        ImportSession session = ImportSession.start("dump.sql");

        ImportOrchestrator.builder()
                .batcher(new InsertBatcher(0, 0))
                .executor(executor)
                .budget(InvocationBudget.unlimited().toBuilder().maxTimeMillis(10).build())
                .clock(() -> ticks.getAndIncrement())
                .build()
                .run(session, file);

        assertEquals(ImportState.RUNNING, session.getState());
        assertTrue(session.getCurrentLine() > 0);
        assertTrue(session.getCurrentOffset() > 0);
    }

    @Test
    void tunerIsAdaptedAndMemoryRecorded() throws IOException {
        Path file = DumpReaderTest.write(dir, "dump.sql", dump());
        AutoTunerTest.FakeProbe probe = new AutoTunerTest.FakeProbe();
        AutoTuner tuner = new AutoTuner(AutoTunerSettings.defaults(), probe, System::currentTimeMillis);
        RecordingExecutor executor = new RecordingExecutor();
        ImportSession session = ImportSession.start("dump.sql");

        ImportOrchestrator.builder()
                .executor(executor)
                .tuner(tuner)
                .build()
                .run(session, file);

        assertEquals(ImportState.FINISHED, session.getState());
        assertEquals(tuner.getCurrentBatchSize(), session.getBatchSize());
        assertEquals(25, session.getMemoryPercentage());
        assertEquals(512L * 1024 * 1024, session.getMemoryUsage());
    }

    private static String updates(int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i <= n; i++) {
            sb.append("UPDATE t SET v = ").append(i).append(" WHERE id = ").append(i).append(";\n");
        }
        return sb.toString();
    }

    private static AutoTuner tunerUnderPressure() {
        AutoTunerTest.FakeProbe probe = new AutoTunerTest.FakeProbe();
        probe.heapUsage = (long) (probe.heapLimit * 0.95);
        return new AutoTuner(AutoTunerSettings.defaults(), probe, System::currentTimeMillis);
    }

    @Test
    void memoryPressurePausesBoundedInvocation() throws IOException {
        Path file = DumpReaderTest.write(dir, "dump.sql", updates(3000));
        RecordingExecutor executor = new RecordingExecutor();
        ImportSession session = ImportSession.start("dump.sql");

        InvocationResult r = ImportOrchestrator.builder()
                .executor(executor)
                .tuner(tunerUnderPressure())
                .budget(InvocationBudget.lines(100_000))
                .build()
                .run(session, file);

        assertEquals(ImportState.RUNNING, session.getState());
        assertFalse(r.finished());
        assertEquals(1000, session.getCurrentLine());
        assertEquals(1000, executor.committed.size());
    }

    @Test
    void memoryPressureDoesNotStopUnboundedInvocation() throws IOException {
        Path file = DumpReaderTest.write(dir, "dump.sql", updates(3000));
        RecordingExecutor executor = new RecordingExecutor();
        ImportSession session = ImportSession.start("dump.sql");

        InvocationResult r = ImportOrchestrator.builder()
                .executor(executor)
                .tuner(tunerUnderPressure())
                .budget(InvocationBudget.unlimited())
                .build()
                .run(session, file);

        assertTrue(r.finished());
        assertFalse(r.failed());
        assertEquals(ImportState.FINISHED, session.getState());
        assertEquals(3000, session.getCurrentLine());
        assertEquals(3000, executor.committed.size());
    }
}
