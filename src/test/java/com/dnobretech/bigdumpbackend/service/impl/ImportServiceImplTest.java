package com.dnobretech.bigdumpbackend.service.impl;

import com.dnobretech.bigdumpbackend.domain.ImportHistoryEntry;
import com.dnobretech.bigdumpbackend.domain.ImportSession;
import com.dnobretech.bigdumpbackend.domain.ImportState;
import com.dnobretech.bigdumpbackend.dto.ImportProgressDTO;
import com.dnobretech.bigdumpbackend.dto.ImportStatusDTO;
import com.dnobretech.bigdumpbackend.exception.DumpFileNotFoundException;
import com.dnobretech.bigdumpbackend.repository.ImportHistoryRepository;
import com.dnobretech.bigdumpbackend.repository.ImportSessionRepository;
import com.dnobretech.bigdumpbackend.service.ImportService;
import com.dnobretech.bigdumpbackend.sqlimport.InvocationResult;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.TestPropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@TestPropertySource(properties = "bigdump.import.lines-per-invocation=4")
class ImportServiceImplTest {

    @Autowired
    private ImportService importService;

    @Autowired
    private ImportSessionRepository sessions;

    @Autowired
    private ImportHistoryRepository historyRepository;

    @Autowired
    private JdbcTemplate jdbc;

    @Value("${bigdump.upload-dir}")
    private String uploadDir;

    private String table;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(Paths.get(uploadDir));
        table = "t_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    private String dump(int rows) {
        StringBuilder sb = new StringBuilder("CREATE TABLE " + table + " (id INT PRIMARY KEY);\n");
        for (int i = 1; i <= rows; i++) {
            sb.append("INSERT INTO ").append(table).append(" VALUES (").append(i).append(");\n");
        }
        return sb.toString();
    }

    // um DELETE entre os INSERTs esvazia o buffer do batcher e abre pontos limpos de pausa
    private String interleavedDump(int rows) {
        StringBuilder sb = new StringBuilder("CREATE TABLE " + table + " (id INT PRIMARY KEY);\n");
        for (int i = 1; i <= rows; i++) {
            sb.append("INSERT INTO ").append(table).append(" VALUES (").append(i).append(");\n");
            sb.append("DELETE FROM ").append(table).append(" WHERE id < 0;\n");
        }
        return sb.toString();
    }

    private String upload(String content) throws IOException {
        String name = table + ".sql";
        Files.writeString(Paths.get(uploadDir).resolve(name), content);
        return name;
    }

    private List<ImportHistoryEntry> historyOf(String name) {
        return historyRepository.findAllByOrderByIdDesc().stream()
                .filter(e -> name.equals(e.getFilename()))
                .toList();
    }

    private int rows() {
        Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return n == null ? 0 : n;
    }

    @Test
    void staggeredInvocationsImportWholeDump() throws IOException {
        String name = upload(interleavedDump(11));

        ImportProgressDTO first = importService.start(name);
        assertEquals("RUNNING", first.status().state());
        assertTrue(first.invocation().linesThisInvocation() >= 4);

        ImportProgressDTO last = first;
        for (int i = 0; i < 20 && !"FINISHED".equals(last.status().state()); i++) {
            last = importService.resume(name);
        }

        ImportStatusDTO status = last.status();
        assertEquals("FINISHED", status.state());
        assertEquals(23, status.linesDone());
        assertEquals(100.0, status.percentDone());
        assertNotNull(status.linesTotalEstimate());
        assertEquals(11, rows());
        assertEquals("none", status.compressionType());
    }

    @Test
    void resumingFinishedSessionDoesNothing() throws IOException {
        String name = upload(dump(2));
        ImportProgressDTO p = importService.start(name);
        assertEquals("FINISHED", p.status().state());

        ImportProgressDTO again = importService.resume(name);
        assertEquals("FINISHED", again.status().state());
        assertNull(again.invocation());
        assertEquals(2, rows());
    }

    @Test
    void existingTableStopsWithDropAndRetryOffer() throws IOException {
        jdbc.execute("CREATE TABLE " + table + " (id INT PRIMARY KEY)");
        jdbc.execute("INSERT INTO " + table + " VALUES (99)");
        String name = upload(dump(3));

        ImportStatusDTO failed = importService.start(name).status();
        assertEquals("ERROR", failed.state());
        assertTrue(failed.canDropAndRetry());
        assertTrue(table.equalsIgnoreCase(failed.errorTable()));
        assertEquals(1L, failed.errorLine());
        assertEquals(0, failed.linesDone());

        ImportProgressDTO retried = importService.dropAndRetry(name);
        assertEquals("FINISHED", retried.status().state());
        assertFalse(retried.status().canDropAndRetry());
        assertNull(retried.status().errorTable());
        assertEquals(3, rows());
    }

    @Test
    void dropAndRetryRequiresTableExistsError() throws IOException {
        String name = upload(dump(1));
        importService.start(name);
        assertThrows(IllegalStateException.class, () -> importService.dropAndRetry(name));
    }

    @Test
    void dropAndRetryRejectsUnsafeTableName() throws IOException {
        String name = upload(dump(1));
        ImportSession s = ImportSession.start(name);
        s.setState(ImportState.ERROR);
        s.setErrorTable(table + "; DROP TABLE import_session");
        sessions.save(s);

        assertThrows(IllegalArgumentException.class, () -> importService.dropAndRetry(name));
    }

    @Test
    void dropAndRetryRefusesTableNotCreatedByDump() throws IOException {
        String name = upload("INSERT INTO outra VALUES (1);\n");
        ImportSession s = ImportSession.start(name);
        s.setState(ImportState.ERROR);
        s.setErrorTable("outra");
        sessions.save(s);

        assertThrows(IllegalStateException.class, () -> importService.dropAndRetry(name));
    }

    @Test
    void stopThenResumeContinuesFromCheckpoint() throws IOException {
        String name = upload(interleavedDump(11));
        assertEquals("RUNNING", importService.start(name).status().state());

        ImportStatusDTO stopped = importService.stop(name);
        assertEquals("STOPPED", stopped.state());
        assertEquals("STOPPED", importService.status(name).state());

        ImportProgressDTO resumed = importService.resume(name);
        assertTrue(resumed.invocation().linesThisInvocation() > 0);
        assertNotEquals("STOPPED", resumed.status().state());
    }

    @Test
    void forgetRemovesSession() throws IOException {
        String name = upload(dump(1));
        importService.start(name);

        importService.forget(name);

        assertThrows(EntityNotFoundException.class, () -> importService.status(name));
        assertFalse(sessions.existsById(name));
    }

    @Test
    void metricsExposeTunerAndBatcher() throws IOException {
        String name = upload(dump(3));
        importService.start(name);

        Map<String, Object> m = importService.metrics(name);
        assertEquals(name, m.get("filename"));
        assertNotNull(m.get("autoTuner"));
        assertNotNull(m.get("batcher"));
    }

    @Test
    void unknownFileOrSession() {
        assertThrows(DumpFileNotFoundException.class, () -> importService.start("nao-existe.sql"));
        assertThrows(EntityNotFoundException.class, () -> importService.resume("nao-existe.sql"));
    }

    @Test
    void runToCompletionImportsInOneGo(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("cli.sql");
        Files.writeString(file, dump(25));

        InvocationResult result = importService.runToCompletion(file);

        assertTrue(result.finished());
        assertFalse(result.failed());
        assertEquals(26, result.statistics().linesDone());
        assertEquals(25, rows());
        assertFalse(sessions.existsById("cli.sql"));
    }

    @Test
    void finishedAndFailedImportsAreRecordedInHistory() throws IOException {
        String name = upload(interleavedDump(11));
        ImportProgressDTO p = importService.start(name);
        assertTrue(historyOf(name).isEmpty());
        while (!"FINISHED".equals(p.status().state())) {
            p = importService.resume(name);
        }

        List<ImportHistoryEntry> done = historyOf(name);
        assertEquals(1, done.size());
        assertTrue(done.get(0).isSuccess());
        assertEquals(23, done.get(0).getLinesProcessed());
        assertNull(done.get(0).getError());

        jdbc.execute("DROP TABLE " + table);
        jdbc.execute("CREATE TABLE " + table + " (id INT PRIMARY KEY)");
        importService.start(name);

        List<ImportHistoryEntry> after = historyOf(name);
        assertEquals(2, after.size());
        assertFalse(after.get(0).isSuccess());
        assertNotNull(after.get(0).getError());
    }

    @Test
    void deleteDumpRefusedWhileSessionIsRunning() throws IOException {
        String name = upload(interleavedDump(11));
        assertEquals("RUNNING", importService.start(name).status().state());

        assertThrows(IllegalStateException.class, () -> importService.deleteDump(name));
        assertTrue(Files.exists(Paths.get(uploadDir).resolve(name)));

        importService.stop(name);
        importService.deleteDump(name);

        assertFalse(Files.exists(Paths.get(uploadDir).resolve(name)));
        assertFalse(sessions.existsById(name));
    }
}
