package com.dnobretech.bigdumpbackend.service.impl;

import com.dnobretech.bigdumpbackend.domain.ImportSession;
import com.dnobretech.bigdumpbackend.domain.ImportState;
import com.dnobretech.bigdumpbackend.dto.ImportHistoryDTO;
import com.dnobretech.bigdumpbackend.dto.ImportHistoryStatsDTO;
import com.dnobretech.bigdumpbackend.repository.ImportHistoryRepository;
import com.dnobretech.bigdumpbackend.service.ImportHistoryService;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(ImportHistoryServiceImpl.class)
@TestPropertySource(properties = "bigdump.history.max-entries=3")
class ImportHistoryServiceImplTest {

    @Autowired
    private ImportHistoryService history;

    @Autowired
    private ImportHistoryRepository repository;

    private static ImportSession session(String name, ImportState state, long queries, long bytes) {
        ImportSession s = ImportSession.start(name);
        s.setCreatedAt(LocalDateTime.now().minusSeconds(4));
        s.setState(state);
        s.setTotalStatementsExecuted(queries);
        s.setCurrentLine(queries * 2);
        s.setCurrentOffset(bytes);
        if (state == ImportState.ERROR) s.setErrorMessage("Table 'users' already exists");
        return s;
    }

    @Test
    void keepsOnlyTheMostRecentEntries() {
        for (int i = 1; i <= 5; i++) {
            history.record(session("d" + i + ".sql", ImportState.FINISHED, i, 1024));
        }

        List<ImportHistoryDTO> all = history.list(null);
        assertEquals(List.of("d5.sql", "d4.sql", "d3.sql"), all.stream().map(ImportHistoryDTO::filename).toList());
        assertEquals(3, repository.count());
        assertEquals(List.of("d5.sql"), history.list(1).stream().map(ImportHistoryDTO::filename).toList());
    }

    @Test
    void recordsFailureWithErrorMessage() {
        history.record(session("a.sql", ImportState.ERROR, 7, 2048));

        ImportHistoryDTO e = history.list(null).get(0);
        assertFalse(e.success());
        assertEquals("Table 'users' already exists", e.error());
        assertEquals(14, e.linesProcessed());
        assertEquals("2.00 KB", e.sizeFormatted());
        assertTrue(e.durationSeconds() >= 4.0);
    }

    @Test
    void statisticsSumAllEntries() {
        assertEquals(0, history.statistics().totalImports());
        assertNull(history.statistics().lastImport());

        history.record(session("a.sql", ImportState.FINISHED, 10, 1024));
        history.record(session("b.sql", ImportState.ERROR, 5, 1024));

        ImportHistoryStatsDTO stats = history.statistics();
        assertEquals(2, stats.totalImports());
        assertEquals(1, stats.successfulImports());
        assertEquals(1, stats.failedImports());
        assertEquals(15, stats.totalQueries());
        assertEquals(2048, stats.totalBytes());
        assertEquals("b.sql", stats.lastImport().filename());
    }

    @Test
    void deleteAndClear() {
        history.record(session("a.sql", ImportState.FINISHED, 1, 10));
        history.record(session("b.sql", ImportState.FINISHED, 1, 10));
        Long id = history.list(null).get(0).id();

        history.delete(id);
        assertEquals(1, repository.count());
        assertThrows(EntityNotFoundException.class, () -> history.delete(id));

        history.clear();
        assertEquals(0, repository.count());
    }
}
