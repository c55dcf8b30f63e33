package com.dnobretech.bigdumpbackend.controller;

import com.dnobretech.bigdumpbackend.dto.DumpFileDTO;
import com.dnobretech.bigdumpbackend.dto.ImportProgressDTO;
import com.dnobretech.bigdumpbackend.dto.ImportStatusDTO;
import com.dnobretech.bigdumpbackend.exception.CorruptStreamException;
import com.dnobretech.bigdumpbackend.exception.DumpFileNotFoundException;
import com.dnobretech.bigdumpbackend.service.FileService;
import com.dnobretech.bigdumpbackend.service.ImportService;
import com.dnobretech.bigdumpbackend.sqlimport.InvocationStatistics;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ImportController.class)
class ImportControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ImportService importService;

    @MockBean
    private FileService fileService;

    private static ImportStatusDTO statusDto(String state) {
        return new ImportStatusDTO("a.sql", state, 10, 250, 4, 1000, "none", 25.0, null, null,
                3000, 0, 0, 0.0, "conservative", null, null, null, null, false, null);
    }

    @Test
    void startReturnsProgress() throws Exception {
        when(importService.start("a.sql")).thenReturn(new ImportProgressDTO(statusDto("RUNNING"),
                new InvocationStatistics(10, 4, 250, 10, 4, false, null)));

        mvc.perform(post("/imports").param("filename", "a.sql"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status.state").value("RUNNING"))
                .andExpect(jsonPath("$.status.percentDone").value(25.0))
                .andExpect(jsonPath("$.invocation.linesThisInvocation").value(10));
    }

    @Test
    void blankFilenameIsRejected() throws Exception {
        mvc.perform(post("/imports").param("filename", " "))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(importService);
    }

    @Test
    void continueAndStatusUseFilenameWithExtension() throws Exception {
        when(importService.resume("dump.sql.gz")).thenReturn(new ImportProgressDTO(statusDto("FINISHED"), null));

        mvc.perform(post("/imports/dump.sql.gz/continue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status.state").value("FINISHED"));
        verify(importService).resume("dump.sql.gz");
    }

    @Test
    void forgetConfirmsRemoval() throws Exception {
        mvc.perform(delete("/imports/a.sql"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.removed").value("a.sql"));
        verify(importService).forget("a.sql");
    }

    @Test
    void deleteFileGoesThroughImportService() throws Exception {
        mvc.perform(delete("/imports/files/a.sql"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value("a.sql"));
        verify(importService).deleteDump("a.sql");
        verify(importService, never()).forget(any());

        doThrow(new IllegalStateException("Import de 'b.sql' em andamento")).when(importService).deleteDump("b.sql");
        mvc.perform(delete("/imports/files/b.sql")).andExpect(status().isConflict());
    }

    @Test
    void uploadReturnsCreated() throws Exception {
        when(fileService.saveDump(any())).thenReturn(
                new DumpFileDTO("a.sql", 9, "9 B", "none", true, Instant.parse("2026-01-01T00:00:00Z")));

        mvc.perform(multipart("/imports/files").file(new MockMultipartFile("file", "a.sql", null, "SELECT 1;".getBytes())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.filename").value("a.sql"));
    }

    @Test
    void listsFiles() throws Exception {
        when(fileService.listDumps()).thenReturn(List.of(
                new DumpFileDTO("b.sql.bz2", 2048, "2.00 KB", "bzip2", false, Instant.parse("2026-01-01T00:00:00Z"))));

        mvc.perform(get("/imports/files"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].codecAvailable").value(false));
    }

    @Test
    void errorsMapToStatusCodes() throws Exception {
        when(importService.status("sumiu.sql")).thenThrow(new EntityNotFoundException("Sessão de import não encontrada"));
        when(importService.start("x.sql")).thenThrow(new DumpFileNotFoundException("x.sql"));
        when(importService.resume("a.sql")).thenThrow(new IllegalStateException("Import de 'a.sql' já está em andamento"));
        when(importService.dropAndRetry("a.sql")).thenThrow(new IllegalArgumentException("Nome de tabela inválido"));
        when(importService.resume("b.sql.gz")).thenThrow(new CorruptStreamException("b.sql.gz", 100, "gzip corrompido", null));

        mvc.perform(get("/imports/sumiu.sql")).andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
        mvc.perform(post("/imports").param("filename", "x.sql")).andExpect(status().isNotFound());
        mvc.perform(post("/imports/a.sql/continue")).andExpect(status().isConflict());
        mvc.perform(post("/imports/a.sql/drop-and-retry")).andExpect(status().isBadRequest());
        mvc.perform(post("/imports/b.sql.gz/continue")).andExpect(status().isUnprocessableEntity());
    }
}
