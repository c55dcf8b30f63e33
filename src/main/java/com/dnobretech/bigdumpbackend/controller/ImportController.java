package com.dnobretech.bigdumpbackend.controller;

import com.dnobretech.bigdumpbackend.dto.DumpFileDTO;
import com.dnobretech.bigdumpbackend.dto.ImportProgressDTO;
import com.dnobretech.bigdumpbackend.dto.ImportStatusDTO;
import com.dnobretech.bigdumpbackend.service.FileService;
import com.dnobretech.bigdumpbackend.service.ImportService;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@Slf4j
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/imports")
public class ImportController {

    private final ImportService importService;
    private final FileService fileService;

    // Arquivos disponíveis no diretório de uploads
    @GetMapping("/files")
    public List<DumpFileDTO> files() throws IOException {
        return fileService.listDumps();
    }

    @PostMapping("/files")
    public ResponseEntity<?> upload(@RequestParam("file") MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("ok", false, "error", "Envie 'file' (multipart)."));
        }
        DumpFileDTO saved = fileService.saveDump(file);
        return ResponseEntity.status(HttpStatus.CREATED).body(saved);
    }

    @DeleteMapping("/files/{filename}")
    public ResponseEntity<?> deleteFile(@PathVariable String filename) throws IOException {
        importService.deleteDump(filename);
        return ResponseEntity.ok(Map.of("ok", true, "deleted", filename));
    }

    // Nova sessão (ou recomeço do zero) e primeira invocação
    @PostMapping
    public ImportProgressDTO start(@RequestParam @NotBlank String filename) {
        return importService.start(filename);
    }

    // Próxima invocação a partir da sessão persistida
    @PostMapping("/{filename}/continue")
    public ImportProgressDTO resume(@PathVariable String filename) {
        return importService.resume(filename);
    }

    @GetMapping("/{filename}")
    public ImportStatusDTO status(@PathVariable String filename) {
        return importService.status(filename);
    }

    @PostMapping("/{filename}/stop")
    public ImportStatusDTO stop(@PathVariable String filename) {
        return importService.stop(filename);
    }

    @DeleteMapping("/{filename}")
    public ResponseEntity<?> forget(@PathVariable String filename) {
        importService.forget(filename);
        return ResponseEntity.ok(Map.of("ok", true, "removed", filename));
    }

    // Recuperação guiada de "tabela já existe"
    @PostMapping("/{filename}/drop-and-retry")
    public ImportProgressDTO dropAndRetry(@PathVariable String filename) {
        return importService.dropAndRetry(filename);
    }

    @GetMapping("/{filename}/metrics")
    public Map<String, Object> metrics(@PathVariable String filename) {
        return importService.metrics(filename);
    }
}
