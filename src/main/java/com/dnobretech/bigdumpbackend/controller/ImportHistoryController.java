package com.dnobretech.bigdumpbackend.controller;

import com.dnobretech.bigdumpbackend.dto.ImportHistoryDTO;
import com.dnobretech.bigdumpbackend.dto.ImportHistoryStatsDTO;
import com.dnobretech.bigdumpbackend.service.ImportHistoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

// Imports concluídos ou com erro, mais recentes primeiro
@RestController
@RequiredArgsConstructor
@RequestMapping("/imports/history")
public class ImportHistoryController {

    private final ImportHistoryService history;

    @GetMapping
    public List<ImportHistoryDTO> list(@RequestParam(required = false) Integer limit) {
        return history.list(limit);
    }

    @GetMapping("/stats")
    public ImportHistoryStatsDTO stats() {
        return history.statistics();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable Long id) {
        history.delete(id);
        return ResponseEntity.ok(Map.of("ok", true, "removed", id));
    }

    @DeleteMapping
    public ResponseEntity<?> clear() {
        history.clear();
        return ResponseEntity.ok(Map.of("ok", true));
    }
}
