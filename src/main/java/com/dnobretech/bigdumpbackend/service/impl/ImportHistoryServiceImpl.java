package com.dnobretech.bigdumpbackend.service.impl;

import com.dnobretech.bigdumpbackend.domain.ImportHistoryEntry;
import com.dnobretech.bigdumpbackend.domain.ImportSession;
import com.dnobretech.bigdumpbackend.domain.ImportState;
import com.dnobretech.bigdumpbackend.dto.ImportHistoryDTO;
import com.dnobretech.bigdumpbackend.dto.ImportHistoryStatsDTO;
import com.dnobretech.bigdumpbackend.repository.ImportHistoryRepository;
import com.dnobretech.bigdumpbackend.service.ImportHistoryService;
import com.dnobretech.bigdumpbackend.util.ByteFormat;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ImportHistoryServiceImpl implements ImportHistoryService {

    private final ImportHistoryRepository repo;

    @Value("${bigdump.history.max-entries:50}")
    private int maxEntries;

    @Override
    @Transactional
    public void record(ImportSession session) {
        boolean success = session.getState() == ImportState.FINISHED;
        LocalDateTime now = LocalDateTime.now();
        long durationMillis = session.getCreatedAt() == null
                ? 0L
                : Math.max(0L, Duration.between(session.getCreatedAt(), now).toMillis());

        repo.save(ImportHistoryEntry.builder()
                .filename(session.getFilename())
                .queriesExecuted(session.getTotalStatementsExecuted())
                .linesProcessed(session.getCurrentLine())
                .bytesProcessed(session.getCurrentOffset())
                .success(success)
                .error(success ? null : session.getErrorMessage())
                .durationMillis(durationMillis)
                .finishedAt(now)
                .build());
        log.info("Histórico: '{}' {} ({} queries, {} linhas)", session.getFilename(),
                success ? "concluído" : "com erro", session.getTotalStatementsExecuted(), session.getCurrentLine());

        List<ImportHistoryEntry> all = repo.findAllByOrderByIdDesc();
        if (maxEntries > 0 && all.size() > maxEntries) {
            repo.deleteAll(all.subList(maxEntries, all.size()));
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ImportHistoryDTO> list(Integer limit) {
        List<ImportHistoryEntry> entries = (limit != null && limit > 0)
                ? repo.findAllByOrderByIdDesc(PageRequest.of(0, limit))
                : repo.findAllByOrderByIdDesc();
        return entries.stream().map(ImportHistoryServiceImpl::toDTO).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public ImportHistoryStatsDTO statistics() {
        List<ImportHistoryEntry> all = repo.findAllByOrderByIdDesc();
        if (all.isEmpty()) {
            return new ImportHistoryStatsDTO(0, 0, 0, 0, 0, ByteFormat.format(0), 0.0, null);
        }
        int ok = (int) all.stream().filter(ImportHistoryEntry::isSuccess).count();
        long queries = all.stream().mapToLong(ImportHistoryEntry::getQueriesExecuted).sum();
        long bytes = all.stream().mapToLong(ImportHistoryEntry::getBytesProcessed).sum();
        double avgSeconds = all.stream().mapToLong(ImportHistoryEntry::getDurationMillis).average().orElse(0) / 1000.0;
        return new ImportHistoryStatsDTO(all.size(), ok, all.size() - ok, queries, bytes, ByteFormat.format(bytes),
                Math.round(avgSeconds * 100) / 100.0, toDTO(all.get(0)));
    }

    @Override
    @Transactional
    public void delete(Long id) {
        if (!repo.existsById(id)) {
            throw new EntityNotFoundException("Entrada de histórico não encontrada: " + id);
        }
        repo.deleteById(id);
    }

    @Override
    @Transactional
    public void clear() {
        repo.deleteAllInBatch();
        log.info("Histórico de imports limpo");
    }

    private static ImportHistoryDTO toDTO(ImportHistoryEntry e) {
        return new ImportHistoryDTO(e.getId(), e.getFilename(), e.getFinishedAt(), e.getQueriesExecuted(),
                e.getLinesProcessed(), e.getBytesProcessed(), ByteFormat.format(e.getBytesProcessed()),
                e.isSuccess(), e.getError(), Math.round(e.getDurationMillis() / 10.0) / 100.0);
    }
}
