package com.dnobretech.bigdumpbackend.service;

import com.dnobretech.bigdumpbackend.domain.ImportSession;
import com.dnobretech.bigdumpbackend.dto.ImportHistoryDTO;
import com.dnobretech.bigdumpbackend.dto.ImportHistoryStatsDTO;

import java.util.List;

public interface ImportHistoryService {

    // chamado quando a sessão termina em FINISHED ou ERROR
    void record(ImportSession session);

    List<ImportHistoryDTO> list(Integer limit);
    ImportHistoryStatsDTO statistics();
    void delete(Long id);
    void clear();
}
