package com.dnobretech.bigdumpbackend.repository;

import com.dnobretech.bigdumpbackend.domain.ImportHistoryEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ImportHistoryRepository extends JpaRepository<ImportHistoryEntry, Long> {
    List<ImportHistoryEntry> findAllByOrderByIdDesc();
    List<ImportHistoryEntry> findAllByOrderByIdDesc(Pageable pageable);
}
