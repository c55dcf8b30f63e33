package com.dnobretech.bigdumpbackend.repository;

import com.dnobretech.bigdumpbackend.domain.ImportSession;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ImportSessionRepository extends JpaRepository<ImportSession, String> {
    // filename = ID
}
