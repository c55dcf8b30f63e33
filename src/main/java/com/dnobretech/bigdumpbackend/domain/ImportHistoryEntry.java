package com.dnobretech.bigdumpbackend.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/** Um import encerrado (FINISHED ou ERROR). Mais recentes primeiro; só as últimas N ficam. */
@Entity
@Table(name = "import_history",
        indexes = {
                @Index(name = "ix_import_history_filename", columnList = "filename")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "error")
public class ImportHistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String filename;

    @Column(name = "queries_executed", nullable = false)
    private long queriesExecuted;

    @Column(name = "lines_processed", nullable = false)
    private long linesProcessed;

    @Column(name = "bytes_processed", nullable = false)
    private long bytesProcessed;

    @Column(nullable = false)
    private boolean success;

    @Column(columnDefinition = "text")
    private String error;

    @Column(name = "duration_ms", nullable = false)
    private long durationMillis;            // do início da sessão até o fim, pausas incluídas

    @Column(name = "finished_at", nullable = false)
    private LocalDateTime finishedAt;
}
