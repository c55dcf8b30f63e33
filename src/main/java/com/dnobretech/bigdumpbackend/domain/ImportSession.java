package com.dnobretech.bigdumpbackend.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Estado retomável de um import. Só campos primitivos/strings: serve tanto para a tabela
 * {@code import_session} quanto para o loop em memória do modo CLI.
 * <p>
 * {@code currentLine}/{@code currentOffset} apontam para o último checkpoint (commit feito, buffer de
 * INSERTs vazio). O offset é a referência para retomar; a linha é só telemetria e mensagem de erro.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@ToString(exclude = {"pendingStatement", "errorStatement", "fileAnalysisJson"})
@Table(name = "import_session")
public class ImportSession {

    @Id
    @Column(name = "filename", nullable = false, length = 255)
    private String filename;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    @Builder.Default
    private ImportState state = ImportState.NOT_STARTED;

    @Column(name = "current_line", nullable = false)
    private long currentLine;               // linhas consumidas até o checkpoint

    @Column(name = "current_offset", nullable = false)
    private long currentOffset;             // bytes (descomprimidos) até o checkpoint

    @Column(name = "start_line", nullable = false)
    private long startLine;                 // onde a invocação atual começou

    @Column(name = "start_offset", nullable = false)
    private long startOffset;

    @Column(name = "total_statements", nullable = false)
    private long totalStatementsExecuted;

    @Column(name = "delimiter", nullable = false, length = 32)
    @Builder.Default
    private String delimiter = ";";

    @Column(name = "pending_statement", columnDefinition = "text")
    private String pendingStatement;

    @Column(name = "in_string", nullable = false)
    private boolean inString;

    @Column(name = "active_quote", length = 1)
    private String activeQuote;

    @Column(name = "file_analysis", columnDefinition = "text")
    private String fileAnalysisJson;        // FileAnalysisResult em JSON, calculado uma vez

    @Column(name = "profile", length = 20)
    private String profile;

    @Column(name = "compression_type", length = 10)
    private String compressionType;

    @Column(name = "file_size", nullable = false)
    private long fileSize;

    @Column(name = "batch_size", nullable = false)
    private int batchSize;

    @Column(name = "row_sample_count", nullable = false)
    private long rowSampleCount;

    @Column(name = "row_sample_bytes", nullable = false)
    private long rowSampleBytes;

    // ---- erro da última invocação ----
    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "error_statement", columnDefinition = "text")
    private String errorStatement;

    @Column(name = "error_line")
    private Long errorLine;

    @Column(name = "error_table", length = 255)
    private String errorTable;              // "tabela já existe": alvo do drop-and-retry

    // ---- estatísticas ----
    @Column(name = "memory_usage", nullable = false)
    private long memoryUsage;

    @Column(name = "memory_percentage", nullable = false)
    private int memoryPercentage;

    @Column(name = "speed_lps", nullable = false)
    private double speedLps;

    @Column(name = "frozen_lines_total")
    private Long frozenLinesTotal;          // estimativa congelada ao passar de 5%

    @Column(name = "frozen_queries_total")
    private Long frozenQueriesTotal;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static ImportSession start(String filename) {
        return ImportSession.builder()
                .filename(filename)
                .state(ImportState.NOT_STARTED)
                .delimiter(";")
                .createdAt(LocalDateTime.now())
                .updatedAt(LocalDateTime.now())
                .build();
    }

    public Character activeQuoteChar() {
        return (activeQuote == null || activeQuote.isEmpty()) ? null : activeQuote.charAt(0);
    }

    public boolean hasError() {
        return state == ImportState.ERROR;
    }

    public void clearError() {
        errorMessage = null;
        errorStatement = null;
        errorLine = null;
        errorTable = null;
    }
}
