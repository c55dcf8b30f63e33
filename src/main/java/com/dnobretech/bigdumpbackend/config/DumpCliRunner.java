package com.dnobretech.bigdumpbackend.config;

import com.dnobretech.bigdumpbackend.exception.DumpImportException;
import com.dnobretech.bigdumpbackend.service.ImportService;
import com.dnobretech.bigdumpbackend.sqlimport.InvocationResult;
import com.dnobretech.bigdumpbackend.sqlimport.PerformanceProfile;
import com.dnobretech.bigdumpbackend.sqlimport.SqlDumpOptimizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Modo CLI, ativado por {@code --bigdump.cli.input=...}.
 * Com {@code bigdump.cli.output} reescreve o dump em arquivo (INSERTs agrupados); sem ele importa no banco
 * configurado de uma vez, sem orçamento.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "bigdump.cli", name = "input")
public class DumpCliRunner implements ApplicationRunner {

    private final ImportService importService;

    @Value("${bigdump.cli.input}")
    private String input;
    @Value("${bigdump.cli.output:}")
    private String output;
    @Value("${bigdump.cli.force:false}")
    private boolean force;
    @Value("${bigdump.cli.profile:conservative}")
    private String profile;
    @Value("${bigdump.reader.buffer-size:131072}")
    private int bufferSize;

    @Override
    public void run(ApplicationArguments args) {
        Path in = Path.of(input);
        if (output != null && !output.isBlank()) {
            var report = SqlDumpOptimizer.forProfile(PerformanceProfile.fromName(profile), bufferSize)
                    .optimize(in, Path.of(output), force);
            log.info("CLI: {} statements lidos, {} gravados, {} bytes em {} ms",
                    report.statementsIn(), report.statementsOut(), report.bytesWritten(), report.elapsedMillis());
            return;
        }

        InvocationResult result = importService.runToCompletion(in);
        if (result.failed()) {
            throw result.failure();
        }
        if (!result.finished()) {
            throw new DumpImportException("CLI: import de '" + in.getFileName() + "' terminou em "
                    + result.session().getState() + " na linha " + result.session().getCurrentLine()
                    + " sem chegar ao fim do arquivo");
        }
        log.info("CLI: import de '{}' concluído, {} linhas e {} queries",
                in.getFileName(), result.statistics().linesDone(), result.statistics().queriesDone());
    }
}
