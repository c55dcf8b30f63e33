package com.dnobretech.bigdumpbackend.sqlimport;

import com.dnobretech.bigdumpbackend.domain.ImportSession;
import com.dnobretech.bigdumpbackend.exception.DumpImportException;

/**
 * @param failure a falha que parou a invocação (statement rejeitado, limite do parser, string sem
 *                fechar), ou null
 */
public record InvocationResult(ImportSession session, InvocationStatistics statistics,
                               BatcherStatistics batcherStatistics, DumpImportException failure) {

    public boolean finished() {
        return statistics.finished();
    }

    public boolean failed() {
        return failure != null;
    }
}
