package com.dnobretech.bigdumpbackend.exception;

/**
 * Raiz das falhas do import de dumps. Todas são unchecked: quem decide o que fazer é o orquestrador
 * (grava o erro na sessão) ou o {@link ApiExceptionHandler} (traduz para HTTP).
 */
public class DumpImportException extends RuntimeException {

    public DumpImportException(String message) {
        super(message);
    }

    public DumpImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
