package com.dnobretech.bigdumpbackend.exception;

import lombok.Getter;

/** O parser não conseguiu montar um statement: limite estourado, DELIMITER vazio ou string sem fechar no fim. */
@Getter
public class StatementParseException extends DumpImportException {

    private final long lineNumber;

    public StatementParseException(String message, long lineNumber) {
        super("Erro de parsing na linha " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }
}
