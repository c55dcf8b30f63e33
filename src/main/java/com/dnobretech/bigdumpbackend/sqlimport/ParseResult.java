package com.dnobretech.bigdumpbackend.sqlimport;

import java.util.List;

/**
 * Resultado de {@link SqlStatementParser#parseLine(String)}. Uma linha pode fechar mais de um
 * statement; {@code error} vem preenchido quando um limite de segurança foi estourado ou a diretiva
 * DELIMITER não tinha valor.
 */
public record ParseResult(List<ParsedStatement> statements, boolean delimiterChanged, String error) {

    static final ParseResult NOTHING = new ParseResult(List.of(), false, null);
    static final ParseResult DELIMITER_CHANGED = new ParseResult(List.of(), true, null);

    static ParseResult error(String message) {
        return new ParseResult(List.of(), false, message);
    }

    /** Primeiro statement completado nesta linha, ou null. */
    public ParsedStatement statement() {
        return statements.isEmpty() ? null : statements.get(0);
    }

    public boolean hasError() {
        return error != null;
    }
}
