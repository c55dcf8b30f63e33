package com.dnobretech.bigdumpbackend.exception;

import lombok.Getter;

/**
 * O banco rejeitou um statement. Carrega o texto, a linha (1-based) do dump onde o statement terminou
 * e a mensagem do banco. {@code existingTable} vem preenchido quando a falha é "tabela já existe".
 */
@Getter
public class StatementExecutionException extends DumpImportException {

    private static final int MAX_DISPLAY = 500;

    private final String statement;
    private final long lineNumber;
    private final String databaseMessage;
    private final String existingTable;

    public StatementExecutionException(String statement, long lineNumber, String databaseMessage, String existingTable) {
        super("Erro SQL na linha " + lineNumber + ":\nQuery: " + abbreviate(statement) + "\nErro do banco: " + databaseMessage);
        this.statement = statement;
        this.lineNumber = lineNumber;
        this.databaseMessage = databaseMessage;
        this.existingTable = existingTable;
    }

    public boolean isTargetAlreadyExists() {
        return existingTable != null;
    }

    public static String abbreviate(String statement) {
        if (statement == null) return "";
        return statement.length() > MAX_DISPLAY ? statement.substring(0, MAX_DISPLAY) + "..." : statement;
    }
}
