package com.dnobretech.bigdumpbackend.sqlimport;

/**
 * Resposta do banco para um statement.
 *
 * @param existingTable preenchido quando a falha é "tabela já existe"
 */
public record ExecutionResult(boolean success, long rowsAffected, String error, Integer errorCode,
                              String sqlState, String existingTable) {

    public static ExecutionResult ok(long rowsAffected) {
        return new ExecutionResult(true, rowsAffected, null, null, null, null);
    }

    public static ExecutionResult failure(String error) {
        return new ExecutionResult(false, 0, error, null, null, null);
    }

    public static ExecutionResult failure(String error, Integer errorCode, String sqlState, String existingTable) {
        return new ExecutionResult(false, 0, error, errorCode, sqlState, existingTable);
    }
}
