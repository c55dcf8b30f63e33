package com.dnobretech.bigdumpbackend.sqlimport;

/**
 * Capacidade de executar um statement. O orquestrador não conhece o banco: só pede "rode isto" e lê
 * sucesso, linhas afetadas e erro. Falhas voltam no {@link ExecutionResult}, não como exceção.
 */
public interface StatementExecutor {

    ExecutionResult execute(String statement);

    /** Confirma o que rodou desde o último commit. */
    default void commit() {
    }

    /** Desfaz o que rodou desde o último commit. */
    default void rollback() {
    }
}
