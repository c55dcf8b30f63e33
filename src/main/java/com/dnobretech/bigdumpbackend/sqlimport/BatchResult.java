package com.dnobretech.bigdumpbackend.sqlimport;

import java.util.List;

/**
 * Statements prontos para executar, na ordem em que devem ir para o banco. {@code batched} indica que o
 * statement recebido foi absorvido pelo buffer de INSERTs (e pode ainda não estar em {@code statements}).
 */
public record BatchResult(List<String> statements, boolean batched) {

    static final BatchResult EMPTY = new BatchResult(List.of(), false);

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
