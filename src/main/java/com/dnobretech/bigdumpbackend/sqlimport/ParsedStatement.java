package com.dnobretech.bigdumpbackend.sqlimport;

/**
 * Statement completo (já sem o delimitador e com trim) e sua classificação.
 *
 * @param prefix {@code INSERT [IGNORE] INTO <tabela> [(colunas)] VALUES} quando é INSERT, senão null
 * @param tuples a(s) tupla(s) de valores quando é INSERT, senão null
 */
public record ParsedStatement(String text, StatementKind kind, boolean ignore, String prefix, String tuples) {

    public static ParsedStatement of(String text) {
        return StatementClassifier.classify(text);
    }

    public boolean isInsert() {
        return kind != StatementKind.OTHER;
    }

    public boolean isExtendedInsert() {
        return kind == StatementKind.EXTENDED_INSERT;
    }

    public boolean isSingleRowInsert() {
        return kind == StatementKind.INSERT || kind == StatementKind.INSERT_IGNORE;
    }
}
