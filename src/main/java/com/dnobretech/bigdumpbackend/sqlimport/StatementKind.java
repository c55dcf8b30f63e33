package com.dnobretech.bigdumpbackend.sqlimport;

/** Classificação de um statement completo, usada pelo {@link InsertBatcher}. */
public enum StatementKind {
    /** INSERT de uma única tupla. */
    INSERT,
    /** INSERT IGNORE de uma única tupla. */
    INSERT_IGNORE,
    /** INSERT (ou INSERT IGNORE) com duas ou mais tuplas, já no formato "extended". */
    EXTENDED_INSERT,
    /** Qualquer outra coisa, incluindo INSERTs que não dá para classificar com segurança. */
    OTHER
}
