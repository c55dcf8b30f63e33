package com.dnobretech.bigdumpbackend.exception;

/**
 * O descompressor não consegue produzir dados utilizáveis (gzip/bzip2 inválido ou truncado).
 */
public class CorruptStreamException extends DumpReadException {

    public CorruptStreamException(String filename, long offset, String message, Throwable cause) {
        super(filename, offset, message, cause);
    }
}
