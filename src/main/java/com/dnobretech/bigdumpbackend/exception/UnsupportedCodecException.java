package com.dnobretech.bigdumpbackend.exception;

import com.dnobretech.bigdumpbackend.sqlimport.CompressionType;

public class UnsupportedCodecException extends DumpImportException {

    private final CompressionType compressionType;

    public UnsupportedCodecException(CompressionType compressionType, String message) {
        super(message);
        this.compressionType = compressionType;
    }

    public CompressionType getCompressionType() {
        return compressionType;
    }
}
