package com.dnobretech.bigdumpbackend.exception;

public class DumpFileNotFoundException extends DumpImportException {

    private final String filename;

    public DumpFileNotFoundException(String filename) {
        super("Arquivo não encontrado: " + filename);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
