package com.dnobretech.bigdumpbackend.exception;

/**
 * Falha de I/O ao ler o dump, já com o arquivo e o offset (bytes descomprimidos) no contexto.
 */
public class DumpReadException extends DumpImportException {

    private final String filename;
    private final long offset;

    public DumpReadException(String filename, long offset, String message, Throwable cause) {
        super(message + " [arquivo=" + filename + ", offset=" + offset + "]", cause);
        this.filename = filename;
        this.offset = offset;
    }

    public String getFilename() {
        return filename;
    }

    public long getOffset() {
        return offset;
    }
}
