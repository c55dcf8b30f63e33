package com.dnobretech.bigdumpbackend.exception;

public class InvalidProfileException extends DumpImportException {

    public InvalidProfileException(String profile) {
        super("Perfil de performance desconhecido: '" + profile + "' (use conservative|aggressive)");
    }
}
