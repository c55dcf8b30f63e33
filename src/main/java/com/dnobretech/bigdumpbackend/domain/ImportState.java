package com.dnobretech.bigdumpbackend.domain;

public enum ImportState {
    NOT_STARTED,
    RUNNING,
    FINISHED,
    ERROR,
    STOPPED;

    public boolean isTerminal() {
        return this == FINISHED || this == STOPPED;
    }
}
