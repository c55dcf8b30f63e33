package com.dnobretech.bigdumpbackend.service;

import com.dnobretech.bigdumpbackend.sqlimport.FileAnalysisResult;

import java.nio.file.Path;

public interface FileAnalysisService {

    /** Estimativas a partir de uma amostra do início do dump. */
    FileAnalysisResult analyze(Path file);

    /** O dump tem um CREATE TABLE para {@code table} no trecho inicial? Usado pelo drop-and-retry. */
    boolean hasCreateTableFor(Path file, String table);
}
