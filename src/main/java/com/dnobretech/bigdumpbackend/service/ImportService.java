package com.dnobretech.bigdumpbackend.service;

import com.dnobretech.bigdumpbackend.dto.ImportProgressDTO;
import com.dnobretech.bigdumpbackend.dto.ImportStatusDTO;
import com.dnobretech.bigdumpbackend.sqlimport.InvocationResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

public interface ImportService {

    // staggered (web): uma invocação por chamada, sessão persistida entre elas
    ImportProgressDTO start(String filename);
    ImportProgressDTO resume(String filename);

    ImportStatusDTO status(String filename);
    ImportStatusDTO stop(String filename);
    void forget(String filename);

    // remove o arquivo do diretório de uploads junto com a sessão; recusado com import em andamento
    void deleteDump(String filename) throws IOException;

    // "tabela já existe": DROP TABLE e retomada no statement que falhou
    ImportProgressDTO dropAndRetry(String filename);

    Map<String, Object> metrics(String filename);

    // CLI: invocações sem orçamento até o fim do arquivo, sem sessão persistida
    InvocationResult runToCompletion(Path file);
}
