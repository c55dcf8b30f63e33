package com.dnobretech.bigdumpbackend.service;

import com.dnobretech.bigdumpbackend.dto.DumpFileDTO;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Diretório de uploads: todo import é resolvido contra ele. */
public interface FileService {
    List<DumpFileDTO> listDumps() throws IOException;
    DumpFileDTO saveDump(MultipartFile file) throws IOException;
    Path resolve(String filename);
    void deleteDump(String filename) throws IOException;
}
