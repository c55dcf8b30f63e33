package com.dnobretech.bigdumpbackend.service.impl;

import com.dnobretech.bigdumpbackend.dto.DumpFileDTO;
import com.dnobretech.bigdumpbackend.exception.DumpFileNotFoundException;
import com.dnobretech.bigdumpbackend.service.FileService;
import com.dnobretech.bigdumpbackend.sqlimport.CodecCapabilities;
import com.dnobretech.bigdumpbackend.sqlimport.CompressionType;
import com.dnobretech.bigdumpbackend.util.ByteFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class FileServiceImpl implements FileService {

    private static final List<String> ALLOWED_EXTENSIONS = List.of(".sql", ".gz", ".bz2");

    private final CodecCapabilities codecs;

    @Value("${bigdump.upload-dir:./uploads}")
    private String uploadDir;

    @Override
    public List<DumpFileDTO> listDumps() throws IOException {
        Path dir = uploadRoot();
        if (!Files.isDirectory(dir)) return List.of();
        List<DumpFileDTO> out = new ArrayList<>();
        try (Stream<Path> s = Files.list(dir)) {
            for (Path p : s.filter(Files::isRegularFile)
                    .filter(p -> hasAllowedExtension(p.getFileName().toString()))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList()) {
                out.add(describe(p));
            }
        }
        return out;
    }

    @Override
    public DumpFileDTO saveDump(MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Envie 'file' (multipart) com o dump");
        }
        String name = sanitize(file.getOriginalFilename());
        if (!hasAllowedExtension(name)) {
            throw new IllegalArgumentException("Extensão não suportada: '" + name + "' (use .sql, .gz ou .bz2)");
        }
        Path dir = uploadRoot();
        Files.createDirectories(dir);
        Path dest = dir.resolve(name);
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, dest); // sem REPLACE_EXISTING: não sobrescreve upload existente
        } catch (FileAlreadyExistsException e) {
            throw new IllegalStateException("Já existe um dump com o nome '" + name + "'");
        }
        log.info("Upload salvo: '{}' ({})", name, ByteFormat.format(Files.size(dest)));
        return describe(dest);
    }

    @Override
    public Path resolve(String filename) {
        String name = sanitize(filename);
        Path p = uploadRoot().resolve(name).normalize();
        if (!p.startsWith(uploadRoot()) || !Files.isRegularFile(p)) {
            throw new DumpFileNotFoundException(name);
        }
        return p;
    }

    @Override
    public void deleteDump(String filename) throws IOException {
        String name = sanitize(filename);
        if (!hasAllowedExtension(name)) {
            throw new IllegalArgumentException("Não é possível remover este tipo de arquivo: '" + name + "'");
        }
        Path p = resolve(name);
        Files.delete(p);
        log.info("Dump removido: '{}'", name);
    }

    /**
     * Só o basename, sem "..", e apenas letras, dígitos, '-', '_' e '.'. O resto vira '_'.
     */
    public static String sanitize(String original) {
        if (original == null || original.isBlank()) {
            throw new IllegalArgumentException("Nome de arquivo vazio");
        }
        String base = original.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        base = base.replaceAll("[^A-Za-z0-9._-]", "_");
        while (base.contains("..")) {
            base = base.replace("..", ".");
        }
        base = base.replaceAll("^\\.+", "");
        if (base.isEmpty()) {
            throw new IllegalArgumentException("Nome de arquivo inválido: '" + original + "'");
        }
        return base;
    }

    private static boolean hasAllowedExtension(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return ALLOWED_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    private DumpFileDTO describe(Path p) throws IOException {
        long size = Files.size(p);
        CompressionType type = CompressionType.fromFilename(p.getFileName().toString());
        return new DumpFileDTO(p.getFileName().toString(), size, ByteFormat.format(size), type.label(),
                codecs.supports(type), Files.getLastModifiedTime(p).toInstant());
    }

    private Path uploadRoot() {
        return Paths.get(uploadDir).toAbsolutePath().normalize();
    }
}
