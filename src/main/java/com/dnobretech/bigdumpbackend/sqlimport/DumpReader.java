package com.dnobretech.bigdumpbackend.sqlimport;

import com.dnobretech.bigdumpbackend.exception.CorruptStreamException;
import com.dnobretech.bigdumpbackend.exception.DumpFileNotFoundException;
import com.dnobretech.bigdumpbackend.exception.DumpReadException;
import com.dnobretech.bigdumpbackend.exception.UnsupportedCodecException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.zip.GZIPInputStream;

/**
 * Leitor de linhas sobre dump puro, gzip ou bzip2, com posição em bytes do stream descomprimido.
 * <p>
 * Cada linha volta com o terminador. O BOM UTF-8 só é removido da linha que começa no offset 0.
 * {@link #seek(long, SeekProgressListener)} posiciona exatamente no offset pedido: texto puro usa o
 * canal, gzip avança descomprimindo, bzip2 reabre e relê desde o início ({@link #replaySeek}).
 * <p>
 * Não é thread-safe.
 */
@Slf4j
public class DumpReader implements Closeable {

    public static final int MIN_BUFFER_SIZE = 64 * 1024;
    public static final int MAX_BUFFER_SIZE = 256 * 1024;
    public static final int DEFAULT_BUFFER_SIZE = 128 * 1024;

    private static final long REPLAY_PROGRESS_INTERVAL = 8L * 1024 * 1024;

    private final int bufferSize;
    private final CodecCapabilities capabilities;

    private Path path;
    private CompressionType compressionType = CompressionType.NONE;
    private SeekableByteChannel channel;   // só para texto puro
    private InputStream in;

    private final byte[] buffer;
    private int bufPos;
    private int bufLen;

    private byte[] line = new byte[1024];
    private int lineLen;

    private long position;
    private boolean eof;

    public DumpReader() {
        this(DEFAULT_BUFFER_SIZE, CodecCapabilities.probe());
    }

    public DumpReader(int bufferSize, CodecCapabilities capabilities) {
        this.bufferSize = clampBufferSize(bufferSize);
        this.capabilities = capabilities;
        this.buffer = new byte[this.bufferSize];
    }

    public static int clampBufferSize(int requested) {
        return Math.max(MIN_BUFFER_SIZE, Math.min(MAX_BUFFER_SIZE, requested));
    }

    public void open(Path file) {
        close();
        if (file == null || !Files.isRegularFile(file)) {
            throw new DumpFileNotFoundException(String.valueOf(file));
        }
        CompressionType type = CompressionType.fromFilename(file.getFileName().toString());
        if (!capabilities.supports(type)) {
            throw new UnsupportedCodecException(type,
                    "Suporte a bzip2 indisponível: adicione o Apache Commons Compress ao classpath ("
                            + file.getFileName() + ")");
        }
        this.path = file;
        this.compressionType = type;
        openAtStart();
        log.debug("Dump aberto: path='{}' codec={} buffer={}", file, type.label(), bufferSize);
    }

    /**
     * @return a próxima linha com o terminador, ou {@code null} no fim do stream
     */
    public String readLine() {
        ensureOpen();
        if (eof) return null;

        long lineStart = position;
        lineLen = 0;
        try {
            while (true) {
                if (bufPos >= bufLen && !fill()) break;
                int i = bufPos;
                while (i < bufLen && buffer[i] != '\n') i++;
                boolean found = i < bufLen;
                int end = found ? i + 1 : bufLen;
                append(buffer, bufPos, end - bufPos);
                position += end - bufPos;
                bufPos = end;
                if (found) break;
            }
        } catch (IOException e) {
            throw wrap("Falha ao ler linha", e);
        }

        if (lineLen == 0) {
            eof = true;
            return null;
        }
        int start = (lineStart == 0 && hasUtf8Bom()) ? 3 : 0;
        return new String(line, start, lineLen - start, StandardCharsets.UTF_8);
    }

    public long tell() {
        return position;
    }

    public boolean eof() {
        return eof;
    }

    public void seek(long targetOffset) {
        seek(targetOffset, SeekProgressListener.NONE);
    }

    /**
     * Posiciona o leitor em {@code targetOffset} (bytes descomprimidos). Para bzip2 isto é um
     * {@link #replaySeek}, O(offset).
     */
    public void seek(long targetOffset, SeekProgressListener onProgress) {
        ensureOpen();
        if (targetOffset < 0) throw new IllegalArgumentException("offset negativo: " + targetOffset);

        switch (compressionType) {
            case NONE -> seekChannel(targetOffset);
            case GZIP -> {
                if (targetOffset < position) reopen();
                skipForward(targetOffset, SeekProgressListener.NONE);
            }
            case BZIP2 -> replaySeek(targetOffset, onProgress);
        }
        eof = false;
    }

    /**
     * Simula acesso aleatório num stream sem seek: reabre o arquivo e descarta bytes até o offset,
     * avisando {@code onProgress} a cada 8 MiB.
     */
    public void replaySeek(long targetOffset, SeekProgressListener onProgress) {
        ensureOpen();
        long started = System.nanoTime();
        reopen();
        skipForward(targetOffset, onProgress == null ? SeekProgressListener.NONE : onProgress);
        eof = false;
        log.info("Replay-seek concluído: path='{}' offset={} em {} ms",
                path.getFileName(), targetOffset, (System.nanoTime() - started) / 1_000_000);
    }

    @Override
    public void close() {
        if (in != null) {
            try {
                in.close();
            } catch (IOException e) {
                log.debug("Ignorando IOException ao fechar '{}': {}", path, e.toString());
            }
        }
        in = null;
        channel = null;
        path = null;
        compressionType = CompressionType.NONE;
        bufPos = 0;
        bufLen = 0;
        lineLen = 0;
        position = 0;
        eof = false;
    }

    public boolean isOpen() {
        return in != null;
    }

    public CompressionType getCompressionType() {
        return compressionType;
    }

    public Path getPath() {
        return path;
    }

    public int getBufferSize() {
        return bufferSize;
    }

    /** Tamanho em disco (comprimido para gz/bz2). */
    public long getFileSize() {
        try {
            return path == null ? 0L : Files.size(path);
        } catch (IOException e) {
            return 0L;
        }
    }

    // ===================== internos =====================

    private void openAtStart() {
        try {
            switch (compressionType) {
                case NONE -> {
                    channel = Files.newByteChannel(path, StandardOpenOption.READ);
                    in = Channels.newInputStream(channel);
                }
                case GZIP -> in = new GZIPInputStream(Files.newInputStream(path), bufferSize);
                case BZIP2 -> in = new BZip2CompressorInputStream(
                        new BufferedInputStream(Files.newInputStream(path), bufferSize), true);
            }
        } catch (IOException e) {
            in = null;
            channel = null;
            throw wrap("Não foi possível abrir o dump", e);
        }
        bufPos = 0;
        bufLen = 0;
        position = 0;
        eof = false;
    }

    private void reopen() {
        InputStream old = in;
        in = null;
        if (old != null) {
            try {
                old.close();
            } catch (IOException e) {
                log.debug("Ignorando IOException ao reabrir '{}': {}", path, e.toString());
            }
        }
        openAtStart();
    }

    private void seekChannel(long targetOffset) {
        try {
            long size = channel.size();
            if (targetOffset > size) {
                throw new DumpReadException(path.toString(), targetOffset,
                        "Offset além do fim do arquivo (" + size + " bytes)", null);
            }
            channel.position(targetOffset);
        } catch (IOException e) {
            throw wrap("Falha no seek", e);
        }
        bufPos = 0;
        bufLen = 0;
        position = targetOffset;
    }

    private void skipForward(long targetOffset, SeekProgressListener onProgress) {
        long nextReport = position + REPLAY_PROGRESS_INTERVAL;
        try {
            while (position < targetOffset) {
                if (bufPos >= bufLen && !fill()) {
                    throw new DumpReadException(path.toString(), targetOffset,
                            "Não foi possível posicionar: o stream termina em " + position, null);
                }
                int n = (int) Math.min(bufLen - bufPos, targetOffset - position);
                bufPos += n;
                position += n;
                if (position >= nextReport) {
                    onProgress.onProgress(position, targetOffset);
                    nextReport = position + REPLAY_PROGRESS_INTERVAL;
                }
            }
        } catch (IOException e) {
            throw wrap("Falha ao avançar no stream", e);
        }
        onProgress.onProgress(position, targetOffset);
    }

    private boolean fill() throws IOException {
        int n = in.read(buffer, 0, buffer.length);
        bufPos = 0;
        bufLen = Math.max(n, 0);
        return n > 0;
    }

    private void append(byte[] src, int off, int len) {
        if (lineLen + len > line.length) {
            line = Arrays.copyOf(line, Math.max(line.length * 2, lineLen + len));
        }
        System.arraycopy(src, off, line, lineLen, len);
        lineLen += len;
    }

    private boolean hasUtf8Bom() {
        return lineLen >= 3 && line[0] == (byte) 0xEF && line[1] == (byte) 0xBB && line[2] == (byte) 0xBF;
    }

    private void ensureOpen() {
        if (in == null) throw new IllegalStateException("Nenhum dump aberto");
    }

    private DumpReadException wrap(String message, IOException e) {
        String name = String.valueOf(path);
        if (compressionType.isCompressed()) {
            return new CorruptStreamException(name, position,
                    message + " (" + compressionType.label() + " inválido ou truncado: " + e.getMessage() + ")", e);
        }
        return new DumpReadException(name, position, message + ": " + e.getMessage(), e);
    }
}
