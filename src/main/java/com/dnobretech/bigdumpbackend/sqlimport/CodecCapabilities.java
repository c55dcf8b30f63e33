package com.dnobretech.bigdumpbackend.sqlimport;

/**
 * Resultado da detecção de codecs opcionais. A detecção roda uma vez por processo (o bzip2 depende do
 * Commons Compress no classpath) e o resultado é injetado no {@link DumpReader}.
 */
public record CodecCapabilities(boolean bzip2Available) {

    static final String BZIP2_INPUT_CLASS_NAME =
            "org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream";

    private static volatile CodecCapabilities probed;

    public static CodecCapabilities probe() {
        CodecCapabilities current = probed;
        if (current == null) {
            synchronized (CodecCapabilities.class) {
                current = probed;
                if (current == null) {
                    current = new CodecCapabilities(isClassPresent(BZIP2_INPUT_CLASS_NAME));
                    probed = current;
                }
            }
        }
        return current;
    }

    /** Só para testes: força uma nova detecção na próxima chamada. */
    public static void reset() {
        probed = null;
    }

    public boolean supports(CompressionType type) {
        return type != CompressionType.BZIP2 || bzip2Available;
    }

    private static boolean isClassPresent(String className) {
        try {
            Class.forName(className, false, CodecCapabilities.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }
}
