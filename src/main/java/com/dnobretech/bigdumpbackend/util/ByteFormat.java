package com.dnobretech.bigdumpbackend.util;

import java.util.Locale;

public final class ByteFormat {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private ByteFormat() {
    }

    /** 1536 -> "1.50 KB". */
    public static String format(long bytes) {
        if (bytes < 1024) return bytes + " B";
        double v = bytes;
        int u = 0;
        while (v >= 1024 && u < UNITS.length - 1) {
            v /= 1024;
            u++;
        }
        return String.format(Locale.ROOT, "%.2f %s", v, UNITS[u]);
    }
}
