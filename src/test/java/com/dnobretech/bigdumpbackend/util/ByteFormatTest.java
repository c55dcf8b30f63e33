package com.dnobretech.bigdumpbackend.util;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ByteFormatTest {

    @ParameterizedTest
    @CsvSource({
            "0, 0 B",
            "1023, 1023 B",
            "1536, 1.50 KB",
            "1048576, 1.00 MB",
            "5368709120, 5.00 GB"
    })
    void format(long bytes, String expected) {
        assertEquals(expected, ByteFormat.format(bytes));
    }
}
