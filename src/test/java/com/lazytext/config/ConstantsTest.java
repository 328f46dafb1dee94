package com.lazytext.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.ByteBuffer;
import org.junit.jupiter.api.Test;

class ConstantsTest {

    @Test
    void testLengthsMagicSpellsFormatName() {
        byte[] magicBytes = ByteBuffer.allocate(Integer.BYTES).putInt(Constants.LENGTHS_MAGIC).array();
        assertEquals("LTLN", new String(magicBytes, StandardCharsets.US_ASCII));
    }

    @Test
    void testMapChunkIsMultipleOfEveryIdWidth() {
        assertEquals(1, Long.bitCount(Constants.MAP_CHUNK_BYTES));
        assertEquals(0, Constants.MAP_CHUNK_BYTES % Long.BYTES);
        assertEquals(0, Constants.MAP_CHUNK_BYTES % Integer.BYTES);
        assertEquals(0, Constants.MAP_CHUNK_BYTES % Short.BYTES);
    }

    @Test
    void testDefaults() {
        assertEquals(-1, Constants.UNBOUNDED);
        assertEquals(8, Constants.DEFAULT_ID_WIDTH);
        assertTrue(Constants.DEFAULT_REUSE);
        assertEquals(".lengths.bin", Constants.LENGTHS_SUFFIX);
        assertEquals(".memmap", Constants.MEMMAP_SUFFIX);
    }
}
