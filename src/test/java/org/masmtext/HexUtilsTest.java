package org.masmtext;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HexUtilsTest {

    @Test
    @DisplayName("Bytes print as uppercase pairs without separators")
    void opcodeBytes() {
        assertEquals("C3", HexUtils.opcodeBytes(new byte[] {(byte) 0xc3}, 8));
        assertEquals("", HexUtils.opcodeBytes(new byte[0], 8));
        assertEquals("0F1F+", HexUtils.opcodeBytes(new byte[] {0x0f, 0x1f, 0x44, 0x00}, 2));
        assertEquals("0F1F4400", HexUtils.opcodeBytes(new byte[] {0x0f, 0x1f, 0x44, 0x00}, 4));
    }

    @Test
    @DisplayName("Hex text parses with or without spaces")
    void parseHex() {
        assertArrayEquals(new byte[] {0x48, (byte) 0x8b}, HexUtils.parseHex("48 8b"));
        assertArrayEquals(new byte[] {0x48, (byte) 0x8b}, HexUtils.parseHex("488B"));
        assertArrayEquals(new byte[0], HexUtils.parseHex(""));
        assertThrows(IllegalArgumentException.class, () -> HexUtils.parseHex("488"));
        assertThrows(IllegalArgumentException.class, () -> HexUtils.parseHex("zz"));
    }
}
