package org.masmtext;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PtrSizeNamesTest {

    @Test
    @DisplayName("Integer and float sizes")
    void scalarNames() {
        assertEquals("byte", PtrSizeNames.of(AsmType.integer(8)));
        assertEquals("word", PtrSizeNames.of(AsmType.integer(16)));
        assertEquals("dword", PtrSizeNames.of(AsmType.parse("u32")));
        assertEquals("qword", PtrSizeNames.of(AsmType.parse("i64")));
        assertEquals("float", PtrSizeNames.of(AsmType.floating(32)));
        assertEquals("double", PtrSizeNames.of(AsmType.floating(64)));
        assertEquals("ldouble", PtrSizeNames.of(AsmType.parse("f80")));
    }

    @Test
    @DisplayName("Vectors: two quadwords are a dqword, others spell out the count")
    void vectorNames() {
        assertEquals("dqword", PtrSizeNames.of(AsmType.parse("v2u64")));
        assertEquals("V4dword", PtrSizeNames.of(AsmType.parse("v4u32")));
        assertEquals("V4float", PtrSizeNames.of(AsmType.vector(4, AsmType.floating(32))));
        assertEquals("V2double", PtrSizeNames.of(AsmType.parse("v2f64")));
    }

    @Test
    @DisplayName("Null and unhandled types fail")
    void failures() {
        assertThrows(UnparseException.class, () -> PtrSizeNames.of(null));
        assertThrows(UnparseException.class, () -> PtrSizeNames.of(AsmType.integer(128)));
        assertThrows(UnparseException.class, () -> PtrSizeNames.of(AsmType.floating(16)));
    }

    @Test
    @DisplayName("Malformed type text is rejected")
    void badTypeText() {
        assertThrows(IllegalArgumentException.class, () -> AsmType.parse("x32"));
        assertThrows(IllegalArgumentException.class, () -> AsmType.parse("v"));
        assertThrows(IllegalArgumentException.class, () -> AsmType.parse("v4"));
        assertThrows(IllegalArgumentException.class, () -> AsmType.parse("uabc"));
    }
}
