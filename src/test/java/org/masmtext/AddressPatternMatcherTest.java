package org.masmtext;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.masmtext.Expr.*;

class AddressPatternMatcherTest {

    private static final RegisterDictionary REGS = RegisterDictionary.x86_64();

    private static Expr r(String name) { return reg(REGS.get(name)); }

    private static String emit(Expr address) {
        return AddressPatternMatcher.match(address).map(p -> p.emit(REGS)).orElse(null);
    }

    @Test
    @DisplayName("(base+index*stride)+offset and base+(index*stride+offset) emit the same text")
    void bothShapes() {
        Expr left = add(add(r("rbx"), mul(r("rcx"), imm(4, 8))), imm(0x10, 32));
        Expr right = add(r("rbx"), add(mul(r("rcx"), imm(4, 8)), imm(0x10, 32)));
        assertEquals("[rbx+rcx*4+0x10]", emit(left));
        assertEquals("[rbx+rcx*4+0x10]", emit(right));
    }

    @Test
    @DisplayName("Term order and operand order of the product do not matter")
    void anyOrder() {
        assertEquals("[rbx+rcx*4+0x10]",
                emit(add(add(imm(0x10, 32), mul(imm(4, 8), r("rcx"))), r("rbx"))));
        assertEquals("[rbx+rcx*4+0x10]",
                emit(add(mul(r("rcx"), imm(4, 8)), add(imm(0x10, 32), r("rbx")))));
    }

    @Test
    @DisplayName("Stride 1 is left out")
    void strideOne() {
        assertEquals("[rax+rdx+0x0]", emit(add(add(r("rax"), mul(r("rdx"), imm(1, 8))), imm(0, 32))));
    }

    @Test
    @DisplayName("Negative offsets")
    void negativeOffset() {
        assertEquals("[rbp+rsi*8-0x10]",
                emit(add(add(r("rbp"), mul(r("rsi"), imm(8, 8))), imm(0xfffffff0L, 32))));
        assertEquals("[ebp+eax*2-0x80]",
                emit(add(add(r("ebp"), mul(r("eax"), imm(2, 8))), imm(0x80, 8))));
    }

    @Test
    @DisplayName("Match result exposes each part")
    void parts() {
        Optional<AddressPatternMatcher.AddressPattern> m =
                AddressPatternMatcher.match(add(add(r("rbx"), mul(imm(4, 8), r("rcx"))), imm(0x10, 32)));
        assertTrue(m.isPresent());
        assertEquals(r("rbx"), m.get().base);
        assertEquals(r("rcx"), m.get().index);
        assertEquals(4, m.get().stride.bits);
        assertEquals(0x10, m.get().offset.bits);
    }

    @Test
    @DisplayName("A role claimed twice is no match")
    void duplicateRoles() {
        assertTrue(AddressPatternMatcher.match(add(add(r("rax"), r("rbx")), imm(8, 8))).isEmpty());
        assertTrue(AddressPatternMatcher.match(add(add(r("rax"), imm(1, 8)), imm(2, 8))).isEmpty());
        assertTrue(AddressPatternMatcher.match(
                add(add(mul(r("rax"), imm(2, 8)), mul(r("rbx"), imm(4, 8))), imm(2, 8))).isEmpty());
    }

    @Test
    @DisplayName("Terms of other shapes are no match")
    void otherShapes() {
        // four terms
        assertTrue(AddressPatternMatcher.match(add(add(add(r("rax"), r("rbx")), r("rcx")), imm(4, 8))).isEmpty());
        // product of two registers, product of two integers
        assertTrue(AddressPatternMatcher.match(add(add(r("rax"), mul(r("rbx"), r("rcx"))), imm(0, 8))).isEmpty());
        assertTrue(AddressPatternMatcher.match(add(add(r("rax"), mul(imm(2, 8), imm(4, 8))), imm(0, 8))).isEmpty());
        // subtraction as a term
        assertTrue(AddressPatternMatcher.match(add(add(r("rax"), sub(r("rbx"), imm(1, 8))), imm(0, 8))).isEmpty());
        // two terms only
        assertTrue(AddressPatternMatcher.match(add(r("rax"), imm(8, 8))).isEmpty());
        assertTrue(AddressPatternMatcher.match(r("rax")).isEmpty());
    }
}
