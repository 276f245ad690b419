package org.masmtext;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.masmtext.Expr.*;

class InstructionDebugPrinterTest {

    private static final RegisterDictionary REGS = RegisterDictionary.x86_64();

    private static Expr r(String name) { return reg(REGS.get(name)); }

    private static byte[] bytes(int... b) {
        byte[] out = new byte[b.length];
        for (int i = 0; i < b.length; i++) out[i] = (byte) b[i];
        return out;
    }

    /** Stand-in for another architecture's unparser. */
    private static final GenericUnparser ARM = new GenericUnparser() {
        @Override
        public String unparseExpression(Instruction insn, Expr expr, LabelMap labels) {
            return "op";
        }

        @Override
        public String unparseInstruction(Instruction insn) {
            return insn.mnemonic + " r0, r1";
        }
    };

    private final InstructionDebugPrinter printer = new InstructionDebugPrinter(new MasmUnparser(REGS));

    private final Instruction movIndexed = Instruction.x86(0x401000L, "mov", bytes(0x8b, 0x44, 0x8b, 0x10),
            r("eax"), mem(add(add(r("rbx"), mul(r("rcx"), imm(4, 8))), imm(0x10, 8))));

    @Test
    @DisplayName("x86 line: address, padded mnemonic, operands, bytes")
    void x86Line() {
        assertEquals("401000: mov       eax, [rbx+rcx*4+0x10] ; BYTES: 8B448B10",
                printer.debugInstruction(movIndexed, 8, null));
    }

    @Test
    @DisplayName("Byte dump is cut at the limit and marked with +")
    void truncatedBytes() {
        assertEquals("401000: mov       eax, [rbx+rcx*4+0x10] ; BYTES: 8B44+",
                printer.debugInstruction(movIndexed, 2, null));
        assertEquals("401000: mov       eax, [rbx+rcx*4+0x10]",
                printer.debugInstruction(movIndexed, 0, null));
    }

    @Test
    @DisplayName("No operands leaves the padding in place")
    void noOperands() {
        Instruction ret = Instruction.x86(0x401005L, "ret", bytes(0xc3));
        assertEquals("401005: ret       ", printer.debugInstruction(ret, 0, null));
        assertEquals("401005: ret        ; BYTES: C3", printer.debugInstruction(ret, 4, null));
    }

    @Test
    @DisplayName("lea operands drop the segment override")
    void leaMode() {
        Expr fsMem = mem(r("rax")).withSegment(r("fs"));
        Instruction lea = Instruction.x86(0x1000, "lea", bytes(0x64, 0x48, 0x8d, 0x00), r("rax"), fsMem);
        Instruction mov = Instruction.x86(0x1000, "mov", bytes(0x64, 0x48, 0x8b, 0x00), r("rax"), fsMem);
        assertTrue(lea.isLea());
        assertEquals("1000: lea       rax, [rax]", printer.debugInstruction(lea, 0, null));
        assertEquals("1000: mov       rax, fs:[rax]", printer.debugInstruction(mov, 0, null));
    }

    @Test
    @DisplayName("Labels and negative immediates in a full line")
    void labelsAndNegatives() {
        LabelMap labels = LabelMap.builder().put(0x402000L, "do_work").build();
        Instruction call = Instruction.x86(0x401010L, "call", bytes(0xe8), imm(0x402000L, 64));
        Instruction add = Instruction.x86(0x401015L, "add", bytes(0x48, 0x83, 0xc4, 0xf8), r("rsp"), imm(0xf8, 8));
        assertEquals("401010: call      do_work", printer.debugInstruction(call, 0, labels));
        assertEquals("401015: add       rsp, -0x8", printer.debugInstruction(add, 0, labels));
    }

    @Test
    @DisplayName("Null instruction and null operand")
    void nulls() {
        assertEquals("NULL!", printer.debugInstruction(null, 8, null));
        Instruction broken = new Instruction(Architecture.X86, 0x10, "push",
                Arrays.asList((Expr) null), bytes(0x50));
        assertEquals("10: push      BOGUS:NULL", printer.debugInstruction(broken, 0, null));
    }

    @Test
    @DisplayName("Other architectures go to the generic unparser")
    void otherArchitecture() {
        InstructionDebugPrinter withArm = new InstructionDebugPrinter(
                new MasmUnparser(new ExpressionUnparser(REGS), ARM));
        Instruction nop = new Instruction(Architecture.ARM, 0x1000, "mov", List.of(), bytes(0x01, 0x00, 0xa0, 0xe1));
        assertEquals("0x00001000 mov r0, r1 ; BYTES: 0100A0E1", withArm.debugInstruction(nop, 8, null));
        assertThrows(UnparseException.class, () -> printer.debugInstruction(nop, 8, null));
    }

    @Test
    @DisplayName("Function listing with block reasons, static data and separators")
    void function() {
        Instruction push = Instruction.x86(0x401000L, "push", bytes(0x55), r("rbp"));
        Instruction ret = Instruction.x86(0x401001L, "ret", bytes(0xc3));
        List<Block> blocks = List.of(
                new Block("entry point", false, List.of(push)),
                new Block("data", true, List.of(ret)));

        String expected = "; block reason: entry point\n"
                + "401000: push      rbp ; BYTES: 55\n"
                + "\n"
                + "; block reason: data\n"
                + "; hey, this block is static data!\n"
                + "401001: ret        ; BYTES: C3\n"
                + "\n";
        assertEquals(expected, printer.debugFunction(blocks, 8, true, true, null));
        assertEquals("401000: push      rbp\n; hey, this block is static data!\n401001: ret       \n",
                printer.debugFunction(blocks, 0, false, false, null));
    }

    @Test
    @DisplayName("Rendered record carries operand text and full bytes")
    void render() {
        InstructionInfo info = printer.render(movIndexed, 2, null);
        assertEquals("eax, [rbx+rcx*4+0x10]", info.operands);
        assertEquals("8B448B10", info.hexBytes);
        assertEquals("401000: mov       eax, [rbx+rcx*4+0x10] ; BYTES: 8B44+", info.label());
        assertFalse(info.failed());
    }
}
