package org.masmtext;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/** Debug listing lines: {@code 401000: mov       eax, [rbx+rcx*4+0x10] ; BYTES: 8B448B10}. */
public class InstructionDebugPrinter {
    private final MasmUnparser unparser;

    public InstructionDebugPrinter(MasmUnparser unparser) {
        this.unparser = unparser;
    }

    /** Operand texts joined with ", ". x86 only. */
    public String operands(Instruction insn, LabelMap labels) {
        List<String> ops = new ArrayList<>();
        for (Expr e : insn.operands) {
            ops.add(unparser.unparseExpression(insn, e, labels));
        }
        return String.join(", ", ops);
    }

    /**
     * @param maxBytes how many raw bytes to dump; 0 leaves the "; BYTES:" part off
     */
    public String debugInstruction(Instruction insn, int maxBytes, LabelMap labels) {
        if (insn == null) return "NULL!";
        return line(insn, insn.isX86() ? operands(insn, labels) : null, maxBytes);
    }

    public InstructionInfo render(Instruction insn, int maxBytes, LabelMap labels) {
        String ops = insn.isX86() ? operands(insn, labels) : null;
        return new InstructionInfo(insn.address,
                HexUtils.opcodeBytes(insn.getRawBytes(), Integer.MAX_VALUE),
                insn.mnemonic, ops, line(insn, ops, maxBytes));
    }

    private String line(Instruction insn, String ops, int maxBytes) {
        String opbytes = "";
        if (maxBytes > 0) {
            opbytes = " ; BYTES: " + HexUtils.opcodeBytes(insn.getRawBytes(), maxBytes);
        }
        if (!insn.isX86()) {
            return String.format("0x%08X", insn.address) + " "
                    + unparser.getGeneric().unparseInstruction(insn) + opbytes;
        }
        return String.format("%X: %-9s %s", insn.address, insn.mnemonic, ops) + opbytes;
    }

    /**
     * Whole function, one line per instruction, blocks in the given order.
     *
     * @param basicBlockLines blank line after each block
     * @param showReasons     "; block reason:" header before each block
     */
    public String debugFunction(List<Block> blocks, int maxBytes, boolean basicBlockLines,
                                boolean showReasons, LabelMap labels) {
        return debugFunction(blocks, basicBlockLines, showReasons,
                insn -> debugInstruction(insn, maxBytes, labels));
    }

    /** Same layout, with the caller producing each instruction line. */
    public String debugFunction(List<Block> blocks, boolean basicBlockLines, boolean showReasons,
                                Function<Instruction, String> lineFor) {
        StringBuilder sb = new StringBuilder();
        for (Block blk : blocks) {
            if (showReasons) {
                sb.append("; block reason: ").append(blk.reason).append('\n');
            }
            if (blk.staticData) {
                sb.append("; hey, this block is static data!\n");
            }
            for (Instruction insn : blk.instructions) {
                sb.append(lineFor.apply(insn)).append('\n');
            }
            if (basicBlockLines) sb.append('\n');
        }
        return sb.toString();
    }
}
