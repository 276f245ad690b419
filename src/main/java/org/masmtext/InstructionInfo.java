package org.masmtext;

/** One rendered instruction of a listing. */
public class InstructionInfo {
    public final long address;
    public final String hexBytes;  // e.g. "488B4510"
    public final String mnemonic;  // e.g. mov, lea
    public final String operands;  // rendered operand text, comma separated
    public final String line;      // full debug line
    public final String error;     // set instead of operands/line when rendering failed

    public InstructionInfo(long address, String hexBytes, String mnemonic, String operands, String line) {
        this(address, hexBytes, mnemonic, operands, line, null);
    }

    private InstructionInfo(long address, String hexBytes, String mnemonic, String operands,
                            String line, String error) {
        this.address = address;
        this.hexBytes = hexBytes;
        this.mnemonic = mnemonic;
        this.operands = operands;
        this.line = line;
        this.error = error;
    }

    public static InstructionInfo failed(Instruction insn, String error) {
        return new InstructionInfo(insn.address, HexUtils.opcodeBytes(insn.getRawBytes(), Integer.MAX_VALUE),
                insn.mnemonic, null, null, error);
    }

    public boolean failed() { return error != null; }

    public String label() {
        return failed()
                ? String.format("%X: %s <ERROR: %s>", address, mnemonic, error)
                : line;
    }
}
