package org.masmtext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** A decoded instruction as handed over by the lifter. */
public class Instruction {
    public final Architecture arch;
    public final long address;
    public final String mnemonic;
    public final List<Expr> operands;  // entries may be null for operands the lifter lost
    private final byte[] rawBytes;

    public Instruction(Architecture arch, long address, String mnemonic, List<Expr> operands, byte[] rawBytes) {
        this.arch = Objects.requireNonNull(arch, "arch");
        this.address = address;
        this.mnemonic = Objects.requireNonNull(mnemonic, "mnemonic");
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        this.rawBytes = rawBytes == null ? new byte[0] : rawBytes.clone();
    }

    public static Instruction x86(long address, String mnemonic, byte[] rawBytes, Expr... operands) {
        return new Instruction(Architecture.X86, address, mnemonic, Arrays.asList(operands), rawBytes);
    }

    public byte[] getRawBytes() { return rawBytes.clone(); }

    public boolean isX86() { return arch == Architecture.X86; }

    /** lea computes an address, it never touches the memory it names. */
    public boolean isLea() {
        return isX86() && mnemonic.toLowerCase(Locale.ROOT).equals("lea");
    }

    @Override public String toString() {
        return String.format("%X %s %s", address, mnemonic, operands);
    }
}
