package org.masmtext;

import java.util.Locale;

public enum Architecture {
    X86,
    ARM,
    MIPS,
    PPC,
    M68K;

    public static Architecture parse(String s) {
        if (s == null) throw new IllegalArgumentException("missing architecture");
        switch (s.toLowerCase(Locale.ROOT)) {
            case "x86": case "i386": case "amd64": case "x86_64": return X86;
            case "arm": case "aarch64": case "arm64": return ARM;
            case "mips": return MIPS;
            case "ppc": case "powerpc": return PPC;
            case "m68k": return M68K;
            default: throw new IllegalArgumentException("unknown architecture: " + s);
        }
    }
}
