package org.masmtext;

import java.util.*;

/**
 * Two-way register name table. Rendering goes descriptor to name; the listing
 * reader goes name to descriptor.
 */
public final class RegisterDictionary {

    public static final int GPR = 0;
    public static final int SEGMENT = 1;
    public static final int IP = 2;
    public static final int FLAGS = 3;

    private static final String[] GPR64 = {
            "rax", "rcx", "rdx", "rbx", "rsp", "rbp", "rsi", "rdi",
            "r8", "r9", "r10", "r11", "r12", "r13", "r14", "r15"};
    private static final String[] GPR32 = {
            "eax", "ecx", "edx", "ebx", "esp", "ebp", "esi", "edi",
            "r8d", "r9d", "r10d", "r11d", "r12d", "r13d", "r14d", "r15d"};
    private static final String[] GPR16 = {
            "ax", "cx", "dx", "bx", "sp", "bp", "si", "di",
            "r8w", "r9w", "r10w", "r11w", "r12w", "r13w", "r14w", "r15w"};
    private static final String[] GPR8 = {
            "al", "cl", "dl", "bl", "spl", "bpl", "sil", "dil",
            "r8b", "r9b", "r10b", "r11b", "r12b", "r13b", "r14b", "r15b"};
    private static final String[] GPR8_HIGH = {"ah", "ch", "dh", "bh"};
    private static final String[] SEGMENTS = {"es", "cs", "ss", "ds", "fs", "gs"};

    private static final RegisterDictionary X86_64 = buildX86_64();

    private final String name;
    private final Map<RegisterDescriptor, String> names = new LinkedHashMap<>();
    private final Map<String, RegisterDescriptor> descriptors = new HashMap<>();

    private RegisterDictionary(String name) {
        this.name = name;
    }

    public static RegisterDictionary x86_64() {
        return X86_64;
    }

    private static RegisterDictionary buildX86_64() {
        RegisterDictionary d = new RegisterDictionary("amd64");
        for (int i = 0; i < GPR64.length; i++) {
            d.insert(GPR64[i], new RegisterDescriptor(GPR, i, 0, 64));
            d.insert(GPR32[i], new RegisterDescriptor(GPR, i, 0, 32));
            d.insert(GPR16[i], new RegisterDescriptor(GPR, i, 0, 16));
            d.insert(GPR8[i], new RegisterDescriptor(GPR, i, 0, 8));
        }
        for (int i = 0; i < GPR8_HIGH.length; i++)
            d.insert(GPR8_HIGH[i], new RegisterDescriptor(GPR, i, 8, 8));
        for (int i = 0; i < SEGMENTS.length; i++)
            d.insert(SEGMENTS[i], new RegisterDescriptor(SEGMENT, i, 0, 16));
        d.insert("rip", new RegisterDescriptor(IP, 0, 0, 64));
        d.insert("eip", new RegisterDescriptor(IP, 0, 0, 32));
        d.insert("ip", new RegisterDescriptor(IP, 0, 0, 16));
        d.insert("rflags", new RegisterDescriptor(FLAGS, 0, 0, 64));
        d.insert("eflags", new RegisterDescriptor(FLAGS, 0, 0, 32));
        d.insert("flags", new RegisterDescriptor(FLAGS, 0, 0, 16));
        return d;
    }

    private void insert(String regName, RegisterDescriptor desc) {
        names.put(desc, regName);
        descriptors.put(regName, desc);
    }

    /** Canonical short name, e.g. {@code rax}; an unknown descriptor cannot be rendered. */
    public String nameOf(RegisterDescriptor desc) {
        String n = names.get(desc);
        if (n == null)
            throw new UnparseException("no " + name + " register for descriptor " + desc);
        return n;
    }

    public Optional<RegisterDescriptor> find(String regName) {
        if (regName == null) return Optional.empty();
        return Optional.ofNullable(descriptors.get(regName.toLowerCase(Locale.ROOT)));
    }

    /** Descriptor for a known name; for building trees by hand. */
    public RegisterDescriptor get(String regName) {
        return find(regName).orElseThrow(
                () -> new IllegalArgumentException("unknown " + name + " register: " + regName));
    }
}
