package org.masmtext;

import java.util.Optional;

/**
 * MASM-style text for x86 operand trees.
 * <p>
 * Stateless apart from the register dictionary; each {@link #unparse} call walks its own
 * tree, so one instance can serve concurrent callers sharing a {@link LabelMap}.
 */
public class ExpressionUnparser {

    /** Deepest tree accepted. Real addressing expressions stay in single digits. */
    public static final int MAX_DEPTH = 256;

    static final String NULL_OPERAND = "BOGUS:NULL";

    private final RegisterDictionary registers;

    public ExpressionUnparser(RegisterDictionary registers) {
        this.registers = registers;
    }

    /**
     * @param leaMode true for the memory operand of {@code lea}: no size keyword, no segment
     * @param labels  names substituted for 32/64-bit immediates; may be null
     * @throws UnparseException if the tree holds something that has no faithful text form
     */
    public String unparse(Expr expr, boolean leaMode, LabelMap labels) {
        return render(expr, leaMode, labels, 0);
    }

    private String render(Expr expr, boolean leaMode, LabelMap labels, int depth) {
        if (expr == null) return NULL_OPERAND;
        if (depth > MAX_DEPTH)
            throw new UnparseException("expression nested deeper than " + MAX_DEPTH);
        return expr.accept(new Walk(leaMode, labels, depth));
    }

    private final class Walk implements Expr.Visitor<String> {
        private final boolean leaMode;
        private final LabelMap labels;
        private final int depth;

        Walk(boolean leaMode, LabelMap labels, int depth) {
            this.leaMode = leaMode;
            this.labels = labels;
            this.depth = depth;
        }

        private String child(Expr e) {
            return render(e, false, labels, depth + 1);
        }

        @Override
        public String visitAdd(Expr.Add e) {
            String l = child(e.lhs);
            String r = child(e.rhs);
            // rax + -0x4 reads as rax-0x4
            if (r.startsWith("-")) return l + r;
            return l + "+" + r;
        }

        @Override
        public String visitSubtract(Expr.Subtract e) {
            return child(e.lhs) + "-" + child(e.rhs);
        }

        @Override
        public String visitMultiply(Expr.Multiply e) {
            return child(e.lhs) + "*" + child(e.rhs);
        }

        @Override
        public String visitMemoryRef(Expr.MemoryRef e) {
            Optional<AddressPatternMatcher.AddressPattern> ia = AddressPatternMatcher.match(e.address);
            if (ia.isPresent()) {
                return ia.get().emit(registers);
            }

            StringBuilder sb = new StringBuilder();
            if (!leaMode) {
                if (isSizeAmbiguous(e)) {
                    sb.append(PtrSizeNames.of(e.type)).append(" ptr ");
                }
                if (e.segment != null) {
                    // only fs is printed; other overrides are dropped
                    String seg = render(e.segment, false, null, depth + 1);
                    if (seg.equals("fs")) {
                        sb.append(seg).append(':');
                    }
                }
            }
            return sb.append('[').append(child(e.address)).append(']').toString();
        }

        @Override
        public String visitRegister(Expr.Register e) {
            return registers.nameOf(e.descriptor);
        }

        @Override
        public String visitIndirectRegister(Expr.IndirectRegister e) {
            return "(" + e.index + ")";
        }

        @Override
        public String visitIntValue(Expr.IntValue e) {
            return IntegerLiteralFormatter.format(e.bits, e.width, labels);
        }

        @Override
        public String visitOpaque(Expr.Opaque e) {
            throw new UnparseException("unhandled expression kind " + e.kind);
        }
    }

    /**
     * Whether the access size must be spelled out. Assemblers infer it from the other operand
     * in practice, and nothing here looks at the other operand, so this always says no.
     */
    static boolean isSizeAmbiguous(Expr.MemoryRef e) {
        return false;
    }
}
