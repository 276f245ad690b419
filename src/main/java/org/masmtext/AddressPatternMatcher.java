package org.masmtext;

import java.util.Objects;
import java.util.Optional;

/**
 * Finds {@code [base+index*stride+offset]} inside a memory address, whichever way the lifter
 * nested the additions: {@code (reg+reg*int)+int}, {@code reg+(reg*int+int)}, or any order of
 * the three terms inside those two shapes.
 */
public final class AddressPatternMatcher {

    /** A complete match. All four parts are always present. */
    public static final class AddressPattern {
        public final Expr.Register base;
        public final Expr.Register index;
        public final Expr.IntValue stride;
        public final Expr.IntValue offset;

        AddressPattern(Expr.Register base, Expr.Register index, Expr.IntValue stride, Expr.IntValue offset) {
            this.base = Objects.requireNonNull(base);
            this.index = Objects.requireNonNull(index);
            this.stride = Objects.requireNonNull(stride);
            this.offset = Objects.requireNonNull(offset);
        }

        /** {@code [base+index*stride+0xoff]}, stride omitted when 1, offset always signed. */
        public String emit(RegisterDictionary regs) {
            StringBuilder sb = new StringBuilder();
            sb.append('[').append(regs.nameOf(base.descriptor));
            sb.append('+').append(regs.nameOf(index.descriptor));
            if (stride.bits != 1) {
                sb.append('*').append(Long.toHexString(stride.bits));
            }
            sb.append(IntegerLiteralFormatter.signedOffset(offset));
            return sb.append(']').toString();
        }
    }

    private AddressPatternMatcher() {}

    public static Optional<AddressPattern> match(Expr address) {
        if (!(address instanceof Expr.Add)) return Optional.empty();
        Expr.Add outer = (Expr.Add) address;

        Expr[] terms;
        if (outer.lhs instanceof Expr.Add) {
            Expr.Add inner = (Expr.Add) outer.lhs;
            terms = new Expr[] {inner.lhs, inner.rhs, outer.rhs};
        } else if (outer.rhs instanceof Expr.Add) {
            Expr.Add inner = (Expr.Add) outer.rhs;
            terms = new Expr[] {outer.lhs, inner.lhs, inner.rhs};
        } else {
            return Optional.empty();
        }

        Expr.Register base = null, index = null;
        Expr.IntValue stride = null, offset = null;
        for (Expr t : terms) {
            if (t instanceof Expr.Register) {
                if (base != null) return Optional.empty();
                base = (Expr.Register) t;
            } else if (t instanceof Expr.IntValue) {
                if (offset != null) return Optional.empty();
                offset = (Expr.IntValue) t;
            } else if (t instanceof Expr.Multiply) {
                Expr.Multiply mul = (Expr.Multiply) t;
                Expr.Register r;
                Expr other;
                if (mul.lhs instanceof Expr.Register) {
                    r = (Expr.Register) mul.lhs;
                    other = mul.rhs;
                } else if (mul.rhs instanceof Expr.Register) {
                    r = (Expr.Register) mul.rhs;
                    other = mul.lhs;
                } else {
                    return Optional.empty();
                }
                if (!(other instanceof Expr.IntValue) || index != null) return Optional.empty();
                index = r;
                stride = (Expr.IntValue) other;
            } else {
                return Optional.empty();
            }
        }
        // three terms, three distinct roles: every role is filled here
        return Optional.of(new AddressPattern(base, index, stride, offset));
    }
}
