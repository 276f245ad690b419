package org.masmtext;

import java.util.Objects;

/**
 * One node of an instruction operand tree, as produced by the lifter.
 * Trees are immutable, never shared between instructions and never cyclic.
 */
public abstract class Expr {

    /** One case per node kind. Adding a node kind breaks every visitor until it handles it. */
    public interface Visitor<R> {
        R visitAdd(Add e);
        R visitSubtract(Subtract e);
        R visitMultiply(Multiply e);
        R visitMemoryRef(MemoryRef e);
        R visitRegister(Register e);
        R visitIndirectRegister(IndirectRegister e);
        R visitIntValue(IntValue e);
        R visitOpaque(Opaque e);
    }

    Expr() {}

    public abstract <R> R accept(Visitor<R> v);

    /* ---------- factories ---------- */

    public static Add add(Expr lhs, Expr rhs) { return new Add(lhs, rhs); }
    public static Subtract sub(Expr lhs, Expr rhs) { return new Subtract(lhs, rhs); }
    public static Multiply mul(Expr lhs, Expr rhs) { return new Multiply(lhs, rhs); }
    public static MemoryRef mem(Expr address) { return new MemoryRef(address, null, null); }
    public static Register reg(RegisterDescriptor d) { return new Register(d); }
    public static IntValue imm(long bits, int width) { return new IntValue(bits, width); }

    /** lhs op rhs; emission order is lhs first. */
    public abstract static class Binary extends Expr {
        public final Expr lhs;
        public final Expr rhs;

        Binary(Expr lhs, Expr rhs) {
            this.lhs = Objects.requireNonNull(lhs, "lhs");
            this.rhs = Objects.requireNonNull(rhs, "rhs");
        }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Binary b = (Binary) o;
            return lhs.equals(b.lhs) && rhs.equals(b.rhs);
        }
        @Override public int hashCode() { return Objects.hash(getClass(), lhs, rhs); }
    }

    public static final class Add extends Binary {
        public Add(Expr lhs, Expr rhs) { super(lhs, rhs); }
        @Override public <R> R accept(Visitor<R> v) { return v.visitAdd(this); }
        @Override public String toString() { return "Add(" + lhs + ", " + rhs + ")"; }
    }

    public static final class Subtract extends Binary {
        public Subtract(Expr lhs, Expr rhs) { super(lhs, rhs); }
        @Override public <R> R accept(Visitor<R> v) { return v.visitSubtract(this); }
        @Override public String toString() { return "Subtract(" + lhs + ", " + rhs + ")"; }
    }

    public static final class Multiply extends Binary {
        public Multiply(Expr lhs, Expr rhs) { super(lhs, rhs); }
        @Override public <R> R accept(Visitor<R> v) { return v.visitMultiply(this); }
        @Override public String toString() { return "Multiply(" + lhs + ", " + rhs + ")"; }
    }

    /** [address], with an optional segment register and an optional access type. */
    public static final class MemoryRef extends Expr {
        public final Expr address;
        public final Expr segment;   // nullable
        public final AsmType type;   // nullable, only consulted for "xxx ptr"

        public MemoryRef(Expr address, Expr segment, AsmType type) {
            this.address = Objects.requireNonNull(address, "address");
            this.segment = segment;
            this.type = type;
        }

        public MemoryRef withSegment(Expr seg) { return new MemoryRef(address, seg, type); }
        public MemoryRef withType(AsmType t) { return new MemoryRef(address, segment, t); }

        @Override public <R> R accept(Visitor<R> v) { return v.visitMemoryRef(this); }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof MemoryRef)) return false;
            MemoryRef m = (MemoryRef) o;
            return address.equals(m.address) && Objects.equals(segment, m.segment)
                    && Objects.equals(type, m.type);
        }
        @Override public int hashCode() { return Objects.hash(address, segment, type); }
        @Override public String toString() {
            return "MemoryRef(" + address + (segment == null ? "" : ", seg=" + segment) + ")";
        }
    }

    public static final class Register extends Expr {
        public final RegisterDescriptor descriptor;

        public Register(RegisterDescriptor descriptor) {
            this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        }

        @Override public <R> R accept(Visitor<R> v) { return v.visitRegister(this); }
        @Override public boolean equals(Object o) {
            return o instanceof Register && descriptor.equals(((Register) o).descriptor);
        }
        @Override public int hashCode() { return descriptor.hashCode(); }
        @Override public String toString() { return "Register(" + descriptor + ")"; }
    }

    /** Register known only by a numeric index; rendered as the placeholder {@code (i)}. */
    public static final class IndirectRegister extends Expr {
        public final int index;

        public IndirectRegister(int index) { this.index = index; }

        @Override public <R> R accept(Visitor<R> v) { return v.visitIndirectRegister(this); }
        @Override public boolean equals(Object o) {
            return o instanceof IndirectRegister && index == ((IndirectRegister) o).index;
        }
        @Override public int hashCode() { return Integer.hashCode(index); }
        @Override public String toString() { return "IndirectRegister(" + index + ")"; }
    }

    /**
     * Fixed-width integer. {@code bits} holds the raw pattern truncated to {@code width}.
     * Any positive width is carried; widths the renderer cannot print are rejected when the
     * value is rendered, so one odd operand fails only its own instruction.
     */
    public static final class IntValue extends Expr {
        public final long bits;
        public final int width;

        public IntValue(long bits, int width) {
            if (width < 1)
                throw new IllegalArgumentException("integer width must be positive: " + width);
            this.width = width;
            this.bits = bits & mask(width);
        }

        /** Value sign-extended from {@code width}. */
        public long signedValue() {
            checkFitsLong();
            int shift = 64 - width;
            return (bits << shift) >> shift;
        }

        public boolean signBit() {
            checkFitsLong();
            return (bits >>> (width - 1) & 1L) != 0;
        }

        private void checkFitsLong() {
            if (width > 64)
                throw new UnparseException("unsupported integer width: " + width);
        }

        static long mask(int width) {
            return width >= 64 ? -1L : (1L << width) - 1;
        }

        @Override public <R> R accept(Visitor<R> v) { return v.visitIntValue(this); }
        @Override public boolean equals(Object o) {
            if (!(o instanceof IntValue)) return false;
            IntValue i = (IntValue) o;
            return bits == i.bits && width == i.width;
        }
        @Override public int hashCode() { return Objects.hash(bits, width); }
        @Override public String toString() { return "IntValue(0x" + Long.toHexString(bits) + ", " + width + ")"; }
    }

    /** A node kind the lifter produced but this package has no text form for. */
    public static final class Opaque extends Expr {
        public final String kind;

        public Opaque(String kind) { this.kind = Objects.requireNonNull(kind, "kind"); }

        @Override public <R> R accept(Visitor<R> v) { return v.visitOpaque(this); }
        @Override public boolean equals(Object o) {
            return o instanceof Opaque && kind.equals(((Opaque) o).kind);
        }
        @Override public int hashCode() { return kind.hashCode(); }
        @Override public String toString() { return "Opaque(" + kind + ")"; }
    }
}
