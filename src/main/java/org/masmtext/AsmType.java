package org.masmtext;

import java.util.Objects;

/** Data type of a memory access; only used to name the operand size. */
public abstract class AsmType {

    AsmType() {}

    public static IntegerType integer(int bits) { return new IntegerType(bits); }
    public static FloatType floating(int bits) { return new FloatType(bits); }
    public static VectorType vector(int count, AsmType element) { return new VectorType(count, element); }

    /**
     * Parses the listing notation: {@code u8}/{@code i32} integers, {@code f64} floats,
     * {@code v2u64} vectors (count followed by an element type).
     */
    public static AsmType parse(String text) {
        if (text == null || text.length() < 2)
            throw new IllegalArgumentException("bad type: " + text);
        char c = text.charAt(0);
        try {
            switch (c) {
                case 'u':
                case 'i':
                    return integer(Integer.parseInt(text.substring(1)));
                case 'f':
                    return floating(Integer.parseInt(text.substring(1)));
                case 'v': {
                    int i = 1;
                    while (i < text.length() && Character.isDigit(text.charAt(i))) i++;
                    if (i == 1 || i == text.length())
                        throw new IllegalArgumentException("bad vector type: " + text);
                    return vector(Integer.parseInt(text.substring(1, i)), parse(text.substring(i)));
                }
                default:
                    throw new IllegalArgumentException("bad type: " + text);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad type: " + text, e);
        }
    }

    public static final class IntegerType extends AsmType {
        public final int nBits;
        IntegerType(int nBits) { this.nBits = nBits; }
        @Override public boolean equals(Object o) { return o instanceof IntegerType && ((IntegerType) o).nBits == nBits; }
        @Override public int hashCode() { return Objects.hash("u", nBits); }
        @Override public String toString() { return "u" + nBits; }
    }

    public static final class FloatType extends AsmType {
        public final int nBits;
        FloatType(int nBits) { this.nBits = nBits; }
        @Override public boolean equals(Object o) { return o instanceof FloatType && ((FloatType) o).nBits == nBits; }
        @Override public int hashCode() { return Objects.hash("f", nBits); }
        @Override public String toString() { return "f" + nBits; }
    }

    public static final class VectorType extends AsmType {
        public final int nElements;
        public final AsmType element;
        VectorType(int nElements, AsmType element) {
            this.nElements = nElements;
            this.element = Objects.requireNonNull(element, "element");
        }
        @Override public boolean equals(Object o) {
            if (!(o instanceof VectorType)) return false;
            VectorType v = (VectorType) o;
            return nElements == v.nElements && element.equals(v.element);
        }
        @Override public int hashCode() { return Objects.hash(nElements, element); }
        @Override public String toString() { return "v" + nElements + element; }
    }
}
