package org.masmtext;

import java.util.Optional;

/**
 * Hex text for fixed-width immediates.
 * <p>
 * A value is printed negative only when its sign bit is set and at least one lower bit is
 * set, so the most negative value of a width (8-bit {@code 0x80}) prints as {@code 0x80}.
 * 32- and 64-bit values that match a label print as the label.
 */
public final class IntegerLiteralFormatter {
    private IntegerLiteralFormatter() {}

    public static String format(long rawValue, int widthBits, LabelMap labels) {
        long mask = mask(widthBits);
        long v = rawValue & mask;

        if (widthBits == 32 || widthBits == 64) {
            Optional<String> label = LabelResolver.resolve(v, labels);
            if (label.isPresent()) return label.get();
        }

        long signBit = 1L << (widthBits - 1);
        long lowerBits = signBit - 1;
        if ((v & signBit) != 0 && (v & lowerBits) != 0) {
            return "-0x" + Long.toHexString((~v + 1) & mask);
        }
        return "0x" + Long.toHexString(v);
    }

    public static String format(Expr.IntValue value, LabelMap labels) {
        return format(value.bits, value.width, labels);
    }

    /**
     * Offset text inside a normalized address: always signed, decided by the sign bit alone,
     * never substituted by a label.
     */
    static String signedOffset(Expr.IntValue offset) {
        boolean neg = offset.signBit();
        long s = offset.signedValue();
        return (neg ? "-" : "+") + "0x" + Long.toHexString(neg ? -s : s);
    }

    private static long mask(int widthBits) {
        switch (widthBits) {
            case 8: return 0xffL;
            case 16: return 0xffffL;
            case 32: return 0xffffffffL;
            case 64: return -1L;
            default:
                throw new UnparseException("unsupported integer width: " + widthBits);
        }
    }
}
