package org.masmtext;

import com.fasterxml.jackson.databind.JsonNode;

/** Unsigned 64-bit values in listing JSON: plain numbers or "0x"-prefixed hex strings. */
final class JsonNumbers {
    private JsonNumbers() {}

    static long parseUnsigned(String text) {
        String s = text.trim();
        try {
            if (s.startsWith("0x") || s.startsWith("0X")) {
                return Long.parseUnsignedLong(s.substring(2), 16);
            }
            if (s.startsWith("-")) {
                return Long.parseLong(s);
            }
            return Long.parseUnsignedLong(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad number: " + text, e);
        }
    }

    static long parseUnsigned(JsonNode node, String field) {
        if (node == null || node.isNull() || node.isMissingNode())
            throw new IllegalArgumentException("missing field: " + field);
        if (node.isIntegralNumber()) {
            // BigInteger covers values above Long.MAX_VALUE
            java.math.BigInteger v = node.bigIntegerValue();
            if (v.signum() >= 0 ? v.bitLength() > 64 : v.bitLength() > 63)
                throw new IllegalArgumentException("field " + field + " does not fit in 64 bits: " + node);
            return v.longValue();
        }
        if (node.isTextual()) {
            return parseUnsigned(node.asText());
        }
        throw new IllegalArgumentException("field " + field + " is not a number: " + node);
    }
}
