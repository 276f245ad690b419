package org.masmtext;

public final class HexUtils {
    private HexUtils() {}

    /** First {@code max} bytes as uppercase hex pairs, no separators, "+" if more were cut. */
    public static String opcodeBytes(byte[] code, int max) {
        int n = Math.min(code.length, Math.max(max, 0));
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) {
            sb.append(String.format("%02X", code[i]));
        }
        if (code.length > n) sb.append('+');
        return sb.toString();
    }

    public static byte[] parseHex(String hex) {
        String s = hex.replace(" ", "");
        if (s.length() % 2 != 0)
            throw new IllegalArgumentException("odd number of hex digits: " + hex);
        byte[] out = new byte[s.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(s.charAt(2 * i), 16);
            int lo = Character.digit(s.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) throw new IllegalArgumentException("not hex: " + hex);
            out[i] = (byte) (hi << 4 | lo);
        }
        return out;
    }
}
