package org.ruuvigateway.decode;

/**
 * Strict hexadecimal codec: even length, {@code [0-9a-fA-F]} only, no separators or whitespace.
 */
public final class HexCodec {

    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private HexCodec() {
    }

    /**
     * @throws IllegalArgumentException on odd length or a non-hex character
     */
    public static byte[] decode(String hex) {
        int len = hex.length();
        if ((len & 1) != 0) {
            throw new IllegalArgumentException("odd number of hex digits: " + len);
        }
        byte[] out = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            out[i / 2] = (byte) ((digit(hex, i) << 4) | digit(hex, i + 1));
        }
        return out;
    }

    /** Lower-case hex of {@code bytes}. */
    public static String encode(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            out[2 * i] = DIGITS[(bytes[i] >> 4) & 0x0F];
            out[2 * i + 1] = DIGITS[bytes[i] & 0x0F];
        }
        return new String(out);
    }

    // Character.digit would also accept non-ASCII digits
    private static int digit(String hex, int index) {
        char c = hex.charAt(index);
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        throw new IllegalArgumentException("non-hex character '" + c + "' at index " + index);
    }
}
