// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.primitives;

import java.util.Arrays;

/**
 * Utility methods for hex encoding/decoding.
 *
 * <p>Bitcoin nodes print hashes and raw serializations as bare hex, so nothing here
 * accepts or produces a {@code 0x} prefix.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        Arrays.fill(NIBBLE_LOOKUP, -1);

        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }

        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Convert a hex string into a byte array.
     *
     * @param hexString the string to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null, has an odd number of
     *                                  characters, or contains invalid hex
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        if ((hexString.length() & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString.length());
        }

        final byte[] result = new byte[hexString.length() / 2];
        for (int i = 0; i < result.length; i++) {
            final int high = toNibble(hexString.charAt(i * 2));
            final int low = toNibble(hexString.charAt(i * 2 + 1));
            result[i] = (byte) ((high << 4) | low);
        }
        return result;
    }

    /**
     * Encode bytes in reverse order, lowercase.
     *
     * <p>Bitcoin hashes are computed over little-endian bytes but displayed
     * big-endian, so a raw double-SHA-256 digest must be reversed before it can be
     * compared with a txid or block hash reported by a node.
     *
     * @param bytes the bytes to encode
     * @return hex string of the reversed bytes
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encodeReversed(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }

        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[bytes.length - 1 - i] & 0xFF;
            chars[i * 2] = HEX_CHARS[v >>> 4];
            chars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Returns {@code true} when every character of {@code value} is a hex digit
     * and the string has exactly {@code length} characters.
     *
     * @param value  the candidate string, may be null
     * @param length the required number of hex characters
     * @return whether the string is hex of that exact length
     */
    public static boolean isHexOfLength(final String value, final int length) {
        if (value == null || value.length() != length) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (!isHexChar(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isHexChar(final char c) {
        return c < NIBBLE_LOOKUP.length && NIBBLE_LOOKUP[c] != -1;
    }

    private static int toNibble(final char c) {
        if (!isHexChar(c)) {
            throw new IllegalArgumentException("invalid hex character: '" + c + "'");
        }
        return NIBBLE_LOOKUP[c];
    }
}
