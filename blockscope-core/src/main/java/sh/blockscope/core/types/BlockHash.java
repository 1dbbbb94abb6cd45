// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core.types;

import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import sh.blockscope.primitives.Hex;

/**
 * Hex-encoded 32-byte block hash, in the byte order nodes display it.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Exactly 64 hex characters, no prefix</li>
 * <li>Case-insensitive; normalized to lowercase</li>
 * </ul>
 */
public record BlockHash(@JsonValue String value) {
    static final int HEX_LENGTH = 64;

    public BlockHash {
        Objects.requireNonNull(value, "block hash");
        if (!Hex.isHexOfLength(value, BlockHash.HEX_LENGTH)) {
            throw new IllegalArgumentException("Invalid block hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static BlockHash of(final String value) {
        return new BlockHash(value);
    }

    /**
     * Checks the shape of a candidate hash without throwing.
     *
     * @param candidate the raw string, may be null
     * @return {@code true} if {@code new BlockHash(candidate)} would succeed
     */
    public static boolean isValid(final String candidate) {
        return Hex.isHexOfLength(candidate, BlockHash.HEX_LENGTH);
    }

    @Override
    public String toString() {
        return value;
    }
}
