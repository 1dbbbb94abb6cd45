// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core.types;

import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import sh.blockscope.primitives.Hex;

/**
 * Transaction identifier: 64 hex characters, normalized to lowercase.
 * <p>
 * Same shape as {@link BlockHash}, kept as a separate type so a txid can never be
 * passed where a block hash is expected.
 */
public record TxId(@JsonValue String value) {

    public TxId {
        Objects.requireNonNull(value, "txid");
        if (!Hex.isHexOfLength(value, BlockHash.HEX_LENGTH)) {
            throw new IllegalArgumentException("Invalid txid: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TxId of(final String value) {
        return new TxId(value);
    }

    public static boolean isValid(final String candidate) {
        return Hex.isHexOfLength(candidate, BlockHash.HEX_LENGTH);
    }

    @Override
    public String toString() {
        return value;
    }
}
