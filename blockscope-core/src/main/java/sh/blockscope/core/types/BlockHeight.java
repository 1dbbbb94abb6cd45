// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Non-negative block height. Genesis is height 0.
 */
public record BlockHeight(@JsonValue long value) {

    public BlockHeight {
        if (value < 0) {
            throw new IllegalArgumentException("Block height cannot be negative: " + value);
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static BlockHeight of(final long value) {
        return new BlockHeight(value);
    }

    /**
     * Returns the height {@code distance} blocks below this one.
     *
     * @param distance how many blocks to step back
     * @return the lower height
     * @throws IllegalArgumentException if the result would precede genesis
     */
    public BlockHeight minus(final long distance) {
        return new BlockHeight(value - distance);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
