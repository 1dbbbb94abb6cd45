// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import sh.blockscope.core.types.BlockHeight;

/**
 * The most recent blocks as of one chain-height read, newest first.
 *
 * <p>Invariants, checked on construction:
 * <ul>
 * <li>at most {@link #WINDOW} entries</li>
 * <li>exactly {@code min(WINDOW, tip + 1)} entries</li>
 * <li>the entry at position {@code i} has height {@code tip - i}</li>
 * </ul>
 *
 * <p>Serializes as a bare JSON array of blocks.
 *
 * @param tip    the chain height read at the start of the aggregation
 * @param blocks the blocks, newest first
 */
public record LatestBlocks(@JsonIgnore BlockHeight tip, @JsonValue List<Block> blocks) {

    /** Number of blocks in a full window. */
    public static final int WINDOW = 10;

    public LatestBlocks {
        Objects.requireNonNull(tip, "tip");
        Objects.requireNonNull(blocks, "blocks");
        blocks = List.copyOf(blocks);

        final long expected = expectedSize(tip);
        if (blocks.size() != expected) {
            throw new IllegalArgumentException(
                    "expected " + expected + " blocks below tip " + tip + " but got " + blocks.size());
        }
        for (int i = 0; i < blocks.size(); i++) {
            final long height = blocks.get(i).height();
            if (height != tip.value() - i) {
                throw new IllegalArgumentException(
                        "block at position " + i + " has height " + height + ", expected " + (tip.value() - i));
            }
        }
    }

    /**
     * Number of blocks a window ending at {@code tip} holds: fewer than
     * {@link #WINDOW} only near genesis.
     *
     * @param tip the newest height
     * @return {@code min(WINDOW, tip + 1)}
     */
    public static int expectedSize(final BlockHeight tip) {
        return (int) Math.min(WINDOW, tip.value() + 1);
    }

    public int size() {
        return blocks.size();
    }
}
