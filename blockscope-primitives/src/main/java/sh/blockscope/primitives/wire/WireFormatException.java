// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.primitives.wire;

/**
 * Thrown when bytes do not follow Bitcoin's wire serialization.
 */
public final class WireFormatException extends IllegalArgumentException {

    public WireFormatException(final String message) {
        super(message);
    }
}
