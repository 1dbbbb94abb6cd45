// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.primitives.wire;

import java.util.Arrays;
import java.util.Objects;

/**
 * Sequential reader over Bitcoin's wire serialization.
 *
 * <p>Integers on the wire are little-endian. Variable-length counts use the
 * CompactSize encoding:
 * <ul>
 * <li>{@code 0x00-0xfc}: the value itself (1 byte)</li>
 * <li>{@code 0xfd}: followed by a uint16</li>
 * <li>{@code 0xfe}: followed by a uint32</li>
 * <li>{@code 0xff}: followed by a uint64</li>
 * </ul>
 *
 * <p>The reader does not copy the backing array; callers must not mutate it while
 * reading. Instances are not thread-safe.
 *
 * @see <a href="https://en.bitcoin.it/wiki/Protocol_documentation#Variable_length_integer">Variable
 *      length integer</a>
 */
public final class WireReader {

    private final byte[] data;
    private int position;

    public WireReader(final byte[] data) {
        this.data = Objects.requireNonNull(data, "data cannot be null");
    }

    public int position() {
        return position;
    }

    public int remaining() {
        return data.length - position;
    }

    public boolean hasRemaining() {
        return position < data.length;
    }

    /**
     * Returns the byte at the current position without consuming it.
     *
     * @return the unsigned byte value
     * @throws WireFormatException if no bytes remain
     */
    public int peek() {
        require(1);
        return data[position] & 0xFF;
    }

    public int readUInt8() {
        require(1);
        return data[position++] & 0xFF;
    }

    public int readUInt16() {
        require(2);
        final int value = (data[position] & 0xFF) | ((data[position + 1] & 0xFF) << 8);
        position += 2;
        return value;
    }

    public long readUInt32() {
        require(4);
        final long value = (data[position] & 0xFFL)
                | ((data[position + 1] & 0xFFL) << 8)
                | ((data[position + 2] & 0xFFL) << 16)
                | ((data[position + 3] & 0xFFL) << 24);
        position += 4;
        return value;
    }

    public long readInt64() {
        require(8);
        long value = 0;
        for (int i = 7; i >= 0; i--) {
            value = (value << 8) | (data[position + i] & 0xFFL);
        }
        position += 8;
        return value;
    }

    /**
     * Reads a CompactSize unsigned integer.
     *
     * <p>Values that would not fit a Java {@code int} are rejected, since every
     * count in a transaction is bounded by the size of the transaction itself.
     *
     * @return the decoded value
     * @throws WireFormatException if the value is truncated or larger than
     *                             {@link Integer#MAX_VALUE}
     */
    public int readCompactSize() {
        final int first = readUInt8();
        final long value;
        if (first < 0xFD) {
            value = first;
        } else if (first == 0xFD) {
            value = readUInt16();
        } else if (first == 0xFE) {
            value = readUInt32();
        } else {
            value = readInt64();
        }
        if (value < 0 || value > Integer.MAX_VALUE) {
            throw new WireFormatException("CompactSize out of range at offset " + (position - 1));
        }
        return (int) value;
    }

    public byte[] readBytes(final int length) {
        if (length < 0) {
            throw new WireFormatException("negative length: " + length);
        }
        require(length);
        final byte[] out = Arrays.copyOfRange(data, position, position + length);
        position += length;
        return out;
    }

    public void skip(final int length) {
        if (length < 0) {
            throw new WireFormatException("negative length: " + length);
        }
        require(length);
        position += length;
    }

    /**
     * Reads a CompactSize length prefix and skips that many bytes.
     */
    public void skipVarBytes() {
        skip(readCompactSize());
    }

    /**
     * Copies a range of the underlying data that has already been read.
     *
     * @param from start offset, inclusive
     * @param to   end offset, exclusive; must not exceed {@link #position()}
     * @return the copied bytes
     */
    public byte[] slice(final int from, final int to) {
        if (from < 0 || to < from || to > position) {
            throw new WireFormatException("invalid slice [" + from + ", " + to + ") at position " + position);
        }
        return Arrays.copyOfRange(data, from, to);
    }

    private void require(final int length) {
        if (length > data.length - position) {
            throw new WireFormatException(
                    "unexpected end of data: need " + length + " bytes at offset " + position
                            + " but only " + (data.length - position) + " remain");
        }
    }
}
