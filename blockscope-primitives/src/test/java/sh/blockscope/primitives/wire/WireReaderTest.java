// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.primitives.wire;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import sh.blockscope.primitives.Hex;

class WireReaderTest {

    @Test
    @DisplayName("Little-endian integers")
    void readsLittleEndianIntegers() {
        WireReader reader = new WireReader(Hex.decode("0100" + "02000000" + "00f2052a01000000"));

        assertEquals(1, reader.readUInt16());
        assertEquals(2L, reader.readUInt32());
        assertEquals(5_000_000_000L, reader.readInt64());
        assertFalse(reader.hasRemaining());
    }

    @Test
    void readsUnsignedUInt32AboveIntRange() {
        WireReader reader = new WireReader(Hex.decode("ffffffff"));
        assertEquals(0xFFFFFFFFL, reader.readUInt32());
    }

    @Test
    @DisplayName("CompactSize boundaries")
    void readsCompactSizeForms() {
        assertEquals(0xFC, new WireReader(Hex.decode("fc")).readCompactSize());
        assertEquals(0xFD, new WireReader(Hex.decode("fdfd00")).readCompactSize());
        assertEquals(0x10000, new WireReader(Hex.decode("fe00000100")).readCompactSize());
        assertEquals(1, new WireReader(Hex.decode("ff0100000000000000")).readCompactSize());
    }

    @Test
    void rejectsCompactSizeBeyondIntRange() {
        WireReader reader = new WireReader(Hex.decode("ff0000000001000000"));
        assertThrows(WireFormatException.class, reader::readCompactSize);
    }

    @Test
    void skipVarBytesConsumesPrefixAndPayload() {
        WireReader reader = new WireReader(Hex.decode("03aabbccdd"));
        reader.skipVarBytes();
        assertEquals(4, reader.position());
        assertEquals(0xDD, reader.peek());
    }

    @Test
    void sliceCopiesConsumedRange() {
        WireReader reader = new WireReader(Hex.decode("0102030405"));
        reader.skip(4);
        assertArrayEquals(Hex.decode("0203"), reader.slice(1, 3));
        assertThrows(WireFormatException.class, () -> reader.slice(2, 5));
    }

    @Test
    void truncatedInputFails() {
        WireReader reader = new WireReader(Hex.decode("0100"));
        WireFormatException ex = assertThrows(WireFormatException.class, reader::readUInt32);
        assertTrue(ex.getMessage().contains("unexpected end of data"));
        assertEquals(0, reader.position());
    }

    @Test
    void readBytesCopiesAndAdvances() {
        WireReader reader = new WireReader(Hex.decode("aabbccdd"));

        assertArrayEquals(Hex.decode("aabb"), reader.readBytes(2));
        assertEquals(2, reader.position());
        assertThrows(WireFormatException.class, () -> reader.readBytes(3));
        assertThrows(WireFormatException.class, () -> reader.readBytes(-1));
    }
}
