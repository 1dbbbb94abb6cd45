// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core.tx;

import java.io.ByteArrayOutputStream;

import sh.blockscope.core.crypto.Sha256;
import sh.blockscope.core.types.TxId;
import sh.blockscope.primitives.Hex;
import sh.blockscope.primitives.wire.WireFormatException;
import sh.blockscope.primitives.wire.WireReader;

/**
 * Derives transaction identifiers from raw serialized transactions.
 *
 * <p>Layout of a serialized transaction:
 * <pre>
 * version(4) [marker(1)=0x00 flag(1)!=0x00] vin_count vin* vout_count vout* [witness*] locktime(4)
 * </pre>
 * The txid commits to everything except marker, flag and witness data.
 *
 * @see <a href="https://github.com/bitcoin/bips/blob/master/bip-0144.mediawiki">BIP 144</a>
 */
public final class RawTransactions {

    private static final int VERSION_SIZE = 4;
    private static final int LOCKTIME_SIZE = 4;
    private static final int OUTPOINT_SIZE = 32 + 4;
    private static final int SEQUENCE_SIZE = 4;
    private static final int VALUE_SIZE = 8;

    private RawTransactions() {
    }

    /**
     * Computes the txid of a raw transaction.
     *
     * @param rawHex the transaction serialization as hex, as found in the node's
     *               {@code hex} field
     * @return the txid in display byte order
     * @throws WireFormatException      if the bytes are not a well-formed transaction
     * @throws IllegalArgumentException if {@code rawHex} is not hex
     */
    public static TxId txid(final String rawHex) {
        return new TxId(Hex.encodeReversed(Sha256.doubleHash(stripWitness(Hex.decode(rawHex)))));
    }

    /**
     * Returns the legacy serialization of a transaction, dropping segwit marker,
     * flag and witnesses when present.
     *
     * @param raw serialized transaction
     * @return the serialization the txid commits to
     * @throws WireFormatException if the bytes are not a well-formed transaction
     */
    static byte[] stripWitness(final byte[] raw) {
        final WireReader reader = new WireReader(raw);
        reader.skip(VERSION_SIZE);

        boolean segwit = false;
        if (reader.remaining() >= 2 && reader.peek() == 0x00) {
            reader.readUInt8();
            if (reader.readUInt8() == 0x00) {
                throw new WireFormatException("segwit flag must be non-zero");
            }
            segwit = true;
        }

        final int bodyStart = reader.position();
        final int inputCount = reader.readCompactSize();
        for (int i = 0; i < inputCount; i++) {
            reader.skip(OUTPOINT_SIZE);
            reader.skipVarBytes();
            reader.skip(SEQUENCE_SIZE);
        }
        final int outputCount = reader.readCompactSize();
        for (int i = 0; i < outputCount; i++) {
            reader.skip(VALUE_SIZE);
            reader.skipVarBytes();
        }
        final int bodyEnd = reader.position();

        if (segwit) {
            for (int i = 0; i < inputCount; i++) {
                final int items = reader.readCompactSize();
                for (int j = 0; j < items; j++) {
                    reader.skipVarBytes();
                }
            }
        }

        final int locktimeStart = reader.position();
        reader.skip(LOCKTIME_SIZE);
        if (reader.hasRemaining()) {
            throw new WireFormatException(reader.remaining() + " trailing bytes after locktime");
        }

        if (!segwit) {
            return raw;
        }

        final ByteArrayOutputStream out = new ByteArrayOutputStream(raw.length);
        out.write(raw, 0, VERSION_SIZE);
        out.write(raw, bodyStart, bodyEnd - bodyStart);
        out.write(raw, locktimeStart, LOCKTIME_SIZE);
        return out.toByteArray();
    }
}
