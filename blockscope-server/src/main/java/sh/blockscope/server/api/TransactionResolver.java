// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.server.api;

import java.util.Objects;

import sh.blockscope.core.error.ApiException;
import sh.blockscope.core.error.RpcException;
import sh.blockscope.core.model.Transaction;
import sh.blockscope.core.tx.RawTransactions;
import sh.blockscope.core.types.TxId;
import sh.blockscope.rpc.NodeReader;

/**
 * Resolves a client-supplied txid to the node's decoded transaction.
 *
 * <p>When the node includes the raw {@code hex}, the txid is re-derived from it and
 * must equal the requested one.
 */
public final class TransactionResolver {

    public static final String INVALID_TXID = "Invalid transaction id";
    public static final String FETCH_FAILED = "Failed to retrieve transaction information";

    private final NodeReader reader;

    public TransactionResolver(final NodeReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    public Transaction resolve(final String rawTxId) throws ApiException {
        if (!TxId.isValid(rawTxId)) {
            throw ApiException.invalidInput(INVALID_TXID);
        }
        try {
            return fetch(new TxId(rawTxId));
        } catch (RpcException e) {
            throw ApiException.fromRpc(e, FETCH_FAILED);
        }
    }

    Transaction fetch(final TxId txid) throws RpcException {
        final Transaction tx = reader.getRawTransaction(txid);
        if (!txid.equals(tx.txid())) {
            throw RpcException.decode("node returned transaction " + tx.txid() + " for " + txid, null, null, null);
        }
        if (tx.hex() != null) {
            final TxId derived;
            try {
                derived = RawTransactions.txid(tx.hex());
            } catch (IllegalArgumentException e) {
                // WireFormatException for bad structure, plain IllegalArgumentException for non-hex
                throw RpcException.decode("malformed raw transaction " + txid, null, null, e);
            }
            if (!txid.equals(derived)) {
                throw RpcException.decode("raw transaction hashes to " + derived + ", expected " + txid,
                        null, null, null);
            }
        }
        return tx;
    }
}
