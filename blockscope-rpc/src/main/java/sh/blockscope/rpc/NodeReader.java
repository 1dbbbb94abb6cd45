// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.rpc;

import sh.blockscope.core.error.RpcException;
import sh.blockscope.core.model.Block;
import sh.blockscope.core.model.Transaction;
import sh.blockscope.core.types.BlockHash;
import sh.blockscope.core.types.BlockHeight;
import sh.blockscope.core.types.TxId;

/**
 * Typed read operations against a Bitcoin node.
 *
 * <p>Every method performs exactly one RPC call. A {@code null} result or a
 * result that does not map onto the model is an {@link RpcException} of kind
 * {@link RpcException.Kind#DECODE}.
 */
public interface NodeReader {

    /** {@code getblock [hash, 1]} */
    Block getBlock(BlockHash hash) throws RpcException;

    /** {@code getrawtransaction [txid, true]} */
    Transaction getRawTransaction(TxId txid) throws RpcException;

    /** {@code getblockcount []} */
    BlockHeight getBlockCount() throws RpcException;

    /** {@code getblockhash [height]} */
    BlockHash getBlockHash(BlockHeight height) throws RpcException;

    static NodeReader from(final BitcoinProvider provider) {
        return new DefaultNodeReader(provider);
    }
}
