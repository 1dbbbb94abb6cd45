// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.rpc;

import java.util.List;
import java.util.Objects;

import sh.blockscope.core.error.RpcException;
import sh.blockscope.core.model.Block;
import sh.blockscope.core.model.Transaction;
import sh.blockscope.core.types.BlockHash;
import sh.blockscope.core.types.BlockHeight;
import sh.blockscope.core.types.TxId;
import sh.blockscope.rpc.internal.RpcInvoker;

/**
 * Default {@link NodeReader} backed by a {@link BitcoinProvider}.
 */
final class DefaultNodeReader implements NodeReader {

    /** {@code getblock} verbosity returning decoded fields with txids only. */
    static final int BLOCK_VERBOSITY = 1;

    private final RpcInvoker invoker;

    DefaultNodeReader(final BitcoinProvider provider) {
        Objects.requireNonNull(provider, "provider");
        this.invoker = new RpcInvoker(provider::send);
    }

    @Override
    public Block getBlock(final BlockHash hash) throws RpcException {
        return invoker.call("getblock", List.of(hash.value(), BLOCK_VERBOSITY), Block.class);
    }

    @Override
    public Transaction getRawTransaction(final TxId txid) throws RpcException {
        return invoker.call("getrawtransaction", List.of(txid.value(), true), Transaction.class);
    }

    @Override
    public BlockHeight getBlockCount() throws RpcException {
        return invoker.call("getblockcount", List.of(), result -> new BlockHeight(((Number) result).longValue()));
    }

    @Override
    public BlockHash getBlockHash(final BlockHeight height) throws RpcException {
        return invoker.call("getblockhash", List.of(height.value()), result -> new BlockHash((String) result));
    }
}
