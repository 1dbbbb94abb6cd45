// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.server.api;

import java.util.Objects;

import sh.blockscope.core.error.ApiException;
import sh.blockscope.core.error.RpcException;
import sh.blockscope.core.model.Block;
import sh.blockscope.core.types.BlockHash;
import sh.blockscope.rpc.NodeReader;

/**
 * Resolves a client-supplied block hash to the node's block.
 */
public final class BlockResolver {

    public static final String INVALID_HASH = "Invalid block hash";
    public static final String FETCH_FAILED = "Failed to retrieve block information";

    private final NodeReader reader;

    public BlockResolver(final NodeReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    /**
     * Validates {@code rawHash} and fetches the block.
     *
     * @param rawHash the path parameter as received
     * @return the block, fields verbatim from the node
     * @throws ApiException {@code INVALID_INPUT} before any node call if the hash is
     *                      malformed; {@code NOT_FOUND_OR_UPSTREAM} or {@code UPSTREAM}
     *                      if the node call fails
     */
    public Block resolve(final String rawHash) throws ApiException {
        if (!BlockHash.isValid(rawHash)) {
            throw ApiException.invalidInput(INVALID_HASH);
        }
        try {
            return fetch(new BlockHash(rawHash));
        } catch (RpcException e) {
            throw ApiException.fromRpc(e, FETCH_FAILED);
        }
    }

    /**
     * Fetches a block by an already validated hash, without API error translation.
     *
     * @param hash the block hash
     * @return the block
     * @throws RpcException if the node call fails or answers with a different block
     */
    public Block fetch(final BlockHash hash) throws RpcException {
        final Block block = reader.getBlock(hash);
        if (!hash.equals(block.hash())) {
            throw RpcException.decode("node returned block " + block.hash() + " for " + hash, null, null, null);
        }
        return block;
    }
}
