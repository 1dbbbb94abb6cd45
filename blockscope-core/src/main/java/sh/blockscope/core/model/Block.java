// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core.model;

import java.math.BigDecimal;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import sh.blockscope.core.types.BlockHash;
import sh.blockscope.core.types.TxId;

/**
 * A block as decoded by the node's {@code getblock} (verbosity 1).
 *
 * <p>Component names match the node's JSON field names and are serialized under the
 * same names, so the public representation is the node's own decode. Nothing here
 * is recomputed.
 *
 * @param hash              the block hash
 * @param confirmations     confirmations at the time of the call; {@code -1} when the
 *                          block is not on the active chain
 * @param height            height on the node's chain
 * @param version           block version
 * @param versionHex        block version as hex
 * @param merkleroot        merkle root of the included transactions
 * @param time              header timestamp (seconds since epoch)
 * @param mediantime        median time past
 * @param nonce             header nonce
 * @param bits              compact difficulty target
 * @param difficulty        difficulty
 * @param chainwork         cumulative chain work, hex
 * @param nTx               number of transactions
 * @param previousblockhash parent hash, absent for genesis
 * @param nextblockhash     child hash, absent at the tip
 * @param strippedsize      size without witness data
 * @param size              serialized size in bytes
 * @param weight            block weight
 * @param tx                ids of the included transactions, coinbase first
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Block(
        BlockHash hash,
        @Nullable Long confirmations,
        long height,
        @Nullable Long version,
        @Nullable String versionHex,
        @Nullable String merkleroot,
        @Nullable Long time,
        @Nullable Long mediantime,
        @Nullable Long nonce,
        @Nullable String bits,
        @Nullable BigDecimal difficulty,
        @Nullable String chainwork,
        @JsonProperty("nTx") @Nullable Integer nTx,
        @Nullable BlockHash previousblockhash,
        @Nullable BlockHash nextblockhash,
        @Nullable Long strippedsize,
        @Nullable Long size,
        @Nullable Long weight,
        @Nullable List<TxId> tx) {

    public Block {
        if (hash == null) {
            throw new IllegalArgumentException("block is missing 'hash'");
        }
        tx = tx == null ? null : List.copyOf(tx);
    }
}
