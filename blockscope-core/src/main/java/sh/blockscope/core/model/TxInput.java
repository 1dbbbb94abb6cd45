// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

import sh.blockscope.core.types.TxId;

/**
 * A transaction input.
 *
 * <p>Either spends a prior output ({@code txid} + {@code vout}) or, for the first
 * transaction of a block, carries the {@code coinbase} data instead.
 *
 * @param coinbase    coinbase script hex; present only on coinbase inputs
 * @param txid        id of the transaction whose output is spent
 * @param vout        index of the spent output
 * @param scriptSig   unlocking script
 * @param txinwitness witness stack items, hex
 * @param sequence    sequence number
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TxInput(
        @Nullable String coinbase,
        @Nullable TxId txid,
        @Nullable Long vout,
        @Nullable ScriptSig scriptSig,
        @Nullable List<String> txinwitness,
        @Nullable Long sequence) {

    public TxInput {
        if (coinbase == null && txid == null) {
            throw new IllegalArgumentException("input must reference a prior output or be a coinbase");
        }
        txinwitness = txinwitness == null ? null : List.copyOf(txinwitness);
    }
}
