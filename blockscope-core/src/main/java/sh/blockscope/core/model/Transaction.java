// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core.model;

import java.math.BigDecimal;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

import sh.blockscope.core.types.BlockHash;
import sh.blockscope.core.types.TxId;

/**
 * A transaction as decoded by the node's verbose {@code getrawtransaction}.
 *
 * <p>Unconfirmed (mempool) transactions carry no {@code blockhash},
 * {@code confirmations}, {@code time} or {@code blocktime}. The {@code fee} is only
 * present when the node can derive it.
 *
 * @param txid          transaction id
 * @param hash          witness transaction id
 * @param version       transaction version
 * @param size          serialized size
 * @param vsize         virtual size
 * @param weight        transaction weight
 * @param locktime      lock time
 * @param vin           inputs
 * @param vout          outputs
 * @param hex           raw serialization
 * @param blockhash     containing block, if confirmed
 * @param confirmations confirmations, if confirmed
 * @param time          block time, if confirmed
 * @param blocktime     block time, if confirmed
 * @param fee           fee in BTC, when available
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Transaction(
        TxId txid,
        @Nullable String hash,
        @Nullable Long version,
        @Nullable Long size,
        @Nullable Long vsize,
        @Nullable Long weight,
        @Nullable Long locktime,
        List<TxInput> vin,
        List<TxOutput> vout,
        @Nullable String hex,
        @Nullable BlockHash blockhash,
        @Nullable Long confirmations,
        @Nullable Long time,
        @Nullable Long blocktime,
        @Nullable BigDecimal fee) {

    public Transaction {
        if (txid == null) {
            throw new IllegalArgumentException("transaction is missing 'txid'");
        }
        vin = vin == null ? List.of() : List.copyOf(vin);
        vout = vout == null ? List.of() : List.copyOf(vout);
    }
}
