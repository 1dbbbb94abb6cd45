// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.server;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import sh.blockscope.core.model.Block;
import sh.blockscope.core.types.BlockHash;
import sh.blockscope.core.types.TxId;

/**
 * Deterministic chain data shared by server tests.
 */
public final class TestChain {

    public static final String GENESIS_HASH = "000000000019d6689c085ae165831e934ff763ae46a2a6c172b3f1b60a8ce26f";

    public static final String GENESIS_COINBASE_TXID =
            "4a5e1e4baab89f3a32518a88c31bc87f618f76673e2cc77ab2127b7afdeda33b";

    public static final String GENESIS_COINBASE_HEX =
            "01000000010000000000000000000000000000000000000000000000000000000000000000ffffffff4d04ffff001d0104"
                    + "455468652054696d65732030332f4a616e2f32303039204368616e63656c6c6f72206f6e206272696e6b206f66"
                    + "207365636f6e64206261696c6f757420666f722062616e6b73ffffffff0100f2052a01000000434104678afdb0fe"
                    + "5548271967f1a67130b7105cd6a828e03909a67962e0ea1f61deb649f6bc3f4cef38c4f35504e51ec112de5c384df7"
                    + "ba0b8d578a4c702b6bf11d5fac00000000";

    private TestChain() {
    }

    /** Hash of the block at {@code height}; the real genesis hash at 0. */
    public static String hashAt(final long height) {
        return height == 0 ? GENESIS_HASH : String.format("%064x", 0xb10c_0000L + height);
    }

    public static Block blockAt(final long height, final long tip) {
        return new Block(
                new BlockHash(hashAt(height)),
                tip - height + 1,
                height,
                0x20000000L,
                "20000000",
                GENESIS_COINBASE_TXID,
                1_231_006_505L + height * 600,
                1_231_006_505L + height * 600 - 3600,
                height * 7,
                "1d00ffff",
                BigDecimal.ONE,
                String.format("%064x", height + 1),
                1,
                height == 0 ? null : new BlockHash(hashAt(height - 1)),
                height == tip ? null : new BlockHash(hashAt(height + 1)),
                285L,
                285L,
                1140L,
                List.of(new TxId(GENESIS_COINBASE_TXID)));
    }

    /** The block as the node's {@code getblock} verbosity 1 returns it. */
    public static Map<String, Object> blockJson(final long height, final long tip) {
        final Map<String, Object> json = new LinkedHashMap<>();
        json.put("hash", hashAt(height));
        json.put("confirmations", tip - height + 1);
        json.put("height", height);
        json.put("version", 536870912);
        json.put("versionHex", "20000000");
        json.put("merkleroot", GENESIS_COINBASE_TXID);
        json.put("time", 1_231_006_505L + height * 600);
        json.put("nonce", height * 7);
        json.put("bits", "1d00ffff");
        json.put("difficulty", new BigDecimal("95672703408223.94"));
        json.put("nTx", 1);
        if (height > 0) {
            json.put("previousblockhash", hashAt(height - 1));
        }
        if (height < tip) {
            json.put("nextblockhash", hashAt(height + 1));
        }
        json.put("tx", List.of(GENESIS_COINBASE_TXID));
        return json;
    }

    /** The genesis coinbase as {@code getrawtransaction [txid, true]} returns it. */
    public static Map<String, Object> coinbaseJson() {
        final Map<String, Object> json = new LinkedHashMap<>();
        json.put("txid", GENESIS_COINBASE_TXID);
        json.put("hash", GENESIS_COINBASE_TXID);
        json.put("version", 1);
        json.put("size", 204);
        json.put("vsize", 204);
        json.put("weight", 816);
        json.put("locktime", 0);
        json.put("vin", List.of(Map.of(
                "coinbase", "04ffff001d0104",
                "sequence", 4294967295L)));
        json.put("vout", List.of(Map.of(
                "value", new BigDecimal("50.00000000"),
                "n", 0,
                "scriptPubKey", Map.of("hex", "4104678a", "type", "pubkey"))));
        json.put("hex", GENESIS_COINBASE_HEX);
        json.put("blockhash", GENESIS_HASH);
        json.put("confirmations", 850000);
        json.put("time", 1231006505);
        json.put("blocktime", 1231006505);
        return json;
    }
}
