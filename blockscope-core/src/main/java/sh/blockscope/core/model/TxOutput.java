// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core.model;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A transaction output.
 *
 * @param value        amount in BTC, exactly as the node printed it
 * @param n            output index
 * @param scriptPubKey locking script and derived destination
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TxOutput(BigDecimal value, int n, ScriptPubKey scriptPubKey) {}
