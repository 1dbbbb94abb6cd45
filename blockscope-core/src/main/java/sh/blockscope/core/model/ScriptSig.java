// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Unlocking script of a transaction input.
 *
 * @param asm disassembled script
 * @param hex raw script bytes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScriptSig(String asm, String hex) {}
