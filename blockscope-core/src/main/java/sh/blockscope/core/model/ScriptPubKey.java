// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * Locking script of a transaction output and the destination the node derived from it.
 *
 * @param asm       disassembled script
 * @param desc      output descriptor (newer nodes only)
 * @param hex       raw script bytes
 * @param type      script template, e.g. {@code witness_v0_keyhash}, {@code nulldata}
 * @param address   destination address; absent for scripts without one
 * @param addresses destination addresses as reported by older nodes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScriptPubKey(
        @Nullable String asm,
        @Nullable String desc,
        @Nullable String hex,
        @Nullable String type,
        @Nullable String address,
        @Nullable List<String> addresses) {

    public ScriptPubKey {
        addresses = addresses == null ? null : List.copyOf(addresses);
    }
}
