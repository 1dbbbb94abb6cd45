// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.rpc;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcRequest(String jsonrpc, String method, List<?> params, String id) {}
