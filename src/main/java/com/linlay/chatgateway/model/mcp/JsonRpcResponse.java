package com.linlay.chatgateway.model.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON-RPC 2.0 response envelope. Absent members are omitted, so a transport-level error carries no id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcResponse(
        String jsonrpc,
        JsonNode id,
        Object result,
        JsonRpcError error
) {

    public static final String VERSION = "2.0";

    public static JsonRpcResponse success(JsonNode id, Object result) {
        return new JsonRpcResponse(VERSION, id, result, null);
    }

    public static JsonRpcResponse failure(JsonNode id, int code, String message, Object data) {
        return new JsonRpcResponse(VERSION, id, null, new JsonRpcError(code, message, data));
    }
}
