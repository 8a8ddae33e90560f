package com.linlay.chatgateway.mcp;

/**
 * A JSON-RPC level failure answered with an error object instead of a result.
 */
public class McpProtocolException extends RuntimeException {

    private final int code;
    private final transient Object data;

    public McpProtocolException(int code, String message) {
        this(code, message, null);
    }

    public McpProtocolException(int code, String message, Object data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public int getCode() {
        return code;
    }

    public Object getData() {
        return data;
    }
}
