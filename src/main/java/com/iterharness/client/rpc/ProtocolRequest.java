package com.iterharness.client.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * JSON-RPC 2.0 request envelope. {@code params} is omitted from the wire form when null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"jsonrpc", "id", "method", "params"})
public record ProtocolRequest(String jsonrpc, long id, String method, Object params) {

    public static final String VERSION = "2.0";

    public static ProtocolRequest of(long id, String method, Object params) {
        return new ProtocolRequest(VERSION, id, method, params);
    }
}
