package com.iterharness.client.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON-RPC 2.0 response envelope. Exactly one of {@code result} and {@code error} is set in a
 * well-formed response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProtocolResponse(String jsonrpc, JsonNode id, JsonNode result, ProtocolError error) {

    public boolean isError() {
        return error != null;
    }

    /**
     * An explicit {@code "result": null} counts as present; only an absent field does not.
     */
    boolean hasResult() {
        return result != null;
    }
}
