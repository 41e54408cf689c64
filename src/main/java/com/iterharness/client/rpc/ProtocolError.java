package com.iterharness.client.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON-RPC 2.0 error object.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProtocolError(int code, String message, JsonNode data) {}
