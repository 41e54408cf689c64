package com.iterharness.client.rpc;

/**
 * First chunk read from the server-sent-events endpoint.
 *
 * @param raw         text read before the stream was closed
 * @param endpointUrl URL announced by the {@code endpoint} event
 */
public record SseHandshake(String raw, String endpointUrl) {}
