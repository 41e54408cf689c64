package com.iterharness.container;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iterharness.client.rpc.ProtocolClient;
import com.iterharness.client.rpc.ProtocolRequest;
import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;

/**
 * Shell scripts a driver container runs to talk to the service over the test network.
 *
 * <p>Payloads are serialized on the host and passed to {@code curl} as single-quoted literals,
 * so nothing in them is expanded by the container shell.
 */
public final class DriverCommands {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int PROBE_TIMEOUT_SECONDS = 5;

    private DriverCommands() {}

    /**
     * A JSON-RPC call to {@code {baseUrl}/mcp/v1}; prints the response body.
     */
    public static String jsonRpc(String baseUrl, long id, String method, Object params) {
        String payload = toJson(ProtocolRequest.of(id, method, params));
        return "curl -s -X POST -H 'Content-Type: application/json' -d " + quote(payload)
                + " " + quote(baseUrl + ProtocolClient.RPC_PATH);
    }

    /**
     * A REST call; {@code body} may be null for requests without one.
     */
    public static String rest(String method, String url, Object body) {
        var sb = new StringBuilder("curl -s -X ").append(method);
        if (body != null) {
            String json = body instanceof String s ? s : toJson(body);
            sb.append(" -H 'Content-Type: application/json' -d ").append(quote(json));
        }
        return sb.append(' ').append(quote(url)).toString();
    }

    /**
     * Fetches {@code http://{alias}:{port}/health}, failing with a non-zero exit status when the
     * alias does not resolve or the service does not answer 2xx.
     */
    public static String probeAlias(String alias, int port) {
        return "curl -sf --max-time " + PROBE_TIMEOUT_SECONDS + " "
                + quote("http://" + alias + ":" + port + "/health");
    }

    /**
     * Wraps {@code value} in single quotes for POSIX shells.
     */
    public static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new HarnessException(ErrorKind.REQUEST_FAILED, "Failed to serialize driver payload", e);
        }
    }
}
