package com.iterharness.client.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iterharness.client.HttpResult;
import com.iterharness.client.HttpTestClient;
import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;
import com.iterharness.core.results.ResultStore;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 client for the service's tool-call protocol at {@code POST /mcp/v1}.
 *
 * <p>Ids are drawn from a per-client counter, so every request made by one test carries a
 * distinct id. A response is validated before it is returned: it must echo the request id,
 * declare {@code "jsonrpc": "2.0"}, and carry either a {@code result} or an {@code error}.
 */
public class ProtocolClient {

    public static final String RPC_PATH = "/mcp/v1";
    public static final String SSE_PATH = "/mcp/sse";
    private static final int SSE_READ_LIMIT = 4096;

    private final HttpTestClient http;
    private final ResultStore results;
    private final Duration timeout;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicLong ids = new AtomicLong();
    private final HttpClient streamClient;

    public ProtocolClient(HttpTestClient http, ResultStore results, Duration timeout) {
        this.http = http;
        this.results = results;
        this.timeout = timeout;
        this.streamClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
    }

    /**
     * Sends a request and returns the envelope, raising if it carries an error object.
     *
     * @throws ProtocolErrorException if the response contains {@code error}
     * @throws HarnessException PROTOCOL_VIOLATION for malformed envelopes
     */
    public ProtocolResponse call(String method, Object params) {
        var response = send(method, params);
        if (response.isError()) {
            throw new ProtocolErrorException(method, response.error());
        }
        return response;
    }

    /**
     * Sends a request and returns the envelope as-is, error included.
     */
    public ProtocolResponse send(String method, Object params) {
        var request = ProtocolRequest.of(ids.incrementAndGet(), method, params);
        HttpResult result = http.post(RPC_PATH, serialize(request));
        if (!result.isSuccess()) {
            throw new HarnessException(ErrorKind.REQUEST_FAILED,
                    method + " returned HTTP " + result.status() + ": " + result.body());
        }
        return decode(request, result.body());
    }

    ProtocolResponse decode(ProtocolRequest request, String body) {
        ProtocolResponse response;
        try {
            response = objectMapper.readValue(body, ProtocolResponse.class);
        } catch (IOException e) {
            throw new HarnessException(ErrorKind.PROTOCOL_VIOLATION,
                    "Unparseable response to " + request.method() + " (body: " + body + ")", e);
        }
        if (!ProtocolRequest.VERSION.equals(response.jsonrpc())) {
            throw new HarnessException(ErrorKind.PROTOCOL_VIOLATION,
                    "Response to " + request.method() + " has jsonrpc=" + response.jsonrpc());
        }
        if (response.id() == null || !response.id().canConvertToLong() || response.id().asLong() != request.id()) {
            throw new HarnessException(ErrorKind.PROTOCOL_VIOLATION,
                    "Response id " + response.id() + " does not match request id " + request.id());
        }
        if (!response.hasResult() && !response.isError()) {
            throw new HarnessException(ErrorKind.PROTOCOL_VIOLATION,
                    "Response to " + request.method() + " has neither result nor error");
        }
        return response;
    }

    // -- convenience calls --

    public JsonNode initialize() {
        return call("initialize", null).result();
    }

    /**
     * @return names of the tools listed in {@code result.tools}
     */
    public List<String> listTools() {
        JsonNode tools = call("tools/list", null).result().path("tools");
        if (!tools.isArray()) {
            throw new HarnessException(ErrorKind.PROTOCOL_VIOLATION, "tools/list result has no tools array");
        }
        var names = new ArrayList<String>();
        tools.forEach(t -> names.add(t.path("name").asText()));
        return names;
    }

    public JsonNode callTool(String name, Map<String, ?> arguments) {
        return call("tools/call", Map.of("name", name, "arguments", arguments)).result();
    }

    // -- push channel --

    /**
     * Opens the SSE endpoint, reads the first chunk and checks it announces the callback
     * endpoint ({@code event: endpoint} followed by {@code data: http...}).
     *
     * @throws HarnessException PROTOCOL_VIOLATION if the handshake is missing, TIMEOUT if
     *         nothing arrives in time
     */
    public SseHandshake probeStream() {
        String url = http.baseUrl() + SSE_PATH;
        results.log("GET {} (stream probe)", SSE_PATH);
        var request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("Accept", "text/event-stream")
                .GET()
                .build();

        HttpResponse<InputStream> response;
        try {
            response = streamClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpTimeoutException e) {
            throw new HarnessException(ErrorKind.TIMEOUT, "SSE endpoint did not answer within " + timeout.toMillis() + "ms", e);
        } catch (ConnectException e) {
            throw new HarnessException(ErrorKind.CONNECTION_REFUSED, "Connection refused: " + url, e);
        } catch (IOException e) {
            throw new HarnessException(ErrorKind.REQUEST_FAILED, "SSE request failed: " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HarnessException(ErrorKind.REQUEST_FAILED, "Interrupted opening " + url, e);
        }

        try (InputStream body = response.body()) {
            if (response.statusCode() != 200) {
                throw new HarnessException(ErrorKind.REQUEST_FAILED, "SSE endpoint returned HTTP " + response.statusCode());
            }
            String raw = readFirstChunk(body);
            results.log("SSE first chunk: {}", raw.trim());
            String endpoint = parseEndpoint(raw);
            if (endpoint == null) {
                throw new HarnessException(ErrorKind.PROTOCOL_VIOLATION,
                        "Expected 'event: endpoint' with an http data line, got: " + raw);
            }
            return new SseHandshake(raw, endpoint);
        } catch (IOException e) {
            throw new HarnessException(ErrorKind.REQUEST_FAILED, "Failed to close SSE stream", e);
        }
    }

    private String readFirstChunk(InputStream body) {
        var reader = CompletableFuture.supplyAsync(() -> {
            var buffer = new StringBuilder();
            var text = new InputStreamReader(body, StandardCharsets.UTF_8);
            char[] chunk = new char[1024];
            try {
                int n;
                while (buffer.length() < SSE_READ_LIMIT && (n = text.read(chunk)) > 0) {
                    buffer.append(chunk, 0, n);
                    if (parseEndpoint(buffer.toString()) != null) {
                        break;
                    }
                }
            } catch (IOException e) {
                throw new HarnessException(ErrorKind.REQUEST_FAILED, "Failed reading SSE stream", e);
            }
            return buffer.toString();
        });
        try {
            return reader.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            reader.cancel(true);
            throw new HarnessException(ErrorKind.TIMEOUT, "No SSE data within " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof HarnessException he) {
                throw he;
            }
            throw new HarnessException(ErrorKind.REQUEST_FAILED, "Failed reading SSE stream", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HarnessException(ErrorKind.REQUEST_FAILED, "Interrupted reading SSE stream", e);
        }
    }

    /**
     * Returns the URL from the data line following {@code event: endpoint}, or null.
     */
    static String parseEndpoint(String raw) {
        int end = raw.lastIndexOf('\n');
        if (end < 0) {
            return null;
        }
        // a line without its terminator may still be arriving
        String[] lines = raw.substring(0, end).split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].trim().equals("event: endpoint")) {
                continue;
            }
            for (int j = i + 1; j < lines.length; j++) {
                String line = lines[j].trim();
                if (line.isEmpty()) break;
                if (line.startsWith("data:")) {
                    String data = line.substring("data:".length()).trim();
                    return data.startsWith("http") ? data : null;
                }
            }
        }
        return null;
    }

    private String serialize(ProtocolRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new HarnessException(ErrorKind.REQUEST_FAILED, "Failed to serialize " + request.method(), e);
        }
    }
}
