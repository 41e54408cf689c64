package com.iterharness.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;
import com.iterharness.core.results.ResultStore;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON-over-HTTP helper bound to one test environment.
 *
 * <p>Every call is logged to the {@link ResultStore} (method and path, then status and body)
 * before it returns, so a failed run can be reconstructed from its artifacts alone.
 * No retries happen here.
 */
public class HttpTestClient {

    private final String baseUrl;
    private final ResultStore results;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpTestClient(String baseUrl, ResultStore results, Duration requestTimeout) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.results = results;
        this.requestTimeout = requestTimeout;
        this.objectMapper = new ObjectMapper();
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(requestTimeout)
                .build();
    }

    public String baseUrl() {
        return baseUrl;
    }

    public HttpResult get(String path) {
        return request("GET", path, null);
    }

    public HttpResult post(String path, Object body) {
        return request("POST", path, body);
    }

    public HttpResult delete(String path) {
        return request("DELETE", path, null);
    }

    /**
     * Fetches an HTML page.
     *
     * @throws HarnessException REQUEST_FAILED unless the status is 200
     */
    public String getHtml(String path) {
        var result = get(path);
        if (result.status() != 200) {
            throw new HarnessException(ErrorKind.REQUEST_FAILED,
                    "GET " + path + " returned unexpected status " + result.status());
        }
        return result.body();
    }

    /**
     * Performs a request. A non-null {@code body} is serialized as JSON; a {@code String}
     * body is sent as-is.
     *
     * @throws HarnessException TIMEOUT, CONNECTION_REFUSED or REQUEST_FAILED
     */
    public HttpResult request(String method, String path, Object body) {
        var builder = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(requestTimeout);
        if (body != null) {
            builder.header("Content-Type", "application/json");
            builder.method(method, HttpRequest.BodyPublishers.ofString(serialize(body)));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        results.log("{} {}", method, path);
        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpConnectTimeoutException e) {
            results.log("{} {} failed: connect timeout", method, path);
            throw new HarnessException(ErrorKind.TIMEOUT, "Connect timeout: " + method + " " + path, e);
        } catch (HttpTimeoutException e) {
            results.log("{} {} failed: timeout after {}ms", method, path, requestTimeout.toMillis());
            throw new HarnessException(ErrorKind.TIMEOUT,
                    "Request timed out after " + requestTimeout.toMillis() + "ms: " + method + " " + path, e);
        } catch (ConnectException e) {
            results.log("{} {} failed: connection refused", method, path);
            throw new HarnessException(ErrorKind.CONNECTION_REFUSED,
                    "Connection refused: " + method + " " + baseUrl + path, e);
        } catch (IOException e) {
            results.log("{} {} failed: {}", method, path, e.getMessage());
            throw new HarnessException(ErrorKind.REQUEST_FAILED, "Request failed: " + method + " " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HarnessException(ErrorKind.REQUEST_FAILED, "Interrupted: " + method + " " + path, e);
        }

        results.log("Response: {} {}", response.statusCode(), response.body());
        Map<String, List<String>> headers = new TreeMap<>();
        response.headers().map().forEach((k, v) -> headers.put(k.toLowerCase(), v));
        return new HttpResult(method, path, response.statusCode(), headers, response.body());
    }

    private String serialize(Object body) {
        if (body instanceof String s) {
            return s;
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new HarnessException(ErrorKind.REQUEST_FAILED, "Failed to serialize request body", e);
        }
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
