package com.iterharness.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Response of one HTTP call made through {@link HttpTestClient}.
 *
 * @param method  request method
 * @param path    request path relative to the base URL
 * @param status  response status code
 * @param headers response headers (lower-case names)
 * @param body    response body as text
 */
public record HttpResult(
    String method,
    String path,
    int status,
    Map<String, List<String>> headers,
    String body
) {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public String header(String name) {
        var values = headers.get(name.toLowerCase());
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * Parses the body as JSON.
     *
     * @throws HarnessException PROTOCOL_VIOLATION if the body is not JSON
     */
    public JsonNode json() {
        try {
            return MAPPER.readTree(body);
        } catch (IOException e) {
            throw new HarnessException(ErrorKind.PROTOCOL_VIOLATION,
                    "Response to " + method + " " + path + " is not JSON: " + abbreviate(body), e);
        }
    }

    static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 500 ? s : s.substring(0, 500) + "...";
    }
}
