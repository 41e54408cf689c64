package com.iterharness.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects response mismatches instead of stopping at the first one.
 *
 * <p>A test records every check, keeps going, and at the end either hands {@link #errors()}
 * to the summary or calls {@link #assertAll()}. Methods that parse return
 * {@link MissingNode} on failure so later checks can still run.
 */
public class ResponseChecks {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> errors = new ArrayList<>();

    public boolean check(boolean condition, String message) {
        if (!condition) {
            errors.add(message);
        }
        return condition;
    }

    public boolean status(HttpResult result, int expected) {
        if (result == null) {
            return check(false, "Expected status " + expected + ", but response was null");
        }
        return check(result.status() == expected,
                "Expected status " + expected + " for " + result.method() + " " + result.path()
                        + ", got " + result.status());
    }

    public boolean contains(String actual, String expected) {
        return check(actual != null && actual.contains(expected),
                "Expected string to contain \"" + expected + "\", got: " + HttpResult.abbreviate(actual));
    }

    /** Parses a JSON object; records an error and returns a missing node otherwise. */
    public JsonNode jsonObject(String body) {
        JsonNode node = parse(body);
        if (!node.isMissingNode() && !node.isObject()) {
            errors.add("Expected JSON object, got: " + HttpResult.abbreviate(body));
            return MissingNode.getInstance();
        }
        return node;
    }

    public JsonNode jsonArray(String body) {
        JsonNode node = parse(body);
        if (!node.isMissingNode() && !node.isArray()) {
            errors.add("Expected JSON array, got: " + HttpResult.abbreviate(body));
            return MissingNode.getInstance();
        }
        return node;
    }

    public boolean hasField(JsonNode node, String field) {
        return check(node != null && node.has(field), "Expected field \"" + field + "\" in " + node);
    }

    public boolean fieldEquals(JsonNode node, String field, String expected) {
        if (!hasField(node, field)) {
            return false;
        }
        String actual = node.get(field).asText();
        return check(expected.equals(actual),
                "Expected " + field + "=\"" + expected + "\", got \"" + actual + "\"");
    }

    public boolean nonEmptyArray(JsonNode node, String field) {
        if (!hasField(node, field)) {
            return false;
        }
        JsonNode value = node.get(field);
        return check(value.isArray() && !value.isEmpty(),
                "Expected non-empty array \"" + field + "\", got " + value);
    }

    private JsonNode parse(String body) {
        try {
            JsonNode node = body == null ? null : MAPPER.readTree(body);
            if (node == null || node.isMissingNode()) {
                errors.add("Expected JSON, got empty body");
                return MissingNode.getInstance();
            }
            return node;
        } catch (JsonProcessingException e) {
            errors.add("Failed to parse JSON: " + e.getOriginalMessage() + " Data: " + HttpResult.abbreviate(body));
            return MissingNode.getInstance();
        }
    }

    public List<String> errors() {
        return List.copyOf(errors);
    }

    public boolean passed() {
        return errors.isEmpty();
    }

    /**
     * @throws AssertionError listing every recorded mismatch
     */
    public void assertAll() {
        if (errors.isEmpty()) {
            return;
        }
        var sb = new StringBuilder(errors.size() + " check(s) failed:");
        for (String error : errors) {
            sb.append("\n  - ").append(error);
        }
        throw new AssertionError(sb.toString());
    }
}
