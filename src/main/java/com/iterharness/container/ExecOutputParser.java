package com.iterharness.container;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * Extracts a JSON document from container exec output.
 *
 * <p>Tooling inside a container may prefix its output with ANSI control sequences, terminal
 * title escapes or banners. The parser strips CSI sequences ({@code ESC [ ... letter}), OSC
 * sequences ({@code ESC ] ... BEL}) and the {@code \x01}/{@code \x02} readline markers, then
 * takes the first balanced top-level JSON object or array.
 */
public final class ExecOutputParser {

    private static final Pattern CONTROL_SEQUENCES = Pattern.compile(
            "\\x1B\\[[0-9;?]*[a-zA-Z]|\\x1B\\][^\\x07]*\\x07|[\\x01\\x02]");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ExecOutputParser() {}

    public static String stripControlSequences(String output) {
        if (output == null) return "";
        return CONTROL_SEQUENCES.matcher(output).replaceAll("");
    }

    /**
     * Returns the first top-level JSON value in {@code output}, or null if there is none.
     * Brackets inside JSON strings do not count toward nesting.
     */
    public static String extractJson(String output) {
        String clean = stripControlSequences(output);
        int start = -1;
        for (int i = 0; i < clean.length(); i++) {
            char c = clean.charAt(i);
            if (c == '{' || c == '[') {
                start = i;
                break;
            }
        }
        if (start < 0) {
            return null;
        }

        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < clean.length(); i++) {
            char c = clean.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{', '[' -> depth++;
                case '}', ']' -> {
                    depth--;
                    if (depth == 0) {
                        return clean.substring(start, i + 1);
                    }
                }
                default -> { }
            }
        }
        // Unbalanced: hand the tail to the JSON parser and let it report the error
        return clean.substring(start);
    }

    /**
     * @throws HarnessException PROTOCOL_VIOLATION if no JSON value can be decoded
     */
    public static JsonNode parse(String output) {
        String json = extractJson(output);
        if (json == null) {
            throw new HarnessException(ErrorKind.PROTOCOL_VIOLATION, "No JSON found in output: " + abbreviate(output));
        }
        try {
            return MAPPER.readTree(json);
        } catch (IOException e) {
            throw new HarnessException(ErrorKind.PROTOCOL_VIOLATION, "Invalid JSON in output: " + abbreviate(json), e);
        }
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 300 ? s : s.substring(0, 300) + "...";
    }
}
