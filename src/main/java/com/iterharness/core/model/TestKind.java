package com.iterharness.core.model;

/**
 * Category of an integration test. Also the first segment of its results directory.
 */
public enum TestKind {
    API("api"),
    MCP("mcp"),
    UI("ui"),
    SERVICE("service");

    private final String directoryName;

    TestKind(String directoryName) {
        this.directoryName = directoryName;
    }

    public String directoryName() {
        return directoryName;
    }

    public static TestKind fromString(String value) {
        for (TestKind kind : values()) {
            if (kind.directoryName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        if ("mcp-protocol".equalsIgnoreCase(value)) return MCP;
        if ("service-lifecycle".equalsIgnoreCase(value)) return SERVICE;
        throw new IllegalArgumentException("Unknown test kind: " + value);
    }
}
