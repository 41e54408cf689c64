package com.iterharness.core.error;

/**
 * Classifies harness failures so the facade and test bodies can decide severity.
 */
public enum ErrorKind {
    /** Binary or image missing, port exhaustion, directory creation failure. Abort, no retry. */
    SETUP_FATAL,
    /** Health probe never succeeded within its bound. */
    READINESS_TIMEOUT,
    /** Expected absence of a prerequisite (container engine, credentials). Skip, not fail. */
    ENVIRONMENT_SKIP,
    /** A blocking operation ran out of time. */
    TIMEOUT,
    /** The peer actively refused the connection. */
    CONNECTION_REFUSED,
    REQUEST_FAILED,
    PROTOCOL_VIOLATION,
    PROTOCOL_ERROR,
    ARTIFACT_WRITE,
    CONTAINER_FAILURE,
    BROWSER_FAILURE;

    public boolean isSkip() {
        return this == ENVIRONMENT_SKIP;
    }
}
