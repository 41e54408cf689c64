package com.iterharness.core.model;

public enum TestOutcome {
    PASSED,
    FAILED,
    SKIPPED
}
