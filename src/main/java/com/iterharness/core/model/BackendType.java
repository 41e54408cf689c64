package com.iterharness.core.model;

public enum BackendType {
    LOCAL,
    EXTERNAL,
    CONTAINERIZED
}
