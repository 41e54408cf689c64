package com.iterharness.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing harness-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTest(String testKind, String testName) {
        MDC.put("testKind", testKind);
        MDC.put("testName", testName);
    }

    public static void setBackend(String testKind, String testName, String backend) {
        setTest(testKind, testName);
        MDC.put("backend", backend);
    }

    public static void clear() {
        MDC.remove("testKind");
        MDC.remove("testName");
        MDC.remove("backend");
    }
}
