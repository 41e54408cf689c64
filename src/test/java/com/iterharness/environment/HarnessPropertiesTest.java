package com.iterharness.environment;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HarnessPropertiesTest {

    @Test
    void defaults() {
        var props = new HarnessProperties();

        assertFalse(props.isExternal());
        assertFalse(props.isContainerized());
        assertEquals(19000, props.getBasePort());
        assertEquals("http://iter:19000", props.getContainer().internalBaseUrl());
    }

    @Test
    void environmentOverrides() {
        var props = HarnessProperties.fromEnvironment(Map.of(
                "ITER_BASE_URL", " http://staging:19000 ",
                "TEST_DOCKER", "1"));

        assertTrue(props.isExternal());
        assertEquals("http://staging:19000", props.getExternalUrl());
        assertTrue(props.isContainerized());
    }

    @Test
    void resultsRootAndBinaryFromEnvironment() {
        var props = HarnessProperties.fromEnvironment(Map.of(
                "ITER_RESULTS_ROOT", "/tmp/iter-results",
                "ITER_SERVICE_BINARY", " /opt/iter/bin/iter-service "));

        assertEquals("/tmp/iter-results", props.getResultsRoot());
        assertEquals(Path.of("/tmp/iter-results"), props.resultsRootPath());
        assertEquals("/opt/iter/bin/iter-service", props.getLocal().getBinary());
    }

    @Test
    void blankResultsRootKeepsDefault() {
        var props = HarnessProperties.fromEnvironment(Map.of("ITER_RESULTS_ROOT", " ", "ITER_SERVICE_BINARY", ""));

        assertEquals("target/results", props.getResultsRoot());
        assertEquals("", props.getLocal().getBinary());
    }

    @Test
    void dockerFlagAcceptsTrueAndRejectsOtherValues() {
        assertTrue(HarnessProperties.fromEnvironment(Map.of("TEST_DOCKER", "TRUE")).isContainerized());
        assertFalse(HarnessProperties.fromEnvironment(Map.of("TEST_DOCKER", "yes")).isContainerized());
        assertFalse(HarnessProperties.fromEnvironment(Map.of("ITER_BASE_URL", "  ")).isExternal());
    }

    @Test
    void internalUrlFollowsAliasAndPort() {
        var container = new HarnessProperties.Container();
        container.setServiceAlias("svc");
        container.setServicePort(8080);

        assertEquals("http://svc:8080", container.internalBaseUrl());
    }
}
