package com.iterharness.scenario;

import com.iterharness.client.HttpResult;
import com.iterharness.client.ResponseChecks;
import com.iterharness.client.rpc.ProtocolClient;
import com.iterharness.client.rpc.SseHandshake;
import com.iterharness.core.error.HarnessException;
import com.iterharness.core.model.TestSummary;
import com.iterharness.environment.TestEnvironment;

import java.util.List;

/**
 * Minimal end-to-end check of a running service: health, protocol handshake, tool listing and
 * the SSE endpoint announcement. Always leaves a summary behind.
 */
public class SmokeScenario {

    static final List<String> REQUIRED_TOOLS = List.of("list_projects", "search");

    public TestSummary run(TestEnvironment env) {
        var checks = new ResponseChecks();
        try {
            HttpResult health = env.httpClient().get("/health");
            checks.status(health, 200);
            checks.fieldEquals(checks.jsonObject(health.body()), "status", "ok");

            ProtocolClient rpc = env.protocolClient();
            var init = rpc.initialize();
            checks.hasField(init, "serverInfo");

            List<String> tools = rpc.listTools();
            env.log("Tools: {}", tools);
            for (String tool : REQUIRED_TOOLS) {
                checks.check(tools.contains(tool), "Expected tool " + tool + " in " + tools);
            }

            SseHandshake handshake = rpc.probeStream();
            env.log("SSE endpoint: {}", handshake.endpointUrl());
        } catch (HarnessException e) {
            if (e.kind().isSkip()) {
                return env.writeSkipped(e.getMessage());
            }
            checks.check(false, e.toString());
        }
        String details = checks.passed() ? "Smoke checks passed" : checks.errors().size() + " check(s) failed";
        return env.writeSummary(checks.passed(), details, checks.errors().toArray(new String[0]));
    }
}
