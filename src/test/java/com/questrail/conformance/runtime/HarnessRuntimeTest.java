package com.questrail.conformance.runtime;

import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.questrail.conformance.action.ActionDefinition;
import com.questrail.conformance.action.ActionRegistry;
import com.questrail.conformance.action.InjectedParameter;
import com.questrail.conformance.config.HarnessConfig;
import com.questrail.conformance.listener.ListenerType;
import com.questrail.conformance.observability.HarnessObservabilitySink;
import com.questrail.conformance.observability.NullObservabilitySink;
import com.questrail.conformance.observability.RecordingObservabilitySink;
import com.questrail.conformance.scenario.TestResult;
import com.questrail.conformance.scenario.TestScenario;
import com.questrail.conformance.scenario.TestStatus;
import com.questrail.conformance.state.StateStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full runtime over real executors, a real clock and file listeners.
 */
class HarnessRuntimeTest {

    private static final String SCENARIO = String.join("\n",
            "timeout: 20",
            "states:",
            "  request:",
            "    host:",
            "      client:",
            "        actions:",
            "          - append_trigger:",
            "              line: Packet-Type Access-Request",
            "    verify:",
            "      timeout: 10",
            "      triggers:",
            "        - Packet-Type:",
            "            pattern: Access-Request",
            "  accept:",
            "    host:",
            "      server:",
            "        actions:",
            "          - append_trigger:",
            "              line: Packet-Type Access-Accept",
            "          - append_trigger:",
            "              line: Session-Timeout 3600",
            "    verify:",
            "      timeout: 10",
            "      triggers:",
            "        - Packet-Type:",
            "            pattern: Access-Accept",
            "        - Session-Timeout:",
            "            range: [60, 86400]",
            "        - Error-Cause:",
            "            never_fire:",
            "");

    @TempDir
    Path listenerDir;

    private ActionRegistry appendAction() {
        return new ActionRegistry().register(ActionDefinition.builder("append_trigger")
                .injecting(InjectedParameter.TEST_NAME)
                .withHandler(inv -> Files.writeString(
                        listenerDir.resolve(inv.testName().orElseThrow() + ".txt"),
                        inv.requireString("line") + "\n",
                        StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND))
                .build());
    }

    private HarnessRuntime runtime(HarnessObservabilitySink sink) {
        HarnessConfig config = HarnessConfig.builder()
                .withListenerDirectory(listenerDir)
                .withListenerType(ListenerType.FILE)
                .withEnvironment("it")
                .withColorizeReport(false)
                .build();
        return HarnessRuntime.builder(config)
                .withActions(appendAction())
                .withObservabilitySink(sink)
                .build();
    }

    @Test
    void runsAScenarioAgainstAFileListener() throws Exception {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        try (HarnessRuntime runtime = runtime(sink)) {
            TestScenario scenario = runtime.scenarioLoader().load(new YAMLMapper().readTree(SCENARIO), "radius-it");

            OrchestrationReport report = runtime.runAll(List.of(scenario));

            assertTrue(report.allPassed(), () -> "report: " + report);
            TestResult result = report.results().get(0);
            assertEquals(TestStatus.PASSED, result.status());
            assertEquals(2, result.states().size());
            assertTrue(result.states().stream().allMatch(s -> s.status() == StateStatus.COMPLETED));
            assertEquals(3, result.states().get(1).report().total());
            assertTrue(Files.exists(listenerDir.resolve("radius-it.txt.bak")), "consumed file moved aside");
            assertEquals(1, sink.completed.size());
        }
    }

    @Test
    void stopIsIdempotentAndRefusesFurtherRuns() {
        HarnessRuntime runtime = runtime(NullObservabilitySink.INSTANCE);
        runtime.stop();
        runtime.stop();

        assertThrows(IllegalStateException.class, () -> runtime.runAll(List.of()));
    }
}
