package com.questrail.conformance.scenario;

import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.questrail.conformance.action.ActionDefinition;
import com.questrail.conformance.action.ActionInvocation;
import com.questrail.conformance.action.ActionRegistry;
import com.questrail.conformance.action.BoundAction;
import com.questrail.conformance.action.InjectedParameter;
import com.questrail.conformance.config.HarnessConfig;
import com.questrail.conformance.listener.ListenerDestination;
import com.questrail.conformance.listener.ListenerType;
import com.questrail.conformance.rules.RuleCompiler;
import com.questrail.conformance.rules.RuleKind;
import com.questrail.conformance.rules.TrackingPolicy;
import com.questrail.conformance.state.StateDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioLoaderTest {

    private static final Path LISTENERS = Path.of("/tmp/listeners");

    private ScenarioLoader loader;
    private Path scenarios;

    @BeforeEach
    void setUp() throws Exception {
        HarnessConfig config = HarnessConfig.builder()
                .withEnvironment("ci")
                .withListenerDirectory(LISTENERS)
                .withListenerType(ListenerType.FILE)
                .withSeed(99L)
                .build();
        ActionRegistry registry = new ActionRegistry().register(
                ActionDefinition.builder("send_request")
                        .injecting(InjectedParameter.SOURCE, InjectedParameter.TARGET,
                                InjectedParameter.TEST_NAME, InjectedParameter.LOGGER)
                        .withHandler(inv -> { })
                        .build());
        loader = new ScenarioLoader(config, registry, new RuleCompiler(false));

        URL dir = getClass().getResource("/scenarios");
        assertNotNull(dir, "scenario fixtures on the test classpath");
        scenarios = Path.of(dir.toURI());
    }

    @Test
    void loadsStatesActionsAndRules() {
        TestScenario scenario = loader.loadFile(scenarios.resolve("auth.yml"));

        assertEquals("auth-ci", scenario.name());
        assertEquals(Duration.ofSeconds(30), scenario.timeout());
        assertEquals(new ListenerDestination.TailFile(LISTENERS.resolve("auth-ci.txt")), scenario.destination());
        assertEquals(List.of("accept", "reject"),
                scenario.states().stream().map(StateDescriptor::name).collect(Collectors.toList()));

        StateDescriptor accept = scenario.states().get(0);
        assertEquals("Valid credentials are accepted", accept.description());
        assertEquals(Duration.ofSeconds(5), accept.timeout());
        assertEquals(List.of("Packet-Type", "Reply-Message", "Session-Timeout"), List.copyOf(accept.rules().attributes()));
        assertEquals(TrackingPolicy.ADVISORY, accept.rules().rulesFor("Reply-Message").get(0).tracking());
        assertEquals(RuleKind.RANGE, accept.rules().rulesFor("Session-Timeout").get(0).kind());

        StateDescriptor reject = scenario.states().get(1);
        assertEquals(HarnessConfig.DEFAULT_STATE_TIMEOUT, reject.timeout());
        assertEquals(TrackingPolicy.FORBIDDEN, reject.rules().rulesFor("Accounting").get(0).tracking());
    }

    @Test
    void injectsContainerNamesAndSkipsUnknownActions() {
        StateDescriptor accept = loader.loadFile(scenarios.resolve("auth.yml")).states().get(0);

        assertEquals(1, accept.actions().size(), "unknown action dropped");
        BoundAction bound = accept.actions().get(0);
        assertEquals("client", bound.host());

        ActionInvocation invocation = bound.invocation();
        assertEquals("auth-ci-client-1", invocation.source().orElseThrow());
        assertEquals("auth-ci-server-1", invocation.target().orElseThrow());
        assertEquals("auth-ci", invocation.testName().orElseThrow());
        assertEquals("bob", invocation.requireString("user"));
        assertInstanceOf(Logger.class, invocation.parameter(InjectedParameter.LOGGER.key()).orElseThrow());
        assertEquals("com.questrail.conformance.test.auth-ci", invocation.logger().getName());
    }

    @Test
    void missingTargetIsAConfigurationError() {
        ScenarioConfigurationException e = assertThrows(ScenarioConfigurationException.class,
                () -> loader.loadFile(scenarios.resolve("missing-target.yml")));
        assertTrue(e.getMessage().contains("requires a target parameter"), e.getMessage());
    }

    @Test
    void unknownConditionIsAConfigurationError() {
        assertThrows(ScenarioConfigurationException.class,
                () -> loader.loadFile(scenarios.resolve("broken-condition.yml")));
    }

    @Test
    void directoryLoadSkipsInvalidFiles() throws Exception {
        List<TestScenario> loaded = loader.loadDirectory(scenarios);

        assertEquals(List.of("auth-ci", "shuffled-ci"),
                loaded.stream().map(TestScenario::name).collect(Collectors.toList()));
    }

    @Test
    void shuffledStatesUseTheConfiguredSeed() {
        TestScenario first = loader.loadFile(scenarios.resolve("shuffled.yml"));
        TestScenario second = loader.loadFile(scenarios.resolve("shuffled.yml"));

        assertEquals(OptionalLong.of(99), first.seed());
        assertEquals(first.states().stream().map(StateDescriptor::name).collect(Collectors.toList()),
                second.states().stream().map(StateDescriptor::name).collect(Collectors.toList()));
        assertEquals(4, first.states().size());
    }

    @Test
    void missingTimeoutsFallBackToDefaults() throws Exception {
        TestScenario scenario = loader.load(new YAMLMapper().readTree(
                "states:\n  only:\n    verify:\n      triggers:\n        - A:\n            pass:\n"), "inline-ci");

        assertEquals(HarnessConfig.DEFAULT_TEST_TIMEOUT, scenario.timeout());
        assertEquals(HarnessConfig.DEFAULT_STATE_TIMEOUT, scenario.states().get(0).timeout());
        assertTrue(scenario.seed().isEmpty());
    }

    @Test
    void nonPositiveTimeoutIsRejected() {
        assertThrows(ScenarioConfigurationException.class, () -> loader.load(
                new YAMLMapper().readTree("timeout: 0\nstates: {}\n"), "zero-ci"));
    }
}
