package com.questrail.conformance.scenario;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.questrail.conformance.action.ActionDefinition;
import com.questrail.conformance.action.ActionRegistry;
import com.questrail.conformance.action.BoundAction;
import com.questrail.conformance.config.HarnessConfig;
import com.questrail.conformance.rules.RuleCompiler;
import com.questrail.conformance.rules.RuleConfigurationException;
import com.questrail.conformance.rules.RuleMap;
import com.questrail.conformance.state.StateDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * ScenarioLoader
 * =============================================================================
 * Reads YAML scenario files into {@link TestScenario}s.
 *
 * <pre>
 * timeout: 40
 * state_order: sequence
 * states:
 *   &lt;state&gt;:
 *     description: text
 *     host:
 *       &lt;host&gt;:
 *         actions:
 *           - &lt;action&gt;: {params}
 *     verify:
 *       timeout: 15
 *       triggers:
 *         - &lt;attribute&gt;: {&lt;condition&gt;: params}
 * </pre>
 *
 * <p>Timeouts are in seconds. A test loaded from a file is named
 * {@code <file stem>-<environment>}. When loading a directory, an invalid
 * file is logged and skipped; the other files still load.</p>
 */
public final class ScenarioLoader
{
    private static final Logger log = LoggerFactory.getLogger(ScenarioLoader.class);

    private static final String TEST_LOGGER_PREFIX = "com.questrail.conformance.test.";

    private final HarnessConfig config;
    private final ActionRegistry actions;
    private final RuleCompiler compiler;
    private final YAMLMapper mapper = new YAMLMapper();
    private final ActionBinder binder = new ActionBinder(mapper);

    public ScenarioLoader(HarnessConfig config, ActionRegistry actions, RuleCompiler compiler) {
        this.config = Objects.requireNonNull(config, "config");
        this.actions = Objects.requireNonNull(actions, "actions");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
    }

    /**
     * Loads every {@code *.yml} and {@code *.yaml} file in {@code directory}, in
     * name order, skipping the ones that fail to load.
     */
    public List<TestScenario> loadDirectory(Path directory) throws IOException {
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String n = p.getFileName().toString();
                        return n.endsWith(".yml") || n.endsWith(".yaml");
                    })
                    .sorted()
                    .collect(Collectors.toList());
        }

        List<TestScenario> scenarios = new ArrayList<>();
        for (Path file : files) {
            try {
                scenarios.add(loadFile(file));
            } catch (ScenarioConfigurationException e) {
                log.error("Invalid configuration in {}: {}", file, e.getMessage());
                log.debug("Skipping invalid test configuration.", e);
            }
        }
        return scenarios;
    }

    public TestScenario loadFile(Path file) {
        String testName = stem(file) + "-" + config.environment();
        log.info("Parsing test configuration file: {}", file);
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new ScenarioConfigurationException("cannot read " + file + ": " + e.getMessage(), e);
        }
        return load(root, testName);
    }

    /**
     * Builds a test from an already parsed scenario document.
     */
    public TestScenario load(JsonNode root, String testName) {
        if (root == null || !root.isObject()) {
            throw new ScenarioConfigurationException("scenario " + testName + " must be a mapping");
        }
        Logger testLogger = LoggerFactory.getLogger(TEST_LOGGER_PREFIX + testName);

        Duration timeout = seconds(root.get("timeout"), config.defaultTestTimeout(), "timeout");
        StateOrder order = StateOrder.fromName(text(root.get("state_order")));

        List<StateDescriptor> states = new ArrayList<>();
        JsonNode statesNode = root.get("states");
        if (statesNode != null && !statesNode.isNull()) {
            if (!statesNode.isObject()) {
                throw new ScenarioConfigurationException("states must be a mapping in " + testName);
            }
            Iterator<Map.Entry<String, JsonNode>> it = statesNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                states.add(loadState(entry.getKey(), entry.getValue(), testName, testLogger));
            }
        }
        if (states.isEmpty()) {
            log.warn("Test {} defines no states", testName);
        }

        return TestScenario.create(
                testName,
                states,
                timeout,
                config.listenerType().destinationFor(config.listenerDirectory(), testName),
                order,
                config.seedIfSet());
    }

    private StateDescriptor loadState(String stateName, JsonNode state, String testName, Logger testLogger) {
        if (state == null || !state.isObject()) {
            throw new ScenarioConfigurationException("state '" + stateName + "' must be a mapping");
        }
        String description = text(state.get("description"));

        List<BoundAction> bound = new ArrayList<>();
        JsonNode hosts = state.get("host");
        if (hosts != null && hosts.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = hosts.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> host = it.next();
                JsonNode actionList = host.getValue() == null ? null : host.getValue().get("actions");
                if (actionList == null || actionList.isNull()) {
                    continue;
                }
                if (!actionList.isArray()) {
                    throw new ScenarioConfigurationException(
                            "actions of host '" + host.getKey() + "' in state '" + stateName + "' must be a list");
                }
                for (JsonNode action : actionList) {
                    bindAction(action, host.getKey(), testName, testLogger).ifPresent(bound::add);
                }
            }
        }

        JsonNode verify = state.get("verify");
        Duration stateTimeout = seconds(verify == null ? null : verify.get("timeout"),
                config.defaultStateTimeout(), "verify.timeout");
        RuleMap rules;
        try {
            rules = compiler.compileTriggers(verify == null ? null : verify.get("triggers"));
        } catch (RuleConfigurationException e) {
            throw new ScenarioConfigurationException(
                    "invalid trigger in state '" + stateName + "': " + e.getMessage(), e);
        }

        return new StateDescriptor(stateName, description, bound, rules, stateTimeout);
    }

    private Optional<BoundAction> bindAction(JsonNode action, String host, String testName, Logger testLogger) {
        if (action == null || !action.isObject() || action.size() != 1) {
            throw new ScenarioConfigurationException("action entry must be a single-key mapping, got: " + action);
        }
        Map.Entry<String, JsonNode> only = action.fields().next();
        String actionName = only.getKey();
        Optional<ActionDefinition> definition = actions.find(actionName);
        if (definition.isEmpty()) {
            log.warn("Unknown action: {}", actionName);
            return Optional.empty();
        }
        return Optional.of(binder.bind(definition.get(), only.getValue(), testName, host, testLogger));
    }

    private static Duration seconds(JsonNode node, Duration fallback, String field) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isNumber()) {
            throw new ScenarioConfigurationException(field + " must be a number of seconds, got: " + node);
        }
        double secs = node.asDouble();
        if (secs <= 0) {
            throw new ScenarioConfigurationException(field + " must be positive, got: " + node);
        }
        return Duration.ofMillis(Math.round(secs * 1000));
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
