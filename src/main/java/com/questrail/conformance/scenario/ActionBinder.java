package com.questrail.conformance.scenario;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.conformance.action.ActionDefinition;
import com.questrail.conformance.action.ActionInvocation;
import com.questrail.conformance.action.BoundAction;
import com.questrail.conformance.action.InjectedParameter;
import org.slf4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves an action's scenario parameters and fills in the injected ones.
 */
final class ActionBinder
{
    private static final TypeReference<LinkedHashMap<String, Object>> PARAMS = new TypeReference<>() {};

    private final ObjectMapper mapper;

    ActionBinder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    BoundAction bind(ActionDefinition definition, JsonNode params, String testName, String host, Logger testLogger) {
        Map<String, Object> resolved = toMap(definition.name(), params);

        if (definition.injects(InjectedParameter.SOURCE)) {
            resolved.put(InjectedParameter.SOURCE.key(), containerName(testName, host));
        }
        if (definition.injects(InjectedParameter.TARGET)) {
            Object target = resolved.get(InjectedParameter.TARGET.key());
            if (target == null) {
                throw new ScenarioConfigurationException(
                        "Action " + definition.name() + " requires a target parameter.");
            }
            resolved.put(InjectedParameter.TARGET.key(), containerName(testName, target.toString()));
        }
        if (definition.injects(InjectedParameter.TEST_NAME)) {
            resolved.put(InjectedParameter.TEST_NAME.key(), testName);
        }
        if (definition.injects(InjectedParameter.LOGGER)) {
            resolved.put(InjectedParameter.LOGGER.key(), testLogger);
        }
        return new BoundAction(host, definition, new ActionInvocation(definition.name(), resolved, testLogger));
    }

    static String containerName(String testName, String host) {
        return testName + "-" + host + "-1";
    }

    private Map<String, Object> toMap(String actionName, JsonNode params) {
        if (params == null || params.isNull() || params.isMissingNode()) {
            return new LinkedHashMap<>();
        }
        if (!params.isObject()) {
            throw new ScenarioConfigurationException(
                    "parameters of action " + actionName + " must be a mapping, got: " + params);
        }
        return mapper.convertValue(params, PARAMS);
    }
}
