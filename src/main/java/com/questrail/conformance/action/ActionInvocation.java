package com.questrail.conformance.action;

import org.slf4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fully resolved parameters for one action run, including the injected ones.
 */
public record ActionInvocation(String actionName, Map<String, Object> parameters, Logger logger) {

    public ActionInvocation {
        Objects.requireNonNull(actionName, "actionName");
        Objects.requireNonNull(logger, "logger");
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public Optional<Object> parameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    public String requireString(String name) {
        Object value = parameters.get(name);
        if (value == null) {
            throw new IllegalArgumentException(actionName + " requires parameter '" + name + "'");
        }
        return value.toString();
    }

    public Optional<String> source() {
        return parameter(InjectedParameter.SOURCE.key()).map(Object::toString);
    }

    public Optional<String> target() {
        return parameter(InjectedParameter.TARGET.key()).map(Object::toString);
    }

    public Optional<String> testName() {
        return parameter(InjectedParameter.TEST_NAME.key()).map(Object::toString);
    }
}
