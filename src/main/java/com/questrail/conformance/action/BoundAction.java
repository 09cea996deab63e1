package com.questrail.conformance.action;

import java.util.Objects;

/**
 * An action bound to a host with all of its parameters resolved, ready to run
 * when its state starts.
 */
public record BoundAction(String host, ActionDefinition definition, ActionInvocation invocation) {

    public BoundAction {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(invocation, "invocation");
    }

    public String name() {
        return definition.name();
    }

    public void run() throws Exception {
        definition.handler().execute(invocation);
    }

    @Override
    public String toString() {
        return name() + "@" + host;
    }
}
