package com.questrail.conformance.action;

import java.util.Collection;

/**
 * Service provider interface for contributing actions. Implementations are
 * discovered through {@link java.util.ServiceLoader} from
 * {@code META-INF/services/com.questrail.conformance.action.ActionProvider}.
 */
public interface ActionProvider
{
    Collection<ActionDefinition> actions();
}
