package com.questrail.conformance.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Name and alias lookup for {@link ActionDefinition}s.
 */
public final class ActionRegistry
{
    private static final Logger log = LoggerFactory.getLogger(ActionRegistry.class);

    private final Map<String, ActionDefinition> byName = new LinkedHashMap<>();

    public ActionRegistry register(ActionDefinition definition) {
        claim(definition.name(), definition);
        definition.aliases().forEach(alias -> claim(alias, definition));
        return this;
    }

    public ActionRegistry registerAll(Collection<ActionDefinition> definitions) {
        definitions.forEach(this::register);
        return this;
    }

    private void claim(String name, ActionDefinition definition) {
        ActionDefinition existing = byName.putIfAbsent(name, definition);
        if (existing != null && existing != definition) {
            throw new IllegalArgumentException(
                    "action name '" + name + "' already registered by " + existing.name());
        }
    }

    public Optional<ActionDefinition> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public int size() {
        return byName.size();
    }

    /**
     * Registers every action contributed by {@link ActionProvider}s visible to
     * {@code loader}.
     */
    public static ActionRegistry discover(ClassLoader loader) {
        ActionRegistry registry = new ActionRegistry();
        for (ActionProvider provider : ServiceLoader.load(ActionProvider.class, loader)) {
            Collection<ActionDefinition> actions = provider.actions();
            log.debug("Loaded {} action(s) from {}", actions.size(), provider.getClass().getName());
            registry.registerAll(actions);
        }
        return registry;
    }

    public static ActionRegistry discover() {
        return discover(Thread.currentThread().getContextClassLoader());
    }
}
