package com.questrail.conformance.action;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A named action that scenario files can schedule on a host.
 *
 * <p>{@code injected} declares which {@link InjectedParameter}s the handler
 * expects; only those are filled in.</p>
 */
public record ActionDefinition(
    String name,
    Set<String> aliases,
    Set<InjectedParameter> injected,
    ActionHandler handler
) {
    public ActionDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
        aliases = Set.copyOf(aliases);
        injected = injected.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(injected));
    }

    public boolean injects(InjectedParameter parameter) {
        return injected.contains(parameter);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final Set<String> aliases = new LinkedHashSet<>();
        private final Set<InjectedParameter> injected = EnumSet.noneOf(InjectedParameter.class);
        private ActionHandler handler;

        private Builder(String name) {
            this.name = name;
        }

        public Builder withAlias(String alias) {
            aliases.add(alias);
            return this;
        }

        public Builder injecting(InjectedParameter... parameters) {
            injected.addAll(Set.of(parameters));
            return this;
        }

        public Builder withHandler(ActionHandler handler) {
            this.handler = handler;
            return this;
        }

        public ActionDefinition build() {
            return new ActionDefinition(name, aliases, injected, handler);
        }
    }
}
