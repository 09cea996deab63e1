package com.questrail.conformance.action;

import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionRegistryTest {

    private static ActionDefinition noop(String name, String... aliases) {
        ActionDefinition.Builder b = ActionDefinition.builder(name).withHandler(inv -> { });
        for (String alias : aliases) {
            b.withAlias(alias);
        }
        return b.build();
    }

    @Test
    void findsByNameAndAlias() {
        ActionDefinition restart = noop("restart_service", "restart");
        ActionRegistry registry = new ActionRegistry().register(restart);

        assertSame(restart, registry.find("restart_service").orElseThrow());
        assertSame(restart, registry.find("restart").orElseThrow());
        assertTrue(registry.find("stop").isEmpty());
        assertEquals(2, registry.size());
    }

    @Test
    void duplicateNameIsRejected() {
        ActionRegistry registry = new ActionRegistry().register(noop("restart_service", "restart"));

        assertThrows(IllegalArgumentException.class, () -> registry.register(noop("restart")));
        assertThrows(IllegalArgumentException.class, () -> registry.register(noop("other", "restart_service")));
    }

    @Test
    void discoversProvidersOnTheClasspath() throws Exception {
        ActionRegistry registry = ActionRegistry.discover(getClass().getClassLoader());

        ActionDefinition echo = registry.find("say").orElseThrow();
        assertEquals("echo", echo.name());
        assertTrue(echo.injects(InjectedParameter.TEST_NAME));
        assertFalse(echo.injects(InjectedParameter.TARGET));

        BoundAction bound = new BoundAction("client", echo, new ActionInvocation("echo",
                Map.of("message", "hello", "test_name", "echo-local"), LoggerFactory.getLogger("test.echo")));
        bound.run();
        assertEquals("echo@client", bound.toString());
    }

    @Test
    void requireStringReportsTheMissingParameter() {
        ActionInvocation invocation = new ActionInvocation("echo", Map.of(), LoggerFactory.getLogger("test.echo"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> invocation.requireString("message"));
        assertTrue(e.getMessage().contains("message"));
        assertTrue(invocation.source().isEmpty());
    }
}
