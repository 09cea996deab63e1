package com.questrail.conformance.config;

import com.questrail.conformance.listener.ListenerType;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Aggregated configuration for a harness run.
 *
 * <p>{@code seed} is {@code null} when none was given; a shuffled test then
 * draws and logs its own.</p>
 */
public record HarnessConfig(
    Path listenerDirectory,
    ListenerType listenerType,
    String environment,
    Long seed,
    Duration defaultStateTimeout,
    Duration defaultTestTimeout,
    boolean scriptingEnabled,
    Duration scriptTimeout,
    long scriptStatementLimit,
    boolean detailedReport,
    boolean colorizeReport
) {
    public static final Duration DEFAULT_STATE_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_TEST_TIMEOUT = Duration.ofSeconds(40);

    public HarnessConfig {
        Objects.requireNonNull(listenerDirectory, "listenerDirectory");
        Objects.requireNonNull(listenerType, "listenerType");
        Objects.requireNonNull(environment, "environment");
        requirePositive(defaultStateTimeout, "defaultStateTimeout");
        requirePositive(defaultTestTimeout, "defaultTestTimeout");
        requirePositive(scriptTimeout, "scriptTimeout");
        if (scriptStatementLimit <= 0) {
            throw new IllegalArgumentException("scriptStatementLimit must be positive");
        }
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public OptionalLong seedIfSet() {
        return seed == null ? OptionalLong.empty() : OptionalLong.of(seed);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static HarnessConfig defaults() {
        return builder().build();
    }

    public static final class Builder {
        private Path listenerDirectory = Path.of(System.getProperty("java.io.tmpdir"), "conformance-listeners");
        private ListenerType listenerType = ListenerType.SOCKET;
        private String environment = "local";
        private Long seed;
        private Duration defaultStateTimeout = DEFAULT_STATE_TIMEOUT;
        private Duration defaultTestTimeout = DEFAULT_TEST_TIMEOUT;
        private boolean scriptingEnabled;
        private Duration scriptTimeout = Duration.ofSeconds(2);
        private long scriptStatementLimit = 1_000_000L;
        private boolean detailedReport;
        private boolean colorizeReport = true;

        public Builder withListenerDirectory(Path listenerDirectory) {
            this.listenerDirectory = listenerDirectory;
            return this;
        }

        public Builder withListenerType(ListenerType listenerType) {
            this.listenerType = listenerType;
            return this;
        }

        public Builder withEnvironment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder withSeed(Long seed) {
            this.seed = seed;
            return this;
        }

        public Builder withDefaultStateTimeout(Duration timeout) {
            this.defaultStateTimeout = timeout;
            return this;
        }

        public Builder withDefaultTestTimeout(Duration timeout) {
            this.defaultTestTimeout = timeout;
            return this;
        }

        public Builder withScriptingEnabled(boolean enabled) {
            this.scriptingEnabled = enabled;
            return this;
        }

        public Builder withScriptTimeout(Duration timeout) {
            this.scriptTimeout = timeout;
            return this;
        }

        public Builder withScriptStatementLimit(long limit) {
            this.scriptStatementLimit = limit;
            return this;
        }

        public Builder withDetailedReport(boolean detailed) {
            this.detailedReport = detailed;
            return this;
        }

        public Builder withColorizeReport(boolean colorize) {
            this.colorizeReport = colorize;
            return this;
        }

        public HarnessConfig build() {
            return new HarnessConfig(listenerDirectory, listenerType, environment, seed,
                    defaultStateTimeout, defaultTestTimeout,
                    scriptingEnabled, scriptTimeout, scriptStatementLimit,
                    detailedReport, colorizeReport);
        }
    }
}
