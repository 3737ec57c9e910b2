package com.metagov.config;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for the Metagov core.
 * <p>
 * Driver: METAGOV_DRIVER_EVENT_RECEIVER_URL (unset = events are only delivered to in-process listeners).
 * Timeouts: METAGOV_EVENT_TIMEOUT_SECONDS, METAGOV_PROCESS_START_TIMEOUT_SECONDS.
 * Scheduler sweep: METAGOV_SWEEP_PARALLELISM. Reference poll plugin: METAGOV_POLL_BASE_URL.
 */
public final class MetagovConfig {

    private static final String ENV_DRIVER_EVENT_RECEIVER_URL = "METAGOV_DRIVER_EVENT_RECEIVER_URL";
    private static final String ENV_EVENT_TIMEOUT_SECONDS = "METAGOV_EVENT_TIMEOUT_SECONDS";
    private static final String ENV_PROCESS_START_TIMEOUT_SECONDS = "METAGOV_PROCESS_START_TIMEOUT_SECONDS";
    private static final String ENV_SWEEP_PARALLELISM = "METAGOV_SWEEP_PARALLELISM";
    private static final String ENV_POLL_BASE_URL = "METAGOV_POLL_BASE_URL";
    private static final String ENV_LOAD_DISCOVERED_PLUGINS = "METAGOV_LOAD_DISCOVERED_PLUGINS";

    private static final int DEFAULT_EVENT_TIMEOUT_SECONDS = 10;
    private static final int DEFAULT_PROCESS_START_TIMEOUT_SECONDS = 30;
    private static final int DEFAULT_SWEEP_PARALLELISM = 4;
    private static final String DEFAULT_POLL_BASE_URL = "https://polls.example.org";

    private final String driverEventReceiverUrl;
    private final Duration eventTimeout;
    private final Duration processStartTimeout;
    private final int sweepParallelism;
    private final String pollBaseUrl;
    private final boolean loadDiscoveredPlugins;

    private MetagovConfig(Builder b) {
        this.driverEventReceiverUrl = b.driverEventReceiverUrl;
        this.eventTimeout = Duration.ofSeconds(b.eventTimeoutSeconds);
        this.processStartTimeout = Duration.ofSeconds(b.processStartTimeoutSeconds);
        this.sweepParallelism = b.sweepParallelism;
        this.pollBaseUrl = b.pollBaseUrl;
        this.loadDiscoveredPlugins = b.loadDiscoveredPlugins;
    }

    /** Reads configuration from {@link System#getenv()}. */
    public static MetagovConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /**
     * Reads configuration from the given variables (same keys as the environment).
     * Invalid numbers fall back to defaults.
     */
    public static MetagovConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .driverEventReceiverUrl(env.get(ENV_DRIVER_EVENT_RECEIVER_URL))
                .eventTimeoutSeconds(parsePositive(env.get(ENV_EVENT_TIMEOUT_SECONDS), DEFAULT_EVENT_TIMEOUT_SECONDS))
                .processStartTimeoutSeconds(parsePositive(env.get(ENV_PROCESS_START_TIMEOUT_SECONDS), DEFAULT_PROCESS_START_TIMEOUT_SECONDS))
                .sweepParallelism(parsePositive(env.get(ENV_SWEEP_PARALLELISM), DEFAULT_SWEEP_PARALLELISM))
                .pollBaseUrl(env.get(ENV_POLL_BASE_URL))
                .loadDiscoveredPlugins(!"false".equalsIgnoreCase(trimToNull(env.get(ENV_LOAD_DISCOVERED_PLUGINS))))
                .build();
    }

    private static int parsePositive(String value, int defaultValue) {
        String v = trimToNull(value);
        if (v == null) return defaultValue;
        try {
            int n = Integer.parseInt(v);
            return n > 0 ? n : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String trimToNull(String s) {
        if (s == null || s.isBlank()) return null;
        return s.trim();
    }

    /** Driver endpoint that receives forwarded events, or null when forwarding is disabled. */
    public String getDriverEventReceiverUrl() {
        return driverEventReceiverUrl;
    }

    public Duration getEventTimeout() {
        return eventTimeout;
    }

    /** Upper bound on a type-specific process start; exceeding it rolls the process back. */
    public Duration getProcessStartTimeout() {
        return processStartTimeout;
    }

    public int getSweepParallelism() {
        return sweepParallelism;
    }

    public String getPollBaseUrl() {
        return pollBaseUrl;
    }

    /** Whether plugin providers found via ServiceLoader are registered in addition to internal ones. */
    public boolean isLoadDiscoveredPlugins() {
        return loadDiscoveredPlugins;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String driverEventReceiverUrl;
        private int eventTimeoutSeconds = DEFAULT_EVENT_TIMEOUT_SECONDS;
        private int processStartTimeoutSeconds = DEFAULT_PROCESS_START_TIMEOUT_SECONDS;
        private int sweepParallelism = DEFAULT_SWEEP_PARALLELISM;
        private String pollBaseUrl = DEFAULT_POLL_BASE_URL;
        private boolean loadDiscoveredPlugins = true;

        private Builder() {
        }

        public Builder driverEventReceiverUrl(String url) {
            this.driverEventReceiverUrl = trimToNull(url);
            return this;
        }

        public Builder eventTimeoutSeconds(int seconds) {
            if (seconds <= 0) throw new IllegalArgumentException("eventTimeoutSeconds must be positive");
            this.eventTimeoutSeconds = seconds;
            return this;
        }

        public Builder processStartTimeoutSeconds(int seconds) {
            if (seconds <= 0) throw new IllegalArgumentException("processStartTimeoutSeconds must be positive");
            this.processStartTimeoutSeconds = seconds;
            return this;
        }

        public Builder sweepParallelism(int parallelism) {
            if (parallelism <= 0) throw new IllegalArgumentException("sweepParallelism must be positive");
            this.sweepParallelism = parallelism;
            return this;
        }

        public Builder pollBaseUrl(String url) {
            String u = trimToNull(url);
            this.pollBaseUrl = u != null ? u : DEFAULT_POLL_BASE_URL;
            return this;
        }

        public Builder loadDiscoveredPlugins(boolean load) {
            this.loadDiscoveredPlugins = load;
            return this;
        }

        public MetagovConfig build() {
            return new MetagovConfig(this);
        }
    }
}
