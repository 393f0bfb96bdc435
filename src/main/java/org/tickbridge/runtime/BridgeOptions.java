package org.tickbridge.runtime;

import java.util.Map;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Tuning of a {@link BridgeHandle} and its host loop, read from the {@code tickbridge}
 * section of the configuration.
 *
 * @param runtimeThreads         threads of the task executor
 * @param threadNamePrefix       name prefix of executor threads
 * @param maxCallbacksPerTick    main-thread callbacks executed per pump, 0 for a full drain
 * @param yieldToRuntime         yield the world thread once per pump before draining callbacks
 * @param tickIntervalMs         host loop cadence
 * @param maxTicks               host loop stops after this many ticks, 0 for no limit
 * @param shutdownTimeoutSeconds grace period for executor and host shutdown
 */
public record BridgeOptions(
        int runtimeThreads,
        String threadNamePrefix,
        int maxCallbacksPerTick,
        boolean yieldToRuntime,
        long tickIntervalMs,
        long maxTicks,
        int shutdownTimeoutSeconds) {

    private static final Config DEFAULTS = ConfigFactory.parseMap(Map.of(
            "runtime.threads", Math.max(2, Runtime.getRuntime().availableProcessors()),
            "runtime.threadNamePrefix", "tickbridge-task",
            "mainThread.maxCallbacksPerTick", 0,
            "mainThread.yieldToRuntime", false,
            "host.tickIntervalMs", 100,
            "host.maxTicks", 0,
            "shutdownTimeoutSeconds", 5
    ));

    public BridgeOptions {
        if (runtimeThreads <= 0) {
            throw new IllegalArgumentException("runtime.threads must be positive, got " + runtimeThreads);
        }
        if (maxCallbacksPerTick < 0) {
            throw new IllegalArgumentException("mainThread.maxCallbacksPerTick cannot be negative, got " + maxCallbacksPerTick);
        }
        if (tickIntervalMs < 0) {
            throw new IllegalArgumentException("host.tickIntervalMs cannot be negative, got " + tickIntervalMs);
        }
        if (maxTicks < 0) {
            throw new IllegalArgumentException("host.maxTicks cannot be negative, got " + maxTicks);
        }
        if (shutdownTimeoutSeconds < 0) {
            throw new IllegalArgumentException("shutdownTimeoutSeconds cannot be negative, got " + shutdownTimeoutSeconds);
        }
    }

    /**
     * Reads options from a {@code tickbridge} config section. Missing keys take their defaults.
     *
     * @param section the {@code tickbridge} section, may be empty
     * @throws IllegalArgumentException if a value has the wrong type or is out of range
     */
    public static BridgeOptions fromConfig(Config section) {
        Config config = section.withFallback(DEFAULTS);
        try {
            return new BridgeOptions(
                    config.getInt("runtime.threads"),
                    config.getString("runtime.threadNamePrefix"),
                    config.getInt("mainThread.maxCallbacksPerTick"),
                    config.getBoolean("mainThread.yieldToRuntime"),
                    config.getLong("host.tickIntervalMs"),
                    config.getLong("host.maxTicks"),
                    config.getInt("shutdownTimeoutSeconds"));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid tickbridge configuration: " + e.getMessage(), e);
        }
    }

    /**
     * @return options with every value at its default
     */
    public static BridgeOptions defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    public BridgeOptions withMaxCallbacksPerTick(int limit) {
        return new BridgeOptions(runtimeThreads, threadNamePrefix, limit, yieldToRuntime, tickIntervalMs, maxTicks,
                shutdownTimeoutSeconds);
    }

    public BridgeOptions withTickInterval(long intervalMs) {
        return new BridgeOptions(runtimeThreads, threadNamePrefix, maxCallbacksPerTick, yieldToRuntime, intervalMs,
                maxTicks, shutdownTimeoutSeconds);
    }

    public BridgeOptions withMaxTicks(long ticks) {
        return new BridgeOptions(runtimeThreads, threadNamePrefix, maxCallbacksPerTick, yieldToRuntime, tickIntervalMs,
                ticks, shutdownTimeoutSeconds);
    }
}
