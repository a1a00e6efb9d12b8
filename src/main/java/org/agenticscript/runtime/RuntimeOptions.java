package org.agenticscript.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;

/**
 * The tunables of a runtime session, read from the {@code agenticscript} block of a Typesafe
 * {@link Config}. Missing keys fall back to {@code reference.conf}.
 *
 * @param defaultAskTimeout Timeout of an {@code ask} without explicit timeout.
 * @param historyLimit Number of messages the bus keeps for inspection.
 * @param processingDelay Artificial latency of every message an agent processes.
 * @param receivedLimit Number of received tells each agent remembers.
 */
public record RuntimeOptions(Duration defaultAskTimeout, int historyLimit, Duration processingDelay, int receivedLimit) {

    /**
     * Reads the options from a configuration.
     *
     * @param config The root configuration.
     * @return The options.
     * @throws IllegalArgumentException if a value is missing or invalid.
     */
    public static RuntimeOptions fromConfig(Config config) {
        try {
            Config finalConfig = config.withFallback(ConfigFactory.defaultReference()).getConfig("agenticscript");
            RuntimeOptions options = new RuntimeOptions(
                    finalConfig.getDuration("ask.default-timeout"),
                    finalConfig.getInt("bus.history-limit"),
                    finalConfig.getDuration("agent.processing-delay"),
                    finalConfig.getInt("agent.received-limit"));
            if (options.historyLimit <= 0 || options.receivedLimit <= 0) {
                throw new IllegalArgumentException("bus.history-limit and agent.received-limit must be positive");
            }
            if (options.processingDelay.isNegative()) {
                throw new IllegalArgumentException("agent.processing-delay cannot be negative");
            }
            return options;
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid agenticscript configuration", e);
        }
    }

    /**
     * @return The options defined by {@code reference.conf}.
     */
    public static RuntimeOptions defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    public RuntimeOptions withDefaultAskTimeout(Duration timeout) {
        return new RuntimeOptions(timeout, historyLimit, processingDelay, receivedLimit);
    }

    public RuntimeOptions withProcessingDelay(Duration delay) {
        return new RuntimeOptions(defaultAskTimeout, historyLimit, delay, receivedLimit);
    }
}
