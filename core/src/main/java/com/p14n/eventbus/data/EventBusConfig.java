package com.p14n.eventbus.data;

import java.util.Locale;
import java.util.Properties;

/**
 * Configuration for an event bus instance.
 *
 * <p>
 * Recognised property keys for {@link #fromProperties(Properties)}:
 * </p>
 * <ul>
 * <li>{@code eventbus.scope-name}: telemetry scope, default
 * {@value #DEFAULT_SCOPE_NAME}</li>
 * <li>{@code eventbus.process-policy}: one of {@link ProcessPolicy}, case
 * insensitive, default {@code DRAIN_UNTIL_EMPTY}</li>
 * </ul>
 *
 * @param scopeName     The OpenTelemetry instrumentation scope for the bus's
 *                      metrics and spans
 * @param processPolicy How {@code process()} treats messages posted while it
 *                      runs
 */
public record EventBusConfig(String scopeName, ProcessPolicy processPolicy) {

    /** Default telemetry scope name. */
    public static final String DEFAULT_SCOPE_NAME = "eventbus";

    /** Property key for the scope name. */
    public static final String SCOPE_NAME_KEY = "eventbus.scope-name";

    /** Property key for the process policy. */
    public static final String PROCESS_POLICY_KEY = "eventbus.process-policy";

    /**
     * Creates a new config.
     *
     * @param scopeName     telemetry scope name
     * @param processPolicy process policy
     * @throws IllegalArgumentException if either argument is null or the scope
     *                                  name is blank
     */
    public EventBusConfig {
        if (scopeName == null || scopeName.isBlank()) {
            throw new IllegalArgumentException("Scope name cannot be empty");
        }
        if (processPolicy == null) {
            throw new IllegalArgumentException("Process policy cannot be null");
        }
    }

    /**
     * Creates a config with the default scope name.
     *
     * @param processPolicy process policy
     */
    public EventBusConfig(ProcessPolicy processPolicy) {
        this(DEFAULT_SCOPE_NAME, processPolicy);
    }

    /**
     * Creates a config with the default process policy.
     *
     * @param scopeName telemetry scope name
     */
    public EventBusConfig(String scopeName) {
        this(scopeName, ProcessPolicy.DRAIN_UNTIL_EMPTY);
    }

    /**
     * Returns the default configuration.
     *
     * @return config with scope {@value #DEFAULT_SCOPE_NAME} and
     *         {@link ProcessPolicy#DRAIN_UNTIL_EMPTY}
     */
    public static EventBusConfig defaults() {
        return new EventBusConfig(DEFAULT_SCOPE_NAME, ProcessPolicy.DRAIN_UNTIL_EMPTY);
    }

    /**
     * Reads a config from properties, falling back to defaults for missing
     * keys.
     *
     * @param props the properties to read
     * @return the config
     * @throws IllegalArgumentException if props is null or the process policy
     *                                  is not recognised
     */
    public static EventBusConfig fromProperties(Properties props) {
        if (props == null) {
            throw new IllegalArgumentException("Properties cannot be null");
        }
        String scope = props.getProperty(SCOPE_NAME_KEY, DEFAULT_SCOPE_NAME).trim();
        String policy = props.getProperty(PROCESS_POLICY_KEY);
        return new EventBusConfig(scope, policy == null ? ProcessPolicy.DRAIN_UNTIL_EMPTY : parsePolicy(policy));
    }

    private static ProcessPolicy parsePolicy(String value) {
        try {
            return ProcessPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown process policy: " + value, e);
        }
    }
}
