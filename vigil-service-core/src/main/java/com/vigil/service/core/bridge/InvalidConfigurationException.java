package com.vigil.service.core.bridge;

/** A configuration object cannot be materialized as declared. */
public class InvalidConfigurationException extends IllegalArgumentException {
    private final String reason;
    private final String location;

    public InvalidConfigurationException(String message) {
        this(message, null);
    }

    public InvalidConfigurationException(String message, String location) {
        super(location == null ? message : message + " (" + location + ")");
        this.reason = message;
        this.location = location;
    }

    /** Message without the location suffix. */
    public String reason() {
        return reason;
    }

    public String location() {
        return location;
    }
}
