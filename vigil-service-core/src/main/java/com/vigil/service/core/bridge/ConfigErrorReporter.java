package com.vigil.service.core.bridge;

/** Error context of the configuration compiler. */
@FunctionalInterface
public interface ConfigErrorReporter {
    void report(ConfigValidationError error);
}
