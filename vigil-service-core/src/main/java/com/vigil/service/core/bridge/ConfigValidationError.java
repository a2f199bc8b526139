package com.vigil.service.core.bridge;

/** Error surfaced to the configuration compiler without aborting compilation. */
public record ConfigValidationError(String location, String message, boolean warning) {}
