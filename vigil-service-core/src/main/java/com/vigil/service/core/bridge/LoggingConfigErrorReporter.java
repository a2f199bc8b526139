package com.vigil.service.core.bridge;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Default reporter: validation errors go to the log and are not retained. */
@Slf4j
@Component
public class LoggingConfigErrorReporter implements ConfigErrorReporter {

    @Override
    public void report(ConfigValidationError error) {
        if (error.warning()) {
            log.info("Config validation warning at {}: {}", error.location(), error.message());
        } else {
            log.warn("Config validation error at {}: {}", error.location(), error.message());
        }
    }
}
