package com.vigil.reference;

import com.vigil.service.core.config.VigilProperties;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Reference service that wires the health-state engine. */
@EnableScheduling
@Slf4j
@SpringBootApplication(scanBasePackages = {"com.vigil"})
public class VigilApplication {

    public static void main(String[] args) {
        long maxMemory = Runtime.getRuntime().maxMemory();
        log.info("Max memory: {} ({} bytes)", formatBytes(maxMemory), maxMemory);
        SpringApplication.run(VigilApplication.class, args);
    }

    @Bean
    ApplicationListener<ApplicationReadyEvent> engineSettingsLogger(VigilProperties properties) {
        return event -> log.info(
                "vigil ready: flapping={} (low={}, high={}), acknowledgement sweep={}, retention={} ({})",
                properties.getFlapping().isEnabled(),
                properties.getFlapping().getThresholdLow(),
                properties.getFlapping().getThresholdHigh(),
                properties.getAcknowledgements().getSweep().isEnabled(),
                properties.getRetention().isEnabled(),
                properties.getRetention().getPath());
    }

    static String formatBytes(long bytes) {
        if (bytes >= 1_073_741_824L) return String.format(Locale.ROOT, "%.2f GB", bytes / 1_073_741_824.0);
        if (bytes >= 1_048_576L) return String.format(Locale.ROOT, "%.2f MB", bytes / 1_048_576.0);
        return String.format(Locale.ROOT, "%d bytes", bytes);
    }
}
