package com.vigil.service.core.ack;

import com.vigil.service.core.config.VigilProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Optional periodic pass clearing expired acknowledgements ahead of the next read. */
@Slf4j
@Component
@RequiredArgsConstructor
public class AcknowledgementExpirySweeper {

    private final AcknowledgementManager acknowledgementManager;
    private final VigilProperties properties;

    @Scheduled(fixedDelayString = "${vigil.acknowledgements.sweep.interval:PT1M}")
    public void sweep() {
        if (!properties.getAcknowledgements().getSweep().isEnabled()) {
            return;
        }
        try {
            int cleared = acknowledgementManager.expireStale();
            if (cleared > 0) {
                log.info("Acknowledgement sweep cleared {} expired acknowledgements", cleared);
            }
        } catch (RuntimeException ex) {
            log.warn("Acknowledgement sweep failed: {}", ex.getMessage());
            log.debug("Acknowledgement sweep failure stacktrace", ex);
        }
    }
}
