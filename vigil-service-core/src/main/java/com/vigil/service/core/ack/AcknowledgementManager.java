package com.vigil.service.core.ack;

import com.vigil.model.AcknowledgementType;
import com.vigil.model.ObjectKind;
import com.vigil.service.core.model.Checkable;
import com.vigil.service.core.registry.EntityRegistry;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Acknowledgement state of hosts and services.
 *
 * <p>Reading is a state transition: {@link #readAndMaybeExpireAcknowledgement(Checkable)} clears an
 * acknowledgement whose expiry has passed, so a stale acknowledgement is never reported as active even
 * without the optional sweep.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AcknowledgementManager {

    private final EntityRegistry registry;
    private final Clock clock;

    public AcknowledgementType readAndMaybeExpireAcknowledgement(Checkable checkable) {
        AcknowledgementType before = checkable.getStoredAcknowledgement();
        AcknowledgementType now = checkable.readAndMaybeExpireAcknowledgement(clock.instant());
        if (before != now && log.isDebugEnabled()) {
            log.debug("Acknowledgement of {} expired", checkable);
        }
        return now;
    }

    public boolean isAcknowledged(Checkable checkable) {
        return readAndMaybeExpireAcknowledgement(checkable) != AcknowledgementType.NONE;
    }

    public void setAcknowledgement(Checkable checkable, AcknowledgementType type) {
        checkable.setAcknowledgement(type);
    }

    /** {@code null} clears the expiry. */
    public void setAcknowledgementExpiry(Checkable checkable, Instant expiry) {
        checkable.setAcknowledgementExpiry(expiry);
    }

    public void acknowledge(Checkable checkable, AcknowledgementType type, Instant expiry) {
        checkable.setAcknowledgement(type);
        checkable.setAcknowledgementExpiry(expiry);
        log.info("{} acknowledged: type={} expiry={}", checkable, type, expiry);
    }

    public void clearAcknowledgement(Checkable checkable) {
        checkable.setAcknowledgement(AcknowledgementType.NONE);
        checkable.setAcknowledgementExpiry(null);
    }

    /** Expires every stale acknowledgement now. Returns the number cleared. */
    public int expireStale() {
        Instant now = clock.instant();
        int cleared = 0;
        for (ObjectKind kind : ObjectKind.values()) {
            for (Checkable checkable : registry.getAll(kind)) {
                AcknowledgementType before = checkable.getStoredAcknowledgement();
                if (before == AcknowledgementType.NONE) {
                    continue;
                }
                if (checkable.readAndMaybeExpireAcknowledgement(now) == AcknowledgementType.NONE) {
                    cleared++;
                }
            }
        }
        return cleared;
    }
}
