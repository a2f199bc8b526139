package com.vigil.service.core.dependency;

import com.vigil.model.DowntimeRecord;
import java.time.Instant;

/** Decides whether a downtime window is in effect. Supplied by the downtime subsystem. */
@FunctionalInterface
public interface DowntimeActivityEvaluator {
    boolean isActive(DowntimeRecord downtime, Instant now);
}
