package com.vigil.service.core.dependency;

import com.vigil.model.DowntimeRecord;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Fixed downtimes are active inside {@code [start, end)}. Flexible downtimes are active from their
 * trigger time for {@code duration}, and never past {@code end}.
 */
@Component
public class WindowDowntimeEvaluator implements DowntimeActivityEvaluator {

    @Override
    public boolean isActive(DowntimeRecord downtime, Instant now) {
        if (downtime == null || now == null) {
            return false;
        }
        if (downtime.getStart() != null && now.isBefore(downtime.getStart())) {
            return false;
        }
        if (downtime.getEnd() != null && !now.isBefore(downtime.getEnd())) {
            return false;
        }
        if (downtime.isFixed()) {
            return true;
        }
        Instant triggered = downtime.getTriggerTime();
        if (triggered == null || now.isBefore(triggered)) {
            return false;
        }
        return downtime.getDuration() == null || now.isBefore(triggered.plus(downtime.getDuration()));
    }
}
