package com.vigil.service.core.flapping;

import com.vigil.model.FlappingSnapshot;
import com.vigil.service.core.config.VigilProperties;
import com.vigil.service.core.model.Checkable;
import java.time.Clock;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Tracks state-change frequency over the last {@value FlappingSnapshot#SLOTS} evaluations of an entity.
 *
 * <p>Each evaluation writes one bit into a circular history. The flap percentage weights recent
 * changes more heavily: the slot at position {@code i}, counted from the oldest, contributes
 * {@code 0.8 + 0.02 * i}. The result is not normalized (a single newest change counts 5.9, a single
 * oldest one 4.0, a full history 99) and thresholds are calibrated against that scale. Hysteresis: a
 * flapping entity stays flapping while the percentage is above the low threshold, a calm one starts
 * flapping only above the high threshold. Both comparisons are strict.
 */
@Slf4j
@Component
public class FlappingDetector {

    private static final double BASE_WEIGHT = 0.8;
    private static final double WEIGHT_STEP = 0.02;

    private final VigilProperties properties;
    private final Clock clock;

    public FlappingDetector(VigilProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /** Records one evaluation cycle. Serialized per entity. */
    public FlappingSnapshot updateFlappingStatus(Checkable checkable, boolean stateChanged) {
        double low = thresholdLow(checkable);
        double high = thresholdHigh(checkable);
        FlappingSnapshot next =
                checkable.updateFlapping(previous -> advance(previous, stateChanged, low, high, clock.instant()));
        if (log.isDebugEnabled()) {
            log.debug(
                    "Flapping update {}: changed={} value={} flapping={}",
                    checkable,
                    stateChanged,
                    next.getCurrent(),
                    next.isFlapping());
        }
        return next;
    }

    /**
     * Reported flapping state: requires flapping detection to be enabled both globally and on the
     * entity, regardless of the stored flag.
     */
    public boolean isFlapping(Checkable checkable) {
        if (!properties.getFlapping().isEnabled() || !checkable.isEnableFlapping()) {
            return false;
        }
        return checkable.getFlapping().isFlapping();
    }

    public double getFlappingCurrent(Checkable checkable) {
        return checkable.getFlapping().getCurrent();
    }

    public double thresholdLow(Checkable checkable) {
        Double value = checkable.getFlappingThresholdLow();
        return value != null ? value : properties.getFlapping().getThresholdLow();
    }

    public double thresholdHigh(Checkable checkable) {
        Double value = checkable.getFlappingThresholdHigh();
        return value != null ? value : properties.getFlapping().getThresholdHigh();
    }

    static FlappingSnapshot advance(
            FlappingSnapshot previous, boolean stateChanged, double thresholdLow, double thresholdHigh, Instant now) {
        int writeIndex = Math.floorMod(previous.getIndex(), FlappingSnapshot.SLOTS);
        int buffer = previous.getBuffer() & FlappingSnapshot.MASK;
        if (stateChanged) {
            buffer |= 1 << writeIndex;
        } else {
            buffer &= ~(1 << writeIndex);
        }
        int oldestIndex = (writeIndex + 1) % FlappingSnapshot.SLOTS;

        double value = flapPercentage(buffer, oldestIndex);

        boolean wasFlapping = previous.isFlapping();
        boolean flapping = wasFlapping ? value > thresholdLow : value > thresholdHigh;

        return FlappingSnapshot.builder()
                .buffer(buffer)
                .index(oldestIndex)
                .current(value)
                .flapping(flapping)
                .lastChange(flapping != wasFlapping ? now : previous.getLastChange())
                .build();
    }

    /** Weighted percentage of set slots, iterating from {@code oldestIndex} towards the newest. */
    static double flapPercentage(int buffer, int oldestIndex) {
        double stateChanges = 0;
        for (int i = 0; i < FlappingSnapshot.SLOTS; i++) {
            int index = (oldestIndex + i) % FlappingSnapshot.SLOTS;
            if ((buffer & (1 << index)) != 0) {
                stateChanges += BASE_WEIGHT + (WEIGHT_STEP * i);
            }
        }
        return 100.0 * stateChanges / FlappingSnapshot.SLOTS;
    }
}
