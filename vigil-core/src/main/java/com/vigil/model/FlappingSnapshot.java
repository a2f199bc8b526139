package com.vigil.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Persistable flapping history of one entity. {@code buffer} is a 20-bit mask (bit n = slot n),
 * {@code index} the next slot to write (0..19).
 */
@JsonInclude(Include.NON_NULL)
@Value
@Builder
@Jacksonized
public class FlappingSnapshot {
    public static final int SLOTS = 20;
    public static final int MASK = (1 << SLOTS) - 1;

    int buffer;
    int index;
    double current;
    boolean flapping;
    Instant lastChange;

    public static FlappingSnapshot empty() {
        return FlappingSnapshot.builder().build();
    }
}
