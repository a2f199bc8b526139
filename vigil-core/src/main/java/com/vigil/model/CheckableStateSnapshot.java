package com.vigil.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * State of one entity that survives restarts. Caches and resolved dependency sets are never part of
 * it; they are rebuilt from the registry.
 */
@JsonInclude(Include.NON_NULL)
@Value
@Builder
@Jacksonized
public class CheckableStateSnapshot {
    ObjectKind kind;
    String name;
    FlappingSnapshot flapping;
    @Builder.Default
    AcknowledgementType acknowledgement = AcknowledgementType.NONE;
    Instant acknowledgementExpiry;
}
