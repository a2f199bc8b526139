package com.vigil.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Outcome of one check execution as delivered by the check subsystem. */
@JsonInclude(Include.NON_NULL)
@Value
@Builder
@Jacksonized
public class CheckResult {
    ServiceState state;
    String output;
    Instant executionStart;
    Instant executionEnd;
}
