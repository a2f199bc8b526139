package com.vigil.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Scheduled maintenance window attached to a host or service.
 *
 * <p>Fixed downtimes cover {@code [start, end)}. Flexible downtimes become active when triggered and
 * last {@code duration} from {@code triggerTime}, never past {@code end}.
 */
@JsonInclude(Include.NON_NULL)
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DowntimeRecord {
    String id;
    String author;
    String comment;
    Instant start;
    Instant end;
    @Builder.Default
    boolean fixed = true;
    Duration duration;
    Instant triggerTime;
}
