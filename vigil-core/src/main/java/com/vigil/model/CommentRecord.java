package com.vigil.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@JsonInclude(Include.NON_NULL)
@Value
@Builder
@Jacksonized
public class CommentRecord {
    String id;
    String author;
    String text;
    Instant entryTime;
    Instant expireTime;
}
