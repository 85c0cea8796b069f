package com.delta.listener.signal.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HnUser(
    String id,
    long created,
    int karma,
    String about,
    List<Long> submitted
) {
    public HnUser {
        submitted = submitted == null ? List.of() : List.copyOf(submitted);
    }

    public Instant createdAt() {
        return created <= 0 ? null : Instant.ofEpochSecond(created);
    }
}
