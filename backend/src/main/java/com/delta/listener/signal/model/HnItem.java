package com.delta.listener.signal.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HnItem(
    long id,
    String type,
    String by,
    long time,
    String text,
    String url,
    String title,
    Long parent,
    List<Long> kids,
    Integer score,
    Integer descendants,
    boolean deleted,
    boolean dead
) {
    public HnItem {
        kids = kids == null ? List.of() : List.copyOf(kids);
    }

    public boolean isLive() {
        return !deleted && !dead;
    }

    public boolean isStory() {
        return "story".equals(type);
    }

    public boolean isComment() {
        return "comment".equals(type);
    }

    public Instant publishedAt() {
        return time <= 0 ? null : Instant.ofEpochSecond(time);
    }
}
