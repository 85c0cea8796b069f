package com.delta.listener.signal.model;

import java.time.Instant;
import java.util.List;

/**
 * A normalized piece of content from any source. HN stories, HN comments and RSS articles all map onto it.
 */
public record SourceItem(
    String id,
    SourceType sourceType,
    String author,
    String title,
    String body,
    String url,
    String permalink,
    Instant publishedAt,
    String parentId,
    List<String> childIds
) {
    public SourceItem {
        childIds = childIds == null ? List.of() : List.copyOf(childIds);
    }

    public String text() {
        StringBuilder sb = new StringBuilder();
        if (title != null && !title.isBlank()) {
            sb.append(title);
        }
        if (body != null && !body.isBlank()) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(body);
        }
        return sb.toString();
    }

    public String sourceUrl() {
        return permalink != null ? permalink : url;
    }
}
