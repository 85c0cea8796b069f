package com.delta.listener.signal.model;

import java.time.Instant;
import java.util.List;

public record RssArticle(
    String title,
    String link,
    String description,
    String content,
    Instant publishedAt,
    String author,
    List<String> categories,
    String guid,
    String feedName,
    String feedCategory
) {
    public RssArticle {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public RssArticle withFeed(String name, String category) {
        return new RssArticle(title, link, description, content, publishedAt, author, categories, guid, name, category);
    }
}
