package com.delta.listener.signal.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * An author bio as HN serves it (HTML with entity-escaped links) together with its decoded plain text and the
 * link targets of its anchors.
 */
public record BioText(String raw, String text, List<String> links) {
    public BioText {
        links = links == null ? List.of() : List.copyOf(links);
    }

    public static BioText of(String about) {
        if (about == null || about.isBlank()) {
            return new BioText(about, "", List.of());
        }
        Document document = Jsoup.parse(about);
        List<String> hrefs = new ArrayList<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.attr("href").trim();
            if (!href.isEmpty()) {
                hrefs.add(href);
            }
        }
        return new BioText(about, document.text(), hrefs);
    }

    public boolean isEmpty() {
        return text.isBlank();
    }
}
