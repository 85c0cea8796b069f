package com.delta.listener.signal.source;

import com.delta.listener.signal.model.RssArticle;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Lenient RSS 2.0 / Atom reader. RSS {@code <item>} elements are read first; Atom {@code <entry>} elements only
 * when the document has no items. Entries missing a title or a link are dropped.
 */
@Component
public class RssFeedParser {
    private static final Logger log = LoggerFactory.getLogger(RssFeedParser.class);
    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
        value -> ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant(),
        value -> OffsetDateTime.parse(value).toInstant(),
        Instant::parse,
        value -> ZonedDateTime.parse(value, DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm:ss zzz", Locale.ENGLISH)).toInstant(),
        value -> ZonedDateTime.parse(value, DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm zzz", Locale.ENGLISH)).toInstant()
    );

    public List<RssArticle> parse(String xml) {
        if (xml == null || xml.isBlank()) {
            return List.of();
        }
        Document document = Jsoup.parse(xml, "", Parser.xmlParser());
        List<RssArticle> articles = new ArrayList<>();
        for (Element item : document.getElementsByTag("item")) {
            RssArticle article = new RssArticle(
                firstText(item, "title"),
                firstNonBlank(firstText(item, "link"), firstAttr(item, "link", "href")),
                firstText(item, "description"),
                firstNonBlank(firstText(item, "content:encoded"), firstText(item, "content")),
                parseDate(firstNonBlank(firstText(item, "pubDate"), firstText(item, "dc:date"))),
                firstNonBlank(firstText(item, "author"), firstText(item, "dc:creator")),
                allText(item, "category"),
                firstNonBlank(firstText(item, "guid"), firstText(item, "link")),
                null,
                null
            );
            addIfComplete(articles, article);
        }
        if (!articles.isEmpty()) {
            return articles;
        }
        for (Element entry : document.getElementsByTag("entry")) {
            RssArticle article = new RssArticle(
                firstText(entry, "title"),
                firstNonBlank(atomLink(entry), firstText(entry, "link")),
                firstText(entry, "summary"),
                firstText(entry, "content"),
                parseDate(firstNonBlank(firstText(entry, "published"), firstText(entry, "updated"))),
                firstNonBlank(firstText(entry, "name"), firstText(entry, "author")),
                atomCategories(entry),
                firstText(entry, "id"),
                null,
                null
            );
            addIfComplete(articles, article);
        }
        return articles;
    }

    static Instant parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        for (Function<String, Instant> parser : DATE_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                log.trace("Date {} not in this format: {}", value, e.getMessage());
            }
        }
        log.debug("Unparseable feed date '{}', treating article as undated", value);
        return null;
    }

    private void addIfComplete(List<RssArticle> articles, RssArticle article) {
        if (isBlank(article.title()) || isBlank(article.link())) {
            return;
        }
        articles.add(article);
    }

    private String atomLink(Element entry) {
        Elements links = entry.getElementsByTag("link");
        String fallback = null;
        for (Element link : links) {
            String href = link.attr("href").trim();
            if (href.isEmpty()) {
                continue;
            }
            String rel = link.attr("rel");
            if (rel.isEmpty() || "alternate".equals(rel)) {
                return href;
            }
            if (fallback == null) {
                fallback = href;
            }
        }
        return fallback;
    }

    private List<String> atomCategories(Element entry) {
        List<String> categories = new ArrayList<>();
        for (Element category : entry.getElementsByTag("category")) {
            String term = category.hasAttr("term") ? category.attr("term").trim() : category.text().trim();
            if (!term.isEmpty()) {
                categories.add(term);
            }
        }
        return categories;
    }

    private String firstText(Element parent, String tag) {
        Element element = parent.getElementsByTag(tag).first();
        if (element == null) {
            return null;
        }
        String text = element.text().trim();
        return text.isEmpty() ? null : text;
    }

    private String firstAttr(Element parent, String tag, String attribute) {
        Element element = parent.getElementsByTag(tag).first();
        if (element == null) {
            return null;
        }
        String value = element.attr(attribute).trim();
        return value.isEmpty() ? null : value;
    }

    private List<String> allText(Element parent, String tag) {
        List<String> values = new ArrayList<>();
        for (Element element : parent.getElementsByTag(tag)) {
            String text = element.text().trim();
            if (!text.isEmpty()) {
                values.add(text);
            }
        }
        return values;
    }

    private static String firstNonBlank(String first, String second) {
        return isBlank(first) ? (isBlank(second) ? null : second) : first;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Plain text of an HTML fragment, entities decoded and whitespace collapsed.
     */
    public static String htmlToText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }
}
