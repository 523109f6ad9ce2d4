package com.signalgate.collectors.rss;

import com.signalgate.collectors.api.FeedPollResult;
import com.signalgate.collectors.api.FeedSource;
import com.signalgate.collectors.config.FeedSourceConfig;
import com.signalgate.core.bus.EventBus;
import com.signalgate.core.events.AlertRaised;
import com.signalgate.core.model.RawArticle;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * RSS 2.0 and Atom feed reader. Items without a parseable publish date get {@link Instant#EPOCH}, which the
 * ingestor treats as too old.
 */
public class RssFeedSource implements FeedSource {
    private static final Logger LOGGER = Logger.getLogger(RssFeedSource.class.getName());

    private final HttpClient httpClient;
    private final EventBus eventBus;
    private final Clock clock;
    private final Duration requestTimeout;

    public RssFeedSource(HttpClient httpClient, EventBus eventBus, Clock clock, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.eventBus = eventBus;
        this.clock = clock;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String name() {
        return "rss";
    }

    @Override
    public CompletableFuture<FeedPollResult> poll(FeedSourceConfig source) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(source.url()))
                    .GET()
                    .timeout(requestTimeout)
                    .header("Accept", "application/rss+xml, application/atom+xml, application/xml, text/xml")
                    .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(fail(source, "Invalid feed URL: " + source.url()));
        }

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        return fail(source, "Feed fetch failed for " + source.name() + ": " + rootMessage(error));
                    }
                    if (response.statusCode() < 200 || response.statusCode() >= 300) {
                        return fail(source, "Feed " + source.name() + " returned HTTP " + response.statusCode());
                    }
                    ParseOutcome parsed = parseItemsOutcome(response.body(), source.name());
                    if (parsed.invalidXml()) {
                        return fail(source, "Invalid RSS/Atom XML for feed " + source.name());
                    }
                    LOGGER.fine(() -> "Feed " + source.name() + " returned " + parsed.items().size() + " items");
                    return FeedPollResult.success(source.name(), parsed.items());
                });
    }

    private FeedPollResult fail(FeedSourceConfig source, String message) {
        LOGGER.warning(message);
        eventBus.publish(new AlertRaised(
                clock.instant(),
                "feed",
                message,
                Map.of("source", source.name(), "url", source.url())
        ));
        return FeedPollResult.failure(source.name(), message);
    }

    static List<RawArticle> parseItems(String xml, String source) {
        return parseItemsOutcome(xml, source).items();
    }

    private static ParseOutcome parseItemsOutcome(String xml, String source) {
        if (xml == null || xml.isBlank()) {
            return new ParseOutcome(List.of(), true);
        }
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);

            var builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException exception) {
                    LOGGER.fine(() -> "Feed XML warning: " + exception.getMessage());
                }

                @Override
                public void error(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }

                @Override
                public void fatalError(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }
            });

            Document document = builder.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
            String root = document.getDocumentElement().getNodeName();
            if ("feed".equalsIgnoreCase(root)) {
                return new ParseOutcome(parseAtom(document, source), false);
            }
            return new ParseOutcome(parseRss(document, source), false);
        } catch (Exception e) {
            return new ParseOutcome(List.of(), true);
        }
    }

    private static List<RawArticle> parseRss(Document document, String source) {
        NodeList items = document.getElementsByTagName("item");
        List<RawArticle> articles = new ArrayList<>();
        for (int i = 0; i < items.getLength(); i++) {
            Node item = items.item(i);
            String title = childText(item, "title").orElse("(untitled)");
            String description = childText(item, "description").orElse("");
            String link = childText(item, "link").orElse("");
            Instant publishedAt = parseDate(childText(item, "pubDate").orElse(null));
            articles.add(new RawArticle(title, description, link, publishedAt, source));
        }
        return articles;
    }

    private static List<RawArticle> parseAtom(Document document, String source) {
        NodeList entries = document.getElementsByTagName("entry");
        List<RawArticle> articles = new ArrayList<>();
        for (int i = 0; i < entries.getLength(); i++) {
            Node entry = entries.item(i);
            String title = childText(entry, "title").orElse("(untitled)");
            String description = childText(entry, "summary").orElseGet(() -> childText(entry, "content").orElse(""));
            String link = childAttribute(entry, "link", "href").orElse("");
            Instant publishedAt = parseDate(childText(entry, "published")
                    .orElseGet(() -> childText(entry, "updated").orElse(null)));
            articles.add(new RawArticle(title, description, link, publishedAt, source));
        }
        return articles;
    }

    private static Optional<String> childText(Node parent, String tagName) {
        if (!(parent instanceof Element element)) {
            return Optional.empty();
        }
        NodeList children = element.getElementsByTagName(tagName);
        if (children.getLength() == 0) {
            return Optional.empty();
        }
        String text = children.item(0).getTextContent();
        return text == null ? Optional.empty() : Optional.of(text.trim());
    }

    private static Optional<String> childAttribute(Node parent, String tagName, String attribute) {
        if (!(parent instanceof Element element)) {
            return Optional.empty();
        }
        NodeList children = element.getElementsByTagName(tagName);
        if (children.getLength() == 0 || !(children.item(0) instanceof Element child)) {
            return Optional.empty();
        }
        String value = child.getAttribute(attribute);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    static Instant parseDate(String value) {
        if (value == null || value.isBlank()) {
            return Instant.EPOCH;
        }
        List<Function<String, Instant>> parsers = List.of(
                Instant::parse,
                v -> OffsetDateTime.parse(v).toInstant(),
                v -> ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant()
        );
        return parsers.stream()
                .map(parser -> safelyParse(parser, value.trim()))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .findFirst()
                .orElse(Instant.EPOCH);
    }

    private static Optional<Instant> safelyParse(Function<String, Instant> parser, String value) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    private record ParseOutcome(List<RawArticle> items, boolean invalidXml) {
    }
}
