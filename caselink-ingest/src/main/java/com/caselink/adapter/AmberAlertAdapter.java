package com.caselink.adapter;

import com.caselink.config.IngestionProperties;
import com.caselink.config.IngestionProperties.RetrySettings;
import com.caselink.config.IngestionProperties.SourceDefinition;
import com.caselink.exception.FetchException;
import com.caselink.exception.NormalizationException;
import com.caselink.model.CaseSource;
import com.caselink.model.FetchOptions;
import com.caselink.model.Gender;
import com.caselink.model.NormalizedCase;
import com.caselink.model.RecordStatus;
import com.caselink.service.Normalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * AMBER alert RSS feeds. Alerts are free text, so identity and demographics
 * are pulled out with a handful of patterns; anything that does not match is
 * left null. Feeds are not paginated.
 */
@Component
public class AmberAlertAdapter implements SourceAdapter<AmberFeedItem> {

    private static final Logger log = LoggerFactory.getLogger(AmberAlertAdapter.class);

    static final List<String> DEFAULT_FEEDS = List.of(
        "https://www.amberalert.gov/feed/rss",
        "https://www.missingkids.org/missingkids/servlet/RSSServlet"
    );
    private static final long DEFAULT_FEED_DELAY_MS = 1_000;

    private static final MediaType[] RSS_TYPES = {
        MediaType.parseMediaType("application/rss+xml"), MediaType.APPLICATION_XML, MediaType.TEXT_XML
    };

    private static final Pattern AGE = Pattern.compile("(\\d+)[\\s-]*year[\\s-]*old", Pattern.CASE_INSENSITIVE);
    private static final Pattern GENDER = Pattern.compile("\\b(male|female|boy|girl)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LOCATION = Pattern.compile(
        "(?:last seen|missing from|abducted from|from)\\s+([^,.]+(?:,\\s*[A-Z]{2})?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NAME = Pattern.compile(
        "(?:missing|alert)[:\\s]+([A-Z][A-Z\\s]+?)(?=,|\\s+\\d+|\\s+year)", Pattern.CASE_INSENSITIVE);
    static final int MAX_LOCATION_LENGTH = 200;
    private static final Pattern TAGS = Pattern.compile("<[^>]*>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // First match wins
    private static final List<String> RACE_TERMS = List.of(
        "white", "black", "hispanic", "asian", "native american", "multi-racial", "mixed");

    private final SourceHttpClient http;
    private final ObjectMapper objectMapper;
    private final List<String> feeds;
    private final long feedDelayMs;
    private final RetrySettings retry;

    public AmberAlertAdapter(SourceHttpClient http, IngestionProperties properties, ObjectMapper objectMapper) {
        SourceDefinition def = properties.getSource(CaseSource.AMBER);
        this.http = http;
        this.objectMapper = objectMapper;
        this.feeds = def.getFeeds() == null || def.getFeeds().isEmpty() ? DEFAULT_FEEDS : List.copyOf(def.getFeeds());
        this.feedDelayMs = def.pageDelayMsOr(DEFAULT_FEED_DELAY_MS);
        this.retry = def.retryOr(3, 5_000);
    }

    @Override
    public CaseSource source() {
        return CaseSource.AMBER;
    }

    @Override
    public String sourceName() {
        return "AMBER Alert RSS Feeds";
    }

    @Override
    public int pollingIntervalMinutes() {
        return 15;
    }

    @Override
    public String apiType() {
        return "rss";
    }

    @Override
    public List<AmberFeedItem> fetch(FetchOptions options) {
        List<AmberFeedItem> all = new ArrayList<>();
        log.info("AMBER adapter: fetching {} feed(s)", feeds.size());

        for (String feedUrl : feeds) {
            try {
                String xml = http.getText(feedUrl, retry, RSS_TYPES);
                all.addAll(RssFeedParser.parse(feedUrl, xml == null ? "" : xml));
            } catch (FetchException e) {
                log.warn("AMBER adapter: feed {} unavailable: {}", feedUrl, e.getMessage());
            } catch (SAXException | IOException e) {
                log.warn("AMBER adapter: feed {} is not valid RSS: {}", feedUrl, e.getMessage());
            }
            http.pause(feedDelayMs);
        }

        if (all.isEmpty()) {
            log.info("AMBER adapter: no items fetched (feeds may be unavailable or empty)");
        }
        log.info("AMBER adapter: fetch complete ({} items)", all.size());
        return all;
    }

    @Override
    public void probe() {
        http.getText(feeds.get(0), retry, RSS_TYPES);
    }

    @Override
    public NormalizedCase normalize(AmberFeedItem item) {
        String title = item.title() != null ? item.title() : "";
        String description = item.description() != null ? item.description()
            : item.contentEncoded() != null ? item.contentEncoded() : "";
        String cleanDescription = WHITESPACE.matcher(TAGS.matcher(description).replaceAll("")).replaceAll(" ").trim();
        String text = title + " " + cleanDescription;

        String externalId = externalId(item);
        if (externalId == null) {
            throw new NormalizationException("AMBER item without guid, link or title");
        }

        Normalizer.NameParts name = extractName(text);

        List<String> photoUrls = item.enclosureUrl() != null ? List.of(item.enclosureUrl()) : List.of();

        return new NormalizedCase(
            externalId,
            CaseSource.AMBER,
            name.firstName(),
            name.lastName(),
            Normalizer.normalizeName(name.firstName(), name.lastName()),
            null,
            Normalizer.parseDate(item.pubDate()),
            extractLocation(text),
            null,
            null,
            "US",
            cleanDescription.isEmpty() ? null : cleanDescription,
            extractGender(text),
            extractRace(text),
            extractAge(text),
            null,
            null,
            null,
            photoUrls,
            RecordStatus.MISSING,
            item.link(),
            objectMapper.valueToTree(item)
        );
    }

    static String externalId(AmberFeedItem item) {
        if (item.guid() != null && !item.guid().isBlank()) return item.guid();
        if (item.link() != null && !item.link().isBlank()) return item.link();
        if (item.title() == null || item.title().isBlank()) return null;
        String encoded = Base64.getEncoder().encodeToString(item.title().getBytes(StandardCharsets.UTF_8));
        return "amber-" + encoded.substring(0, Math.min(20, encoded.length()));
    }

    static Normalizer.NameParts extractName(String text) {
        Matcher m = NAME.matcher(text);
        if (!m.find()) return new Normalizer.NameParts(null, null);

        String[] parts = WHITESPACE.split(m.group(1).trim());
        if (parts.length == 1) return new Normalizer.NameParts(parts[0], null);
        return new Normalizer.NameParts(parts[0], String.join(" ", List.of(parts).subList(1, parts.length)));
    }

    static Integer extractAge(String text) {
        Matcher m = AGE.matcher(text);
        return m.find() ? Normalizer.parseAge(m.group(1)) : null;
    }

    static Gender extractGender(String text) {
        Matcher m = GENDER.matcher(text);
        return m.find() ? Normalizer.normalizeGender(m.group(1)) : Gender.UNKNOWN;
    }

    static String extractRace(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return RACE_TERMS.stream().filter(lower::contains).findFirst().orElse(null);
    }

    static String extractLocation(String text) {
        Matcher m = LOCATION.matcher(text);
        if (!m.find()) return null;
        String location = m.group(1).trim();
        if (location.length() > MAX_LOCATION_LENGTH) {
            location = location.substring(0, MAX_LOCATION_LENGTH).strip();
        }
        return Normalizer.emptyToNull(location);
    }
}
