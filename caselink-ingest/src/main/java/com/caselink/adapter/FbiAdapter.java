package com.caselink.adapter;

import com.caselink.config.IngestionProperties;
import com.caselink.config.IngestionProperties.RetrySettings;
import com.caselink.config.IngestionProperties.SourceDefinition;
import com.caselink.exception.FetchException;
import com.caselink.exception.NormalizationException;
import com.caselink.model.AgeRange;
import com.caselink.model.CaseSource;
import com.caselink.model.FetchOptions;
import com.caselink.model.Gender;
import com.caselink.model.NormalizedCase;
import com.caselink.model.RecordStatus;
import com.caselink.service.Normalizer;
import com.caselink.service.Normalizer.NameParts;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * FBI Wanted API. The API cannot filter on missing persons server-side, so
 * every poster is fetched and classified here.
 */
@Component
public class FbiAdapter implements SourceAdapter<FbiRecord> {

    private static final Logger log = LoggerFactory.getLogger(FbiAdapter.class);

    static final String DEFAULT_BASE_URL = "https://api.fbi.gov/wanted/v1/list";
    private static final int DEFAULT_MAX_PAGES = 30;
    private static final int DEFAULT_PAGE_SIZE = 50;
    private static final long DEFAULT_PAGE_DELAY_MS = 1_000;

    private static final Set<String> MISSING_CLASSIFICATIONS = Set.of("missing", "kidnapping");
    private static final Set<String> MISSING_SUBJECTS = Set.of(
        "kidnappings and missing persons",
        "vicap missing persons",
        "vicap unidentified persons"
    );
    private static final Pattern AGE_RANGE = Pattern.compile("(\\d+)\\D+(\\d+)");

    private final SourceHttpClient http;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final int maxPages;
    private final int pageSize;
    private final long pageDelayMs;
    private final RetrySettings retry;

    public FbiAdapter(SourceHttpClient http, IngestionProperties properties, ObjectMapper objectMapper) {
        SourceDefinition def = properties.getSource(CaseSource.FBI);
        this.http = http;
        this.objectMapper = objectMapper;
        this.baseUrl = def.baseUrlOr(DEFAULT_BASE_URL);
        this.maxPages = def.maxPagesOr(DEFAULT_MAX_PAGES);
        this.pageSize = def.pageSizeOr(DEFAULT_PAGE_SIZE);
        this.pageDelayMs = def.pageDelayMsOr(DEFAULT_PAGE_DELAY_MS);
        this.retry = def.retryOr(3, 1_000);
    }

    @Override
    public CaseSource source() {
        return CaseSource.FBI;
    }

    @Override
    public String sourceName() {
        return "FBI Wanted - Missing Persons";
    }

    @Override
    public int pollingIntervalMinutes() {
        return 360;
    }

    @Override
    public List<FbiRecord> fetch(FetchOptions options) {
        int page = options.pageOr(1);
        int lastPage = page + options.maxPagesOr(maxPages) - 1;
        List<FbiRecord> all = new ArrayList<>();

        log.info("FBI adapter: starting fetch (pages {}-{})", page, lastPage);

        while (page <= lastPage) {
            FbiRecord.Page data;
            try {
                data = http.getJson(pageUrl(page), FbiRecord.Page.class, retry);
            } catch (FetchException e) {
                log.error("FBI adapter: page {} failed, keeping {} records already fetched: {}",
                    page, all.size(), e.getMessage());
                break;
            }

            if (data == null || data.items() == null || data.items().isEmpty()) {
                log.info("FBI adapter: no more records at page {}", page);
                break;
            }
            all.addAll(data.items());

            int totalPages = (int) Math.ceil(data.total() / (double) pageSize);
            if (page >= totalPages) break;

            page++;
            http.pause(pageDelayMs);
        }

        List<FbiRecord> candidates = all.stream()
            .filter(r -> modifiedSince(r, options.since()))
            .toList();

        // No poster classified as missing usually means the schema moved; keep all.
        List<FbiRecord> missing = candidates.stream().filter(FbiAdapter::isMissingPerson).toList();
        List<FbiRecord> result = missing.isEmpty() ? candidates : missing;

        log.info("FBI adapter: fetch complete ({} fetched, {} kept)", all.size(), result.size());
        return result;
    }

    @Override
    public void probe() {
        http.getJson(baseUrl + "?page=1&pageSize=1", FbiRecord.Page.class, retry);
    }

    /**
     * True when the poster describes a missing or kidnapped person rather than
     * a fugitive wanted for kidnapping.
     */
    static boolean isMissingPerson(FbiRecord record) {
        if (record.missingPersons() != null && !record.missingPersons().isEmpty()) return true;

        String posterClass = record.posterClassification();
        if (posterClass != null && MISSING_CLASSIFICATIONS.contains(posterClass.trim().toLowerCase(Locale.ROOT))) {
            return true;
        }

        if (record.subjects() == null) return false;
        return record.subjects().stream()
            .filter(Objects::nonNull)
            .map(s -> s.trim().toLowerCase(Locale.ROOT))
            .anyMatch(MISSING_SUBJECTS::contains);
    }

    @Override
    public NormalizedCase normalize(FbiRecord record) {
        if (record.uid() == null || record.uid().isBlank()) {
            throw new NormalizationException("FBI record without uid: " + record.title());
        }

        NameParts name = Normalizer.splitFullName(record.title());

        LocalDate dateOfBirth = null;
        if (record.datesOfBirthUsed() != null && !record.datesOfBirthUsed().isEmpty()) {
            dateOfBirth = Normalizer.parseDate(record.datesOfBirthUsed().get(0));
        }

        FbiRecord.MissingPerson missing = record.missingPersons() != null && !record.missingPersons().isEmpty()
            ? record.missingPersons().get(0) : null;

        List<String> photoUrls = record.images() == null ? List.of() : record.images().stream()
            .map(FbiRecord.Image::original)
            .filter(url -> url != null && !url.isBlank())
            .toList();

        Gender gender = Normalizer.normalizeGender(
            record.sex() != null ? record.sex() : missing != null ? missing.sex() : null);

        String race = firstText(record.raceRaw());
        if (race == null) race = record.race();
        if (race == null && missing != null) race = missing.race();

        return new NormalizedCase(
            record.uid(),
            CaseSource.FBI,
            name.firstName(),
            name.lastName(),
            Normalizer.normalizeName(name.firstName(), name.lastName()),
            dateOfBirth,
            missing != null ? Normalizer.parseDate(missing.date()) : null,
            missing != null ? missing.missingFrom() : null,
            null,
            null,
            "US",
            record.description(),
            gender,
            race,
            missing != null ? Normalizer.parseAge(missing.age()) : null,
            ageRange(record),
            Normalizer.inchesToCm(record.heightMin()),
            Normalizer.lbsToKg(record.weightMin()),
            photoUrls,
            RecordStatus.MISSING,
            record.url() != null ? record.url() : "https://www.fbi.gov/wanted/kidnap/" + record.uid(),
            objectMapper.valueToTree(record)
        );
    }

    private String pageUrl(int page) {
        return baseUrl + "?page=" + page + "&pageSize=" + pageSize;
    }

    private static boolean modifiedSince(FbiRecord record, Instant since) {
        if (since == null || record.modified() == null) return true;
        try {
            return !OffsetDateTime.parse(record.modified()).toInstant().isBefore(since);
        } catch (DateTimeParseException e) {
            return true;
        }
    }

    private static AgeRange ageRange(FbiRecord record) {
        JsonNode range = record.ageRange();
        if (range != null && range.isArray() && range.size() >= 2
                && range.get(0).canConvertToInt() && range.get(1).canConvertToInt()) {
            return new AgeRange(range.get(0).asInt(), range.get(1).asInt());
        }
        if (range != null && range.isTextual()) {
            Matcher m = AGE_RANGE.matcher(range.asText());
            if (m.find()) {
                Integer min = Normalizer.parseAge(m.group(1));
                Integer max = Normalizer.parseAge(m.group(2));
                if (min != null && max != null) return new AgeRange(min, max);
            }
        }
        if (record.ageMin() != null && record.ageMax() != null) {
            return new AgeRange(record.ageMin(), record.ageMax());
        }
        return null;
    }

    private static String firstText(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isArray()) {
            return node.size() > 0 && node.get(0).isTextual() ? node.get(0).asText() : null;
        }
        return node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }
}
