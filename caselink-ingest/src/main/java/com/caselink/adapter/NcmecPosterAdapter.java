package com.caselink.adapter;

import com.caselink.config.IngestionProperties;
import com.caselink.config.IngestionProperties.RetrySettings;
import com.caselink.config.IngestionProperties.SourceDefinition;
import com.caselink.exception.FetchException;
import com.caselink.exception.NormalizationException;
import com.caselink.model.CaseSource;
import com.caselink.model.FetchOptions;
import com.caselink.model.NormalizedCase;
import com.caselink.model.RecordStatus;
import com.caselink.service.Normalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * NCMEC public poster catalog. No credentials; the servlet answers JSON with
 * an unreliable content type, so the body is read as text and parsed here.
 */
@Component
public class NcmecPosterAdapter implements SourceAdapter<NcmecPosterRecord> {

    private static final Logger log = LoggerFactory.getLogger(NcmecPosterAdapter.class);

    static final String DEFAULT_BASE_URL = "https://api.missingkids.org/missingkids/servlet/JSONDataServlet";
    static final String PHOTO_HOST = "https://api.missingkids.org";
    private static final String DEFAULT_ORG_PREFIX = "NCMC";
    private static final int DEFAULT_MAX_PAGES = 10;
    private static final int DEFAULT_PAGE_SIZE = 25;
    private static final long DEFAULT_PAGE_DELAY_MS = 2_000;

    private final SourceHttpClient http;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final int maxPages;
    private final int pageSize;
    private final long pageDelayMs;
    private final RetrySettings retry;

    public NcmecPosterAdapter(SourceHttpClient http, IngestionProperties properties, ObjectMapper objectMapper) {
        SourceDefinition def = properties.getSource(CaseSource.NCMEC);
        this.http = http;
        this.objectMapper = objectMapper;
        this.baseUrl = def.baseUrlOr(DEFAULT_BASE_URL);
        this.maxPages = def.maxPagesOr(DEFAULT_MAX_PAGES);
        this.pageSize = def.pageSizeOr(DEFAULT_PAGE_SIZE);
        this.pageDelayMs = def.pageDelayMsOr(DEFAULT_PAGE_DELAY_MS);
        this.retry = def.retryOr(2, 1_000);
    }

    @Override
    public CaseSource source() {
        return CaseSource.NCMEC;
    }

    @Override
    public String sourceName() {
        return "NCMEC Public Search";
    }

    @Override
    public int pollingIntervalMinutes() {
        return 120;
    }

    @Override
    public List<NcmecPosterRecord> fetch(FetchOptions options) {
        int page = options.pageOr(1);
        int lastPage = page + options.maxPagesOr(maxPages) - 1;
        List<NcmecPosterRecord> all = new ArrayList<>();

        log.info("NCMEC adapter: starting fetch (pages {}-{})", page, lastPage);

        while (page <= lastPage) {
            String body;
            try {
                body = http.getText(pageUrl(page), retry);
            } catch (FetchException e) {
                log.warn("NCMEC adapter: page {} failed, stopping: {}", page, e.getMessage());
                break;
            }

            NcmecPosterRecord.Page data;
            try {
                data = objectMapper.readValue(body, NcmecPosterRecord.Page.class);
            } catch (JsonProcessingException e) {
                log.warn("NCMEC adapter: invalid JSON on page {}, stopping: {}", page, e.getOriginalMessage());
                break;
            }

            List<NcmecPosterRecord> records = data == null ? List.of() : data.records();
            if (records.isEmpty()) {
                log.info("NCMEC adapter: no more records at page {}", page);
                break;
            }
            all.addAll(records);

            Integer totalPages = data.totalPages();
            if (totalPages != null && totalPages > 0 && page >= totalPages) break;

            page++;
            http.pause(pageDelayMs);
        }

        log.info("NCMEC adapter: fetch complete ({} records)", all.size());
        return all;
    }

    @Override
    public void probe() {
        http.getText(baseUrl + "?action=publicSearch&searchLang=en&goToPage=1&pageSize=1", retry);
    }

    @Override
    public NormalizedCase normalize(NcmecPosterRecord record) {
        String prefix = record.orgPrefix() != null && !record.orgPrefix().isBlank()
            ? record.orgPrefix().trim() : DEFAULT_ORG_PREFIX;
        String caseNumber = Normalizer.emptyToNull(record.caseNumber());

        String externalId;
        if (caseNumber != null) {
            externalId = prefix + caseNumber;
        } else if (record.id() != null) {
            externalId = "NCMEC-" + record.id();
        } else {
            throw new NormalizationException("NCMEC record without case number or id");
        }

        String photo = record.imageUrl() != null ? record.imageUrl() : record.thumbnailUrl();
        List<String> photoUrls = photo == null || photo.isBlank() ? List.of() : List.of(absolutePhotoUrl(photo));

        String location = Stream.of(record.missingCity(), record.missingState())
            .map(Normalizer::emptyToNull)
            .filter(Objects::nonNull)
            .collect(Collectors.joining(", "));

        String country = Normalizer.normalizeCountryCode(record.missingCountry());

        String sourceUrl = record.url();
        if (sourceUrl == null && caseNumber != null) {
            sourceUrl = "https://www.missingkids.org/poster/" + prefix + "/" + caseNumber;
        }

        return new NormalizedCase(
            externalId,
            CaseSource.NCMEC,
            record.firstName(),
            record.lastName(),
            Normalizer.normalizeName(record.firstName(), record.lastName()),
            null,
            Normalizer.parseDate(record.missingDate()),
            location.isEmpty() ? null : location,
            null,
            null,
            country != null ? country : "US",
            null,
            Normalizer.normalizeGender(record.sex()),
            record.race(),
            Normalizer.parseAge(record.age()),
            null,
            Normalizer.parseHeight(record.height()),
            Normalizer.parseWeight(record.weight()),
            photoUrls,
            RecordStatus.MISSING,
            sourceUrl,
            objectMapper.valueToTree(record)
        );
    }

    private String pageUrl(int page) {
        return baseUrl + "?action=publicSearch&searchLang=en&goToPage=" + page + "&pageSize=" + pageSize;
    }

    static String absolutePhotoUrl(String path) {
        if (path.startsWith("http")) return path;
        return PHOTO_HOST + (path.startsWith("/") ? path : "/" + path);
    }
}
