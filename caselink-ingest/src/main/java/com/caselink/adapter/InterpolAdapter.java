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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Interpol yellow notices, restricted to minors. Each listed notice is
 * enriched with its detail document and image list; both are optional.
 */
@Component
public class InterpolAdapter implements SourceAdapter<InterpolNotice> {

    private static final Logger log = LoggerFactory.getLogger(InterpolAdapter.class);

    static final String DEFAULT_BASE_URL = "https://ws-public.interpol.int/notices/v1/yellow";
    private static final String NOTICE_PAGE_URL =
        "https://www.interpol.int/en/How-we-work/Notices/Yellow-Notices/View-Yellow-Notices/";
    private static final int DEFAULT_MAX_PAGES = 20;
    private static final int DEFAULT_PAGE_SIZE = 20;
    private static final long DEFAULT_PAGE_DELAY_MS = 1_000;

    private final SourceHttpClient http;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final int maxPages;
    private final int pageSize;
    private final long pageDelayMs;
    private final RetrySettings retry;

    public InterpolAdapter(SourceHttpClient http, IngestionProperties properties, ObjectMapper objectMapper) {
        SourceDefinition def = properties.getSource(CaseSource.INTERPOL);
        this.http = http;
        this.objectMapper = objectMapper;
        this.baseUrl = def.baseUrlOr(DEFAULT_BASE_URL);
        this.maxPages = def.maxPagesOr(DEFAULT_MAX_PAGES);
        this.pageSize = def.pageSizeOr(DEFAULT_PAGE_SIZE);
        this.pageDelayMs = def.pageDelayMsOr(DEFAULT_PAGE_DELAY_MS);
        this.retry = def.retryOr(3, 5_000);
    }

    @Override
    public CaseSource source() {
        return CaseSource.INTERPOL;
    }

    @Override
    public String sourceName() {
        return "Interpol Yellow Notices (Children)";
    }

    @Override
    public int pollingIntervalMinutes() {
        return 360;
    }

    @Override
    public List<InterpolNotice> fetch(FetchOptions options) {
        int page = options.pageOr(1);
        int lastPage = page + options.maxPagesOr(maxPages) - 1;
        List<InterpolNotice> all = new ArrayList<>();

        log.info("Interpol adapter: starting fetch (pages {}-{})", page, lastPage);

        while (page <= lastPage) {
            InterpolNotice.Page data;
            try {
                data = http.getJson(pageUrl(page), InterpolNotice.Page.class, retry);
            } catch (FetchException e) {
                log.error("Interpol adapter: page {} failed, keeping {} notices: {}",
                    page, all.size(), e.getMessage());
                break;
            }

            List<InterpolNotice.Notice> notices = data == null ? List.of() : data.notices();
            if (notices.isEmpty()) {
                log.info("Interpol adapter: no more records at page {}", page);
                break;
            }

            for (InterpolNotice.Notice notice : notices) {
                all.add(enrich(notice));
                http.pause(pageDelayMs);
            }

            if (!data.hasNext()) break;
            page++;
            http.pause(pageDelayMs);
        }

        log.info("Interpol adapter: fetch complete ({} notices)", all.size());
        return all;
    }

    @Override
    public void probe() {
        http.getJson(baseUrl + "?ageMin=0&ageMax=17&resultPerPage=1&page=1", InterpolNotice.Page.class, retry);
    }

    InterpolNotice enrich(InterpolNotice.Notice notice) {
        InterpolNotice.Notice detail = null;
        String selfHref = href(notice.links() == null ? null : notice.links().self());
        if (selfHref != null) {
            try {
                detail = http.getJson(selfHref, InterpolNotice.Notice.class, retry);
            } catch (FetchException e) {
                log.warn("Interpol adapter: detail for {} unavailable, using summary: {}",
                    notice.entityId(), e.getMessage());
            }
        }

        List<String> photoUrls = new ArrayList<>();
        String imagesHref = href(notice.links() == null ? null : notice.links().images());
        String thumbnailHref = href(notice.links() == null ? null : notice.links().thumbnail());
        if (imagesHref != null) {
            try {
                InterpolNotice.ImagePage images = http.getJson(imagesHref, InterpolNotice.ImagePage.class, retry);
                if (images != null) {
                    for (InterpolNotice.Picture picture : images.pictures()) {
                        String url = href(picture.links() == null ? null : picture.links().self());
                        if (url != null) photoUrls.add(url);
                    }
                }
            } catch (FetchException e) {
                log.debug("Interpol adapter: images for {} unavailable: {}", notice.entityId(), e.getMessage());
            }
        } else if (thumbnailHref != null) {
            photoUrls.add(thumbnailHref);
        }

        return new InterpolNotice(notice, detail, photoUrls);
    }

    @Override
    public NormalizedCase normalize(InterpolNotice record) {
        InterpolNotice.Notice summary = record.summary();
        if (summary == null || summary.entityId() == null || summary.entityId().isBlank()) {
            throw new NormalizationException("Interpol notice without entity_id");
        }
        InterpolNotice.Notice best = record.best();

        String firstName = summary.forename() != null ? summary.forename() : best.forename();
        String lastName = summary.name() != null ? summary.name() : best.name();
        String dob = summary.dateOfBirth() != null ? summary.dateOfBirth() : best.dateOfBirth();

        List<String> nationalities = best.nationalities() != null ? best.nationalities() : summary.nationalities();
        String country = nationalities == null || nationalities.isEmpty()
            ? null : Normalizer.normalizeCountryCode(nationalities.get(0));

        String description = best.specificAlertText() != null ? best.specificAlertText()
            : best.distinguishingMarks() != null ? best.distinguishingMarks()
            : summary.distinguishingMarks();

        String place = summary.placeOfBirth() != null ? summary.placeOfBirth() : best.placeOfBirth();
        String sex = best.sexId() != null ? best.sexId() : summary.sexId();

        return new NormalizedCase(
            summary.entityId(),
            CaseSource.INTERPOL,
            firstName,
            lastName,
            Normalizer.normalizeName(firstName, lastName),
            Normalizer.parseDate(dob),
            null,
            place,
            null,
            null,
            country,
            description,
            Normalizer.normalizeGender(sex),
            null,
            null,
            null,
            Normalizer.metersToCm(best.height()),
            best.weight() == null ? null : (int) Math.round(best.weight()),
            record.photoUrls(),
            RecordStatus.MISSING,
            NOTICE_PAGE_URL + summary.entityId().replace('/', '-'),
            objectMapper.valueToTree(record)
        );
    }

    private String pageUrl(int page) {
        return baseUrl + "?ageMin=0&ageMax=17&resultPerPage=" + pageSize + "&page=" + page;
    }

    private static String href(InterpolNotice.Link link) {
        return link == null || link.href() == null || link.href().isBlank() ? null : link.href();
    }
}
