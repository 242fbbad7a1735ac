package com.caselink.service;

import com.caselink.exception.PersistenceException;
import com.caselink.model.ExactMatch;
import com.caselink.model.Image;
import com.caselink.model.MissingCase;
import com.caselink.model.NormalizedCase;
import com.caselink.model.Person;
import com.caselink.repository.CaseRepository;
import com.caselink.repository.CaseSourceRecordRepository;
import com.caselink.repository.ImageRepository;
import com.caselink.repository.PersonRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Transactional writes for one ingested record. Each public method commits
 * all of its rows or none of them; failures surface as
 * {@link PersistenceException} after rollback.
 */
@Service
public class CaseWriter {

    static final String CASE_TYPE_MISSING = "missing";
    static final String URGENCY_STANDARD = "standard";
    static final String IMAGE_TYPE_PHOTO = "photo";

    // Column widths from schema.sql; free text longer than these is clipped.
    static final int LOCATION_WIDTH = 512;
    static final int NAME_WIDTH = 255;
    static final int NORMALIZED_NAME_WIDTH = 512;
    static final int ETHNICITY_WIDTH = 255;

    private final CaseRepository cases;
    private final PersonRepository persons;
    private final ImageRepository images;
    private final CaseSourceRecordRepository sourceRecords;
    private final Clock clock;

    public CaseWriter(CaseRepository cases, PersonRepository persons, ImageRepository images,
                      CaseSourceRecordRepository sourceRecords, Clock clock) {
        this.cases = cases;
        this.persons = persons;
        this.images = images;
        this.sourceRecords = sourceRecords;
        this.clock = clock;
    }

    public record CreatedCase(Long caseId, Long personId) {}

    /**
     * Insert case, person, images and the originating provenance row.
     */
    @Transactional
    public CreatedCase create(NormalizedCase record, int qualityScore) {
        Instant now = clock.instant();
        try {
            Long caseId = cases.insert(toCase(record, qualityScore, now));
            Long personId = persons.insert(toPerson(record, caseId));

            List<String> urls = record.photoUrls();
            for (int i = 0; i < urls.size(); i++) {
                images.insert(new Image(
                    null,
                    personId,
                    urls.get(i),
                    record.source().slug() + "/" + record.externalId() + "/photo-" + i,
                    IMAGE_TYPE_PHOTO,
                    i == 0,
                    record.source().slug()
                ));
            }

            sourceRecords.insert(caseId, record.source().slug(), record.externalId(), record.sourceUrl(),
                now, rawJson(record));
            return new CreatedCase(caseId, personId);
        } catch (DataAccessException e) {
            throw new PersistenceException(record.externalId(), "Failed to create case: " + rootMessage(e), e);
        }
    }

    /**
     * Re-ingestion of a known record. An originating record refreshes its
     * case and person; an attached record only refreshes its provenance row.
     */
    @Transactional
    public void refresh(ExactMatch match, NormalizedCase record, int qualityScore) {
        Instant now = clock.instant();
        try {
            if (match.originating()) {
                cases.refresh(match.caseId(), qualityScore, record.description(),
                    clip(record.lastSeenLocation(), LOCATION_WIDTH),
                    record.sourceUrl(), now);
                persons.refreshMeasurements(match.personId(), record.heightCm(), record.weightKg());
            }
            sourceRecords.refresh(match.sourceRecordId(), now, rawJson(record));
        } catch (DataAccessException e) {
            throw new PersistenceException(record.externalId(), "Failed to update case: " + rootMessage(e), e);
        }
    }

    /**
     * Record {@code record} as another source's view of an existing case.
     */
    @Transactional
    public void attach(Long caseId, NormalizedCase record) {
        try {
            sourceRecords.upsert(caseId, record.source().slug(), record.externalId(), record.sourceUrl(),
                clock.instant(), rawJson(record));
        } catch (DataAccessException e) {
            throw new PersistenceException(record.externalId(), "Failed to attach provenance: " + rootMessage(e), e);
        }
    }

    static MissingCase toCase(NormalizedCase record, int qualityScore, Instant now) {
        Instant reportedAt = record.missingDate() != null
            ? record.missingDate().atStartOfDay(ZoneOffset.UTC).toInstant()
            : now;
        return new MissingCase(
            null,
            Normalizer.caseNumber(record),
            CASE_TYPE_MISSING,
            Normalizer.caseStatus(record.status()),
            URGENCY_STANDARD,
            qualityScore,
            reportedAt,
            record.source().slug(),
            record.externalId(),
            record.sourceUrl(),
            record.missingDate(),
            clip(record.lastSeenLocation(), LOCATION_WIDTH),
            record.lastSeenLat(),
            record.lastSeenLng(),
            record.lastSeenCountry(),
            record.description(),
            now
        );
    }

    static String clip(String value, int width) {
        if (value == null || value.length() <= width) return value;
        return value.substring(0, width).strip();
    }

    static Person toPerson(NormalizedCase record, Long caseId) {
        return new Person(
            null,
            caseId,
            Person.ROLE_MISSING_CHILD,
            clip(record.firstName(), NAME_WIDTH),
            clip(record.lastName(), NAME_WIDTH),
            clip(record.nameNormalized() != null
                ? record.nameNormalized()
                : Normalizer.normalizeName(record.firstName(), record.lastName()), NORMALIZED_NAME_WIDTH),
            record.dateOfBirth(),
            record.age(),
            record.ageRange() != null ? record.ageRange().min() : null,
            record.ageRange() != null ? record.ageRange().max() : null,
            record.gender().dbValue(),
            record.lastSeenCountry(),
            clip(record.race(), ETHNICITY_WIDTH),
            record.heightCm(),
            record.weightKg()
        );
    }

    private static String rawJson(NormalizedCase record) {
        return record.rawData() != null ? record.rawData().toString() : null;
    }

    private static String rootMessage(DataAccessException e) {
        Throwable root = e.getMostSpecificCause();
        return root.getMessage() != null ? root.getMessage() : e.getClass().getSimpleName();
    }
}
