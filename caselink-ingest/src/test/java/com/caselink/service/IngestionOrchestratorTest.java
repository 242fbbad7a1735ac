package com.caselink.service;

import com.caselink.adapter.FbiAdapter;
import com.caselink.adapter.SourceAdapter;
import com.caselink.adapter.SourceHttpClient;
import com.caselink.config.IngestionProperties;
import com.caselink.exception.NormalizationException;
import com.caselink.exception.OrchestrationException;
import com.caselink.model.CaseSource;
import com.caselink.model.DataSource;
import com.caselink.model.FetchOptions;
import com.caselink.model.Gender;
import com.caselink.model.Image;
import com.caselink.model.IngestionLog;
import com.caselink.model.IngestionResult;
import com.caselink.model.MissingCase;
import com.caselink.model.NormalizedCase;
import com.caselink.model.Person;
import com.caselink.model.RecordStatus;
import com.caselink.model.RunStatus;
import com.caselink.repository.CaseRepository;
import com.caselink.repository.CaseSourceRecordRepository;
import com.caselink.repository.DataSourceRepository;
import com.caselink.repository.ImageRepository;
import com.caselink.repository.IngestionLogRepository;
import com.caselink.repository.PersonRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@SpringBootTest
@ActiveProfiles("test")
@Sql(scripts = "/sql/cleanup.sql", executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class IngestionOrchestratorTest {

    private static final LocalDate MARIA_DOB = LocalDate.of(2015, 5, 1);

    @Autowired
    private IngestionOrchestrator orchestrator;

    @Autowired
    private CaseRepository caseRepository;

    @Autowired
    private PersonRepository personRepository;

    @Autowired
    private ImageRepository imageRepository;

    @Autowired
    private CaseSourceRecordRepository sourceRecordRepository;

    @Autowired
    private DataSourceRepository dataSourceRepository;

    @Autowired
    private IngestionLogRepository ingestionLogRepository;

    @Nested
    @DisplayName("new records")
    class NewRecords {

        @Test
        void createsCasePersonImagesAndProvenance() {
            NormalizedCase record = TestRecords.complete(CaseSource.FBI, "fbi-100");

            IngestionResult result = orchestrator.run(StubAdapter.of(CaseSource.FBI, record), FetchOptions.defaults());

            assertThat(result.recordsFetched()).isEqualTo(1);
            assertThat(result.recordsInserted()).isEqualTo(1);
            assertThat(result.errors()).isEmpty();

            List<MissingCase> cases = caseRepository.findBySource("fbi");
            assertThat(cases).hasSize(1);
            MissingCase created = cases.get(0);
            assertThat(created.caseNumber()).isEqualTo("FBI-fbi-100");
            assertThat(created.caseType()).isEqualTo("missing");
            assertThat(created.status()).isEqualTo(MissingCase.STATUS_ACTIVE);
            assertThat(created.qualityScore()).isEqualTo(100);
            assertThat(created.sourceId()).isEqualTo("fbi-100");

            List<Person> persons = personRepository.findByCaseId(created.id());
            assertThat(persons).singleElement().satisfies(p -> {
                assertThat(p.role()).isEqualTo(Person.ROLE_MISSING_CHILD);
                assertThat(p.nameNormalized()).isEqualTo("jane doe");
                assertThat(p.gender()).isEqualTo("female");
                assertThat(p.nationality()).isEqualTo("US");
            });

            List<Image> images = imageRepository.findByPersonId(persons.get(0).id());
            assertThat(images).singleElement().satisfies(i -> {
                assertThat(i.primary()).isTrue();
                assertThat(i.storageKey()).isEqualTo("fbi/fbi-100/photo-0");
            });

            assertThat(sourceRecordRepository.findByCaseId(created.id()))
                .extracting(r -> r.sourceSlug() + "/" + r.sourceId())
                .containsExactly("fbi/fbi-100");
        }

        @Test
        void onlyFirstImageIsPrimary() {
            NormalizedCase record = TestRecords.withPhotos(CaseSource.NCMEC, "NCMC-7", "Ana", "Lima",
                List.of("https://example.org/a.jpg", "https://example.org/b.jpg", "https://example.org/c.jpg"));

            orchestrator.run(StubAdapter.of(CaseSource.NCMEC, record), FetchOptions.defaults());

            Person person = personRepository.findByCaseId(caseRepository.findBySource("ncmec").get(0).id()).get(0);
            assertThat(imageRepository.findByPersonId(person.id()))
                .extracting(Image::primary)
                .containsExactly(true, false, false);
        }

        @Test
        void logAndDataSourceReflectRun() {
            orchestrator.run(StubAdapter.of(CaseSource.FBI,
                TestRecords.named(CaseSource.FBI, "fbi-1", "Jane", "Doe"),
                TestRecords.named(CaseSource.FBI, "fbi-2", "John", "Roe")), FetchOptions.defaults());

            DataSource dataSource = dataSourceRepository.findBySlug("fbi").orElseThrow();
            assertThat(dataSource.name()).isEqualTo("Stub fbi");
            assertThat(dataSource.apiType()).isEqualTo("rest");
            assertThat(dataSource.totalRecordsFetched()).isEqualTo(2);
            assertThat(dataSource.totalRecordsInserted()).isEqualTo(2);
            assertThat(dataSource.lastSuccessAt()).isNotNull();

            List<IngestionLog> logs = ingestionLogRepository.findRecent(dataSource.id(), 10);
            assertThat(logs).singleElement().satisfies(l -> {
                assertThat(l.status()).isEqualTo(RunStatus.SUCCESS);
                assertThat(l.recordsFetched()).isEqualTo(2);
                assertThat(l.recordsInserted()).isEqualTo(2);
                assertThat(l.completedAt()).isNotNull();
                assertThat(l.durationMs()).isNotNull();
            });
        }
    }

    @Nested
    @DisplayName("re-ingestion")
    class ReIngestion {

        @Test
        void sameSourceRerunUpdatesWithoutNewRows() {
            StubAdapter adapter = StubAdapter.of(CaseSource.FBI,
                TestRecords.complete(CaseSource.FBI, "fbi-1"),
                TestRecords.named(CaseSource.FBI, "fbi-2", "John", "Roe"));

            IngestionResult first = orchestrator.run(adapter, FetchOptions.defaults());
            int cases = caseRepository.count();
            int persons = personRepository.count();
            int images = imageRepository.count();
            int provenance = sourceRecordRepository.count();

            IngestionResult second = orchestrator.run(adapter, FetchOptions.defaults());

            assertThat(first.recordsInserted()).isEqualTo(2);
            assertThat(second.recordsInserted()).isZero();
            assertThat(second.recordsUpdated()).isEqualTo(2);
            assertThat(caseRepository.count()).isEqualTo(cases);
            assertThat(personRepository.count()).isEqualTo(persons);
            assertThat(imageRepository.count()).isEqualTo(images);
            assertThat(sourceRecordRepository.count()).isEqualTo(provenance);
        }

        @Test
        void countersAccumulateAcrossRuns() {
            StubAdapter adapter = StubAdapter.of(CaseSource.FBI,
                TestRecords.named(CaseSource.FBI, "fbi-1", "Jane", "Doe"));

            orchestrator.run(adapter, FetchOptions.defaults());
            orchestrator.run(adapter, FetchOptions.defaults());
            orchestrator.run(adapter, FetchOptions.defaults());

            DataSource dataSource = dataSourceRepository.findBySlug("fbi").orElseThrow();
            assertThat(dataSource.totalRecordsFetched()).isEqualTo(3);
            assertThat(dataSource.totalRecordsInserted()).isEqualTo(1);
            assertThat(dataSource.totalRecordsUpdated()).isEqualTo(2);
            assertThat(ingestionLogRepository.findRecent(dataSource.id(), 10)).hasSize(3);
        }
    }

    @Nested
    @DisplayName("cross-source merge")
    class CrossSource {

        @Test
        void fuzzyDuplicateAttachesProvenance() {
            orchestrator.run(StubAdapter.of(CaseSource.FBI, TestRecords.person(CaseSource.FBI, "fbi-maria",
                "Maria", "Silva", MARIA_DOB, Gender.FEMALE)), FetchOptions.defaults());

            IngestionResult ncmec = orchestrator.run(StubAdapter.of(CaseSource.NCMEC,
                TestRecords.person(CaseSource.NCMEC, "NCMC-maria", "Maria", "Da Silva",
                    MARIA_DOB.plusDays(2), Gender.FEMALE)), FetchOptions.defaults());

            assertThat(ncmec.recordsSkipped()).isEqualTo(1);
            assertThat(ncmec.recordsInserted()).isZero();
            assertThat(caseRepository.count()).isEqualTo(1);
            assertThat(personRepository.count()).isEqualTo(1);

            Long caseId = caseRepository.findBySource("fbi").get(0).id();
            assertThat(sourceRecordRepository.findByCaseId(caseId))
                .extracting(r -> r.sourceSlug() + "/" + r.sourceId())
                .containsExactlyInAnyOrder("fbi/fbi-maria", "ncmec/NCMC-maria");
        }

        @Test
        void attachedRecordRerunIsAnUpdate() {
            orchestrator.run(StubAdapter.of(CaseSource.FBI, TestRecords.person(CaseSource.FBI, "fbi-maria",
                "Maria", "Silva", MARIA_DOB, Gender.FEMALE)), FetchOptions.defaults());
            StubAdapter ncmec = StubAdapter.of(CaseSource.NCMEC, TestRecords.person(CaseSource.NCMEC,
                "NCMC-maria", "Maria", "Da Silva", MARIA_DOB.plusDays(2), Gender.FEMALE));
            orchestrator.run(ncmec, FetchOptions.defaults());

            IngestionResult rerun = orchestrator.run(ncmec, FetchOptions.defaults());

            assertThat(rerun.recordsUpdated()).isEqualTo(1);
            assertThat(caseRepository.count()).isEqualTo(1);
            assertThat(sourceRecordRepository.count()).isEqualTo(2);
        }

        @Test
        void dissimilarNamesCreateSeparateCases() {
            orchestrator.run(StubAdapter.of(CaseSource.FBI,
                TestRecords.named(CaseSource.FBI, "fbi-1", "Maria", "Silva")), FetchOptions.defaults());

            IngestionResult result = orchestrator.run(StubAdapter.of(CaseSource.INTERPOL,
                TestRecords.named(CaseSource.INTERPOL, "2024/1", "Joanna", "Kowalska")), FetchOptions.defaults());

            assertThat(result.recordsInserted()).isEqualTo(1);
            assertThat(caseRepository.count()).isEqualTo(2);
        }

        @Test
        void onlyFirstFiftyCandidatesAreConsidered() {
            List<NormalizedCase> ncmec = new ArrayList<>();
            for (int i = 1; i < 60; i++) {
                ncmec.add(TestRecords.named(CaseSource.NCMEC, "NCMC-" + i, "Child", "Number " + i));
            }
            ncmec.add(TestRecords.named(CaseSource.NCMEC, "NCMC-60", "Maria", "Silva"));
            orchestrator.run(new StubAdapter(CaseSource.NCMEC, () -> ncmec), FetchOptions.defaults());
            assertThat(caseRepository.count()).isEqualTo(60);

            IngestionResult fbi = orchestrator.run(StubAdapter.of(CaseSource.FBI,
                TestRecords.named(CaseSource.FBI, "fbi-maria", "Maria", "Silva")), FetchOptions.defaults());

            assertThat(fbi.recordsInserted()).isEqualTo(1);
            assertThat(fbi.recordsSkipped()).isZero();
            assertThat(caseRepository.count()).isEqualTo(61);
        }

        @Test
        void matchWithinCandidateCapIsFound() {
            List<NormalizedCase> ncmec = new ArrayList<>();
            for (int i = 1; i < 10; i++) {
                ncmec.add(TestRecords.named(CaseSource.NCMEC, "NCMC-" + i, "Child", "Number " + i));
            }
            ncmec.add(TestRecords.named(CaseSource.NCMEC, "NCMC-10", "Maria", "Silva"));
            orchestrator.run(new StubAdapter(CaseSource.NCMEC, () -> ncmec), FetchOptions.defaults());

            IngestionResult fbi = orchestrator.run(StubAdapter.of(CaseSource.FBI,
                TestRecords.named(CaseSource.FBI, "fbi-maria", "Maria", "Silva")), FetchOptions.defaults());

            assertThat(fbi.recordsSkipped()).isEqualTo(1);
            assertThat(caseRepository.count()).isEqualTo(10);
        }
    }

    @Nested
    @DisplayName("record failures")
    class RecordFailures {

        @Test
        void normalizationFailuresAreCounted() {
            IngestionResult result = orchestrator.run(StubAdapter.of(CaseSource.AMBER,
                TestRecords.named(CaseSource.AMBER, "bad-1", "Jane", "Doe"),
                TestRecords.named(CaseSource.AMBER, "amber-2", "John", "Roe"),
                TestRecords.named(CaseSource.AMBER, "bad-3", "Ann", "Poe")), FetchOptions.defaults());

            assertThat(result.recordsFetched()).isEqualTo(3);
            assertThat(result.recordsFailed()).isEqualTo(2);
            assertThat(result.recordsInserted()).isEqualTo(1);
            assertThat(result.errors()).extracting(e -> e.error())
                .containsExactly("No identity for bad-1", "No identity for bad-3");
        }

        @Test
        void failedImageRollsBackWholeCase() {
            String tooLong = "https://example.org/" + "x".repeat(2049);
            NormalizedCase broken = TestRecords.withPhotos(CaseSource.FBI, "fbi-broken", "Jane", "Doe",
                List.of("https://example.org/ok.jpg", tooLong));
            NormalizedCase fine = TestRecords.named(CaseSource.FBI, "fbi-fine", "John", "Roe");

            IngestionResult result = orchestrator.run(StubAdapter.of(CaseSource.FBI, broken, fine),
                FetchOptions.defaults());

            assertThat(result.recordsFailed()).isEqualTo(1);
            assertThat(result.recordsInserted()).isEqualTo(1);
            assertThat(result.errors()).singleElement()
                .satisfies(e -> assertThat(e.externalId()).isEqualTo("fbi-broken"));

            assertThat(caseRepository.findBySource("fbi"))
                .extracting(MissingCase::sourceId)
                .containsExactly("fbi-fine");
            assertThat(personRepository.count()).isEqualTo(1);
            assertThat(imageRepository.count()).isZero();
            assertThat(sourceRecordRepository.count()).isEqualTo(1);
        }

        @Test
        void oversizedFreeTextIsClippedNotLost() {
            String location = "Last seen near " + "the old mill road ".repeat(40);
            String first = "A".repeat(300);
            NormalizedCase record = new NormalizedCase("amber-long", CaseSource.AMBER, first, "Doe",
                Normalizer.normalizeName(first, "Doe"), null, null, location, null, null, "US", null,
                Gender.FEMALE, "white ".repeat(60), 8, null, null, null, List.of(), RecordStatus.MISSING,
                null, null);

            IngestionResult result = orchestrator.run(StubAdapter.of(CaseSource.AMBER, record),
                FetchOptions.defaults());

            assertThat(result.recordsFailed()).isZero();
            assertThat(result.recordsInserted()).isEqualTo(1);
            MissingCase saved = caseRepository.findBySource("amber").get(0);
            assertThat(saved.lastSeenLocation()).hasSizeLessThanOrEqualTo(CaseWriter.LOCATION_WIDTH)
                .startsWith("Last seen near the old mill road");
            Person person = personRepository.findByCaseId(saved.id()).get(0);
            assertThat(person.firstName()).hasSize(CaseWriter.NAME_WIDTH);
            assertThat(person.ethnicity()).hasSizeLessThanOrEqualTo(CaseWriter.ETHNICITY_WIDTH);
        }

        @Test
        void recordedErrorsAreCapped() {
            List<NormalizedCase> bad = new ArrayList<>();
            for (int i = 0; i < 60; i++) {
                bad.add(TestRecords.named(CaseSource.FBI, "bad-" + i, "Jane", "Doe"));
            }

            IngestionResult result = orchestrator.run(new StubAdapter(CaseSource.FBI, () -> bad),
                FetchOptions.defaults());

            assertThat(result.recordsFailed()).isEqualTo(60);
            assertThat(result.errors()).hasSize(50);

            DataSource dataSource = dataSourceRepository.findBySlug("fbi").orElseThrow();
            assertThat(dataSource.totalRecordsFailed()).isEqualTo(60);
            IngestionLog log = ingestionLogRepository.findRecent(dataSource.id(), 1).get(0);
            assertThat(log.status()).isEqualTo(RunStatus.SUCCESS);
            assertThat(log.errorDetails()).contains("bad-0").doesNotContain("bad-50");
        }
    }

    @Nested
    @DisplayName("run failures")
    class RunFailures {

        @Test
        void fetchFailureMarksLogAndRethrows() {
            StubAdapter adapter = new StubAdapter(CaseSource.INTERPOL, () -> {
                throw new IllegalStateException("upstream unavailable");
            });

            assertThatThrownBy(() -> orchestrator.run(adapter, FetchOptions.defaults()))
                .isInstanceOf(OrchestrationException.class)
                .hasMessageContaining("upstream unavailable")
                .satisfies(e -> assertThat(((OrchestrationException) e).getIngestionLogId()).isNotNull());

            DataSource dataSource = dataSourceRepository.findBySlug("interpol").orElseThrow();
            assertThat(dataSource.lastErrorMessage()).isEqualTo("upstream unavailable");
            assertThat(dataSource.lastErrorAt()).isNotNull();
            assertThat(dataSource.lastSuccessAt()).isNull();

            IngestionLog log = ingestionLogRepository.findRecent(dataSource.id(), 1).get(0);
            assertThat(log.status()).isEqualTo(RunStatus.ERROR);
            assertThat(log.errorMessage()).isEqualTo("upstream unavailable");
            assertThat(log.errorDetails()).contains("\"error\"");
            assertThat(log.completedAt()).isNotNull();
        }

        @Test
        void longErrorMessagesAreTruncated() {
            String message = "e".repeat(1200);
            StubAdapter adapter = new StubAdapter(CaseSource.FBI, () -> {
                throw new IllegalStateException(message);
            });

            assertThatThrownBy(() -> orchestrator.run(adapter, FetchOptions.defaults()))
                .isInstanceOf(OrchestrationException.class);

            DataSource dataSource = dataSourceRepository.findBySlug("fbi").orElseThrow();
            assertThat(dataSource.lastErrorMessage()).hasSize(500);
            assertThat(ingestionLogRepository.findRecent(dataSource.id(), 1).get(0).errorMessage()).hasSize(1000);
        }

        @Test
        void pageFailureMidFetchStillCompletesRunWithEarlierPages() {
            RestClient.Builder builder = RestClient.builder();
            MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
            IngestionProperties properties = new IngestionProperties();
            FbiAdapter adapter = new FbiAdapter(new SourceHttpClient(builder, properties, millis -> { }),
                properties, new ObjectMapper());
            server.expect(requestTo(fbiPageUrl(1)))
                .andRespond(withSuccess(fbiPageBody(250, "uid-1", "DOE, JANE"), MediaType.APPLICATION_JSON));
            server.expect(requestTo(fbiPageUrl(2)))
                .andRespond(withSuccess(fbiPageBody(250, "uid-2", "ROE, MARK"), MediaType.APPLICATION_JSON));
            server.expect(ExpectedCount.times(3), requestTo(fbiPageUrl(3))).andRespond(withServerError());

            IngestionResult result = orchestrator.run(adapter, FetchOptions.maxPages(5));

            server.verify();
            assertThat(result.recordsFetched()).isEqualTo(2);
            assertThat(result.recordsInserted()).isEqualTo(2);
            assertThat(result.recordsFailed()).isZero();
            assertThat(caseRepository.findBySource("fbi"))
                .extracting(MissingCase::sourceId)
                .containsExactlyInAnyOrder("uid-1", "uid-2");

            DataSource dataSource = dataSourceRepository.findBySlug("fbi").orElseThrow();
            assertThat(dataSource.lastSuccessAt()).isNotNull();
            IngestionLog log = ingestionLogRepository.findRecent(dataSource.id(), 1).get(0);
            assertThat(log.status()).isEqualTo(RunStatus.SUCCESS);
            assertThat(log.recordsFetched()).isEqualTo(2);
        }

        @Test
        void runAllContinuesPastFailingSource() {
            StubAdapter failing = new StubAdapter(CaseSource.INTERPOL, () -> {
                throw new IllegalStateException("down");
            });
            StubAdapter working = StubAdapter.of(CaseSource.FBI,
                TestRecords.named(CaseSource.FBI, "fbi-1", "Jane", "Doe"));

            Map<CaseSource, IngestionResult> results = orchestrator.runAll(List.of(failing, working),
                (source, run) -> run.get());

            assertThat(results).containsOnlyKeys(CaseSource.FBI);
            assertThat(results.get(CaseSource.FBI).recordsInserted()).isEqualTo(1);
        }
    }

    private static String fbiPageUrl(int page) {
        return "https://api.fbi.gov/wanted/v1/list?page=" + page + "&pageSize=50";
    }

    private static String fbiPageBody(int total, String uid, String title) {
        return "{\"total\":" + total + ",\"page\":1,\"items\":[{\"uid\":\"" + uid + "\",\"title\":\""
            + title + "\",\"poster_classification\":\"missing\"}]}";
    }

    /**
     * Adapter whose raw records are already normalized. External ids starting
     * with "bad-" fail normalization.
     */
    static class StubAdapter implements SourceAdapter<NormalizedCase> {

        private final CaseSource source;
        private final Supplier<List<NormalizedCase>> records;

        StubAdapter(CaseSource source, Supplier<List<NormalizedCase>> records) {
            this.source = source;
            this.records = records;
        }

        static StubAdapter of(CaseSource source, NormalizedCase... records) {
            List<NormalizedCase> list = List.of(records);
            return new StubAdapter(source, () -> list);
        }

        @Override
        public CaseSource source() {
            return source;
        }

        @Override
        public String sourceName() {
            return "Stub " + source.slug();
        }

        @Override
        public int pollingIntervalMinutes() {
            return 60;
        }

        @Override
        public List<NormalizedCase> fetch(FetchOptions options) {
            return records.get();
        }

        @Override
        public NormalizedCase normalize(NormalizedCase raw) {
            if (raw.externalId().startsWith("bad-")) {
                throw new NormalizationException("No identity for " + raw.externalId());
            }
            return raw;
        }

        @Override
        public void probe() {
        }
    }
}
