package com.caselink.controller;

import com.caselink.exception.FetchException;
import com.caselink.exception.OrchestrationException;
import com.caselink.exception.UnknownSourceException;
import com.caselink.job.JobSnapshot;
import com.caselink.job.JobStatus;
import com.caselink.job.JobTrigger;
import com.caselink.job.ScheduleStatus;
import com.caselink.model.CaseSource;
import com.caselink.model.FetchOptions;
import com.caselink.model.IngestionResult;
import com.caselink.model.RecordError;
import com.caselink.service.IngestionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(IngestionApiController.class)
class IngestionApiControllerTest {

    private static final IngestionResult RESULT = new IngestionResult(CaseSource.FBI, 5, 3, 1, 0, 1, 1200,
        List.of(new RecordError("bad-1", "No identity")));

    @Autowired
    private MockMvc mvc;

    @MockBean
    private IngestionService ingestionService;

    @Nested
    @DisplayName("Synchronous trigger")
    class Trigger {

        @Test
        void returnsRunResult() throws Exception {
            when(ingestionService.trigger("fbi", FetchOptions.maxPages(2))).thenReturn(RESULT);

            mvc.perform(post("/api/ingestion/fbi/trigger").param("maxPages", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("FBI"))
                .andExpect(jsonPath("$.recordsInserted").value(3))
                .andExpect(jsonPath("$.errors[0].externalId").value("bad-1"));
        }

        @Test
        void failedRunIsBadGateway() throws Exception {
            OrchestrationException failure = new OrchestrationException(CaseSource.FBI, 17L,
                new FetchException("https://api.fbi.gov/wanted/v1/list", 3, new RuntimeException("timeout")));
            when(ingestionService.trigger(anyString(), any())).thenThrow(failure);

            mvc.perform(post("/api/ingestion/fbi/trigger"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.ingestionLogId").value(17))
                .andExpect(jsonPath("$.error").value(failure.getMessage()));
        }

        @Test
        void unknownSourceIsNotFound() throws Exception {
            when(ingestionService.trigger(anyString(), any())).thenThrow(new UnknownSourceException("nope"));

            mvc.perform(post("/api/ingestion/nope/trigger"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Unknown source: nope"));
        }

        @Test
        void triggerAllReturnsResultPerSource() throws Exception {
            when(ingestionService.triggerAll()).thenReturn(Map.of(CaseSource.FBI, RESULT));

            mvc.perform(post("/api/ingestion/trigger"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.FBI.recordsFetched").value(5));
        }
    }

    @Nested
    @DisplayName("Queued jobs")
    class Jobs {

        @Test
        void enqueueReturnsAccepted() throws Exception {
            when(ingestionService.enqueueManual("ncmec", FetchOptions.maxPages(null))).thenReturn("job-42");

            mvc.perform(post("/api/ingestion/ncmec/jobs"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value("job-42"));
        }

        @Test
        void enqueueOnStoppedQueueIsUnavailable() throws Exception {
            when(ingestionService.enqueueManual(anyString(), any()))
                .thenThrow(new IllegalStateException("Queue for ncmec is not accepting jobs"));

            mvc.perform(post("/api/ingestion/ncmec/jobs"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Queue for ncmec is not accepting jobs"));
        }

        @Test
        void enqueueForUnknownSourceIsNotFound() throws Exception {
            when(ingestionService.enqueueManual(anyString(), any())).thenThrow(new UnknownSourceException("nope"));

            mvc.perform(post("/api/ingestion/nope/jobs"))
                .andExpect(status().isNotFound());
        }

        @Test
        void getJobReturnsSnapshot() throws Exception {
            JobSnapshot snapshot = new JobSnapshot("job-42", "ncmec", JobTrigger.MANUAL, 1, JobStatus.COMPLETED,
                1, 3, Instant.parse("2024-06-01T10:00:00Z"), Instant.parse("2024-06-01T10:01:00Z"), null, RESULT);
            when(ingestionService.getJob("job-42")).thenReturn(Optional.of(snapshot));

            mvc.perform(get("/api/ingestion/jobs/job-42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.priority").value(1))
                .andExpect(jsonPath("$.result.recordsInserted").value(3));
        }

        @Test
        void missingJobIsNotFound() throws Exception {
            when(ingestionService.getJob("gone")).thenReturn(Optional.empty());

            mvc.perform(get("/api/ingestion/jobs/gone"))
                .andExpect(status().isNotFound());
        }

        @Test
        void cancelWaitingJob() throws Exception {
            when(ingestionService.getJob("job-1")).thenReturn(Optional.of(waiting("job-1")));
            when(ingestionService.cancelJob("job-1")).thenReturn(true);

            mvc.perform(delete("/api/ingestion/jobs/job-1"))
                .andExpect(status().isNoContent());
        }

        @Test
        void cancelRunningJobIsConflict() throws Exception {
            when(ingestionService.getJob("job-1")).thenReturn(Optional.of(waiting("job-1")));
            when(ingestionService.cancelJob("job-1")).thenReturn(false);

            mvc.perform(delete("/api/ingestion/jobs/job-1"))
                .andExpect(status().isConflict());
        }

        @Test
        void cancelUnknownJobIsNotFound() throws Exception {
            when(ingestionService.getJob("gone")).thenReturn(Optional.empty());

            mvc.perform(delete("/api/ingestion/jobs/gone"))
                .andExpect(status().isNotFound());
            verify(ingestionService, never()).cancelJob("gone");
        }

        private JobSnapshot waiting(String id) {
            return new JobSnapshot(id, "fbi", JobTrigger.SCHEDULED, 10, JobStatus.WAITING, 0, 3,
                Instant.parse("2024-06-01T10:00:00Z"), null, null, null);
        }
    }

    @Test
    void schedulesListsRegisteredCrons() throws Exception {
        when(ingestionService.getSchedules()).thenReturn(List.of(
            new ScheduleStatus("fbi-scheduled", "fbi", "0 0 */6 * * *",
                ZonedDateTime.of(2024, 6, 1, 12, 0, 0, 0, ZoneOffset.UTC))));

        mvc.perform(get("/api/ingestion/schedules"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].key").value("fbi-scheduled"))
            .andExpect(jsonPath("$[0].cron").value("0 0 */6 * * *"));
    }
}
