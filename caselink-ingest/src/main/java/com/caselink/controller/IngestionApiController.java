package com.caselink.controller;

import com.caselink.exception.OrchestrationException;
import com.caselink.exception.UnknownSourceException;
import com.caselink.job.JobSnapshot;
import com.caselink.job.ScheduleStatus;
import com.caselink.model.CaseSource;
import com.caselink.model.FetchOptions;
import com.caselink.model.IngestionResult;
import com.caselink.model.IngestionStatus;
import com.caselink.service.IngestionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/ingestion")
public class IngestionApiController {

    private final IngestionService ingestionService;

    public IngestionApiController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    /**
     * Run an ingestion now and wait for it to finish.
     */
    @PostMapping("/{source}/trigger")
    public ResponseEntity<?> trigger(
            @PathVariable String source,
            @RequestParam(value = "maxPages", required = false) Integer maxPages) {
        try {
            IngestionResult result = ingestionService.trigger(source, FetchOptions.maxPages(maxPages));
            return ResponseEntity.ok(result);
        } catch (OrchestrationException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", e.getMessage());
            body.put("ingestionLogId", e.getIngestionLogId());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
        }
    }

    @PostMapping("/trigger")
    public ResponseEntity<Map<CaseSource, IngestionResult>> triggerAll() {
        return ResponseEntity.ok(ingestionService.triggerAll());
    }

    @GetMapping("/{source}/status")
    public ResponseEntity<IngestionStatus> status(@PathVariable String source) {
        return ResponseEntity.ok(ingestionService.getStatus(source));
    }

    /**
     * Queue a manual run ahead of scheduled ones.
     */
    @PostMapping("/{source}/jobs")
    public ResponseEntity<?> enqueue(
            @PathVariable String source,
            @RequestParam(value = "maxPages", required = false) Integer maxPages) {
        try {
            String jobId = ingestionService.enqueueManual(source, FetchOptions.maxPages(maxPages));
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("jobId", jobId));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<JobSnapshot> getJob(@PathVariable String jobId) {
        return ingestionService.getJob(jobId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/jobs/{jobId}")
    public ResponseEntity<?> cancelJob(@PathVariable String jobId) {
        if (ingestionService.getJob(jobId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (!ingestionService.cancelJob(jobId)) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", "Job is running or already finished"));
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/schedules")
    public ResponseEntity<List<ScheduleStatus>> schedules() {
        return ResponseEntity.ok(ingestionService.getSchedules());
    }

    @ExceptionHandler(UnknownSourceException.class)
    public ResponseEntity<Map<String, String>> unknownSource(UnknownSourceException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }
}
