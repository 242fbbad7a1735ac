package com.caselink.config;

import com.caselink.model.CaseSource;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Ingestion settings. Define sources in application.yml under
 * 'caselink.ingestion.sources'.
 */
@Configuration
@ConfigurationProperties(prefix = "caselink.ingestion")
public class IngestionProperties {

    private boolean schedulingEnabled = true;
    private boolean workerEnabled = true;
    private String userAgent = "CaseLink/1.0 (Missing Children Search Platform)";
    private Worker worker = new Worker();
    private List<SourceDefinition> sources = new ArrayList<>();

    public boolean isSchedulingEnabled() { return schedulingEnabled; }
    public void setSchedulingEnabled(boolean schedulingEnabled) { this.schedulingEnabled = schedulingEnabled; }

    public boolean isWorkerEnabled() { return workerEnabled; }
    public void setWorkerEnabled(boolean workerEnabled) { this.workerEnabled = workerEnabled; }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public Worker getWorker() { return worker; }
    public void setWorker(Worker worker) { this.worker = worker; }

    public List<SourceDefinition> getSources() { return sources; }
    public void setSources(List<SourceDefinition> sources) { this.sources = sources; }

    /**
     * Definition for the given source, or an empty one so adapters fall back
     * to their built-in defaults.
     */
    public SourceDefinition getSource(CaseSource source) {
        return sources.stream()
            .filter(s -> source.slug().equalsIgnoreCase(s.getSlug()))
            .findFirst()
            .orElseGet(() -> {
                SourceDefinition def = new SourceDefinition();
                def.setSlug(source.slug());
                return def;
            });
    }

    /**
     * Mutable class for Spring Boot configuration binding
     */
    public static class SourceDefinition {
        private String slug;
        private boolean enabled = true;
        private String cron;
        private String baseUrl;
        private Integer maxPages;
        private Integer pageSize;
        private Long pageDelayMs;
        private Integer retryAttempts;
        private Long retryInitialDelayMs;
        private List<String> feeds = new ArrayList<>();

        public int maxPagesOr(int fallback) { return maxPages != null ? maxPages : fallback; }
        public int pageSizeOr(int fallback) { return pageSize != null ? pageSize : fallback; }
        public long pageDelayMsOr(long fallback) { return pageDelayMs != null ? pageDelayMs : fallback; }
        public String baseUrlOr(String fallback) { return baseUrl != null && !baseUrl.isBlank() ? baseUrl : fallback; }

        public RetrySettings retryOr(int attempts, long initialDelayMs) {
            return new RetrySettings(
                retryAttempts != null ? retryAttempts : attempts,
                retryInitialDelayMs != null ? retryInitialDelayMs : initialDelayMs
            );
        }

        // Getters and setters for Spring Boot binding
        public String getSlug() { return slug; }
        public void setSlug(String slug) { this.slug = slug; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getCron() { return cron; }
        public void setCron(String cron) { this.cron = cron; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public Integer getMaxPages() { return maxPages; }
        public void setMaxPages(Integer maxPages) { this.maxPages = maxPages; }

        public Integer getPageSize() { return pageSize; }
        public void setPageSize(Integer pageSize) { this.pageSize = pageSize; }

        public Long getPageDelayMs() { return pageDelayMs; }
        public void setPageDelayMs(Long pageDelayMs) { this.pageDelayMs = pageDelayMs; }

        public Integer getRetryAttempts() { return retryAttempts; }
        public void setRetryAttempts(Integer retryAttempts) { this.retryAttempts = retryAttempts; }

        public Long getRetryInitialDelayMs() { return retryInitialDelayMs; }
        public void setRetryInitialDelayMs(Long retryInitialDelayMs) { this.retryInitialDelayMs = retryInitialDelayMs; }

        public List<String> getFeeds() { return feeds; }
        public void setFeeds(List<String> feeds) { this.feeds = feeds; }
    }

    public static class Worker {
        private long rateWindowMs = 60_000;
        private long shutdownTimeoutMs = 30_000;
        private int scheduledAttempts = 3;
        private long scheduledBackoffMs = 30_000;
        private int manualAttempts = 3;
        private long manualBackoffMs = 5_000;
        private int retainedJobs = 200;

        public long getRateWindowMs() { return rateWindowMs; }
        public void setRateWindowMs(long rateWindowMs) { this.rateWindowMs = rateWindowMs; }

        public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
        public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }

        public int getScheduledAttempts() { return scheduledAttempts; }
        public void setScheduledAttempts(int scheduledAttempts) { this.scheduledAttempts = scheduledAttempts; }

        public long getScheduledBackoffMs() { return scheduledBackoffMs; }
        public void setScheduledBackoffMs(long scheduledBackoffMs) { this.scheduledBackoffMs = scheduledBackoffMs; }

        public int getManualAttempts() { return manualAttempts; }
        public void setManualAttempts(int manualAttempts) { this.manualAttempts = manualAttempts; }

        public long getManualBackoffMs() { return manualBackoffMs; }
        public void setManualBackoffMs(long manualBackoffMs) { this.manualBackoffMs = manualBackoffMs; }

        public int getRetainedJobs() { return retainedJobs; }
        public void setRetainedJobs(int retainedJobs) { this.retainedJobs = retainedJobs; }
    }

    public record RetrySettings(int maxAttempts, long initialDelayMs) {}
}
