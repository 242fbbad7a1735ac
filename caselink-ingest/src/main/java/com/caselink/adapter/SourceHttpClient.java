package com.caselink.adapter;

import com.caselink.config.IngestionProperties;
import com.caselink.config.IngestionProperties.RetrySettings;
import com.caselink.exception.FetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.util.function.Supplier;

/**
 * HTTP access shared by all adapters: bounded retry with exponential backoff
 * and a pause primitive for pacing requests at the source's tolerated rate.
 */
@Component
public class SourceHttpClient {

    private static final Logger log = LoggerFactory.getLogger(SourceHttpClient.class);
    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final RestClient restClient;
    private final Sleeper sleeper;

    public SourceHttpClient(RestClient.Builder restClientBuilder, IngestionProperties properties, Sleeper sleeper) {
        this.restClient = restClientBuilder
            .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
            .build();
        this.sleeper = sleeper;
    }

    /**
     * GET a JSON document and bind it to {@code type}.
     *
     * @throws FetchException once all attempts have failed
     */
    public <T> T getJson(String url, Class<T> type, RetrySettings retry) {
        return execute(url, retry, () -> restClient.get()
            .uri(URI.create(url))
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .body(type));
    }

    /**
     * GET a document as text, e.g. an RSS feed or a JSON body with a
     * misleading content type.
     *
     * @throws FetchException once all attempts have failed
     */
    public String getText(String url, RetrySettings retry, MediaType... accept) {
        return execute(url, retry, () -> restClient.get()
            .uri(URI.create(url))
            .accept(accept.length > 0 ? accept : new MediaType[] {MediaType.ALL})
            .retrieve()
            .body(String.class));
    }

    /**
     * Wait between requests. An interrupt is preserved for the caller.
     */
    public void pause(long millis) {
        if (millis <= 0) return;
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while pacing requests");
        }
    }

    private <T> T execute(String url, RetrySettings retry, Supplier<T> request) {
        int maxAttempts = Math.max(1, retry.maxAttempts());
        RetryTemplate template = retryTemplate(maxAttempts, retry.initialDelayMs());
        try {
            return template.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.debug("Retrying {} (attempt {}/{})", url, context.getRetryCount() + 1, maxAttempts);
                }
                return request.get();
            });
        } catch (RestClientException | BackOffInterruptedException e) {
            throw new FetchException(url, maxAttempts, e);
        }
    }

    private RetryTemplate retryTemplate(int maxAttempts, long initialDelayMs) {
        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(initialDelayMs);
        backOff.setMultiplier(BACKOFF_MULTIPLIER);
        backOff.setMaxInterval(Math.max(1, initialDelayMs) << Math.max(0, maxAttempts - 1));
        backOff.setSleeper(sleeper);

        return RetryTemplate.builder()
            .maxAttempts(maxAttempts)
            .customBackoff(backOff)
            .retryOn(RestClientException.class)
            .build();
    }
}
