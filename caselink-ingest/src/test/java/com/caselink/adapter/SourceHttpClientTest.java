package com.caselink.adapter;

import com.caselink.config.IngestionProperties;
import com.caselink.config.IngestionProperties.RetrySettings;
import com.caselink.exception.FetchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SourceHttpClientTest {

    private static final String URL = "https://upstream.example.org/list?page=1";

    private MockRestServiceServer server;
    private SourceHttpClient http;
    private final List<Long> sleeps = new ArrayList<>();

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        http = new SourceHttpClient(builder, new IngestionProperties(), sleeps::add);
    }

    @Test
    void sendsUserAgent() {
        server.expect(requestTo(URL))
            .andExpect(method(HttpMethod.GET))
            .andExpect(header(HttpHeaders.USER_AGENT, "CaseLink/1.0 (Missing Children Search Platform)"))
            .andRespond(withSuccess("{\"ok\":true}", MediaType.APPLICATION_JSON));

        @SuppressWarnings("unchecked")
        Map<String, Object> body = http.getJson(URL, Map.class, new RetrySettings(3, 1_000));

        assertThat(body).containsEntry("ok", true);
        server.verify();
    }

    @Test
    void retriesWithExponentialBackoffThenSucceeds() {
        server.expect(ExpectedCount.times(2), requestTo(URL)).andRespond(withServerError());
        server.expect(requestTo(URL)).andRespond(withSuccess("hello", MediaType.TEXT_PLAIN));

        String body = http.getText(URL, new RetrySettings(3, 1_000));

        assertThat(body).isEqualTo("hello");
        assertThat(sleeps).containsExactly(1_000L, 2_000L);
        server.verify();
    }

    @Test
    void exhaustedAttemptsRaiseFetchException() {
        server.expect(ExpectedCount.times(2), requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> http.getText(URL, new RetrySettings(2, 500)))
            .isInstanceOf(FetchException.class)
            .hasMessageContaining("after 2 attempt(s)")
            .satisfies(e -> assertThat(((FetchException) e).getUrl()).isEqualTo(URL));
        assertThat(sleeps).containsExactly(500L);
        server.verify();
    }

    @Test
    void pauseUsesSleeper() {
        http.pause(1_500);
        http.pause(0);

        assertThat(sleeps).containsExactly(1_500L);
    }
}
