package com.socialfeed.ingest.service.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialfeed.ingest.config.IngestionSettings;
import com.socialfeed.ingest.model.ActorQuery;
import com.socialfeed.ingest.model.ActorRun;
import com.socialfeed.ingest.model.ContentSource;
import com.socialfeed.ingest.model.QueryMode;
import com.socialfeed.ingest.service.ActorInvocationException;
import com.socialfeed.ingest.service.EmptyDatasetException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ApifyActorClientTest {

    @Mock
    private HttpClient httpClient;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final ActorQuery query = new ActorQuery(QueryMode.DIRECT_TARGETS, Map.of("twitterHandles", List.of("alice")));

    @Test
    void startsRunPollsUntilTerminalAndReturnsDataset() throws Exception {
        doReturn(response(201, "{\"data\":{\"id\":\"run-1\",\"status\":\"RUNNING\"}}"),
                response(200, "{\"data\":{\"id\":\"run-1\",\"status\":\"SUCCEEDED\",\"defaultDatasetId\":\"ds-1\"}}"))
                .when(httpClient).send(any(), any());

        ActorRun run = client(Duration.ZERO).runAndWait("apidojo/tweet-scraper", query);

        assertThat(run.runId()).isEqualTo("run-1");
        assertThat(run.datasetId()).isEqualTo("ds-1");

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient, times(2)).send(captor.capture(), any());
        HttpRequest start = captor.getAllValues().get(0);
        assertThat(start.method()).isEqualTo("POST");
        assertThat(start.uri().toString()).isEqualTo("https://api.test/v2/acts/apidojo~tweet-scraper/runs?waitForFinish=5");
        assertThat(start.headers().firstValue("Authorization")).contains("Bearer token-123");
        assertThat(captor.getAllValues().get(1).uri().toString()).isEqualTo("https://api.test/v2/actor-runs/run-1?waitForFinish=5");
    }

    @Test
    void failedRunIsAnInvocationError() throws Exception {
        doReturn(response(201, "{\"data\":{\"id\":\"run-2\",\"status\":\"FAILED\"}}"))
                .when(httpClient).send(any(), any());

        assertThatThrownBy(() -> client(Duration.ZERO).runAndWait("apidojo/tweet-scraper", query))
                .isInstanceOf(ActorInvocationException.class)
                .hasMessageContaining("FAILED");
    }

    @Test
    void runWithoutDatasetIsEmptyDatasetError() throws Exception {
        doReturn(response(201, "{\"data\":{\"id\":\"run-3\",\"status\":\"SUCCEEDED\"}}"))
                .when(httpClient).send(any(), any());

        assertThatThrownBy(() -> client(Duration.ZERO).runAndWait("apidojo/tweet-scraper", query))
                .isInstanceOf(EmptyDatasetException.class)
                .hasMessageContaining("run-3");
    }

    @Test
    void transportFailureIsAnInvocationError() throws Exception {
        doThrow(new IOException("connection refused")).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> client(Duration.ZERO).runAndWait("apidojo/tweet-scraper", query))
                .isInstanceOf(ActorInvocationException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void rejectedStartIsAnInvocationError() throws Exception {
        doReturn(response(401, "{\"error\":{\"type\":\"user-or-token-not-found\"}}"))
                .when(httpClient).send(any(), any());

        assertThatThrownBy(() -> client(Duration.ZERO).runAndWait("apidojo/tweet-scraper", query))
                .isInstanceOf(ActorInvocationException.class)
                .hasMessageContaining("status=401");
    }

    @Test
    void runTimeoutStopsWaiting() throws Exception {
        doReturn(response(201, "{\"data\":{\"id\":\"run-4\",\"status\":\"RUNNING\"}}"))
                .when(httpClient).send(any(), any());

        assertThatThrownBy(() -> client(Duration.ofNanos(1)).runAndWait("apidojo/tweet-scraper", query))
                .isInstanceOf(ActorInvocationException.class)
                .hasMessageContaining("did not finish");
        verify(httpClient, times(1)).send(any(), any());
    }

    @Test
    void readsDatasetInPagesPreservingOrder() throws Exception {
        List<Map<String, Object>> firstPage = new ArrayList<>();
        for (int i = 0; i < ApifyActorClient.DATASET_PAGE_SIZE; i++) {
            firstPage.add(Map.of("id", String.valueOf(i)));
        }
        doReturn(response(200, objectMapper.writeValueAsString(firstPage)),
                response(200, "[{\"id\":\"last\"}]"))
                .when(httpClient).send(any(), any());

        List<Map<String, Object>> items = client(Duration.ZERO).fetchItems("ds-9");

        assertThat(items).hasSize(ApifyActorClient.DATASET_PAGE_SIZE + 1);
        assertThat(items.get(0)).containsEntry("id", "0");
        assertThat(items.get(items.size() - 1)).containsEntry("id", "last");

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient, times(2)).send(captor.capture(), any());
        assertThat(captor.getAllValues().get(1).uri().getQuery()).contains("offset=1000");
    }

    private ApifyActorClient client(Duration runTimeout) {
        IngestionSettings settings = new IngestionSettings("token-123", "https://api.test/v2/", runTimeout, 5,
                Map.of(ContentSource.TWITTER, new IngestionSettings.SourceSettings(
                        "apidojo/tweet-scraper", QueryMode.DIRECT_TARGETS, 7, 250, "", List.of())),
                new IngestionSettings.EnrichmentSettings("openai", "", "https://api.openai.test/v1", "gpt-4-turbo", Duration.ofSeconds(60)));
        return new ApifyActorClient(httpClient, objectMapper, settings);
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }
}
