package com.socialfeed.ingest.service.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialfeed.ingest.config.IngestionSettings;
import com.socialfeed.ingest.model.ActorQuery;
import com.socialfeed.ingest.model.ActorRun;
import com.socialfeed.ingest.service.ActorInvocationException;
import com.socialfeed.ingest.service.EmptyDatasetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs scraping actors synchronously and reads their output datasets.
 *
 * A run is started with a long-poll wait and then re-polled until it reaches a terminal status.
 * No retries happen here; a failed call surfaces as {@link ActorInvocationException}.
 */
@Service
public class ApifyActorClient {

    private static final Logger logger = LoggerFactory.getLogger(ApifyActorClient.class);

    static final int DATASET_PAGE_SIZE = 1000;
    private static final Set<String> TERMINAL_STATUSES = Set.of("SUCCEEDED", "FAILED", "ABORTED", "TIMED-OUT");
    private static final String SUCCEEDED = "SUCCEEDED";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String token;
    private final Duration runTimeout;
    private final int pollWaitSeconds;

    public ApifyActorClient(HttpClient httpClient, ObjectMapper objectMapper, IngestionSettings settings) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = settings.getApifyBaseUrl();
        this.token = settings.getApifyToken();
        this.runTimeout = settings.getRunTimeout();
        this.pollWaitSeconds = settings.getPollWaitSeconds();
    }

    /**
     * Starts the actor and blocks until the run is terminal.
     *
     * @param actorId actor in {@code owner/name} form
     * @param query   run input
     * @return the finished run with its dataset id
     * @throws ActorInvocationException if the run cannot be started, fails, or exceeds the run timeout
     * @throws EmptyDatasetException    if the run succeeded without a dataset
     */
    public ActorRun runAndWait(String actorId, ActorQuery query) {
        long startedAt = System.nanoTime();
        String body;
        try {
            body = objectMapper.writeValueAsString(query.runInput());
        } catch (IOException e) {
            throw new ActorInvocationException("Could not serialize run input for actor " + actorId, e);
        }

        HttpRequest start = authorized(URI.create(baseUrl + "/acts/" + actorPath(actorId) + "/runs?waitForFinish=" + pollWaitSeconds))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        JsonNode run = send(start, "start actor " + actorId).path("data");
        String runId = run.path("id").asText("");
        if (runId.isEmpty()) {
            throw new ActorInvocationException("Actor " + actorId + " returned no run id");
        }
        logger.info("Apify run started for actor {}: run id {} (status {})", actorId, runId, run.path("status").asText());

        while (!TERMINAL_STATUSES.contains(run.path("status").asText())) {
            if (deadlineExceeded(startedAt)) {
                throw new ActorInvocationException("Actor run " + runId + " did not finish within " + runTimeout);
            }
            HttpRequest poll = authorized(URI.create(baseUrl + "/actor-runs/" + runId + "?waitForFinish=" + pollWaitSeconds))
                    .GET()
                    .build();
            run = send(poll, "poll run " + runId).path("data");
            logger.debug("Apify run {} status {}", runId, run.path("status").asText());
        }

        String status = run.path("status").asText();
        if (!SUCCEEDED.equals(status)) {
            throw new ActorInvocationException("Actor run " + runId + " ended with status " + status);
        }
        String datasetId = run.path("defaultDatasetId").asText("");
        if (datasetId.isEmpty()) {
            throw new EmptyDatasetException(runId);
        }
        return new ActorRun(runId, status, datasetId);
    }

    /**
     * Reads every item of a dataset, page by page, in dataset order.
     */
    public List<Map<String, Object>> fetchItems(String datasetId) {
        List<Map<String, Object>> items = new ArrayList<>();
        int offset = 0;
        while (true) {
            HttpRequest page = authorized(URI.create(baseUrl + "/datasets/" + datasetId
                    + "/items?format=json&clean=true&offset=" + offset + "&limit=" + DATASET_PAGE_SIZE))
                    .GET()
                    .build();
            String json = sendForBody(page, "read dataset " + datasetId);
            List<Map<String, Object>> batch;
            try {
                batch = objectMapper.readValue(json, new TypeReference<List<Map<String, Object>>>() {});
            } catch (IOException e) {
                throw new ActorInvocationException("Dataset " + datasetId + " returned malformed JSON", e);
            }
            items.addAll(batch);
            if (batch.size() < DATASET_PAGE_SIZE) {
                break;
            }
            offset += batch.size();
        }
        logger.debug("Read {} items from dataset {}", items.size(), datasetId);
        return items;
    }

    private boolean deadlineExceeded(long startedAt) {
        return !runTimeout.isZero() && System.nanoTime() - startedAt > runTimeout.toNanos();
    }

    private HttpRequest.Builder authorized(URI uri) {
        return HttpRequest.newBuilder()
                .uri(uri)
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(pollWaitSeconds + 30L));
    }

    private JsonNode send(HttpRequest request, String action) {
        String json = sendForBody(request, action);
        try {
            return objectMapper.readTree(json);
        } catch (IOException e) {
            throw new ActorInvocationException("Malformed response while trying to " + action, e);
        }
    }

    private String sendForBody(HttpRequest request, String action) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ActorInvocationException("Could not " + action + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActorInvocationException("Interrupted while trying to " + action, e);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new ActorInvocationException("Failed to " + action + ": status=" + response.statusCode()
                    + " body=" + abbreviate(response.body()));
        }
        return response.body();
    }

    // owner/name -> owner~name as the REST API expects
    private static String actorPath(String actorId) {
        return actorId.replace('/', '~');
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
