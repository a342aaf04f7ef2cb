package com.phillippitts.n8nsync.service.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.phillippitts.n8nsync.config.properties.N8nApiProperties;
import com.phillippitts.n8nsync.domain.Workflow;
import com.phillippitts.n8nsync.domain.WorkflowSummary;
import com.phillippitts.n8nsync.exception.RemoteApiException;
import com.phillippitts.n8nsync.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link N8nApiClient} backed by the n8n public REST API ({@code /api/v1}).
 *
 * <p>Authenticates with the {@code X-N8N-API-KEY} header. Listing follows
 * {@code nextCursor} until the server stops returning one.
 */
public class RestN8nApiClient implements N8nApiClient {

    static final String API_KEY_HEADER = "X-N8N-API-KEY";
    static final String API_PATH = "/api/v1";

    private static final Logger LOG = LogManager.getLogger(RestN8nApiClient.class);
    private static final int MAX_BODY_IN_MESSAGE = 200;

    private final RestClient restClient;
    private final int pageSize;

    /**
     * @param builder builder already configured with base URL and authentication
     * @param pageSize listing page size
     */
    public RestN8nApiClient(RestClient.Builder builder, int pageSize) {
        this.restClient = builder.build();
        this.pageSize = pageSize;
    }

    /**
     * Builds a client for {@code properties}, applying base URL, API key header and timeouts
     * to {@code builder}.
     */
    public static RestN8nApiClient create(RestClient.Builder builder, N8nApiProperties properties) {
        return new RestN8nApiClient(configure(builder, properties), properties.getPageSize());
    }

    static RestClient.Builder configure(RestClient.Builder builder, N8nApiProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeoutMs());
        requestFactory.setReadTimeout(properties.getReadTimeoutMs());

        builder.baseUrl(properties.getHost() + API_PATH)
                .requestFactory(requestFactory)
                .defaultHeader(API_KEY_HEADER, properties.getApiKey())
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE);

        LOG.info("n8n API client configured: host={}, apiKey={}",
                properties.getHost(), LogSanitizer.mask(properties.getApiKey()));
        return builder;
    }

    @Override
    public List<WorkflowSummary> list() {
        List<WorkflowSummary> all = new ArrayList<>();
        Set<String> seenCursors = new HashSet<>();
        String cursor = null;
        do {
            String pageCursor = cursor;
            WorkflowPage page = call("list", () -> restClient.get()
                    .uri(b -> {
                        b.path("/workflows").queryParam("limit", pageSize);
                        if (pageCursor != null) {
                            b.queryParam("cursor", pageCursor);
                        }
                        return b.build();
                    })
                    .retrieve()
                    .body(WorkflowPage.class));
            if (page == null || page.data() == null) {
                break;
            }
            all.addAll(page.data());
            cursor = page.nextCursor();
            // A server repeating a cursor would otherwise loop forever
            if (cursor != null && !seenCursors.add(cursor)) {
                throw new RemoteApiException("list", 0, "Pagination cursor repeated: " + cursor);
            }
        } while (cursor != null && !cursor.isBlank());
        LOG.debug("Listed {} remote workflows", all.size());
        return all;
    }

    @Override
    public Optional<Workflow> get(String workflowId) {
        try {
            return Optional.ofNullable(call("get", () -> restClient.get()
                    .uri("/workflows/{id}", workflowId)
                    .retrieve()
                    .body(Workflow.class)));
        } catch (RemoteApiException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public Workflow create(Workflow payload) {
        Workflow created = call("create", () -> restClient.post()
                .uri("/workflows")
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(Workflow.class));
        if (created == null || created.id() == null) {
            throw new RemoteApiException("create", 0, "Server did not return a workflow id");
        }
        return created;
    }

    @Override
    public Workflow update(String workflowId, Workflow payload) {
        return requireBody("update", call("update", () -> restClient.put()
                .uri("/workflows/{id}", workflowId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(Workflow.class)));
    }

    @Override
    public boolean delete(String workflowId) {
        try {
            call("delete", () -> restClient.delete()
                    .uri("/workflows/{id}", workflowId)
                    .retrieve()
                    .toBodilessEntity());
            return true;
        } catch (RemoteApiException e) {
            if (e.isNotFound()) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public Workflow activate(String workflowId) {
        return requireBody("activate", call("activate", () -> restClient.post()
                .uri("/workflows/{id}/activate", workflowId)
                .retrieve()
                .body(Workflow.class)));
    }

    @Override
    public Workflow deactivate(String workflowId) {
        return requireBody("deactivate", call("deactivate", () -> restClient.post()
                .uri("/workflows/{id}/deactivate", workflowId)
                .retrieve()
                .body(Workflow.class)));
    }

    @Override
    public boolean testConnection() {
        try {
            call("testConnection", () -> restClient.get()
                    .uri(b -> b.path("/workflows").queryParam("limit", 1).build())
                    .retrieve()
                    .toBodilessEntity());
            return true;
        } catch (RemoteApiException e) {
            LOG.debug("Connection test failed: {}", e.getMessage());
            return false;
        }
    }

    private static Workflow requireBody(String operation, Workflow body) {
        if (body == null) {
            throw new RemoteApiException(operation, 0, "Empty response body");
        }
        return body;
    }

    private static <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            String body = LogSanitizer.truncate(e.getResponseBodyAsString(), MAX_BODY_IN_MESSAGE);
            String reason = status == HttpStatus.NOT_FOUND.value() ? "Not found" : "Request failed";
            throw new RemoteApiException(operation, status, body.isEmpty() ? reason : reason + ": " + body, e);
        } catch (ResourceAccessException e) {
            throw new RemoteApiException(operation, 0, "Remote unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new RemoteApiException(operation, 0, "Unreadable response: " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record WorkflowPage(List<WorkflowSummary> data, String nextCursor) {
    }
}
