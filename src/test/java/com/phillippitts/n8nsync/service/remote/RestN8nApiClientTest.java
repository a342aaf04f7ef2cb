package com.phillippitts.n8nsync.service.remote;

import com.phillippitts.n8nsync.config.properties.N8nApiProperties;
import com.phillippitts.n8nsync.domain.Workflow;
import com.phillippitts.n8nsync.domain.WorkflowSummary;
import com.phillippitts.n8nsync.exception.RemoteApiException;
import com.phillippitts.n8nsync.service.normalize.WorkflowNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.util.List;

import static com.phillippitts.n8nsync.testutil.WorkflowFixtures.workflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestN8nApiClientTest {

    private static final String BASE = "http://n8n.test/api/v1";

    private MockRestServiceServer server;
    private RestN8nApiClient client;

    @BeforeEach
    void setUp() {
        N8nApiProperties properties = new N8nApiProperties("http://n8n.test/", "secret-key", null, null, 2);
        RestClient.Builder builder = RestN8nApiClient.configure(RestClient.builder(), properties);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new RestN8nApiClient(builder, properties.getPageSize());
    }

    @Test
    void listFollowsCursorAndSendsApiKey() {
        server.expect(requestTo(BASE + "/workflows?limit=2"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("X-N8N-API-KEY", "secret-key"))
                .andRespond(withSuccess("""
                        {"data":[
                          {"id":"1","name":"A","active":true,"updatedAt":"2024-01-01T00:00:00.000Z",
                           "tags":[{"id":"t","name":"prod"}],"nodes":[]},
                          {"id":"2","name":"B","active":false,"updatedAt":"2024-01-02T00:00:00.000Z"}
                        ],"nextCursor":"c1"}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/workflows?limit=2&cursor=c1"))
                .andRespond(withSuccess("""
                        {"data":[{"id":"3","name":"C","active":false,"updatedAt":"2024-01-03T00:00:00.000Z"}],
                         "nextCursor":null}
                        """, MediaType.APPLICATION_JSON));

        List<WorkflowSummary> all = client.list();

        assertThat(all).extracting(WorkflowSummary::id).containsExactly("1", "2", "3");
        assertThat(all.get(0).active()).isTrue();
        assertThat(all.get(0).tags()).extracting(t -> t.name()).containsExactly("prod");
        assertThat(all.get(1).tags()).isEmpty();
        server.verify();
    }

    @Test
    void listRejectsRepeatedCursor() {
        server.expect(requestTo(BASE + "/workflows?limit=2"))
                .andRespond(withSuccess("{\"data\":[],\"nextCursor\":\"c1\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/workflows?limit=2&cursor=c1"))
                .andRespond(withSuccess("{\"data\":[],\"nextCursor\":\"c1\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.list())
                .isInstanceOf(RemoteApiException.class)
                .hasMessageContaining("cursor");
    }

    @Test
    void listFailureCarriesStatusAndTruncatedBody() {
        server.expect(requestTo(BASE + "/workflows?limit=2"))
                .andRespond(withServerError().body("x".repeat(500)));

        assertThatThrownBy(() -> client.list())
                .isInstanceOfSatisfying(RemoteApiException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(500);
                    assertThat(e.isTransient()).isTrue();
                    assertThat(e.getMessage()).hasSizeLessThan(300);
                });
    }

    @Test
    void getMapsNotFoundToEmpty() {
        server.expect(requestTo(BASE + "/workflows/42"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.get("42")).isEmpty();
    }

    @Test
    void getParsesFullWorkflow() {
        server.expect(requestTo(BASE + "/workflows/42"))
                .andRespond(withSuccess("""
                        {"id":"42","name":"Orders","nodes":[{"name":"Start"}],"connections":{},
                         "settings":{"executionOrder":"v1"},"active":true,"versionId":"abc",
                         "updatedAt":"2024-01-01T00:00:00.000Z"}
                        """, MediaType.APPLICATION_JSON));

        Workflow w = client.get("42").orElseThrow();

        assertThat(w.name()).isEqualTo("Orders");
        assertThat(w.isActive()).isTrue();
        assertThat(w.nodes().get(0).path("name").asText()).isEqualTo("Start");
    }

    @Test
    void createSendsPushPayloadOnly() {
        server.expect(requestTo(BASE + "/workflows"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.name").value("Orders"))
                .andExpect(jsonPath("$.active").doesNotExist())
                .andExpect(jsonPath("$.tags").doesNotExist())
                .andExpect(jsonPath("$.id").doesNotExist())
                .andRespond(withSuccess("{\"id\":\"77\",\"name\":\"Orders\",\"active\":false}",
                        MediaType.APPLICATION_JSON));

        Workflow payload = new WorkflowNormalizer().forPush(workflow("Orders", "v0"));

        assertThat(client.create(payload).id()).isEqualTo("77");
    }

    @Test
    void createWithoutReturnedIdFails() {
        server.expect(requestTo(BASE + "/workflows"))
                .andRespond(withSuccess("{\"name\":\"Orders\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.create(workflow("Orders", "v0")))
                .isInstanceOf(RemoteApiException.class);
    }

    @Test
    void updateOfMissingWorkflowIsNotFound() {
        server.expect(requestTo(BASE + "/workflows/9"))
                .andExpect(method(HttpMethod.PUT))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> client.update("9", workflow("Orders", "v0")))
                .isInstanceOfSatisfying(RemoteApiException.class, e -> assertThat(e.isNotFound()).isTrue());
    }

    @Test
    void deleteReportsWhetherSomethingWasDeleted() {
        server.expect(requestTo(BASE + "/workflows/1"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess());
        server.expect(requestTo(BASE + "/workflows/2"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.delete("1")).isTrue();
        assertThat(client.delete("2")).isFalse();
    }

    @Test
    void activateAndDeactivateUseDedicatedEndpoints() {
        server.expect(requestTo(BASE + "/workflows/5/activate"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"id\":\"5\",\"active\":true}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/workflows/5/deactivate"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"id\":\"5\",\"active\":false}", MediaType.APPLICATION_JSON));

        assertThat(client.activate("5").isActive()).isTrue();
        assertThat(client.deactivate("5").isActive()).isFalse();
        server.verify();
    }

    @Test
    void connectionTestReportsReachability() {
        server.expect(requestTo(BASE + "/workflows?limit=1")).andRespond(withSuccess());
        server.expect(requestTo(BASE + "/workflows?limit=1")).andRespond(withStatus(HttpStatus.UNAUTHORIZED));
        server.expect(requestTo(BASE + "/workflows?limit=1")).andRespond(withException(new IOException("refused")));

        assertThat(client.testConnection()).isTrue();
        assertThat(client.testConnection()).isFalse();
        assertThat(client.testConnection()).isFalse();
    }

    @Test
    void networkFailureIsTransient() {
        server.expect(requestTo(BASE + "/workflows/1")).andRespond(withException(new IOException("refused")));

        assertThatThrownBy(() -> client.get("1"))
                .isInstanceOfSatisfying(RemoteApiException.class, e -> {
                    assertThat(e.getStatusCode()).isZero();
                    assertThat(e.isTransient()).isTrue();
                });
    }
}
