package com.example.flowmutator.api.v1;

import com.example.flowmutator.llm.ChangeProposalClient;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import(GraphControllerIntegrationTest.TestConfig.class)
@DisplayName("Workflow graph API")
class GraphControllerIntegrationTest {

    static final String PROPOSED_CHANGES = """
            [{"action": "add_node", "details": {"node_id": "3", "node_type": "n8n-nodes-base.slack", "name": "Notify"}},
             {"action": "add_connection", "details": {"source_node": "Fetch", "target_node": "Notify"}}]
            """;

    @TestConfiguration
    static class TestConfig {
        @Bean
        public tools.jackson.databind.json.JsonMapper jsonMapper() {
            return tools.jackson.databind.json.JsonMapper.builder().build();
        }

        @Bean
        @Primary
        public ChangeProposalClient stubChangeProposalClient() {
            return (graph, description) -> "Sure:\n```json\n" + PROPOSED_CHANGES + "```";
        }

        @Bean
        public RestTemplate restTemplate() {
            RestTemplate rest = new RestTemplate();
            rest.setErrorHandler(new org.springframework.web.client.ResponseErrorHandler() {
                @Override
                public boolean hasError(ClientHttpResponse response) {
                    return false;
                }

                @Override
                public void handleError(java.net.URI url, HttpMethod method, ClientHttpResponse response) throws java.io.IOException {
                }
            });
            return rest;
        }
    }

    private static final String GRAPH = """
            {
              "name": "Hourly fetch",
              "nodes": [
                { "id": "1", "name": "Every hour", "type": "n8n-nodes-base.scheduleTrigger", "parameters": {}, "position": [0, 0] },
                { "id": "2", "name": "Fetch", "type": "n8n-nodes-base.httpRequest", "parameters": { "url": "https://example.org" }, "position": [220, 0] }
              ],
              "connections": {
                "Every hour": { "main": [[ { "node": "Fetch", "type": "main", "index": 0 } ]] }
              }
            }
            """;

    private static final String RENAMED_GRAPH = GRAPH.replace("\"Hourly fetch\"", "\"Hourly fetch v2\"");

    @LocalServerPort
    private int port;

    @Autowired
    private RestTemplate restTemplate;

    private String baseUrl() {
        return "http://localhost:" + port + "/api/v1";
    }

    private ResponseEntity<Map<String, Object>> post(String path, String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return restTemplate.exchange(baseUrl() + path, HttpMethod.POST, new HttpEntity<>(body, headers),
                new ParameterizedTypeReference<>() {});
    }

    private static String quoted(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }

    @Test
    @DisplayName("GET /health returns UP")
    void health() {
        ResponseEntity<Map> resp = restTemplate.getForEntity(baseUrl() + "/health", Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).containsEntry("status", "UP").containsEntry("generationConfigured", true);
    }

    @Nested
    @DisplayName("mutate and modify")
    class Mutation {

        @Test
        @DisplayName("POST /graphs/mutate applies the change-set and returns the diff")
        void mutate() {
            String body = "{\"graph\": " + GRAPH + ", \"instructions\": " + quoted(PROPOSED_CHANGES) + "}";
            ResponseEntity<Map<String, Object>> resp = post("/graphs/mutate", body);

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            Map<String, Object> result = resp.getBody();
            assertThat(result).isNotNull();
            assertThat(result.get("extracted")).isEqualTo(true);
            assertThat(result.get("rolledBack")).isEqualTo(false);
            assertThat(result.get("appliedCount")).isEqualTo(2);
            @SuppressWarnings("unchecked")
            Map<String, Object> graph = (Map<String, Object>) result.get("graph");
            assertThat(graph.get("nodes")).asList().hasSize(3);
            @SuppressWarnings("unchecked")
            Map<String, Object> diff = (Map<String, Object>) result.get("diff");
            assertThat(diff.get("changeSummary")).isEqualTo("Added 1 node(s); Added 1 connection(s)");
        }

        @Test
        @DisplayName("POST /graphs/mutate rolls back a change-set that breaks the graph")
        void mutateRollsBack() {
            String instructions = "[{\"action\":\"add_node\",\"details\":{\"node_id\":\"2\",\"node_type\":\"n8n-nodes-base.set\",\"name\":\"Copy\"}}]";
            ResponseEntity<Map<String, Object>> resp = post("/graphs/mutate",
                    "{\"graph\": " + GRAPH + ", \"instructions\": " + quoted(instructions) + "}");

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody().get("rolledBack")).isEqualTo(true);
            assertThat(resp.getBody().get("errors")).asList().isNotEmpty();
            @SuppressWarnings("unchecked")
            Map<String, Object> graph = (Map<String, Object>) resp.getBody().get("graph");
            assertThat(graph.get("nodes")).asList().hasSize(2);
        }

        @Test
        @DisplayName("POST /graphs/modify applies the proposed change-set")
        void modify() {
            ResponseEntity<Map<String, Object>> resp = post("/graphs/modify",
                    "{\"graph\": " + GRAPH + ", \"description\": \"Notify Slack after fetching\"}");

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody().get("appliedCount")).isEqualTo(2);
            assertThat(resp.getBody().get("rolledBack")).isEqualTo(false);
        }
    }

    @Nested
    @DisplayName("validate and diff")
    class ValidateAndDiff {

        @Test
        @DisplayName("POST /graphs/validate reports a valid graph")
        void validate() {
            ResponseEntity<Map<String, Object>> resp = post("/graphs/validate", "{\"graph\": " + GRAPH + "}");
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody().get("valid")).isEqualTo(true);
            assertThat(resp.getBody().get("errors")).asList().isEmpty();
        }

        @Test
        @DisplayName("POST /graphs/validate reports a dangling connection")
        void validateDangling() {
            String broken = GRAPH.replace("\"node\": \"Fetch\"", "\"node\": \"Ghost\"");
            ResponseEntity<Map<String, Object>> resp = post("/graphs/validate", "{\"graph\": " + broken + "}");
            assertThat(resp.getBody().get("valid")).isEqualTo(false);
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> errors = (List<Map<String, Object>>) resp.getBody().get("errors");
            assertThat(errors).anyMatch(e -> String.valueOf(e.get("message")).contains("'Ghost'"));
        }

        @Test
        @DisplayName("POST /graphs/diff reports a renamed workflow")
        void diff() {
            ResponseEntity<Map<String, Object>> resp = post("/graphs/diff",
                    "{\"original\": " + GRAPH + ", \"modified\": " + RENAMED_GRAPH + "}");
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody().get("hasChanges")).isEqualTo(true);
            assertThat(resp.getBody().get("overallSeverity")).isEqualTo("minor");
        }

        @Test
        @DisplayName("POST /graphs/diff/report?format=html returns an HTML page")
        void htmlReport() {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            ResponseEntity<String> resp = restTemplate.exchange(baseUrl() + "/graphs/diff/report?format=html",
                    HttpMethod.POST,
                    new HttpEntity<>("{\"original\": " + GRAPH + ", \"modified\": " + RENAMED_GRAPH + "}", headers),
                    String.class);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getHeaders().getContentType().isCompatibleWith(MediaType.TEXT_HTML)).isTrue();
            assertThat(resp.getBody()).contains("<h1>Workflow Diff Report</h1>").contains("Hourly fetch v2");
        }
    }

    @Nested
    @DisplayName("error handling")
    class ErrorHandling {

        @Test
        @DisplayName("unknown report format returns 400")
        void unknownFormat() {
            ResponseEntity<Map<String, Object>> resp = post("/graphs/diff/report?format=pdf",
                    "{\"original\": " + GRAPH + ", \"modified\": " + GRAPH + "}");
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(String.valueOf(resp.getBody().get("message"))).contains("unknown report format 'pdf'");
        }

        @Test
        @DisplayName("malformed graph returns 400")
        void malformedGraph() {
            ResponseEntity<Map<String, Object>> resp = post("/graphs/validate", "{\"graph\": {\"nodes\": 5}}");
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(String.valueOf(resp.getBody().get("message"))).startsWith("Malformed workflow graph");
        }

        @Test
        @DisplayName("missing instructions returns 400")
        void missingField() {
            ResponseEntity<Map<String, Object>> resp = post("/graphs/mutate", "{\"graph\": " + GRAPH + "}");
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        }

        @Test
        @DisplayName("body that is not JSON returns 400")
        void notJson() {
            ResponseEntity<Map<String, Object>> resp = post("/graphs/validate", "{not json");
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(resp.getBody().get("message")).isEqualTo("Request body is not valid JSON");
        }
    }
}
