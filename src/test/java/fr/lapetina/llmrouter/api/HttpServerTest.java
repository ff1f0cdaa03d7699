package fr.lapetina.llmrouter.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llmrouter.domain.model.CircuitState;
import fr.lapetina.llmrouter.domain.model.ErrorType;
import fr.lapetina.llmrouter.integration.TestLoadBalancerFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class HttpServerTest {

    @Test
    @DisplayName("should map every error type to an HTTP status")
    void shouldMapErrorTypes() {
        assertThat(HttpServer.statusFor(ErrorType.INVALID_REQUEST)).isEqualTo(400);
        assertThat(HttpServer.statusFor(ErrorType.AUTHENTICATION)).isEqualTo(401);
        assertThat(HttpServer.statusFor(ErrorType.COST_BUDGET_EXCEEDED)).isEqualTo(402);
        assertThat(HttpServer.statusFor(ErrorType.RATE_LIMIT)).isEqualTo(429);
        assertThat(HttpServer.statusFor(ErrorType.NO_PROVIDERS_AVAILABLE)).isEqualTo(503);
        assertThat(HttpServer.statusFor(ErrorType.CAPACITY_EXCEEDED)).isEqualTo(503);
        assertThat(HttpServer.statusFor(ErrorType.MAX_RETRIES_EXCEEDED)).isEqualTo(502);
        assertThat(HttpServer.statusFor(ErrorType.TIMEOUT)).isEqualTo(504);
    }

    @Nested
    @DisplayName("Over the wire")
    class OverTheWire {

        private final ObjectMapper objectMapper = new ObjectMapper();
        private final HttpClient client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();

        private TestLoadBalancerFactory factory;
        private HttpServer server;

        @BeforeEach
        void setUp() throws IOException {
            factory = TestLoadBalancerFactory.create();
            server = new HttpServer("127.0.0.1", 0, 16, 2,
                    factory.getLoadBalancer(), factory.getMetricsRegistry());
            server.start();
        }

        @AfterEach
        void tearDown() {
            server.close();
            factory.close();
        }

        private HttpResponse<String> post(String path, String body) throws Exception {
            HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path))
                    .timeout(Duration.ofSeconds(5))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            return client.send(request, HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<String> get(String path) throws Exception {
            HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path))
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();
            return client.send(request, HttpResponse.BodyHandlers.ofString());
        }

        @Test
        @DisplayName("should answer a completion request")
        void shouldServeCompletion() throws Exception {
            HttpResponse<String> response = post("/v1/completions",
                    "{\"prompt\":\"Say hello\",\"request_id\":\"http-1\",\"max_tokens\":200}");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = objectMapper.readTree(response.body());
            assertThat(body.path("request_id").asText()).isEqualTo("http-1");
            assertThat(body.path("provider_id").asText()).isEqualTo("primary");
            assertThat(body.path("content").asText()).isEqualTo("answer from primary");
        }

        @Test
        @DisplayName("should return 400 with the error type for an invalid request")
        void shouldRejectBlankPrompt() throws Exception {
            HttpResponse<String> response = post("/v1/completions", "{\"prompt\":\"   \"}");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(objectMapper.readTree(response.body()).path("error_type").asText())
                    .isEqualTo("INVALID_REQUEST");
        }

        @Test
        @DisplayName("should return 400 for a malformed body")
        void shouldRejectMalformedJson() throws Exception {
            HttpResponse<String> response = post("/v1/completions", "{not json");

            assertThat(response.statusCode()).isEqualTo(400);
        }

        @Test
        @DisplayName("should report DEGRADED health while a breaker is open")
        void shouldReportDegradedHealth() throws Exception {
            factory.getProviderRegistry().require("secondary").circuitBreaker().forceState(CircuitState.OPEN);

            HttpResponse<String> response = get("/health");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = objectMapper.readTree(response.body());
            assertThat(body.path("status").asText()).isEqualTo("DEGRADED");
            assertThat(body.path("providers").path("secondary").asText()).isEqualTo("OPEN");
        }

        @Test
        @DisplayName("should reset a breaker through the admin endpoint")
        void shouldResetBreaker() throws Exception {
            factory.getProviderRegistry().require("primary").circuitBreaker().forceState(CircuitState.OPEN);

            HttpResponse<String> response = post("/admin/providers/primary/reset", "");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(factory.getProviderRegistry().require("primary").circuitBreaker().getState())
                    .isEqualTo(CircuitState.CLOSED);
        }

        @Test
        @DisplayName("should return 404 for an unknown provider")
        void shouldRejectUnknownProvider() throws Exception {
            HttpResponse<String> response = post("/admin/providers/nobody/reset", "");

            assertThat(response.statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should validate quality scores")
        void shouldValidateQualityScore() throws Exception {
            assertThat(post("/admin/providers/primary/quality", "{\"score\":1.5}").statusCode()).isEqualTo(400);
            assertThat(post("/admin/providers/primary/quality", "{\"score\":0.5}").statusCode()).isEqualTo(200);
        }

        @Test
        @DisplayName("should expose Prometheus metrics")
        void shouldScrapeMetrics() throws Exception {
            post("/v1/completions", "{\"prompt\":\"Say hello\"}");

            HttpResponse<String> response = get("/metrics");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("llm_router_test");
        }
    }
}
