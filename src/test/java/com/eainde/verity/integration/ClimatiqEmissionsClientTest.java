package com.eainde.verity.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ClimatiqEmissionsClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ClimatiqEmissionsClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new ClimatiqEmissionsClient(new OkHttpClient(), objectMapper, server.url("/data/v1").toString(), "secret");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("posts the freight activity and maps the estimate")
    void success() throws Exception {
        // Arrange
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"co2e\": 1902.456, \"emission_factor\": {\"id\": \"ef-42\", \"source\": \"GLEC\"}}"));

        // Act
        EmissionsEstimate estimate = client.estimate("BDCGP", "DEHAM", 8200, "sea");

        // Assert
        assertThat(estimate.co2eKg()).isEqualTo(1902.46);
        assertThat(estimate.co2eTonnes()).isEqualTo(1.9025);
        assertThat(estimate.factorId()).isEqualTo("ef-42");
        assertThat(estimate.estimated()).isFalse();

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/data/v1/estimate");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("parameters").path("weight").asDouble()).isEqualTo(8.2);
        assertThat(body.path("parameters").path("distance").asDouble()).isEqualTo(14500.0);
        assertThat(body.path("emission_factor").path("activity_id").asText()).startsWith("freight_vessel");
    }

    @Test
    @DisplayName("falls back to the local GLEC estimate on a server error")
    void serverError() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("maintenance"));

        EmissionsEstimate estimate = client.estimate("BDCGP", "DEHAM", 8200, "sea");

        // 8.2 t x 14500 km x 0.016
        assertThat(estimate.co2eKg()).isEqualTo(1902.4);
        assertThat(estimate.factorId()).isEqualTo("glec-v3-fallback");
        assertThat(estimate.estimated()).isTrue();
    }

    @Test
    @DisplayName("falls back on a non-JSON body")
    void malformed() {
        server.enqueue(new MockResponse().setBody("<html>oops</html>"));

        assertThat(client.estimate("BDCGP", "DEHAM", 8200, "sea").estimated()).isTrue();
    }

    @Test
    @DisplayName("falls back when the response carries no co2e figure")
    void missingCo2e() {
        server.enqueue(new MockResponse().setBody("{\"emission_factor\": {\"id\": \"ef-42\"}}"));

        EmissionsEstimate estimate = client.estimate("BDCGP", "DEHAM", 8200, "sea");

        assertThat(estimate.co2eKg()).isEqualTo(1902.4);
        assertThat(estimate.estimated()).isTrue();
    }

    @Test
    @DisplayName("uses the GLEC estimate without calling Climatiq when no API key is configured")
    void blankApiKey() {
        ClimatiqEmissionsClient keyless = new ClimatiqEmissionsClient(
                new OkHttpClient(), objectMapper, server.url("/data/v1").toString(), " ");

        EmissionsEstimate estimate = keyless.estimate("BDCGP", "DEHAM", 8200, "sea");

        assertThat(estimate.factorId()).isEqualTo("glec-v3-fallback");
        assertThat(estimate.estimated()).isTrue();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    @DisplayName("falls back when the service is unreachable")
    void unreachable() throws IOException {
        server.shutdown();

        assertThat(client.estimate("CNSHA", "DEHAM", 1000, "sea").co2eKg()).isEqualTo(312.0);
    }
}
