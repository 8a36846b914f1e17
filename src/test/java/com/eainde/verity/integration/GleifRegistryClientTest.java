package com.eainde.verity.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GleifRegistryClientTest {

    private static final String EMPTY = "{\"data\": []}";

    private MockWebServer server;
    private GleifRegistryClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new GleifRegistryClient(new OkHttpClient(), new ObjectMapper(), server.url("/api/v1").toString());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static String record(String lei, String registrationStatus, String entityStatus, String conformity) {
        return """
                {"id": "%s", "attributes": {
                  "entity": {"legalName": {"name": "GreenTextile GmbH"}, "jurisdiction": "DE", "status": "%s",
                             "legalAddress": {"country": "DE"}},
                  "registration": {"status": "%s", "conformityFlag": "%s", "lastUpdateDate": "2026-01-01"}}}"""
                .formatted(lei, entityStatus, registrationStatus, conformity);
    }

    @Nested
    @DisplayName("exact name match")
    class Exact {

        @Test
        @DisplayName("verifies an issued, active, conforming LEI")
        void verified() throws Exception {
            server.enqueue(new MockResponse().setBody("{\"data\": [" + record("LEI1", "ISSUED", "ACTIVE", "CONFORMING") + "]}"));

            EntityVerification verification = client.verify("SUP-1", "GreenTextile GmbH", "de");

            assertThat(verification.status()).isEqualTo(RegistryStatus.VERIFIED);
            assertThat(verification.riskFlags()).isEmpty();
            assertThat(verification.records()).singleElement().satisfies(lei -> {
                assertThat(lei.lei()).isEqualTo("LEI1");
                assertThat(lei.legalName()).isEqualTo("GreenTextile GmbH");
            });
            RecordedRequest request = server.takeRequest();
            assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/api/v1/lei-records");
            assertThat(request.getRequestUrl().queryParameter("filter[entity.legalName]")).isEqualTo("GreenTextile GmbH");
            assertThat(request.getRequestUrl().queryParameter("filter[entity.legalAddress.country]")).isEqualTo("DE");
        }

        @Test
        @DisplayName("a lapsed registration wins over other flags")
        void lapsed() {
            server.enqueue(new MockResponse().setBody("{\"data\": ["
                    + record("LEI1", "LAPSED", "ACTIVE", "CONFORMING") + ","
                    + record("LEI2", "ISSUED", "INACTIVE", "NON_CONFORMING") + "]}"));

            EntityVerification verification = client.verify("SUP-1", "GreenTextile GmbH", null);

            assertThat(verification.status()).isEqualTo(RegistryStatus.LAPSED);
            assertThat(verification.riskFlags())
                    .containsExactly("LEI_REGISTRATION_LAPSED", "ENTITY_INACTIVE", "NON_CONFORMING_LEI");
        }

        @Test
        @DisplayName("an inactive entity is flagged")
        void flagged() {
            server.enqueue(new MockResponse().setBody("{\"data\": [" + record("LEI1", "ISSUED", "INACTIVE", "CONFORMING") + "]}"));

            assertThat(client.verify("SUP-1", "GreenTextile GmbH", null).status()).isEqualTo(RegistryStatus.FLAGGED);
        }
    }

    @Nested
    @DisplayName("full-text retry")
    class Fuzzy {

        @Test
        @DisplayName("accepts an active fuzzy match with a warning flag")
        void fuzzyMatch() throws Exception {
            server.enqueue(new MockResponse().setBody(EMPTY));
            server.enqueue(new MockResponse().setBody("{\"data\": [" + record("LEI9", "ISSUED", "ACTIVE", "CONFORMING") + "]}"));

            EntityVerification verification = client.verify("SUP-1", "Green Textile", null);

            assertThat(verification.status()).isEqualTo(RegistryStatus.VERIFIED);
            assertThat(verification.riskFlags()).containsExactly("FUZZY_MATCH_ONLY");
            server.takeRequest();
            assertThat(server.takeRequest().getRequestUrl().queryParameter("filter[fulltext]")).isEqualTo("Green Textile");
        }

        @Test
        @DisplayName("reports NO_LEI_FOUND when both searches are empty")
        void none() {
            server.enqueue(new MockResponse().setBody(EMPTY));
            server.enqueue(new MockResponse().setBody(EMPTY));

            EntityVerification verification = client.verify("SUP-1", "Nobody Ltd", null);

            assertThat(verification.status()).isEqualTo(RegistryStatus.NO_LEI_FOUND);
            assertThat(verification.riskFlags()).containsExactly("NO_LEI_REGISTRATION", "FUZZY_SEARCH_NO_MATCH");
            assertThat(verification.apiAvailable()).isTrue();
        }
    }

    @Test
    @DisplayName("propagates a server error as a collaborator failure")
    void serverError() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> client.verify("SUP-1", "GreenTextile GmbH", null))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("HTTP 500");
    }
}
