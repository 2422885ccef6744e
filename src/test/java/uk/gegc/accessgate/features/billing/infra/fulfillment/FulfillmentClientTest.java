package uk.gegc.accessgate.features.billing.infra.fulfillment;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import uk.gegc.accessgate.features.billing.application.FulfillmentProperties;
import uk.gegc.accessgate.features.billing.domain.exception.FulfillmentServiceException;
import uk.gegc.accessgate.features.billing.domain.model.OrderSnapshot;
import uk.gegc.accessgate.features.billing.infra.fulfillment.dto.AliasRequest;
import uk.gegc.accessgate.features.billing.infra.fulfillment.dto.AliasResponse;
import uk.gegc.accessgate.features.billing.infra.fulfillment.dto.OnboardNotifyRequest;
import uk.gegc.accessgate.features.billing.infra.fulfillment.dto.OnboardNotifyResponse;

import java.time.Duration;
import java.time.Instant;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.notContaining;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises the fulfillment client against a WireMock server on a random port.
 */
@DisplayName("FulfillmentClient")
class FulfillmentClientTest {

    private WireMockServer wireMockServer;
    private FulfillmentClient client;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        FulfillmentProperties properties = new FulfillmentProperties();
        properties.setBaseUrl("http://localhost:" + wireMockServer.port() + "/");
        properties.setApiKey("test-api-key");
        properties.setReadTimeout(Duration.ofSeconds(2));

        client = new FulfillmentClient(new FulfillmentClientConfig().fulfillmentRestTemplate(new RestTemplateBuilder(), properties), properties);
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null && wireMockServer.isRunning()) {
            wireMockServer.stop();
        }
    }

    @Nested
    @DisplayName("POST /alias")
    class Alias {

        @Test
        @DisplayName("Sends api key, idempotency key and the request body")
        void createAlias_sendsHeadersAndBody() {
            // Given
            wireMockServer.stubFor(post(urlEqualTo("/alias"))
                    .willReturn(okJson("{\"alias\": \"spark-123@fulfil.example\", \"extra\": true}")));

            // When
            AliasResponse response = client.createAlias(new AliasRequest("a@x.com", "cus_1", false), "alias-evt_1");

            // Then
            assertThat(response.alias()).isEqualTo("spark-123@fulfil.example");
            wireMockServer.verify(postRequestedFor(urlEqualTo("/alias"))
                    .withHeader("x-api-key", equalTo("test-api-key"))
                    .withHeader("x-idempotency-key", equalTo("alias-evt_1"))
                    .withHeader("Content-Type", equalTo("application/json"))
                    .withRequestBody(equalToJson("{\"email\": \"a@x.com\", \"customerId\": \"cus_1\", \"notifyUser\": false}")));
        }

        @Test
        @DisplayName("Blank alias in a 200 response is a failure")
        void createAlias_blankAlias() {
            // Given
            wireMockServer.stubFor(post(urlEqualTo("/alias")).willReturn(okJson("{\"alias\": \"\"}")));

            // When & Then
            assertThatThrownBy(() -> client.createAlias(new AliasRequest("a@x.com", "cus_1", false), "alias-evt_1"))
                    .isInstanceOfSatisfying(FulfillmentServiceException.class,
                            e -> assertThat(e.getOperation()).isEqualTo("alias"));
        }

        @Test
        @DisplayName("Non-2xx response carries the status in the message")
        void createAlias_serverError() {
            // Given
            wireMockServer.stubFor(post(urlEqualTo("/alias")).willReturn(aResponse().withStatus(503)));

            // When & Then
            assertThatThrownBy(() -> client.createAlias(new AliasRequest("a@x.com", "cus_1", false), "alias-evt_1"))
                    .isInstanceOf(FulfillmentServiceException.class)
                    .hasMessageContaining("HTTP 503");
        }
    }

    @Test
    @DisplayName("Onboard notify sends the onboarding secret and no idempotency key")
    void notifyOnboarding_sendsSecret() {
        // Given
        wireMockServer.stubFor(post(urlEqualTo("/onboard-notify")).willReturn(okJson("{\"notificationSent\": true}")));

        // When
        OnboardNotifyResponse response = client.notifyOnboarding(
                new OnboardNotifyRequest("cus_1", "a@x.com", "spark-123@fulfil.example", "firstflame_pair", "First Flame Pair"),
                "onboarding-secret");

        // Then
        assertThat(response.notificationSent()).isTrue();
        wireMockServer.verify(postRequestedFor(urlEqualTo("/onboard-notify"))
                .withHeader("x-api-key", equalTo("test-api-key"))
                .withHeader("x-onboarding-secret", equalTo("onboarding-secret"))
                .withHeader("x-idempotency-key", absent())
                .withRequestBody(matchingJsonPath("$.alias", equalTo("spark-123@fulfil.example")))
                .withRequestBody(matchingJsonPath("$.planKey", equalTo("firstflame_pair"))));
    }

    @Nested
    @DisplayName("POST /orders")
    class Orders {

        @Test
        @DisplayName("Keys the call by event id and omits null fields")
        void upsertOrder_sendsSnapshot() {
            // Given
            wireMockServer.stubFor(post(urlEqualTo("/orders")).willReturn(okJson("{\"ok\": true}")));
            OrderSnapshot snapshot = new OrderSnapshot("evt_1", "checkout.session.completed", "cus_1", "a@x.com",
                    2900L, "usd", "paid", "price_pair", "firstflame", "firstflame_pair", null,
                    Instant.parse("2026-01-01T00:00:00Z"));

            // When
            String ack = client.upsertOrder(snapshot);

            // Then
            assertThat(ack).contains("\"ok\"");
            wireMockServer.verify(postRequestedFor(urlEqualTo("/orders"))
                    .withHeader("x-idempotency-key", equalTo("order-evt_1"))
                    .withRequestBody(matchingJsonPath("$.eventId", equalTo("evt_1")))
                    .withRequestBody(matchingJsonPath("$.amount", equalTo("2900")))
                    .withRequestBody(notContaining("planName")));
        }

        @Test
        @DisplayName("Empty acknowledgement body is returned as an empty string")
        void upsertOrder_emptyBody() {
            // Given
            wireMockServer.stubFor(post(urlEqualTo("/orders")).willReturn(aResponse().withStatus(204)));

            // When & Then
            assertThat(client.upsertOrder(new OrderSnapshot("evt_2", "customer.subscription.deleted", "cus_1",
                    null, null, null, "canceled", null, null, null, null, null))).isEmpty();
        }

        @Test
        @DisplayName("Connection failure is wrapped with the operation name")
        void upsertOrder_connectionFailure() {
            // Given
            wireMockServer.stop();

            // When & Then
            assertThatThrownBy(() -> client.upsertOrder(new OrderSnapshot("evt_3", "invoice.payment_failed", "cus_1",
                    null, null, null, "payment_failed", null, null, null, null, null)))
                    .isInstanceOfSatisfying(FulfillmentServiceException.class, e -> {
                        assertThat(e.getOperation()).isEqualTo("orders");
                        assertThat(e.getCause()).isNotNull();
                    });
        }
    }
}
