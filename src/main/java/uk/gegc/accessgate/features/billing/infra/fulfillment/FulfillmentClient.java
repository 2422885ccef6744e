package uk.gegc.accessgate.features.billing.infra.fulfillment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import uk.gegc.accessgate.features.billing.application.FulfillmentProperties;
import uk.gegc.accessgate.features.billing.domain.exception.FulfillmentServiceException;
import uk.gegc.accessgate.features.billing.domain.model.OrderSnapshot;
import uk.gegc.accessgate.features.billing.infra.fulfillment.dto.AliasRequest;
import uk.gegc.accessgate.features.billing.infra.fulfillment.dto.AliasResponse;
import uk.gegc.accessgate.features.billing.infra.fulfillment.dto.OnboardNotifyRequest;
import uk.gegc.accessgate.features.billing.infra.fulfillment.dto.OnboardNotifyResponse;

/**
 * HTTP client of the fulfillment service. Every failure surfaces as {@link FulfillmentServiceException}.
 */
@Slf4j
@Component
public class FulfillmentClient {

    static final String API_KEY_HEADER = "x-api-key";
    static final String IDEMPOTENCY_KEY_HEADER = "x-idempotency-key";
    static final String ONBOARDING_SECRET_HEADER = "x-onboarding-secret";

    private final RestTemplate restTemplate;
    private final FulfillmentProperties properties;

    public FulfillmentClient(@Qualifier("fulfillmentRestTemplate") RestTemplate restTemplate,
                             FulfillmentProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    /**
     * Creates or fetches the alias for an email; idempotent on {@code idempotencyKey}.
     */
    public AliasResponse createAlias(AliasRequest request, String idempotencyKey) {
        HttpHeaders headers = baseHeaders();
        headers.set(IDEMPOTENCY_KEY_HEADER, idempotencyKey);
        AliasResponse response = post("alias", "/alias", new HttpEntity<>(request, headers), AliasResponse.class);
        if (response == null || !StringUtils.hasText(response.alias())) {
            throw new FulfillmentServiceException("alias", "Fulfillment service returned no alias");
        }
        return response;
    }

    public OnboardNotifyResponse notifyOnboarding(OnboardNotifyRequest request, String onboardingSecret) {
        HttpHeaders headers = baseHeaders();
        headers.set(ONBOARDING_SECRET_HEADER, onboardingSecret);
        OnboardNotifyResponse response = post("onboard-notify", "/onboard-notify",
                new HttpEntity<>(request, headers), OnboardNotifyResponse.class);
        if (response == null) {
            throw new FulfillmentServiceException("onboard-notify", "Fulfillment service returned an empty body");
        }
        return response;
    }

    /**
     * @return the opaque acknowledgement body, possibly empty
     */
    public String upsertOrder(OrderSnapshot snapshot) {
        HttpHeaders headers = baseHeaders();
        headers.set(IDEMPOTENCY_KEY_HEADER, "order-" + snapshot.eventId());
        String ack = post("orders", "/orders", new HttpEntity<>(snapshot, headers), String.class);
        return ack == null ? "" : ack;
    }

    private <T> T post(String operation, String path, HttpEntity<?> entity, Class<T> responseType) {
        String url = baseUrl() + path;
        try {
            T body = restTemplate.postForObject(url, entity, responseType);
            log.debug("Fulfillment {} call succeeded", operation);
            return body;
        } catch (RestClientResponseException e) {
            throw new FulfillmentServiceException(operation,
                    "Fulfillment " + operation + " failed with HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new FulfillmentServiceException(operation,
                    "Fulfillment " + operation + " call failed: " + e.getMessage(), e);
        }
    }

    private HttpHeaders baseHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(API_KEY_HEADER, properties.getApiKey());
        return headers;
    }

    private String baseUrl() {
        String baseUrl = properties.getBaseUrl();
        if (!StringUtils.hasText(baseUrl)) {
            throw new FulfillmentServiceException("config", "fulfillment.base-url is not configured");
        }
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
}
