package uk.gegc.accessgate.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.accessgate.features.billing.application.FulfillmentProperties;
import uk.gegc.accessgate.features.billing.application.OnboardingService;
import uk.gegc.accessgate.features.billing.domain.model.AccessState;
import uk.gegc.accessgate.features.billing.domain.model.OnboardingOutcome;
import uk.gegc.accessgate.features.billing.domain.model.OnboardingRequest;
import uk.gegc.accessgate.features.billing.infra.fulfillment.FulfillmentClient;
import uk.gegc.accessgate.features.billing.infra.fulfillment.dto.AliasRequest;
import uk.gegc.accessgate.features.billing.infra.fulfillment.dto.AliasResponse;
import uk.gegc.accessgate.features.billing.infra.fulfillment.dto.OnboardNotifyRequest;
import uk.gegc.accessgate.features.billing.infra.fulfillment.dto.OnboardNotifyResponse;
import uk.gegc.accessgate.features.billing.infra.store.KeyValueStore;

import java.time.Clock;

@Slf4j
@Service
@RequiredArgsConstructor
public class OnboardingServiceImpl implements OnboardingService {

    private final KeyValueStore store;
    private final FulfillmentClient fulfillmentClient;
    private final FulfillmentProperties fulfillmentProperties;
    private final Clock clock;

    @Override
    public OnboardingOutcome ensureOnboarded(OnboardingRequest request) {
        if (request.access() != AccessState.ACTIVE
                || !StringUtils.hasText(request.customerId())
                || !StringUtils.hasText(request.email())) {
            log.debug("Customer {} not eligible for onboarding (access={}, email known={})",
                    request.customerId(), request.access(), StringUtils.hasText(request.email()));
            return OnboardingOutcome.NOT_ELIGIBLE;
        }

        String markerKey = markerKey(request);
        try {
            if (store.get(markerKey).isPresent()) {
                log.debug("Customer {} already onboarded", request.customerId());
                return OnboardingOutcome.ALREADY_ONBOARDED;
            }

            String aliasToken = "alias-" + request.eventId();
            String onboardingSecret = fulfillmentProperties.getOnboardingSecret();

            if (!StringUtils.hasText(onboardingSecret)) {
                log.warn("Onboarding secret not configured; falling back to generic notification for customer {}",
                        request.customerId());
                fulfillmentClient.createAlias(new AliasRequest(request.email(), request.customerId(), true), aliasToken);
                markOnboarded(markerKey);
                return OnboardingOutcome.ONBOARDED_GENERIC;
            }

            AliasResponse alias = fulfillmentClient.createAlias(
                    new AliasRequest(request.email(), request.customerId(), false), aliasToken);
            OnboardNotifyResponse notified = fulfillmentClient.notifyOnboarding(
                    new OnboardNotifyRequest(request.customerId(), request.email(), alias.alias(),
                            request.planKey(), request.planName()),
                    onboardingSecret);
            if (!notified.notificationSent()) {
                log.warn("Fulfillment service reported no notification sent for customer {}; will retry on next event",
                        request.customerId());
                return OnboardingOutcome.FAILED;
            }

            markOnboarded(markerKey);
            log.info("Onboarded customer {} with alias {} (plan={})",
                    request.customerId(), alias.alias(), request.planKey());
            return OnboardingOutcome.ONBOARDED;
        } catch (RuntimeException e) {
            log.warn("Onboarding failed for customer {}; marker left unset: {}", request.customerId(), e.getMessage(), e);
            return OnboardingOutcome.FAILED;
        }
    }

    private void markOnboarded(String markerKey) {
        store.put(markerKey, clock.instant().toString());
    }

    static String markerKey(OnboardingRequest request) {
        String id = StringUtils.hasText(request.customerId()) ? request.customerId() : request.email();
        return MARKER_PREFIX + id;
    }
}
