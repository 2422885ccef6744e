package uk.gegc.accessgate.features.billing.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.accessgate.features.billing.application.FulfillmentProperties;
import uk.gegc.accessgate.features.billing.domain.exception.FulfillmentServiceException;
import uk.gegc.accessgate.features.billing.domain.model.AccessState;
import uk.gegc.accessgate.features.billing.domain.model.OnboardingOutcome;
import uk.gegc.accessgate.features.billing.domain.model.OnboardingRequest;
import uk.gegc.accessgate.features.billing.infra.fulfillment.FulfillmentClient;
import uk.gegc.accessgate.features.billing.infra.fulfillment.dto.AliasRequest;
import uk.gegc.accessgate.features.billing.infra.fulfillment.dto.AliasResponse;
import uk.gegc.accessgate.features.billing.infra.fulfillment.dto.OnboardNotifyRequest;
import uk.gegc.accessgate.features.billing.infra.fulfillment.dto.OnboardNotifyResponse;
import uk.gegc.accessgate.features.billing.infra.store.InMemoryKeyValueStore;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("OnboardingServiceImpl")
class OnboardingServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private FulfillmentClient fulfillmentClient;

    private InMemoryKeyValueStore store;
    private FulfillmentProperties fulfillmentProperties;
    private OnboardingServiceImpl service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemoryKeyValueStore(clock);
        fulfillmentProperties = new FulfillmentProperties();
        fulfillmentProperties.setOnboardingSecret("onboard-secret");
        service = new OnboardingServiceImpl(store, fulfillmentClient, fulfillmentProperties, clock);
    }

    @Nested
    @DisplayName("Eligibility")
    class Eligibility {

        @Test
        @DisplayName("Locked access is not eligible")
        void lockedNotEligible() {
            OnboardingOutcome outcome = service.ensureOnboarded(request(AccessState.LOCKED, "cus_1", "a@x.com"));

            assertThat(outcome).isEqualTo(OnboardingOutcome.NOT_ELIGIBLE);
            verifyNoInteractions(fulfillmentClient);
        }

        @Test
        @DisplayName("Unknown email is not eligible")
        void missingEmailNotEligible() {
            assertThat(service.ensureOnboarded(request(AccessState.ACTIVE, "cus_1", null)))
                    .isEqualTo(OnboardingOutcome.NOT_ELIGIBLE);
        }

        @Test
        @DisplayName("Unknown customer id is not eligible")
        void missingCustomerNotEligible() {
            assertThat(service.ensureOnboarded(request(AccessState.ACTIVE, null, "a@x.com")))
                    .isEqualTo(OnboardingOutcome.NOT_ELIGIBLE);
        }
    }

    @Nested
    @DisplayName("Two-phase onboarding")
    class TwoPhase {

        @Test
        @DisplayName("Creates a silent alias, sends the notification, then writes the marker")
        void onboardsOnce() {
            when(fulfillmentClient.createAlias(any(), anyString())).thenReturn(new AliasResponse("flame-123@alias.test"));
            when(fulfillmentClient.notifyOnboarding(any(), anyString())).thenReturn(new OnboardNotifyResponse(true));

            OnboardingOutcome first = service.ensureOnboarded(request(AccessState.ACTIVE, "cus_1", "a@x.com"));
            OnboardingOutcome second = service.ensureOnboarded(request(AccessState.ACTIVE, "cus_1", "a@x.com"));

            assertThat(first).isEqualTo(OnboardingOutcome.ONBOARDED);
            assertThat(second).isEqualTo(OnboardingOutcome.ALREADY_ONBOARDED);
            assertThat(store.get("onboarded:cus_1")).contains(NOW.toString());
            verify(fulfillmentClient).createAlias(new AliasRequest("a@x.com", "cus_1", false), "alias-evt_1");
            verify(fulfillmentClient, times(1)).notifyOnboarding(
                    new OnboardNotifyRequest("cus_1", "a@x.com", "flame-123@alias.test",
                            "firstflame_pair", "First Flame: Household Pair"),
                    "onboard-secret");
        }

        @Test
        @DisplayName("Notification failure leaves the marker unset")
        void notificationFailureLeavesMarkerUnset() {
            when(fulfillmentClient.createAlias(any(), anyString())).thenReturn(new AliasResponse("flame-123@alias.test"));
            when(fulfillmentClient.notifyOnboarding(any(), anyString()))
                    .thenThrow(new FulfillmentServiceException("onboard-notify", "HTTP 500"));

            OnboardingOutcome outcome = service.ensureOnboarded(request(AccessState.ACTIVE, "cus_1", "a@x.com"));

            assertThat(outcome).isEqualTo(OnboardingOutcome.FAILED);
            assertThat(store.get("onboarded:cus_1")).isEmpty();
        }

        @Test
        @DisplayName("Notification not sent is treated as failure")
        void notificationNotSent() {
            when(fulfillmentClient.createAlias(any(), anyString())).thenReturn(new AliasResponse("flame-123@alias.test"));
            when(fulfillmentClient.notifyOnboarding(any(), anyString())).thenReturn(new OnboardNotifyResponse(false));

            assertThat(service.ensureOnboarded(request(AccessState.ACTIVE, "cus_1", "a@x.com")))
                    .isEqualTo(OnboardingOutcome.FAILED);
            assertThat(store.get("onboarded:cus_1")).isEmpty();
        }

        @Test
        @DisplayName("Alias failure skips the notification")
        void aliasFailure() {
            when(fulfillmentClient.createAlias(any(), anyString()))
                    .thenThrow(new FulfillmentServiceException("alias", "timeout"));

            assertThat(service.ensureOnboarded(request(AccessState.ACTIVE, "cus_1", "a@x.com")))
                    .isEqualTo(OnboardingOutcome.FAILED);
            verify(fulfillmentClient, never()).notifyOnboarding(any(), anyString());
        }
    }

    @Test
    @DisplayName("Without an onboarding secret a single alias call asks the service to notify")
    void genericFallback() {
        fulfillmentProperties.setOnboardingSecret(null);
        when(fulfillmentClient.createAlias(any(), eq("alias-evt_1"))).thenReturn(new AliasResponse("flame-123@alias.test"));

        OnboardingOutcome outcome = service.ensureOnboarded(request(AccessState.ACTIVE, "cus_1", "a@x.com"));

        assertThat(outcome).isEqualTo(OnboardingOutcome.ONBOARDED_GENERIC);
        assertThat(store.get("onboarded:cus_1")).isPresent();
        verify(fulfillmentClient).createAlias(new AliasRequest("a@x.com", "cus_1", true), "alias-evt_1");
        verify(fulfillmentClient, never()).notifyOnboarding(any(), anyString());
    }

    private static OnboardingRequest request(AccessState access, String customerId, String email) {
        return new OnboardingRequest("evt_1", customerId, email, access, "firstflame_pair", "First Flame: Household Pair");
    }
}
