package uk.gegc.accessgate.features.billing.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.accessgate.features.billing.domain.model.AccessState;
import uk.gegc.accessgate.features.billing.domain.model.CheckoutCompleted;
import uk.gegc.accessgate.features.billing.domain.model.InvoicePaymentFailed;
import uk.gegc.accessgate.features.billing.domain.model.SubscriptionDeleted;
import uk.gegc.accessgate.features.billing.domain.model.Unhandled;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AccessPolicy")
class AccessPolicyTest {

    @Nested
    @DisplayName("Subscription status")
    class SubscriptionStatus {

        @ParameterizedTest
        @ValueSource(strings = {"active", "trialing", "ACTIVE", " trialing "})
        @DisplayName("Granting statuses yield active")
        void grantingStatuses(String status) {
            assertThat(AccessPolicy.fromSubscriptionStatus(status)).isEqualTo(AccessState.ACTIVE);
        }

        @ParameterizedTest
        @NullSource
        @ValueSource(strings = {"past_due", "canceled", "unpaid", "incomplete", "incomplete_expired", "paused", ""})
        @DisplayName("Every other status yields locked")
        void otherStatuses(String status) {
            assertThat(AccessPolicy.fromSubscriptionStatus(status)).isEqualTo(AccessState.LOCKED);
        }
    }

    @Nested
    @DisplayName("Checkout completion")
    class Checkout {

        @Test
        @DisplayName("One-time checkout is active regardless of any subscription status")
        void oneTimeCheckoutIsActive() {
            CheckoutCompleted checkout = checkout("payment", null, "canceled");

            assertThat(AccessPolicy.forCheckout(checkout)).isEqualTo(AccessState.ACTIVE);
        }

        @Test
        @DisplayName("Subscription checkout follows the subscription status")
        void subscriptionCheckoutFollowsStatus() {
            assertThat(AccessPolicy.forCheckout(checkout("subscription", "sub_1", "active"))).isEqualTo(AccessState.ACTIVE);
            assertThat(AccessPolicy.forCheckout(checkout("subscription", "sub_1", "incomplete"))).isEqualTo(AccessState.LOCKED);
        }

        @Test
        @DisplayName("Subscription checkout with unresolved status stays locked")
        void subscriptionCheckoutWithoutStatus() {
            assertThat(AccessPolicy.forCheckout(checkout("subscription", "sub_1", null))).isEqualTo(AccessState.LOCKED);
        }
    }

    @Test
    @DisplayName("Invoice payment failure always locks")
    void invoiceFailureLocks() {
        InvoicePaymentFailed failed = new InvoicePaymentFailed("evt_1", "in_1", "cus_1", null, "sub_1",
                null, 100L, "usd", null);

        assertThat(AccessPolicy.derive(failed)).isEqualTo(AccessState.LOCKED);
    }

    @Test
    @DisplayName("Subscription deletion follows its status")
    void deletionFollowsStatus() {
        SubscriptionDeleted deleted = new SubscriptionDeleted("evt_2", "cus_1", "sub_1", "canceled", null, Map.of(), null);

        assertThat(AccessPolicy.derive(deleted)).isEqualTo(AccessState.LOCKED);
    }

    @Test
    @DisplayName("Unhandled events carry no access signal")
    void unhandledHasNoAccess() {
        assertThat(AccessPolicy.derive(new Unhandled("evt_3", "customer.created"))).isNull();
    }

    private static CheckoutCompleted checkout(String mode, String subscriptionId, String subscriptionStatus) {
        return new CheckoutCompleted("evt_1", "cs_1", "cus_1", "a@x.com", mode, "paid",
                subscriptionId, subscriptionStatus, "price_pair", Map.of(), 2900L, "usd", null);
    }
}
