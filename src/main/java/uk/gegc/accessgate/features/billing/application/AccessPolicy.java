package uk.gegc.accessgate.features.billing.application;

import uk.gegc.accessgate.features.billing.domain.model.AccessState;
import uk.gegc.accessgate.features.billing.domain.model.BillingEvent;
import uk.gegc.accessgate.features.billing.domain.model.CheckoutCompleted;
import uk.gegc.accessgate.features.billing.domain.model.InvoicePaymentFailed;
import uk.gegc.accessgate.features.billing.domain.model.SubscriptionDeleted;
import uk.gegc.accessgate.features.billing.domain.model.SubscriptionUpdated;

import java.util.Locale;
import java.util.Set;

/**
 * Derives the access state from the most recently applied event. Pure and stateless.
 */
public final class AccessPolicy {

    private static final Set<String> GRANTING_STATUSES = Set.of("active", "trialing");

    private AccessPolicy() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static AccessState fromSubscriptionStatus(String status) {
        if (status == null) {
            return AccessState.LOCKED;
        }
        return GRANTING_STATUSES.contains(status.trim().toLowerCase(Locale.ROOT))
                ? AccessState.ACTIVE
                : AccessState.LOCKED;
    }

    /**
     * A one-time checkout never receives a confirming subscription event, so completion alone grants access.
     */
    public static AccessState forCheckout(CheckoutCompleted event) {
        if (event.isOneTime()) {
            return AccessState.ACTIVE;
        }
        return fromSubscriptionStatus(event.subscriptionStatus());
    }

    /**
     * @return the derived access, or {@code null} for events that carry no access signal
     */
    public static AccessState derive(BillingEvent event) {
        if (event instanceof CheckoutCompleted checkout) {
            return forCheckout(checkout);
        }
        if (event instanceof SubscriptionUpdated updated) {
            return fromSubscriptionStatus(updated.status());
        }
        if (event instanceof SubscriptionDeleted deleted) {
            return fromSubscriptionStatus(deleted.status());
        }
        if (event instanceof InvoicePaymentFailed) {
            return AccessState.LOCKED;
        }
        return null;
    }
}
