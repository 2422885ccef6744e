package uk.gegc.accessgate.features.billing.application.impl;

import com.stripe.exception.EventDataObjectDeserializationException;
import com.stripe.model.Event;
import com.stripe.model.EventDataObjectDeserializer;
import com.stripe.model.Invoice;
import com.stripe.model.Price;
import com.stripe.model.StripeObject;
import com.stripe.model.Subscription;
import com.stripe.model.SubscriptionItem;
import com.stripe.model.checkout.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.accessgate.features.billing.application.EventClassifier;
import uk.gegc.accessgate.features.billing.application.StripeLookupService;
import uk.gegc.accessgate.features.billing.domain.exception.MalformedWebhookPayloadException;
import uk.gegc.accessgate.features.billing.domain.model.BillingEvent;
import uk.gegc.accessgate.features.billing.domain.model.CheckoutCompleted;
import uk.gegc.accessgate.features.billing.domain.model.InvoicePaymentFailed;
import uk.gegc.accessgate.features.billing.domain.model.SubscriptionDeleted;
import uk.gegc.accessgate.features.billing.domain.model.SubscriptionDetails;
import uk.gegc.accessgate.features.billing.domain.model.SubscriptionUpdated;
import uk.gegc.accessgate.features.billing.domain.model.Unhandled;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class EventClassifierImpl implements EventClassifier {

    private static final Set<String> HANDLED_TYPES = Set.of(
            CheckoutCompleted.TYPE,
            SubscriptionUpdated.CREATED_TYPE,
            SubscriptionUpdated.UPDATED_TYPE,
            SubscriptionDeleted.TYPE,
            InvoicePaymentFailed.TYPE
    );

    private final StripeLookupService stripeLookupService;

    @Override
    public boolean isHandled(String eventType) {
        return eventType != null && HANDLED_TYPES.contains(eventType);
    }

    @Override
    public BillingEvent classify(Event event) {
        String type = event.getType();
        if (!isHandled(type)) {
            return new Unhandled(event.getId(), type);
        }

        StripeObject object = dataObject(event);
        Instant occurredAt = event.getCreated() != null ? Instant.ofEpochSecond(event.getCreated()) : null;

        switch (type) {
            case CheckoutCompleted.TYPE:
                return classifyCheckout(event.getId(), expect(object, Session.class, event), occurredAt);
            case SubscriptionUpdated.CREATED_TYPE:
            case SubscriptionUpdated.UPDATED_TYPE:
                return classifySubscriptionChange(event.getId(), type, expect(object, Subscription.class, event), occurredAt);
            case SubscriptionDeleted.TYPE:
                return classifySubscriptionDeleted(event.getId(), expect(object, Subscription.class, event), occurredAt);
            case InvoicePaymentFailed.TYPE:
                return classifyInvoiceFailed(event.getId(), expect(object, Invoice.class, event), occurredAt);
            default:
                return new Unhandled(event.getId(), type);
        }
    }

    private CheckoutCompleted classifyCheckout(String eventId, Session session, Instant occurredAt) {
        String email = normalizeEmail(firstText(
                session.getCustomerEmail(),
                session.getCustomerDetails() != null ? session.getCustomerDetails().getEmail() : null));

        String customerId = blankToNull(session.getCustomer());
        if (customerId == null && email != null) {
            customerId = stripeLookupService.findCustomerIdByEmail(email).orElse(null);
            log.info("Checkout {} had no customer id; lookup by email resolved {}", session.getId(), customerId);
        }

        String subscriptionId = blankToNull(session.getSubscription());
        Map<String, String> metadata = new HashMap<>();
        String subscriptionStatus = null;
        String priceId = null;

        if (subscriptionId != null) {
            Optional<SubscriptionDetails> details = stripeLookupService.findSubscription(subscriptionId);
            if (details.isPresent()) {
                subscriptionStatus = details.get().status();
                priceId = details.get().priceId();
                metadata.putAll(details.get().metadata());
            }
        } else {
            priceId = stripeLookupService.findSessionPriceId(session.getId()).orElse(null);
        }
        // Session metadata is stamped at checkout creation and outranks the subscription's copy.
        if (session.getMetadata() != null) {
            metadata.putAll(session.getMetadata());
        }

        return new CheckoutCompleted(
                eventId,
                session.getId(),
                customerId,
                email,
                session.getMode(),
                session.getPaymentStatus(),
                subscriptionId,
                subscriptionStatus,
                priceId,
                metadata,
                session.getAmountTotal(),
                session.getCurrency(),
                occurredAt
        );
    }

    private SubscriptionUpdated classifySubscriptionChange(String eventId, String type, Subscription subscription, Instant occurredAt) {
        Price price = firstPrice(subscription);
        return new SubscriptionUpdated(
                eventId,
                type,
                blankToNull(subscription.getCustomer()),
                subscription.getId(),
                subscription.getStatus(),
                price != null ? price.getId() : null,
                subscription.getMetadata(),
                price != null ? price.getUnitAmount() : null,
                subscription.getCurrency(),
                occurredAt
        );
    }

    private SubscriptionDeleted classifySubscriptionDeleted(String eventId, Subscription subscription, Instant occurredAt) {
        Price price = firstPrice(subscription);
        return new SubscriptionDeleted(
                eventId,
                blankToNull(subscription.getCustomer()),
                subscription.getId(),
                subscription.getStatus(),
                price != null ? price.getId() : null,
                subscription.getMetadata(),
                occurredAt
        );
    }

    private InvoicePaymentFailed classifyInvoiceFailed(String eventId, Invoice invoice, Instant occurredAt) {
        String subscriptionId = blankToNull(invoice.getSubscription());
        String priceId = subscriptionId == null
                ? null
                : stripeLookupService.findSubscription(subscriptionId).map(SubscriptionDetails::priceId).orElse(null);
        return new InvoicePaymentFailed(
                eventId,
                invoice.getId(),
                blankToNull(invoice.getCustomer()),
                normalizeEmail(invoice.getCustomerEmail()),
                subscriptionId,
                priceId,
                invoice.getAmountDue(),
                invoice.getCurrency(),
                occurredAt
        );
    }

    private StripeObject dataObject(Event event) {
        if (event.getData() == null || event.getData().getObject() == null) {
            throw new MalformedWebhookPayloadException("Event " + event.getId() + " carries no data object");
        }
        EventDataObjectDeserializer deserializer = event.getDataObjectDeserializer();
        Optional<StripeObject> object = deserializer.getObject();
        if (object.isPresent()) {
            return object.get();
        }
        // API version mismatch between the event and the library; the fields used here are stable across versions.
        try {
            log.debug("Deserializing event {} data unsafely (api_version={})", event.getId(), event.getApiVersion());
            return deserializer.deserializeUnsafe();
        } catch (EventDataObjectDeserializationException e) {
            throw new MalformedWebhookPayloadException("Cannot deserialize data of event " + event.getId(), e);
        }
    }

    private static <T extends StripeObject> T expect(StripeObject object, Class<T> type, Event event) {
        if (!type.isInstance(object)) {
            throw new MalformedWebhookPayloadException(String.format(
                    "Event %s of type %s carries %s instead of %s",
                    event.getId(), event.getType(),
                    object == null ? "nothing" : object.getClass().getSimpleName(),
                    type.getSimpleName()));
        }
        return type.cast(object);
    }

    private static Price firstPrice(Subscription subscription) {
        if (subscription.getItems() == null) {
            return null;
        }
        List<SubscriptionItem> items = subscription.getItems().getData();
        if (items == null || items.isEmpty()) {
            return null;
        }
        return items.get(0).getPrice();
    }

    private static String firstText(String first, String second) {
        return StringUtils.hasText(first) ? first : second;
    }

    private static String blankToNull(String value) {
        return StringUtils.hasText(value) ? value : null;
    }

    static String normalizeEmail(String email) {
        return StringUtils.hasText(email) ? email.trim().toLowerCase(Locale.ROOT) : null;
    }
}
