package uk.gegc.accessgate.features.billing.application.impl;

import com.stripe.StripeClient;
import com.stripe.exception.StripeException;
import com.stripe.model.Customer;
import com.stripe.model.LineItem;
import com.stripe.model.StripeCollection;
import com.stripe.model.Subscription;
import com.stripe.model.SubscriptionItem;
import com.stripe.model.checkout.Session;
import com.stripe.param.CustomerListParams;
import com.stripe.param.checkout.SessionRetrieveParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.accessgate.features.billing.application.StripeLookupService;
import uk.gegc.accessgate.features.billing.domain.model.SubscriptionDetails;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class StripeLookupServiceImpl implements StripeLookupService {

    private final ObjectProvider<StripeClient> stripeClientProvider;

    public StripeLookupServiceImpl(ObjectProvider<StripeClient> stripeClientProvider) {
        this.stripeClientProvider = stripeClientProvider;
    }

    @Override
    public Optional<String> findCustomerIdByEmail(String email) {
        if (!StringUtils.hasText(email)) {
            return Optional.empty();
        }
        StripeClient client = stripeClientProvider.getIfAvailable();
        if (client == null) {
            log.warn("Stripe secret key not configured; cannot look up customer by email");
            return Optional.empty();
        }
        try {
            CustomerListParams params = CustomerListParams.builder()
                    .setEmail(email)
                    .setLimit(1L)
                    .build();
            StripeCollection<Customer> customers = client.customers().list(params);
            List<Customer> data = customers.getData();
            if (data == null || data.isEmpty()) {
                log.info("No Stripe customer found for email {}", email);
                return Optional.empty();
            }
            return Optional.ofNullable(data.get(0).getId());
        } catch (StripeException e) {
            log.warn("Stripe customer lookup by email failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<SubscriptionDetails> findSubscription(String subscriptionId) {
        if (!StringUtils.hasText(subscriptionId)) {
            return Optional.empty();
        }
        StripeClient client = stripeClientProvider.getIfAvailable();
        if (client == null) {
            log.warn("Stripe secret key not configured; cannot retrieve subscription {}", subscriptionId);
            return Optional.empty();
        }
        try {
            Subscription subscription = client.subscriptions().retrieve(subscriptionId);
            return Optional.of(new SubscriptionDetails(
                    subscription.getId(),
                    subscription.getCustomer(),
                    subscription.getStatus(),
                    firstPriceId(subscription),
                    subscription.getMetadata()
            ));
        } catch (StripeException e) {
            log.warn("Stripe subscription retrieval failed for {}: {}", subscriptionId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> findSessionPriceId(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return Optional.empty();
        }
        StripeClient client = stripeClientProvider.getIfAvailable();
        if (client == null) {
            log.warn("Stripe secret key not configured; cannot retrieve line items of session {}", sessionId);
            return Optional.empty();
        }
        try {
            SessionRetrieveParams params = SessionRetrieveParams.builder()
                    .addExpand("line_items")
                    .build();
            Session session = client.checkout().sessions().retrieve(sessionId, params);
            if (session.getLineItems() == null || session.getLineItems().getData() == null
                    || session.getLineItems().getData().isEmpty()) {
                return Optional.empty();
            }
            LineItem first = session.getLineItems().getData().get(0);
            return Optional.ofNullable(first.getPrice()).map(price -> price.getId());
        } catch (StripeException e) {
            log.warn("Stripe session retrieval failed for {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Price id of the first subscription item, or {@code null}.
     */
    static String firstPriceId(Subscription subscription) {
        if (subscription == null || subscription.getItems() == null) {
            return null;
        }
        List<SubscriptionItem> items = subscription.getItems().getData();
        if (items == null || items.isEmpty() || items.get(0).getPrice() == null) {
            return null;
        }
        return items.get(0).getPrice().getId();
    }
}
