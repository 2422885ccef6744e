package uk.gegc.accessgate.features.billing.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.accessgate.features.billing.application.BillingMetricsService;
import uk.gegc.accessgate.features.billing.application.BillingProperties;
import uk.gegc.accessgate.features.billing.application.CustomerRecordService;
import uk.gegc.accessgate.features.billing.domain.model.AccessState;
import uk.gegc.accessgate.features.billing.domain.model.CustomerRecord;
import uk.gegc.accessgate.features.billing.domain.model.CustomerUpdate;
import uk.gegc.accessgate.features.billing.infra.store.KeyValueStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerRecordServiceImpl implements CustomerRecordService {

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final BillingProperties billingProperties;
    private final BillingMetricsService metricsService;
    private final Clock clock;

    @Override
    public Optional<CustomerRecord> merge(CustomerUpdate update, String eventId, String eventType) {
        Optional<String> key = storageKey(update.getCustomerId(), update.getEmail());
        if (key.isEmpty()) {
            log.error("Dropping customer update of event {} ({}): neither customer id nor email is known", eventId, eventType);
            metricsService.incrementRecordDropped(eventType);
            return Optional.empty();
        }

        int maxAttempts = billingProperties.getMergeMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<String> stored = store.get(key.get());
            CustomerRecord current = stored.map(this::read).orElseGet(() -> CustomerRecord.builder().build());
            CustomerRecord merged = apply(current, update, eventId, eventType, clock.instant());

            if (store.compareAndSet(key.get(), stored.orElse(null), write(merged))) {
                log.info("Merged customer record {} from event {} ({}): access={}",
                        key.get(), eventId, eventType, merged.getAccess());
                return Optional.of(merged);
            }
            log.debug("Concurrent write on {} (attempt {}/{}), retrying", key.get(), attempt, maxAttempts);
        }
        throw new IllegalStateException("Customer record " + key.get() + " still contended after "
                + maxAttempts + " attempts");
    }

    @Override
    public Optional<CustomerRecord> get(String customerId) {
        if (!StringUtils.hasText(customerId)) {
            return Optional.empty();
        }
        return store.get(CUSTOMER_PREFIX + customerId).map(this::read);
    }

    @Override
    public Optional<CustomerRecord> getByEmail(String email) {
        if (!StringUtils.hasText(email)) {
            return Optional.empty();
        }
        return store.get(EMAIL_PREFIX + email.trim().toLowerCase(Locale.ROOT)).map(this::read);
    }

    @Override
    public List<CustomerRecord> listCanonical() {
        return store.keys(CUSTOMER_PREFIX).stream()
                .map(key -> store.get(key).flatMap(json -> tryRead(key, json)))
                .flatMap(Optional::stream)
                .sorted(Comparator.comparing(CustomerRecord::getUpdatedAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .toList();
    }

    static Optional<String> storageKey(String customerId, String email) {
        if (StringUtils.hasText(customerId)) {
            return Optional.of(CUSTOMER_PREFIX + customerId);
        }
        if (StringUtils.hasText(email)) {
            return Optional.of(EMAIL_PREFIX + email.trim().toLowerCase(Locale.ROOT));
        }
        return Optional.empty();
    }

    /**
     * Last writer wins per field: only fields the update carries replace stored values.
     */
    static CustomerRecord apply(CustomerRecord current, CustomerUpdate update,
                                String eventId, String eventType, Instant now) {
        CustomerRecord.CustomerRecordBuilder merged = current.toBuilder();
        if (update.getCustomerId() != null) merged.customerId(update.getCustomerId());
        if (update.getEmail() != null) merged.email(update.getEmail().trim().toLowerCase(Locale.ROOT));
        if (update.getSubscriptionId() != null) merged.subscriptionId(update.getSubscriptionId());
        if (update.getSubscriptionStatus() != null) merged.subscriptionStatus(update.getSubscriptionStatus());
        if (update.getPriceId() != null) merged.priceId(update.getPriceId());
        if (update.getTier() != null) merged.tier(update.getTier());
        if (update.getPlanKey() != null) merged.planKey(update.getPlanKey());
        if (update.getPlanName() != null) merged.planName(update.getPlanName());
        if (update.getAccess() != null) merged.access(update.getAccess());
        if (current.getAccess() == null && update.getAccess() == null) merged.access(AccessState.LOCKED);
        return merged
                .updatedAt(now)
                .lastEventId(eventId)
                .lastEventType(eventType)
                .build();
    }

    private CustomerRecord read(String json) {
        try {
            return Objects.requireNonNull(objectMapper.readValue(json, CustomerRecord.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored customer record is not valid JSON", e);
        }
    }

    private Optional<CustomerRecord> tryRead(String key, String json) {
        try {
            return Optional.ofNullable(objectMapper.readValue(json, CustomerRecord.class));
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable customer record {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private String write(CustomerRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize customer record " + record.getCustomerId(), e);
        }
    }
}
