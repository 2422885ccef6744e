package uk.gegc.accessgate.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.accessgate.features.billing.application.BillingMetricsService;
import uk.gegc.accessgate.features.billing.application.BillingProperties;
import uk.gegc.accessgate.features.billing.application.IdempotencyGate;
import uk.gegc.accessgate.features.billing.domain.model.EventLockState;
import uk.gegc.accessgate.features.billing.domain.model.GateDecision;
import uk.gegc.accessgate.features.billing.infra.store.KeyValueStore;

import java.time.Duration;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyGateImpl implements IdempotencyGate {

    private final KeyValueStore store;
    private final BillingProperties billingProperties;
    private final BillingMetricsService metricsService;

    @Override
    public GateDecision begin(String eventId) {
        String key = key(eventId);
        Duration processingTtl = billingProperties.getIdempotency().getProcessingTtl();
        if (store.putIfAbsent(key, EventLockState.PROCESSING.value(), processingTtl)) {
            log.debug("Claimed event {} for processing (ttl={})", eventId, processingTtl);
            return GateDecision.PROCEED;
        }

        Optional<String> current = store.get(key);
        if (current.isEmpty()) {
            // Expired between the two calls; one more claim attempt.
            return store.putIfAbsent(key, EventLockState.PROCESSING.value(), processingTtl)
                    ? GateDecision.PROCEED
                    : GateDecision.ALREADY_PROCESSING;
        }
        EventLockState state = EventLockState.parse(current.get()).orElse(EventLockState.PROCESSING);
        return state == EventLockState.DONE ? GateDecision.ALREADY_DONE : GateDecision.ALREADY_PROCESSING;
    }

    @Override
    public void commit(String eventId) {
        store.put(key(eventId), EventLockState.DONE.value(), billingProperties.getIdempotency().getDoneTtl());
        log.debug("Marked event {} done", eventId);
    }

    @Override
    public boolean abort(String eventId) {
        try {
            store.delete(key(eventId));
            log.info("Released processing lock of event {} for redelivery", eventId);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to release processing lock of event {}; redeliveries are skipped until it expires in up to {}",
                    eventId, billingProperties.getIdempotency().getProcessingTtl(), e);
            metricsService.incrementGateAbortFailed(eventId);
            return false;
        }
    }

    static String key(String eventId) {
        return KEY_PREFIX + eventId;
    }
}
