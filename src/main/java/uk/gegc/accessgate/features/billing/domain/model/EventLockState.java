package uk.gegc.accessgate.features.billing.domain.model;

import java.util.Optional;

/**
 * Stored value of an event lock. Absence of the key means the event was never seen.
 */
public enum EventLockState {
    PROCESSING("processing"),
    DONE("done");

    private final String value;

    EventLockState(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<EventLockState> parse(String raw) {
        for (EventLockState state : values()) {
            if (state.value.equals(raw)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
