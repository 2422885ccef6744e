package uk.gegc.accessgate.features.billing.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Derived access status gating whether a customer may use the paid service.
 */
public enum AccessState {
    ACTIVE,
    LOCKED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AccessState fromWireValue(String value) {
        if (value == null) {
            return LOCKED;
        }
        return "active".equalsIgnoreCase(value.trim()) ? ACTIVE : LOCKED;
    }
}
