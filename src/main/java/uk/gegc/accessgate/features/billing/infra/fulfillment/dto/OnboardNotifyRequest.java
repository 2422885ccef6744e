package uk.gegc.accessgate.features.billing.infra.fulfillment.dto;

public record OnboardNotifyRequest(
        String customerId,
        String email,
        String alias,
        String planKey,
        String planName
) {
}
