package uk.gegc.accessgate.features.billing.domain.model;

public record OnboardingRequest(
        String eventId,
        String customerId,
        String email,
        AccessState access,
        String planKey,
        String planName
) {

    public static OnboardingRequest from(String eventId, CustomerRecord record) {
        return new OnboardingRequest(
                eventId,
                record.getCustomerId(),
                record.getEmail(),
                record.getAccess(),
                record.getPlanKey(),
                record.getPlanName()
        );
    }
}
