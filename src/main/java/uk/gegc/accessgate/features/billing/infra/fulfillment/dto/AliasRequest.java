package uk.gegc.accessgate.features.billing.infra.fulfillment.dto;

public record AliasRequest(String email, String customerId, boolean notifyUser) {
}
