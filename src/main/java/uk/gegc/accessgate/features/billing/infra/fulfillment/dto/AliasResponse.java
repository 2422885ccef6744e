package uk.gegc.accessgate.features.billing.infra.fulfillment.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AliasResponse(String alias) {
}
