package uk.gegc.accessgate.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.accessgate.features.billing.domain.model.CustomerRecord;

import java.time.Instant;
import java.util.List;

@Schema(name = "CustomerExportResponse", description = "Snapshot of all canonical customer records")
public record CustomerExportResponse(
        @Schema(description = "Always true on success", example = "true")
        boolean ok,

        @Schema(description = "When the snapshot was taken")
        Instant generatedAt,

        @Schema(description = "Number of records", example = "2")
        int count,

        @Schema(description = "Customer records, most recently updated first")
        List<CustomerRecord> customers
) {
}
