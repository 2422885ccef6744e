package uk.gegc.accessgate.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.accessgate.features.billing.api.dto.CustomerExportResponse;
import uk.gegc.accessgate.features.billing.application.BillingProperties;
import uk.gegc.accessgate.features.billing.application.CustomerRecordService;
import uk.gegc.accessgate.features.billing.domain.exception.CustomerExportUnauthorizedException;
import uk.gegc.accessgate.features.billing.domain.model.CustomerRecord;
import uk.gegc.accessgate.shared.config.FeatureFlags;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Customers", description = "Operational export of customer access records")
public class CustomerExportController {

    static final String EXPORT_KEY_HEADER = "x-export-key";

    private final CustomerRecordService customerRecordService;
    private final BillingProperties billingProperties;
    private final FeatureFlags featureFlags;
    private final Clock clock;

    @Operation(
            summary = "Export customer records",
            description = "Returns every customer-id keyed record, most recently updated first. Requires the x-export-key header when an export key is configured."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Export generated"),
            @ApiResponse(responseCode = "401", description = "Missing or wrong export key",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Export disabled")
    })
    @GetMapping("/api/customers")
    public ResponseEntity<CustomerExportResponse> exportCustomers(
            @Parameter(description = "Shared export key") @RequestHeader(name = EXPORT_KEY_HEADER, required = false) String exportKey
    ) {
        if (!featureFlags.isCustomerExport()) {
            log.warn("Customer export is disabled");
            return ResponseEntity.notFound().build();
        }

        String expected = billingProperties.getCustomerExportKey();
        if (StringUtils.hasText(expected) && !constantTimeEquals(expected, exportKey)) {
            throw new CustomerExportUnauthorizedException("Invalid or missing export key");
        }

        List<CustomerRecord> customers = customerRecordService.listCanonical();
        Instant generatedAt = clock.instant();
        log.info("Exported {} customer records", customers.size());
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(30, TimeUnit.SECONDS).cachePublic())
                .body(new CustomerExportResponse(true, generatedAt, customers.size(), customers));
    }

    private static boolean constantTimeEquals(String expected, String provided) {
        if (provided == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8));
    }
}
