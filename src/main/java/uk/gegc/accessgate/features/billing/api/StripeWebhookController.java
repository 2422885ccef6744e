package uk.gegc.accessgate.features.billing.api;

import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.accessgate.features.billing.application.StripeWebhookService;
import uk.gegc.accessgate.shared.config.FeatureFlags;

import java.nio.charset.StandardCharsets;

@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Stripe Webhooks", description = "Internal endpoints for Stripe webhook events (not for public use)")
public class StripeWebhookController {

    private final StripeWebhookService webhookService;
    private final FeatureFlags featureFlags;

    @Operation(
            summary = "Handle Stripe webhook",
            description = "Internal endpoint for Stripe to send lifecycle events. Verifies the signature against the raw body, then reconciles customer access."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event processed, duplicate or intentionally ignored"),
            @ApiResponse(responseCode = "400", description = "Missing or invalid signature, or malformed payload",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Webhook handling disabled",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Configuration or strict-step failure; Stripe will redeliver",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @Hidden // Hide from public Swagger UI
    @PostMapping({"/api/v1/billing/stripe/webhook", "/api/webhook"})
    public ResponseEntity<String> handleStripeWebhook(
            @Parameter(hidden = true) @RequestBody(required = false) byte[] payload,
            @Parameter(description = "Stripe signature header for verification") @RequestHeader(name = "Stripe-Signature", required = false) String sigHeader
    ) {
        if (!featureFlags.isWebhooks()) {
            log.warn("Webhook handling is disabled, rejecting webhook");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("");
        }

        String body = payload == null ? "" : new String(payload, StandardCharsets.UTF_8);
        var res = webhookService.process(body, sigHeader);
        log.debug("Stripe webhook handled with result {}", res);
        return ResponseEntity.ok("");
    }
}
