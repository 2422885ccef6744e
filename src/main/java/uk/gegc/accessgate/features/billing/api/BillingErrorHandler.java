package uk.gegc.accessgate.features.billing.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import uk.gegc.accessgate.features.billing.domain.exception.CustomerExportUnauthorizedException;
import uk.gegc.accessgate.features.billing.domain.exception.FulfillmentServiceException;
import uk.gegc.accessgate.features.billing.domain.exception.MalformedWebhookPayloadException;
import uk.gegc.accessgate.features.billing.domain.exception.StrictStepFailedException;
import uk.gegc.accessgate.features.billing.domain.exception.StripeWebhookInvalidSignatureException;
import uk.gegc.accessgate.features.billing.domain.exception.WebhookConfigurationException;
import uk.gegc.accessgate.shared.api.problem.ErrorTypes;
import uk.gegc.accessgate.shared.api.problem.ProblemDetailBuilder;

import java.util.Map;

/**
 * Error handler for billing API endpoints.
 * Maps domain exceptions to RFC 7807 Problem Detail responses. Upstream failures are
 * reported as 500 so that Stripe redelivers; 502 is never used.
 */
@Slf4j
@RestControllerAdvice(basePackages = "uk.gegc.accessgate.features.billing.api")
public class BillingErrorHandler {

    @ExceptionHandler(StripeWebhookInvalidSignatureException.class)
    public ResponseEntity<ProblemDetail> handleInvalidWebhookSignature(StripeWebhookInvalidSignatureException ex, HttpServletRequest request) {
        log.warn("Invalid webhook signature: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.STRIPE_WEBHOOK_INVALID_SIGNATURE,
                "Stripe Webhook Invalid Signature",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(MalformedWebhookPayloadException.class)
    public ResponseEntity<ProblemDetail> handleMalformedPayload(MalformedWebhookPayloadException ex, HttpServletRequest request) {
        log.warn("Malformed webhook payload: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.MALFORMED_WEBHOOK_PAYLOAD,
                "Malformed Webhook Payload",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(WebhookConfigurationException.class)
    public ResponseEntity<ProblemDetail> handleConfiguration(WebhookConfigurationException ex, HttpServletRequest request) {
        log.error("Webhook configuration error: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.createWithProperties(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.CONFIGURATION_MISSING,
                "Service Configuration Error",
                "Webhook handling is not fully configured",
                request,
                Map.of("missing", ex.getMissingProperties())
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    @ExceptionHandler(StrictStepFailedException.class)
    public ResponseEntity<ProblemDetail> handleStrictStepFailed(StrictStepFailedException ex, HttpServletRequest request) {
        log.error("Webhook aborted: {}", ex.getMessage(), ex.getCause());
        ProblemDetail problem = ProblemDetailBuilder.createWithProperties(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.WEBHOOK_PROCESSING_ERROR,
                "Webhook Processing Error",
                "Event processing aborted; it will be retried on redelivery",
                request,
                Map.of("eventId", ex.getEventId(), "step", ex.getStep())
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    @ExceptionHandler(FulfillmentServiceException.class)
    public ResponseEntity<ProblemDetail> handleFulfillmentFailure(FulfillmentServiceException ex, HttpServletRequest request) {
        log.error("Fulfillment service call {} failed: {}", ex.getOperation(), ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.FULFILLMENT_UNAVAILABLE,
                "Fulfillment Service Error",
                "Fulfillment service call failed",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    @ExceptionHandler(CustomerExportUnauthorizedException.class)
    public ResponseEntity<ProblemDetail> handleExportUnauthorized(CustomerExportUnauthorizedException ex, HttpServletRequest request) {
        log.warn("Customer export rejected: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.UNAUTHORIZED,
                ErrorTypes.UNAUTHORIZED,
                "Unauthorized",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error in billing API: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.INTERNAL_SERVER_ERROR,
                "Internal Error",
                "An unexpected error occurred",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }
}
