package uk.gegc.accessgate.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 * Each constant should point to documentation describing the error.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://accessgate.gegc.uk/docs/errors";

    // ==================== Webhook Errors ====================
    public static final URI STRIPE_WEBHOOK_INVALID_SIGNATURE = URI.create(BASE_URL + "/stripe-webhook-invalid-signature");
    public static final URI MALFORMED_WEBHOOK_PAYLOAD = URI.create(BASE_URL + "/malformed-webhook-payload");
    public static final URI WEBHOOK_PROCESSING_ERROR = URI.create(BASE_URL + "/webhook-processing-error");

    // ==================== Configuration Errors ====================
    public static final URI CONFIGURATION_MISSING = URI.create(BASE_URL + "/configuration-missing");

    // ==================== Upstream Errors ====================
    public static final URI FULFILLMENT_UNAVAILABLE = URI.create(BASE_URL + "/fulfillment-unavailable");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
