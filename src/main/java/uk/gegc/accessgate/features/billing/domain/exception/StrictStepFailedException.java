package uk.gegc.accessgate.features.billing.domain.exception;

/**
 * Thrown by the event router when a step declared strict fails. The idempotency gate
 * has already been reverted, so provider redelivery reprocesses the event from scratch.
 */
public class StrictStepFailedException extends RuntimeException {

    private final String eventId;
    private final String step;

    public StrictStepFailedException(String eventId, String step, Throwable cause) {
        super("Strict step '" + step + "' failed for event " + eventId, cause);
        this.eventId = eventId;
        this.step = step;
    }

    public String getEventId() {
        return eventId;
    }

    public String getStep() {
        return step;
    }
}
