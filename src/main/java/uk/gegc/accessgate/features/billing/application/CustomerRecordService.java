package uk.gegc.accessgate.features.billing.application;

import uk.gegc.accessgate.features.billing.domain.model.CustomerRecord;
import uk.gegc.accessgate.features.billing.domain.model.CustomerUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Durable per-customer access record with field-level merge semantics.
 */
public interface CustomerRecordService {

    String CUSTOMER_PREFIX = "customer:";
    String EMAIL_PREFIX = "email:";

    /**
     * Applies the non-null fields of {@code update} to the stored record, keyed by customer id or else email.
     *
     * @return the merged record, or empty when the update has neither customer id nor email
     */
    Optional<CustomerRecord> merge(CustomerUpdate update, String eventId, String eventType);

    Optional<CustomerRecord> get(String customerId);

    Optional<CustomerRecord> getByEmail(String email);

    /**
     * All customer-id keyed records, most recently updated first.
     */
    List<CustomerRecord> listCanonical();
}
