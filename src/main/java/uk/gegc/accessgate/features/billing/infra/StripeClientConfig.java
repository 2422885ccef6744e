package uk.gegc.accessgate.features.billing.infra;

import com.stripe.StripeClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import uk.gegc.accessgate.features.billing.application.StripeProperties;

/**
 * Stripe client configuration.
 * Exposes a typed client with bounded timeouts; no global API key is set.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class StripeClientConfig {

    private final StripeProperties stripe;

    /**
     * Provide a reusable StripeClient only when the secret key is configured.
     */
    @Bean
    @ConditionalOnExpression("'${stripe.secret-key:}' != ''")
    public StripeClient stripeClient() {
        StripeClient.StripeClientBuilder builder = StripeClient.builder()
                .setApiKey(stripe.getSecretKey())
                .setConnectTimeout((int) stripe.getConnectTimeout().toMillis())
                .setReadTimeout((int) stripe.getReadTimeout().toMillis());
        if (StringUtils.hasText(stripe.getApiBase())) {
            log.info("Using custom Stripe API base {}", stripe.getApiBase());
            builder.setApiBase(stripe.getApiBase());
        }
        return builder.build();
    }
}
