package uk.gegc.accessgate.features.billing.infra.fulfillment;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;
import uk.gegc.accessgate.features.billing.application.FulfillmentProperties;

@Configuration
public class FulfillmentClientConfig {

    /**
     * Built from the Boot builder so request bodies share the application's Jackson settings
     * (ISO-8601 instants).
     */
    @Bean
    public RestTemplate fulfillmentRestTemplate(RestTemplateBuilder builder, FulfillmentProperties properties) {
        return builder
                .requestFactory(() -> {
                    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
                    requestFactory.setConnectTimeout(properties.getConnectTimeout());
                    requestFactory.setReadTimeout(properties.getReadTimeout());
                    return requestFactory;
                })
                .build();
    }
}
