package uk.gegc.accessgate.features.billing.infra.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Slf4j
@Configuration
public class KeyValueStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "accessgate.store.type", havingValue = "redis", matchIfMissing = true)
    public KeyValueStore redisKeyValueStore(StringRedisTemplate redisTemplate, StoreProperties storeProperties) {
        log.info("Using Redis key-value store");
        return new RedisKeyValueStore(redisTemplate, storeProperties.getScanCount());
    }

    @Bean
    @ConditionalOnProperty(name = "accessgate.store.type", havingValue = "memory")
    public KeyValueStore inMemoryKeyValueStore(Clock clock) {
        log.warn("Using in-memory key-value store; state is lost on restart");
        return new InMemoryKeyValueStore(clock);
    }
}
