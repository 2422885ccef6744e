package uk.gegc.accessgate.features.billing.infra.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Slf4j
public class RedisKeyValueStore implements KeyValueStore {

    private static final String EXPECT_ABSENT = "1";
    private static final String EXPECT_VALUE = "0";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> compareAndSetScript;
    private final long scanCount;

    public RedisKeyValueStore(StringRedisTemplate redisTemplate, long scanCount) {
        this.redisTemplate = redisTemplate;
        this.scanCount = scanCount;
        this.compareAndSetScript = new DefaultRedisScript<>();
        this.compareAndSetScript.setLocation(new ClassPathResource("store/compare_and_set.lua"));
        this.compareAndSetScript.setResultType(Long.class);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public void put(String key, String value) {
        redisTemplate.opsForValue().set(key, value);
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration ttl) {
        Boolean ok = redisTemplate.opsForValue().setIfAbsent(key, value, ttl);
        return Boolean.TRUE.equals(ok);
    }

    @Override
    public boolean compareAndSet(String key, String expected, String newValue) {
        Long res = redisTemplate.execute(compareAndSetScript, Collections.singletonList(key),
                expected == null ? EXPECT_ABSENT : EXPECT_VALUE,
                expected == null ? "" : expected,
                newValue);
        return Long.valueOf(1L).equals(res);
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(key));
    }

    @Override
    public List<String> keys(String prefix) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(prefix + "*")
                .count(scanCount)
                .build();
        List<String> keys = new ArrayList<>();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            cursor.forEachRemaining(keys::add);
        }
        log.debug("Scanned {} keys with prefix {}", keys.size(), prefix);
        return keys;
    }
}
