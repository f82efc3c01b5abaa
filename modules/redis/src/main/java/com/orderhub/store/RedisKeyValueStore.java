package com.orderhub.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderhub.config.redis.RedisConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Redis 기반 키-값 저장소.
 * <p>
 * 값은 JSON 문자열로 저장되며 {@code SET key value EX ttl}로 만료 시간이 함께 갱신됩니다.
 * 저장소 장애는 호출자의 작업을 중단시키지 않도록 로그만 남깁니다.
 * </p>
 *
 * @author orderhub
 * @version 1.0
 */
@Slf4j
@Component
public class RedisKeyValueStore implements KeyValueStore {

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisKeyValueStore(
        @Qualifier(RedisConfig.REDIS_TEMPLATE_MASTER) RedisTemplate<String, String> redisTemplate,
        ObjectMapper objectMapper
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> Optional<T> get(StoreKey<T> storeKey) {
        try {
            String json = redisTemplate.opsForValue().get(storeKey.key());
            if (json == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(deserialize(json, storeKey.type()));
        } catch (Exception e) {
            log.warn("저장소 조회 실패. (key: {})", storeKey.key(), e);
            return Optional.empty();
        }
    }

    @Override
    public <T> void setWithExpiry(StoreKey<T> storeKey, T value) {
        String json = serialize(value);
        try {
            redisTemplate.opsForValue().set(storeKey.key(), json, storeKey.ttl());
        } catch (Exception e) {
            log.warn("저장소 저장 실패. (key: {})", storeKey.key(), e);
        }
    }

    @Override
    public void delete(StoreKey<?> storeKey) {
        try {
            redisTemplate.delete(storeKey.key());
        } catch (Exception e) {
            log.warn("저장소 삭제 실패. (key: {})", storeKey.key(), e);
        }
    }

    private String serialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreSerializationException("저장소 값 직렬화 실패", e);
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreSerializationException("저장소 값 역직렬화 실패", e);
        }
    }
}
