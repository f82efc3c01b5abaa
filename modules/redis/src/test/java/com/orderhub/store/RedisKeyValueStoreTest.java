package com.orderhub.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisKeyValueStoreTest {

    record Sample(String name, long count, Instant at) {
    }

    private static final StoreKey<Sample> KEY =
        SimpleStoreKey.of("sample:1", Duration.ofHours(24), Sample.class);

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisKeyValueStore store;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        store = new RedisKeyValueStore(redisTemplate, objectMapper);
    }

    @DisplayName("값을 JSON으로 직렬화하여 키의 TTL과 함께 저장한다.")
    @Test
    void storesJsonWithTtl() {
        // arrange
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        Sample sample = new Sample("a", 3L, Instant.parse("2024-01-01T00:00:00Z"));

        // act
        store.setWithExpiry(KEY, sample);

        // assert
        verify(valueOperations).set(eq("sample:1"), anyString(), eq(Duration.ofHours(24)));
    }

    @DisplayName("저장된 JSON을 키의 타입으로 역직렬화하여 반환한다.")
    @Test
    void readsStoredValue() {
        // arrange
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("sample:1")).thenReturn("{\"name\":\"a\",\"count\":3,\"at\":\"2024-01-01T00:00:00Z\"}");

        // act
        Optional<Sample> result = store.get(KEY);

        // assert
        assertThat(result).contains(new Sample("a", 3L, Instant.parse("2024-01-01T00:00:00Z")));
    }

    @DisplayName("키가 없으면 빈 값을 반환한다.")
    @Test
    void returnsEmpty_whenKeyMissing() {
        // arrange
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("sample:1")).thenReturn(null);

        // act
        Optional<Sample> result = store.get(KEY);

        // assert
        assertThat(result).isEmpty();
    }

    @DisplayName("Redis 장애로 저장에 실패해도 예외를 전파하지 않는다.")
    @Test
    void swallowsConnectionFailure_onWrite() {
        // arrange
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        doThrow(new RedisConnectionFailureException("down"))
            .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

        // act & assert
        assertThatCode(() -> store.setWithExpiry(KEY, new Sample("a", 1L, Instant.now())))
            .doesNotThrowAnyException();
    }

    @DisplayName("Redis 장애로 조회에 실패하면 빈 값을 반환한다.")
    @Test
    void returnsEmpty_whenReadFails() {
        // arrange
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("down"));

        // act
        Optional<Sample> result = store.get(KEY);

        // assert
        assertThat(result).isEmpty();
    }
}
