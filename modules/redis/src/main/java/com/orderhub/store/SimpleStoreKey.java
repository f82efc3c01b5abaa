package com.orderhub.store;

import java.time.Duration;

/**
 * 기본 저장소 키 구현체.
 *
 * @param <T> 저장 값의 타입
 * @author orderhub
 * @version 1.0
 */
public record SimpleStoreKey<T>(
    String key,
    Duration ttl,
    Class<T> type
) implements StoreKey<T> {

    public static <T> SimpleStoreKey<T> of(String key, Duration ttl, Class<T> type) {
        return new SimpleStoreKey<>(key, ttl, type);
    }
}
