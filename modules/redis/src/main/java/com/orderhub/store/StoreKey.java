package com.orderhub.store;

import java.time.Duration;

/**
 * 키-값 저장소 키.
 * <p>
 * 저장 위치, 만료 시간, 역직렬화 타입을 함께 정의합니다.
 * </p>
 *
 * @param <T> 저장 값의 타입
 * @author orderhub
 * @version 1.0
 */
public interface StoreKey<T> {

    /**
     * 저장소 키 문자열을 반환합니다.
     *
     * @return 키 문자열
     */
    String key();

    /**
     * 마지막 쓰기 시점부터의 만료 시간을 반환합니다.
     *
     * @return TTL
     */
    Duration ttl();

    /**
     * 저장 값의 타입을 반환합니다.
     *
     * @return 타입
     */
    Class<T> type();
}
