package com.orderhub.store;

import java.util.Optional;

/**
 * 만료 시간이 있는 키-값 저장소.
 * <p>
 * 같은 키에 대한 쓰기는 레코드 전체를 덮어씁니다 (last-writer-wins).
 * </p>
 *
 * @author orderhub
 * @version 1.0
 */
public interface KeyValueStore {

    /**
     * 값을 조회합니다.
     *
     * @param storeKey 저장소 키
     * @param <T> 값의 타입
     * @return 저장된 값 (없거나 만료되었으면 빈 Optional)
     */
    <T> Optional<T> get(StoreKey<T> storeKey);

    /**
     * 값을 저장하고 키의 TTL만큼 만료 시간을 갱신합니다.
     *
     * @param storeKey 저장소 키
     * @param value 저장할 값
     * @param <T> 값의 타입
     */
    <T> void setWithExpiry(StoreKey<T> storeKey, T value);

    /**
     * 값을 삭제합니다.
     *
     * @param storeKey 저장소 키
     */
    void delete(StoreKey<?> storeKey);
}
