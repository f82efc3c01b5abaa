package com.orderhub.domain.batch;

import java.util.List;

/**
 * 페이지 단위로 조회 가능한 배치 데이터 소스.
 * <p>
 * 페이지는 서로 다른 스레드에서 동시에 조회될 수 있습니다.
 * </p>
 *
 * @param <T> 아이템 타입
 */
public interface BatchDataSource<T> {

    long getTotalCount();

    /**
     * {@code [offset, offset + limit)} 범위의 아이템을 조회합니다.
     * 범위를 벗어나면 빈 목록을 반환합니다.
     */
    List<T> getBatch(long offset, int limit);

    static <T> BatchDataSource<T> of(List<T> items) {
        return new ListBatchDataSource<>(items);
    }
}
