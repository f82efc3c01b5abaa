package com.orderhub.domain.batch;

import java.util.List;

/**
 * 메모리 목록을 잘라서 페이지로 제공하는 데이터 소스.
 *
 * @param <T> 아이템 타입
 */
public class ListBatchDataSource<T> implements BatchDataSource<T> {

    private final List<T> items;

    public ListBatchDataSource(List<T> items) {
        this.items = List.copyOf(items);
    }

    @Override
    public long getTotalCount() {
        return items.size();
    }

    @Override
    public List<T> getBatch(long offset, int limit) {
        if (offset >= items.size()) {
            return List.of();
        }
        int from = (int) offset;
        int to = (int) Math.min(items.size(), offset + limit);
        return items.subList(from, to);
    }
}
