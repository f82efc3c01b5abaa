package com.orderhub.application.batch;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO 대기열을 가진 비동기 카운팅 세마포어.
 * <p>
 * {@link #acquire()}는 스레드를 블로킹하지 않고 {@link Permit}을 완료값으로 하는 future를 반환합니다.
 * 가용 슬롯이 없으면 요청 순서대로 대기열에 쌓이고, 반환된 슬롯은 가장 오래 기다린 요청에 전달됩니다.
 * </p>
 * <p>
 * <b>불변식:</b>
 * <ul>
 *   <li>동시에 보유된 Permit 수는 capacity를 넘지 않습니다.</li>
 *   <li>Permit 반환은 한 번만 반영되며, 중복 반환은 무시됩니다.</li>
 * </ul>
 * </p>
 *
 * @author orderhub
 * @version 1.0
 */
public class AsyncSemaphore {

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<CompletableFuture<Permit>> waiters = new ArrayDeque<>();
    private int available;

    public AsyncSemaphore(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("세마포어 용량은 1 이상이어야 합니다. (capacity: " + capacity + ")");
        }
        this.capacity = capacity;
        this.available = capacity;
    }

    /**
     * 슬롯을 요청합니다.
     *
     * @return 슬롯이 할당되면 완료되는 future
     */
    public CompletableFuture<Permit> acquire() {
        lock.lock();
        try {
            if (available > 0) {
                available--;
                return CompletableFuture.completedFuture(new Permit());
            }
            CompletableFuture<Permit> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public int availablePermits() {
        lock.lock();
        try {
            return available;
        } finally {
            lock.unlock();
        }
    }

    public int queueLength() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    private void release() {
        CompletableFuture<Permit> next;
        lock.lock();
        try {
            next = waiters.pollFirst();
            if (next == null) {
                available++;
                return;
            }
        } finally {
            lock.unlock();
        }
        // 대기자의 후속 작업이 이 스레드에서 실행될 수 있으므로 락 밖에서 완료한다
        next.complete(new Permit());
    }

    /**
     * 세마포어 슬롯 하나의 소유권.
     */
    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit() {
        }

        public void release() {
            if (released.compareAndSet(false, true)) {
                AsyncSemaphore.this.release();
            }
        }

        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void close() {
            release();
        }
    }
}
