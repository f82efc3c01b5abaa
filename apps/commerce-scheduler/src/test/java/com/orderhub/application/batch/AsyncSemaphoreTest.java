package com.orderhub.application.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AsyncSemaphore 테스트.
 */
class AsyncSemaphoreTest {

    @DisplayName("용량 이하의 요청은 즉시 슬롯을 받는다.")
    @Test
    void acquiresImmediately_whenPermitsAvailable() {
        // arrange
        AsyncSemaphore semaphore = new AsyncSemaphore(2);

        // act
        CompletableFuture<AsyncSemaphore.Permit> first = semaphore.acquire();
        CompletableFuture<AsyncSemaphore.Permit> second = semaphore.acquire();

        // assert
        assertThat(first).isDone();
        assertThat(second).isDone();
        assertThat(semaphore.availablePermits()).isZero();
        assertThat(semaphore.queueLength()).isZero();
    }

    @DisplayName("용량을 넘는 요청은 슬롯이 반환될 때까지 대기한다.")
    @Test
    void waits_whenNoPermitAvailable() {
        // arrange
        AsyncSemaphore semaphore = new AsyncSemaphore(1);
        AsyncSemaphore.Permit held = semaphore.acquire().join();

        // act
        CompletableFuture<AsyncSemaphore.Permit> waiting = semaphore.acquire();

        // assert
        assertThat(waiting).isNotDone();
        assertThat(semaphore.queueLength()).isEqualTo(1);

        held.release();
        assertThat(waiting).isDone();
        assertThat(semaphore.queueLength()).isZero();
    }

    @DisplayName("대기 중인 요청은 요청한 순서대로 슬롯을 받는다.")
    @Test
    void grantsPermitsInFifoOrder() {
        // arrange
        AsyncSemaphore semaphore = new AsyncSemaphore(1);
        AsyncSemaphore.Permit held = semaphore.acquire().join();
        CompletableFuture<AsyncSemaphore.Permit> second = semaphore.acquire();
        CompletableFuture<AsyncSemaphore.Permit> third = semaphore.acquire();

        // act
        held.release();

        // assert
        assertThat(second).isDone();
        assertThat(third).isNotDone();

        second.join().release();
        assertThat(third).isDone();
    }

    @DisplayName("모든 슬롯이 반환되면 가용 슬롯 수는 용량과 같다.")
    @Test
    void restoresCapacity_afterAllPermitsReleased() {
        // arrange
        AsyncSemaphore semaphore = new AsyncSemaphore(3);
        AsyncSemaphore.Permit first = semaphore.acquire().join();
        AsyncSemaphore.Permit second = semaphore.acquire().join();

        // act
        first.release();
        second.close();

        // assert
        assertThat(semaphore.availablePermits()).isEqualTo(semaphore.capacity());
    }

    @Nested
    @DisplayName("Permit 반환")
    class Release {

        @DisplayName("같은 Permit을 여러 번 반환해도 한 번만 반영된다.")
        @Test
        void releaseIsIdempotent() {
            // arrange
            AsyncSemaphore semaphore = new AsyncSemaphore(2);
            AsyncSemaphore.Permit permit = semaphore.acquire().join();

            // act
            permit.release();
            permit.release();
            permit.close();

            // assert
            assertThat(permit.isReleased()).isTrue();
            assertThat(semaphore.availablePermits()).isEqualTo(2);
        }

        @DisplayName("중복 반환이 다른 대기자를 깨우지 않는다.")
        @Test
        void duplicateRelease_doesNotWakeExtraWaiter() {
            // arrange
            AsyncSemaphore semaphore = new AsyncSemaphore(1);
            AsyncSemaphore.Permit held = semaphore.acquire().join();
            CompletableFuture<AsyncSemaphore.Permit> second = semaphore.acquire();
            CompletableFuture<AsyncSemaphore.Permit> third = semaphore.acquire();

            // act
            held.release();
            held.release();

            // assert
            assertThat(second).isDone();
            assertThat(third).isNotDone();
        }
    }

    @DisplayName("용량이 1 미만이면 생성할 수 없다.")
    @Test
    void rejectsNonPositiveCapacity() {
        // act & assert
        assertThatThrownBy(() -> new AsyncSemaphore(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
