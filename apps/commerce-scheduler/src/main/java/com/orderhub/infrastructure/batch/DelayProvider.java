package com.orderhub.infrastructure.batch;

import java.time.Duration;

/**
 * 지연 제공자 인터페이스.
 * <p>
 * 재시도 백오프 대기를 테스트에서 대체할 수 있도록 Thread.sleep을 추상화합니다.
 * </p>
 */
public interface DelayProvider {

    /**
     * 지정된 시간만큼 대기합니다.
     *
     * @param duration 대기 시간
     * @throws InterruptedException 인터럽트 발생 시
     */
    void delay(Duration duration) throws InterruptedException;
}
