package com.orderhub.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 배치 작업 비동기 실행을 위한 ExecutorService 설정.
 */
@Configuration
public class AsyncConfig {

    public static final String BATCH_EXECUTOR = "batchExecutor";
    public static final String JOB_DISPATCH_EXECUTOR = "jobDispatchExecutor";
    public static final String ONE_TIME_JOB_EXECUTOR = "oneTimeJobExecutor";

    /**
     * 배치 페이지 조회와 아이템 처리를 수행하는 ExecutorService를 생성합니다.
     * <p>
     * 작업별 동시 실행 배치 수는 세마포어가 제한하고, 이 풀은 프로세스 전체의 스레드 수를 제한합니다.
     * </p>
     *
     * @param properties 스케줄링 설정
     * @return ExecutorService 인스턴스
     */
    @Bean(name = BATCH_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService batchExecutor(SchedulingProperties properties) {
        return Executors.newFixedThreadPool(properties.workerPoolSize(), namedDaemonThreads("batch-worker-"));
    }

    /**
     * 관리 API에서 요청한 즉시 실행 작업을 호출 스레드와 분리하여 실행합니다.
     *
     * @return ExecutorService 인스턴스
     */
    @Bean(name = JOB_DISPATCH_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService jobDispatchExecutor() {
        return Executors.newFixedThreadPool(2, namedDaemonThreads("job-dispatch-"));
    }

    /**
     * 실행 시각이 된 일회성 작업을 티커 스레드와 분리하여 실행합니다.
     *
     * @return ExecutorService 인스턴스
     */
    @Bean(name = ONE_TIME_JOB_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService oneTimeJobExecutor() {
        return Executors.newFixedThreadPool(4, namedDaemonThreads("one-time-job-"));
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + threadNumber.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
    }
}
