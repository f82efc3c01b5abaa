package com.orderhub.domain.batch;

import com.orderhub.support.error.CoreException;
import com.orderhub.support.error.ErrorType;
import org.springframework.batch.item.ItemProcessor;

import java.util.List;

/**
 * 배치 작업 실행 설정.
 * <p>
 * {@link #builder()}로 생성하며, 잘못된 설정은 작업 등록 전에 {@link CoreException}으로 거부됩니다.
 * </p>
 * <p>
 * <b>기본값:</b>
 * <ul>
 *   <li>batchSize: 1000</li>
 *   <li>maxConcurrency: 5</li>
 *   <li>retryAttempts: 3 (최초 시도 포함)</li>
 * </ul>
 * </p>
 *
 * @param <T> 아이템 타입
 * @author orderhub
 * @version 1.0
 */
public final class JobConfig<T> {

    public static final int DEFAULT_BATCH_SIZE = 1000;
    public static final int DEFAULT_MAX_CONCURRENCY = 5;
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;

    private final String jobId;
    private final String jobType;
    private final BatchDataSource<T> dataSource;
    private final int batchSize;
    private final int maxConcurrency;
    private final int retryAttempts;
    private final ItemProcessor<? super T, ?> processor;
    private final JobListener listener;

    private JobConfig(Builder<T> builder) {
        this.jobId = builder.jobId;
        this.jobType = builder.jobType;
        this.dataSource = builder.dataSource;
        this.batchSize = builder.batchSize;
        this.maxConcurrency = builder.maxConcurrency;
        this.retryAttempts = builder.retryAttempts;
        this.processor = builder.processor;
        this.listener = builder.listener;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public String jobId() {
        return jobId;
    }

    public String jobType() {
        return jobType;
    }

    public BatchDataSource<T> dataSource() {
        return dataSource;
    }

    public int batchSize() {
        return batchSize;
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    public int retryAttempts() {
        return retryAttempts;
    }

    public ItemProcessor<? super T, ?> processor() {
        return processor;
    }

    public JobListener listener() {
        return listener;
    }

    public static final class Builder<T> {
        private String jobId;
        private String jobType;
        private BatchDataSource<T> dataSource;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private int retryAttempts = DEFAULT_RETRY_ATTEMPTS;
        private ItemProcessor<? super T, ?> processor;
        private JobListener listener = JobListener.NONE;

        private Builder() {
        }

        public Builder<T> jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder<T> jobType(String jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder<T> dataSource(BatchDataSource<T> dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        /**
         * 메모리 목록을 데이터 소스로 사용합니다.
         */
        public Builder<T> items(List<T> items) {
            this.dataSource = items != null ? new ListBatchDataSource<>(items) : null;
            return this;
        }

        public Builder<T> batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder<T> maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder<T> retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        public Builder<T> processor(ItemProcessor<? super T, ?> processor) {
            this.processor = processor;
            return this;
        }

        public Builder<T> listener(JobListener listener) {
            this.listener = listener != null ? listener : JobListener.NONE;
            return this;
        }

        public JobConfig<T> build() {
            if (jobId == null || jobId.isBlank()) {
                throw new CoreException(ErrorType.BAD_REQUEST, "배치 작업 ID는 필수입니다.");
            }
            if (jobType == null || jobType.isBlank()) {
                throw new CoreException(ErrorType.BAD_REQUEST, "배치 작업 유형은 필수입니다.");
            }
            if (dataSource == null) {
                throw new CoreException(ErrorType.BAD_REQUEST, "지원되지 않는 데이터 소스 형식입니다.");
            }
            if (processor == null) {
                throw new CoreException(ErrorType.BAD_REQUEST, "아이템 처리기는 필수입니다.");
            }
            if (batchSize < 1) {
                throw new CoreException(ErrorType.BAD_REQUEST,
                    String.format("배치 크기는 1 이상이어야 합니다. (batchSize: %d)", batchSize));
            }
            if (maxConcurrency < 1) {
                throw new CoreException(ErrorType.BAD_REQUEST,
                    String.format("동시 실행 수는 1 이상이어야 합니다. (maxConcurrency: %d)", maxConcurrency));
            }
            if (retryAttempts < 1) {
                throw new CoreException(ErrorType.BAD_REQUEST,
                    String.format("시도 횟수는 1 이상이어야 합니다. (retryAttempts: %d)", retryAttempts));
            }
            return new JobConfig<>(this);
        }
    }
}
