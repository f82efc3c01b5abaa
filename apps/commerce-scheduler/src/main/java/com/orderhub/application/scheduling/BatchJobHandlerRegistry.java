package com.orderhub.application.scheduling;

import com.orderhub.domain.batch.BatchJobType;
import com.orderhub.support.error.CoreException;
import com.orderhub.support.error.ErrorType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * 배치 작업 유형별 핸들러 레지스트리.
 * <p>
 * 실행 가능한 유형은 {@link BatchJobType}으로 닫혀 있으며, 등록되지 않은 유형의 실행 요청은 거부됩니다.
 * </p>
 */
@Slf4j
@Component
public class BatchJobHandlerRegistry {

    private final Map<BatchJobType, BatchJobHandler> handlers = Collections.synchronizedMap(new EnumMap<>(BatchJobType.class));

    public void register(BatchJobType type, BatchJobHandler handler) {
        BatchJobHandler previous = handlers.put(type, handler);
        if (previous != null) {
            log.warn("배치 작업 핸들러를 교체합니다. (유형: {})", type);
        }
    }

    /**
     * 유형에 해당하는 핸들러를 반환합니다.
     *
     * @param type 배치 작업 유형
     * @return 핸들러
     * @throws CoreException 등록되지 않은 유형인 경우 (BAD_REQUEST)
     */
    public BatchJobHandler get(BatchJobType type) {
        BatchJobHandler handler = handlers.get(type);
        if (handler == null) {
            throw new CoreException(ErrorType.BAD_REQUEST,
                String.format("지원하지 않는 배치 작업 유형입니다. (유형: %s)", type));
        }
        return handler;
    }

    public boolean isRegistered(BatchJobType type) {
        return handlers.containsKey(type);
    }

    public Set<BatchJobType> registeredTypes() {
        synchronized (handlers) {
            return Set.copyOf(handlers.keySet());
        }
    }
}
