package com.orderhub.application.notification;

import com.orderhub.application.batch.BatchProcessor;
import com.orderhub.domain.batch.BatchDataSource;
import com.orderhub.domain.batch.BatchJobParameters;
import com.orderhub.domain.batch.BatchJobType;
import com.orderhub.domain.batch.JobConfig;
import com.orderhub.domain.batch.JobSnapshot;
import com.orderhub.domain.notification.DailyDigest;
import com.orderhub.domain.notification.Notification;
import com.orderhub.domain.notification.NotificationService;
import com.orderhub.domain.notification.NotificationType;
import com.orderhub.support.error.CoreException;
import com.orderhub.support.error.ErrorType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 알림 배치 작업.
 * <p>
 * 일일 다이제스트, 대량 푸시, 오래된 알림 정리를 {@link BatchProcessor}로 실행합니다.
 * </p>
 *
 * @author orderhub
 * @version 1.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationBatchJobs {

    static final int DEFAULT_RETENTION_DAYS = 90;
    private static final int PUSH_BATCH_SIZE = 1000;

    private final BatchProcessor batchProcessor;
    private final NotificationService notificationService;
    private final Clock clock;

    /**
     * 다이제스트 수신 설정 사용자에게 일일 다이제스트를 보냅니다.
     * 보낼 내용이 없는 사용자는 건너뜁니다.
     *
     * @return 작업 스냅샷
     */
    public JobSnapshot sendDailyDigest() {
        BatchJobType type = BatchJobType.NOTIFICATION_DAILY_DIGEST;
        AtomicLong sent = new AtomicLong();

        JobSnapshot snapshot = batchProcessor.executeBatchJob(JobConfig.<Long>builder()
            .jobId(type.newJobId(clock.millis()))
            .jobType(type.name())
            .dataSource(new BatchDataSource<>() {
                @Override
                public long getTotalCount() {
                    return notificationService.countDigestSubscribers();
                }

                @Override
                public List<Long> getBatch(long offset, int limit) {
                    return notificationService.getDigestSubscribers(offset, limit);
                }
            })
            .batchSize(PUSH_BATCH_SIZE)
            .processor(userId -> {
                DailyDigest digest = notificationService.generateDailyDigest(userId);
                if (digest != null && digest.hasContent()) {
                    notificationService.sendNotification(digest.toNotification());
                    sent.incrementAndGet();
                }
                return userId;
            })
            .build());

        log.info("[일일 다이제스트] 대상 {}명, 발송 {}건", snapshot.totalItems(), sent.get());
        return snapshot;
    }

    /**
     * 대상 조건에 맞는 사용자에게 같은 알림을 보냅니다.
     *
     * @param parameters {@code notificationData} (title, message 필수, data 선택), {@code targetCriteria} (선택)
     * @return 작업 스냅샷
     * @throws CoreException 알림 제목이나 본문이 없는 경우 (BAD_REQUEST)
     */
    public JobSnapshot sendBulkPush(BatchJobParameters parameters) {
        BatchJobType type = BatchJobType.NOTIFICATION_BULK_PUSH;
        Map<String, Object> notificationData = parameters.getMap("notificationData");
        Map<String, Object> targetCriteria = parameters.getMap("targetCriteria");
        String title = stringValue(notificationData.get("title"));
        String message = stringValue(notificationData.get("message"));
        if (title == null || message == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, "대량 푸시에는 notificationData.title과 notificationData.message가 필요합니다.");
        }
        Map<String, Object> payload = toPayload(notificationData.get("data"));

        JobSnapshot snapshot = batchProcessor.executeBatchJob(JobConfig.<Long>builder()
            .jobId(type.newJobId(clock.millis()))
            .jobType(type.name())
            .dataSource(new BatchDataSource<>() {
                @Override
                public long getTotalCount() {
                    return notificationService.countTargetUsers(targetCriteria);
                }

                @Override
                public List<Long> getBatch(long offset, int limit) {
                    return notificationService.getTargetUsers(targetCriteria, offset, limit);
                }
            })
            .batchSize(PUSH_BATCH_SIZE)
            .processor(userId -> {
                notificationService.sendNotification(
                    new Notification(userId, NotificationType.BULK_PUSH, title, message, payload));
                return userId;
            })
            .build());

        log.info("[대량 푸시] 대상 {}명, 성공 {}건, 실패 {}건",
            snapshot.totalItems(), snapshot.processedItems(), snapshot.failedItems());
        return snapshot;
    }

    /**
     * 보관 기간이 지난 알림을 삭제합니다.
     *
     * @param parameters {@code retentionDays} (기본값 90)
     * @return 작업 스냅샷
     */
    public JobSnapshot cleanupOldNotifications(BatchJobParameters parameters) {
        BatchJobType type = BatchJobType.NOTIFICATION_CLEANUP;
        int retentionDays = parameters.getInt("retentionDays", DEFAULT_RETENTION_DAYS);
        if (retentionDays < 1) {
            throw new CoreException(ErrorType.BAD_REQUEST,
                String.format("알림 보관 기간은 1일 이상이어야 합니다. (retentionDays: %d)", retentionDays));
        }
        ZonedDateTime cutoff = ZonedDateTime.now(clock).minusDays(retentionDays);
        List<Long> notificationIds = notificationService.getNotificationIdsCreatedBefore(cutoff);

        JobSnapshot snapshot = batchProcessor.executeBatchJob(JobConfig.<Long>builder()
            .jobId(type.newJobId(clock.millis()))
            .jobType(type.name())
            .items(notificationIds)
            .batchSize(PUSH_BATCH_SIZE)
            .processor(notificationId -> {
                notificationService.deleteNotification(notificationId);
                return notificationId;
            })
            .build());

        log.info("[알림 정리] 기준 시각 {}, 삭제 {}건, 실패 {}건",
            cutoff, snapshot.processedItems(), snapshot.failedItems());
        return snapshot;
    }

    private static String stringValue(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> toPayload(Object data) {
        if (data instanceof Map<?, ?> map) {
            return new LinkedHashMap<>((Map<String, Object>) map);
        }
        return Map.of();
    }
}
