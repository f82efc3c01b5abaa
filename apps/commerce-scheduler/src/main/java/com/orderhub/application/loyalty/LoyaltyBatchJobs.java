package com.orderhub.application.loyalty;

import com.orderhub.application.batch.BatchProcessor;
import com.orderhub.domain.batch.BatchDataSource;
import com.orderhub.domain.batch.BatchJobParameters;
import com.orderhub.domain.batch.BatchJobType;
import com.orderhub.domain.batch.JobConfig;
import com.orderhub.domain.batch.JobSnapshot;
import com.orderhub.domain.batch.JobStatus;
import com.orderhub.domain.loyalty.ExpiringPoints;
import com.orderhub.domain.loyalty.LoyaltyService;
import com.orderhub.domain.loyalty.PointExpiryResult;
import com.orderhub.domain.loyalty.TierChange;
import com.orderhub.domain.notification.Notification;
import com.orderhub.domain.notification.NotificationService;
import com.orderhub.domain.notification.NotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 로열티 배치 작업.
 * <p>
 * 포인트 만료, 등급 재평가, 축제 보너스 지급을 {@link BatchProcessor}로 실행합니다.
 * </p>
 *
 * @author orderhub
 * @version 1.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoyaltyBatchJobs {

    static final int EXPIRY_NOTICE_DAYS = 30;
    static final String DEFAULT_FESTIVAL_TYPE = "general";
    static final double DEFAULT_FESTIVAL_MULTIPLIER = 1.5;
    private static final int MEMBER_BATCH_SIZE = 500;

    private final BatchProcessor batchProcessor;
    private final LoyaltyService loyaltyService;
    private final NotificationService notificationService;
    private final Clock clock;

    /**
     * 포인트 만료 작업을 실행합니다.
     * <p>
     * {@value #EXPIRY_NOTICE_DAYS}일 안에 만료되는 포인트 보유자에게 안내 알림을 보낸 뒤,
     * 만료 시각이 지난 포인트를 소멸시킵니다. 알림 작업이 완료되지 않으면 소멸 처리는 생략합니다.
     * </p>
     *
     * @return 알림 작업 스냅샷
     */
    public JobSnapshot processPointsExpiry() {
        BatchJobType type = BatchJobType.LOYALTY_POINTS_EXPIRY;
        List<ExpiringPoints> expiringPoints = loyaltyService.getExpiringPoints(EXPIRY_NOTICE_DAYS);

        JobSnapshot snapshot = batchProcessor.executeBatchJob(JobConfig.<ExpiringPoints>builder()
            .jobId(type.newJobId(clock.millis()))
            .jobType(type.name())
            .items(expiringPoints)
            .batchSize(MEMBER_BATCH_SIZE)
            .processor(points -> {
                notificationService.sendNotification(pointsExpiringNotification(points));
                return points;
            })
            .build());

        if (snapshot.status() != JobStatus.COMPLETED) {
            log.warn("[포인트 만료] 만료 안내 작업이 완료되지 않아 소멸 처리를 생략합니다. (jobId: {}, status: {})",
                snapshot.jobId(), snapshot.status());
            return snapshot;
        }

        PointExpiryResult result = loyaltyService.processExpiredPoints();
        log.info("[포인트 만료] 만료 안내 {}건, 소멸 처리 사용자 {}명, 소멸 포인트 {}",
            snapshot.processedItems(), result.expiredUsers(), result.totalExpiredPoints());
        return snapshot;
    }

    /**
     * 전체 회원의 등급을 재평가하고 등급이 바뀐 회원에게 알림을 보냅니다.
     *
     * @return 작업 스냅샷
     */
    public JobSnapshot evaluateTiers() {
        BatchJobType type = BatchJobType.LOYALTY_TIER_EVALUATION;
        AtomicLong upgrades = new AtomicLong();
        AtomicLong downgrades = new AtomicLong();

        JobSnapshot snapshot = batchProcessor.executeBatchJob(JobConfig.<Long>builder()
            .jobId(type.newJobId(clock.millis()))
            .jobType(type.name())
            .dataSource(memberDataSource())
            .batchSize(MEMBER_BATCH_SIZE)
            .processor(userId -> {
                loyaltyService.evaluateTier(userId).ifPresent(change -> {
                    notificationService.sendNotification(tierChangeNotification(change));
                    if (change.upgrade()) {
                        upgrades.incrementAndGet();
                    } else {
                        downgrades.incrementAndGet();
                    }
                });
                return userId;
            })
            .build());

        log.info("[등급 재평가] 대상 {}명, 상향 {}명, 하향 {}명",
            snapshot.totalItems(), upgrades.get(), downgrades.get());
        return snapshot;
    }

    /**
     * 전체 회원에게 축제 보너스 포인트를 지급합니다.
     *
     * @param parameters {@code festivalType} (기본값 general), {@code multiplier} (기본값 1.5)
     * @return 작업 스냅샷
     */
    public JobSnapshot grantFestivalBonus(BatchJobParameters parameters) {
        BatchJobType type = BatchJobType.LOYALTY_FESTIVAL_BONUS;
        String festivalType = parameters.getString("festivalType", DEFAULT_FESTIVAL_TYPE);
        double multiplier = parameters.getDouble("multiplier", DEFAULT_FESTIVAL_MULTIPLIER);
        AtomicLong grantedPoints = new AtomicLong();

        JobSnapshot snapshot = batchProcessor.executeBatchJob(JobConfig.<Long>builder()
            .jobId(type.newJobId(clock.millis()))
            .jobType(type.name())
            .dataSource(memberDataSource())
            .batchSize(MEMBER_BATCH_SIZE)
            .processor(userId -> {
                long granted = loyaltyService.grantFestivalBonus(userId, festivalType, multiplier);
                if (granted > 0) {
                    grantedPoints.addAndGet(granted);
                    notificationService.sendNotification(festivalBonusNotification(userId, festivalType, granted));
                }
                return userId;
            })
            .build());

        log.info("[축제 보너스] festivalType: {}, multiplier: {}, 지급 포인트 합계 {}",
            festivalType, multiplier, grantedPoints.get());
        return snapshot;
    }

    private BatchDataSource<Long> memberDataSource() {
        return new BatchDataSource<>() {
            @Override
            public long getTotalCount() {
                return loyaltyService.countMembers();
            }

            @Override
            public List<Long> getBatch(long offset, int limit) {
                return loyaltyService.getMemberIds(offset, limit);
            }
        };
    }

    private Notification pointsExpiringNotification(ExpiringPoints points) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("points", points.points());
        data.put("expiresAt", points.expiresAt() != null ? points.expiresAt().toString() : null);
        return new Notification(
            points.userId(),
            NotificationType.LOYALTY_POINTS_EXPIRING,
            "포인트 소멸 예정 안내",
            String.format("%d 포인트가 곧 소멸됩니다.", points.points()),
            data
        );
    }

    private Notification tierChangeNotification(TierChange change) {
        NotificationType type = change.upgrade()
            ? NotificationType.LOYALTY_TIER_UPGRADE
            : NotificationType.LOYALTY_TIER_DOWNGRADE;
        String title = change.upgrade() ? "회원 등급이 올라갔습니다" : "회원 등급이 조정되었습니다";
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("previousTier", change.previousTier());
        data.put("newTier", change.newTier());
        return new Notification(
            change.userId(),
            type,
            title,
            String.format("%s 등급에서 %s 등급으로 변경되었습니다.", change.previousTier(), change.newTier()),
            data
        );
    }

    private Notification festivalBonusNotification(Long userId, String festivalType, long granted) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("festivalType", festivalType);
        data.put("points", granted);
        return new Notification(
            userId,
            NotificationType.LOYALTY_FESTIVAL_BONUS,
            "축제 보너스 포인트 지급",
            String.format("축제 보너스 %d 포인트가 지급되었습니다.", granted),
            data
        );
    }
}
