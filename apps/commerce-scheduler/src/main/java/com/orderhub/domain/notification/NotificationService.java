package com.orderhub.domain.notification;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

/**
 * 알림 도메인 서비스.
 */
public interface NotificationService {

    void sendNotification(Notification notification);

    void sendEventNotification(EventNotification notification);

    long countDigestSubscribers();

    List<Long> getDigestSubscribers(long offset, int limit);

    DailyDigest generateDailyDigest(Long userId);

    /**
     * 조건에 맞는 대상 사용자 수를 조회합니다.
     *
     * @param criteria 대상 조건 (비어 있으면 전체 사용자)
     * @return 대상 사용자 수
     */
    long countTargetUsers(Map<String, Object> criteria);

    List<Long> getTargetUsers(Map<String, Object> criteria, long offset, int limit);

    /**
     * 기준 시각 이전에 생성된 알림 ID 목록을 조회합니다.
     */
    List<Long> getNotificationIdsCreatedBefore(ZonedDateTime cutoff);

    void deleteNotification(Long notificationId);
}
