package com.orderhub.infrastructure.commerceapi;

import com.orderhub.domain.notification.DailyDigest;
import com.orderhub.domain.notification.EventNotification;
import com.orderhub.domain.notification.Notification;
import com.orderhub.domain.notification.NotificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * 커머스 API를 호출하는 {@link NotificationService} 구현체.
 */
@Component
@RequiredArgsConstructor
public class NotificationServiceImpl implements NotificationService {

    private final NotificationApiClient notificationApiClient;

    @Override
    public void sendNotification(Notification notification) {
        CommerceApiDto.unwrap(
            notificationApiClient.sendNotification(CommerceApiDto.NotificationRequest.from(notification)),
            "sendNotification"
        );
    }

    @Override
    public void sendEventNotification(EventNotification notification) {
        CommerceApiDto.unwrap(
            notificationApiClient.sendEventNotification(CommerceApiDto.EventNotificationRequest.from(notification)),
            "sendEventNotification"
        );
    }

    @Override
    public long countDigestSubscribers() {
        return count(notificationApiClient.countDigestSubscribers(), "countDigestSubscribers");
    }

    @Override
    public List<Long> getDigestSubscribers(long offset, int limit) {
        return userIds(notificationApiClient.getDigestSubscribers(offset, limit), "getDigestSubscribers");
    }

    @Override
    public DailyDigest generateDailyDigest(Long userId) {
        CommerceApiDto.DigestResponse response =
            CommerceApiDto.unwrap(notificationApiClient.generateDailyDigest(userId), "generateDailyDigest");
        if (response == null) {
            return new DailyDigest(userId, null, null, Map.of(), false);
        }
        return response.toDomain();
    }

    @Override
    public long countTargetUsers(Map<String, Object> criteria) {
        return count(notificationApiClient.countTargetUsers(criteria), "countTargetUsers");
    }

    @Override
    public List<Long> getTargetUsers(Map<String, Object> criteria, long offset, int limit) {
        return userIds(notificationApiClient.getTargetUsers(criteria, offset, limit), "getTargetUsers");
    }

    @Override
    public List<Long> getNotificationIdsCreatedBefore(ZonedDateTime cutoff) {
        return userIds(
            notificationApiClient.getNotificationIdsCreatedBefore(cutoff.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME)),
            "getNotificationIdsCreatedBefore"
        );
    }

    @Override
    public void deleteNotification(Long notificationId) {
        CommerceApiDto.unwrap(notificationApiClient.deleteNotification(notificationId), "deleteNotification");
    }

    private long count(CommerceApiDto.ApiResponse<CommerceApiDto.CountResponse> response, String operation) {
        CommerceApiDto.CountResponse data = CommerceApiDto.unwrap(response, operation);
        return data != null ? data.count() : 0L;
    }

    private List<Long> userIds(CommerceApiDto.ApiResponse<CommerceApiDto.UserIdsResponse> response, String operation) {
        CommerceApiDto.UserIdsResponse data = CommerceApiDto.unwrap(response, operation);
        return data != null ? data.userIdsOrEmpty() : List.of();
    }
}
