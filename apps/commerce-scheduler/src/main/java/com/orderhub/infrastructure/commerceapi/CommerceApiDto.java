package com.orderhub.infrastructure.commerceapi;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.orderhub.domain.coupon.Coupon;
import com.orderhub.domain.event.Event;
import com.orderhub.domain.event.EventStatus;
import com.orderhub.domain.loyalty.ExpiringPoints;
import com.orderhub.domain.loyalty.PointExpiryResult;
import com.orderhub.domain.loyalty.TierChange;
import com.orderhub.domain.notification.DailyDigest;
import com.orderhub.domain.notification.EventNotification;
import com.orderhub.domain.notification.Notification;
import com.orderhub.support.error.CoreException;
import com.orderhub.support.error.ErrorType;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

/**
 * 커머스 API 내부 엔드포인트 DTO.
 */
public class CommerceApiDto {

    /**
     * 응답 래퍼를 검사하고 데이터를 꺼냅니다.
     *
     * @param response API 응답
     * @param operation 호출한 작업 이름 (로그/예외 메시지용)
     * @param <T> 데이터 타입
     * @return 응답 데이터
     * @throws CoreException 응답이 없거나 FAIL인 경우 (INTERNAL_ERROR)
     */
    public static <T> T unwrap(ApiResponse<T> response, String operation) {
        if (response == null || response.meta() == null) {
            throw new CoreException(ErrorType.INTERNAL_ERROR,
                String.format("커머스 API 응답이 비어 있습니다. (operation: %s)", operation));
        }
        if (response.meta().result() != ApiResponse.Metadata.Result.SUCCESS) {
            throw new CoreException(ErrorType.INTERNAL_ERROR,
                String.format("커머스 API 호출 실패. (operation: %s, errorCode: %s, message: %s)",
                    operation, response.meta().errorCode(), response.meta().message()));
        }
        return response.data();
    }

    /**
     * 커머스 API 응답 래퍼.
     */
    public record ApiResponse<T>(
        @JsonProperty("meta") Metadata meta,
        @JsonProperty("data") T data
    ) {
        public record Metadata(
            @JsonProperty("result") Result result,
            @JsonProperty("errorCode") String errorCode,
            @JsonProperty("message") String message
        ) {
            public enum Result {
                SUCCESS,
                FAIL
            }
        }
    }

    public record EventResponse(
        @JsonProperty("id") Long id,
        @JsonProperty("name") String name,
        @JsonProperty("startTime") ZonedDateTime startTime,
        @JsonProperty("endTime") ZonedDateTime endTime,
        @JsonProperty("status") EventStatus status,
        @JsonProperty("targetAudience") String targetAudience
    ) {
        public Event toDomain() {
            return new Event(id, name, startTime, endTime, status, targetAudience);
        }
    }

    public record EventStatusRequest(
        @JsonProperty("status") EventStatus status
    ) {
    }

    public record CouponResponse(
        @JsonProperty("id") Long id,
        @JsonProperty("code") String code,
        @JsonProperty("discountValue") Long discountValue,
        @JsonProperty("expiresAt") ZonedDateTime expiresAt
    ) {
        public Coupon toDomain() {
            return new Coupon(id, code, discountValue, expiresAt);
        }
    }

    public record CountResponse(
        @JsonProperty("count") long count
    ) {
    }

    public record NotificationRequest(
        @JsonProperty("userId") Long userId,
        @JsonProperty("type") String type,
        @JsonProperty("title") String title,
        @JsonProperty("message") String message,
        @JsonProperty("data") Map<String, Object> data
    ) {
        public static NotificationRequest from(Notification notification) {
            return new NotificationRequest(
                notification.userId(),
                notification.type().name(),
                notification.title(),
                notification.message(),
                notification.data()
            );
        }
    }

    public record EventNotificationRequest(
        @JsonProperty("eventId") Long eventId,
        @JsonProperty("type") String type,
        @JsonProperty("title") String title,
        @JsonProperty("message") String message,
        @JsonProperty("targetAudience") String targetAudience
    ) {
        public static EventNotificationRequest from(EventNotification notification) {
            return new EventNotificationRequest(
                notification.eventId(),
                notification.type().name(),
                notification.title(),
                notification.message(),
                notification.targetAudience()
            );
        }
    }

    public record DigestResponse(
        @JsonProperty("userId") Long userId,
        @JsonProperty("title") String title,
        @JsonProperty("message") String message,
        @JsonProperty("data") Map<String, Object> data,
        @JsonProperty("hasContent") boolean hasContent
    ) {
        public DailyDigest toDomain() {
            return new DailyDigest(userId, title, message, data, hasContent);
        }
    }

    public record ExpiringPointsResponse(
        @JsonProperty("userId") Long userId,
        @JsonProperty("points") long points,
        @JsonProperty("expiresAt") ZonedDateTime expiresAt
    ) {
        public ExpiringPoints toDomain() {
            return new ExpiringPoints(userId, points, expiresAt);
        }
    }

    public record PointExpiryResponse(
        @JsonProperty("expiredUsers") long expiredUsers,
        @JsonProperty("totalExpiredPoints") long totalExpiredPoints
    ) {
        public PointExpiryResult toDomain() {
            return new PointExpiryResult(expiredUsers, totalExpiredPoints);
        }
    }

    /**
     * 등급 재평가 응답. 등급이 바뀌지 않았으면 {@code changed}가 false입니다.
     */
    public record TierEvaluationResponse(
        @JsonProperty("userId") Long userId,
        @JsonProperty("changed") boolean changed,
        @JsonProperty("previousTier") String previousTier,
        @JsonProperty("newTier") String newTier,
        @JsonProperty("upgrade") boolean upgrade
    ) {
        public TierChange toDomain() {
            return new TierChange(userId, previousTier, newTier, upgrade);
        }
    }

    public record FestivalBonusRequest(
        @JsonProperty("festivalType") String festivalType,
        @JsonProperty("multiplier") double multiplier
    ) {
    }

    public record FestivalBonusResponse(
        @JsonProperty("userId") Long userId,
        @JsonProperty("grantedPoints") long grantedPoints
    ) {
    }

    public record UserIdsResponse(
        @JsonProperty("userIds") List<Long> userIds
    ) {
        public List<Long> userIdsOrEmpty() {
            return userIds != null ? userIds : List.of();
        }
    }
}
