package com.orderhub.infrastructure.commerceapi;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.Map;

/**
 * 커머스 API 알림 내부 엔드포인트 FeignClient.
 */
@FeignClient(
    name = "notificationApiClient",
    url = "${commerce-api.url}",
    path = "/internal/v1/notifications"
)
public interface NotificationApiClient {

    @PostMapping
    CommerceApiDto.ApiResponse<Object> sendNotification(@RequestBody CommerceApiDto.NotificationRequest request);

    @PostMapping("/events")
    CommerceApiDto.ApiResponse<Object> sendEventNotification(@RequestBody CommerceApiDto.EventNotificationRequest request);

    @GetMapping("/digest-subscribers/count")
    CommerceApiDto.ApiResponse<CommerceApiDto.CountResponse> countDigestSubscribers();

    @GetMapping("/digest-subscribers")
    CommerceApiDto.ApiResponse<CommerceApiDto.UserIdsResponse> getDigestSubscribers(
        @RequestParam("offset") long offset,
        @RequestParam("limit") int limit
    );

    @GetMapping("/digests/{userId}")
    CommerceApiDto.ApiResponse<CommerceApiDto.DigestResponse> generateDailyDigest(@PathVariable("userId") Long userId);

    @PostMapping("/targets/count")
    CommerceApiDto.ApiResponse<CommerceApiDto.CountResponse> countTargetUsers(@RequestBody Map<String, Object> criteria);

    @PostMapping("/targets")
    CommerceApiDto.ApiResponse<CommerceApiDto.UserIdsResponse> getTargetUsers(
        @RequestBody Map<String, Object> criteria,
        @RequestParam("offset") long offset,
        @RequestParam("limit") int limit
    );

    /**
     * 기준 시각 이전에 생성된 알림 ID를 조회합니다.
     *
     * @param createdBefore ISO-8601 시각
     * @return 알림 ID 목록
     */
    @GetMapping("/ids")
    CommerceApiDto.ApiResponse<CommerceApiDto.UserIdsResponse> getNotificationIdsCreatedBefore(
        @RequestParam("createdBefore") String createdBefore
    );

    @DeleteMapping("/{notificationId}")
    CommerceApiDto.ApiResponse<Object> deleteNotification(@PathVariable("notificationId") Long notificationId);
}
