package com.orderhub.infrastructure.commerceapi;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;

import java.util.List;

/**
 * 커머스 API 이벤트 내부 엔드포인트 FeignClient.
 */
@FeignClient(
    name = "eventApiClient",
    url = "${commerce-api.url}",
    path = "/internal/v1/events"
)
public interface EventApiClient {

    @GetMapping("/upcoming")
    CommerceApiDto.ApiResponse<List<CommerceApiDto.EventResponse>> getUpcomingEvents();

    @GetMapping("/active")
    CommerceApiDto.ApiResponse<List<CommerceApiDto.EventResponse>> getActiveEvents();

    @PutMapping("/{eventId}/status")
    CommerceApiDto.ApiResponse<Object> updateEventStatus(
        @PathVariable("eventId") Long eventId,
        @RequestBody CommerceApiDto.EventStatusRequest request
    );
}
