package com.orderhub.domain.notification;

/**
 * 이벤트 대상 그룹 전체에게 보내는 알림.
 *
 * @param eventId 이벤트 ID
 * @param type 알림 유형
 * @param title 제목
 * @param message 본문
 * @param targetAudience 대상 그룹
 */
public record EventNotification(
    Long eventId,
    NotificationType type,
    String title,
    String message,
    String targetAudience
) {
}
