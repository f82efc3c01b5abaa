package com.orderhub.domain.notification;

import java.util.Map;

/**
 * 사용자별 일일 다이제스트.
 *
 * @param userId 사용자 ID
 * @param title 제목
 * @param message 본문
 * @param data 요약 데이터
 * @param hasContent 보낼 내용이 있는지 여부
 */
public record DailyDigest(
    Long userId,
    String title,
    String message,
    Map<String, Object> data,
    boolean hasContent
) {
    public Notification toNotification() {
        return new Notification(userId, NotificationType.DAILY_DIGEST, title, message, data);
    }
}
