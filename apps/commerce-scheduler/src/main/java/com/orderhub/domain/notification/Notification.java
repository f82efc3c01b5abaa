package com.orderhub.domain.notification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 사용자 한 명에게 보내는 알림.
 *
 * @param userId 수신 사용자 ID
 * @param type 알림 유형
 * @param title 제목
 * @param message 본문
 * @param data 부가 데이터
 */
public record Notification(
    Long userId,
    NotificationType type,
    String title,
    String message,
    Map<String, Object> data
) {
    public Notification {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
