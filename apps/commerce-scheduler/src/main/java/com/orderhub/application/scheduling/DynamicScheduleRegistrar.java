package com.orderhub.application.scheduling;

import com.orderhub.domain.coupon.Coupon;
import com.orderhub.domain.coupon.CouponService;
import com.orderhub.domain.event.Event;
import com.orderhub.domain.event.EventService;
import com.orderhub.domain.event.EventStatus;
import com.orderhub.domain.notification.EventNotification;
import com.orderhub.domain.notification.Notification;
import com.orderhub.domain.notification.NotificationService;
import com.orderhub.domain.notification.NotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 비즈니스 데이터로부터 실행 시각을 계산하는 일회성 작업 등록기.
 * <p>
 * <b>등록하는 작업:</b>
 * <ul>
 *   <li>{@code event_start_notify_{eventId}}: 이벤트 시작 1시간 전 대상 그룹에 시작 알림</li>
 *   <li>{@code event_end_{eventId}}: 이벤트 종료 시각에 상태를 ENDED로 변경</li>
 *   <li>{@code coupon_expiry_notify_{couponId}}: 쿠폰 만료 1일 전 보유자 전원에게 만료 알림</li>
 * </ul>
 * </p>
 * <p>
 * 이미 지난 시각의 작업은 예약되지 않습니다. 조회 실패는 종류(이벤트/쿠폰)별로 로그만 남기고 넘어갑니다.
 * </p>
 *
 * @author orderhub
 * @version 1.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DynamicScheduleRegistrar {

    static final Duration EVENT_START_NOTICE = Duration.ofHours(1);
    static final Duration COUPON_EXPIRY_NOTICE = Duration.ofDays(1);

    private final OneTimeJobScheduler oneTimeJobScheduler;
    private final EventService eventService;
    private final CouponService couponService;
    private final NotificationService notificationService;

    public void registerAll() {
        scheduleEventJobs();
        scheduleCouponJobs();
    }

    /**
     * 예정된 이벤트의 시작 알림과 종료 작업을 예약합니다.
     *
     * @return 예약된 작업 수
     */
    public int scheduleEventJobs() {
        try {
            List<Event> events = eventService.getUpcomingEvents();
            int scheduled = 0;
            for (Event event : events) {
                if (event.startTime() != null) {
                    Instant notifyAt = event.startTime().toInstant().minus(EVENT_START_NOTICE);
                    if (oneTimeJobScheduler.schedule(eventStartJobId(event.id()), notifyAt,
                        () -> sendEventStartNotification(event))) {
                        scheduled++;
                    }
                }
                if (event.endTime() != null) {
                    if (oneTimeJobScheduler.schedule(eventEndJobId(event.id()), event.endTime().toInstant(),
                        () -> endEvent(event))) {
                        scheduled++;
                    }
                }
            }
            log.info("이벤트 기반 일회성 작업 등록 완료. (events: {}, scheduled: {})", events.size(), scheduled);
            return scheduled;
        } catch (Exception e) {
            log.warn("이벤트 기반 일회성 작업 등록 실패.", e);
            return 0;
        }
    }

    /**
     * 활성 쿠폰의 만료 알림을 예약합니다.
     *
     * @return 예약된 작업 수
     */
    public int scheduleCouponJobs() {
        try {
            List<Coupon> coupons = couponService.getActiveCoupons();
            int scheduled = 0;
            for (Coupon coupon : coupons) {
                if (coupon.expiresAt() == null) {
                    continue;
                }
                Instant notifyAt = coupon.expiresAt().toInstant().minus(COUPON_EXPIRY_NOTICE);
                if (oneTimeJobScheduler.schedule(couponExpiryJobId(coupon.id()), notifyAt,
                    () -> notifyCouponHolders(coupon))) {
                    scheduled++;
                }
            }
            log.info("쿠폰 기반 일회성 작업 등록 완료. (coupons: {}, scheduled: {})", coupons.size(), scheduled);
            return scheduled;
        } catch (Exception e) {
            log.warn("쿠폰 기반 일회성 작업 등록 실패.", e);
            return 0;
        }
    }

    void sendEventStartNotification(Event event) {
        notificationService.sendEventNotification(new EventNotification(
            event.id(),
            NotificationType.EVENT_STARTING,
            "이벤트가 곧 시작됩니다",
            String.format("%s 이벤트가 1시간 후 시작됩니다.", event.name()),
            event.targetAudienceOrAll()
        ));
        log.info("이벤트 시작 알림 발송. (eventId: {})", event.id());
    }

    void endEvent(Event event) {
        eventService.updateEventStatus(event.id(), EventStatus.ENDED);
        log.info("이벤트 종료 처리. (eventId: {})", event.id());
    }

    /**
     * 쿠폰 보유자 전원에게 만료 알림을 보냅니다. 한 명에게 실패해도 나머지에게는 계속 보냅니다.
     *
     * @return 발송 성공 건수
     */
    int notifyCouponHolders(Coupon coupon) {
        List<Long> holders = couponService.getCouponHolders(coupon.id());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("couponId", coupon.id());
        data.put("couponCode", coupon.code());
        data.put("discountValue", coupon.discountValue());
        data.put("expiresAt", coupon.expiresAt() != null ? coupon.expiresAt().toString() : null);

        int sent = 0;
        for (Long userId : holders) {
            try {
                notificationService.sendNotification(new Notification(
                    userId,
                    NotificationType.COUPON_EXPIRING,
                    "쿠폰 만료 예정 안내",
                    String.format("%s 쿠폰이 내일 만료됩니다.", coupon.code()),
                    data
                ));
                sent++;
            } catch (Exception e) {
                log.warn("쿠폰 만료 알림 발송 실패. (couponId: {}, userId: {})", coupon.id(), userId, e);
            }
        }
        log.info("쿠폰 만료 알림 발송 완료. (couponId: {}, holders: {}, sent: {})", coupon.id(), holders.size(), sent);
        return sent;
    }

    static String eventStartJobId(Long eventId) {
        return "event_start_notify_" + eventId;
    }

    static String eventEndJobId(Long eventId) {
        return "event_end_" + eventId;
    }

    static String couponExpiryJobId(Long couponId) {
        return "coupon_expiry_notify_" + couponId;
    }
}
