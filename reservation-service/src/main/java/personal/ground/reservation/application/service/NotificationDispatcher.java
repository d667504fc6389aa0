package personal.ground.reservation.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.ground.reservation.application.port.out.NotificationSink;
import personal.ground.reservation.domain.model.NotificationMessage;

/**
 * 알림 전송 래퍼
 * 알림은 best-effort: 실패해도 로그만 남기고 이미 커밋된 예약을 되돌리거나 재시도하지 않는다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final NotificationSink notificationSink;

    /**
     * @return 전송 성공 여부
     */
    public boolean dispatch(NotificationMessage message) {
        try {
            notificationSink.send(message);
            return true;
        } catch (Exception e) {
            log.error("Notification failed (ignored): kind={}, title={}, error={}",
                    message.kind(), message.title(), e.getMessage(), e);
            return false;
        }
    }
}
