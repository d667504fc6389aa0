package personal.ground.reservation.application.port.out;

import personal.ground.reservation.domain.model.NotificationMessage;

/**
 * Notification Sink (Output Port)
 * fire-and-forget 운영자 알림. 엔드포인트 미설정 시 조용히 무시(no-op)
 */
public interface NotificationSink {

    /**
     * @throws personal.ground.reservation.domain.exception.ExternalStoreException 전송 실패 시
     */
    void send(NotificationMessage message);
}
