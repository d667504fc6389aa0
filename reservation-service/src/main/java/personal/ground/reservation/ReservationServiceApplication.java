package personal.ground.reservation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Reservation Service Application
 * 예약 접수 → 검증 → 중복 확인 → 요금 계산 → 캘린더/대장/알림 커밋 파이프라인
 */
@EnableScheduling  // Daily Summary Scheduler 활성화
@ConfigurationPropertiesScan(basePackages = "personal.ground.reservation.application.config")
@SpringBootApplication(
    scanBasePackages = {
        "personal.ground.reservation",
        "personal.ground.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class ReservationServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReservationServiceApplication.class, args);
    }
}
