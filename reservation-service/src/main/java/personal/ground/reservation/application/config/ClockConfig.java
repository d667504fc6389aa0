package personal.ground.reservation.application.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 그라운드 시간대 기준 Clock. 테스트에서는 고정 Clock으로 교체
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(GroundProperties properties) {
        return Clock.system(properties.zoneId());
    }
}
