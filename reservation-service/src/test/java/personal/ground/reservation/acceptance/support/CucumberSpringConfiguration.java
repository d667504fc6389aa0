package personal.ground.reservation.acceptance.support;

import io.cucumber.spring.CucumberContextConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * Cucumber와 Spring Boot를 통합하기 위한 설정 클래스
 * 외부 연동(캘린더, 대장, 알림, 추출기)은 메모리 구현으로 교체하고 실제 HTTP로 API를 호출
 */
@CucumberContextConfiguration
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import({TestExternalStoreConfig.class, ReservationHttpAdapter.class, ReservationTestContext.class})
public class CucumberSpringConfiguration {
}
