package personal.ground.reservation.acceptance.steps;

import io.cucumber.java.Before;
import io.cucumber.java.en.And;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.cucumber.spring.ScenarioScope;
import io.restassured.response.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import personal.ground.reservation.acceptance.support.ReservationHttpAdapter;
import personal.ground.reservation.acceptance.support.ReservationTestContext;
import personal.ground.reservation.acceptance.support.ScriptedReservationExtractor;
import personal.ground.reservation.domain.model.BookingRecord;
import personal.ground.reservation.domain.model.NotificationMessage;
import personal.ground.reservation.domain.model.ReservationCandidate;
import personal.ground.reservation.domain.service.BookingLedgerCodec;
import personal.ground.reservation.fixture.InMemoryCalendarStore;
import personal.ground.reservation.fixture.InMemoryLedgerStore;
import personal.ground.reservation.fixture.RecordingNotificationSink;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Reservation Acceptance Test Step Definitions
 * 비즈니스 관점의 자연어로 작성된 시나리오에 매핑
 */
@Slf4j
@ScenarioScope
@RequiredArgsConstructor
public class ReservationAcceptanceSteps {

    private static final String DEFAULT_NAME = "田中太郎";
    private static final String DEFAULT_PHONE = "090-1234-5678";

    private final ReservationHttpAdapter httpAdapter;
    private final ReservationTestContext context;
    private final InMemoryCalendarStore calendarStore;
    private final InMemoryLedgerStore ledgerStore;
    private final RecordingNotificationSink notificationSink;
    private final ScriptedReservationExtractor extractor;

    @Before
    public void resetExternalStores() {
        calendarStore.clear();
        ledgerStore.clear();
        notificationSink.clear();
        extractor.clear();
    }

    private static Map<String, Object> candidate(String date, String startTime, int hours, String court) {
        Map<String, Object> body = new HashMap<>();
        body.put("date", date);
        body.put("startTime", startTime);
        body.put("hours", hours);
        body.put("court", court);
        body.put("name", DEFAULT_NAME);
        body.put("phone", DEFAULT_PHONE);
        return body;
    }

    // ==========================================
    // Given: 사전 상태
    // ==========================================

    @Given("이미 {string} {string}부터 {int}시간 {string}면 예약이 확정되어 있다")
    public void 이미_예약이_확정되어_있다(String date, String startTime, int hours, String court) {
        log.info(">>> Given: 기존 예약 확정 - date={}, start={}, court={}", date, startTime, court);
        Response response = httpAdapter.commitReservation(candidate(date, startTime, hours, court));
        assertThat(response.statusCode()).isEqualTo(201);
        notificationSink.clear();
    }

    @Given("메시지 {string}는 {string} {string}부터 {int}시간 {string}면 예약으로 해석된다")
    public void 메시지가_예약으로_해석된다(String text, String date, String startTime, int hours, String court) {
        extractor.script(text, new ReservationCandidate(date, startTime, null, hours, court, null, null,
                DEFAULT_NAME, DEFAULT_PHONE, null, 0.95));
    }

    // ==========================================
    // When: 이용자 행동
    // ==========================================

    @When("이용자가 {string} {string}부터 {int}시간 {string}면 예약을 요청한다")
    public void 이용자가_예약을_요청한다(String date, String startTime, int hours, String court) {
        log.info(">>> When: 예약 커밋 API 호출 - date={}, start={}, hours={}, court={}",
                date, startTime, hours, court);
        context.setLastHttpResponse(httpAdapter.commitReservation(candidate(date, startTime, hours, court)));
    }

    @When("이용자가 이름 없이 {string} {string}부터 {int}시간 {string}면 예약을 요청한다")
    public void 이용자가_이름_없이_예약을_요청한다(String date, String startTime, int hours, String court) {
        Map<String, Object> body = candidate(date, startTime, hours, court);
        body.remove("name");
        context.setLastHttpResponse(httpAdapter.commitReservation(body));
    }

    @When("이용자가 메시지 {string}를 보낸다")
    public void 이용자가_메시지를_보낸다(String text) {
        log.info(">>> When: 메시지 API 호출");
        context.setLastHttpResponse(httpAdapter.sendMessage(text));
    }

    @When("{int}년 {int}월 집계를 조회한다")
    public void 월간_집계를_조회한다(int year, int month) {
        context.setLastHttpResponse(httpAdapter.getMonthlySummary(year, month));
    }

    // ==========================================
    // Then: 결과 검증
    // ==========================================

    @Then("예약 응답 상태 코드는 {int}이다")
    public void 예약_응답_상태_코드는(int statusCode) {
        assertThat(context.getLastHttpResponse().statusCode()).isEqualTo(statusCode);
    }

    @And("확정된 이용 시간은 {int}시간이고 종료 시각은 {string}이다")
    public void 확정된_이용_시간과_종료_시각(int hours, String endTime) {
        Response response = context.getLastHttpResponse();
        assertThat(response.jsonPath().getInt("data.reservation.hours")).isEqualTo(hours);
        assertThat(response.jsonPath().getString("data.reservation.endTime")).isEqualTo(endTime);
    }

    @And("요금은 {long}엔이고 요일 구분은 {string}이다")
    public void 요금과_요일_구분(long totalFee, String dayType) {
        Response response = context.getLastHttpResponse();
        assertThat(response.jsonPath().getLong("data.reservation.totalFee")).isEqualTo(totalFee);
        assertThat(response.jsonPath().getString("data.reservation.dayType")).isEqualTo(dayType);
    }

    @And("누락 항목에 {string}이 포함된다")
    public void 누락_항목에_포함된다(String field) {
        List<String> missing = context.getLastHttpResponse().jsonPath().getList("data.missingFields", String.class);
        assertThat(missing).contains(field);
    }

    @And("대장에 {string} 상태의 행이 {int}건 기록되어 있다")
    public void 대장에_기록되어_있다(String status, int count) {
        List<BookingRecord> records = ledgerStore.readRows().stream()
                .map(BookingLedgerCodec::fromRow)
                .toList();
        assertThat(records).hasSize(count);
        assertThat(records).allMatch(record -> status.equals(record.status()));
    }

    @And("캘린더에 일정이 {int}건 등록되어 있다")
    public void 캘린더에_일정이_등록되어_있다(int count) {
        assertThat(calendarStore.events()).hasSize(count);
    }

    @And("운영자에게 {string} 알림이 전송된다")
    public void 운영자에게_알림이_전송된다(String kind) {
        assertThat(notificationSink.messages(NotificationMessage.Kind.valueOf(kind))).hasSize(1);
    }

    @And("회신 문구에 {string}가 포함된다")
    public void 회신_문구에_포함된다(String text) {
        assertThat(context.getLastHttpResponse().jsonPath().getString("data.reply")).contains(text);
    }

    @And("집계 건수는 {int}건, 매출 합계는 {long}엔이다")
    public void 집계_결과(int count, long totalFee) {
        Response response = context.getLastHttpResponse();
        assertThat(response.jsonPath().getInt("data.count")).isEqualTo(count);
        assertThat(response.jsonPath().getLong("data.totalFee")).isEqualTo(totalFee);
    }
}
