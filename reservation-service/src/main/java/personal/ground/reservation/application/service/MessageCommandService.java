package personal.ground.reservation.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.ground.reservation.application.config.GroundProperties;
import personal.ground.reservation.application.port.in.CommitReservationUseCase;
import personal.ground.reservation.application.port.in.GetMonthlySummaryUseCase;
import personal.ground.reservation.application.port.in.GetTodayReservationsUseCase;
import personal.ground.reservation.application.port.in.HandleMessageUseCase;
import personal.ground.reservation.application.port.out.ReservationExtractor;
import personal.ground.reservation.domain.model.CommitResult;
import personal.ground.reservation.domain.model.ExtractionResult;
import personal.ground.reservation.domain.service.NotificationMessageFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Set;

/**
 * Message Command Service (Application Service)
 * 메시지 명령 라우팅: 관리자 명령 → 해당 조회/신청, 그 외 → 추출기 → 예약 커밋.
 * 모든 경로에서 회신 문구를 반환하며, 내부 오류는 일반 시스템 오류 문구로 변환
 */
@Slf4j
@Service
public class MessageCommandService implements HandleMessageUseCase {

    static final String LIST_COMMAND = "/予約一覧";
    static final String CANCEL_COMMAND = "/キャンセル";
    static final String MONTHLY_COMMAND = "/月次集計";
    static final Set<String> HELP_COMMANDS = Set.of("/ヘルプ", "ヘルプ", "使い方");

    private final ReservationExtractor extractor;
    private final CommitReservationUseCase commitReservationUseCase;
    private final GetTodayReservationsUseCase getTodayReservationsUseCase;
    private final GetMonthlySummaryUseCase getMonthlySummaryUseCase;
    private final NotificationDispatcher notificationDispatcher;
    private final NotificationMessageFactory messageFactory;
    private final ReplyMessageFormatter formatter;
    private final Clock clock;
    private final ZoneId zoneId;

    public MessageCommandService(ReservationExtractor extractor,
                                 CommitReservationUseCase commitReservationUseCase,
                                 GetTodayReservationsUseCase getTodayReservationsUseCase,
                                 GetMonthlySummaryUseCase getMonthlySummaryUseCase,
                                 NotificationDispatcher notificationDispatcher,
                                 NotificationMessageFactory messageFactory,
                                 ReplyMessageFormatter formatter,
                                 Clock clock,
                                 GroundProperties properties) {
        this.extractor = extractor;
        this.commitReservationUseCase = commitReservationUseCase;
        this.getTodayReservationsUseCase = getTodayReservationsUseCase;
        this.getMonthlySummaryUseCase = getMonthlySummaryUseCase;
        this.notificationDispatcher = notificationDispatcher;
        this.messageFactory = messageFactory;
        this.formatter = formatter;
        this.clock = clock;
        this.zoneId = properties.zoneId();
    }

    @Override
    public String handleText(String text) {
        String trimmed = text == null ? "" : text.trim();
        try {
            if (trimmed.startsWith(LIST_COMMAND)) {
                return formatter.todayList(today(), getTodayReservationsUseCase.listToday());
            }
            if (trimmed.startsWith(CANCEL_COMMAND)) {
                return requestCancellation(trimmed);
            }
            if (trimmed.startsWith(MONTHLY_COMMAND)) {
                return monthlySummary(trimmed.substring(MONTHLY_COMMAND.length()).trim());
            }
            if (HELP_COMMANDS.contains(trimmed)) {
                return help();
            }

            ExtractionResult extraction = extractor.extractFromText(trimmed, today());
            if (!extraction.reservation()) {
                log.info("Message is not a reservation request, replying with help: error={}", extraction.error());
                return help();
            }
            return reply(commitReservationUseCase.commit(extraction.candidate()));

        } catch (Exception e) {
            log.error("Message handling failed: error={}", e.getMessage(), e);
            return ReplyMessageFormatter.SYSTEM_ERROR;
        }
    }

    @Override
    public String handleImage(byte[] image, String mediaType) {
        try {
            ExtractionResult extraction = extractor.extractFromImage(image, mediaType, today());
            if (!extraction.reservation()) {
                log.info("Image did not contain a reservation: mediaType={}, error={}", mediaType, extraction.error());
                return ReplyMessageFormatter.IMAGE_NOT_READ;
            }
            return reply(commitReservationUseCase.commit(extraction.candidate()));

        } catch (Exception e) {
            log.error("Image message handling failed: mediaType={}", mediaType, e);
            return ReplyMessageFormatter.SYSTEM_ERROR;
        }
    }

    @Override
    public String requestCancellation(String text) {
        log.info("Cancellation requested");
        notificationDispatcher.dispatch(messageFactory.cancelRequest(text));
        return ReplyMessageFormatter.CANCEL_ACKNOWLEDGED;
    }

    @Override
    public String help() {
        return formatter.help();
    }

    private String monthlySummary(String argument) {
        YearMonth month;
        if (argument.isEmpty()) {
            month = YearMonth.now(clock.withZone(zoneId));
        } else {
            try {
                month = YearMonth.parse(argument);
            } catch (DateTimeParseException e) {
                log.info("Invalid month argument: argument={}", argument);
                return formatter.invalidMonth(argument);
            }
        }
        return formatter.monthlySummary(
                getMonthlySummaryUseCase.monthlySummary(month.getYear(), month.getMonthValue()));
    }

    private String reply(CommitResult result) {
        if (result instanceof CommitResult.Committed committed) {
            return formatter.confirmation(committed.confirmation());
        }
        if (result instanceof CommitResult.Rejected rejected) {
            return formatter.remediation(rejected.error());
        }
        if (result instanceof CommitResult.Conflicted conflicted) {
            return formatter.conflict(conflicted.request());
        }
        CommitResult.Failed failed = (CommitResult.Failed) result;
        log.warn("Reservation commit failed: failedAt={}, finalState={}, reason={}",
                failed.failedAt(), failed.finalState(), failed.reason());
        return ReplyMessageFormatter.SYSTEM_ERROR;
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(zoneId));
    }
}
