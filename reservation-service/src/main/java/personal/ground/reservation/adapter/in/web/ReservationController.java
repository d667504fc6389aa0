package personal.ground.reservation.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import personal.ground.common.exception.ErrorCode;
import personal.ground.common.web.ApiResponse;
import personal.ground.reservation.adapter.in.web.dto.BookingRecordResponse;
import personal.ground.reservation.adapter.in.web.dto.CancellationRequest;
import personal.ground.reservation.adapter.in.web.dto.CommitResponse;
import personal.ground.reservation.adapter.in.web.dto.MessageRequest;
import personal.ground.reservation.adapter.in.web.dto.MonthlySummaryResponse;
import personal.ground.reservation.adapter.in.web.dto.ReplyResponse;
import personal.ground.reservation.adapter.in.web.dto.ReservationCandidateRequest;
import personal.ground.reservation.application.port.in.CommitReservationUseCase;
import personal.ground.reservation.application.port.in.GetMonthlySummaryUseCase;
import personal.ground.reservation.application.port.in.GetTodayReservationsUseCase;
import personal.ground.reservation.application.port.in.HandleMessageUseCase;
import personal.ground.reservation.domain.model.CommitResult;
import personal.ground.reservation.domain.model.CommitState;

import java.io.IOException;
import java.util.List;

/**
 * Reservation API Controller
 * 메시징 게이트웨이/관리 도구용 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ReservationController {

    private final HandleMessageUseCase handleMessageUseCase;
    private final CommitReservationUseCase commitReservationUseCase;
    private final GetTodayReservationsUseCase getTodayReservationsUseCase;
    private final GetMonthlySummaryUseCase getMonthlySummaryUseCase;

    /**
     * 텍스트 메시지 처리 (명령 또는 예약 요청)
     * POST /api/v1/messages
     */
    @PostMapping("/messages")
    public ResponseEntity<ApiResponse<ReplyResponse>> handleMessage(@Valid @RequestBody MessageRequest request) {
        log.info("Message received: length={}", request.text().length());

        String reply = handleMessageUseCase.handleText(request.text());

        return ResponseEntity.ok(ApiResponse.success("Message handled", new ReplyResponse(reply)));
    }

    /**
     * 이미지 메시지 처리
     * POST /api/v1/messages/image
     */
    @PostMapping(value = "/messages/image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<ReplyResponse>> handleImage(@RequestPart("image") MultipartFile image)
            throws IOException {
        log.info("Image message received: contentType={}, size={}", image.getContentType(), image.getSize());

        String reply = handleMessageUseCase.handleImage(image.getBytes(), image.getContentType());

        return ResponseEntity.ok(ApiResponse.success("Image handled", new ReplyResponse(reply)));
    }

    /**
     * 구조화된 예약 후보 커밋
     * POST /api/v1/reservations
     */
    @PostMapping("/reservations")
    public ResponseEntity<ApiResponse<CommitResponse>> commitReservation(
            @RequestBody ReservationCandidateRequest request) {
        log.info("Reservation commit requested: date={}, start={}, court={}",
                request.date(), request.startTime(), request.court());

        CommitResult result = commitReservationUseCase.commit(request.toCandidate());
        CommitResponse response = CommitResponse.from(result);

        if (result instanceof CommitResult.Committed) {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(ApiResponse.success("Reservation committed", response));
        }
        ErrorCode errorCode = errorCodeOf(result);
        return ResponseEntity.status(errorCode.getHttpStatus())
                .body(ApiResponse.error(errorCode.getMessage(), response));
    }

    /**
     * 오늘 예약 목록
     * GET /api/v1/reservations/today
     */
    @GetMapping("/reservations/today")
    public ResponseEntity<ApiResponse<List<BookingRecordResponse>>> listToday() {
        List<BookingRecordResponse> response = getTodayReservationsUseCase.listToday().stream()
                .map(BookingRecordResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("Today's reservations", response));
    }

    /**
     * 월간 집계
     * GET /api/v1/reservations/summary?year=2025&month=6
     */
    @GetMapping("/reservations/summary")
    public ResponseEntity<ApiResponse<MonthlySummaryResponse>> monthlySummary(
            @RequestParam int year,
            @RequestParam int month) {
        log.info("Monthly summary requested: year={}, month={}", year, month);

        MonthlySummaryResponse response = MonthlySummaryResponse.from(
                getMonthlySummaryUseCase.monthlySummary(year, month));

        return ResponseEntity.ok(ApiResponse.success("Monthly summary", response));
    }

    /**
     * 취소 신청 (운영자 알림으로만 전달)
     * POST /api/v1/reservations/cancellations
     */
    @PostMapping("/reservations/cancellations")
    public ResponseEntity<ApiResponse<ReplyResponse>> requestCancellation(
            @Valid @RequestBody CancellationRequest request) {
        String reply = handleMessageUseCase.requestCancellation(request.text());

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.success("Cancellation requested", new ReplyResponse(reply)));
    }

    /**
     * 이용 안내
     * GET /api/v1/help
     */
    @GetMapping("/help")
    public ResponseEntity<ApiResponse<ReplyResponse>> help() {
        return ResponseEntity.ok(ApiResponse.success("Help", new ReplyResponse(handleMessageUseCase.help())));
    }

    private static ErrorCode errorCodeOf(CommitResult result) {
        if (result instanceof CommitResult.Rejected) {
            return ErrorCode.RESERVATION_VALIDATION_FAILED;
        }
        if (result instanceof CommitResult.Conflicted) {
            return ErrorCode.RESERVATION_CONFLICT;
        }
        CommitResult.Failed failed = (CommitResult.Failed) result;
        // 락 대기 시간 초과는 VALIDATED 에서 실패
        if (failed.failedAt() == CommitState.VALIDATED) {
            return ErrorCode.COURT_LOCK_UNAVAILABLE;
        }
        return ErrorCode.EXTERNAL_SERVICE_ERROR;
    }
}
