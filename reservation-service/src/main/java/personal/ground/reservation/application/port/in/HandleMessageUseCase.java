package personal.ground.reservation.application.port.in;

/**
 * Handle Message UseCase (Input Port)
 * 메시징 게이트웨이에서 들어온 메시지를 처리하고 회신 문구를 반환한다.
 * 모든 경로가 회신 문구를 반환하며 예외를 던지지 않는다
 */
public interface HandleMessageUseCase {

    String handleText(String text);

    String handleImage(byte[] image, String mediaType);

    /**
     * 취소 신청 (알림으로만 전달, 대장은 변경하지 않음)
     */
    String requestCancellation(String text);

    String help();
}
