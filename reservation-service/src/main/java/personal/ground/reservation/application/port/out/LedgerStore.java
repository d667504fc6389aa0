package personal.ground.reservation.application.port.out;

import java.util.List;

/**
 * Ledger Store (Output Port)
 * 예약 대장(스프레드시트) 연동 인터페이스. 행은 위치 기반 컬럼 배열
 */
public interface LedgerStore {

    /**
     * 헤더 행이 비어 있으면 기록
     */
    void ensureHeaderRow(List<String> columns);

    /**
     * 행 추가
     *
     * @return 추가된 행 번호 (1-based, 헤더 포함)
     * @throws personal.ground.reservation.domain.exception.ExternalStoreException 기록 실패 시
     */
    int appendRow(List<Object> columns);

    /**
     * 헤더를 제외한 데이터 행 전체 조회
     *
     * @throws personal.ground.reservation.domain.exception.ExternalStoreException 조회 실패 시
     */
    List<List<String>> readRows();
}
