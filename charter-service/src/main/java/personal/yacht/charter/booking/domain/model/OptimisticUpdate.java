package personal.yacht.charter.booking.domain.model;

/**
 * 백엔드 응답 전까지 유지되는 낙관적 변경
 *
 * @param applied  적용된 스냅샷 (삭제면 null)
 * @param previous 적용 전 스냅샷 (생성이면 null), 롤백 시 복원한다
 */
public record OptimisticUpdate(
        String operationId,
        MutationType type,
        String reservationId,
        Reservation applied,
        Reservation previous) {

    /**
     * 아래에 깔린 변경이 실패했을 때 복원 대상을 바꿔 끼운다.
     */
    public OptimisticUpdate withPrevious(Reservation newPrevious) {
        return new OptimisticUpdate(operationId, type, reservationId, applied, newPrevious);
    }
}
