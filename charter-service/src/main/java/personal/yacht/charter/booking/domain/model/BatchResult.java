package personal.yacht.charter.booking.domain.model;

/**
 * 일괄 처리 작업별 결과
 *
 * @param reservation 성공 시 확정된 예약 (삭제면 null)
 * @param error       실패 원인 (성공이면 null)
 */
public record BatchResult(
        BatchOperation operation,
        boolean success,
        Reservation reservation,
        Throwable error) {

    public static BatchResult success(BatchOperation operation, Reservation reservation) {
        return new BatchResult(operation, true, reservation, null);
    }

    public static BatchResult failure(BatchOperation operation, Throwable error) {
        return new BatchResult(operation, false, null, error);
    }
}
