package personal.yacht.charter.booking.domain.model;

import java.time.Instant;

/**
 * 되돌리기용 작업 이력
 *
 * @param before 변경 전 스냅샷 (생성이면 null)
 * @param after  확정된 스냅샷 (삭제면 null)
 */
public record OperationRecord(
        String operationId,
        MutationType type,
        Reservation before,
        Reservation after,
        Instant recordedAt) {

    public String reservationId() {
        return after != null ? after.id() : before.id();
    }
}
