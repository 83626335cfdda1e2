package personal.yacht.charter.booking.domain.model;

import lombok.Builder;

import java.time.LocalDateTime;

/**
 * 예약 부분 변경 요청
 * null 필드는 변경하지 않는다.
 */
@Builder(toBuilder = true)
public record ReservationPatch(
        String resourceId,
        String customerName,
        String customerEmail,
        LocalDateTime startDateTime,
        LocalDateTime endDateTime,
        ReservationStatus status,
        ReservationType type,
        String notes,
        Boolean depositPaid,
        Boolean finalPaymentPaid) {

    public static ReservationPatch moveTo(MoveTarget target) {
        return ReservationPatch.builder()
                .resourceId(target.resourceId())
                .startDateTime(target.startDateTime())
                .endDateTime(target.endDateTime())
                .build();
    }

    /**
     * 이전 스냅샷의 모든 값을 되돌리는 변경 (되돌리기용)
     */
    public static ReservationPatch restoring(Reservation previous) {
        return new ReservationPatch(
                previous.resourceId(),
                previous.customerName(),
                previous.customerEmail(),
                previous.startDateTime(),
                previous.endDateTime(),
                previous.status(),
                previous.type(),
                previous.notes(),
                previous.depositPaid(),
                previous.finalPaymentPaid());
    }
}
