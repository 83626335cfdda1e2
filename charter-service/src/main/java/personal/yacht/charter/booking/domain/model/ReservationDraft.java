package personal.yacht.charter.booking.domain.model;

import lombok.Builder;

import java.time.LocalDateTime;

/**
 * 예약 생성 요청
 * id가 비어 있으면 상태 관리자가 발급한다.
 */
@Builder(toBuilder = true)
public record ReservationDraft(
        String id,
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

    /**
     * 삭제된 예약을 같은 ID로 다시 만들기 위한 요청 (되돌리기용)
     */
    public static ReservationDraft recreate(Reservation reservation) {
        return new ReservationDraft(
                reservation.id(),
                reservation.resourceId(),
                reservation.customerName(),
                reservation.customerEmail(),
                reservation.startDateTime(),
                reservation.endDateTime(),
                reservation.status(),
                reservation.type(),
                reservation.notes(),
                reservation.depositPaid(),
                reservation.finalPaymentPaid());
    }
}
