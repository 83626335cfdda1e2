package personal.yacht.charter.booking.domain.model;

import java.time.LocalDate;
import java.util.Optional;

/**
 * 한 자원의 특정 일자 가용성
 *
 * @param transitionDay 점유 예약의 시작일 또는 종료일과 정확히 일치하는 날
 * @param reservation   점유 예약 (없으면 null)
 */
public record AvailabilityResult(
        LocalDate date,
        String resourceId,
        AvailabilityStatus status,
        boolean transitionDay,
        Reservation reservation) {

    public static AvailabilityResult available(LocalDate date, String resourceId) {
        return new AvailabilityResult(date, resourceId, AvailabilityStatus.AVAILABLE, false, null);
    }

    public static AvailabilityResult occupied(LocalDate date, String resourceId, Reservation reservation) {
        return new AvailabilityResult(date, resourceId, AvailabilityStatus.of(reservation),
                reservation.isBoundary(date), reservation);
    }

    public boolean isAvailable() {
        return status == AvailabilityStatus.AVAILABLE;
    }

    public Optional<Reservation> occupyingReservation() {
        return Optional.ofNullable(reservation);
    }
}
