package personal.yacht.charter.booking.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * 정비 기간 (시작일, 종료일 포함)
 */
public record MaintenanceWindow(
        LocalDate startDate,
        LocalDate endDate,
        String reason) {

    Reservation toReservation(String resourceId) {
        return new Reservation(
                "maintenance:" + resourceId + ":" + startDate,
                resourceId,
                null,
                null,
                startDate.atStartOfDay(),
                endDate.atTime(LocalTime.MAX),
                ReservationStatus.CONFIRMED,
                ReservationType.MAINTENANCE,
                reason,
                false,
                false,
                List.of(),
                null,
                null);
    }
}
