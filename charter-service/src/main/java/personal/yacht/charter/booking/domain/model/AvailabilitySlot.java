package personal.yacht.charter.booking.domain.model;

import java.time.LocalDate;

/**
 * 연속된 가용 일자 구간 (시작일, 종료일 포함)
 */
public record AvailabilitySlot(
        String resourceId,
        LocalDate startDate,
        LocalDate endDate,
        int days,
        boolean includesWeekend) {
}
