package personal.yacht.charter.booking.domain.model;

import java.time.LocalDateTime;

/**
 * 예약 이동 대상 (요트, 기간)
 */
public record MoveTarget(
        String resourceId,
        LocalDateTime startDateTime,
        LocalDateTime endDateTime) {
}
