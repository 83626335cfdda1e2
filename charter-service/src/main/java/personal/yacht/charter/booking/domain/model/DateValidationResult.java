package personal.yacht.charter.booking.domain.model;

import java.util.List;

/**
 * 기간 검증 결과
 * 경고는 예약을 막지 않는다.
 */
public record DateValidationResult(
        List<String> errors,
        List<String> warnings,
        long bookingDays,
        long daysInAdvance) {

    public DateValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
