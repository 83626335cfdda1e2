package personal.yacht.charter.booking.domain.exception;

import personal.yacht.common.exception.BusinessException;
import personal.yacht.common.exception.ErrorCode;

import java.util.Map;

/**
 * Reservation Validation Exception
 * 필드별 오류 맵을 담아 낙관적 적용 전에 발생
 */
public class ReservationValidationException extends BusinessException {

    private final Map<String, String> fieldErrors;

    public ReservationValidationException(Map<String, String> fieldErrors) {
        super(ErrorCode.RESERVATION_VALIDATION_FAILED,
                String.format("Reservation validation failed: fields=%s", fieldErrors.keySet()));
        this.fieldErrors = Map.copyOf(fieldErrors);
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
