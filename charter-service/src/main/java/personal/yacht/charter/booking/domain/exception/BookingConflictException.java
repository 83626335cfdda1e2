package personal.yacht.charter.booking.domain.exception;

import personal.yacht.charter.booking.domain.model.ConflictCheckResult;
import personal.yacht.common.exception.BusinessException;
import personal.yacht.common.exception.ErrorCode;

/**
 * Booking Conflict Exception
 * 전체 충돌 목록을 담아 호출자가 대안을 제시할 수 있게 한다.
 * HTTP 409 Conflict 대응
 */
public class BookingConflictException extends BusinessException {

    private final ConflictCheckResult result;

    public BookingConflictException(String resourceId, ConflictCheckResult result) {
        super(ErrorCode.BOOKING_CONFLICT,
                String.format("Booking conflicts with existing reservations: resourceId=%s, conflicts=%d",
                        resourceId, result.conflicts().size()));
        this.result = result;
    }

    public ConflictCheckResult getResult() {
        return result;
    }
}
