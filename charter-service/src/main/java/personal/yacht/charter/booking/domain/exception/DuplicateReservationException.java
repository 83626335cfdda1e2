package personal.yacht.charter.booking.domain.exception;

import personal.yacht.common.exception.BusinessException;
import personal.yacht.common.exception.ErrorCode;

/**
 * Duplicate Reservation Exception
 * 메모리 상태에 이미 있는 ID로 예약을 생성하려 할 때 발생
 */
public class DuplicateReservationException extends BusinessException {
    public DuplicateReservationException(String reservationId) {
        super(ErrorCode.DUPLICATE_RESERVATION,
                String.format("Reservation already exists: reservationId=%s", reservationId));
    }
}
