package personal.yacht.charter.booking.domain.exception;

import personal.yacht.common.exception.BusinessException;
import personal.yacht.common.exception.ErrorCode;

/**
 * Reservation Not Found Exception
 * 메모리 상태에 없는 예약을 변경하려 할 때 발생
 */
public class ReservationNotFoundException extends BusinessException {
    public ReservationNotFoundException(String reservationId) {
        super(ErrorCode.RESERVATION_NOT_FOUND,
                String.format("Reservation not found: reservationId=%s", reservationId));
    }
}
