package personal.yacht.charter.booking.application.port.in;

import personal.yacht.charter.booking.domain.model.AvailabilityResult;
import personal.yacht.charter.booking.domain.model.OperationRecord;
import personal.yacht.charter.booking.domain.model.Reservation;
import personal.yacht.charter.booking.domain.model.StateStats;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Query Reservation Use Case
 * 현재 메모리 상태에 대한 부수 효과 없는 조회
 */
public interface QueryReservationUseCase {

    List<Reservation> getAll();

    Optional<Reservation> getById(String reservationId);

    List<Reservation> getForResource(String resourceId);

    List<Reservation> getInRange(LocalDate start, LocalDate end);

    List<Reservation> getInRange(LocalDate start, LocalDate end, String resourceId);

    AvailabilityResult getDateAvailability(LocalDate date, String resourceId);

    List<OperationRecord> getOperationHistory();

    StateStats getStats();
}
