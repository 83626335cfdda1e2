package personal.yacht.charter.booking.domain.event;

import personal.yacht.charter.booking.domain.model.BatchResult;
import personal.yacht.charter.booking.domain.model.MutationType;
import personal.yacht.charter.booking.domain.model.OperationRecord;
import personal.yacht.charter.booking.domain.model.Reservation;

import java.util.List;

/**
 * 예약 상태 이벤트
 * 구독자에게 적용/확정/롤백 순서대로 동기 전달된다.
 */
public sealed interface ReservationStateEvent {

    /** 전체 교체 */
    record BulkUpdate(List<Reservation> reservations) implements ReservationStateEvent {
        public BulkUpdate {
            reservations = List.copyOf(reservations);
        }
    }

    /** 낙관적 적용 (삭제면 applied == null) */
    record OptimisticApply(String operationId, MutationType mutationType, String reservationId,
                           Reservation applied) implements ReservationStateEvent {
    }

    /** 낙관적 적용 취소 (restored는 롤백 후 메모리 상태, 없으면 null) */
    record OptimisticRollback(String operationId, MutationType mutationType, String reservationId,
                              Reservation restored, Throwable cause) implements ReservationStateEvent {
    }

    record Created(String operationId, Reservation reservation) implements ReservationStateEvent {
    }

    /** 수정 또는 이동 확정 */
    record Updated(String operationId, MutationType mutationType, Reservation reservation,
                   Reservation previous) implements ReservationStateEvent {
    }

    record Deleted(String operationId, String reservationId, Reservation previous)
            implements ReservationStateEvent {
    }

    record BatchComplete(List<BatchResult> results) implements ReservationStateEvent {
        public BatchComplete {
            results = List.copyOf(results);
        }
    }

    record OperationUndone(OperationRecord operation) implements ReservationStateEvent {
    }

    record Cleared() implements ReservationStateEvent {
    }
}
