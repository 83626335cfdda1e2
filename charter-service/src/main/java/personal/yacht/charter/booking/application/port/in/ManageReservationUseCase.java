package personal.yacht.charter.booking.application.port.in;

import personal.yacht.charter.booking.domain.event.ReservationStateListener;
import personal.yacht.charter.booking.domain.model.BatchOperation;
import personal.yacht.charter.booking.domain.model.BatchResult;
import personal.yacht.charter.booking.domain.model.MoveTarget;
import personal.yacht.charter.booking.domain.model.MutationOptions;
import personal.yacht.charter.booking.domain.model.Reservation;
import personal.yacht.charter.booking.domain.model.ReservationDraft;
import personal.yacht.charter.booking.domain.model.ReservationPatch;
import personal.yacht.common.event.Subscription;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Manage Reservation Use Case
 * 예약 상태 변경 (낙관적 적용 후 백엔드 확정)
 *
 * <p>존재하지 않는 예약, 검증 오류, 충돌은 낙관적 적용 전에 동기적으로 던진다.
 * 백엔드 실패는 롤백 후 반환된 future의 예외로 전달된다.
 */
public interface ManageReservationUseCase {

    void setAll(Collection<Reservation> reservations);

    CompletableFuture<Reservation> create(ReservationDraft draft);

    CompletableFuture<Reservation> create(ReservationDraft draft, MutationOptions options);

    CompletableFuture<Reservation> update(String reservationId, ReservationPatch patch);

    CompletableFuture<Reservation> update(String reservationId, ReservationPatch patch, MutationOptions options);

    CompletableFuture<Boolean> delete(String reservationId);

    CompletableFuture<Boolean> delete(String reservationId, MutationOptions options);

    CompletableFuture<Reservation> move(String reservationId, MoveTarget target);

    /**
     * 순차 실행, 부분 실패 허용 (원자적이지 않음)
     */
    CompletableFuture<List<BatchResult>> batchUpdate(List<BatchOperation> operations);

    /**
     * @return 되돌린 작업이 있으면 true, 이력이 비어 있으면 false
     */
    CompletableFuture<Boolean> undoLastOperation();

    void clear();

    Subscription subscribe(ReservationStateListener listener);
}
