package personal.yacht.charter.booking.application.port.out;

import personal.yacht.charter.booking.domain.model.Reservation;
import personal.yacht.charter.booking.domain.model.ReservationDraft;
import personal.yacht.charter.booking.domain.model.ReservationPatch;

import java.util.concurrent.CompletableFuture;

/**
 * Reservation Mutation Port (Output Port)
 * 원격 예약 백엔드의 비동기 변경 API
 *
 * <p>실패는 {@link personal.yacht.charter.booking.domain.exception.MutationFailedException}을
 * 원인으로 하는 예외적 완료로 전달된다 (검증, 충돌, 네트워크, 권한).
 */
public interface ReservationMutationPort {

    CompletableFuture<Reservation> create(ReservationDraft draft);

    CompletableFuture<Reservation> update(String reservationId, ReservationPatch patch);

    CompletableFuture<Boolean> delete(String reservationId);

    /**
     * 예약의 불리언 필드 반전 (depositPaid, finalPaymentPaid)
     */
    CompletableFuture<Reservation> toggleField(String reservationId, String field);
}
