package personal.yacht.charter.acceptance.support;

import personal.yacht.charter.booking.application.port.out.ReservationMutationPort;
import personal.yacht.charter.booking.domain.exception.MutationFailedException;
import personal.yacht.charter.booking.domain.model.Reservation;
import personal.yacht.charter.booking.domain.model.ReservationDraft;
import personal.yacht.charter.booking.domain.model.ReservationPatch;
import personal.yacht.common.exception.ErrorCode;

import java.net.ConnectException;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 메모리 예약 백엔드
 * 연결 불가 상태를 켜면 모든 호출이 NETWORK 실패로 끝난다.
 */
public class InMemoryReservationBackend implements ReservationMutationPort {

    private static final String ACTOR = "backend";

    private final Map<String, Reservation> reservations = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private volatile boolean unreachable;

    @Override
    public CompletableFuture<Reservation> create(ReservationDraft draft) {
        count("create");
        if (unreachable) {
            return unreachable();
        }
        Reservation saved = Reservation.fromDraft(draft.id(), draft, Instant.now());
        reservations.put(saved.id(), saved);
        return CompletableFuture.completedFuture(saved);
    }

    @Override
    public CompletableFuture<Reservation> update(String reservationId, ReservationPatch patch) {
        count("update");
        if (unreachable) {
            return unreachable();
        }
        Reservation current = reservations.get(reservationId);
        if (current == null) {
            return notFound(reservationId);
        }
        Reservation saved = current.applyPatch(patch, Instant.now(), ACTOR);
        reservations.put(reservationId, saved);
        return CompletableFuture.completedFuture(saved);
    }

    @Override
    public CompletableFuture<Boolean> delete(String reservationId) {
        count("delete");
        if (unreachable) {
            return unreachable();
        }
        return CompletableFuture.completedFuture(reservations.remove(reservationId) != null);
    }

    @Override
    public CompletableFuture<Reservation> toggleField(String reservationId, String field) {
        count("toggle");
        if (unreachable) {
            return unreachable();
        }
        Reservation current = reservations.get(reservationId);
        if (current == null) {
            return notFound(reservationId);
        }
        ReservationPatch patch = switch (field) {
            case "depositPaid" -> ReservationPatch.builder().depositPaid(!current.depositPaid()).build();
            case "finalPaymentPaid" -> ReservationPatch.builder().finalPaymentPaid(!current.finalPaymentPaid()).build();
            default -> null;
        };
        if (patch == null) {
            return CompletableFuture.failedFuture(
                    MutationFailedException.of(ErrorCode.MUTATION_REJECTED, "Unknown toggle field: " + field));
        }
        Reservation saved = current.applyPatch(patch, Instant.now(), ACTOR);
        reservations.put(reservationId, saved);
        return CompletableFuture.completedFuture(saved);
    }

    public void seed(Reservation reservation) {
        reservations.put(reservation.id(), reservation);
    }

    public Optional<Reservation> find(String reservationId) {
        return Optional.ofNullable(reservations.get(reservationId));
    }

    public int callCount(String action) {
        AtomicInteger counter = calls.get(action);
        return counter == null ? 0 : counter.get();
    }

    public void setUnreachable(boolean unreachable) {
        this.unreachable = unreachable;
    }

    public void reset() {
        reservations.clear();
        calls.clear();
        unreachable = false;
    }

    private void count(String action) {
        calls.computeIfAbsent(action, key -> new AtomicInteger()).incrementAndGet();
    }

    private static <T> CompletableFuture<T> unreachable() {
        return CompletableFuture.failedFuture(MutationFailedException.network("Reservation backend unreachable",
                new ConnectException("Connection refused")));
    }

    private static <T> CompletableFuture<T> notFound(String reservationId) {
        return CompletableFuture.failedFuture(MutationFailedException.of(ErrorCode.MUTATION_REJECTED,
                "Reservation not found on backend: reservationId=" + reservationId));
    }
}
