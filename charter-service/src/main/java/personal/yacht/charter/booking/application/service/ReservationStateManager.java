package personal.yacht.charter.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.yacht.charter.booking.application.config.ReservationStateProperties;
import personal.yacht.charter.booking.application.port.in.ManageReservationUseCase;
import personal.yacht.charter.booking.application.port.in.QueryReservationUseCase;
import personal.yacht.charter.booking.application.port.out.ReservationMutationPort;
import personal.yacht.charter.booking.application.port.out.ResourceRegistry;
import personal.yacht.charter.booking.domain.event.ReservationStateEvent;
import personal.yacht.charter.booking.domain.event.ReservationStateListener;
import personal.yacht.charter.booking.domain.exception.BookingConflictException;
import personal.yacht.charter.booking.domain.exception.DuplicateReservationException;
import personal.yacht.charter.booking.domain.exception.MutationFailedException;
import personal.yacht.charter.booking.domain.exception.ReservationNotFoundException;
import personal.yacht.charter.booking.domain.exception.ReservationValidationException;
import personal.yacht.charter.booking.domain.model.AvailabilityResult;
import personal.yacht.charter.booking.domain.model.BatchOperation;
import personal.yacht.charter.booking.domain.model.BatchResult;
import personal.yacht.charter.booking.domain.model.ConflictCheckOptions;
import personal.yacht.charter.booking.domain.model.ConflictCheckResult;
import personal.yacht.charter.booking.domain.model.MoveTarget;
import personal.yacht.charter.booking.domain.model.MutationOptions;
import personal.yacht.charter.booking.domain.model.MutationType;
import personal.yacht.charter.booking.domain.model.OperationRecord;
import personal.yacht.charter.booking.domain.model.OptimisticUpdate;
import personal.yacht.charter.booking.domain.model.Reservation;
import personal.yacht.charter.booking.domain.model.ReservationDraft;
import personal.yacht.charter.booking.domain.model.ReservationPatch;
import personal.yacht.charter.booking.domain.model.ResourceSpec;
import personal.yacht.charter.booking.domain.model.StateStats;
import personal.yacht.charter.booking.domain.service.BookingConflictEngine;
import personal.yacht.charter.booking.domain.service.ReservationValidator;
import personal.yacht.charter.offline.application.port.in.OfflineQueueUseCase;
import personal.yacht.charter.offline.domain.model.QueueOperation;
import personal.yacht.common.event.Subscription;
import personal.yacht.common.exception.BusinessException;
import personal.yacht.common.exception.ErrorCode;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Reservation State Manager
 * 메모리 예약 상태의 단일 소유자 (낙관적 변경 + 롤백)
 *
 * <p>변경 흐름:
 * 1. 결과 스냅샷 생성, 검증 및 충돌 검사
 * 2. 메모리에 즉시 반영 후 OptimisticApply 이벤트 (operationId 부여)
 * 3. 백엔드 비동기 호출
 * 4a. 성공 시 백엔드가 돌려준 스냅샷으로 확정, 이력 기록, 확정 이벤트
 * 4b. 실패 시 적용 시점의 이전 스냅샷을 복원, OptimisticRollback 이벤트 후 예외 전파
 *     같은 예약에 더 나중의 낙관적 변경이 올라가 있으면 복원 대신 그 변경의 이전 스냅샷을 바꿔 끼운다.
 *
 * <p>적용/확정/롤백과 이벤트 발행은 하나의 락 안에서 수행되므로 서로 끼어들지 않는다.
 * 백엔드 호출만 락 밖에서 일어나며, 완료 순서는 보장하지 않는다 (마지막 적용 우선).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationStateManager implements ManageReservationUseCase, QueryReservationUseCase {

    private final ReservationMutationPort mutationPort;
    private final BookingConflictEngine conflictEngine;
    private final ReservationValidator validator;
    private final ResourceRegistry resourceRegistry;
    private final OfflineQueueUseCase offlineQueue;
    private final ReservationStateProperties properties;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, Reservation> reservations = new HashMap<>();
    private final Map<String, OptimisticUpdate> optimisticUpdates = new LinkedHashMap<>();
    private final Deque<OperationRecord> operationHistory = new ArrayDeque<>();
    private final List<ReservationStateListener> listeners = new CopyOnWriteArrayList<>();

    // ========== Bulk ==========

    @Override
    public void setAll(Collection<Reservation> newReservations) {
        synchronized (lock) {
            reservations.clear();
            optimisticUpdates.clear();
            newReservations.forEach(reservation -> reservations.put(reservation.id(), reservation));
            log.info("Reservation state replaced: count={}", reservations.size());
            publish(new ReservationStateEvent.BulkUpdate(new ArrayList<>(reservations.values())));
        }
    }

    @Override
    public void clear() {
        synchronized (lock) {
            reservations.clear();
            optimisticUpdates.clear();
            operationHistory.clear();
            log.info("Reservation state cleared");
            publish(new ReservationStateEvent.Cleared());
        }
    }

    // ========== Mutations ==========

    @Override
    public CompletableFuture<Reservation> create(ReservationDraft draft) {
        return create(draft, MutationOptions.DEFAULT);
    }

    @Override
    public CompletableFuture<Reservation> create(ReservationDraft draft, MutationOptions options) {
        String operationId = newOperationId();
        ReservationDraft request;

        synchronized (lock) {
            String reservationId = draft.id() != null ? draft.id() : UUID.randomUUID().toString();
            if (reservations.containsKey(reservationId)) {
                throw new DuplicateReservationException(reservationId);
            }
            Reservation candidate = Reservation.fromDraft(reservationId, draft, clock.instant());
            ensureValid(candidate);
            if (options.validateConflicts()) {
                ensureNoConflicts(candidate);
            }
            if (options.optimistic()) {
                applyOptimistic(new OptimisticUpdate(operationId, MutationType.CREATE, reservationId, candidate, null));
            }
            request = draft.toBuilder().id(reservationId).build();
        }

        log.debug("Creating reservation: reservationId={}, operationId={}", request.id(), operationId);
        return call(() -> mutationPort.create(request)).handle((saved, error) -> {
            synchronized (lock) {
                if (error != null) {
                    return fail(operationId, options, () -> QueueOperation.create(request), error);
                }
                commit(operationId, saved.id(), saved);
                if (options.recordHistory()) {
                    record(new OperationRecord(operationId, MutationType.CREATE, null, saved, clock.instant()));
                }
                log.info("Reservation created: reservationId={}, operationId={}", saved.id(), operationId);
                publish(new ReservationStateEvent.Created(operationId, saved));
                return saved;
            }
        });
    }

    @Override
    public CompletableFuture<Reservation> update(String reservationId, ReservationPatch patch) {
        return update(reservationId, patch, MutationOptions.DEFAULT);
    }

    @Override
    public CompletableFuture<Reservation> update(String reservationId, ReservationPatch patch,
                                                 MutationOptions options) {
        return modify(reservationId, patch, MutationType.UPDATE, options);
    }

    @Override
    public CompletableFuture<Reservation> move(String reservationId, MoveTarget target) {
        return modify(reservationId, ReservationPatch.moveTo(target), MutationType.MOVE, MutationOptions.DEFAULT);
    }

    @Override
    public CompletableFuture<Boolean> delete(String reservationId) {
        return delete(reservationId, MutationOptions.DEFAULT);
    }

    @Override
    public CompletableFuture<Boolean> delete(String reservationId, MutationOptions options) {
        String operationId = newOperationId();
        Reservation previous;

        synchronized (lock) {
            previous = require(reservationId);
            if (options.optimistic()) {
                applyOptimistic(new OptimisticUpdate(operationId, MutationType.DELETE, reservationId, null, previous));
            }
        }

        log.debug("Deleting reservation: reservationId={}, operationId={}", reservationId, operationId);
        return call(() -> mutationPort.delete(reservationId)).handle((deleted, error) -> {
            synchronized (lock) {
                Throwable failure = error != null || Boolean.TRUE.equals(deleted)
                        ? error
                        : MutationFailedException.of(ErrorCode.MUTATION_REJECTED,
                        "Backend did not delete reservation: reservationId=" + reservationId);
                if (failure != null) {
                    return fail(operationId, options, () -> QueueOperation.delete(reservationId), failure);
                }
                commit(operationId, reservationId, null);
                if (options.recordHistory()) {
                    record(new OperationRecord(operationId, MutationType.DELETE, previous, null, clock.instant()));
                }
                log.info("Reservation deleted: reservationId={}, operationId={}", reservationId, operationId);
                publish(new ReservationStateEvent.Deleted(operationId, reservationId, previous));
                return true;
            }
        });
    }

    // ========== Batch & Undo ==========

    /**
     * 일괄 처리
     * 작업을 하나씩 순서대로 실행하며, 한 작업의 실패가 다른 작업을 중단하거나 되돌리지 않는다.
     */
    @Override
    public CompletableFuture<List<BatchResult>> batchUpdate(List<BatchOperation> operations) {
        List<BatchResult> results = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);

        for (BatchOperation operation : operations) {
            chain = chain.thenCompose(ignored -> execute(operation).handle((reservation, error) -> {
                results.add(error == null
                        ? BatchResult.success(operation, reservation)
                        : BatchResult.failure(operation, unwrap(error)));
                return null;
            }));
        }

        return chain.thenApply(ignored -> {
            List<BatchResult> snapshot = List.copyOf(results);
            long failed = snapshot.stream().filter(result -> !result.success()).count();
            log.info("Batch update completed: total={}, failed={}", snapshot.size(), failed);
            synchronized (lock) {
                publish(new ReservationStateEvent.BatchComplete(snapshot));
            }
            return snapshot;
        });
    }

    /**
     * 마지막 작업 되돌리기
     * 생성은 삭제로, 수정/이동은 이전 값 복원으로, 삭제는 같은 ID로 재생성한다.
     * 되돌리기가 실패하면 이력 항목을 다시 넣는다.
     */
    @Override
    public CompletableFuture<Boolean> undoLastOperation() {
        OperationRecord last;
        synchronized (lock) {
            last = operationHistory.pollLast();
        }
        if (last == null) {
            log.debug("Nothing to undo");
            return CompletableFuture.completedFuture(false);
        }

        log.info("Undoing operation: type={}, reservationId={}, operationId={}",
                last.type(), last.reservationId(), last.operationId());
        CompletableFuture<?> inverse = switch (last.type()) {
            case CREATE -> call(() -> delete(last.after().id(), MutationOptions.UNDO));
            case UPDATE, MOVE -> call(() -> update(last.before().id(),
                    ReservationPatch.restoring(last.before()), MutationOptions.UNDO));
            case DELETE -> call(() -> create(ReservationDraft.recreate(last.before()), MutationOptions.UNDO));
        };

        return inverse.handle((ignored, error) -> {
            synchronized (lock) {
                if (error != null) {
                    operationHistory.addLast(last);
                    log.warn("Undo failed, history entry restored: operationId={}, error={}",
                            last.operationId(), unwrap(error).getMessage());
                    throw new CompletionException(unwrap(error));
                }
                publish(new ReservationStateEvent.OperationUndone(last));
                return true;
            }
        });
    }

    // ========== Queries ==========

    @Override
    public List<Reservation> getAll() {
        synchronized (lock) {
            return List.copyOf(reservations.values());
        }
    }

    @Override
    public Optional<Reservation> getById(String reservationId) {
        synchronized (lock) {
            return Optional.ofNullable(reservations.get(reservationId));
        }
    }

    @Override
    public List<Reservation> getForResource(String resourceId) {
        return getAll().stream()
                .filter(reservation -> reservation.isOn(resourceId))
                .toList();
    }

    @Override
    public List<Reservation> getInRange(LocalDate start, LocalDate end) {
        return getAll().stream()
                .filter(reservation -> conflictEngine.overlaps(
                        reservation.startDate(), reservation.endDate(), start, end))
                .toList();
    }

    @Override
    public List<Reservation> getInRange(LocalDate start, LocalDate end, String resourceId) {
        return getInRange(start, end).stream()
                .filter(reservation -> reservation.isOn(resourceId))
                .toList();
    }

    /**
     * 현재 메모리 상태와 요트 정비 기간을 함께 고려한 일자 가용성
     */
    @Override
    public AvailabilityResult getDateAvailability(LocalDate date, String resourceId) {
        return conflictEngine.dateAvailability(date, resourceId, withMaintenanceBlocks(resourceId, getAll()));
    }

    @Override
    public List<OperationRecord> getOperationHistory() {
        synchronized (lock) {
            return List.copyOf(operationHistory);
        }
    }

    @Override
    public StateStats getStats() {
        synchronized (lock) {
            return new StateStats(reservations.size(), optimisticUpdates.size(),
                    operationHistory.size(), listeners.size());
        }
    }

    // ========== Subscription ==========

    @Override
    public Subscription subscribe(ReservationStateListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // ========== Internal ==========

    private CompletableFuture<Reservation> modify(String reservationId, ReservationPatch patch,
                                                  MutationType type, MutationOptions options) {
        String operationId = newOperationId();
        Reservation previous;

        synchronized (lock) {
            previous = require(reservationId);
            Reservation candidate = previous.applyPatch(patch, clock.instant(), properties.defaultActor());
            ensureValid(candidate);
            if (options.validateConflicts()) {
                ensureNoConflicts(candidate);
            }
            if (options.optimistic()) {
                applyOptimistic(new OptimisticUpdate(operationId, type, reservationId, candidate, previous));
            }
        }

        log.debug("Updating reservation: type={}, reservationId={}, operationId={}", type, reservationId, operationId);
        return call(() -> mutationPort.update(reservationId, patch)).handle((saved, error) -> {
            synchronized (lock) {
                if (error != null) {
                    return fail(operationId, options, () -> QueueOperation.update(reservationId, patch), error);
                }
                commit(operationId, saved.id(), saved);
                if (options.recordHistory()) {
                    record(new OperationRecord(operationId, type, previous, saved, clock.instant()));
                }
                log.info("Reservation updated: type={}, reservationId={}, operationId={}",
                        type, reservationId, operationId);
                publish(new ReservationStateEvent.Updated(operationId, type, saved, previous));
                return saved;
            }
        });
    }

    private CompletableFuture<Reservation> execute(BatchOperation operation) {
        return switch (operation.type()) {
            case CREATE -> call(() -> create(operation.draft()));
            case UPDATE -> call(() -> update(operation.reservationId(), operation.patch()));
            case MOVE -> call(() -> move(operation.reservationId(), operation.target()));
            case DELETE -> call(() -> delete(operation.reservationId())).thenApply(deleted -> (Reservation) null);
        };
    }

    private void applyOptimistic(OptimisticUpdate update) {
        optimisticUpdates.put(update.operationId(), update);
        if (update.applied() == null) {
            reservations.remove(update.reservationId());
        } else {
            reservations.put(update.reservationId(), update.applied());
        }
        publish(new ReservationStateEvent.OptimisticApply(
                update.operationId(), update.type(), update.reservationId(), update.applied()));
    }

    /**
     * 백엔드가 확정한 스냅샷 반영 (락 안에서 호출, 삭제면 confirmed == null)
     * 그 위에 다른 낙관적 변경이 올라가 있으면 메모리는 그대로 두고 그 변경의 복원 대상만 바꾼다.
     */
    private void commit(String operationId, String reservationId, Reservation confirmed) {
        OptimisticUpdate update = optimisticUpdates.remove(operationId);
        if (update != null && reservations.get(reservationId) != update.applied()) {
            rebaseStackedUpdates(update, confirmed);
            return;
        }
        if (confirmed == null) {
            reservations.remove(reservationId);
        } else {
            reservations.put(reservationId, confirmed);
        }
    }

    /**
     * 롤백 후 실패를 다시 던진다 (락 안에서 호출).
     * 네트워크 실패이고 설정이 켜져 있으면 오프라인 대기열로 넘긴다.
     */
    private <T> T fail(String operationId, MutationOptions options, Supplier<QueueOperation> handoff,
                       Throwable error) {
        Throwable cause = unwrap(error);
        rollback(operationId, cause);

        if (options.queueOnFailure() && properties.queueOnNetworkFailure()
                && cause instanceof MutationFailedException failure && failure.isRetryable()) {
            try {
                String itemId = offlineQueue.enqueue(handoff.get());
                log.info("Failed mutation handed to offline queue: operationId={}, queueItemId={}",
                        operationId, itemId);
            } catch (BusinessException e) {
                log.error("Failed to hand mutation to offline queue: operationId={}, errorCode={}",
                        operationId, e.getErrorCode(), e);
            }
        }
        throw new CompletionException(cause);
    }

    /**
     * 낙관적 변경 취소 (락 안에서 호출)
     * 메모리에 아직 이 작업의 스냅샷이 남아 있을 때만 이전 스냅샷을 복원한다.
     * 그 위에 다른 낙관적 변경이 올라가 있으면 그 변경의 복원 대상을 이 작업의 이전 스냅샷으로 바꾼다.
     */
    private void rollback(String operationId, Throwable cause) {
        OptimisticUpdate update = optimisticUpdates.remove(operationId);
        if (update == null) {
            return;
        }

        String reservationId = update.reservationId();
        Reservation restored;
        if (reservations.get(reservationId) == update.applied()) {
            restored = update.previous();
            if (restored == null) {
                reservations.remove(reservationId);
            } else {
                reservations.put(reservationId, restored);
            }
        } else {
            rebaseStackedUpdates(update, update.previous());
            restored = reservations.get(reservationId);
        }

        log.warn("Optimistic update rolled back: type={}, reservationId={}, operationId={}, cause={}",
                update.type(), reservationId, operationId, cause.getMessage());
        publish(new ReservationStateEvent.OptimisticRollback(
                operationId, update.type(), reservationId, restored, cause));
    }

    private void rebaseStackedUpdates(OptimisticUpdate settled, Reservation base) {
        optimisticUpdates.replaceAll((id, pending) ->
                pending.reservationId().equals(settled.reservationId()) && pending.previous() == settled.applied()
                        ? pending.withPrevious(base)
                        : pending);
    }

    private void record(OperationRecord operation) {
        operationHistory.addLast(operation);
        while (operationHistory.size() > properties.historySize()) {
            operationHistory.removeFirst();
        }
    }

    private void publish(ReservationStateEvent event) {
        for (ReservationStateListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Subscriber callback failed: event={}", event.getClass().getSimpleName(), e);
            }
        }
    }

    private Reservation require(String reservationId) {
        Reservation reservation = reservations.get(reservationId);
        if (reservation == null) {
            throw new ReservationNotFoundException(reservationId);
        }
        return reservation;
    }

    private void ensureValid(Reservation candidate) {
        Map<String, String> errors = validator.validate(candidate);
        if (!errors.isEmpty()) {
            throw new ReservationValidationException(errors);
        }
    }

    private void ensureNoConflicts(Reservation candidate) {
        List<Reservation> pool = withMaintenanceBlocks(candidate.resourceId(), reservations.values());
        ConflictCheckResult result = conflictEngine.checkConflicts(candidate, pool, ConflictCheckOptions.defaults());
        if (result.hasConflicts()) {
            log.warn("Booking conflict detected: reservationId={}, resourceId={}, conflicts={}",
                    candidate.id(), candidate.resourceId(), result.conflicts().size());
            throw new BookingConflictException(candidate.resourceId(), result);
        }
    }

    private List<Reservation> withMaintenanceBlocks(String resourceId, Collection<Reservation> base) {
        List<Reservation> pool = new ArrayList<>(base);
        resourceRegistry.findById(resourceId)
                .map(ResourceSpec::maintenanceBlocks)
                .ifPresent(pool::addAll);
        return pool;
    }

    private static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> invocation) {
        try {
            return invocation.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static String newOperationId() {
        return UUID.randomUUID().toString();
    }
}
