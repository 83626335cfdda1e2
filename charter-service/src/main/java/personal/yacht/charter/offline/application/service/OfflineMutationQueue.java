package personal.yacht.charter.offline.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.yacht.charter.booking.application.port.out.ReservationMutationPort;
import personal.yacht.charter.offline.application.config.OfflineQueueProperties;
import personal.yacht.charter.offline.application.port.in.OfflineQueueUseCase;
import personal.yacht.charter.offline.application.port.out.NetworkStatusPort;
import personal.yacht.charter.offline.application.port.out.QueueStore;
import personal.yacht.charter.offline.domain.exception.OfflineQueueFullException;
import personal.yacht.charter.offline.domain.exception.QueueStoreCapacityExceededException;
import personal.yacht.charter.offline.domain.model.QueueItem;
import personal.yacht.charter.offline.domain.model.QueueItemStatus;
import personal.yacht.charter.offline.domain.model.QueueOperation;
import personal.yacht.charter.offline.domain.model.QueueStatus;
import personal.yacht.common.event.Subscription;
import personal.yacht.common.exception.BusinessException;
import personal.yacht.common.exception.ErrorCode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Offline Mutation Queue
 * 백엔드에 닿지 못한 변경을 영속 저장하고 온라인일 때 순서대로 재전송
 *
 * <p>처리 규칙:
 * 1. 한 번에 하나의 패스만 실행 (실행 중 재호출은 무시)
 * 2. PENDING 항목을 등록 순서대로 하나씩 전송, 항목 사이에 짧은 지연
 * 3. 실패 시 재시도 횟수 증가, 백오프가 지나기 전에는 다시 전송하지 않음
 *    최대 횟수 도달 시 FAILED (상태 조회에는 남음)
 * 4. 패스 종료 후 완료 항목 정리, PENDING이 남아 있으면 다음 패스 예약 (예약은 항상 하나)
 *
 * <p>패스와 재시도 예약은 전용 단일 스레드에서 실행된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OfflineMutationQueue implements OfflineQueueUseCase {

    private static final String DISPATCH_METRIC = "offline.queue.dispatch";

    private final ReservationMutationPort mutationPort;
    private final QueueStore queueStore;
    private final NetworkStatusPort networkStatus;
    private final OfflineQueueProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Object lock = new Object();
    private final List<QueueItem> items = new ArrayList<>();
    private final AtomicBoolean processing = new AtomicBoolean(false);
    private final List<Consumer<QueueStatus>> listeners = new CopyOnWriteArrayList<>();

    private volatile boolean online;
    private ScheduledExecutorService executor;
    private ScheduledFuture<?> nextPass;
    private Subscription networkSubscription;

    // ========== Lifecycle ==========

    @PostConstruct
    public void start() {
        List<QueueItem> restored = queueStore.load();
        synchronized (lock) {
            items.clear();
            items.addAll(restored);
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "offline-queue");
            thread.setDaemon(true);
            return thread;
        });
        online = networkStatus.isOnline();
        networkSubscription = networkStatus.subscribe(this::onNetworkStatusChanged);
        Gauge.builder("offline.queue.pending", this, queue -> queue.getStatus().pendingCount())
                .description("Offline queue items waiting for dispatch")
                .register(meterRegistry);

        log.info("Offline queue started: restoredItems={}, online={}", restored.size(), online);
        if (online && hasPendingItems()) {
            schedulePass(properties.retry().initialDelayMs());
        }
    }

    @PreDestroy
    public void stop() {
        if (networkSubscription != null) {
            networkSubscription.unsubscribe();
        }
        if (executor != null) {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Offline queue worker did not terminate in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Offline queue stopped");
    }

    // ========== Enqueue ==========

    @Override
    public String enqueue(QueueOperation operation) {
        QueueItem item;
        synchronized (lock) {
            if (items.size() >= properties.maxSize()) {
                log.warn("Offline queue is full: maxSize={}, type={}", properties.maxSize(), operation.type());
                throw new OfflineQueueFullException(properties.maxSize());
            }
            item = QueueItem.pending(UUID.randomUUID().toString(), clock.instant(), operation);
            items.add(item);
            if (!persist()) {
                items.remove(item);
                throw new BusinessException(ErrorCode.QUEUE_STORE_FAILURE,
                        String.format("Could not persist queued operation: type=%s, reservationId=%s",
                                operation.type(), operation.reservationId()));
            }
        }

        log.info("Operation queued: itemId={}, type={}, reservationId={}",
                item.id(), operation.type(), operation.reservationId());
        notifyListeners();
        if (online && !processing.get()) {
            triggerProcessing();
        }
        return item.id();
    }

    @Override
    public boolean canEnqueue() {
        synchronized (lock) {
            return items.size() < properties.maxSize();
        }
    }

    // ========== Processing ==========

    @Override
    public void processQueue() {
        if (!online) {
            log.debug("Offline, queue processing skipped");
            return;
        }
        if (!processing.compareAndSet(false, true)) {
            log.debug("Queue pass already running");
            return;
        }

        int completed = 0;
        int failed = 0;
        try {
            notifyListeners();
            List<String> dueIds = dueItemIds();
            log.info("Processing offline queue: due={}", dueIds.size());

            for (String itemId : dueIds) {
                if (!online) {
                    log.info("Connection lost during queue pass, stopping");
                    break;
                }
                Optional<QueueItem> current = getQueueItem(itemId);
                if (current.isEmpty() || !current.get().dueAt(clock.instant())) {
                    continue;
                }
                if (dispatch(current.get())) {
                    completed++;
                } else {
                    failed++;
                }
                if (!pauseBetweenItems()) {
                    break;
                }
            }

            synchronized (lock) {
                if (items.removeIf(item -> item.status() == QueueItemStatus.COMPLETED)) {
                    persist();
                }
            }
        } finally {
            processing.set(false);
        }

        log.info("Offline queue pass finished: completed={}, failed={}", completed, failed);
        notifyListeners();
        if (online && hasPendingItems()) {
            scheduleRetry();
        }
    }

    @Override
    public int retryFailedItems() {
        int reset = 0;
        synchronized (lock) {
            for (int i = 0; i < items.size(); i++) {
                QueueItem item = items.get(i);
                if (item.retries() > 0 && item.status() != QueueItemStatus.COMPLETED) {
                    items.set(i, item.resetForRetry());
                    reset++;
                }
            }
            if (reset > 0) {
                persist();
            }
        }

        if (reset > 0) {
            log.info("Failed queue items reset for retry: count={}", reset);
            notifyListeners();
            triggerProcessing();
        }
        return reset;
    }

    // ========== Maintenance & Queries ==========

    @Override
    public int clearQueue(boolean completedOnly) {
        int removed;
        synchronized (lock) {
            int before = items.size();
            if (completedOnly) {
                items.removeIf(item -> item.status() == QueueItemStatus.COMPLETED);
            } else {
                items.clear();
            }
            removed = before - items.size();
            persist();
        }
        log.info("Offline queue cleared: completedOnly={}, removed={}", completedOnly, removed);
        notifyListeners();
        return removed;
    }

    @Override
    public boolean removeFromQueue(String itemId) {
        boolean removed;
        synchronized (lock) {
            removed = items.removeIf(item -> item.id().equals(itemId));
            if (removed) {
                persist();
            }
        }
        if (removed) {
            log.info("Queue item removed: itemId={}", itemId);
            notifyListeners();
        }
        return removed;
    }

    @Override
    public Optional<QueueItem> getQueueItem(String itemId) {
        synchronized (lock) {
            return items.stream().filter(item -> item.id().equals(itemId)).findFirst();
        }
    }

    @Override
    public QueueStatus getStatus() {
        synchronized (lock) {
            return QueueStatus.of(online, processing.get(), items);
        }
    }

    @Override
    public Subscription subscribe(Consumer<QueueStatus> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // ========== Internal ==========

    void onNetworkStatusChanged(boolean nowOnline) {
        boolean wasOnline = online;
        online = nowOnline;
        if (!wasOnline && nowOnline) {
            log.info("Connection restored, processing offline queue");
            triggerProcessing();
        } else if (wasOnline && !nowOnline) {
            log.info("Connection lost, mutations will be queued");
        }
        notifyListeners();
    }

    /**
     * 항목 1건 전송
     *
     * @return 성공 여부
     */
    private boolean dispatch(QueueItem item) {
        QueueOperation operation = item.operation();
        try {
            invoke(operation).join();
            replace(item.markCompleted(clock.instant()));
            meterRegistry.counter(DISPATCH_METRIC, "result", "success").increment();
            log.info("Queued operation dispatched: itemId={}, type={}, reservationId={}",
                    item.id(), operation.type(), operation.reservationId());
            return true;
        } catch (RuntimeException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            QueueItem updated = item.recordFailure(cause.getMessage(), properties.retry().maxAttempts(),
                    clock.instant().plusMillis(properties.retry().backoffMs()));
            replace(updated);

            if (updated.status() == QueueItemStatus.FAILED) {
                meterRegistry.counter(DISPATCH_METRIC, "result", "exhausted").increment();
                log.error("Queued operation failed permanently: itemId={}, type={}, reservationId={}, retries={}",
                        item.id(), operation.type(), operation.reservationId(), updated.retries(), cause);
            } else {
                meterRegistry.counter(DISPATCH_METRIC, "result", "retry").increment();
                log.warn("Queued operation failed, will retry: itemId={}, retries={}/{}, error={}",
                        item.id(), updated.retries(), properties.retry().maxAttempts(), cause.getMessage());
            }
            return false;
        }
    }

    private CompletableFuture<?> invoke(QueueOperation operation) {
        return switch (operation.type()) {
            case CREATE -> mutationPort.create(operation.draft());
            case UPDATE -> mutationPort.update(operation.reservationId(), operation.patch());
            case DELETE -> mutationPort.delete(operation.reservationId());
            case TOGGLE_FIELD -> mutationPort.toggleField(operation.reservationId(), operation.field());
        };
    }

    private void replace(QueueItem updated) {
        synchronized (lock) {
            for (int i = 0; i < items.size(); i++) {
                if (items.get(i).id().equals(updated.id())) {
                    items.set(i, updated);
                    persist();
                    break;
                }
            }
        }
        notifyListeners();
    }

    /**
     * 저장소에 현재 목록 기록 (락 안에서 호출)
     * 용량 초과 시 완료 항목을 정리하고 한 번 더 시도한다.
     *
     * @return 최종 저장 성공 여부
     */
    private boolean persist() {
        try {
            queueStore.save(List.copyOf(items));
            return true;
        } catch (QueueStoreCapacityExceededException e) {
            log.warn("Queue store is full, pruning completed items and retrying: {}", e.getMessage());
            items.removeIf(item -> item.status() == QueueItemStatus.COMPLETED);
            try {
                queueStore.save(List.copyOf(items));
                return true;
            } catch (RuntimeException retryFailure) {
                log.error("Failed to persist offline queue after cleanup", retryFailure);
                return false;
            }
        } catch (RuntimeException e) {
            log.error("Failed to persist offline queue", e);
            return false;
        }
    }

    private List<String> dueItemIds() {
        Instant now = clock.instant();
        synchronized (lock) {
            return items.stream()
                    .filter(item -> item.dueAt(now))
                    .map(QueueItem::id)
                    .toList();
        }
    }

    private boolean hasPendingItems() {
        synchronized (lock) {
            return items.stream().anyMatch(QueueItem::awaitingDispatch);
        }
    }

    private boolean pauseBetweenItems() {
        long delay = properties.retry().itemDelayMs();
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Queue pass interrupted");
            return false;
        }
    }

    private void triggerProcessing() {
        if (executor == null || executor.isShutdown()) {
            log.debug("Queue worker not running, processing deferred");
            return;
        }
        executor.execute(this::runPass);
    }

    /**
     * 가장 이른 재시도 시각에 맞춰 다음 패스 예약
     */
    private void scheduleRetry() {
        Instant now = clock.instant();
        Instant earliest;
        synchronized (lock) {
            earliest = items.stream()
                    .filter(QueueItem::awaitingDispatch)
                    .map(item -> item.nextAttemptAt() == null ? now : item.nextAttemptAt())
                    .min(Instant::compareTo)
                    .orElse(null);
        }
        if (earliest == null) {
            return;
        }
        long delay = Math.max(0, Duration.between(now, earliest).toMillis());
        log.debug("Pending items remain, next pass in {}ms", delay);
        schedulePass(delay);
    }

    /**
     * 예약된 패스는 하나만 유지한다. 더 이른 시각이 필요할 때만 기존 예약을 바꾼다.
     */
    private void schedulePass(long delayMs) {
        synchronized (lock) {
            if (executor == null || executor.isShutdown()) {
                return;
            }
            if (nextPass != null && !nextPass.isDone()) {
                if (nextPass.getDelay(TimeUnit.MILLISECONDS) <= delayMs) {
                    return;
                }
                nextPass.cancel(false);
            }
            nextPass = executor.schedule(this::runScheduledPass, delayMs, TimeUnit.MILLISECONDS);
        }
    }

    private void runScheduledPass() {
        synchronized (lock) {
            nextPass = null;
        }
        runPass();
    }

    private void runPass() {
        try {
            processQueue();
        } catch (RuntimeException e) {
            log.error("Offline queue pass failed", e);
        }
    }

    private void notifyListeners() {
        if (listeners.isEmpty()) {
            return;
        }
        QueueStatus status = getStatus();
        for (Consumer<QueueStatus> listener : listeners) {
            try {
                listener.accept(status);
            } catch (RuntimeException e) {
                log.error("Queue status listener failed", e);
            }
        }
    }
}
