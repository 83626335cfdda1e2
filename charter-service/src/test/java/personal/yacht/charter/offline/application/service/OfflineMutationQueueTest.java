package personal.yacht.charter.offline.application.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.yacht.charter.booking.application.port.out.ReservationMutationPort;
import personal.yacht.charter.booking.domain.exception.MutationFailedException;
import personal.yacht.charter.booking.domain.model.Reservation;
import personal.yacht.charter.booking.domain.model.ReservationDraft;
import personal.yacht.charter.booking.domain.model.ReservationPatch;
import personal.yacht.charter.offline.application.config.OfflineQueueProperties;
import personal.yacht.charter.offline.domain.exception.OfflineQueueFullException;
import personal.yacht.charter.offline.domain.model.QueueItem;
import personal.yacht.charter.offline.domain.model.QueueItemStatus;
import personal.yacht.charter.offline.domain.model.QueueOperation;
import personal.yacht.charter.offline.domain.model.QueueStatus;
import personal.yacht.charter.support.InMemoryQueueStore;
import personal.yacht.charter.support.MutableClock;
import personal.yacht.charter.support.StubNetworkStatus;
import personal.yacht.common.exception.BusinessException;
import personal.yacht.common.exception.ErrorCode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static personal.yacht.charter.support.ReservationFixtures.confirmed;
import static personal.yacht.charter.support.ReservationFixtures.draft;

@ExtendWith(MockitoExtension.class)
@DisplayName("OfflineMutationQueue 단위 테스트")
class OfflineMutationQueueTest {

    private static final Instant NOW = Instant.parse("2025-05-01T00:00:00Z");
    private static final long BACKOFF_MS = 50;
    private static final ReservationDraft DRAFT = draft("r-1", "spectre",
            LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 12));
    private static final Reservation SAVED = confirmed("r-1", "spectre",
            LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 12));

    @Mock
    private ReservationMutationPort mutationPort;

    private InMemoryQueueStore queueStore;
    private StubNetworkStatus networkStatus;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private OfflineMutationQueue queue;

    @BeforeEach
    void setUp() {
        queueStore = new InMemoryQueueStore();
        networkStatus = new StubNetworkStatus(false);
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(NOW);
        queue = newQueue(100);
    }

    @AfterEach
    void tearDown() {
        queue.stop();
    }

    // ========== enqueue ==========

    @Test
    @DisplayName("등록 - 항목이 PENDING으로 저장소에 기록된다")
    void enqueue_Persists() {
        // when
        String itemId = queue.enqueueCreate(DRAFT);

        // then
        assertThat(queue.getQueueItem(itemId)).get().satisfies(item -> {
            assertThat(item.status()).isEqualTo(QueueItemStatus.PENDING);
            assertThat(item.retries()).isZero();
            assertThat(item.enqueuedAt()).isEqualTo(NOW);
            assertThat(item.operation()).isEqualTo(QueueOperation.create(DRAFT));
        });
        assertThat(queueStore.stored()).extracting(QueueItem::id).containsExactly(itemId);
        verifyNoInteractions(mutationPort);
    }

    @Test
    @DisplayName("등록 실패 - 최대 크기에 도달하면 거부한다")
    void enqueue_Full() {
        // given
        queue = newQueue(2);
        queue.enqueueDelete("r-1");
        queue.enqueueDelete("r-2");

        // when & then
        assertThat(queue.canEnqueue()).isFalse();
        assertThatThrownBy(() -> queue.enqueueDelete("r-3"))
                .isInstanceOf(OfflineQueueFullException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.QUEUE_FULL);
        assertThat(queue.getStatus().totalCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("등록 - 저장소 용량 초과 시 완료 항목을 정리하고 다시 저장한다")
    void enqueue_StoreCapacityPrunesCompleted() {
        // given
        QueueItem done = QueueItem.pending("done", NOW, QueueOperation.delete("r-0")).markCompleted(NOW);
        queueStore.preload(List.of(done));
        queue.start();
        queueStore.rejectNextSaves(1);

        // when
        String itemId = queue.enqueueDelete("r-1");

        // then
        assertThat(queueStore.stored()).extracting(QueueItem::id).containsExactly(itemId);
        assertThat(queue.getStatus().items()).extracting(QueueItem::id).containsExactly(itemId);
    }

    @Test
    @DisplayName("등록 실패 - 정리 후에도 저장할 수 없으면 항목을 남기지 않는다")
    void enqueue_StoreFailure() {
        queueStore.rejectNextSaves(2);

        assertThatThrownBy(() -> queue.enqueueDelete("r-1"))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.QUEUE_STORE_FAILURE);
        assertThat(queue.getStatus().totalCount()).isZero();
    }

    // ========== processQueue ==========

    @Test
    @DisplayName("처리 - 등록 순서대로 전송하고 완료 항목은 정리된다")
    void processQueue_DispatchesInOrder() {
        // given
        ReservationPatch patch = ReservationPatch.builder().notes("VIP").build();
        given(mutationPort.create(DRAFT)).willReturn(CompletableFuture.completedFuture(SAVED));
        given(mutationPort.update("r-2", patch)).willReturn(CompletableFuture.completedFuture(SAVED));
        given(mutationPort.delete("r-3")).willReturn(CompletableFuture.completedFuture(true));
        given(mutationPort.toggleField("r-4", "depositPaid")).willReturn(CompletableFuture.completedFuture(SAVED));
        queue.enqueueCreate(DRAFT);
        queue.enqueueUpdate("r-2", patch);
        queue.enqueueDelete("r-3");
        queue.enqueueToggleField("r-4", "depositPaid");
        queue.onNetworkStatusChanged(true);

        // when
        queue.processQueue();

        // then
        InOrder order = inOrder(mutationPort);
        order.verify(mutationPort).create(DRAFT);
        order.verify(mutationPort).update("r-2", patch);
        order.verify(mutationPort).delete("r-3");
        order.verify(mutationPort).toggleField("r-4", "depositPaid");
        assertThat(queue.getStatus().totalCount()).isZero();
        assertThat(queueStore.stored()).isEmpty();
        assertThat(meterRegistry.counter("offline.queue.dispatch", "result", "success").count()).isEqualTo(4.0);
    }

    @Test
    @DisplayName("처리 - 실패한 항목은 재시도 횟수가 늘고 다음 항목은 계속 처리된다")
    void processQueue_FailureDoesNotBlockOthers() {
        // given
        given(mutationPort.create(DRAFT)).willReturn(networkFailure());
        given(mutationPort.delete("r-2")).willReturn(CompletableFuture.completedFuture(true));
        String failingId = queue.enqueueCreate(DRAFT);
        queue.enqueueDelete("r-2");
        queue.onNetworkStatusChanged(true);

        // when
        queue.processQueue();

        // then
        QueueStatus status = queue.getStatus();
        assertThat(status.totalCount()).isEqualTo(1);
        assertThat(status.pendingCount()).isEqualTo(1);
        assertThat(status.retryingCount()).isEqualTo(1);
        assertThat(queue.getQueueItem(failingId)).get().satisfies(item -> {
            assertThat(item.retries()).isEqualTo(1);
            assertThat(item.lastError()).isEqualTo("Backend unreachable");
            assertThat(item.nextAttemptAt()).isEqualTo(NOW.plusMillis(BACKOFF_MS));
        });
        verify(mutationPort).delete("r-2");
    }

    @Test
    @DisplayName("처리 - 최대 재시도에 도달하면 FAILED로 남고 더 이상 전송하지 않는다")
    void processQueue_ExhaustsRetries() {
        // given
        given(mutationPort.create(DRAFT)).willReturn(networkFailure());
        String itemId = queue.enqueueCreate(DRAFT);
        queue.onNetworkStatusChanged(true);

        // when
        for (int pass = 0; pass < 5; pass++) {
            queue.processQueue();
            clock.advance(Duration.ofMillis(BACKOFF_MS));
        }

        // then
        verify(mutationPort, times(3)).create(DRAFT);
        assertThat(queue.getQueueItem(itemId)).get().satisfies(item -> {
            assertThat(item.status()).isEqualTo(QueueItemStatus.FAILED);
            assertThat(item.retries()).isEqualTo(3);
        });
        assertThat(queue.getStatus().failedCount()).isEqualTo(1);
        assertThat(queue.getStatus().pendingCount()).isZero();
        assertThat(meterRegistry.counter("offline.queue.dispatch", "result", "retry").count()).isEqualTo(2.0);
        assertThat(meterRegistry.counter("offline.queue.dispatch", "result", "exhausted").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("처리 - 백오프가 지나기 전에는 실패한 항목을 다시 전송하지 않는다")
    void processQueue_WaitsForBackoffBeforeRetry() {
        // given
        queue = newQueue(100, 10_000, clock);
        given(mutationPort.delete("a")).willReturn(networkFailure());
        given(mutationPort.delete("b")).willReturn(CompletableFuture.completedFuture(true));
        given(mutationPort.delete("c")).willReturn(CompletableFuture.completedFuture(true));
        queue.onNetworkStatusChanged(true);
        String failingId = queue.enqueueDelete("a");
        queue.processQueue();

        // when
        clock.advance(Duration.ofMillis(200));
        queue.enqueueDelete("b");
        queue.processQueue();
        clock.advance(Duration.ofMillis(200));
        queue.enqueueDelete("c");
        queue.processQueue();

        // then
        verify(mutationPort, times(1)).delete("a");
        verify(mutationPort).delete("b");
        verify(mutationPort).delete("c");
        assertThat(queue.getQueueItem(failingId)).get().satisfies(item -> {
            assertThat(item.status()).isEqualTo(QueueItemStatus.PENDING);
            assertThat(item.retries()).isEqualTo(1);
        });

        // 백오프 경과 후에는 다시 전송
        clock.advance(Duration.ofSeconds(10));
        queue.processQueue();
        verify(mutationPort, times(2)).delete("a");
    }

    @Test
    @DisplayName("처리 - 오프라인이면 아무것도 전송하지 않는다")
    void processQueue_Offline() {
        queue.enqueueDelete("r-1");

        queue.processQueue();

        verifyNoInteractions(mutationPort);
        assertThat(queue.getStatus().pendingCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("수동 재시도 - FAILED 항목을 재시도 횟수 0으로 되돌린다")
    void retryFailedItems() {
        // given
        given(mutationPort.delete("r-1"))
                .willReturn(networkFailure(), networkFailure(), networkFailure())
                .willReturn(CompletableFuture.completedFuture(true));
        String itemId = queue.enqueueDelete("r-1");
        queue.onNetworkStatusChanged(true);
        for (int pass = 0; pass < 3; pass++) {
            queue.processQueue();
            clock.advance(Duration.ofMillis(BACKOFF_MS));
        }

        // when
        int reset = queue.retryFailedItems();

        // then
        assertThat(reset).isEqualTo(1);
        assertThat(queue.getQueueItem(itemId)).get().satisfies(item -> {
            assertThat(item.status()).isEqualTo(QueueItemStatus.PENDING);
            assertThat(item.retries()).isZero();
            assertThat(item.lastError()).isNull();
        });

        queue.processQueue();
        assertThat(queue.getStatus().totalCount()).isZero();
    }

    // ========== lifecycle ==========

    @Test
    @DisplayName("온라인 복귀 시 대기 중인 항목을 정확히 한 번 전송한다")
    void reconnect_DispatchesOnce() {
        // given
        given(mutationPort.create(DRAFT)).willReturn(CompletableFuture.completedFuture(SAVED));
        queue.start();
        queue.enqueueCreate(DRAFT);
        assertThat(queue.getStatus().online()).isFalse();

        // when
        networkStatus.goOnline();

        // then
        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(queue.getStatus().totalCount()).isZero());
        verify(mutationPort, times(1)).create(DRAFT);
    }

    @Test
    @DisplayName("재시작 시 저장된 항목을 복원하고 온라인이면 처리한다")
    void start_RestoresPersistedItems() {
        // given
        queueStore.preload(List.of(QueueItem.pending("persisted", NOW, QueueOperation.delete("r-9"))));
        given(mutationPort.delete("r-9")).willReturn(CompletableFuture.completedFuture(true));
        networkStatus.goOnline();

        // when
        queue.start();

        // then
        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(queueStore.stored()).isEmpty());
        verify(mutationPort).delete("r-9");
        assertThat(meterRegistry.get("offline.queue.pending").gauge().value()).isZero();
    }

    @Test
    @DisplayName("남은 항목이 있으면 백오프 후 다음 패스를 실행한다")
    void processQueue_SchedulesBackoffPass() {
        // given
        queue = newQueue(100, BACKOFF_MS, Clock.systemUTC());
        given(mutationPort.delete("r-1"))
                .willReturn(networkFailure())
                .willReturn(CompletableFuture.completedFuture(true));
        queue.start();
        queue.enqueueDelete("r-1");

        // when
        networkStatus.goOnline();

        // then
        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(queue.getStatus().totalCount()).isZero());
        verify(mutationPort, times(2)).delete("r-1");
    }

    @Test
    @DisplayName("새 항목 등록으로 시작된 패스도 백오프 중인 항목은 건너뛴다")
    void enqueue_DoesNotShortenBackoff() {
        // given
        queue = newQueue(100, 10_000, Clock.systemUTC());
        given(mutationPort.delete("a")).willReturn(networkFailure());
        given(mutationPort.delete("b")).willReturn(CompletableFuture.completedFuture(true));
        given(mutationPort.delete("c")).willReturn(CompletableFuture.completedFuture(true));
        queue.start();
        networkStatus.goOnline();
        String failingId = queue.enqueueDelete("a");
        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(queue.getQueueItem(failingId)).get()
                        .extracting(QueueItem::retries).isEqualTo(1));

        // when
        queue.enqueueDelete("b");
        queue.enqueueDelete("c");

        // then
        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(queue.getStatus().totalCount()).isEqualTo(1));
        verify(mutationPort, times(1)).delete("a");
        assertThat(queue.getQueueItem(failingId)).get()
                .extracting(QueueItem::status).isEqualTo(QueueItemStatus.PENDING);
    }

    // ========== maintenance ==========

    @Test
    @DisplayName("항목 조회, 개별 삭제, 전체 삭제")
    void removeAndClear() {
        String first = queue.enqueueDelete("r-1");
        String second = queue.enqueueDelete("r-2");
        queue.enqueueDelete("r-3");

        assertThat(queue.removeFromQueue(first)).isTrue();
        assertThat(queue.removeFromQueue(first)).isFalse();
        assertThat(queue.getQueueItem(first)).isEmpty();
        assertThat(queue.getQueueItem(second)).isPresent();
        assertThat(queue.clearQueue(true)).isZero();
        assertThat(queue.clearQueue(false)).isEqualTo(2);
        assertThat(queueStore.stored()).isEmpty();
    }

    @Test
    @DisplayName("구독자는 상태 변경마다 스냅샷을 받는다")
    void subscribe_ReceivesStatus() {
        List<QueueStatus> received = new ArrayList<>();
        queue.subscribe(received::add);

        queue.enqueueDelete("r-1");
        queue.onNetworkStatusChanged(true);

        assertThat(received).hasSize(2);
        assertThat(received.get(0).pendingCount()).isEqualTo(1);
        assertThat(received.get(0).online()).isFalse();
        assertThat(received.get(1).online()).isTrue();
    }

    private OfflineMutationQueue newQueue(int maxSize) {
        return newQueue(maxSize, BACKOFF_MS, clock);
    }

    private OfflineMutationQueue newQueue(int maxSize, long backoffMs, Clock queueClock) {
        OfflineQueueProperties properties = new OfflineQueueProperties(maxSize,
                new OfflineQueueProperties.Retry(3, 0, backoffMs, 0),
                new OfflineQueueProperties.Store("unused", 1024));
        return new OfflineMutationQueue(mutationPort, queueStore, networkStatus, properties,
                queueClock, meterRegistry);
    }

    private static <T> CompletableFuture<T> networkFailure() {
        return CompletableFuture.failedFuture(
                MutationFailedException.network("Backend unreachable", new RuntimeException("refused")));
    }
}
