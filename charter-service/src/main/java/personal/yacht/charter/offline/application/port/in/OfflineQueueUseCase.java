package personal.yacht.charter.offline.application.port.in;

import personal.yacht.charter.booking.domain.model.ReservationDraft;
import personal.yacht.charter.booking.domain.model.ReservationPatch;
import personal.yacht.charter.offline.domain.model.QueueItem;
import personal.yacht.charter.offline.domain.model.QueueOperation;
import personal.yacht.charter.offline.domain.model.QueueStatus;
import personal.yacht.common.event.Subscription;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Offline Queue Use Case
 * 백엔드에 닿지 못한 변경 의도를 보관하고 순서대로 재전송한다.
 */
public interface OfflineQueueUseCase {

    /**
     * @return 대기열 항목 ID
     * @throws personal.yacht.charter.offline.domain.exception.OfflineQueueFullException 대기열이 가득 찬 경우
     */
    String enqueue(QueueOperation operation);

    default String enqueueCreate(ReservationDraft draft) {
        return enqueue(QueueOperation.create(draft));
    }

    default String enqueueUpdate(String reservationId, ReservationPatch patch) {
        return enqueue(QueueOperation.update(reservationId, patch));
    }

    default String enqueueDelete(String reservationId) {
        return enqueue(QueueOperation.delete(reservationId));
    }

    default String enqueueToggleField(String reservationId, String field) {
        return enqueue(QueueOperation.toggleField(reservationId, field));
    }

    boolean canEnqueue();

    /**
     * 처리 패스 1회 실행 (호출 스레드에서 동기 실행, 이미 실행 중이면 무시)
     */
    void processQueue();

    /**
     * @return 재시도 대상으로 되돌린 항목 수
     */
    int retryFailedItems();

    /**
     * @return 제거된 항목 수
     */
    int clearQueue(boolean completedOnly);

    boolean removeFromQueue(String itemId);

    Optional<QueueItem> getQueueItem(String itemId);

    QueueStatus getStatus();

    Subscription subscribe(Consumer<QueueStatus> listener);
}
