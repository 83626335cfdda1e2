package personal.yacht.charter.offline.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Queue Item Domain Model
 * 오프라인 대기열 항목 (불변)
 *
 * <p>PENDING → COMPLETED (전송 성공)
 * <br>PENDING → FAILED (최대 재시도 도달, 수동 재시도 전까지 처리 제외)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueueItem(
        String id,
        Instant enqueuedAt,
        QueueOperation operation,
        QueueItemStatus status,
        int retries,
        String lastError,
        Instant nextAttemptAt,
        Instant completedAt) {

    public static QueueItem pending(String id, Instant enqueuedAt, QueueOperation operation) {
        return new QueueItem(id, enqueuedAt, operation, QueueItemStatus.PENDING, 0, null, null, null);
    }

    public QueueItem markCompleted(Instant at) {
        return new QueueItem(id, enqueuedAt, operation, QueueItemStatus.COMPLETED, retries, lastError, null, at);
    }

    /**
     * 전송 실패 기록
     * 재시도 횟수가 maxRetries에 도달하면 FAILED로 전이하고, 아니면 retryAt 이후에만 다시 전송한다.
     */
    public QueueItem recordFailure(String error, int maxRetries, Instant retryAt) {
        int attempts = retries + 1;
        boolean exhausted = attempts >= maxRetries;
        return new QueueItem(id, enqueuedAt, operation,
                exhausted ? QueueItemStatus.FAILED : QueueItemStatus.PENDING,
                attempts, error, exhausted ? null : retryAt, null);
    }

    /**
     * 수동 재시도 (재시도 횟수와 대기 시각 초기화)
     */
    public QueueItem resetForRetry() {
        return new QueueItem(id, enqueuedAt, operation, QueueItemStatus.PENDING, 0, null, null, null);
    }

    public boolean awaitingDispatch() {
        return status == QueueItemStatus.PENDING;
    }

    /**
     * 지금 전송할 차례인지 (PENDING이고 백오프 대기 시각이 지났는지)
     */
    public boolean dueAt(Instant now) {
        return awaitingDispatch() && (nextAttemptAt == null || !nextAttemptAt.isAfter(now));
    }

    public boolean retrying() {
        return status == QueueItemStatus.PENDING && retries > 0;
    }
}
