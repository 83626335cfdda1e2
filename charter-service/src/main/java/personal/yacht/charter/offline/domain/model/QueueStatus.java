package personal.yacht.charter.offline.domain.model;

import java.util.List;

/**
 * 대기열 상태 스냅샷
 *
 * @param retryingCount 한 번 이상 실패했지만 아직 재시도 대상인 항목 수
 * @param failedCount   최대 재시도에 도달한 항목 수
 */
public record QueueStatus(
        boolean online,
        boolean processing,
        int totalCount,
        int pendingCount,
        int retryingCount,
        int failedCount,
        List<QueueItem> items) {

    public static QueueStatus of(boolean online, boolean processing, List<QueueItem> items) {
        int pending = 0;
        int retrying = 0;
        int failed = 0;
        for (QueueItem item : items) {
            if (item.awaitingDispatch()) {
                pending++;
            }
            if (item.retrying()) {
                retrying++;
            }
            if (item.status() == QueueItemStatus.FAILED) {
                failed++;
            }
        }
        return new QueueStatus(online, processing, items.size(), pending, retrying, failed, List.copyOf(items));
    }
}
