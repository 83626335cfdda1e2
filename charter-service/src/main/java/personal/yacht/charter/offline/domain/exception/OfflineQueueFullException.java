package personal.yacht.charter.offline.domain.exception;

import personal.yacht.common.exception.BusinessException;
import personal.yacht.common.exception.ErrorCode;

/**
 * Offline Queue Full Exception
 * 대기열이 최대 크기에 도달해 더 이상 추가할 수 없는 경우
 */
public class OfflineQueueFullException extends BusinessException {
    public OfflineQueueFullException(int maxSize) {
        super(ErrorCode.QUEUE_FULL, String.format("Offline queue is full: maxSize=%d", maxSize));
    }
}
