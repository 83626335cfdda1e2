package personal.yacht.charter.offline.domain.exception;

import personal.yacht.common.exception.BusinessException;
import personal.yacht.common.exception.ErrorCode;

/**
 * Queue Store Capacity Exceeded Exception
 * 영속 저장소가 용량 초과로 쓰기를 거부한 경우
 */
public class QueueStoreCapacityExceededException extends BusinessException {
    public QueueStoreCapacityExceededException(long requiredBytes, long maxBytes) {
        super(ErrorCode.QUEUE_STORE_FULL,
                String.format("Queue store capacity exceeded: required=%d bytes, max=%d bytes", requiredBytes, maxBytes));
    }
}
