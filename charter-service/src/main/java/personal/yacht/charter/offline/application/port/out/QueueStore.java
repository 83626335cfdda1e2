package personal.yacht.charter.offline.application.port.out;

import personal.yacht.charter.offline.domain.model.QueueItem;

import java.util.List;

/**
 * Queue Store (Output Port)
 * 대기열 목록의 로컬 영속 저장소 (동기)
 */
public interface QueueStore {

    /**
     * @return 저장된 항목 (없거나 읽을 수 없으면 빈 목록)
     */
    List<QueueItem> load();

    /**
     * 전체 목록 저장
     *
     * @throws personal.yacht.charter.offline.domain.exception.QueueStoreCapacityExceededException 용량 초과
     */
    void save(List<QueueItem> items);
}
