package personal.yacht.charter.offline.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Offline Queue Configuration Properties
 * 오프라인 대기열 설정값 관리
 */
@ConfigurationProperties(prefix = "offline-queue")
public record OfflineQueueProperties(
        int maxSize,
        Retry retry,
        Store store) {

    /**
     * 재시도 설정
     *
     * @param maxAttempts    FAILED로 전이하기까지의 실패 횟수
     * @param itemDelayMs    항목 사이 대기 시간
     * @param backoffMs      남은 항목이 있을 때 다음 패스까지의 대기 시간
     * @param initialDelayMs 재시작 후 첫 패스까지의 대기 시간
     */
    public record Retry(
            int maxAttempts,
            long itemDelayMs,
            long backoffMs,
            long initialDelayMs) {
    }

    /**
     * 영속 저장소 설정
     */
    public record Store(
            String path,
            long maxBytes) {
    }
}
