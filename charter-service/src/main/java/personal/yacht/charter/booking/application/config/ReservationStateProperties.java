package personal.yacht.charter.booking.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Reservation State Configuration Properties
 *
 * @param historySize           되돌리기 이력 최대 건수 (초과 시 가장 오래된 항목 제거)
 * @param defaultActor          변경 이력에 기록할 주체
 * @param queueOnNetworkFailure 네트워크 실패로 롤백된 변경을 오프라인 대기열로 넘길지 여부
 */
@ConfigurationProperties(prefix = "reservation-state")
public record ReservationStateProperties(
        int historySize,
        String defaultActor,
        boolean queueOnNetworkFailure) {
}
