package personal.yacht.charter.offline.adapter.out.network;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import personal.yacht.charter.offline.application.port.out.NetworkStatusPort;
import personal.yacht.common.event.Subscription;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Backend Health Probe Adapter
 * 예약 백엔드 헬스 체크 결과로 온라인/오프라인을 판단
 *
 * <p>2xx 응답이면 온라인, 그 외 응답이나 연결 실패는 오프라인으로 본다.
 * 상태가 바뀔 때만 구독자에게 알린다.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "network.probe", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BackendHealthProbeAdapter implements NetworkStatusPort {

    private final RestClient backendRestClient;
    private final String healthPath;
    private final List<Consumer<Boolean>> listeners = new CopyOnWriteArrayList<>();

    private volatile boolean online = true;

    public BackendHealthProbeAdapter(RestClient backendRestClient,
                                     @Value("${network.probe.path:/api/v1/health}") String healthPath) {
        this.backendRestClient = backendRestClient;
        this.healthPath = healthPath;
    }

    @Scheduled(fixedDelayString = "${network.probe.interval-ms:5000}")
    public void probe() {
        boolean reachable;
        try {
            reachable = backendRestClient.get()
                    .uri(healthPath)
                    .retrieve()
                    .toBodilessEntity()
                    .getStatusCode()
                    .is2xxSuccessful();
        } catch (RestClientException e) {
            log.debug("Backend health probe failed: {}", e.getMessage());
            reachable = false;
        }
        update(reachable);
    }

    @Override
    public boolean isOnline() {
        return online;
    }

    @Override
    public Subscription subscribe(Consumer<Boolean> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void update(boolean reachable) {
        if (reachable == online) {
            return;
        }
        online = reachable;
        log.info("Network status changed: online={}", reachable);
        for (Consumer<Boolean> listener : listeners) {
            try {
                listener.accept(reachable);
            } catch (RuntimeException e) {
                log.error("Network status listener failed", e);
            }
        }
    }
}
