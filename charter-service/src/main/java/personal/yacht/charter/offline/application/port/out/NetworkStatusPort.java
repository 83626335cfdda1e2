package personal.yacht.charter.offline.application.port.out;

import personal.yacht.common.event.Subscription;

import java.util.function.Consumer;

/**
 * Network Status Port (Output Port)
 * 온라인/오프라인 전환 신호 제공
 */
public interface NetworkStatusPort {

    boolean isOnline();

    /**
     * 상태가 바뀔 때마다 새 상태(온라인 여부)를 전달한다.
     */
    Subscription subscribe(Consumer<Boolean> listener);
}
