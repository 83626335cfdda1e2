package personal.yacht.charter.support;

import personal.yacht.charter.offline.application.port.out.NetworkStatusPort;
import personal.yacht.common.event.Subscription;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 테스트에서 온라인/오프라인을 직접 전환하는 네트워크 상태
 */
public class StubNetworkStatus implements NetworkStatusPort {

    private final List<Consumer<Boolean>> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean online;

    public StubNetworkStatus(boolean online) {
        this.online = online;
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

    public void goOnline() {
        change(true);
    }

    public void goOffline() {
        change(false);
    }

    private void change(boolean value) {
        if (online == value) {
            return;
        }
        online = value;
        listeners.forEach(listener -> listener.accept(value));
    }
}
