package personal.yacht.common.event;

/**
 * 구독 해제 핸들
 * subscribe() 호출이 반환하며, 여러 번 호출해도 안전해야 한다.
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
