package personal.yacht.charter.booking.domain.event;

@FunctionalInterface
public interface ReservationStateListener {

    void onEvent(ReservationStateEvent event);
}
