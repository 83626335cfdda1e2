package personal.yacht.charter.booking.domain.model;

public record StateStats(
        int totalReservations,
        int optimisticUpdates,
        int historySize,
        int subscribers) {
}
