package personal.yacht.charter.booking.domain.model;

/**
 * 일자별 가용성 상태
 */
public enum AvailabilityStatus {
    AVAILABLE("available"),
    CONFIRMED("confirmed"),
    PENDING("pending"),
    BLOCKED("blocked"),
    MAINTENANCE("maintenance"),
    OWNER_USE("owner_use");

    private final String code;

    AvailabilityStatus(String code) {
        this.code = code;
    }

    /**
     * 점유 예약의 유형을 상태보다 우선한다.
     * 완료된 전세 예약처럼 어느 쪽에도 해당하지 않으면 AVAILABLE.
     */
    public static AvailabilityStatus of(Reservation occupying) {
        return switch (occupying.type()) {
            case BLOCKED -> BLOCKED;
            case MAINTENANCE -> MAINTENANCE;
            case OWNER_USE -> OWNER_USE;
            case CHARTER -> ofCharterStatus(occupying.status());
        };
    }

    private static AvailabilityStatus ofCharterStatus(ReservationStatus status) {
        if (status == ReservationStatus.CONFIRMED) {
            return CONFIRMED;
        }
        return status.isAwaitingConfirmation() ? PENDING : AVAILABLE;
    }

    public String getCode() {
        return code;
    }
}
