package personal.yacht.charter.booking.domain.model;

/**
 * 예약 상태
 */
public enum ReservationStatus {
    PENDING("pending"),
    DEPOSIT_PENDING("deposit_pending"),
    CONFIRMED("confirmed"),
    CANCELLED("cancelled"),
    NO_SHOW("no_show"),
    COMPLETED("completed");

    private final String code;

    ReservationStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 취소/노쇼 예약은 충돌 및 가용성 계산에서 제외된다.
     */
    public boolean isActive() {
        return this != CANCELLED && this != NO_SHOW;
    }

    public boolean isAwaitingConfirmation() {
        return this == PENDING || this == DEPOSIT_PENDING;
    }
}
