package personal.yacht.charter.booking.domain.model;

/**
 * 충돌 유형 - 기존 예약의 유형/상태에서 결정된다.
 */
public enum ConflictType {
    BLOCKED_PERIOD("blocked_period", ConflictSeverity.MEDIUM),
    MAINTENANCE("maintenance", ConflictSeverity.HIGH),
    OWNER_USE("owner_use", ConflictSeverity.HIGH),
    CONFIRMED_BOOKING("confirmed_booking", ConflictSeverity.HIGH),
    PENDING_BOOKING("pending_booking", ConflictSeverity.LOW);

    private final String code;
    private final ConflictSeverity severity;

    ConflictType(String code, ConflictSeverity severity) {
        this.code = code;
        this.severity = severity;
    }

    public static ConflictType of(Reservation existing) {
        return switch (existing.type()) {
            case BLOCKED -> BLOCKED_PERIOD;
            case MAINTENANCE -> MAINTENANCE;
            case OWNER_USE -> OWNER_USE;
            case CHARTER -> existing.status().isAwaitingConfirmation() ? PENDING_BOOKING : CONFIRMED_BOOKING;
        };
    }

    public String getCode() {
        return code;
    }

    public ConflictSeverity getSeverity() {
        return severity;
    }
}
