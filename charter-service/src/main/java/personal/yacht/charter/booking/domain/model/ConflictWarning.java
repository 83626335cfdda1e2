package personal.yacht.charter.booking.domain.model;

/**
 * 예약을 막지 않는 경고
 */
public record ConflictWarning(
        WarningType type,
        String message,
        Reservation reservation) {

    public static ConflictWarning backToBack(Reservation existing) {
        return new ConflictWarning(WarningType.BACK_TO_BACK,
                "Back-to-back booking detected - consider turnaround time", existing);
    }

    public static ConflictWarning sameDayTransition(Reservation existing) {
        return new ConflictWarning(WarningType.SAME_DAY_TRANSITION,
                "Same-day checkout/checkin detected", existing);
    }

    public enum WarningType {
        BACK_TO_BACK("back_to_back"),
        SAME_DAY_TRANSITION("same_day_transition");

        private final String code;

        WarningType(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }
}
