package personal.yacht.charter.booking.domain.model;

/**
 * 예약 기간 검증 규칙
 *
 * @param minDays        최소 예약 일 수 (양 끝 포함)
 * @param maxDays        최대 예약 일 수
 * @param allowPast      과거 날짜 허용 여부
 * @param minAdvanceDays 최소 사전 예약 일 수
 * @param maxAdvanceDays 최대 사전 예약 일 수
 */
public record DateValidationOptions(
        int minDays,
        int maxDays,
        boolean allowPast,
        int minAdvanceDays,
        int maxAdvanceDays) {

    public static DateValidationOptions defaults() {
        return new DateValidationOptions(1, 30, false, 0, 365);
    }

    public DateValidationOptions allowingPast() {
        return new DateValidationOptions(minDays, maxDays, true, minAdvanceDays, maxAdvanceDays);
    }
}
