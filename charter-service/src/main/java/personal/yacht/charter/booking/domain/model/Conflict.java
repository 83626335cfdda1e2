package personal.yacht.charter.booking.domain.model;

/**
 * 후보 예약과 기존 예약 간의 겹침 (계산 결과, 저장하지 않음)
 *
 * @param overlapDays 교집합의 일 수 (양 끝 포함, 1 이상)
 */
public record Conflict(
        ConflictType type,
        ConflictSeverity severity,
        int overlapDays,
        Reservation reservation) {

    public static Conflict of(Reservation existing, int overlapDays) {
        ConflictType type = ConflictType.of(existing);
        return new Conflict(type, type.getSeverity(), overlapDays, existing);
    }
}
