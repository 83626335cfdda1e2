package personal.yacht.charter.booking.domain.model;

/**
 * 충돌 검사 옵션
 *
 * @param excludeSameDay 하루짜리 체크아웃/체크인 경계 겹침을 경고로 낮춘다
 * @param includeBlocked BLOCKED 유형 예약을 검사 대상에 포함한다
 */
public record ConflictCheckOptions(boolean excludeSameDay, boolean includeBlocked) {

    public static ConflictCheckOptions defaults() {
        return new ConflictCheckOptions(false, true);
    }
}
