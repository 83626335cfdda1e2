package personal.yacht.charter.booking.domain.model;

/**
 * 변경 호출별 옵션
 *
 * @param optimistic        백엔드 응답 전에 메모리에 먼저 반영
 * @param validateConflicts 적용 전 충돌 검사
 * @param recordHistory     성공 시 되돌리기 이력에 기록
 * @param queueOnFailure    네트워크 실패 시 오프라인 대기열로 넘김
 */
public record MutationOptions(
        boolean optimistic,
        boolean validateConflicts,
        boolean recordHistory,
        boolean queueOnFailure) {

    public static final MutationOptions DEFAULT = new MutationOptions(true, true, true, true);
    public static final MutationOptions UNDO = new MutationOptions(true, false, false, false);
}
