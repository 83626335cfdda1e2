package personal.yacht.charter.booking.domain.model;

import personal.yacht.common.exception.BusinessException;
import personal.yacht.common.exception.ErrorCode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reservation Domain Model
 * 예약 도메인 모델 (불변)
 *
 * <p>시작/종료 시각의 순서(end > start)는 상태 관리자가 적용 전에 검증한다.
 * 변경 이력은 최근 {@value #MAX_CHANGE_HISTORY}건만 유지한다.
 */
public record Reservation(
        String id,
        String resourceId,
        String customerName,
        String customerEmail,
        LocalDateTime startDateTime,
        LocalDateTime endDateTime,
        ReservationStatus status,
        ReservationType type,
        String notes,
        boolean depositPaid,
        boolean finalPaymentPaid,
        List<ChangeHistoryEntry> changeHistory,
        Instant createdAt,
        Instant updatedAt) {

    public static final int MAX_CHANGE_HISTORY = 50;

    public Reservation {
        if (id == null || id.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation ID cannot be blank");
        }
        status = status == null ? ReservationStatus.PENDING : status;
        type = type == null ? ReservationType.CHARTER : type;
        changeHistory = changeHistory == null ? List.of() : List.copyOf(changeHistory);
    }

    /**
     * 예약 생성 (정적 팩토리 메서드)
     * 생성 시점에는 변경 이력이 비어 있다.
     *
     * @param id    예약 ID
     * @param draft 생성 요청
     * @param now   생성 시각
     * @return 새로운 예약
     */
    public static Reservation fromDraft(String id, ReservationDraft draft, Instant now) {
        return new Reservation(
                id,
                draft.resourceId(),
                draft.customerName(),
                draft.customerEmail(),
                draft.startDateTime(),
                draft.endDateTime(),
                draft.status(),
                draft.type(),
                draft.notes(),
                Boolean.TRUE.equals(draft.depositPaid()),
                Boolean.TRUE.equals(draft.finalPaymentPaid()),
                List.of(),
                now,
                now);
    }

    /**
     * 부분 변경 적용
     * 실제로 바뀐 필드가 있으면 변경 이력을 한 건 추가한다.
     *
     * @param patch 변경 내용 (null 필드는 유지)
     * @param now   변경 시각
     * @param actor 변경 주체
     * @return 변경된 예약 (바뀐 필드가 없으면 자기 자신)
     */
    public Reservation applyPatch(ReservationPatch patch, Instant now, String actor) {
        List<String> changed = new ArrayList<>();
        String newResourceId = pick("resourceId", resourceId, patch.resourceId(), changed);
        String newCustomerName = pick("customerName", customerName, patch.customerName(), changed);
        String newCustomerEmail = pick("customerEmail", customerEmail, patch.customerEmail(), changed);
        LocalDateTime newStart = pick("startDateTime", startDateTime, patch.startDateTime(), changed);
        LocalDateTime newEnd = pick("endDateTime", endDateTime, patch.endDateTime(), changed);
        ReservationStatus newStatus = pick("status", status, patch.status(), changed);
        ReservationType newType = pick("type", type, patch.type(), changed);
        String newNotes = pick("notes", notes, patch.notes(), changed);
        boolean newDepositPaid = pick("depositPaid", depositPaid, patch.depositPaid(), changed);
        boolean newFinalPaymentPaid = pick("finalPaymentPaid", finalPaymentPaid, patch.finalPaymentPaid(), changed);

        if (changed.isEmpty()) {
            return this;
        }
        return new Reservation(id, newResourceId, newCustomerName, newCustomerEmail, newStart, newEnd,
                newStatus, newType, newNotes, newDepositPaid, newFinalPaymentPaid,
                appendHistory(new ChangeHistoryEntry(now, actor, changed)), createdAt, now);
    }

    /**
     * 다른 요트에 같은 기간을 잡았을 때의 후보 (충돌 검사용, 이력 없음)
     */
    public Reservation relocatedTo(String otherResourceId) {
        return new Reservation(id, otherResourceId, customerName, customerEmail, startDateTime, endDateTime,
                status, type, notes, depositPaid, finalPaymentPaid, changeHistory, createdAt, updatedAt);
    }

    // ========== Day Granularity ==========

    public LocalDate startDate() {
        return startDateTime.toLocalDate();
    }

    public LocalDate endDate() {
        return endDateTime.toLocalDate();
    }

    // ========== Domain Validation Methods (Tell, Don't Ask) ==========

    /**
     * 충돌/가용성 계산 대상 여부 (취소, 노쇼 제외)
     */
    public boolean isActive() {
        return status.isActive();
    }

    public boolean isOn(String otherResourceId) {
        return Objects.equals(resourceId, otherResourceId);
    }

    public boolean occupies(LocalDate date) {
        return !date.isBefore(startDate()) && !date.isAfter(endDate());
    }

    public boolean isBoundary(LocalDate date) {
        return date.equals(startDate()) || date.equals(endDate());
    }

    private List<ChangeHistoryEntry> appendHistory(ChangeHistoryEntry entry) {
        List<ChangeHistoryEntry> history = new ArrayList<>(changeHistory);
        history.add(entry);
        int overflow = history.size() - MAX_CHANGE_HISTORY;
        return overflow > 0 ? history.subList(overflow, history.size()) : history;
    }

    private static <T> T pick(String field, T current, T requested, List<String> changed) {
        if (requested == null || requested.equals(current)) {
            return current;
        }
        changed.add(field);
        return requested;
    }
}
