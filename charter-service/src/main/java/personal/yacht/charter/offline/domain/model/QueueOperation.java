package personal.yacht.charter.offline.domain.model;

import personal.yacht.charter.booking.domain.model.ReservationDraft;
import personal.yacht.charter.booking.domain.model.ReservationPatch;

/**
 * 대기열에 보관되는 변경 의도
 *
 * @param reservationId 대상 예약 (생성이면 draft의 ID)
 * @param field         TOGGLE_FIELD 대상 필드명
 */
public record QueueOperation(
        QueueOperationType type,
        String reservationId,
        ReservationDraft draft,
        ReservationPatch patch,
        String field) {

    public static QueueOperation create(ReservationDraft draft) {
        return new QueueOperation(QueueOperationType.CREATE, draft.id(), draft, null, null);
    }

    public static QueueOperation update(String reservationId, ReservationPatch patch) {
        return new QueueOperation(QueueOperationType.UPDATE, reservationId, null, patch, null);
    }

    public static QueueOperation delete(String reservationId) {
        return new QueueOperation(QueueOperationType.DELETE, reservationId, null, null, null);
    }

    public static QueueOperation toggleField(String reservationId, String field) {
        return new QueueOperation(QueueOperationType.TOGGLE_FIELD, reservationId, null, null, field);
    }
}
