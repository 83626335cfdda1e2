package personal.yacht.charter.booking.domain.model;

/**
 * 일괄 처리의 개별 작업
 */
public record BatchOperation(
        MutationType type,
        String reservationId,
        ReservationDraft draft,
        ReservationPatch patch,
        MoveTarget target) {

    public static BatchOperation create(ReservationDraft draft) {
        return new BatchOperation(MutationType.CREATE, draft.id(), draft, null, null);
    }

    public static BatchOperation update(String reservationId, ReservationPatch patch) {
        return new BatchOperation(MutationType.UPDATE, reservationId, null, patch, null);
    }

    public static BatchOperation delete(String reservationId) {
        return new BatchOperation(MutationType.DELETE, reservationId, null, null, null);
    }

    public static BatchOperation move(String reservationId, MoveTarget target) {
        return new BatchOperation(MutationType.MOVE, reservationId, null, null, target);
    }
}
