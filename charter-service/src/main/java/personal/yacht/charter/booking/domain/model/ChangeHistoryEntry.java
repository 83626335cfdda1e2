package personal.yacht.charter.booking.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * 예약 변경 이력 한 건
 */
public record ChangeHistoryEntry(
        Instant timestamp,
        String actor,
        List<String> changedFields) {

    public ChangeHistoryEntry {
        changedFields = changedFields == null ? List.of() : List.copyOf(changedFields);
    }
}
