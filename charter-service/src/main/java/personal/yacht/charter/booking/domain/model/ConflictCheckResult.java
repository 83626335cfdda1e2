package personal.yacht.charter.booking.domain.model;

import java.util.List;

public record ConflictCheckResult(
        List<Conflict> conflicts,
        List<ConflictWarning> warnings) {

    public ConflictCheckResult {
        conflicts = List.copyOf(conflicts);
        warnings = List.copyOf(warnings);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
