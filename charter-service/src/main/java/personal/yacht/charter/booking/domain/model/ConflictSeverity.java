package personal.yacht.charter.booking.domain.model;

public enum ConflictSeverity {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String code;

    ConflictSeverity(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
