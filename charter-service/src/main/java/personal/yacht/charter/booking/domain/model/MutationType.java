package personal.yacht.charter.booking.domain.model;

public enum MutationType {
    CREATE,
    UPDATE,
    DELETE,
    MOVE
}
