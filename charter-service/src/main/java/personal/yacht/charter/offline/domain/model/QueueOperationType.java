package personal.yacht.charter.offline.domain.model;

public enum QueueOperationType {
    CREATE,
    UPDATE,
    DELETE,
    TOGGLE_FIELD
}
