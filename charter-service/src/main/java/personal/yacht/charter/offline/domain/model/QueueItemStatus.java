package personal.yacht.charter.offline.domain.model;

public enum QueueItemStatus {
    PENDING,
    COMPLETED,
    FAILED
}
