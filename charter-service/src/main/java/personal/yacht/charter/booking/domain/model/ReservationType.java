package personal.yacht.charter.booking.domain.model;

/**
 * 예약 유형
 * CHARTER 외의 유형은 고객이 없는 자원 점유(차단, 정비, 선주 사용)를 나타낸다.
 */
public enum ReservationType {
    CHARTER("charter"),
    BLOCKED("blocked"),
    MAINTENANCE("maintenance"),
    OWNER_USE("owner_use");

    private final String code;

    ReservationType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
