package personal.yacht.charter.booking.domain.model;

import java.util.List;

/**
 * 요트(자원) 명세 - 외부 레지스트리 소유, 읽기 전용
 */
public record ResourceSpec(
        String id,
        String name,
        int maxGuests,
        int minBookingHours,
        List<MaintenanceWindow> maintenanceWindows,
        List<SeasonalRate> seasonalRates) {

    public ResourceSpec {
        maintenanceWindows = maintenanceWindows == null ? List.of() : List.copyOf(maintenanceWindows);
        seasonalRates = seasonalRates == null ? List.of() : List.copyOf(seasonalRates);
    }

    /**
     * 정비 기간을 MAINTENANCE 유형의 예약으로 노출한다.
     * 엔진은 자원 단위 비가용 기간을 일반 예약과 동일하게 취급한다.
     */
    public List<Reservation> maintenanceBlocks() {
        return maintenanceWindows.stream()
                .map(window -> window.toReservation(id))
                .toList();
    }
}
