package personal.yacht.charter.booking.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * 충돌 시 제안할 대안 (각 목록은 최대 {@value #MAX_SUGGESTIONS}건)
 */
public record AlternativeSuggestions(
        List<AlternativeDate> alternativeDates,
        List<AlternativeResource> alternativeResources,
        List<AvailabilitySlot> nearbySlots) {

    public static final int MAX_SUGGESTIONS = 5;

    public AlternativeSuggestions {
        alternativeDates = List.copyOf(alternativeDates);
        alternativeResources = List.copyOf(alternativeResources);
        nearbySlots = List.copyOf(nearbySlots);
    }

    /**
     * 같은 요트의 다른 날짜
     *
     * @param daysDifference 원래 시작일과의 거리 (일)
     */
    public record AlternativeDate(
            String resourceId,
            LocalDate startDate,
            LocalDate endDate,
            int days,
            long daysDifference) {
    }

    /**
     * 같은 날짜의 다른 요트
     */
    public record AlternativeResource(
            ResourceSpec resource,
            LocalDate startDate,
            LocalDate endDate) {
    }
}
