package personal.yacht.charter.booking.domain.model;

import java.time.LocalDate;

/**
 * 시즌 요금 구간 (배율)
 */
public record SeasonalRate(
        String name,
        LocalDate startDate,
        LocalDate endDate,
        double multiplier) {
}
