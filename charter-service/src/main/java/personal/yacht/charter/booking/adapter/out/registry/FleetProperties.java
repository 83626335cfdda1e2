package personal.yacht.charter.booking.adapter.out.registry;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalDate;
import java.util.List;

/**
 * Fleet Configuration Properties
 * 요트 명세 (정비 기간, 시즌 요금 포함)
 */
@ConfigurationProperties(prefix = "fleet")
public record FleetProperties(List<Yacht> yachts) {

    public FleetProperties {
        yachts = yachts == null ? List.of() : List.copyOf(yachts);
    }

    public record Yacht(
            String id,
            String name,
            int maxGuests,
            int minBookingHours,
            List<Maintenance> maintenance,
            List<Rate> seasonalRates) {
    }

    public record Maintenance(
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            String reason) {
    }

    public record Rate(
            String name,
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            double multiplier) {
    }
}
