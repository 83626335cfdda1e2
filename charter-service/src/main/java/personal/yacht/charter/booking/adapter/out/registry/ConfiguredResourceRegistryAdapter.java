package personal.yacht.charter.booking.adapter.out.registry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.yacht.charter.booking.application.port.out.ResourceRegistry;
import personal.yacht.charter.booking.domain.model.MaintenanceWindow;
import personal.yacht.charter.booking.domain.model.ResourceSpec;
import personal.yacht.charter.booking.domain.model.SeasonalRate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Configured Resource Registry Adapter
 * 설정 파일(fleet.*)에 정의된 요트 명세를 제공
 */
@Slf4j
@Component
public class ConfiguredResourceRegistryAdapter implements ResourceRegistry {

    private final Map<String, ResourceSpec> resources = new LinkedHashMap<>();

    public ConfiguredResourceRegistryAdapter(FleetProperties fleetProperties) {
        for (FleetProperties.Yacht yacht : fleetProperties.yachts()) {
            resources.put(yacht.id(), toSpec(yacht));
        }
        log.info("Fleet registry loaded: yachts={}", resources.keySet());
    }

    @Override
    public Optional<ResourceSpec> findById(String resourceId) {
        return Optional.ofNullable(resources.get(resourceId));
    }

    @Override
    public List<ResourceSpec> findAll() {
        return List.copyOf(resources.values());
    }

    private static ResourceSpec toSpec(FleetProperties.Yacht yacht) {
        List<MaintenanceWindow> maintenance = yacht.maintenance() == null ? List.of() : yacht.maintenance().stream()
                .map(window -> new MaintenanceWindow(window.start(), window.end(), window.reason()))
                .toList();
        List<SeasonalRate> rates = yacht.seasonalRates() == null ? List.of() : yacht.seasonalRates().stream()
                .map(rate -> new SeasonalRate(rate.name(), rate.start(), rate.end(), rate.multiplier()))
                .toList();
        return new ResourceSpec(yacht.id(), yacht.name(), yacht.maxGuests(), yacht.minBookingHours(),
                maintenance, rates);
    }
}
