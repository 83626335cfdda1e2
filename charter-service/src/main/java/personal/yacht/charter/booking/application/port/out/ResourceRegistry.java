package personal.yacht.charter.booking.application.port.out;

import personal.yacht.charter.booking.domain.model.ResourceSpec;

import java.util.List;
import java.util.Optional;

/**
 * Resource Registry (Output Port)
 * 요트 명세 조회 (읽기 전용, 동기)
 */
public interface ResourceRegistry {

    Optional<ResourceSpec> findById(String resourceId);

    List<ResourceSpec> findAll();
}
