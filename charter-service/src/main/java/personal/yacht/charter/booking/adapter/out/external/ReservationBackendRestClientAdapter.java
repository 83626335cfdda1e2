package personal.yacht.charter.booking.adapter.out.external;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import personal.yacht.charter.booking.application.port.out.ReservationMutationPort;
import personal.yacht.charter.booking.domain.exception.MutationFailedException;
import personal.yacht.charter.booking.domain.model.Reservation;
import personal.yacht.charter.booking.domain.model.ReservationDraft;
import personal.yacht.charter.booking.domain.model.ReservationPatch;
import personal.yacht.common.exception.ErrorCode;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Reservation Backend REST Client Adapter
 * 원격 예약 API와 HTTP 통신하는 구현체 (RestClient 사용)
 *
 * <p>Circuit Breaker 적용:
 * - 4xx 에러: MutationFailedException(검증/충돌/권한) → ignoreExceptions → Circuit 열지 않음
 * - 5xx 에러, Timeout, 연결 실패: Circuit 실패로 카운트 → NETWORK 유형으로 변환
 * - Circuit Open: 호출하지 않고 즉시 NETWORK 실패 (Fail-Fast)
 */
@Slf4j
@Component
public class ReservationBackendRestClientAdapter implements ReservationMutationPort {

    static final String CIRCUIT_BREAKER_NAME = "reservationBackend";
    private static final String RESERVATIONS_PATH = "/api/v1/reservations";

    private final RestClient backendRestClient;
    private final CircuitBreaker circuitBreaker;
    private final Executor executor;

    public ReservationBackendRestClientAdapter(RestClient backendRestClient,
                                               CircuitBreakerRegistry circuitBreakerRegistry,
                                               @Qualifier("backendCallExecutor") Executor executor) {
        this.backendRestClient = backendRestClient;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Reservation> create(ReservationDraft draft) {
        return submit("create", () -> backendRestClient.post()
                .uri(RESERVATIONS_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .body(draft)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (request, response) -> rejectWith(response, "create"))
                .body(Reservation.class));
    }

    @Override
    public CompletableFuture<Reservation> update(String reservationId, ReservationPatch patch) {
        return submit("update", () -> backendRestClient.patch()
                .uri(RESERVATIONS_PATH + "/{id}", reservationId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(patch)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (request, response) -> rejectWith(response, "update"))
                .body(Reservation.class));
    }

    @Override
    public CompletableFuture<Boolean> delete(String reservationId) {
        return submit("delete", () -> backendRestClient.delete()
                .uri(RESERVATIONS_PATH + "/{id}", reservationId)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (request, response) -> rejectWith(response, "delete"))
                .toBodilessEntity()
                .getStatusCode()
                .is2xxSuccessful());
    }

    @Override
    public CompletableFuture<Reservation> toggleField(String reservationId, String field) {
        return submit("toggle", () -> backendRestClient.post()
                .uri(RESERVATIONS_PATH + "/{id}/toggle/{field}", reservationId, field)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (request, response) -> rejectWith(response, "toggle"))
                .body(Reservation.class));
    }

    private <T> CompletableFuture<T> submit(String action, Supplier<T> call) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return circuitBreaker.executeSupplier(call);
            } catch (CallNotPermittedException e) {
                log.warn("Reservation backend circuit is open: action={}", action);
                throw MutationFailedException.network("Reservation backend circuit is open", e);
            } catch (RestClientException e) {
                log.error("Reservation backend unreachable: action={}, error={}", action, e.getMessage());
                throw MutationFailedException.network("Reservation backend unreachable: " + e.getMessage(), e);
            }
        }, executor);
    }

    private void rejectWith(ClientHttpResponse response, String action) throws IOException {
        HttpStatusCode status = response.getStatusCode();
        log.warn("Reservation backend rejected mutation: action={}, status={}", action, status);
        throw MutationFailedException.of(ErrorCode.fromClientError(status),
                String.format("Reservation backend rejected %s: status=%d", action, status.value()));
    }
}
