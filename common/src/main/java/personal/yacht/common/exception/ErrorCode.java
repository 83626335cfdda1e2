package personal.yacht.common.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (1xxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C002", "서버 내부 오류가 발생했습니다."),

    // Reservation Domain (2xxx)
    RESERVATION_NOT_FOUND(HttpStatus.NOT_FOUND, "R001", "예약을 찾을 수 없습니다."),
    RESERVATION_VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "R002", "예약 정보가 올바르지 않습니다."),
    BOOKING_CONFLICT(HttpStatus.CONFLICT, "R003", "요청한 기간에 겹치는 예약이 있습니다."),
    DUPLICATE_RESERVATION(HttpStatus.CONFLICT, "R004", "이미 존재하는 예약 ID입니다."),

    // Mutation API (3xxx)
    MUTATION_REJECTED(HttpStatus.UNPROCESSABLE_ENTITY, "M001", "예약 백엔드가 요청을 거부했습니다."),
    MUTATION_CONFLICT(HttpStatus.CONFLICT, "M002", "예약 백엔드에서 충돌이 발생했습니다."),
    MUTATION_FORBIDDEN(HttpStatus.FORBIDDEN, "M003", "예약 변경 권한이 없습니다."),
    BACKEND_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "M004", "예약 백엔드에 연결할 수 없습니다."),

    // Offline Queue (4xxx)
    QUEUE_FULL(HttpStatus.TOO_MANY_REQUESTS, "Q001", "오프라인 대기열이 가득 찼습니다."),
    QUEUE_STORE_FULL(HttpStatus.INSUFFICIENT_STORAGE, "Q002", "대기열 저장소 용량을 초과했습니다."),
    QUEUE_STORE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "Q003", "대기열 저장소에 기록할 수 없습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    /**
     * 백엔드 4xx 응답 상태를 변경 실패 코드로 변환
     * 401/403 → 권한, 409 → 충돌, 그 외 → 검증 실패
     */
    public static ErrorCode fromClientError(HttpStatusCode status) {
        int value = status.value();
        if (value == HttpStatus.UNAUTHORIZED.value() || value == HttpStatus.FORBIDDEN.value()) {
            return MUTATION_FORBIDDEN;
        }
        if (value == HttpStatus.CONFLICT.value()) {
            return MUTATION_CONFLICT;
        }
        return MUTATION_REJECTED;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
