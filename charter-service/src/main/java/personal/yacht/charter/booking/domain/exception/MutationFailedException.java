package personal.yacht.charter.booking.domain.exception;

import personal.yacht.common.exception.BusinessException;
import personal.yacht.common.exception.ErrorCode;

/**
 * Mutation Failed Exception
 * 예약 백엔드가 변경을 거부했거나 수행하지 못한 경우
 * 네트워크 유형만 재시도 대상이다.
 */
public class MutationFailedException extends BusinessException {

    private final Kind kind;

    public MutationFailedException(Kind kind, String message) {
        super(kind.errorCode, message);
        this.kind = kind;
    }

    public MutationFailedException(Kind kind, String message, Throwable cause) {
        super(kind.errorCode, message, cause);
        this.kind = kind;
    }

    public static MutationFailedException of(ErrorCode errorCode, String message) {
        return new MutationFailedException(Kind.from(errorCode), message);
    }

    public static MutationFailedException network(String message, Throwable cause) {
        return new MutationFailedException(Kind.NETWORK, message, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind == Kind.NETWORK;
    }

    public enum Kind {
        VALIDATION(ErrorCode.MUTATION_REJECTED),
        CONFLICT(ErrorCode.MUTATION_CONFLICT),
        NETWORK(ErrorCode.BACKEND_UNAVAILABLE),
        PERMISSION(ErrorCode.MUTATION_FORBIDDEN);

        private final ErrorCode errorCode;

        Kind(ErrorCode errorCode) {
            this.errorCode = errorCode;
        }

        static Kind from(ErrorCode errorCode) {
            for (Kind kind : values()) {
                if (kind.errorCode == errorCode) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Not a mutation error code: " + errorCode);
        }
    }
}
