package com.benzaiten.shared.security.exception;

import lombok.Getter;

import java.util.Set;

/**
 * API Key 저장소 호출 실패
 */
@Getter
public class KeyRecordStoreException extends RuntimeException {

    private static final Set<String> THROTTLING_CODES = Set.of(
            "ProvisionedThroughputExceededException",
            "RequestLimitExceeded"
    );
    private static final Set<String> UNAUTHORIZED_CODES = Set.of("UnauthorizedOperation");

    public enum Reason {
        /** 처리량 초과 - 호출 측 재시도 가능 */
        THROTTLED,
        /** 저장소 접근 권한 없음 */
        UNAUTHORIZED,
        /** 그 외 모든 실패 */
        FAILURE
    }

    private final Reason reason;
    private final String errorCode;

    public KeyRecordStoreException(Reason reason, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.errorCode = errorCode;
    }

    /**
     * 저장소 에러 코드로부터 예외를 생성합니다.
     *
     * @param errorCode 저장소가 반환한 에러 코드 (예: "RequestLimitExceeded"), 없으면 null
     * @param operation 실패한 작업 이름 (예: "GetItem")
     */
    public static KeyRecordStoreException fromErrorCode(String errorCode, String operation, Throwable cause) {
        return new KeyRecordStoreException(classify(errorCode), errorCode,
                "Error getting api key: " + errorCode + ":" + operation, cause);
    }

    public static Reason classify(String errorCode) {
        if (errorCode == null) {
            return Reason.FAILURE;
        }
        if (THROTTLING_CODES.contains(errorCode)) {
            return Reason.THROTTLED;
        }
        if (UNAUTHORIZED_CODES.contains(errorCode)) {
            return Reason.UNAUTHORIZED;
        }
        return Reason.FAILURE;
    }
}
