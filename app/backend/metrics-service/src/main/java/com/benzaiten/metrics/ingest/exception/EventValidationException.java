package com.benzaiten.metrics.ingest.exception;

import com.benzaiten.shared.response.ApiResponse;
import lombok.Getter;

/**
 * 수신 이벤트 검증 실패
 *
 * 호출 측에 그대로 반환할 응답을 포함합니다.
 */
@Getter
public class EventValidationException extends RuntimeException {

    private final transient ApiResponse response;

    public EventValidationException(ApiResponse response) {
        super(requireResponse(response).getBodyAsString());
        this.response = response;
    }

    private static ApiResponse requireResponse(ApiResponse response) {
        if (response == null) {
            throw new IllegalArgumentException("Invalid type, got null instead of ApiResponse");
        }
        return response;
    }
}
