package com.benzaiten.shared.security;

import com.benzaiten.shared.response.ApiResponse;
import com.benzaiten.shared.response.ApiStatus;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * API Key 인가 결과
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class AuthorizationDecision {

    private final ApiStatus status;

    /**
     * 사람이 읽을 수 있는 사유 (기본값: 상태의 기본 본문)
     */
    private final String reason;

    public static AuthorizationDecision of(ApiStatus status) {
        return new AuthorizationDecision(status, status.getBody());
    }

    public boolean isGranted() {
        return status.isOk();
    }

    public int getStatusCode() {
        return status.getCode();
    }

    public ApiResponse toResponse() {
        return ApiResponse.of(status, reason);
    }
}
