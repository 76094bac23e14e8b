package com.benzaiten.shared.security;

import com.benzaiten.shared.response.ApiResponse;
import com.benzaiten.shared.response.ApiStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuthorizationDecision 단위 테스트")
class AuthorizationDecisionTest {

    @Test
    @DisplayName("상태만 주면 상태의 기본 본문을 사유로 사용")
    void of_DefaultReason() {
        AuthorizationDecision decision = AuthorizationDecision.of(ApiStatus.EXPIRED_KEY);

        assertThat(decision.getReason()).isEqualTo("Expired API Key");
        assertThat(decision.getStatusCode()).isEqualTo(403);
        assertThat(decision.isGranted()).isFalse();
    }

    @Test
    @DisplayName("200 상태만 허용으로 판단")
    void isGranted() {
        assertThat(AuthorizationDecision.of(ApiStatus.ACCESS_GRANTED).isGranted()).isTrue();
        assertThat(AuthorizationDecision.of(ApiStatus.FORBIDDEN).isGranted()).isFalse();
    }

    @Test
    @DisplayName("상태와 사유가 같으면 같은 판단")
    void equals_SameStatusAndReason() {
        assertThat(new AuthorizationDecision(ApiStatus.FORBIDDEN, "Forbidden"))
                .isEqualTo(AuthorizationDecision.of(ApiStatus.FORBIDDEN))
                .hasSameHashCodeAs(AuthorizationDecision.of(ApiStatus.FORBIDDEN));
        assertThat(new AuthorizationDecision(ApiStatus.FORBIDDEN, "other"))
                .isNotEqualTo(AuthorizationDecision.of(ApiStatus.FORBIDDEN));
    }

    @Test
    @DisplayName("응답 변환 시 사유를 본문으로 사용")
    void toResponse() {
        ApiResponse response = new AuthorizationDecision(ApiStatus.BAD_REQUEST, "Invalid signature").toResponse();

        assertThat(response.getStatusCode()).isEqualTo(400);
        assertThat(response.getBodyAsString()).isEqualTo("Invalid signature");
    }
}
