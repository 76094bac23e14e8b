package com.benzaiten.shared.response;

/**
 * Benzaiten API 응답 코드 목록
 *
 * <p>요청 검증, API Key 인가, 수집 처리에서 반환하는 모든 결과를 하나의 평면 목록으로 관리합니다.
 * 호출 측은 상태 코드를 직접 만들지 않고 항상 이 enum을 이름으로 참조합니다.</p>
 */
public enum ApiStatus {

    ACCESS_GRANTED(200, "Access Granted"),
    CREATED(201, "Created"),

    BAD_REQUEST(400, "Bad request"),
    UNAUTHORIZED(401, "Unauthorized"),
    FORBIDDEN(403, "Forbidden"),
    INVALID_KEY(403, "Invalid API Key"),
    EXPIRED_KEY(403, "Expired API Key"),
    METHOD_NOT_ALLOWED(405, "Method not accepted"),
    REQUEST_TOO_LARGE(413, "Message too big for being processed"),
    TEAPOT(418, "I'm a teapot"),
    BAD_MAPPING(421, "Bad mapping"),

    INTERNAL_SERVER_ERROR(500, "Internal Server Error"),
    SERVICE_UNAVAILABLE(503, "Service Unavailable"),
    NETWORK_AUTH_REQUIRED(511, "Network authentication required");

    private final int code;
    private final String body;

    ApiStatus(int code, String body) {
        this.code = code;
        this.body = body;
    }

    public int getCode() {
        return code;
    }

    /**
     * 기본 응답 본문
     */
    public String getBody() {
        return body;
    }

    public boolean isOk() {
        return code / 100 == 2;
    }
}
