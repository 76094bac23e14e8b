package com.benzaiten.shared.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * API 호출에 대한 응답
 *
 * <p>API Gateway 프록시 통합 응답 형식
 * {@code {isBase64Encoded, statusCode, headers, body}}으로 변환할 수 있습니다.
 * 본문은 문자열 또는 바이트 배열입니다.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public class ApiResponse {

    private final int statusCode;
    private final Map<String, String> headers;

    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    private final byte[] body;

    /**
     * 본문이 바이트로 주어졌는지 여부 (문자열 본문이면 false)
     */
    private final boolean binary;

    private ApiResponse(int statusCode, Map<String, String> headers, byte[] body, boolean binary) {
        this.statusCode = statusCode;
        this.headers = headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body == null ? new byte[0] : body;
        this.binary = binary;
    }

    public static ApiResponse of(ApiStatus status) {
        return of(status, status.getBody());
    }

    public static ApiResponse of(ApiStatus status, String body) {
        return of(status.getCode(), Collections.emptyMap(), body);
    }

    public static ApiResponse of(int statusCode, Map<String, String> headers, String body) {
        return new ApiResponse(statusCode, headers,
                body == null ? null : body.getBytes(StandardCharsets.UTF_8), false);
    }

    public static ApiResponse ofBytes(int statusCode, Map<String, String> headers, byte[] body) {
        return new ApiResponse(statusCode, headers, body == null ? null : body.clone(), true);
    }

    /**
     * 2xx 응답인지 확인
     */
    public boolean isOk() {
        return statusCode / 100 == 2;
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public byte[] getBodyBytes() {
        return body.clone();
    }

    /**
     * 같은 상태 코드로 헤더만 교체한 응답을 반환합니다.
     */
    public ApiResponse withHeaders(Map<String, String> newHeaders) {
        return new ApiResponse(statusCode, newHeaders, body, binary);
    }

    /**
     * 객체(Map, DTO)를 JSON 문자열로 직렬화하여 본문으로 설정한 응답을 반환합니다.
     *
     * @param objectMapper 직렬화에 사용할 ObjectMapper
     * @param value        본문으로 변환할 객체
     */
    public ApiResponse withJsonBody(ObjectMapper objectMapper, Object value) {
        try {
            return of(statusCode, headers, objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize response body", e);
        }
    }

    public Map<String, Object> render() {
        return render(false);
    }

    /**
     * Lambda 프록시 통합 응답 Map을 생성합니다.
     *
     * <p>바이트 본문이 이미 base64 문자열이면 isBase64Encoded=true로 표시합니다.
     * encodeBase64=true인 경우 본문(문자열은 UTF-8)을 base64로 인코딩합니다.</p>
     *
     * @param encodeBase64 본문을 base64로 인코딩할지 여부
     * @return {isBase64Encoded, statusCode, headers, body}
     */
    public Map<String, Object> render(boolean encodeBase64) {
        boolean base64Encoded = binary && isCanonicalBase64(body);

        String renderedBody;
        if (encodeBase64) {
            renderedBody = Base64.getEncoder().encodeToString(body);
            base64Encoded = true;
        } else {
            renderedBody = getBodyAsString();
        }

        Map<String, Object> rendered = new LinkedHashMap<>();
        rendered.put("isBase64Encoded", base64Encoded);
        rendered.put("statusCode", statusCode);
        rendered.put("headers", headers);
        rendered.put("body", renderedBody);
        return rendered;
    }

    private static boolean isCanonicalBase64(byte[] value) {
        try {
            return Arrays.equals(Base64.getEncoder().encode(Base64.getDecoder().decode(value)), value);
        } catch (IllegalArgumentException e) {
            // base64 알파벳/패딩이 아니면 원문 바이트로 취급
            return false;
        }
    }
}
