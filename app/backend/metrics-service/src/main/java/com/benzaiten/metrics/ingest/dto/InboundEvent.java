package com.benzaiten.metrics.ingest.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * API Gateway 프록시 통합 이벤트 (검증 전, 신뢰할 수 없는 입력)
 *
 * 사용하지 않는 필드(requestContext, multiValueHeaders 등)는 무시합니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundEvent {

    /**
     * API Gateway 리소스 (예: "metric")
     */
    private String resource;

    private String httpMethod;

    /**
     * 요청 본문 (base64 인코딩일 수 있음)
     */
    private String body;

    @JsonProperty("isBase64Encoded")
    private boolean base64Encoded;

    private Map<String, String> queryStringParameters;

    /**
     * Host, X-Bztn-Key, X-Bztn-Sign 포함
     */
    private Map<String, String> headers;
}
