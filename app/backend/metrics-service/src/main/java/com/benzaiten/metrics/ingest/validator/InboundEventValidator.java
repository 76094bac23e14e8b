package com.benzaiten.metrics.ingest.validator;

import com.benzaiten.metrics.common.config.BenzaitenProperties;
import com.benzaiten.metrics.ingest.dto.InboundEvent;
import com.benzaiten.metrics.ingest.exception.DuplicateMetricException;
import com.benzaiten.metrics.ingest.exception.EventValidationException;
import com.benzaiten.metrics.ingest.exception.MetricFormatException;
import com.benzaiten.metrics.ingest.model.IngestRequest;
import com.benzaiten.metrics.ingest.model.Metric;
import com.benzaiten.shared.response.ApiResponse;
import com.benzaiten.shared.response.ApiStatus;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * PUT /metric 이벤트 검증
 *
 * <p>검증 순서 (첫 번째 위반에서 중단):</p>
 * <ol>
 *   <li>리소스 이름 불일치 → 421</li>
 *   <li>PUT 이외의 메서드 → 405</li>
 *   <li>본문 크기 초과 → 413</li>
 *   <li>쿼리 파라미터 존재 → 400</li>
 *   <li>base64 디코딩 실패 → 400</li>
 *   <li>JSON 파싱 실패 → 400</li>
 *   <li>location_name, X-Bztn-Sign, X-Bztn-Key 누락 → 400</li>
 *   <li>metrics 누락 또는 배열 아님 → 400</li>
 *   <li>메트릭 항목 변환 실패 → 400</li>
 *   <li>중복 메트릭 → 400</li>
 * </ol>
 *
 * <p>외부 호출 없이 IngestRequest만 생성합니다.</p>
 */
@Slf4j
@Component
public class InboundEventValidator {

    public static final String ALLOWED_METHOD = "PUT";
    public static final String HOST_HEADER = "Host";
    public static final String KEY_HEADER = "X-Bztn-Key";
    public static final String SIGN_HEADER = "X-Bztn-Sign";
    public static final String LOCATION_FIELD = "location_name";
    public static final String METRICS_FIELD = "metrics";

    private final BenzaitenProperties properties;
    private final ObjectReader bodyReader;

    public InboundEventValidator(BenzaitenProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.bodyReader = objectMapper.readerFor(Map.class)
                .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS,
                        DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * 이벤트를 검증하고 IngestRequest로 변환합니다.
     *
     * @param event API Gateway 이벤트
     * @return 검증된 요청
     * @throws EventValidationException 검증 실패 (반환할 응답 포함)
     */
    public IngestRequest parse(InboundEvent event) {
        String resource = event.getResource();
        if (!properties.getApi().getResourceName().equals(resource)) {
            throw reject(ApiStatus.BAD_MAPPING, "Bad resource: " + resource);
        }

        String method = event.getHttpMethod();
        if (!ALLOWED_METHOD.equals(method)) {
            throw reject(ApiStatus.METHOD_NOT_ALLOWED, "Method " + method + " not allowed");
        }

        String body = event.getBody() == null ? "" : event.getBody();
        if (body.getBytes(StandardCharsets.UTF_8).length >= properties.getApi().getMaxBodyBytes()) {
            throw reject(ApiStatus.REQUEST_TOO_LARGE, ApiStatus.REQUEST_TOO_LARGE.getBody());
        }

        Map<String, String> queryStringParameters = event.getQueryStringParameters();
        if (queryStringParameters != null && !queryStringParameters.isEmpty()) {
            throw reject(ApiStatus.BAD_REQUEST,
                    "0 parameters expected, got " + queryStringParameters.size());
        }

        byte[] message = decodeBody(body, event.isBase64Encoded());
        Map<String, Object> document = readDocument(message);

        Map<String, String> headers = event.getHeaders() == null ? Map.of() : event.getHeaders();
        Map<String, String> lookup = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        lookup.putAll(headers);

        Object location = document.get(LOCATION_FIELD);
        String signature = lookup.get(SIGN_HEADER);
        String apiKey = lookup.get(KEY_HEADER);
        if (!(location instanceof String) || signature == null || apiKey == null) {
            log.error("Invalid key: location_name={}, {}={}, {}={}", location,
                    SIGN_HEADER, signature != null, KEY_HEADER, apiKey != null);
            throw reject(ApiStatus.BAD_REQUEST, ApiStatus.BAD_REQUEST.getBody());
        }

        Object metrics = document.get(METRICS_FIELD);
        if (!(metrics instanceof List)) {
            throw reject(ApiStatus.BAD_REQUEST, "Metrics list is empty or not iterable");
        }
        List<?> entries = (List<?>) metrics;

        IngestRequest request = IngestRequest.builder()
                .apiKey(apiKey)
                .signature(signature)
                .location((String) location)
                .message(message)
                .headers(headers)
                .method(method)
                .host(lookup.get(HOST_HEADER))
                .build();

        for (Object entry : entries) {
            Metric metric = toMetric(entry, (String) location);
            try {
                request.add(metric);
            } catch (DuplicateMetricException e) {
                log.error(e.getMessage());
                throw reject(ApiStatus.BAD_REQUEST, e.getMessage());
            }
        }

        return request;
    }

    private byte[] decodeBody(String body, boolean base64Encoded) {
        if (!base64Encoded) {
            return body.getBytes(StandardCharsets.UTF_8);
        }
        try {
            return Base64.getMimeDecoder().decode(body);
        } catch (IllegalArgumentException e) {
            log.error("Invalid base64 body: {}", e.getMessage());
            throw reject(ApiStatus.BAD_REQUEST, "Invalid base64 body");
        }
    }

    private Map<String, Object> readDocument(byte[] message) {
        try {
            Map<String, Object> document = bodyReader.readValue(message);
            if (document == null) {
                throw reject(ApiStatus.BAD_REQUEST, "Invalid JSon object");
            }
            return document;
        } catch (IOException e) {
            log.error("Invalid JSon object: {}", e.getMessage());
            throw reject(ApiStatus.BAD_REQUEST, "Invalid JSon object");
        }
    }

    private Metric toMetric(Object entry, String location) {
        try {
            if (!(entry instanceof Map)) {
                throw new MetricFormatException(MetricFormatException.Violation.TYPE, null,
                        "metric entry should be an object");
            }
            @SuppressWarnings("unchecked")
            Map<String, ?> typed = (Map<String, ?>) entry;
            return Metric.fromEntry(typed, location);
        } catch (MetricFormatException e) {
            String message = "Invalid metric: " + entry;
            log.error("{} ({})", message, e.getMessage());
            throw reject(ApiStatus.BAD_REQUEST, message);
        }
    }

    private static EventValidationException reject(ApiStatus status, String body) {
        return new EventValidationException(ApiResponse.of(status, body));
    }
}
