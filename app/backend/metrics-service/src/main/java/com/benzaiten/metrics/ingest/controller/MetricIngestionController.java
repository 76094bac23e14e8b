package com.benzaiten.metrics.ingest.controller;

import com.benzaiten.metrics.ingest.dto.InboundEvent;
import com.benzaiten.metrics.ingest.service.MetricIngestionService;
import com.benzaiten.shared.response.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 메트릭 수집 API
 *
 * HTTP 요청을 API Gateway 프록시 이벤트 형태로 변환하여 처리합니다.
 * 메서드/리소스 검증은 서비스에서 수행하므로 모든 메서드를 받습니다.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class MetricIngestionController {

    private final MetricIngestionService metricIngestionService;

    /**
     * 메트릭 수집
     *
     * PUT /metric
     * X-Bztn-Key: API Key
     * X-Bztn-Sign: 요청 본문 서명 (base64)
     */
    @RequestMapping("/{resource}")
    @Operation(summary = "메트릭 수집", description = "서명된 메트릭 배열을 수집합니다. PUT /metric만 허용")
    public ResponseEntity<byte[]> ingest(
            @Parameter(description = "리소스 이름 (metric)") @PathVariable String resource,
            @RequestBody(required = false) byte[] body,
            HttpServletRequest request
    ) {
        log.info("{} /{} - Metrics ingestion requested", request.getMethod(), resource);

        InboundEvent event = toEvent(resource, body, request);
        ApiResponse response = metricIngestionService.handle(event);

        HttpHeaders headers = new HttpHeaders();
        response.getHeaders().forEach(headers::add);
        return ResponseEntity.status(response.getStatusCode())
                .headers(headers)
                .body(response.getBodyBytes());
    }

    private static InboundEvent toEvent(String resource, byte[] body, HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        Enumeration<String> names = request.getHeaderNames();
        while (names.hasMoreElements()) {
            String name = names.nextElement();
            headers.put(name, request.getHeader(name));
        }

        Map<String, String> queryStringParameters = null;
        if (request.getQueryString() != null && !request.getQueryString().isEmpty()) {
            queryStringParameters = UriComponentsBuilder.newInstance()
                    .query(request.getQueryString())
                    .build()
                    .getQueryParams()
                    .toSingleValueMap();
        }

        byte[] raw = body == null ? new byte[0] : body;
        String text = decodeUtf8(raw);

        return InboundEvent.builder()
                .resource(resource)
                .httpMethod(request.getMethod())
                .body(text != null ? text : Base64.getEncoder().encodeToString(raw))
                .base64Encoded(text == null)
                .queryStringParameters(queryStringParameters)
                .headers(headers)
                .build();
    }

    /**
     * UTF-8 텍스트가 아니면 null (바이너리 본문은 base64로 전달)
     */
    private static String decodeUtf8(byte[] raw) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }
}
