package com.benzaiten.metrics.ingest.service;

import com.benzaiten.metrics.ingest.dto.InboundEvent;
import com.benzaiten.metrics.ingest.exception.EventValidationException;
import com.benzaiten.metrics.ingest.exception.MetricPublishException;
import com.benzaiten.metrics.ingest.model.IngestRequest;
import com.benzaiten.metrics.ingest.model.Metric;
import com.benzaiten.metrics.ingest.publisher.MetricSink;
import com.benzaiten.metrics.ingest.validator.InboundEventValidator;
import com.benzaiten.shared.response.ApiResponse;
import com.benzaiten.shared.response.ApiStatus;
import com.benzaiten.shared.security.ApiKeyAuthorizer;
import com.benzaiten.shared.security.AuthorizationDecision;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 메트릭 수집 처리
 *
 * 이벤트 검증 → API Key 인가 → 메트릭 큐 전달 순서로 진행하며,
 * 어떤 단계에서 실패하더라도 예외 대신 응답을 반환합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricIngestionService {

    private final InboundEventValidator validator;
    private final ApiKeyAuthorizer authorizer;
    private final MetricSink metricSink;
    private final ObjectMapper objectMapper;

    /**
     * @param event API Gateway 이벤트
     * @return 201 (processed 개수 포함) 또는 실패 응답
     */
    public ApiResponse handle(InboundEvent event) {
        log.info("Parsing Event...");
        IngestRequest request;
        try {
            request = validator.parse(event);
        } catch (EventValidationException e) {
            log.error("Error parsing: {}", e.getResponse().getBodyAsString());
            return e.getResponse();
        }

        log.info("Checking permissions...");
        AuthorizationDecision decision = authorizer.decide(
                request.getApiKey(),
                request.getMessage(),
                request.getSignature(),
                request.getLocation(),
                request.getMethod()
        );

        if (!decision.isGranted()) {
            log.error("Access denied: {}", decision.getReason());
            return decision.toResponse();
        }

        log.info("Sending metrics");
        try {
            for (Metric metric : request.getMetrics()) {
                metricSink.publish(metric);
            }
        } catch (MetricPublishException e) {
            log.error("Failed to send metrics: {}", e.getMessage(), e);
            return ApiResponse.of(ApiStatus.INTERNAL_SERVER_ERROR);
        }

        log.info("Done");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("processed", request.getMetrics().size());

        return ApiResponse.of(ApiStatus.CREATED.getCode(), Map.of("X-Bztn-Key", request.getApiKey()), "")
                .withJsonBody(objectMapper, body);
    }
}
