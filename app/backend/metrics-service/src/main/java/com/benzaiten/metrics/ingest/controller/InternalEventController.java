package com.benzaiten.metrics.ingest.controller;

import com.benzaiten.metrics.ingest.dto.InboundEvent;
import com.benzaiten.metrics.ingest.service.MetricIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 내부용 이벤트 처리 컨트롤러 (Lambda 프록시 통합 등 내부 호출 전용)
 *
 * API Gateway 프록시 이벤트를 그대로 받아 프록시 응답 형식으로 반환합니다.
 */
@Slf4j
@RestController
@RequestMapping("/internal/v1/events")
@RequiredArgsConstructor
public class InternalEventController {

    private final MetricIngestionService metricIngestionService;

    @PostMapping
    @Operation(summary = "프록시 이벤트 처리", description = "API Gateway 프록시 이벤트를 처리하고 {isBase64Encoded, statusCode, headers, body}를 반환 (내부용)")
    public ResponseEntity<Map<String, Object>> handleEvent(@RequestBody InboundEvent event) {
        log.info("POST /internal/v1/events - {} {}", event.getHttpMethod(), event.getResource());
        return ResponseEntity.ok(metricIngestionService.handle(event).render());
    }
}
