package com.benzaiten.shared.dto.sqs;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Metrics PUT API가 수락한 메트릭 1건에 대한 SQS 메시지
 *
 * 발행: metrics-service (메트릭당 1개 메시지)
 * 소비: 메트릭 저장 처리기
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"metric_name", "time_span", "location_name", "metric_date",
        "metric_value", "metric_source", "msg_send_date_utc"})
public class MetricMessage {

    @JsonProperty("metric_name")
    private String metricName;

    /**
     * 집계 구간 (예: "5min", "1h")
     */
    @JsonProperty("time_span")
    private String timeSpan;

    @JsonProperty("location_name")
    private String locationName;

    /**
     * 측정 시각 (UTC)
     */
    @JsonProperty("metric_date")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime metricDate;

    @JsonProperty("metric_value")
    private BigDecimal metricValue;

    @JsonProperty("metric_source")
    private String metricSource;

    /**
     * 메시지 발송 시각 (UTC, 서버 기준)
     */
    @JsonProperty("msg_send_date_utc")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime msgSendDateUtc;
}
