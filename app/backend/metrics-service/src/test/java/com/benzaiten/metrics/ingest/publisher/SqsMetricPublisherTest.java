package com.benzaiten.metrics.ingest.publisher;

import com.benzaiten.metrics.common.config.BenzaitenProperties;
import com.benzaiten.metrics.ingest.exception.MetricPublishException;
import com.benzaiten.metrics.ingest.model.Metric;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;
import software.amazon.awssdk.services.sqs.model.SqsException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

@ExtendWith(MockitoExtension.class)
@DisplayName("SqsMetricPublisher 단위 테스트")
class SqsMetricPublisherTest {

    private static final String QUEUE_URL = "http://localhost:4566/000000000000/benzaiten-metrics-queue";

    @Mock
    private SqsClient sqsClient;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private BenzaitenProperties properties;
    private SqsMetricPublisher publisher;

    private final Metric metric = Metric.builder()
            .metricName("temperature")
            .timeSpan("5min")
            .locationName("loc1")
            .metricDate(LocalDateTime.of(2021, 6, 2, 12, 0, 0))
            .metricValue(new BigDecimal("21.5"))
            .metricSource("sensor")
            .build();

    @BeforeEach
    void setUp() {
        properties = new BenzaitenProperties();
        properties.getSqs().setMetricQueue("benzaiten-metrics-queue");
        Clock clock = Clock.fixed(Instant.parse("2021-06-02T12:30:00Z"), ZoneOffset.UTC);
        publisher = new SqsMetricPublisher(sqsClient, objectMapper, properties, clock);
    }

    @Test
    @DisplayName("큐 이름으로 URL을 한 번만 조회하고 메트릭마다 메시지 발송")
    void publish_ResolvesQueueUrlOnce() throws Exception {
        // Given
        given(sqsClient.getQueueUrl(any(GetQueueUrlRequest.class)))
                .willReturn(GetQueueUrlResponse.builder().queueUrl(QUEUE_URL).build());
        given(sqsClient.sendMessage(any(SendMessageRequest.class)))
                .willReturn(SendMessageResponse.builder().messageId("msg-1").build());

        // When
        publisher.publish(metric);
        publisher.publish(metric);

        // Then
        then(sqsClient).should(times(1)).getQueueUrl(any(GetQueueUrlRequest.class));
        ArgumentCaptor<SendMessageRequest> captor = ArgumentCaptor.forClass(SendMessageRequest.class);
        then(sqsClient).should(times(2)).sendMessage(captor.capture());

        SendMessageRequest request = captor.getValue();
        assertThat(request.queueUrl()).isEqualTo(QUEUE_URL);

        JsonNode body = objectMapper.readTree(request.messageBody());
        assertThat(body.get("metric_name").asText()).isEqualTo("temperature");
        assertThat(body.get("time_span").asText()).isEqualTo("5min");
        assertThat(body.get("location_name").asText()).isEqualTo("loc1");
        assertThat(body.get("metric_date").asText()).isEqualTo("2021-06-02 12:00:00");
        assertThat(body.get("metric_value").decimalValue()).isEqualByComparingTo("21.5");
        assertThat(body.get("metric_source").asText()).isEqualTo("sensor");
        assertThat(body.get("msg_send_date_utc").asText()).isEqualTo("2021-06-02 12:30:00");
    }

    @Test
    @DisplayName("설정 값이 URL이면 조회 없이 그대로 사용")
    void publish_QueueUrlConfigured() {
        properties.getSqs().setMetricQueue(QUEUE_URL);
        given(sqsClient.sendMessage(any(SendMessageRequest.class)))
                .willReturn(SendMessageResponse.builder().messageId("msg-1").build());

        publisher.publish(metric);

        then(sqsClient).should(never()).getQueueUrl(any(GetQueueUrlRequest.class));
    }

    @Test
    @DisplayName("SQS 오류는 MetricPublishException")
    void publish_SqsFailure() {
        properties.getSqs().setMetricQueue(QUEUE_URL);
        given(sqsClient.sendMessage(any(SendMessageRequest.class)))
                .willThrow(SqsException.builder().message("Access denied").build());

        assertThatThrownBy(() -> publisher.publish(metric))
                .isInstanceOf(MetricPublishException.class)
                .hasMessageContaining("temperature@loc1#5min")
                .hasCauseInstanceOf(SqsException.class);
    }
}
