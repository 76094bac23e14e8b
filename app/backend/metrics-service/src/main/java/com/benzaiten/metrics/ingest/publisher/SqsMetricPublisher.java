package com.benzaiten.metrics.ingest.publisher;

import com.benzaiten.metrics.common.config.BenzaitenProperties;
import com.benzaiten.metrics.ingest.exception.MetricPublishException;
import com.benzaiten.metrics.ingest.model.Metric;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

import java.time.Clock;

/**
 * 메트릭 SQS 발행
 * metrics-service -> 메트릭 저장 처리기 (메트릭당 메시지 1개)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SqsMetricPublisher implements MetricSink {

    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;
    private final BenzaitenProperties properties;
    private final Clock clock;

    private volatile String queueUrl;

    @Override
    public void publish(Metric metric) {
        String messageBody;
        try {
            messageBody = objectMapper.writeValueAsString(metric.toMessage(clock));
        } catch (JsonProcessingException e) {
            throw new MetricPublishException("Failed to serialize metric " + metric.getMetricSystemKey(), e);
        }

        try {
            SendMessageRequest request = SendMessageRequest.builder()
                    .queueUrl(getQueueUrl())
                    .messageBody(messageBody)
                    .build();

            SendMessageResponse response = sqsClient.sendMessage(request);
            log.debug("Published metric to SQS: msk={}, messageId={}",
                    metric.getMetricSystemKey(), response.messageId());

        } catch (SdkException e) {
            log.error("Failed to publish metric to queue: {}", properties.getSqs().getMetricQueue(), e);
            throw new MetricPublishException("Failed to publish metric " + metric.getMetricSystemKey(), e);
        }
    }

    /**
     * 큐 이름으로부터 큐 URL을 가져옵니다 (최초 1회 조회)
     * 설정 값이 전체 URL인 경우 그대로 사용
     */
    private String getQueueUrl() {
        String cached = queueUrl;
        if (cached != null) {
            return cached;
        }

        String queueName = properties.getSqs().getMetricQueue();
        if (queueName.startsWith("https://") || queueName.startsWith("http://")) {
            queueUrl = queueName;
            return queueName;
        }

        String resolved = sqsClient.getQueueUrl(GetQueueUrlRequest.builder()
                .queueName(queueName)
                .build()).queueUrl();
        log.debug("Queue URL for {}: {}", queueName, resolved);
        queueUrl = resolved;
        return resolved;
    }
}
