package com.benzaiten.metrics.ingest.exception;

/**
 * 메트릭을 큐로 전달하지 못한 경우
 */
public class MetricPublishException extends RuntimeException {

    public MetricPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
