package com.benzaiten.metrics.ingest.exception;

import lombok.Getter;

/**
 * 같은 요청에 동일한 메트릭(MSK + metric_date)이 두 번 포함된 경우
 */
@Getter
public class DuplicateMetricException extends RuntimeException {

    private final String metricSystemKey;

    public DuplicateMetricException(String metricSystemKey) {
        super("Metric " + metricSystemKey + " already exists");
        this.metricSystemKey = metricSystemKey;
    }
}
