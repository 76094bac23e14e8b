package com.benzaiten.metrics.ingest.publisher;

import com.benzaiten.metrics.ingest.exception.MetricPublishException;
import com.benzaiten.metrics.ingest.model.Metric;

/**
 * 수락된 메트릭을 후속 처리로 넘기는 포트
 */
public interface MetricSink {

    /**
     * @throws MetricPublishException 전달 실패
     */
    void publish(Metric metric);
}
