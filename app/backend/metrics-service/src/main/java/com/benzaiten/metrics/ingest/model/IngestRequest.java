package com.benzaiten.metrics.ingest.model;

import com.benzaiten.metrics.ingest.exception.DuplicateMetricException;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 검증이 끝난 메트릭 수집 요청
 */
@Getter
@ToString
public class IngestRequest {

    private final String apiKey;

    @ToString.Exclude
    private final String signature;

    private final String location;

    /**
     * 서명 대상 메시지 (요청 본문 원본 바이트, base64 디코딩 후)
     */
    @ToString.Exclude
    private final byte[] message;

    private final Map<String, String> headers;

    private final String method;

    private final String host;

    @Getter(AccessLevel.NONE)
    private final Set<Metric> metrics = new LinkedHashSet<>();

    @Builder
    private IngestRequest(String apiKey, String signature, String location, byte[] message,
                          Map<String, String> headers, String method, String host) {
        this.apiKey = apiKey;
        this.signature = signature;
        this.location = location;
        this.message = message;
        this.headers = headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.method = method;
        this.host = host;
    }

    /**
     * 메트릭을 추가합니다.
     *
     * @param metric 추가할 메트릭
     * @throws DuplicateMetricException 같은 식별자의 메트릭이 이미 있는 경우 (덮어쓰지 않음)
     */
    public void add(Metric metric) {
        if (metrics.contains(metric)) {
            throw new DuplicateMetricException(metric.getMetricSystemKey());
        }
        metrics.add(metric);
    }

    public Set<Metric> getMetrics() {
        return Collections.unmodifiableSet(metrics);
    }
}
