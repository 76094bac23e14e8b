package com.benzaiten.metrics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Metrics Service Application
 * 위치별 메트릭 수집 API (PUT /metric) - API Key 서명 검증 후 SQS로 전달
 */
@SpringBootApplication
public class MetricsServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MetricsServiceApplication.class, args);
    }
}
