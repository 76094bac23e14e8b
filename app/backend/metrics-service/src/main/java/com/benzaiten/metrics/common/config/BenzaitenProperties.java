package com.benzaiten.metrics.common.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Benzaiten API 설정 프로퍼티
 *
 * application.yml의 benzaiten 설정을 애플리케이션 시작 시 한 번 바인딩하고 필수 값을 검증합니다.
 * 비즈니스 로직은 환경 변수를 직접 읽지 않고 이 객체를 주입받아 사용합니다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "benzaiten")
public class BenzaitenProperties {

    @Valid
    private Api api = new Api();

    @Valid
    private Dynamodb dynamodb = new Dynamodb();

    @Valid
    private Sqs sqs = new Sqs();

    @Getter
    @Setter
    public static class Api {

        /**
         * API Gateway 리소스 이름
         * 환경 변수: BENZAITEN_RESOURCE
         */
        @NotBlank
        private String resourceName = "metric";

        /**
         * 요청 본문 최대 크기 (바이트, 미만이어야 함)
         * 환경 변수: BENZAITEN_MAX_BODY
         * 기본값: 20 MiB
         */
        @Positive
        private long maxBodyBytes = 20L * 1024 * 1024;
    }

    @Getter
    @Setter
    public static class Dynamodb {

        /**
         * API Key 테이블 이름
         * 환경 변수: DYNAMODB_TABLE
         */
        @NotBlank(message = "DYNAMODB_TABLE must be configured. Please check your .env file.")
        private String tableName = "benzaiten_api_keys";
    }

    @Getter
    @Setter
    public static class Sqs {

        /**
         * 수락된 메트릭을 전달할 큐 (이름 또는 전체 URL)
         * 환경 변수: SQS_DESTINATION
         */
        @NotBlank(message = "SQS_DESTINATION must be configured. Please check your .env file.")
        private String metricQueue;
    }
}
