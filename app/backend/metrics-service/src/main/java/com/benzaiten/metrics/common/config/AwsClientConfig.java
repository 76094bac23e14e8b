package com.benzaiten.metrics.common.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.sqs.SqsClient;

import java.net.URI;

/**
 * AWS 클라이언트 설정
 *
 * API Key 조회용 DynamoDB와 메트릭 발행용 SQS 클라이언트를 같은 리전과 자격 증명으로 생성합니다.
 * 서비스별 endpoint가 지정되면 LocalStack 등으로 연결합니다.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(BenzaitenProperties.class)
public class AwsClientConfig {

    @Value("${aws.region:ap-northeast-2}")
    private String awsRegion;

    @Value("${aws.dynamodb.endpoint:}")
    private String dynamoDbEndpoint;

    @Value("${aws.sqs.endpoint:}")
    private String sqsEndpoint;

    @Bean
    public DynamoDbClient dynamoDbClient() {
        // 처리량 초과는 503으로 응답하고 재시도는 호출 측에 맡김
        ClientOverrideConfiguration noRetry = ClientOverrideConfiguration.builder()
                .retryPolicy(RetryPolicy.none())
                .build();

        return configure(DynamoDbClient.builder(), "DynamoDB", dynamoDbEndpoint)
                .overrideConfiguration(noRetry)
                .build();
    }

    @Bean
    public SqsClient sqsClient() {
        return configure(SqsClient.builder(), "SQS", sqsEndpoint).build();
    }

    private <B extends AwsClientBuilder<B, ?>> B configure(B builder, String service, String endpoint) {
        builder.region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create());

        if (endpoint == null || endpoint.isBlank()) {
            log.info("{} client: region={}, endpoint=default", service, awsRegion);
        } else {
            log.info("{} client: region={}, endpoint={}", service, awsRegion, endpoint);
            builder.endpointOverride(URI.create(endpoint));
        }
        return builder;
    }
}
