package com.benzaiten.metrics.common.config;

import com.benzaiten.shared.security.ApiKeyAuthorizer;
import com.benzaiten.shared.security.KeyRecordStore;
import com.benzaiten.shared.security.RsaSignatureVerifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * API Key 인가기 설정
 */
@Configuration
public class AuthorizerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RsaSignatureVerifier rsaSignatureVerifier() {
        return new RsaSignatureVerifier();
    }

    @Bean
    public ApiKeyAuthorizer apiKeyAuthorizer(KeyRecordStore keyRecordStore,
                                             RsaSignatureVerifier rsaSignatureVerifier,
                                             Clock clock) {
        return new ApiKeyAuthorizer(keyRecordStore, rsaSignatureVerifier, clock);
    }
}
