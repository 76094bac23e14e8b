package com.benzaiten.metrics.common.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI 설정
 * API Key(X-Bztn-Key)와 메시지 서명(X-Bztn-Sign) 헤더를 보안 스킴으로 표시
 */
@Configuration
public class OpenApiConfig {

    @Value("${springdoc.server.url:/}")
    private String serverUrl;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Benzaiten Metrics API")
                        .version("1.0.0")
                        .description("위치별 메트릭 수집 API\n\n"
                                + "**인증**: `X-Bztn-Key` 헤더에 API Key를, `X-Bztn-Sign` 헤더에 "
                                + "요청 본문의 SHA-512 RSA(PKCS#1 v1.5) 서명을 base64로 전송합니다."))
                .servers(List.of(
                        new Server()
                                .url(serverUrl)
                                .description("API Gateway")
                ))
                .addSecurityItem(new SecurityRequirement()
                        .addList("Bztn Key")
                        .addList("Bztn Sign"))
                .components(new Components()
                        .addSecuritySchemes("Bztn Key",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.APIKEY)
                                        .in(SecurityScheme.In.HEADER)
                                        .name("X-Bztn-Key")
                                        .description("API Key ID"))
                        .addSecuritySchemes("Bztn Sign",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.APIKEY)
                                        .in(SecurityScheme.In.HEADER)
                                        .name("X-Bztn-Sign")
                                        .description("요청 본문의 base64 서명")));
    }
}
