package com.benzaiten.metrics.ingest.controller;

import com.benzaiten.metrics.common.exception.GlobalExceptionHandler;
import com.benzaiten.metrics.ingest.dto.InboundEvent;
import com.benzaiten.metrics.ingest.service.MetricIngestionService;
import com.benzaiten.shared.response.ApiResponse;
import com.benzaiten.shared.response.ApiStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(InternalEventController.class)
@Import(GlobalExceptionHandler.class)
@DisplayName("InternalEventController 테스트")
class InternalEventControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private MetricIngestionService metricIngestionService;

    @Test
    @DisplayName("POST /internal/v1/events - 프록시 이벤트를 처리하고 렌더링된 응답 반환")
    void handleEvent() throws Exception {
        // Given
        String event = """
                {
                  "resource": "metric",
                  "httpMethod": "PUT",
                  "body": "eyJtZXRyaWNzIjogW119",
                  "isBase64Encoded": true,
                  "headers": {"X-Bztn-Key": "key1", "X-Bztn-Sign": "earlgrey"},
                  "requestContext": {"stage": "prod"}
                }
                """;
        given(metricIngestionService.handle(any(InboundEvent.class))).willReturn(ApiResponse.of(ApiStatus.TEAPOT));

        // When & Then
        mockMvc.perform(post("/internal/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(event))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isBase64Encoded").value(false))
                .andExpect(jsonPath("$.statusCode").value(418))
                .andExpect(jsonPath("$.body").value("I'm a teapot"));

        ArgumentCaptor<InboundEvent> captor = ArgumentCaptor.forClass(InboundEvent.class);
        then(metricIngestionService).should().handle(captor.capture());
        InboundEvent parsed = captor.getValue();
        assertThat(parsed.getResource()).isEqualTo("metric");
        assertThat(parsed.isBase64Encoded()).isTrue();
        assertThat(parsed.getHeaders()).isEqualTo(Map.of("X-Bztn-Key", "key1", "X-Bztn-Sign", "earlgrey"));
    }

    @Test
    @DisplayName("POST /internal/v1/events - 읽을 수 없는 이벤트는 400 응답")
    void handleEvent_InvalidJson() throws Exception {
        mockMvc.perform(post("/internal/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.statusCode").value(400))
                .andExpect(jsonPath("$.body").value("Invalid JSon object"));

        then(metricIngestionService).should(never()).handle(any());
    }

    @Test
    @DisplayName("POST /internal/v1/events - 서비스 예외는 500 응답")
    void handleEvent_UnexpectedError() throws Exception {
        given(metricIngestionService.handle(any(InboundEvent.class))).willThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/internal/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resource\": \"metric\", \"httpMethod\": \"PUT\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.body").value("Internal Server Error"));
    }
}
