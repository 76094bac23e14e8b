package com.benzaiten.metrics.common.exception;

import com.benzaiten.shared.response.ApiResponse;
import com.benzaiten.shared.response.ApiStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 읽을 수 없는 프록시 이벤트 JSON
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleNotReadable(HttpMessageNotReadableException e) {
        log.error("읽을 수 없는 요청 본문: {}", e.getMessage());
        ApiResponse response = ApiResponse.of(ApiStatus.BAD_REQUEST, "Invalid JSon object");
        return ResponseEntity.status(response.getStatusCode()).body(response.render());
    }

    /**
     * 매핑되지 않은 경로
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNoResourceFound(NoResourceFoundException e) {
        log.error("존재하지 않는 리소스: {} {}", e.getHttpMethod(), e.getResourcePath());
        ApiResponse response = ApiResponse.of(ApiStatus.BAD_MAPPING, "Bad resource: " + e.getResourcePath());
        return ResponseEntity.status(response.getStatusCode()).body(response.render());
    }

    /**
     * 모든 예외 처리 (최종 catch-all)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleAllExceptions(Exception ex) {
        log.error("예상치 못한 예외 발생: {}", ex.getMessage(), ex);
        ApiResponse response = ApiResponse.of(ApiStatus.INTERNAL_SERVER_ERROR);
        return ResponseEntity.status(response.getStatusCode()).body(response.render());
    }
}
