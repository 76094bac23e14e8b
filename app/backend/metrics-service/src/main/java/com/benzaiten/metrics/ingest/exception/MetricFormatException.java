package com.benzaiten.metrics.ingest.exception;

import lombok.Getter;

/**
 * 메트릭 항목을 Metric으로 변환할 수 없는 경우
 */
@Getter
public class MetricFormatException extends RuntimeException {

    public enum Violation {
        /** 필수 필드 누락 */
        MISSING_FIELD,
        /** 필드 타입 불일치 (예: metric_date가 숫자) */
        TYPE,
        /** 필드 값 형식 오류 (예: 파싱할 수 없는 날짜 문자열) */
        VALUE
    }

    private final Violation violation;
    private final String field;

    public MetricFormatException(Violation violation, String field, String message) {
        super(message);
        this.violation = violation;
        this.field = field;
    }

    public MetricFormatException(Violation violation, String field, String message, Throwable cause) {
        super(message, cause);
        this.violation = violation;
        this.field = field;
    }
}
