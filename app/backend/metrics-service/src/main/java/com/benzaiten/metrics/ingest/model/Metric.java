package com.benzaiten.metrics.ingest.model;

import com.benzaiten.metrics.ingest.exception.MetricFormatException;
import com.benzaiten.metrics.ingest.exception.MetricFormatException.Violation;
import com.benzaiten.shared.dto.sqs.MetricMessage;
import com.benzaiten.shared.util.CanonicalDateTime;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * 메트릭 1건
 *
 * <p>식별자는 (metric_name, location_name, time_span, metric_date)이며
 * metric_value, metric_source는 동등성 비교에 포함되지 않습니다.
 * 같은 요청 안에서 같은 샘플의 값이 두 번 들어오면 중복으로 취급하기 위함입니다.</p>
 */
@Getter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Metric {

    public static final String METRIC_NAME = "metric_name";
    public static final String TIME_SPAN = "time_span";
    public static final String LOCATION_NAME = "location_name";
    public static final String METRIC_DATE = "metric_date";
    public static final String METRIC_VALUE = "metric_value";
    public static final String METRIC_SOURCE = "metric_source";

    @EqualsAndHashCode.Include
    private final String metricName;

    @EqualsAndHashCode.Include
    private final String timeSpan;

    @EqualsAndHashCode.Include
    private final String locationName;

    /**
     * 측정 시각 (UTC, 초 단위)
     */
    @EqualsAndHashCode.Include
    private final LocalDateTime metricDate;

    private final BigDecimal metricValue;

    private final String metricSource;

    @Builder
    private Metric(String metricName, String timeSpan, String locationName, LocalDateTime metricDate,
                   BigDecimal metricValue, String metricSource) {
        this.metricName = metricName;
        this.timeSpan = timeSpan;
        this.locationName = locationName;
        this.metricDate = metricDate == null ? null : metricDate.truncatedTo(ChronoUnit.SECONDS);
        this.metricValue = metricValue;
        this.metricSource = metricSource;
    }

    /**
     * Metric System Key: {@code metric_name@location_name#time_span}
     */
    public String getMetricSystemKey() {
        return metricName + "@" + locationName + "#" + timeSpan;
    }

    /**
     * 요청 본문의 메트릭 항목을 Metric으로 변환합니다.
     *
     * <p>metric_date는 "yyyy-MM-dd HH:mm:ss" 문자열 또는 날짜 객체
     * (LocalDateTime, OffsetDateTime, ZonedDateTime, Instant)를 받습니다.</p>
     *
     * @param entry        메트릭 항목
     * @param locationName 요청의 location_name, null이 아니면 빈 문자열이어도 항목의 location_name을 덮어씀
     * @return 변환된 Metric
     * @throws MetricFormatException 필드 누락, 타입 불일치, 값 형식 오류
     */
    public static Metric fromEntry(Map<String, ?> entry, String locationName) {
        String location = locationName;
        if (location == null) {
            location = requireString(entry, LOCATION_NAME);
        }

        return Metric.builder()
                .metricName(requireString(entry, METRIC_NAME))
                .timeSpan(requireString(entry, TIME_SPAN))
                .locationName(location)
                .metricDate(toMetricDate(require(entry, METRIC_DATE)))
                .metricValue(toMetricValue(require(entry, METRIC_VALUE)))
                .metricSource(requireString(entry, METRIC_SOURCE))
                .build();
    }

    public static Metric fromEntry(Map<String, ?> entry) {
        return fromEntry(entry, null);
    }

    /**
     * SQS 메시지 생성 (발송 시각은 clock 기준 UTC)
     */
    public MetricMessage toMessage(Clock clock) {
        return MetricMessage.builder()
                .metricName(metricName)
                .timeSpan(timeSpan)
                .locationName(locationName)
                .metricDate(metricDate)
                .metricValue(metricValue)
                .metricSource(metricSource)
                .msgSendDateUtc(CanonicalDateTime.now(clock))
                .build();
    }

    public static Metric fromMessage(MetricMessage message) {
        return Metric.builder()
                .metricName(message.getMetricName())
                .timeSpan(message.getTimeSpan())
                .locationName(message.getLocationName())
                .metricDate(message.getMetricDate())
                .metricValue(message.getMetricValue())
                .metricSource(message.getMetricSource())
                .build();
    }

    private static Object require(Map<String, ?> entry, String field) {
        Object value = entry.get(field);
        if (value == null) {
            throw new MetricFormatException(Violation.MISSING_FIELD, field, "Missing field: " + field);
        }
        return value;
    }

    private static String requireString(Map<String, ?> entry, String field) {
        Object value = require(entry, field);
        if (!(value instanceof String)) {
            throw new MetricFormatException(Violation.TYPE, field,
                    field + " should be str, got " + value.getClass().getSimpleName());
        }
        return (String) value;
    }

    private static LocalDateTime toMetricDate(Object value) {
        if (value instanceof String) {
            String text = (String) value;
            try {
                return CanonicalDateTime.parse(text);
            } catch (DateTimeParseException e) {
                throw new MetricFormatException(Violation.VALUE, METRIC_DATE,
                        "metric_date should match " + CanonicalDateTime.PATTERN + ", got " + text, e);
            }
        }
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        throw new MetricFormatException(Violation.TYPE, METRIC_DATE,
                "metric_date should be str with format " + CanonicalDateTime.PATTERN
                        + " or datetime, got " + value.getClass().getSimpleName());
    }

    private static BigDecimal toMetricValue(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                throw new MetricFormatException(Violation.VALUE, METRIC_VALUE,
                        "metric_value should be finite, got " + value);
            }
            return BigDecimal.valueOf(number);
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        throw new MetricFormatException(Violation.TYPE, METRIC_VALUE,
                "metric_value should be a number, got " + value.getClass().getSimpleName());
    }
}
