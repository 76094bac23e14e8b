package com.benzaiten.shared.util;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Benzaiten API 전체에서 사용하는 날짜 형식 (UTC, 초 단위)
 *
 * <p>형식: {@code yyyy-MM-dd HH:mm:ss} (예: "2021-06-02 12:34:56")</p>
 * <p>API Key 만료일(expiration_date_utc), 메트릭 날짜(metric_date),
 * SQS 메시지 발송일(msg_send_date_utc) 모두 이 형식을 따릅니다.</p>
 */
public final class CanonicalDateTime {

    public static final String PATTERN = "yyyy-MM-dd HH:mm:ss";

    public static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);

    private CanonicalDateTime() {
    }

    /**
     * 문자열을 UTC 기준 LocalDateTime으로 파싱합니다.
     *
     * @param value "yyyy-MM-dd HH:mm:ss" 형식 문자열
     * @return 파싱된 날짜
     * @throws DateTimeParseException 형식이 맞지 않는 경우
     */
    public static LocalDateTime parse(String value) {
        return LocalDateTime.parse(value, FORMATTER);
    }

    public static String format(LocalDateTime value) {
        return FORMATTER.format(value);
    }

    /**
     * 현재 UTC 시각 (초 단위 절삭)
     */
    public static LocalDateTime now(Clock clock) {
        return LocalDateTime.now(clock.withZone(ZoneOffset.UTC)).withNano(0);
    }
}
