package com.benzaiten.shared.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CanonicalDateTime 단위 테스트")
class CanonicalDateTimeTest {

    @Test
    @DisplayName("형식에 맞는 문자열 파싱 및 동일 문자열로 포맷")
    void parseAndFormat() {
        LocalDateTime parsed = CanonicalDateTime.parse("2021-06-02 12:34:56");

        assertThat(parsed).isEqualTo(LocalDateTime.of(2021, 6, 2, 12, 34, 56));
        assertThat(CanonicalDateTime.format(parsed)).isEqualTo("2021-06-02 12:34:56");
    }

    @ParameterizedTest
    @ValueSource(strings = {"2021-06-02T12:34:56", "2021-06-02", "2021-02-30 00:00:00", "2021-06-02 25:00:00", "foo", ""})
    @DisplayName("형식이 다르거나 존재하지 않는 날짜는 예외")
    void parse_Invalid(String value) {
        assertThatThrownBy(() -> CanonicalDateTime.parse(value))
                .isInstanceOf(DateTimeParseException.class);
    }

    @Test
    @DisplayName("현재 시각은 시계의 시간대와 무관하게 UTC, 초 단위")
    void now_Utc() {
        Clock clock = Clock.fixed(Instant.parse("2021-06-02T12:34:56.789Z"), ZoneId.of("Asia/Seoul"));

        assertThat(CanonicalDateTime.now(clock)).isEqualTo(LocalDateTime.of(2021, 6, 2, 12, 34, 56));
    }
}
