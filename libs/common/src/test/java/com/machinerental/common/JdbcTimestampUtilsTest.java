package com.machinerental.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  @Test
  void convertsNullsToNull() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
    assertThat(JdbcTimestampUtils.toSqlDate(null)).isNull();
    assertThat(JdbcTimestampUtils.toLocalDate(null)).isNull();
  }

  @Test
  void keepsInstantAndCalendarDateValues() {
    final Instant instant = Instant.parse("2026-10-19T03:30:00Z");
    final LocalDate date = LocalDate.of(2026, 10, 26);

    assertThat(JdbcTimestampUtils.toInstant(JdbcTimestampUtils.toTimestamp(instant)))
        .isEqualTo(instant);
    assertThat(JdbcTimestampUtils.toLocalDate(JdbcTimestampUtils.toSqlDate(date)))
        .isEqualTo(date);
  }
}
