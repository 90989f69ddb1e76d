/*
 * どこで: Compliance サービス層
 * 何を: 注入された Clock と業務タイムゾーンから「今日」と当日の境界時刻を求める
 * なぜ: 期限日数/通知日/当日送信済み判定で同じ暦日を使うため
 */
package com.machinerental.compliance.service;

import com.machinerental.compliance.config.ComplianceCalendarProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class BusinessCalendar {

  private final Clock clock;
  private final ComplianceCalendarProperties properties;

  public Instant now() {
    return Instant.now(clock);
  }

  public LocalDate today() {
    return LocalDate.ofInstant(Instant.now(clock), properties.zoneId());
  }

  public Instant startOfToday() {
    return today().atStartOfDay(properties.zoneId()).toInstant();
  }

  public Instant startOfTomorrow() {
    return today().plusDays(1).atStartOfDay(properties.zoneId()).toInstant();
  }
}
