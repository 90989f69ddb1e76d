/*
 * どこで: Compliance サービス層
 * 何を: DB の既定通知設定を 種別固有 -> ALL -> 設定ファイル の順で探索する
 * なぜ: 既定設定の欠落や不正値を警告ログに残しつつ、通知閾値を必ず決定するため
 */
package com.machinerental.compliance.service;

import com.machinerental.compliance.config.NotificationDefaultsProperties;
import com.machinerental.compliance.model.DocumentType;
import com.machinerental.compliance.model.NotificationDefault;
import com.machinerental.compliance.model.NotificationScope;
import com.machinerental.compliance.repository.NotificationDefaultRepository;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JdbcNotificationDefaultsSource implements NotificationDefaultsSource {

  private static final Logger logger = LoggerFactory.getLogger(JdbcNotificationDefaultsSource.class);

  private final NotificationDefaultRepository defaultRepository;
  private final NotificationDefaultsProperties properties;

  @Override
  public List<Integer> resolveDays(DocumentType documentType) {
    final List<NotificationScope> strategies =
        List.of(NotificationScope.of(documentType), NotificationScope.ALL);
    for (NotificationScope scope : strategies) {
      final Optional<List<Integer>> days = lookup(scope, documentType);
      if (days.isPresent()) {
        return days.get();
      }
    }
    final List<Integer> fallback =
        properties.fallbackDays().stream().distinct().sorted(Comparator.reverseOrder()).toList();
    logger.warn(
        "notification defaults not configured; using fallback type={} days={}",
        documentType.wireName(),
        fallback);
    return fallback;
  }

  private Optional<List<Integer>> lookup(NotificationScope scope, DocumentType documentType) {
    final Optional<NotificationDefault> found = defaultRepository.findByScope(scope);
    if (found.isEmpty()) {
      logger.debug(
          "notification default missing scope={} type={}", scope.wireName(), documentType);
      return Optional.empty();
    }
    final NotificationDefault notificationDefault = found.get();
    if (!notificationDefault.active()) {
      logger.debug("notification default inactive scope={}", scope.wireName());
      return Optional.empty();
    }
    // 有効なのに日数が空なのは設定不備として扱い、次の探索先へ進む
    if (notificationDefault.daysBefore().isEmpty()) {
      logger.warn(
          "notification default is malformed (empty days) scope={} type={}",
          scope.wireName(),
          documentType.wireName());
      return Optional.empty();
    }
    return Optional.of(notificationDefault.daysBefore());
  }
}
