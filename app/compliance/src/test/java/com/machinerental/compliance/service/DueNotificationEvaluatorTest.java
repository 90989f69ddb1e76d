/*
 * どこで: Compliance 期限到達評価のユニットテスト
 * 何を: claim に成功した組だけを返すこと、業務タイムゾーンの日付で評価することを検証する
 * なぜ: 同日同閾値の通知を 1 回に限る前提を崩さないため
 */
package com.machinerental.compliance.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.machinerental.compliance.api.ResourceNotFoundException;
import com.machinerental.compliance.config.ComplianceCalendarProperties;
import com.machinerental.compliance.model.DocumentType;
import com.machinerental.compliance.model.DueNotification;
import com.machinerental.compliance.repository.MachineDocumentRepository;
import com.machinerental.compliance.repository.NotificationLogRepository;
import com.machinerental.compliance.repository.NotificationRuleRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

@ExtendWith(MockitoExtension.class)
class DueNotificationEvaluatorTest {

  // UTC では 3/9 だが Asia/Kolkata では 3/10 になる時刻
  private static final Instant FIXED_NOW = Instant.parse("2026-03-09T20:00:00Z");
  private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

  @Mock private NotificationRuleRepository ruleRepository;
  @Mock private NotificationLogRepository logRepository;
  @Mock private MachineDocumentRepository documentRepository;
  @Mock private ComplianceMetrics metrics;

  private DueNotificationEvaluator evaluator;

  @BeforeEach
  void setUp() {
    final BusinessCalendar calendar =
        new BusinessCalendar(
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC),
            new ComplianceCalendarProperties("Asia/Kolkata"));
    evaluator =
        new DueNotificationEvaluator(
            ruleRepository,
            logRepository,
            documentRepository,
            calendar,
            metrics,
            new NoOpTransactionManager());
  }

  @Test
  void evaluateReturnsOnlyClaimedNotifications() {
    final DueNotification sevenDays = due(1L, 7);
    final DueNotification threeDays = due(2L, 3);
    when(ruleRepository.findMatchingRules(TODAY)).thenReturn(List.of(sevenDays, threeDays));
    when(logRepository.claim(1L, 7, TODAY, FIXED_NOW)).thenReturn(true);
    // 並行実行側が先に登録した組
    when(logRepository.claim(2L, 3, TODAY, FIXED_NOW)).thenReturn(false);

    final List<DueNotification> result = evaluator.evaluate();

    assertThat(result).containsExactly(sevenDays);
    verify(metrics).recordNotificationsDue(1);
  }

  @Test
  void evaluateReturnsEmptyWhenNothingMatches() {
    when(ruleRepository.findMatchingRules(TODAY)).thenReturn(List.of());

    assertThat(evaluator.evaluate()).isEmpty();
    verifyNoInteractions(logRepository);
    verify(metrics).recordNotificationsDue(0);
  }

  @Test
  void historyRejectsUnknownDocument() {
    when(documentRepository.findById(99L)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> evaluator.getNotificationHistory(99L))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessage("document not found id=99");
    verifyNoInteractions(logRepository);
  }

  @Test
  void historyWithoutDocumentReturnsAllLogs() {
    when(logRepository.findHistory(null, 100)).thenReturn(List.of());

    assertThat(evaluator.getNotificationHistory(null)).isEmpty();
    verifyNoInteractions(documentRepository);
  }

  private DueNotification due(long documentId, int daysBefore) {
    return new DueNotification(
        documentId,
        10L,
        "MR-00" + documentId,
        "Crane",
        DocumentType.INSURANCE,
        TODAY.plusDays(daysBefore),
        daysBefore,
        daysBefore);
  }

  private static class NoOpTransactionManager implements PlatformTransactionManager {

    @Override
    public TransactionStatus getTransaction(TransactionDefinition definition) {
      return new SimpleTransactionStatus();
    }

    @Override
    public void commit(TransactionStatus status) {}

    @Override
    public void rollback(TransactionStatus status) {}
  }
}
