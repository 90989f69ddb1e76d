/*
 * どこで: Compliance 通知設定サービスのユニットテスト
 * 何を: 通知日数の正規化・全置換・既定値の一括適用を検証する
 * なぜ: 不正な閾値を書き込まず、既定値を未設定書類にだけ配ることを担保するため
 */
package com.machinerental.compliance.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.machinerental.compliance.api.InvalidDocumentRequestException;
import com.machinerental.compliance.api.ResourceNotFoundException;
import com.machinerental.compliance.config.ComplianceCalendarProperties;
import com.machinerental.compliance.model.DocumentType;
import com.machinerental.compliance.model.NotificationDefault;
import com.machinerental.compliance.model.NotificationScope;
import com.machinerental.compliance.repository.MachineDocumentRepository;
import com.machinerental.compliance.repository.NotificationDefaultRepository;
import com.machinerental.compliance.repository.NotificationRuleRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

@ExtendWith(MockitoExtension.class)
class NotificationRuleServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-10T03:30:00Z");
  private static final long DOCUMENT_ID = 7L;

  @Mock private NotificationRuleRepository ruleRepository;
  @Mock private NotificationDefaultRepository defaultRepository;
  @Mock private MachineDocumentRepository documentRepository;
  @Mock private NotificationDefaultsSource defaultsSource;

  private NotificationRuleService service;

  @BeforeEach
  void setUp() {
    final BusinessCalendar calendar =
        new BusinessCalendar(
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC),
            new ComplianceCalendarProperties("Asia/Kolkata"));
    service =
        new NotificationRuleService(
            ruleRepository,
            defaultRepository,
            documentRepository,
            defaultsSource,
            calendar,
            new NoOpTransactionManager());
  }

  @Test
  void configureReplacesRulesWithDistinctDescendingDays() {
    when(documentRepository.lockById(DOCUMENT_ID)).thenReturn(true);

    final List<Integer> configured = service.configure(DOCUMENT_ID, List.of(3, 14, 7, 3, 0));

    assertThat(configured).containsExactly(14, 7, 3, 0);
    final InOrder order = inOrder(ruleRepository);
    order.verify(ruleRepository).deleteByDocumentId(DOCUMENT_ID);
    order.verify(ruleRepository).insertAll(DOCUMENT_ID, List.of(14, 7, 3, 0), FIXED_NOW);
  }

  @Test
  void configureWithEmptyListClearsRules() {
    when(documentRepository.lockById(DOCUMENT_ID)).thenReturn(true);

    assertThat(service.configure(DOCUMENT_ID, List.of())).isEmpty();
    verify(ruleRepository).deleteByDocumentId(DOCUMENT_ID);
  }

  @Test
  void configureRejectsOutOfRangeDaysBeforeWriting() {
    assertThatThrownBy(() -> service.configure(DOCUMENT_ID, List.of(7, 4000)))
        .isInstanceOf(InvalidDocumentRequestException.class)
        .hasMessage("notification_days must be between -365 and 3650");
    assertThatThrownBy(() -> service.configure(DOCUMENT_ID, Arrays.asList(7, null)))
        .isInstanceOf(InvalidDocumentRequestException.class);
    verifyNoInteractions(ruleRepository);
  }

  @Test
  void configureRejectsUnknownDocument() {
    when(documentRepository.lockById(DOCUMENT_ID)).thenReturn(false);

    assertThatThrownBy(() -> service.configure(DOCUMENT_ID, List.of(7)))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(ruleRepository, never()).deleteByDocumentId(anyLong());
  }

  @Test
  void applyDefaultsConfiguresOnlyDocumentsWithoutRules() {
    when(defaultsSource.resolveDays(DocumentType.PUC)).thenReturn(List.of(30, 7));
    when(documentRepository.findIdsByTypeWithoutRules(DocumentType.PUC))
        .thenReturn(List.of(1L, 2L));
    when(documentRepository.lockById(anyLong())).thenReturn(true);

    final int configured = service.applyDefaults("PUC");

    assertThat(configured).isEqualTo(2);
    verify(ruleRepository).insertAll(1L, List.of(30, 7), FIXED_NOW);
    verify(ruleRepository).insertAll(2L, List.of(30, 7), FIXED_NOW);
    verify(ruleRepository, never()).deleteByDocumentId(anyLong());
  }

  @Test
  void applyDefaultsSkipsDocumentsConfiguredOrDeletedAfterSelection() {
    when(defaultsSource.resolveDays(DocumentType.PUC)).thenReturn(List.of(30, 7));
    when(documentRepository.findIdsByTypeWithoutRules(DocumentType.PUC))
        .thenReturn(List.of(1L, 2L, 3L));
    when(documentRepository.lockById(1L)).thenReturn(true);
    when(documentRepository.lockById(2L)).thenReturn(true);
    when(documentRepository.lockById(3L)).thenReturn(false);
    // 抽出後に個別設定された書類
    when(ruleRepository.countByDocumentId(1L)).thenReturn(1);

    final int configured = service.applyDefaults("PUC");

    assertThat(configured).isEqualTo(1);
    verify(ruleRepository, never()).insertAll(eq(1L), any(), any());
    verify(ruleRepository).insertAll(2L, List.of(30, 7), FIXED_NOW);
    verify(ruleRepository, never()).insertAll(eq(3L), any(), any());
  }

  @Test
  void applyDefaultsRejectsUnknownType() {
    assertThatThrownBy(() -> service.applyDefaults("Permit"))
        .isInstanceOf(InvalidDocumentRequestException.class)
        .hasMessageContaining("RC_Book, PUC, Fitness, Insurance");
    verifyNoInteractions(defaultsSource);
  }

  @Test
  void initializeDefaultsWithoutTypeCoversEveryType() {
    when(defaultsSource.resolveDays(any())).thenReturn(List.of(14));
    when(documentRepository.findIdsByTypeWithoutRules(any())).thenReturn(List.of());
    when(documentRepository.findIdsByTypeWithoutRules(DocumentType.INSURANCE))
        .thenReturn(List.of(9L));
    when(documentRepository.lockById(9L)).thenReturn(true);

    assertThat(service.initializeDefaults(null)).isEqualTo(1);
    for (DocumentType type : DocumentType.values()) {
      verify(defaultsSource).resolveDays(type);
    }
  }

  @Test
  void updateDefaultsNormalizesDaysAndUsesSystemActor() {
    final NotificationDefault stored =
        new NotificationDefault(NotificationScope.ALL, List.of(30, 14), true, "system", FIXED_NOW);
    when(defaultRepository.findByScope(NotificationScope.ALL)).thenReturn(Optional.of(stored));

    final NotificationDefault updated = service.updateDefaults("ALL", List.of(14, 30, 14), " ");

    assertThat(updated).isEqualTo(stored);
    verify(defaultRepository)
        .replace(eq(NotificationScope.ALL), eq(List.of(30, 14)), eq("system"), eq(FIXED_NOW));
  }

  @Test
  void updateDefaultsRejectsNonPositiveDays() {
    assertThatThrownBy(() -> service.updateDefaults("PUC", List.of(7, 0), "ops"))
        .isInstanceOf(InvalidDocumentRequestException.class);
    assertThatThrownBy(() -> service.updateDefaults("PUC", List.of(), "ops"))
        .isInstanceOf(InvalidDocumentRequestException.class)
        .hasMessage("notification_days must not be empty");
    verifyNoInteractions(defaultRepository);
  }

  @Test
  void getDefaultsFiltersToTypeAndAllScopes() {
    final NotificationDefault all =
        new NotificationDefault(NotificationScope.ALL, List.of(14), true, "system", FIXED_NOW);
    final NotificationDefault puc =
        new NotificationDefault(NotificationScope.PUC, List.of(30), true, "ops", FIXED_NOW);
    final NotificationDefault insurance =
        new NotificationDefault(NotificationScope.INSURANCE, List.of(60), true, "ops", FIXED_NOW);
    when(defaultRepository.findAll()).thenReturn(List.of(all, puc, insurance));

    assertThat(service.getDefaults("PUC")).containsExactly(all, puc);
    assertThat(service.getDefaults(null)).hasSize(3);
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
