/*
 * どこで: Compliance データアクセス
 * 何を: document_notification_rules の置き換えと、本日期限到達した閾値の抽出を担う
 * なぜ: 通知設定の全置換と期限判定を SQL 1 本ずつで完結させるため
 */
package com.machinerental.compliance.repository;

import static com.machinerental.common.JdbcTimestampUtils.toLocalDate;
import static com.machinerental.common.JdbcTimestampUtils.toSqlDate;
import static com.machinerental.common.JdbcTimestampUtils.toTimestamp;

import com.machinerental.compliance.model.DocumentType;
import com.machinerental.compliance.model.DueNotification;
import com.machinerental.compliance.model.NotificationRuleRecord;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRuleRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int deleteByDocumentId(long documentId) {
    final String sql = "DELETE FROM document_notification_rules WHERE document_id = :documentId";
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("documentId", documentId));
  }

  public int countByDocumentId(long documentId) {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM document_notification_rules WHERE document_id = :documentId",
            new MapSqlParameterSource().addValue("documentId", documentId),
            Integer.class);
    return count == null ? 0 : count;
  }

  public int insertAll(long documentId, Collection<Integer> daysBefore, Instant now) {
    if (daysBefore.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        INSERT INTO document_notification_rules (
          document_id, days_before, is_active, created_at, updated_at
        ) VALUES (
          :documentId, :daysBefore, TRUE, :now, :now
        )
        """;
    final SqlParameterSource[] batch =
        daysBefore.stream()
            .map(
                days ->
                    new MapSqlParameterSource()
                        .addValue("documentId", documentId)
                        .addValue("daysBefore", days)
                        .addValue("now", toTimestamp(now)))
            .toArray(SqlParameterSource[]::new);
    return jdbcTemplate.batchUpdate(sql, batch).length;
  }

  public List<NotificationRuleRecord> findByDocumentId(long documentId) {
    final String sql =
        """
        SELECT document_id, days_before, is_active
        FROM document_notification_rules
        WHERE document_id = :documentId
        ORDER BY days_before DESC
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("documentId", documentId);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new NotificationRuleRecord(
                rs.getLong("document_id"), rs.getInt("days_before"), rs.getBoolean("is_active")));
  }

  /**
   * 稼働中の機械の書類について、残日数が有効な閾値と一致し、かつ本日の通知ログが未登録の組を返す。
   *
   * <p>ここでの未登録判定は候補の絞り込みに過ぎない。二重通知の防止は {@link
   * NotificationLogRepository#claim} の一意制約で行う。
   */
  public List<DueNotification> findMatchingRules(LocalDate today) {
    final String sql =
        """
        SELECT md.id AS document_id, md.machine_id, m.machine_number, m.name AS machine_name,
               md.document_type, md.expiry_date, r.days_before,
               (md.expiry_date - :today::date) AS days_until_expiry
        FROM machine_documents md
        JOIN machines m ON m.id = md.machine_id AND m.is_active = TRUE
        JOIN document_notification_rules r ON r.document_id = md.id AND r.is_active = TRUE
        WHERE (md.expiry_date - :today::date) = r.days_before
          AND NOT EXISTS (
            SELECT 1
            FROM document_notification_logs l
            WHERE l.document_id = md.id
              AND l.days_before = r.days_before
              AND l.notification_date = :today::date
          )
        ORDER BY md.expiry_date ASC, md.id ASC, r.days_before DESC
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("today", toSqlDate(today));
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new DueNotification(
                rs.getLong("document_id"),
                rs.getLong("machine_id"),
                rs.getString("machine_number"),
                rs.getString("machine_name"),
                DocumentType.fromDatabase(rs.getString("document_type")),
                toLocalDate(rs.getDate("expiry_date")),
                rs.getInt("days_before"),
                rs.getLong("days_until_expiry")));
  }
}
