/*
 * どこで: Compliance データアクセス
 * 何を: document_notification_logs の claim/削除/履歴参照を担う
 * なぜ: (書類, 閾値, 日付) の一意制約で 1 日 1 回の通知を保証するため
 */
package com.machinerental.compliance.repository;

import static com.machinerental.common.JdbcTimestampUtils.toInstant;
import static com.machinerental.common.JdbcTimestampUtils.toLocalDate;
import static com.machinerental.common.JdbcTimestampUtils.toSqlDate;
import static com.machinerental.common.JdbcTimestampUtils.toTimestamp;

import com.machinerental.compliance.model.DocumentType;
import com.machinerental.compliance.model.NotificationLogView;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 通知ログを登録できた場合のみ true。既に同日同閾値の行があれば false。 */
  public boolean claim(long documentId, int daysBefore, LocalDate notificationDate, Instant now) {
    final String sql =
        """
        INSERT INTO document_notification_logs (
          document_id, days_before, notification_date, created_at
        ) VALUES (
          :documentId, :daysBefore, :notificationDate, :now
        )
        ON CONFLICT (document_id, days_before, notification_date) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("documentId", documentId)
            .addValue("daysBefore", daysBefore)
            .addValue("notificationDate", toSqlDate(notificationDate))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public int deleteByDocumentId(long documentId) {
    final String sql = "DELETE FROM document_notification_logs WHERE document_id = :documentId";
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("documentId", documentId));
  }

  /** documentId が null なら全書類の履歴を新しい順に返す。 */
  public List<NotificationLogView> findHistory(Long documentId, int limit) {
    final String sql =
        """
        SELECT l.id, l.document_id, m.machine_number, m.name AS machine_name,
               md.document_type, l.days_before, l.notification_date, l.created_at
        FROM document_notification_logs l
        JOIN machine_documents md ON md.id = l.document_id
        JOIN machines m ON m.id = md.machine_id
        WHERE (CAST(:documentId AS BIGINT) IS NULL OR l.document_id = :documentId)
        ORDER BY l.notification_date DESC, l.created_at DESC, l.id DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("documentId", documentId).addValue("limit", limit);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new NotificationLogView(
                rs.getLong("id"),
                rs.getLong("document_id"),
                rs.getString("machine_number"),
                rs.getString("machine_name"),
                DocumentType.fromDatabase(rs.getString("document_type")),
                rs.getInt("days_before"),
                toLocalDate(rs.getDate("notification_date")),
                toInstant(rs.getTimestamp("created_at"))));
  }
}
