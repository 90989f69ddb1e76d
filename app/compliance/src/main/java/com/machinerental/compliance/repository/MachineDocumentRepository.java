/*
 * どこで: Compliance データアクセス
 * 何を: machine_documents の登録/更新/削除と、残日数・状態・通知日数付きの参照を担う
 * なぜ: 残日数は保存せず、参照日を引数に SQL 上で算出するため
 */
package com.machinerental.compliance.repository;

import static com.machinerental.common.JdbcTimestampUtils.toInstant;
import static com.machinerental.common.JdbcTimestampUtils.toLocalDate;
import static com.machinerental.common.JdbcTimestampUtils.toSqlDate;
import static com.machinerental.common.JdbcTimestampUtils.toTimestamp;

import com.machinerental.compliance.model.DocumentFilter;
import com.machinerental.compliance.model.DocumentStats;
import com.machinerental.compliance.model.DocumentType;
import com.machinerental.compliance.model.ExpiryStatus;
import com.machinerental.compliance.model.MachineDocumentRecord;
import com.machinerental.compliance.model.MachineDocumentView;
import com.machinerental.compliance.model.UpsertAction;
import com.machinerental.compliance.model.UpsertResult;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MachineDocumentRepository {

  private static final String VIEW_SELECT =
      """
      SELECT md.id, md.machine_id, m.machine_number, m.name AS machine_name,
             md.document_type, md.expiry_date, md.last_renewed_date, md.remarks,
             md.created_at, md.updated_at,
             (md.expiry_date - :today::date) AS days_until_expiry,
             COALESCE(
               ARRAY_AGG(r.days_before ORDER BY r.days_before DESC) FILTER (WHERE r.id IS NOT NULL),
               ARRAY[]::integer[]) AS notification_days
      FROM machine_documents md
      JOIN machines m ON m.id = md.machine_id
      LEFT JOIN document_notification_rules r
        ON r.document_id = md.id AND r.is_active = TRUE
      """;

  private static final String VIEW_GROUP_BY =
      """
      GROUP BY md.id, m.machine_number, m.name
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<MachineDocumentRecord> findById(long documentId) {
    final String sql =
        """
        SELECT id, machine_id, document_type, expiry_date, last_renewed_date, remarks,
               created_at, updated_at
        FROM machine_documents
        WHERE id = :documentId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("documentId", documentId);
    return jdbcTemplate.query(sql, params, this::mapRecord).stream().findFirst();
  }

  /** 書類行を行ロックする。書類が無ければ false。呼び出し側のトランザクション内で使う。 */
  public boolean lockById(long documentId) {
    final String sql = "SELECT id FROM machine_documents WHERE id = :documentId FOR UPDATE";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("documentId", documentId);
    return !jdbcTemplate.queryForList(sql, params, Long.class).isEmpty();
  }

  /**
   * (machine_id, document_type) の一意制約で登録/更新を 1 文にまとめる。
   * 同時に初回登録が来ても後着側は UPDATED になる。
   */
  public UpsertResult upsert(
      long machineId,
      DocumentType documentType,
      LocalDate expiryDate,
      LocalDate lastRenewedDate,
      String remarks,
      Instant now) {
    final String sql =
        """
        INSERT INTO machine_documents (
          machine_id, document_type, expiry_date, last_renewed_date, remarks, created_at, updated_at
        ) VALUES (
          :machineId, :documentType, :expiryDate, :lastRenewedDate, :remarks, :now, :now
        )
        ON CONFLICT (machine_id, document_type) DO UPDATE
        SET expiry_date = EXCLUDED.expiry_date,
            last_renewed_date = EXCLUDED.last_renewed_date,
            remarks = EXCLUDED.remarks,
            updated_at = EXCLUDED.updated_at
        RETURNING id, (xmax = 0) AS inserted
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("machineId", machineId)
            .addValue("documentType", documentType.wireName())
            .addValue("expiryDate", toSqlDate(expiryDate))
            .addValue("lastRenewedDate", toSqlDate(lastRenewedDate))
            .addValue("remarks", remarks)
            .addValue("now", toTimestamp(now));
    final UpsertResult result =
        jdbcTemplate.queryForObject(
            sql,
            params,
            (rs, rowNum) ->
                new UpsertResult(
                    rs.getLong("id"),
                    rs.getBoolean("inserted") ? UpsertAction.CREATED : UpsertAction.UPDATED));
    if (result == null) {
      throw new IllegalStateException("machine_documents upsert returned no row");
    }
    return result;
  }

  public int update(
      long documentId,
      LocalDate expiryDate,
      LocalDate lastRenewedDate,
      String remarks,
      Instant now) {
    final String sql =
        """
        UPDATE machine_documents
        SET expiry_date = :expiryDate,
            last_renewed_date = :lastRenewedDate,
            remarks = :remarks,
            updated_at = :now
        WHERE id = :documentId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("documentId", documentId)
            .addValue("expiryDate", toSqlDate(expiryDate))
            .addValue("lastRenewedDate", toSqlDate(lastRenewedDate))
            .addValue("remarks", remarks)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int delete(long documentId) {
    final String sql = "DELETE FROM machine_documents WHERE id = :documentId";
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("documentId", documentId));
  }

  public Optional<MachineDocumentView> findViewById(long documentId, LocalDate today) {
    final String sql = VIEW_SELECT + "WHERE md.id = :documentId\n" + VIEW_GROUP_BY;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("today", toSqlDate(today))
            .addValue("documentId", documentId);
    return jdbcTemplate.query(sql, params, this::mapView).stream().findFirst();
  }

  public List<MachineDocumentView> findViews(DocumentFilter filter, LocalDate today) {
    final List<String> conditions = new ArrayList<>();
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("today", toSqlDate(today));
    if (filter.machineId() != null) {
      conditions.add("md.machine_id = :machineId");
      params.addValue("machineId", filter.machineId());
    }
    if (filter.documentType() != null) {
      conditions.add("md.document_type = :documentType");
      params.addValue("documentType", filter.documentType().wireName());
    }
    if (filter.status() != null) {
      if (filter.status().minDays() != null) {
        conditions.add("(md.expiry_date - :today::date) >= :statusMinDays");
        params.addValue("statusMinDays", filter.status().minDays());
      }
      if (filter.status().maxDays() != null) {
        conditions.add("(md.expiry_date - :today::date) <= :statusMaxDays");
        params.addValue("statusMaxDays", filter.status().maxDays());
      }
    }
    if (filter.expiringWithinDays() != null) {
      conditions.add("(md.expiry_date - :today::date) <= :expiringWithinDays");
      params.addValue("expiringWithinDays", filter.expiringWithinDays());
    }
    final StringBuilder sql = new StringBuilder(VIEW_SELECT);
    if (!conditions.isEmpty()) {
      sql.append("WHERE ").append(String.join("\n  AND ", conditions)).append('\n');
    }
    sql.append(VIEW_GROUP_BY).append("ORDER BY md.expiry_date ASC, md.id ASC\n");
    return jdbcTemplate.query(sql.toString(), params, this::mapView);
  }

  public List<MachineDocumentView> findViewsByIds(List<Long> documentIds, LocalDate today) {
    if (documentIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        VIEW_SELECT
            + "WHERE md.id IN (:documentIds)\n"
            + VIEW_GROUP_BY
            + "ORDER BY md.expiry_date ASC, md.id ASC\n";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("today", toSqlDate(today))
            .addValue("documentIds", documentIds);
    return jdbcTemplate.query(sql, params, this::mapView);
  }

  /** 稼働中の機械について、期限が today 以上 today + daysAhead 以下の書類を返す。 */
  public List<MachineDocumentView> findExpiringOnActiveMachines(LocalDate today, int daysAhead) {
    final String sql =
        VIEW_SELECT
            + """
            WHERE m.is_active = TRUE
              AND md.expiry_date BETWEEN :today::date AND :until::date
            """
            + VIEW_GROUP_BY
            + "ORDER BY md.expiry_date ASC, md.id ASC\n";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("today", toSqlDate(today))
            .addValue("until", toSqlDate(today.plusDays(daysAhead)));
    return jdbcTemplate.query(sql, params, this::mapView);
  }

  public List<Long> findIdsByTypeWithoutRules(DocumentType documentType) {
    final String sql =
        """
        SELECT md.id
        FROM machine_documents md
        WHERE md.document_type = :documentType
          AND NOT EXISTS (
            SELECT 1 FROM document_notification_rules r WHERE r.document_id = md.id
          )
        ORDER BY md.id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("documentType", documentType.wireName());
    return jdbcTemplate.queryForList(sql, params, Long.class);
  }

  public DocumentStats stats(LocalDate today) {
    final String sql =
        """
        SELECT COUNT(*) AS total_documents,
               COUNT(*) FILTER (WHERE md.expiry_date - :today::date <= 0) AS expired_documents,
               COUNT(*) FILTER (WHERE md.expiry_date - :today::date BETWEEN 1 AND 7) AS expiring_this_week,
               COUNT(*) FILTER (WHERE md.expiry_date - :today::date BETWEEN 8 AND 30) AS expiring_this_month,
               COALESCE(ROUND(AVG(md.expiry_date - :today::date)), 0) AS avg_days_until_expiry
        FROM machine_documents md
        JOIN machines m ON m.id = md.machine_id
        WHERE m.is_active = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("today", toSqlDate(today));
    return jdbcTemplate.queryForObject(
        sql,
        params,
        (rs, rowNum) ->
            new DocumentStats(
                rs.getLong("total_documents"),
                rs.getLong("expired_documents"),
                rs.getLong("expiring_this_week"),
                rs.getLong("expiring_this_month"),
                rs.getLong("avg_days_until_expiry")));
  }

  private MachineDocumentRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
    return new MachineDocumentRecord(
        rs.getLong("id"),
        rs.getLong("machine_id"),
        DocumentType.fromDatabase(rs.getString("document_type")),
        toLocalDate(rs.getDate("expiry_date")),
        toLocalDate(rs.getDate("last_renewed_date")),
        rs.getString("remarks"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private MachineDocumentView mapView(ResultSet rs, int rowNum) throws SQLException {
    final long daysUntilExpiry = rs.getLong("days_until_expiry");
    return new MachineDocumentView(
        rs.getLong("id"),
        rs.getLong("machine_id"),
        rs.getString("machine_number"),
        rs.getString("machine_name"),
        DocumentType.fromDatabase(rs.getString("document_type")),
        toLocalDate(rs.getDate("expiry_date")),
        toLocalDate(rs.getDate("last_renewed_date")),
        rs.getString("remarks"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")),
        daysUntilExpiry,
        ExpiryStatus.fromDaysUntilExpiry(daysUntilExpiry),
        toIntegerList(rs.getArray("notification_days")));
  }

  private List<Integer> toIntegerList(Array array) throws SQLException {
    if (array == null) {
      return List.of();
    }
    final Object raw = array.getArray();
    if (raw instanceof Integer[] values) {
      return Arrays.asList(values);
    }
    return List.of();
  }
}
