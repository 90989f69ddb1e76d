/*
 * どこで: Compliance データアクセス
 * 何を: notification_defaults と子テーブル notification_default_days の参照/置き換えを担う
 * なぜ: 既定日数を正規化した行として保持し、範囲単位で丸ごと差し替えるため
 */
package com.machinerental.compliance.repository;

import static com.machinerental.common.JdbcTimestampUtils.toInstant;
import static com.machinerental.common.JdbcTimestampUtils.toTimestamp;

import com.machinerental.compliance.model.NotificationDefault;
import com.machinerental.compliance.model.NotificationScope;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationDefaultRepository {

  private static final String SELECT_DEFAULTS =
      """
      SELECT d.scope, d.is_active, d.created_by, d.updated_at,
             COALESCE(
               ARRAY_AGG(dd.days_before ORDER BY dd.days_before DESC)
                 FILTER (WHERE dd.days_before IS NOT NULL),
               ARRAY[]::integer[]) AS days_before
      FROM notification_defaults d
      LEFT JOIN notification_default_days dd ON dd.scope = d.scope
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<NotificationDefault> findAll() {
    final String sql = SELECT_DEFAULTS + "GROUP BY d.scope\nORDER BY d.scope\n";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public Optional<NotificationDefault> findByScope(NotificationScope scope) {
    final String sql = SELECT_DEFAULTS + "WHERE d.scope = :scope\nGROUP BY d.scope\n";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("scope", scope.wireName());
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** 範囲の既定を有効化して日数を丸ごと差し替える。呼び出し側のトランザクション内で使う。 */
  public void replace(
      NotificationScope scope, Collection<Integer> daysBefore, String actor, Instant now) {
    final String upsertSql =
        """
        INSERT INTO notification_defaults (scope, is_active, created_by, created_at, updated_at)
        VALUES (:scope, TRUE, :actor, :now, :now)
        ON CONFLICT (scope) DO UPDATE
        SET is_active = TRUE,
            created_by = EXCLUDED.created_by,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("scope", scope.wireName())
            .addValue("actor", actor)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(upsertSql, params);
    jdbcTemplate.update(
        "DELETE FROM notification_default_days WHERE scope = :scope",
        new MapSqlParameterSource().addValue("scope", scope.wireName()));
    final String insertDaysSql =
        """
        INSERT INTO notification_default_days (scope, days_before)
        VALUES (:scope, :daysBefore)
        """;
    final SqlParameterSource[] batch =
        daysBefore.stream()
            .map(
                days ->
                    new MapSqlParameterSource()
                        .addValue("scope", scope.wireName())
                        .addValue("daysBefore", days))
            .toArray(SqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(insertDaysSql, batch);
  }

  private NotificationDefault mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String scope = rs.getString("scope");
    return new NotificationDefault(
        NotificationScope.fromWireName(scope)
            .orElseThrow(() -> new IllegalStateException("unknown scope in database: " + scope)),
        toIntegerList(rs.getArray("days_before")),
        rs.getBoolean("is_active"),
        rs.getString("created_by"),
        toInstant(rs.getTimestamp("updated_at")));
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
