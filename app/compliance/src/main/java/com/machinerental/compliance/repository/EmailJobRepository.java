/*
 * どこで: Compliance データアクセス
 * 何を: email_jobs テーブルの登録/claim/状態更新/集計を担う
 * なぜ: 送信 IO をトランザクション外に出しつつ、複数インスタンスでも同じジョブを二重処理しないため
 */
package com.machinerental.compliance.repository;

import static com.machinerental.common.JdbcTimestampUtils.toInstant;
import static com.machinerental.common.JdbcTimestampUtils.toTimestamp;

import com.machinerental.compliance.model.EmailJobRecord;
import com.machinerental.compliance.model.EmailJobStats;
import com.machinerental.compliance.model.EmailJobStatus;
import com.machinerental.compliance.model.EmailJobType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class EmailJobRepository {

  private static final String COLUMNS =
      """
      id, type, entity_id, payload_json::text AS payload_json_text, status,
      attempts, max_attempts, error, scheduled_for, processed_at,
      locked_by, locked_at, lease_until, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(EmailJobRecord record) {
    final String sql =
        """
        INSERT INTO email_jobs (
          type,
          entity_id,
          payload_json,
          status,
          attempts,
          max_attempts,
          error,
          scheduled_for,
          processed_at,
          created_at,
          updated_at
        ) VALUES (
          :type,
          :entityId,
          :payloadJson::jsonb,
          :status,
          :attempts,
          :maxAttempts,
          :error,
          :scheduledFor,
          :processedAt,
          :createdAt,
          :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("type", record.type().code())
            .addValue("entityId", record.entityId())
            .addValue("payloadJson", record.payloadJson())
            .addValue("status", record.status().name())
            .addValue("attempts", record.attempts())
            .addValue("maxAttempts", record.maxAttempts())
            .addValue("error", record.error())
            .addValue("scheduledFor", toTimestamp(record.scheduledFor()))
            .addValue("processedAt", toTimestamp(record.processedAt()))
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    final KeyHolder keyHolder = new GeneratedKeyHolder();
    jdbcTemplate.update(sql, params, keyHolder, new String[] {"id"});
    final Number key = keyHolder.getKey();
    if (key == null) {
      throw new IllegalStateException("email_jobs insert returned no id");
    }
    return key.longValue();
  }

  public Optional<EmailJobRecord> findById(long jobId) {
    final String sql = "SELECT " + COLUMNS + "FROM email_jobs WHERE id = :jobId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("jobId", jobId), this::mapRow)
        .stream()
        .findFirst();
  }

  public List<EmailJobRecord> claimPendingForUpdate(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // 期限到来の PENDING と lease 切れの PROCESSING をまとめて claim し、競合を避ける
    final String sql =
        """
        WITH cte AS (
          SELECT id
          FROM email_jobs
          WHERE (
            status = 'PENDING'
            AND scheduled_for <= :now
          )
          OR (
            status = 'PROCESSING'
            AND (lease_until IS NULL OR lease_until <= :now)
          )
          ORDER BY scheduled_for, id
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE email_jobs j
        SET status = 'PROCESSING',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil,
            updated_at = :now
        FROM cte
        WHERE j.id = cte.id
        RETURNING j.id, j.type, j.entity_id, j.payload_json::text AS payload_json_text, j.status,
                  j.attempts, j.max_attempts, j.error, j.scheduled_for, j.processed_at,
                  j.locked_by, j.locked_at, j.lease_until, j.created_at, j.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** 指定ジョブが PENDING の場合に限り claim する。スケジュール時刻は問わない。 */
  public Optional<EmailJobRecord> claimPendingById(
      long jobId, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        UPDATE email_jobs
        SET status = 'PROCESSING',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil,
            updated_at = :now
        WHERE id = :jobId
          AND status = 'PENDING'
        RETURNING id, type, entity_id, payload_json::text AS payload_json_text, status,
                  attempts, max_attempts, error, scheduled_for, processed_at,
                  locked_by, locked_at, lease_until, created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int markCompleted(long jobId, int attempts, Instant now, String lockedBy) {
    final String sql =
        """
        UPDATE email_jobs
        SET status = 'COMPLETED',
            attempts = :attempts,
            processed_at = :now,
            error = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE id = :jobId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("attempts", attempts)
            .addValue("now", toTimestamp(now))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markRetry(
      long jobId,
      int attempts,
      Instant scheduledFor,
      boolean failed,
      String error,
      Instant now,
      String lockedBy) {
    final String sql =
        """
        UPDATE email_jobs
        SET status = :status,
            attempts = :attempts,
            scheduled_for = COALESCE(:scheduledFor, scheduled_for),
            processed_at = :processedAt,
            error = :error,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE id = :jobId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", failed ? EmailJobStatus.FAILED.name() : EmailJobStatus.PENDING.name())
            .addValue("attempts", attempts)
            .addValue("scheduledFor", failed ? null : toTimestamp(scheduledFor))
            .addValue("processedAt", failed ? toTimestamp(now) : null)
            .addValue("error", error)
            .addValue("now", toTimestamp(now))
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /** FAILED のジョブだけを試行回数 0 の PENDING に戻す。 */
  public int resetFailed(long jobId, Instant now) {
    final String sql =
        """
        UPDATE email_jobs
        SET status = 'PENDING',
            attempts = 0,
            error = NULL,
            processed_at = NULL,
            scheduled_for = :now,
            updated_at = :now
        WHERE id = :jobId
          AND status = 'FAILED'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobId", jobId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public List<EmailJobRecord> findByTypeAndStatus(
      EmailJobType type, EmailJobStatus status, String entityId, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM email_jobs
            WHERE type = :type
              AND (CAST(:status AS VARCHAR) IS NULL OR status = :status)
              AND (CAST(:entityId AS VARCHAR) IS NULL OR entity_id = :entityId)
            ORDER BY created_at DESC, id DESC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("type", type.code())
            .addValue("status", status == null ? null : status.name())
            .addValue("entityId", entityId)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public boolean existsCompletedBetween(
      EmailJobType type, String entityId, Instant from, Instant until) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM email_jobs
          WHERE type = :type
            AND entity_id = :entityId
            AND status = 'COMPLETED'
            AND processed_at >= :from
            AND processed_at < :until
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("type", type.code())
            .addValue("entityId", entityId)
            .addValue("from", toTimestamp(from))
            .addValue("until", toTimestamp(until));
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public int countPending() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM email_jobs WHERE status = 'PENDING'",
            new MapSqlParameterSource(),
            Integer.class);
    return count == null ? 0 : count;
  }

  public EmailJobStats stats(EmailJobType type, Instant since, Instant last24hSince) {
    final String sql =
        """
        SELECT COUNT(*) AS total_jobs,
               COUNT(*) FILTER (WHERE status = 'COMPLETED') AS completed,
               COUNT(*) FILTER (WHERE status = 'FAILED') AS failed,
               COUNT(*) FILTER (WHERE status = 'PENDING') AS pending,
               COUNT(*) FILTER (WHERE created_at >= :last24hSince) AS last_24h
        FROM email_jobs
        WHERE type = :type
          AND created_at >= :since
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("type", type.code())
            .addValue("since", toTimestamp(since))
            .addValue("last24hSince", toTimestamp(last24hSince));
    return jdbcTemplate.queryForObject(
        sql,
        params,
        (rs, rowNum) ->
            new EmailJobStats(
                rs.getLong("total_jobs"),
                rs.getLong("completed"),
                rs.getLong("failed"),
                rs.getLong("pending"),
                rs.getLong("last_24h")));
  }

  public int deleteCompletedOrFailedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM email_jobs
        WHERE created_at < :threshold
          AND status IN ('COMPLETED', 'FAILED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countStaleActive(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM email_jobs
        WHERE created_at < :threshold
          AND status IN ('PENDING', 'PROCESSING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private EmailJobRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new EmailJobRecord(
        rs.getLong("id"),
        EmailJobType.fromCode(rs.getString("type")),
        rs.getString("entity_id"),
        rs.getString("payload_json_text"),
        EmailJobStatus.valueOf(rs.getString("status")),
        rs.getInt("attempts"),
        rs.getInt("max_attempts"),
        rs.getString("error"),
        toInstant(rs.getTimestamp("scheduled_for")),
        toInstant(rs.getTimestamp("processed_at")),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("locked_at")),
        toInstant(rs.getTimestamp("lease_until")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
