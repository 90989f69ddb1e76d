/*
 * どこで: Compliance データアクセス
 * 何を: machines テーブルを参照する
 * なぜ: 機械マスタは別系統で管理され、本サービスは存在/稼働状態の確認だけを行うため
 */
package com.machinerental.compliance.repository;

import com.machinerental.compliance.model.MachineRecord;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MachineRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<MachineRecord> findById(long machineId) {
    final String sql =
        """
        SELECT id, machine_number, name, is_active
        FROM machines
        WHERE id = :machineId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("machineId", machineId);
    final List<MachineRecord> rows =
        jdbcTemplate.query(
            sql,
            params,
            (rs, rowNum) ->
                new MachineRecord(
                    rs.getLong("id"),
                    rs.getString("machine_number"),
                    rs.getString("name"),
                    rs.getBoolean("is_active")));
    return rows.stream().findFirst();
  }
}
