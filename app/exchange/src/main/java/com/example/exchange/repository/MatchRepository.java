/*
 * どこで: Exchange データアクセス
 * 何を: matches テーブルへの書き込み (条件付き insert、version 付き遷移) と一覧
 * なぜ: 組の一意性と遷移の競合を 1 本の SQL で決着させるため
 */
package com.example.exchange.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.exchange.model.MatchRecord;
import com.example.exchange.model.MatchState;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MatchRepository {

  private static final String SELECT_JOINED =
      """
      SELECT m.match_id, m.offer_id, m.request_id, o.owner_id, r.seeker_id, m.state,
             m.overlap_seconds, m.distance_meters, m.version, m.created_at,
             m.last_transition_at, m.last_transition_actor
      FROM matches m
      JOIN offers o ON o.offer_id = m.offer_id
      JOIN care_requests r ON r.request_id = m.request_id
      """;

  private static final String SCORE_ORDER =
      """
      ORDER BY m.overlap_seconds DESC, m.distance_meters ASC, m.created_at DESC, m.match_id
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 役割: 組に終端でないマッチがなければ PENDING のマッチを insert する。
   *
   * @return 新しいマッチ ID。部分一意インデックスに弾かれたときは空
   */
  public Optional<UUID> insertPendingIfAbsent(
      UUID matchId,
      UUID offerId,
      UUID requestId,
      long overlapSeconds,
      double distanceMeters,
      String actor,
      Instant now) {
    final String sql =
        """
        INSERT INTO matches (
          match_id, offer_id, request_id, state, overlap_seconds, distance_meters, version,
          created_at, last_transition_at, last_transition_actor
        ) VALUES (
          :matchId, :offerId, :requestId, 'PENDING', :overlapSeconds, :distanceMeters, 0,
          :now, :now, :actor
        )
        ON CONFLICT (offer_id, request_id) WHERE state IN ('PENDING', 'ACCEPTED')
        DO NOTHING
        RETURNING match_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("matchId", matchId)
            .addValue("offerId", offerId)
            .addValue("requestId", requestId)
            .addValue("overlapSeconds", overlapSeconds)
            .addValue("distanceMeters", distanceMeters)
            .addValue("actor", actor)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> rs.getObject("match_id", UUID.class))
        .stream()
        .findFirst();
  }

  public Optional<MatchRecord> findActiveByPair(UUID offerId, UUID requestId) {
    final String sql =
        SELECT_JOINED
            + """
            WHERE m.offer_id = :offerId
              AND m.request_id = :requestId
              AND m.state IN ('PENDING', 'ACCEPTED')
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("offerId", offerId).addValue("requestId", requestId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<MatchRecord> findById(UUID matchId) {
    final String sql = SELECT_JOINED + "WHERE m.match_id = :matchId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("matchId", matchId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * 役割: {@code expectedVersion} を読んだ後に誰も変更していない場合だけ、マッチを {@code from} から {@code to} へ移す。
   *
   * @return 更新後のマッチ。version か状態が一致しなくなっていれば空
   */
  public Optional<MatchRecord> compareAndSetState(
      UUID matchId,
      long expectedVersion,
      MatchState from,
      MatchState to,
      String actor,
      Instant now) {
    final String sql =
        """
        UPDATE matches m
        SET state = :to,
            version = m.version + 1,
            last_transition_at = :now,
            last_transition_actor = :actor
        FROM offers o, care_requests r
        WHERE m.match_id = :matchId
          AND m.version = :expectedVersion
          AND m.state = :from
          AND o.offer_id = m.offer_id
          AND r.request_id = m.request_id
        RETURNING m.match_id, m.offer_id, m.request_id, o.owner_id, r.seeker_id, m.state,
                  m.overlap_seconds, m.distance_meters, m.version, m.created_at,
                  m.last_transition_at, m.last_transition_actor
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("matchId", matchId)
            .addValue("expectedVersion", expectedVersion)
            .addValue("from", from.name())
            .addValue("to", to.name())
            .addValue("actor", actor)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** {@code userId} の操作待ちの終端でないマッチ。オファー側は PENDING、リクエスト側は ACCEPTED。 */
  public List<MatchRecord> findAwaiting(String userId, int limit, int offset) {
    final String sql =
        SELECT_JOINED
            + """
            WHERE (m.state = 'PENDING' AND o.owner_id = :userId)
               OR (m.state = 'ACCEPTED' AND r.seeker_id = :userId)
            """
            + SCORE_ORDER
            + "LIMIT :limit OFFSET :offset";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public long countAwaiting(String userId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM matches m
        JOIN offers o ON o.offer_id = m.offer_id
        JOIN care_requests r ON r.request_id = m.request_id
        WHERE (m.state = 'PENDING' AND o.owner_id = :userId)
           OR (m.state = 'ACCEPTED' AND r.seeker_id = :userId)
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0 : count;
  }

  /** {@code userId} が当事者のすべてのマッチ。1 つの状態に絞り込める。 */
  public List<MatchRecord> findByParticipant(
      String userId, MatchState state, int limit, int offset) {
    final String sql =
        SELECT_JOINED
            + """
            WHERE (o.owner_id = :userId OR r.seeker_id = :userId)
              AND (CAST(:state AS VARCHAR) IS NULL OR m.state = :state)
            """
            + SCORE_ORDER
            + "LIMIT :limit OFFSET :offset";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("state", state == null ? null : state.name(), Types.VARCHAR)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public long countByParticipant(String userId, MatchState state) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM matches m
        JOIN offers o ON o.offer_id = m.offer_id
        JOIN care_requests r ON r.request_id = m.request_id
        WHERE (o.owner_id = :userId OR r.seeker_id = :userId)
          AND (CAST(:state AS VARCHAR) IS NULL OR m.state = :state)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("state", state == null ? null : state.name(), Types.VARCHAR);
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0 : count;
  }

  private MatchRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MatchRecord(
        rs.getObject("match_id", UUID.class),
        rs.getObject("offer_id", UUID.class),
        rs.getObject("request_id", UUID.class),
        rs.getString("owner_id"),
        rs.getString("seeker_id"),
        MatchState.valueOf(rs.getString("state")),
        rs.getLong("overlap_seconds"),
        rs.getDouble("distance_meters"),
        rs.getLong("version"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("last_transition_at")),
        rs.getString("last_transition_actor"));
  }
}
