/*
 * どこで: Exchange データアクセス
 * 何を: オファー/リクエストストアの PostgreSQL 実装
 * なぜ: 期間の重なりは SQL で絞り、リクエストごとに半径が違う距離判定は重なった行に対して行うため
 */
package com.example.exchange.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.exchange.model.AvailabilitySearch;
import com.example.exchange.model.AvailabilityStatus;
import com.example.exchange.model.CareRequestRecord;
import com.example.exchange.model.MatchCandidate;
import com.example.exchange.model.OfferRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
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
public class JdbcAvailabilityStore implements AvailabilityStore {

  private static final String OFFER_COLUMNS =
      """
      offer_id, owner_id, dog_id, start_at, end_at, latitude, longitude, status,
      created_at, updated_at
      """;

  private static final String REQUEST_COLUMNS =
      """
      request_id, seeker_id, start_at, end_at, latitude, longitude, radius_meters, status,
      created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public OfferRecord insertOffer(OfferRecord offer) {
    final String sql =
        """
        INSERT INTO offers (
          offer_id, owner_id, dog_id, start_at, end_at, latitude, longitude, status,
          created_at, updated_at
        ) VALUES (
          :offerId, :ownerId, :dogId, :startAt, :endAt, :latitude, :longitude, :status,
          :createdAt, :updatedAt
        )
        """;
    jdbcTemplate.update(sql, offerParams(offer));
    return offer;
  }

  @Override
  public Optional<OfferRecord> updateOpenOffer(OfferRecord offer) {
    final String sql =
        """
        UPDATE offers
        SET dog_id = :dogId,
            start_at = :startAt,
            end_at = :endAt,
            latitude = :latitude,
            longitude = :longitude,
            updated_at = :updatedAt
        WHERE offer_id = :offerId
          AND owner_id = :ownerId
          AND status = 'OPEN'
        RETURNING
        """
            + OFFER_COLUMNS;
    return jdbcTemplate.query(sql, offerParams(offer), this::mapOffer).stream().findFirst();
  }

  @Override
  public Optional<OfferRecord> findOffer(UUID offerId) {
    final String sql = "SELECT " + OFFER_COLUMNS + " FROM offers WHERE offer_id = :offerId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("offerId", offerId);
    return jdbcTemplate.query(sql, params, this::mapOffer).stream().findFirst();
  }

  @Override
  public int withdrawOffer(UUID offerId, Instant now) {
    final String sql =
        """
        UPDATE offers
        SET status = 'WITHDRAWN',
            updated_at = :now
        WHERE offer_id = :offerId
          AND status = 'OPEN'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("offerId", offerId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public List<OfferRecord> findOffersByOwner(String ownerId, int limit, int offset) {
    final String sql =
        "SELECT "
            + OFFER_COLUMNS
            + """
            FROM offers
            WHERE owner_id = :ownerId
            ORDER BY start_at DESC, offer_id
            LIMIT :limit OFFSET :offset
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapOffer);
  }

  @Override
  public long countOffersByOwner(String ownerId) {
    final String sql = "SELECT COUNT(*) FROM offers WHERE owner_id = :ownerId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerId", ownerId);
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0 : count;
  }

  @Override
  public CareRequestRecord insertRequest(CareRequestRecord request) {
    final String sql =
        """
        INSERT INTO care_requests (
          request_id, seeker_id, start_at, end_at, latitude, longitude, radius_meters, status,
          created_at, updated_at
        ) VALUES (
          :requestId, :seekerId, :startAt, :endAt, :latitude, :longitude, :radiusMeters, :status,
          :createdAt, :updatedAt
        )
        """;
    jdbcTemplate.update(sql, requestParams(request));
    return request;
  }

  @Override
  public Optional<CareRequestRecord> updateOpenRequest(CareRequestRecord request) {
    final String sql =
        """
        UPDATE care_requests
        SET start_at = :startAt,
            end_at = :endAt,
            latitude = :latitude,
            longitude = :longitude,
            radius_meters = :radiusMeters,
            updated_at = :updatedAt
        WHERE request_id = :requestId
          AND seeker_id = :seekerId
          AND status = 'OPEN'
        RETURNING
        """
            + REQUEST_COLUMNS;
    return jdbcTemplate.query(sql, requestParams(request), this::mapRequest).stream().findFirst();
  }

  @Override
  public Optional<CareRequestRecord> findRequest(UUID requestId) {
    final String sql =
        "SELECT " + REQUEST_COLUMNS + " FROM care_requests WHERE request_id = :requestId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("requestId", requestId);
    return jdbcTemplate.query(sql, params, this::mapRequest).stream().findFirst();
  }

  @Override
  public int withdrawRequest(UUID requestId, Instant now) {
    final String sql =
        """
        UPDATE care_requests
        SET status = 'WITHDRAWN',
            updated_at = :now
        WHERE request_id = :requestId
          AND status = 'OPEN'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", requestId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public List<CareRequestRecord> findRequestsBySeeker(String seekerId, int limit, int offset) {
    final String sql =
        "SELECT "
            + REQUEST_COLUMNS
            + """
            FROM care_requests
            WHERE seeker_id = :seekerId
            ORDER BY start_at DESC, request_id
            LIMIT :limit OFFSET :offset
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("seekerId", seekerId)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRequest);
  }

  @Override
  public long countRequestsBySeeker(String seekerId) {
    final String sql = "SELECT COUNT(*) FROM care_requests WHERE seeker_id = :seekerId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("seekerId", seekerId);
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0 : count;
  }

  @Override
  public List<OfferRecord> searchOffers(AvailabilitySearch search, int limit, int offset) {
    final String sql =
        "SELECT "
            + OFFER_COLUMNS
            + "FROM offers"
            + searchFilter(search, "owner_id")
            + searchOrder(search, "offer_id")
            + " LIMIT :limit OFFSET :offset";
    return jdbcTemplate.query(sql, pagedSearchParams(search, limit, offset), this::mapOffer);
  }

  @Override
  public long countOffers(AvailabilitySearch search) {
    final String sql = "SELECT COUNT(*) FROM offers" + searchFilter(search, "owner_id");
    final Long count = jdbcTemplate.queryForObject(sql, searchParams(search), Long.class);
    return count == null ? 0 : count;
  }

  @Override
  public List<CareRequestRecord> searchRequests(AvailabilitySearch search, int limit, int offset) {
    final String sql =
        "SELECT "
            + REQUEST_COLUMNS
            + "FROM care_requests"
            + searchFilter(search, "seeker_id")
            + searchOrder(search, "request_id")
            + " LIMIT :limit OFFSET :offset";
    return jdbcTemplate.query(sql, pagedSearchParams(search, limit, offset), this::mapRequest);
  }

  @Override
  public long countRequests(AvailabilitySearch search) {
    final String sql = "SELECT COUNT(*) FROM care_requests" + searchFilter(search, "seeker_id");
    final Long count = jdbcTemplate.queryForObject(sql, searchParams(search), Long.class);
    return count == null ? 0 : count;
  }

  @Override
  public List<CareRequestRecord> requestsOverlapping(OfferRecord offer) {
    final String sql =
        "SELECT "
            + REQUEST_COLUMNS
            + """
            FROM care_requests
            WHERE status = 'OPEN'
              AND seeker_id <> :userId
              AND start_at < :endAt
              AND end_at > :startAt
            """;
    final MapSqlParameterSource params =
        overlapParams(offer.ownerId(), offer.startAt(), offer.endAt());
    return jdbcTemplate.query(sql, params, this::mapRequest).stream()
        .filter(request -> MatchCandidate.evaluate(offer, request).isPresent())
        .toList();
  }

  @Override
  public List<OfferRecord> offersOverlapping(CareRequestRecord request) {
    final String sql =
        "SELECT "
            + OFFER_COLUMNS
            + """
            FROM offers
            WHERE status = 'OPEN'
              AND owner_id <> :userId
              AND start_at < :endAt
              AND end_at > :startAt
            """;
    final MapSqlParameterSource params =
        overlapParams(request.seekerId(), request.startAt(), request.endAt());
    return jdbcTemplate.query(sql, params, this::mapOffer).stream()
        .filter(offer -> MatchCandidate.evaluate(offer, request).isPresent())
        .toList();
  }

  @Override
  public ExpiredCounts expireEndedBefore(Instant threshold, Instant now) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("threshold", toTimestamp(threshold))
            .addValue("now", toTimestamp(now));
    final int offers =
        jdbcTemplate.update(
            """
            UPDATE offers
            SET status = 'EXPIRED',
                updated_at = :now
            WHERE status = 'OPEN'
              AND end_at <= :threshold
            """,
            params);
    final int requests =
        jdbcTemplate.update(
            """
            UPDATE care_requests
            SET status = 'EXPIRED',
                updated_at = :now
            WHERE status = 'OPEN'
              AND end_at <= :threshold
            """,
            params);
    return new ExpiredCounts(offers, requests);
  }

  // 列名は呼び出し側の定数と SortField からのみ組み立てる
  private static String searchFilter(AvailabilitySearch search, String userColumn) {
    final StringBuilder where = new StringBuilder(" WHERE status = 'OPEN'");
    if (search.startFrom() != null) {
      where.append(" AND start_at >= :startFrom");
    }
    if (search.endBy() != null) {
      where.append(" AND end_at <= :endBy");
    }
    if (search.excludeUserId() != null) {
      where.append(" AND ").append(userColumn).append(" <> :excludeUserId");
    }
    return where.toString();
  }

  private static String searchOrder(AvailabilitySearch search, String idColumn) {
    return " ORDER BY "
        + search.sortField().column()
        + (search.descending() ? " DESC" : " ASC")
        + ", "
        + idColumn;
  }

  private MapSqlParameterSource searchParams(AvailabilitySearch search) {
    return new MapSqlParameterSource()
        .addValue("startFrom", toTimestamp(search.startFrom()))
        .addValue("endBy", toTimestamp(search.endBy()))
        .addValue("excludeUserId", search.excludeUserId());
  }

  private MapSqlParameterSource pagedSearchParams(
      AvailabilitySearch search, int limit, int offset) {
    return searchParams(search).addValue("limit", limit).addValue("offset", offset);
  }

  private MapSqlParameterSource overlapParams(String userId, Instant startAt, Instant endAt) {
    return new MapSqlParameterSource()
        .addValue("userId", userId)
        .addValue("startAt", toTimestamp(startAt))
        .addValue("endAt", toTimestamp(endAt));
  }

  private MapSqlParameterSource offerParams(OfferRecord offer) {
    return new MapSqlParameterSource()
        .addValue("offerId", offer.offerId())
        .addValue("ownerId", offer.ownerId())
        .addValue("dogId", offer.dogId())
        .addValue("startAt", toTimestamp(offer.startAt()))
        .addValue("endAt", toTimestamp(offer.endAt()))
        .addValue("latitude", offer.latitude())
        .addValue("longitude", offer.longitude())
        .addValue("status", offer.status().name())
        .addValue("createdAt", toTimestamp(offer.createdAt()))
        .addValue("updatedAt", toTimestamp(offer.updatedAt()));
  }

  private MapSqlParameterSource requestParams(CareRequestRecord request) {
    return new MapSqlParameterSource()
        .addValue("requestId", request.requestId())
        .addValue("seekerId", request.seekerId())
        .addValue("startAt", toTimestamp(request.startAt()))
        .addValue("endAt", toTimestamp(request.endAt()))
        .addValue("latitude", request.latitude())
        .addValue("longitude", request.longitude())
        .addValue("radiusMeters", request.radiusMeters())
        .addValue("status", request.status().name())
        .addValue("createdAt", toTimestamp(request.createdAt()))
        .addValue("updatedAt", toTimestamp(request.updatedAt()));
  }

  private OfferRecord mapOffer(ResultSet rs, int rowNum) throws SQLException {
    return new OfferRecord(
        rs.getObject("offer_id", UUID.class),
        rs.getString("owner_id"),
        rs.getString("dog_id"),
        toInstant(rs.getTimestamp("start_at")),
        toInstant(rs.getTimestamp("end_at")),
        rs.getDouble("latitude"),
        rs.getDouble("longitude"),
        AvailabilityStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private CareRequestRecord mapRequest(ResultSet rs, int rowNum) throws SQLException {
    return new CareRequestRecord(
        rs.getObject("request_id", UUID.class),
        rs.getString("seeker_id"),
        toInstant(rs.getTimestamp("start_at")),
        toInstant(rs.getTimestamp("end_at")),
        rs.getDouble("latitude"),
        rs.getDouble("longitude"),
        rs.getDouble("radius_meters"),
        AvailabilityStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
