/*
 * どこで: Exchange サービス層
 * 何を: 期間が終わったオファーとリクエストを EXPIRED にする
 * なぜ: 期限切れのレコードを候補や OPEN の一覧に出さないため
 */
package com.example.exchange.service;

import com.example.exchange.config.ExchangeExpiryProperties;
import com.example.exchange.repository.AvailabilityStore;
import com.example.exchange.repository.AvailabilityStore.ExpiredCounts;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AvailabilityExpiryService {

  private static final Logger logger = LoggerFactory.getLogger(AvailabilityExpiryService.class);

  private final AvailabilityStore availabilityStore;
  private final ExchangeExpiryProperties properties;
  private final Clock clock;

  public ExpiredCounts expire() {
    final Instant now = Instant.now(clock);
    final ExpiredCounts counts =
        availabilityStore.expireEndedBefore(now.minus(properties.grace()), now);
    if (counts.total() > 0) {
      logger.info(
          "availability expired offers={} requests={} now={}",
          counts.offers(),
          counts.requests(),
          now);
    }
    return counts;
  }
}
