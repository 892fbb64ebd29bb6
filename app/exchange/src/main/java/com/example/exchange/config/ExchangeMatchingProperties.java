/*
 * どこで: Exchange 設定バインド
 * 何を: 候補スキャンのリトライ回数とバックオフを保持する
 * なぜ: 一時的な DB 障害を上限つきでリトライするため
 */
package com.example.exchange.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "exchange.matching")
public record ExchangeMatchingProperties(
    Integer maxAttempts, Duration backoffBase, Duration backoffMax) {

  public ExchangeMatchingProperties {
    maxAttempts = maxAttempts == null ? 3 : maxAttempts;
    backoffBase = backoffBase == null ? Duration.ofMillis(100) : backoffBase;
    backoffMax = backoffMax == null ? Duration.ofSeconds(2) : backoffMax;
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("exchange.matching.max-attempts must be >= 1");
    }
    if (backoffBase.isNegative() || backoffBase.isZero()) {
      throw new IllegalArgumentException("exchange.matching.backoff-base must be > 0");
    }
    if (backoffMax.compareTo(backoffBase) < 0) {
      throw new IllegalArgumentException(
          "exchange.matching.backoff-max must be >= exchange.matching.backoff-base");
    }
  }
}
