/*
 * どこで: Exchange 設定バインド
 * 何を: 期限切れワーカーの実行間隔と end_at 後に OPEN のまま残す猶予を保持する
 * なぜ: 掃除の頻度を環境ごとに調整できるようにするため
 */
package com.example.exchange.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "exchange.expiry")
public record ExchangeExpiryProperties(boolean enabled, Duration interval, Duration grace) {

  public ExchangeExpiryProperties {
    interval = interval == null ? Duration.ofMinutes(5) : interval;
    grace = grace == null ? Duration.ZERO : grace;
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("exchange.expiry.interval must be > 0");
    }
    if (grace.isNegative()) {
      throw new IllegalArgumentException("exchange.expiry.grace must be >= 0");
    }
  }
}
