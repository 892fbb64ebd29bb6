/*
 * どこで: Exchange 設定バインド
 * 何を: WebSocket エンドポイント、接続ごとの送信上限、バックフィルのページ幅、配信プールを保持する
 * なぜ: 遅い端末が配信スレッドを送信時間上限より長く占有しないようにするため
 */
package com.example.exchange.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "exchange.live")
public record ExchangeLiveProperties(
    String path,
    List<String> allowedOrigins,
    Duration sendTimeLimit,
    Integer bufferSizeLimit,
    Integer backfillPageSize,
    Integer dispatchPoolSize,
    Integer dispatchQueueCapacity) {

  static final String DEFAULT_PATH = "/ws/notifications";
  static final Duration DEFAULT_SEND_TIME_LIMIT = Duration.ofSeconds(3);
  static final int DEFAULT_BUFFER_SIZE_LIMIT = 512 * 1024;
  static final int DEFAULT_BACKFILL_PAGE_SIZE = 100;
  static final int DEFAULT_DISPATCH_POOL_SIZE = 8;
  static final int DEFAULT_DISPATCH_QUEUE_CAPACITY = 10_000;

  public ExchangeLiveProperties {
    path = path == null || path.isBlank() ? DEFAULT_PATH : path;
    allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
    sendTimeLimit = sendTimeLimit == null ? DEFAULT_SEND_TIME_LIMIT : sendTimeLimit;
    bufferSizeLimit = bufferSizeLimit == null ? DEFAULT_BUFFER_SIZE_LIMIT : bufferSizeLimit;
    backfillPageSize = backfillPageSize == null ? DEFAULT_BACKFILL_PAGE_SIZE : backfillPageSize;
    dispatchPoolSize = dispatchPoolSize == null ? DEFAULT_DISPATCH_POOL_SIZE : dispatchPoolSize;
    dispatchQueueCapacity =
        dispatchQueueCapacity == null ? DEFAULT_DISPATCH_QUEUE_CAPACITY : dispatchQueueCapacity;
    if (sendTimeLimit.isNegative() || sendTimeLimit.isZero()) {
      throw new IllegalArgumentException("exchange.live.send-time-limit must be > 0");
    }
    requirePositive(bufferSizeLimit, "buffer-size-limit");
    requirePositive(backfillPageSize, "backfill-page-size");
    requirePositive(dispatchPoolSize, "dispatch-pool-size");
    if (dispatchQueueCapacity < 0) {
      throw new IllegalArgumentException("exchange.live.dispatch-queue-capacity must be >= 0");
    }
  }

  private static void requirePositive(int value, String name) {
    if (value < 1) {
      throw new IllegalArgumentException("exchange.live." + name + " must be > 0");
    }
  }
}
