/*
 * どこで: Exchange 設定バインド
 * 何を: フィード/受信箱/一覧/会話のページ幅上限を保持する
 * なぜ: すべての一覧クエリを有界にするため
 */
package com.example.exchange.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "exchange.feed")
public record ExchangeFeedProperties(
    Integer defaultLimit, Integer maxLimit, Integer maxPageSize, Integer conversationLimit) {

  public ExchangeFeedProperties {
    defaultLimit = defaultLimit == null ? 50 : defaultLimit;
    maxLimit = maxLimit == null ? 200 : maxLimit;
    maxPageSize = maxPageSize == null ? 100 : maxPageSize;
    conversationLimit = conversationLimit == null ? 100 : conversationLimit;
    if (defaultLimit < 1 || maxPageSize < 1 || conversationLimit < 1) {
      throw new IllegalArgumentException("exchange.feed limits must be > 0");
    }
    // 既定値が上限を超えると引数なしのリクエストが 400 になる
    if (maxLimit < defaultLimit || maxLimit < conversationLimit) {
      throw new IllegalArgumentException(
          "exchange.feed.max-limit must be >= default-limit and conversation-limit");
    }
  }
}
