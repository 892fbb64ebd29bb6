/*
 * どこで: Exchange API レスポンス DTO
 * 何を: 一覧の 1 ページと総件数
 * なぜ: オファー、リクエスト、マッチ、検索の一覧で同じページ形を共有するため
 */
package com.example.exchange.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PageResponse<T>(List<T> items, long total, int page, int pageSize) {
  public PageResponse {
    items = items == null ? List.of() : List.copyOf(items);
  }

  @JsonProperty("has_more")
  public boolean hasMore() {
    return (long) page * pageSize < total;
  }
}
