/*
 * どこで: Exchange API レスポンス DTO
 * 何を: オファー/リクエスト登録・更新の結果と、それで生まれたマッチ
 * なぜ: 呼び出し側がポーリングせずに新しいマッチを知るため
 */
package com.example.exchange.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AvailabilityUpsertResponse(UUID id, String status, List<UUID> matchIds) {
  public AvailabilityUpsertResponse {
    matchIds = matchIds == null ? List.of() : List.copyOf(matchIds);
  }
}
