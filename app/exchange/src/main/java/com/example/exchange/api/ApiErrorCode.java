/*
 * どこで: Exchange API
 * 何を: エラーボディで返すエラーコード
 * なぜ: 同じ HTTP ステータスでもクライアントが原因を区別できるようにするため
 */
package com.example.exchange.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  FORBIDDEN,
  NOT_FOUND,
  STALE_TRANSITION,
  MATCHING_UNAVAILABLE,
  INTERNAL_ERROR
}
