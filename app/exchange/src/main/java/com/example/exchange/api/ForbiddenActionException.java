/*
 * どこで: Exchange API
 * 何を: 操作ユーザーが対象リソースに触れられない、またはその操作を行えないことを表す
 * なぜ: 403 応答へ変換するため
 */
package com.example.exchange.api;

public class ForbiddenActionException extends RuntimeException {
  public ForbiddenActionException(String message) {
    super(message);
  }
}
