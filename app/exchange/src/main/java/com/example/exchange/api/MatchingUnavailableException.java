package com.example.exchange.api;

/** 候補スキャンが一時的な DB エラーで失敗し続け、リトライ回数を使い切ったことを表す。 */
public class MatchingUnavailableException extends RuntimeException {
  public MatchingUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
