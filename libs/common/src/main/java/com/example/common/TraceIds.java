/*
 * どこで: 共通のリクエスト追跡ヘルパー
 * 何を: リクエスト ID を発行し、クライアントが送った ID を検査する
 * なぜ: クライアント指定の ID はそのリクエストの全ログ行に載るため、短いトークン形式だけを受け付ける
 */
package com.example.common;

import java.util.UUID;
import java.util.regex.Pattern;

public final class TraceIds {

  static final int MAX_LENGTH = 64;

  private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9._:-]+");

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** {@code candidate} がリクエスト ID として使えればそれを、使えなければ新しい ID を返す。 */
  public static String orNew(String candidate) {
    if (candidate == null) {
      return newTraceId();
    }
    final String trimmed = candidate.trim();
    if (trimmed.isEmpty()
        || trimmed.length() > MAX_LENGTH
        || !ALLOWED.matcher(trimmed).matches()) {
      return newTraceId();
    }
    return trimmed;
  }
}
