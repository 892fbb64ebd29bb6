/*
 * どこで: Exchange ドメインモデル
 * 何を: オファー/リクエストの検索条件 (期間、自分の除外、並び順) を保持する
 * なぜ: 並び替え列をここで列挙型に固定し、SQL へ任意の文字列が入らないようにするため
 */
package com.example.exchange.model;

import java.time.Instant;
import java.util.Locale;

/**
 * @param startFrom この時刻以降に始まるものだけ。null なら制限なし
 * @param endBy この時刻までに終わるものだけ。null なら制限なし
 * @param excludeUserId このユーザーの投稿を除く。null なら除外なし
 */
public record AvailabilitySearch(
    Instant startFrom, Instant endBy, String excludeUserId, SortField sortField, boolean descending) {

  public static final String DEFAULT_SORT = "-start_at";

  public AvailabilitySearch {
    sortField = sortField == null ? SortField.START_AT : sortField;
  }

  /**
   * 役割: クエリ文字列の sort を解釈して検索条件を作る。
   * 動作: 先頭の {@code -} で降順、残りを列名として照合する。未知の列名は start_at として扱う。
   * 前提: sort が null または空なら {@link #DEFAULT_SORT}。
   */
  public static AvailabilitySearch of(
      Instant startFrom, Instant endBy, String excludeUserId, String sort) {
    final String value = sort == null || sort.isBlank() ? DEFAULT_SORT : sort.trim();
    final boolean descending = value.startsWith("-");
    final String field = descending ? value.substring(1) : value;
    return new AvailabilitySearch(
        startFrom, endBy, excludeUserId, SortField.fromValue(field), descending);
  }

  public enum SortField {
    START_AT("start_at"),
    END_AT("end_at"),
    CREATED_AT("created_at");

    private final String column;

    SortField(String column) {
      this.column = column;
    }

    /** offers と care_requests で共通の列名。 */
    public String column() {
      return column;
    }

    static SortField fromValue(String value) {
      for (SortField field : values()) {
        if (field.column.equals(value.toLowerCase(Locale.ROOT))) {
          return field;
        }
      }
      return START_AT;
    }
  }
}
