/*
 * どこで: Exchange ライブチャネル
 * 何を: 送信が送信時間上限を超えたことを表す
 * なぜ: 配信側は IOException として受け取り、接続を登録解除して閉じるため
 */
package com.example.exchange.live;

import java.io.IOException;

public class LiveSendTimeoutException extends IOException {

  public LiveSendTimeoutException(String message) {
    super(message);
  }

  public LiveSendTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
