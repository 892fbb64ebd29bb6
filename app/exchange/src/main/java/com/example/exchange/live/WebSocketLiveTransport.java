/*
 * どこで: Exchange ライブチャネル
 * 何を: 送信時間上限とバッファ上限つきで WebSocket セッションへ書き込む
 * なぜ: 止まった端末への書き込みが配信スレッドを上限より長く占有しないようにするため
 */
package com.example.exchange.live;

import jakarta.websocket.Session;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.adapter.NativeWebSocketSession;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

public class WebSocketLiveTransport implements LiveTransport {

  private static final Logger logger = LoggerFactory.getLogger(WebSocketLiveTransport.class);

  // Tomcat はこのユーザープロパティ (ms, Long) をブロッキング送信のタイムアウトとして使う
  static final String BLOCKING_SEND_TIMEOUT_PROPERTY =
      "org.apache.tomcat.websocket.BLOCKING_SEND_TIMEOUT";

  private final WebSocketSession session;
  private final Duration sendTimeLimit;
  private final TaskScheduler watchdog;
  private final AtomicBoolean timedOut = new AtomicBoolean();

  public WebSocketLiveTransport(
      WebSocketSession session,
      Duration sendTimeLimit,
      int bufferSizeLimit,
      TaskScheduler watchdog) {
    applyContainerSendTimeout(session, sendTimeLimit);
    this.session =
        new ConcurrentWebSocketSessionDecorator(
            session, (int) sendTimeLimit.toMillis(), bufferSizeLimit);
    this.sendTimeLimit = sendTimeLimit;
    this.watchdog = watchdog;
  }

  /**
   * 役割: 1 フレームを送信する。
   * 動作: 送信時間上限で期限タスクを登録し、期限までに書き込みが終わらなければセッションを閉じて {@link LiveSendTimeoutException} を投げる。
   * 前提: 一度期限切れになった transport への送信はすべて失敗する。
   */
  @Override
  public void send(String payload) throws IOException {
    if (timedOut.get()) {
      throw new LiveSendTimeoutException(timeoutMessage());
    }
    final ScheduledFuture<?> deadline =
        watchdog.schedule(this::abortStalledSend, Instant.now().plus(sendTimeLimit));
    try {
      session.sendMessage(new TextMessage(payload));
    } catch (IOException | RuntimeException ex) {
      if (timedOut.get()) {
        throw new LiveSendTimeoutException(timeoutMessage(), ex);
      }
      throw ex;
    } finally {
      deadline.cancel(false);
    }
    // 閉じた後のデコレータは送信を黙って捨てるため、ここで失敗を返す
    if (timedOut.get()) {
      throw new LiveSendTimeoutException(timeoutMessage());
    }
  }

  @Override
  public boolean isOpen() {
    return !timedOut.get() && session.isOpen();
  }

  @Override
  public void close() {
    try {
      session.close(CloseStatus.SESSION_NOT_RELIABLE);
    } catch (IOException ex) {
      logger.debug("websocket close failed session_id={}", session.getId(), ex);
    }
  }

  private void abortStalledSend() {
    if (timedOut.compareAndSet(false, true)) {
      logger.warn(
          "live send exceeded time limit; closing session_id={} limit_ms={}",
          session.getId(),
          sendTimeLimit.toMillis());
      close();
    }
  }

  private String timeoutMessage() {
    return "send to session "
        + session.getId()
        + " exceeded the time limit of "
        + sendTimeLimit.toMillis()
        + " ms";
  }

  private static void applyContainerSendTimeout(WebSocketSession session, Duration limit) {
    if (session instanceof NativeWebSocketSession nativeSession) {
      final Session container = nativeSession.getNativeSession(Session.class);
      if (container != null) {
        container.getUserProperties().put(BLOCKING_SEND_TIMEOUT_PROPERTY, limit.toMillis());
      }
    }
  }
}
