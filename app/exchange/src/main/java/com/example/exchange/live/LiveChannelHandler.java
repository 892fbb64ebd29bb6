/*
 * どこで: Exchange ライブチャネル
 * 何を: WebSocket 接続に connected を返し、resume にバックフィルで、ping に pong で応える
 * なぜ: 再接続した端末が最後に見た seq 以降をすべて受け取れるようにするため
 */
package com.example.exchange.live;

import com.example.exchange.config.ExchangeLiveProperties;
import com.example.exchange.config.LiveDispatchConfig;
import com.example.exchange.service.NotificationFeedService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
public class LiveChannelHandler extends TextWebSocketHandler {

  private static final Logger logger = LoggerFactory.getLogger(LiveChannelHandler.class);
  static final String CONNECTION_ATTRIBUTE = "exchange.liveConnection";

  private final ConnectionRegistry registry;
  private final NotificationFeedService feedService;
  private final LiveFrames frames;
  private final ExchangeLiveProperties properties;
  private final Clock clock;
  private final TaskScheduler sendWatchdog;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a shared Spring-managed component")
  private final ObjectMapper objectMapper;

  public LiveChannelHandler(
      ConnectionRegistry registry,
      NotificationFeedService feedService,
      LiveFrames frames,
      ExchangeLiveProperties properties,
      Clock clock,
      ObjectMapper objectMapper,
      @Qualifier(LiveDispatchConfig.SEND_WATCHDOG) TaskScheduler sendWatchdog) {
    this.registry = registry;
    this.feedService = feedService;
    this.frames = frames;
    this.properties = properties;
    this.clock = clock;
    this.objectMapper = objectMapper;
    this.sendWatchdog = sendWatchdog;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) throws Exception {
    final Object userId = session.getAttributes().get(UserHandshakeInterceptor.USER_ID_ATTRIBUTE);
    if (!(userId instanceof String user) || user.isBlank()) {
      session.close(CloseStatus.POLICY_VIOLATION.withReason("user id required"));
      return;
    }
    final LiveConnection connection =
        new LiveConnection(
            session.getId(),
            user,
            Instant.now(clock),
            new WebSocketLiveTransport(
                session, properties.sendTimeLimit(), properties.bufferSizeLimit(), sendWatchdog),
            frames,
            feedService::readAfter,
            properties.backfillPageSize(),
            properties.sendTimeLimit());
    session.getAttributes().put(CONNECTION_ATTRIBUTE, connection);
    connection.send(frames.connected(user, connection.connectionId(), connection.connectedAt()));
    logger.info("live connection opened user_id={} connection_id={}", user, session.getId());
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message)
      throws Exception {
    final LiveConnection connection = connectionOf(session);
    if (connection == null) {
      return;
    }
    final JsonNode frame;
    final ClientFrameType type;
    try {
      frame = objectMapper.readTree(message.getPayload());
      type = ClientFrameType.fromValue(frame.path("type").asText());
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      connection.send(frames.error("unsupported message"));
      return;
    }
    switch (type) {
      case RESUME -> resume(connection, frame);
      case PING -> connection.send(frames.pong());
    }
  }

  private void resume(LiveConnection connection, JsonNode frame) throws Exception {
    final JsonNode sinceNode = frame.path("since_seq");
    if (!sinceNode.isMissingNode() && !sinceNode.isNull() && !sinceNode.canConvertToLong()) {
      connection.send(frames.error("since_seq must be an integer"));
      return;
    }
    final long sinceSeq = sinceNode.asLong(0);
    // 読み取り後にコミットされた push も届くよう、ログを読む前に登録する
    registry.register(connection);
    MDC.put("user_id", connection.userId());
    try {
      final int sent = connection.resume(sinceSeq);
      logger.info(
          "live backfill complete connection_id={} since_seq={} sent={} last_seq={}",
          connection.connectionId(),
          sinceSeq,
          sent,
          connection.lastSentSeq());
    } finally {
      MDC.remove("user_id");
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    final LiveConnection connection = connectionOf(session);
    logger.warn(
        "live transport error connection_id={} user_id={}",
        session.getId(),
        connection == null ? null : connection.userId(),
        exception);
    if (connection != null) {
      registry.unregister(connection);
    }
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    final LiveConnection connection = connectionOf(session);
    if (connection == null) {
      return;
    }
    registry.unregister(connection);
    logger.info(
        "live connection closed user_id={} connection_id={} code={}",
        connection.userId(),
        connection.connectionId(),
        status.getCode());
  }

  private LiveConnection connectionOf(WebSocketSession session) {
    final Object attribute = session.getAttributes().get(CONNECTION_ATTRIBUTE);
    return attribute instanceof LiveConnection connection ? connection : null;
  }
}
