/*
 * どこで: Exchange ライブチャネル設定
 * 何を: 通知用 WebSocket エンドポイントとハンドシェイクを登録する
 * なぜ: パスと許可オリジンを exchange.live.* から取るため
 */
package com.example.exchange.config;

import com.example.exchange.live.LiveChannelHandler;
import com.example.exchange.live.UserHandshakeInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

  private final LiveChannelHandler liveChannelHandler;
  private final ExchangeLiveProperties properties;

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry
        .addHandler(liveChannelHandler, properties.path())
        .addInterceptors(new UserHandshakeInterceptor())
        .setAllowedOriginPatterns(properties.allowedOrigins().toArray(String[]::new));
  }
}
