/*
 * どこで: Exchange ライブチャネル
 * 何を: 接続ユーザーを X-User-Id ヘッダーか user_id クエリパラメータから解決する
 * なぜ: ブラウザは WebSocket のアップグレードにヘッダーを付けられず、ゲートウェイがパラメータで渡すことがあるため
 */
package com.example.exchange.live;

import com.example.exchange.config.RequestMdcInterceptor;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.Nullable;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

public class UserHandshakeInterceptor implements HandshakeInterceptor {

  public static final String USER_ID_ATTRIBUTE = "exchange.userId";
  static final String USER_ID_PARAM = "user_id";

  @Override
  public boolean beforeHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Map<String, Object> attributes) {
    final String userId = resolveUserId(request);
    if (userId == null) {
      response.setStatusCode(HttpStatus.BAD_REQUEST);
      return false;
    }
    attributes.put(USER_ID_ATTRIBUTE, userId);
    return true;
  }

  @Override
  public void afterHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      @Nullable Exception exception) {}

  @Nullable
  String resolveUserId(ServerHttpRequest request) {
    final String header = request.getHeaders().getFirst(RequestMdcInterceptor.USER_HEADER);
    if (header != null && !header.isBlank()) {
      return header.trim();
    }
    final String param =
        UriComponentsBuilder.fromUri(request.getURI())
            .build()
            .getQueryParams()
            .getFirst(USER_ID_PARAM);
    if (param != null && !param.isBlank()) {
      return param.trim();
    }
    return null;
  }
}
