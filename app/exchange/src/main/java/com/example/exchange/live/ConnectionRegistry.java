/*
 * どこで: Exchange ライブチャネル
 * 何を: このインスタンスのライブ接続をユーザー ID ごとに保持する
 * なぜ: 配信はユーザーの全端末を引くため。ユーザー単位の変更は ConcurrentHashMap.compute で直列化し、読み手は不変のスナップショットを見る
 */
package com.example.exchange.live;

import com.example.exchange.service.ExchangeMetrics;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ConnectionRegistry {

  private final ConcurrentMap<String, Set<LiveConnection>> connectionsByUser =
      new ConcurrentHashMap<>();
  private final AtomicInteger connectionCount = new AtomicInteger(0);
  private final ExchangeMetrics metrics;

  /** 登録済みだったときは false。 */
  public boolean register(LiveConnection connection) {
    final boolean[] added = new boolean[1];
    connectionsByUser.compute(
        connection.userId(),
        (userId, current) -> {
          final Set<LiveConnection> next =
              current == null ? new LinkedHashSet<>() : new LinkedHashSet<>(current);
          added[0] = next.add(connection);
          return Collections.unmodifiableSet(next);
        });
    if (added[0]) {
      metrics.updateLiveConnections(connectionCount.incrementAndGet());
    }
    return added[0];
  }

  /** 登録されていなかったときは false。 */
  public boolean unregister(LiveConnection connection) {
    final boolean[] removed = new boolean[1];
    connectionsByUser.computeIfPresent(
        connection.userId(),
        (userId, current) -> {
          if (!current.contains(connection)) {
            return current;
          }
          removed[0] = true;
          final Set<LiveConnection> next = new LinkedHashSet<>(current);
          next.remove(connection);
          return next.isEmpty() ? null : Collections.unmodifiableSet(next);
        });
    if (removed[0]) {
      metrics.updateLiveConnections(connectionCount.decrementAndGet());
    }
    return removed[0];
  }

  public Set<LiveConnection> connectionsOf(String userId) {
    return connectionsByUser.getOrDefault(userId, Set.of());
  }

  public int connectionCount() {
    return connectionCount.get();
  }

  public int userCount() {
    return connectionsByUser.size();
  }
}
