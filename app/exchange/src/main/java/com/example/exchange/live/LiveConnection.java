/*
 * どこで: Exchange ライブチャネル
 * 何を: ユーザーの 1 接続と、その接続へ送信済みの最大 seq を保持する
 * なぜ: push がバックフィルと競合しても、先の seq が先に届いても、同じ seq を二度・逆順で送らないため
 */
package com.example.exchange.live;

import com.example.exchange.model.NotificationRecord;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

public class LiveConnection {

  private final String connectionId;
  private final String userId;
  private final Instant connectedAt;
  private final LiveTransport transport;
  private final LiveFrames frames;
  private final BackfillSource backfillSource;
  private final int backfillPageSize;
  private final Duration sendTimeLimit;
  private final ReentrantLock lock = new ReentrantLock();

  // 書き込みは lock 内のみ。読み取りは lock を待たない
  private volatile long lastSentSeq;
  private volatile boolean live;

  public LiveConnection(
      String connectionId,
      String userId,
      Instant connectedAt,
      LiveTransport transport,
      LiveFrames frames,
      BackfillSource backfillSource,
      int backfillPageSize,
      Duration sendTimeLimit) {
    if (backfillPageSize < 1) {
      throw new IllegalArgumentException("backfillPageSize must be >= 1");
    }
    if (sendTimeLimit.isNegative() || sendTimeLimit.isZero()) {
      throw new IllegalArgumentException("sendTimeLimit must be > 0");
    }
    this.connectionId = connectionId;
    this.userId = userId;
    this.connectedAt = connectedAt;
    this.transport = transport;
    this.frames = frames;
    this.backfillSource = backfillSource;
    this.backfillPageSize = backfillPageSize;
    this.sendTimeLimit = sendTimeLimit;
  }

  public String connectionId() {
    return connectionId;
  }

  public String userId() {
    return userId;
  }

  public Instant connectedAt() {
    return connectedAt;
  }

  public long lastSentSeq() {
    return lastSentSeq;
  }

  public boolean isLive() {
    return live;
  }

  /**
   * 役割: {@code sinceSeq} より後の通知をすべて送り、{@code backfill_complete} を送ってライブに切り替える。
   * 動作: ログをページ単位で読み、送信済み seq は飛ばす。
   * 前提: バックフィル読み取り後にコミットされた push を逃さないよう、接続は登録済みであること。
   *
   * @return 送信した通知数
   * @throws LiveSendTimeoutException 他の送信が送信時間上限を超えて接続を占有しているとき
   */
  public int resume(long sinceSeq) throws IOException {
    acquire();
    try {
      // 2 回目の resume でカーソルは戻らない
      lastSentSeq = Math.max(lastSentSeq, Math.max(sinceSeq, 0));
      final int sent = catchUp();
      live = true;
      transport.send(frames.backfillComplete(lastSentSeq));
      return sent;
    } finally {
      lock.unlock();
    }
  }

  /**
   * 役割: {@code record} を push する。
   * 動作: 送信済み seq は飛ばし、次に期待する seq より先の通知が来たら欠けている分をログから読んで先に送る。
   * 前提: {@code record} はこの接続のユーザー宛てであること。
   *
   * @return 送信した通知数。飛ばしたときは 0
   * @throws LiveSendTimeoutException 接続が送信時間上限を超えて占有されているとき
   */
  public int deliver(NotificationRecord record) throws IOException {
    if (!userId.equals(record.userId())) {
      throw new IllegalArgumentException(
          "notification for " + record.userId() + " routed to connection of " + userId);
    }
    acquire();
    try {
      if (!live || record.seq() <= lastSentSeq) {
        return 0;
      }
      if (record.seq() == lastSentSeq + 1) {
        sendEnvelope(record);
        return 1;
      }
      // record がコミット済みなら、このユーザーのより小さい seq もすべてコミット済み
      return catchUp();
    } finally {
      lock.unlock();
    }
  }

  public void send(String frame) throws IOException {
    acquire();
    try {
      transport.send(frame);
    } finally {
      lock.unlock();
    }
  }

  public boolean isOpen() {
    return transport.isOpen();
  }

  public void close() {
    transport.close();
  }

  // 占有中の送信は transport 側の期限で打ち切られるので、待つのも同じ上限まで
  private void acquire() throws IOException {
    try {
      if (!lock.tryLock(sendTimeLimit.toMillis(), TimeUnit.MILLISECONDS)) {
        throw new LiveSendTimeoutException(
            "connection "
                + connectionId
                + " stayed busy longer than "
                + sendTimeLimit.toMillis()
                + " ms");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted waiting for connection " + connectionId);
    }
  }

  private int catchUp() throws IOException {
    int sent = 0;
    while (true) {
      final List<NotificationRecord> page =
          backfillSource.readAfter(userId, lastSentSeq, backfillPageSize);
      for (NotificationRecord record : page) {
        if (record.seq() > lastSentSeq) {
          sendEnvelope(record);
          sent++;
        }
      }
      if (page.size() < backfillPageSize) {
        return sent;
      }
    }
  }

  private void sendEnvelope(NotificationRecord record) throws IOException {
    transport.send(frames.envelope(record));
    lastSentSeq = record.seq();
  }
}
