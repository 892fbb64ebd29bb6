package com.example.exchange.live;

import com.example.exchange.model.NotificationRecord;
import java.util.List;

/** ユーザーのログを指定 seq より後から古い順に読む。 */
@FunctionalInterface
public interface BackfillSource {

  List<NotificationRecord> readAfter(String userId, long sinceSeq, int limit);
}
