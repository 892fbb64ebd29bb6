/*
 * どこで: Exchange サービス層
 * 何を: イベントを各受信者のログへ追記し、その受信者のライブ接続へ push する
 * なぜ: 追記は呼び出し側のトランザクションに乗り、push はコミットを待つので、ロールバックされた変更が端末に見えないため
 */
package com.example.exchange.service;

import com.example.exchange.config.LiveDispatchConfig;
import com.example.exchange.live.ConnectionRegistry;
import com.example.exchange.live.LiveConnection;
import com.example.exchange.model.ExchangeEvent;
import com.example.exchange.model.NotificationRecord;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@Service
public class NotificationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final NotificationFeedService feedService;
    private final ConnectionRegistry registry;
    private final TaskExecutor dispatchExecutor;
    private final ExchangeMetrics metrics;

    public NotificationDispatcher(
            NotificationFeedService feedService,
            ConnectionRegistry registry,
            @Qualifier(LiveDispatchConfig.DISPATCH_EXECUTOR) TaskExecutor dispatchExecutor,
            ExchangeMetrics metrics) {
        this.feedService = feedService;
        this.registry = registry;
        this.dispatchExecutor = dispatchExecutor;
        this.metrics = metrics;
    }

    @Transactional
    public NotificationRecord notifyUser(String userId, ExchangeEvent event) {
        return appendAndSchedule(userId, event);
    }

    /**
     * 役割: 同じイベントを複数ユーザーへ通知する。
     * 動作: 受信者をユーザー ID 順に処理し、同じ 2 人に触れるトランザクション同士が seq 行を同じ順でロックするようにする。
     */
    @Transactional
    public List<NotificationRecord> notifyUsers(Collection<String> userIds, ExchangeEvent event) {
        List<NotificationRecord> records = new ArrayList<>();
        for (String userId : new TreeSet<>(userIds)) {
            records.add(appendAndSchedule(userId, event));
        }
        return records;
    }

    private NotificationRecord appendAndSchedule(String userId, ExchangeEvent event) {
        NotificationRecord record = feedService.append(userId, event);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    push(record);
                }
            });
        } else {
            push(record);
        }
        return record;
    }

    @VisibleForTesting
    void push(NotificationRecord record) {
        for (LiveConnection connection : registry.connectionsOf(record.userId())) {
            try {
                dispatchExecutor.execute(() -> deliver(connection, record));
            } catch (TaskRejectedException ex) {
                // この接続への次の push がログから欠番を埋める
                metrics.recordPush("rejected");
                logger.warn("live push rejected user_id={} connection_id={} seq={}",
                        record.userId(),
                        connection.connectionId(),
                        record.seq());
            }
        }
    }

    @VisibleForTesting
    void deliver(LiveConnection connection, NotificationRecord record) {
        try {
            int sent = connection.deliver(record);
            metrics.recordPush(sent > 0 ? "sent" : "skipped");
        } catch (IOException | RuntimeException ex) {
            metrics.recordPush("failed");
            logger.warn("live push failed; dropping connection user_id={} connection_id={} seq={}",
                    record.userId(),
                    connection.connectionId(),
                    record.seq(),
                    ex);
            // 送信時間上限を超えた接続もここで外す
            registry.unregister(connection);
            connection.close();
        }
    }
}
