/**
 * LogDeliveryService.java
 *
 * 负责把各个观察者队列中的日志真正发送到WebSocket。
 * 以固定的间隔批量发送，减少WebSocket通信频率；每个观察者独立发送，
 * 单个观察者发送失败只影响它自己，也不会影响 LogPump 的读取。
 */
package club.ppmc.launcher.service;

import club.ppmc.launcher.model.LogRecord;
import club.ppmc.launcher.model.ObserverSession;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class LogDeliveryService {

    private final LogBroadcaster broadcaster;
    private final WebSocketNotificationService notificationService;
    private final long flushIntervalMs;
    private final int maxBatchSize;
    private final ScheduledExecutorService deliveryScheduler = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("log-delivery-%d").setDaemon(true).build());

    public LogDeliveryService(
            LogBroadcaster broadcaster,
            WebSocketNotificationService notificationService,
            @Value("${app.broadcast.flush-interval-ms:200}") long flushIntervalMs,
            @Value("${app.broadcast.max-batch-size:500}") int maxBatchSize) {
        this.broadcaster = broadcaster;
        this.notificationService = notificationService;
        this.flushIntervalMs = flushIntervalMs;
        this.maxBatchSize = maxBatchSize;
    }

    @PostConstruct
    public void init() {
        // 每隔 flushIntervalMs 毫秒批量发送一次日志
        deliveryScheduler.scheduleWithFixedDelay(
                this::flushAll, flushIntervalMs, flushIntervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * 为所有观察者发送各自队列中的待发送日志。
     *
     * @return 本轮发送的记录总数。
     */
    public int flushAll() {
        int delivered = 0;
        for (ObserverSession session : broadcaster.sessions()) {
            delivered += flush(session);
        }
        return delivered;
    }

    /**
     * 发送单个观察者队列中的待发送日志，每批最多 maxBatchSize 条。
     *
     * @return 发送的记录数。
     */
    public int flush(ObserverSession session) {
        int delivered = 0;
        try {
            List<LogRecord> batch;
            while (!session.isClosed() && !(batch = session.drain(maxBatchSize)).isEmpty()) {
                notificationService.sendRunLogs(session.getPrincipalName(), batch);
                delivered += batch.size();
            }
        } catch (RuntimeException e) {
            log.error("向观察者 {} 发送日志失败，将在下一轮继续发送新的日志。", session.getId(), e);
        }
        return delivered;
    }

    @PreDestroy
    public void shutdown() {
        log.info("正在关闭 LogDeliveryService...");
        deliveryScheduler.shutdown();
        try {
            if (!deliveryScheduler.awaitTermination(1, TimeUnit.SECONDS)) {
                deliveryScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            deliveryScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
