/**
 * LogBroadcaster.java
 *
 * 将日志记录扇出给任意数量的在线观察者，并把生产速率与投递速率解耦。
 * 它只保存一个固定大小的回放缓冲区（最近 N 条记录），新订阅者先收到回放内容，再收到实时记录。
 * 每个观察者拥有独立的有界队列：队列满时只丢弃该观察者最旧的记录，发布方永远不会被阻塞。
 * 真正的网络发送由 LogDeliveryService 负责。
 */
package club.ppmc.launcher.service;

import club.ppmc.launcher.model.LogRecord;
import club.ppmc.launcher.model.ObserverSession;
import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class LogBroadcaster {

    private final int replayCapacity;
    private final int observerQueueCapacity;

    private final Object lock = new Object();
    private final Deque<LogRecord> replayBuffer = new ArrayDeque<>(); // 由 lock 保护
    private final Map<String, ObserverSession> sessions = new ConcurrentHashMap<>();

    public LogBroadcaster(
            @Value("${app.broadcast.replay-buffer-size:200}") int replayCapacity,
            @Value("${app.broadcast.observer-queue-capacity:1000}") int observerQueueCapacity) {
        Preconditions.checkArgument(replayCapacity >= 0, "回放缓冲区大小不能为负数: %s", replayCapacity);
        Preconditions.checkArgument(observerQueueCapacity > 0, "观察者队列容量必须为正数: %s", observerQueueCapacity);
        this.replayCapacity = replayCapacity;
        this.observerQueueCapacity = observerQueueCapacity;
    }

    /**
     * 新运行开始时调用，清空上一次运行的回放缓冲区。
     */
    public void beginRun(String runId) {
        synchronized (lock) {
            replayBuffer.clear();
        }
        log.debug("回放缓冲区已为运行 {} 重置。", runId);
    }

    /**
     * 发布一条记录：写入回放缓冲区，并放入每个观察者的队列。
     * 该方法只做内存操作，不会因为任何观察者的消费速度而阻塞。
     */
    public void publish(LogRecord record) {
        synchronized (lock) {
            if (replayCapacity > 0) {
                if (replayBuffer.size() >= replayCapacity) {
                    replayBuffer.pollFirst();
                }
                replayBuffer.addLast(record);
            }
            for (ObserverSession session : sessions.values()) {
                session.offer(record);
            }
        }
    }

    /**
     * 创建一个观察者会话。回放缓冲区中的记录会先放入会话队列，之后才是实时记录；
     * 与 publish 在同一把锁下进行，因此不会出现重复或缺漏。
     * 如果已存在相同ID的会话，旧会话会被关闭并替换。
     *
     * @param id            会话ID。
     * @param connectionId  所属连接的ID，用于连接断开时批量清理。
     * @param principalName 投递目标用户名。
     */
    public ObserverSession subscribe(String id, String connectionId, String principalName) {
        var session = new ObserverSession(id, connectionId, principalName, observerQueueCapacity);
        ObserverSession previous;
        synchronized (lock) {
            replayBuffer.forEach(session::offer);
            previous = sessions.put(id, session);
        }
        if (previous != null) {
            previous.close();
            log.info("观察者 {} 重复订阅，旧会话已被替换。", id);
        }
        log.info("新的日志观察者 {} 已订阅 (用户: {}，回放 {} 条记录)。当前观察者数: {}",
                id, principalName, session.getPendingCount(), sessions.size());
        return session;
    }

    /**
     * 取消订阅。重复调用或未知的ID都不会产生副作用。
     *
     * @return 如果确实移除了一个会话返回 true。
     */
    public boolean unsubscribe(String id) {
        ObserverSession removed = sessions.remove(id);
        if (removed == null) {
            return false;
        }
        removed.close();
        log.info("日志观察者 {} 已取消订阅。当前观察者数: {}", id, sessions.size());
        return true;
    }

    /**
     * 移除某个连接下的所有会话，在连接断开时调用。
     *
     * @return 被移除的会话数量。
     */
    public int unsubscribeConnection(String connectionId) {
        int removed = 0;
        for (ObserverSession session : List.copyOf(sessions.values())) {
            if (connectionId.equals(session.getConnectionId()) && unsubscribe(session.getId())) {
                removed++;
            }
        }
        return removed;
    }

    public Collection<ObserverSession> sessions() {
        return List.copyOf(sessions.values());
    }

    public List<LogRecord> replaySnapshot() {
        synchronized (lock) {
            return new ArrayList<>(replayBuffer);
        }
    }
}
