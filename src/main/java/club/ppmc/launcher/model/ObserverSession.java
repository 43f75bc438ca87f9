/**
 * ObserverSession.java
 *
 * 代表一个正在接收实时日志的观察者连接。
 * 每个会话持有一个有界的待发送队列和一个游标（最后一次交付的序号）。
 * 队列满时丢弃最旧的记录：慢速观察者只会丢失历史，而永远不会阻塞发布方。
 * 由 LogBroadcaster 创建和销毁，由 LogDeliveryService 周期性地取出记录发送。
 */
package club.ppmc.launcher.model;

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ObserverSession {

    @Getter private final String id;
    @Getter private final String connectionId;
    @Getter private final String principalName;
    @Getter private final int capacity;

    private final Deque<LogRecord> queue;

    // 以下字段均由 this 的监视器保护
    private String currentRunId;
    private long lastEnqueuedSequence;
    private long cursor;
    private long droppedCount;
    private boolean overflowing;
    private boolean closed;

    public ObserverSession(String id, String connectionId, String principalName, int capacity) {
        Preconditions.checkArgument(capacity > 0, "观察者队列容量必须为正数: %s", capacity);
        this.id = Objects.requireNonNull(id, "id");
        this.connectionId = connectionId;
        this.principalName = principalName;
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(Math.min(capacity, 256));
    }

    /**
     * 将一条记录放入待发送队列。
     * 同一次运行内序号不大于已入队序号的记录会被忽略，从而保证观察者看到的序号严格递增；
     * 记录属于新的运行时游标随之重置。
     *
     * @return 如果记录被接受返回 true。
     */
    public synchronized boolean offer(LogRecord record) {
        if (closed) {
            return false;
        }
        if (!record.runId().equals(currentRunId)) {
            currentRunId = record.runId();
            lastEnqueuedSequence = 0;
            cursor = 0;
        } else if (record.sequence() <= lastEnqueuedSequence) {
            return false;
        }

        if (queue.size() >= capacity) {
            queue.pollFirst();
            droppedCount++;
            if (!overflowing) {
                overflowing = true;
                log.warn("观察者 {} 的日志队列已满 (容量 {})，开始丢弃最旧的记录。", id, capacity);
            }
        }
        queue.addLast(record);
        lastEnqueuedSequence = record.sequence();
        return true;
    }

    /**
     * 取出最多 maxRecords 条待发送记录，并将游标推进到最后一条的序号。
     */
    public synchronized List<LogRecord> drain(int maxRecords) {
        if (queue.isEmpty()) {
            return List.of();
        }
        List<LogRecord> batch = new ArrayList<>(Math.min(maxRecords, queue.size()));
        while (batch.size() < maxRecords && !queue.isEmpty()) {
            batch.add(queue.pollFirst());
        }
        cursor = batch.get(batch.size() - 1).sequence();
        if (overflowing && queue.isEmpty()) {
            overflowing = false;
            log.info("观察者 {} 已追上实时日志，累计丢弃 {} 条记录。", id, droppedCount);
        }
        return batch;
    }

    public synchronized long getCursor() {
        return cursor;
    }

    public synchronized long getDroppedCount() {
        return droppedCount;
    }

    public synchronized int getPendingCount() {
        return queue.size();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * 关闭会话并丢弃所有待发送记录。重复调用没有副作用。
     */
    public synchronized void close() {
        closed = true;
        queue.clear();
    }
}
