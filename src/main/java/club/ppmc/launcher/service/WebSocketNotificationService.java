/**
 * WebSocketNotificationService.java
 *
 * 一个统一的WebSocket消息发送服务。
 * 该服务为应用提供一个单一、清晰的WebSocket通信出口，封装了 SimpMessagingTemplate 的使用细节。
 * 它负责将运行状态事件、日志批次和资源指标用 Gson 序列化后发送到前端对应的主题(topic)或用户队列上。
 */
package club.ppmc.launcher.service;

import club.ppmc.launcher.model.LogRecord;
import club.ppmc.launcher.model.ProcessMetrics;
import club.ppmc.launcher.model.RunStateChange;
import club.ppmc.launcher.model.RunStatus;
import com.google.gson.Gson;
import java.util.List;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
public class WebSocketNotificationService {

    public static final String RUN_STATUS_TOPIC = "/topic/run/status";
    public static final String RUN_METRICS_TOPIC = "/topic/run/metrics";
    public static final String RUN_LOG_QUEUE = "/queue/run-log";
    public static final String RUN_STATUS_QUEUE = "/queue/run-status";

    private final SimpMessagingTemplate messagingTemplate;
    private final Gson gson;

    public WebSocketNotificationService(SimpMessagingTemplate messagingTemplate, Gson gson) {
        this.messagingTemplate = messagingTemplate;
        this.gson = gson;
    }

    /**
     * 广播一次状态迁移 (state-changed) 给所有订阅了状态主题的客户端。
     */
    public void sendRunStateChange(RunStateChange event) {
        sendMessage(RUN_STATUS_TOPIC, gson.toJson(event));
    }

    /**
     * 向单个观察者发送一批按序号排列的日志记录。
     *
     * @param user  观察者的 Principal 名称。
     * @param batch 待发送的记录，不能为空。
     */
    public void sendRunLogs(String user, List<LogRecord> batch) {
        messagingTemplate.convertAndSendToUser(user, RUN_LOG_QUEUE, gson.toJson(batch));
    }

    /**
     * 向刚订阅状态主题的用户单独推送一次当前状态快照。
     */
    public void sendRunStatus(String user, RunStatus status) {
        messagingTemplate.convertAndSendToUser(user, RUN_STATUS_QUEUE, gson.toJson(status));
    }

    public void sendMetrics(ProcessMetrics metrics) {
        sendMessage(RUN_METRICS_TOPIC, gson.toJson(metrics));
    }

    /**
     * 向指定的WebSocket主题发送一个通用载荷(payload)。
     *
     * @param destination 目标WebSocket主题 (例如, "/topic/run/status")
     * @param payload 要发送的任何对象 (将被框架自动序列化为JSON)
     */
    public void sendMessage(String destination, Object payload) {
        messagingTemplate.convertAndSend(destination, payload);
    }
}
