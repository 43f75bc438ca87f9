/**
 * WebSocketSessionListener.java
 *
 * Spring事件监听器，把STOMP的订阅、取消订阅和断开事件转换为日志观察者会话的生命周期。
 * 日志批次按 Principal 投递到 /user/queue/run-log，同一连接上的所有该地址订阅都会收到同一份消息，
 * 因此每个连接只对应一个观察者会话：第一次订阅时创建，最后一个订阅取消或连接断开时清理。
 */
package club.ppmc.launcher.listener;

import club.ppmc.launcher.service.LogBroadcaster;
import club.ppmc.launcher.service.RunSupervisorService;
import club.ppmc.launcher.service.WebSocketNotificationService;
import java.security.Principal;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;
import org.springframework.web.socket.messaging.SessionSubscribeEvent;
import org.springframework.web.socket.messaging.SessionUnsubscribeEvent;

@Component
@Slf4j
public class WebSocketSessionListener {

    static final String RUN_LOG_DESTINATION = "/user" + WebSocketNotificationService.RUN_LOG_QUEUE;

    private final LogBroadcaster broadcaster;
    private final RunSupervisorService supervisorService;
    private final WebSocketNotificationService notificationService;

    // 连接ID -> 该连接上订阅了日志队列的订阅ID
    private final Map<String, Set<String>> runLogSubscriptions = new ConcurrentHashMap<>();

    public WebSocketSessionListener(
            LogBroadcaster broadcaster,
            RunSupervisorService supervisorService,
            WebSocketNotificationService notificationService) {
        this.broadcaster = broadcaster;
        this.supervisorService = supervisorService;
        this.notificationService = notificationService;
    }

    @EventListener
    public void handleSubscribe(SessionSubscribeEvent event) {
        var headerAccessor = StompHeaderAccessor.wrap(event.getMessage());
        String sessionId = headerAccessor.getSessionId();
        String subscriptionId = headerAccessor.getSubscriptionId();
        String destination = headerAccessor.getDestination();
        Principal user = headerAccessor.getUser();

        if (sessionId == null || subscriptionId == null || destination == null || user == null) {
            log.error("在 SessionSubscribeEvent 中无法获取到会话ID、订阅ID、目标地址或 Principal。");
            return;
        }

        if (RUN_LOG_DESTINATION.equals(destination)) {
            subscribeRunLog(sessionId, subscriptionId, user.getName());
        } else if (WebSocketNotificationService.RUN_STATUS_TOPIC.equals(destination)) {
            // 新的订阅者立即收到一次当前状态，之后只接收变化事件
            notificationService.sendRunStatus(user.getName(), supervisorService.status());
        }
    }

    @EventListener
    public void handleUnsubscribe(SessionUnsubscribeEvent event) {
        var headerAccessor = StompHeaderAccessor.wrap(event.getMessage());
        String sessionId = headerAccessor.getSessionId();
        String subscriptionId = headerAccessor.getSubscriptionId();
        if (sessionId == null || subscriptionId == null) {
            return;
        }
        boolean[] lastRemoved = new boolean[1];
        runLogSubscriptions.computeIfPresent(sessionId, (connection, subscriptions) -> {
            if (subscriptions.remove(subscriptionId) && subscriptions.isEmpty()) {
                lastRemoved[0] = true;
                return null;
            }
            return subscriptions;
        });
        if (lastRemoved[0]) {
            broadcaster.unsubscribe(sessionId);
        }
    }

    @EventListener
    public void handleDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        if (sessionId != null) {
            runLogSubscriptions.remove(sessionId);
            int removed = broadcaster.unsubscribeConnection(sessionId);
            log.info("WebSocket 连接断开，会话 ID: {}，清理了 {} 个日志观察者。", sessionId, removed);
        }
    }

    private void subscribeRunLog(String sessionId, String subscriptionId, String principalName) {
        boolean[] first = new boolean[1];
        runLogSubscriptions.compute(sessionId, (connection, subscriptions) -> {
            Set<String> updated = subscriptions != null ? subscriptions : new HashSet<>();
            first[0] = updated.isEmpty();
            updated.add(subscriptionId);
            return updated;
        });
        if (first[0]) {
            broadcaster.subscribe(sessionId, sessionId, principalName);
        } else {
            log.info("连接 {} 重复订阅日志队列 (订阅ID: {})，继续使用已有的观察者会话。", sessionId, subscriptionId);
        }
    }
}
