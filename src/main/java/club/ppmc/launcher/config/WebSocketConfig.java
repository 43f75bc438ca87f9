/**
 * WebSocketConfig.java
 *
 * 配置Spring WebSocket和STOMP消息代理。
 * 前端通过 /ws 端点连接，订阅 /user/queue/run-log 接收日志批次，订阅 /topic/run/status 接收状态变化。
 * 与 WebSocketSessionListener 关联，订阅和断开事件由它转换为观察者会话的创建和清理。
 */
package club.ppmc.launcher.config;

import com.sun.security.auth.UserPrincipal;
import java.security.Principal;
import java.util.Map;
import java.util.UUID;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.server.support.DefaultHandshakeHandler;

@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    static final String ENDPOINT = "/ws";
    private static final long[] STOMP_HEARTBEAT_MS = {10000, 10000};
    private static final long SOCKJS_HEARTBEAT_MS = 25000;

    /**
     * 配置消息代理。
     *
     * <p><b>设计思路</b>:
     * 1. <b>Simple Broker</b>: {@code /topic} 承载一对多的广播，即运行状态变化 ({@code /topic/run/status})
     *    和进程指标 ({@code /topic/run/metrics})。{@code /queue} 承载点对点的日志投递。
     * 2. <b>User Destination</b>: 日志批次通过 {@code convertAndSendToUser} 发往 {@code /user/queue/run-log}，
     *    Spring 会把它解析为该 Principal 自己的队列。每个观察者拥有独立的发送节奏和丢弃策略，
     *    慢速观察者不会拖慢其他人。由于同一 Principal 的所有同名订阅都会收到这份消息，
     *    WebSocketSessionListener 为每个连接只维护一个观察者会话。
     * 3. <b>Heartbeat</b>: STOMP心跳为10秒发送、10秒接收。掉线的观察者会被及时发现，
     *    随后 SessionDisconnectEvent 清理它的队列。
     * 4. <b>Application Destination</b>: {@code /app} 保留给客户端发往服务器的消息，当前的控制操作都走REST接口。
     * </p>
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        var taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("ws-heartbeat-thread-");
        taskScheduler.initialize();

        config.enableSimpleBroker("/topic", "/queue")
                .setHeartbeatValue(STOMP_HEARTBEAT_MS)
                .setTaskScheduler(taskScheduler);
        config.setApplicationDestinationPrefixes("/app");
        config.setUserDestinationPrefix("/user");
    }

    /**
     * 注册STOMP端点。
     *
     * <p><b>设计思路</b>:
     * 1. <b>Handshake Handler</b>: 每个匿名连接都被分配一个随机UUID作为 {@code Principal}，
     *    它就是上面用户目的地的投递地址，因此不同浏览器标签页之间的日志队列互不干扰。
     * 2. <b>SockJS Fallback</b>: 在不支持WebSocket的环境中退回到长轮询等传输方式。
     * 3. <b>SockJS Heartbeat</b>: 每25秒一次传输层心跳，避免反向代理因长时间无数据而断开连接。
     *    日志长时间没有输出时这一点尤其重要。
     * </p>
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry
                .addEndpoint(ENDPOINT)
                .setAllowedOriginPatterns("*")
                .setHandshakeHandler(new AnonymousObserverHandshakeHandler())
                .withSockJS()
                .setHeartbeatTime(SOCKJS_HEARTBEAT_MS);
    }

    /**
     * 为每个连接分配一个随机的 Principal，日志批次按它进行点对点投递。
     */
    static class AnonymousObserverHandshakeHandler extends DefaultHandshakeHandler {

        @Override
        protected Principal determineUser(
                ServerHttpRequest request, WebSocketHandler wsHandler, Map<String, Object> attributes) {
            return new UserPrincipal("observer-" + UUID.randomUUID());
        }
    }
}
