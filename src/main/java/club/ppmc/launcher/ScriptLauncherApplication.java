/**
 * ScriptLauncherApplication.java
 *
 * Spring Boot 应用的主入口类。
 * @EnableScheduling 用于启用定时任务，供 RunMetricsService 周期性推送进程指标。
 * WebSocket 消息代理在 WebSocketConfig 中启用。
 */
package club.ppmc.launcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ScriptLauncherApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScriptLauncherApplication.class, args);
    }
}
