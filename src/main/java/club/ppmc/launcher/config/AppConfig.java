/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 主要用于定义一些应用级别的Bean，例如用于WebSocket消息序列化的 Gson。
 */
package club.ppmc.launcher.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import java.nio.file.Path;
import java.time.Instant;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    /**
     * 定义一个全局的 Gson Bean。
     * 在WebSocket服务中用于将事件和日志记录转换为JSON字符串，确保与前端的兼容性。
     * java.time 和 java.nio 的类型在 JDK 17 上无法被反射访问，因此显式注册为字符串输出。
     *
     * @return 一个配置好的 Gson 实例。
     */
    @Bean
    public Gson gson() {
        return new GsonBuilder()
                .registerTypeAdapter(Instant.class,
                        (JsonSerializer<Instant>) (src, type, context) -> new JsonPrimitive(src.toString()))
                .registerTypeHierarchyAdapter(Path.class,
                        (JsonSerializer<Path>) (src, type, context) -> new JsonPrimitive(src.toString()))
                .serializeNulls()
                .create();
    }
}
