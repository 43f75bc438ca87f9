/**
 * WebConfig.java
 *
 * 全局的Spring Web MVC配置。
 * 控制面板前端可能由其他端口或本地文件提供，因此对 /api 下的接口开放跨域访问。
 */
package club.ppmc.launcher.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns("*") // 反射请求的Origin，允许携带凭证
                .allowedMethods("GET", "POST")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}
