/**
 * StartRunRequest.java
 *
 * 启动请求的请求体，由 RunController 的 start 端点接收。
 */
package club.ppmc.launcher.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * @param configRef 要使用的配置档案名称。
 */
public record StartRunRequest(
        @NotBlank
        @Pattern(regexp = "[A-Za-z0-9_.-]+", message = "配置档案名称只能包含字母、数字、'_'、'.' 和 '-'")
        String configRef) {}
