/**
 * RunControlException.java
 *
 * 运行控制相关错误的基类。
 * 所有子类都是调用方可预期的错误，携带一个稳定的错误类型标识，
 * Controller 层据此将其转换为对应的HTTP状态码和结构化的响应体。
 */
package club.ppmc.launcher.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

@Getter
public abstract class RunControlException extends RuntimeException {

    /** 错误类型，例如 "ALREADY_RUNNING"。 */
    private final String type;

    protected RunControlException(String type, String message) {
        super(message);
        this.type = type;
    }

    protected RunControlException(String type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     *
     * @return 包含结构化错误信息的Map。
     */
    public Map<String, Object> toErrorData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", type);
        data.put("message", getMessage());
        return data;
    }
}
