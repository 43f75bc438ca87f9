/**
 * InvalidConfigException.java
 *
 * 运行配置校验失败时抛出。携带全部的校验问题，而不仅是第一个。
 */
package club.ppmc.launcher.exception;

import java.util.List;
import java.util.Map;
import lombok.Getter;

@Getter
public class InvalidConfigException extends RunControlException {

    private final List<String> violations;

    public InvalidConfigException(List<String> violations) {
        this("INVALID_CONFIG", violations);
    }

    protected InvalidConfigException(String type, List<String> violations) {
        super(type, "运行配置无效: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    @Override
    public Map<String, Object> toErrorData() {
        Map<String, Object> data = super.toErrorData();
        data.put("violations", violations);
        return data;
    }
}
