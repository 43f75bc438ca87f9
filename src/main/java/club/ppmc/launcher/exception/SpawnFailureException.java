/**
 * SpawnFailureException.java
 *
 * 子进程无法创建时抛出，例如可执行文件不存在或没有执行权限。
 */
package club.ppmc.launcher.exception;

import java.util.List;
import java.util.Map;
import lombok.Getter;

@Getter
public class SpawnFailureException extends RunControlException {

    private final List<String> command;

    public SpawnFailureException(List<String> command, Throwable cause) {
        super("SPAWN_FAILURE", "启动进程失败: " + cause.getMessage(), cause);
        this.command = List.copyOf(command);
    }

    @Override
    public Map<String, Object> toErrorData() {
        Map<String, Object> data = super.toErrorData();
        data.put("command", String.join(" ", command));
        return data;
    }
}
