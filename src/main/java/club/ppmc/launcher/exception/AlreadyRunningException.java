/**
 * AlreadyRunningException.java
 *
 * 当已有运行处于 STARTING、RUNNING 或 STOPPING 状态时再次请求启动，抛出此异常。
 */
package club.ppmc.launcher.exception;

import club.ppmc.launcher.model.RunState;
import lombok.Getter;

@Getter
public class AlreadyRunningException extends RunControlException {

    private final RunState currentState;

    public AlreadyRunningException(RunState currentState) {
        super("ALREADY_RUNNING", "脚本正在运行中 (当前状态: " + currentState + ")，请先停止后再启动。");
        this.currentState = currentState;
    }
}
