/**
 * NotRunningException.java
 *
 * 当没有任何运行处于活动状态时请求停止，抛出此异常。
 */
package club.ppmc.launcher.exception;

import club.ppmc.launcher.model.RunState;
import lombok.Getter;

@Getter
public class NotRunningException extends RunControlException {

    private final RunState currentState;

    public NotRunningException(RunState currentState) {
        super("NOT_RUNNING", "脚本未在运行 (当前状态: " + currentState + ")。");
        this.currentState = currentState;
    }
}
