/**
 * RunStateChange.java
 *
 * 状态变更事件（state-changed），在每次状态迁移后推送到 /topic/run/status。
 */
package club.ppmc.launcher.model;

import java.time.Instant;

/**
 * @param type      事件类型，固定为 "state-changed"。
 * @param runId     所属运行的ID。
 * @param state     迁移后的状态。
 * @param exitCode  进入终态时的退出码，其余情况为 null。
 * @param message   面向用户的说明文字。
 * @param timestamp 迁移发生的时间。
 */
public record RunStateChange(
        String type,
        String runId,
        RunState state,
        Integer exitCode,
        String message,
        Instant timestamp
) {

    public static RunStateChange of(String runId, RunState state, Integer exitCode, String message) {
        return new RunStateChange("state-changed", runId, state, exitCode, message, Instant.now());
    }
}
