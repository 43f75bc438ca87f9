/**
 * RunStatus.java
 *
 * 当前运行状态的只读快照，由 RunSupervisorService.status() 无锁生成，
 * 通过 REST 接口返回，也会在观察者订阅状态主题时推送一次。
 */
package club.ppmc.launcher.model;

import java.time.Instant;

/**
 * @param state         当前状态。
 * @param runId         当前或最近一次运行的ID，从未运行过时为 null。
 * @param profile       运行使用的配置档案名称。
 * @param pid           子进程PID，尚未创建进程时为 null。
 * @param startedAt     运行开始时间。
 * @param endedAt       进入终态的时间，运行中为 null。
 * @param elapsedMillis 已运行时长；终态下为整个运行的时长。
 * @param exitCode      进程退出码，运行中或被放弃回收时为 null。
 * @param stopReason    停止请求附带的原因。
 */
public record RunStatus(
        RunState state,
        String runId,
        String profile,
        Long pid,
        Instant startedAt,
        Instant endedAt,
        long elapsedMillis,
        Integer exitCode,
        String stopReason
) {

    public static RunStatus idle() {
        return new RunStatus(RunState.IDLE, null, null, null, null, null, 0L, null, null);
    }
}
