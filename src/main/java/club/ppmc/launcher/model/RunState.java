/**
 * RunState.java
 *
 * 定义受监管脚本一次运行的生命周期状态。
 * 状态迁移只允许沿着 IDLE -> STARTING -> RUNNING -> STOPPING -> 终态 的方向进行，
 * 由 RunSupervisorService 在其同步锁内统一推进。
 */
package club.ppmc.launcher.model;

public enum RunState {
    /** 服务启动后尚未运行过脚本，或上一次启动在创建进程时失败。 */
    IDLE,
    STARTING,
    RUNNING,
    /** 已发送停止信号，等待进程退出。 */
    STOPPING,
    /** 进程以退出码 0 自然结束。 */
    COMPLETED,
    /** 进程以非零退出码自然结束。 */
    FAILED,
    /** 进程因显式的停止请求而结束，与退出码无关。 */
    STOPPED;

    /**
     * 是否为终态。终态之后只有新的 start() 才能再次迁移。
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == STOPPED;
    }

    /**
     * 是否存在一个正在进行中的运行（此时拒绝新的启动请求）。
     */
    public boolean isActive() {
        return this == STARTING || this == RUNNING || this == STOPPING;
    }
}
