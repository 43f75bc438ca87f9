/**
 * ManagedProcess.java
 *
 * 封装一次操作系统进程的调用：启动、环境变量注入、终止以及退出码的获取。
 * 每个实例最多只能启动一次；重复的终止请求不会产生副作用。
 * 由 RunSupervisorService 独占持有，运行进入终态并完成日志排空后即被丢弃。
 */
package club.ppmc.launcher.process;

import club.ppmc.launcher.exception.SpawnFailureException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ManagedProcess {

    private final ProcessLauncher launcher;
    private final AtomicBoolean spawned = new AtomicBoolean(false);
    private final AtomicBoolean terminateRequested = new AtomicBoolean(false);
    private final AtomicBoolean killRequested = new AtomicBoolean(false);

    private volatile Process process;
    private volatile Instant startedAt;

    public ManagedProcess(ProcessLauncher launcher) {
        this.launcher = launcher;
    }

    /**
     * 启动进程。
     *
     * @throws SpawnFailureException 可执行文件不存在或无法启动时。
     * @throws IllegalStateException 该实例已经启动过。
     */
    public void spawn(List<String> command, Map<String, String> environment, Path workingDirectory) {
        if (!spawned.compareAndSet(false, true)) {
            throw new IllegalStateException("该进程句柄已经启动过，不能重复启动。");
        }
        try {
            this.process = launcher.launch(command, environment, workingDirectory);
            this.startedAt = Instant.now();
            log.info("已启动新进程，PID: {}. 命令: {}", pid(), String.join(" ", command));
        } catch (IOException | IllegalArgumentException e) {
            // 环境变量中含有非法字符时 ProcessBuilder 抛出 IllegalArgumentException
            log.error("启动进程失败，命令: {}", command, e);
            throw new SpawnFailureException(command, e);
        }
    }

    public InputStream stdout() {
        return requireStarted().getInputStream();
    }

    public InputStream stderr() {
        return requireStarted().getErrorStream();
    }

    /**
     * 返回一个在进程退出时以退出码完成的 Future。
     */
    public CompletableFuture<Integer> onExit() {
        return requireStarted().onExit().thenApply(Process::exitValue);
    }

    /**
     * 阻塞等待进程退出。只应在专用的I/O线程中调用。
     */
    public int awaitExit() throws InterruptedException {
        return requireStarted().waitFor();
    }

    public OptionalInt exitCode() {
        Process p = this.process;
        if (p == null || p.isAlive()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(p.exitValue());
    }

    public boolean isAlive() {
        Process p = this.process;
        return p != null && p.isAlive();
    }

    public long pid() {
        return requireStarted().pid();
    }

    public Instant startedAt() {
        return startedAt;
    }

    /**
     * 发送优雅停止信号（先发给子孙进程，再发给进程本身）。
     *
     * @return 本次调用是否真正发送了信号。
     */
    public boolean terminate() {
        Process p = requireStarted();
        if (!terminateRequested.compareAndSet(false, true) || !p.isAlive()) {
            return false;
        }
        log.info("正在向进程 PID {} 发送终止信号", p.pid());
        destroyDescendants(p, false);
        p.destroy();
        return true;
    }

    /**
     * 强制终止进程及其子孙进程。
     *
     * @return 本次调用是否真正执行了强制终止。
     */
    public boolean kill() {
        Process p = requireStarted();
        if (!killRequested.compareAndSet(false, true) || !p.isAlive()) {
            return false;
        }
        log.warn("正在强制终止进程 PID {}", p.pid());
        destroyDescendants(p, true);
        p.destroyForcibly();
        return true;
    }

    private void destroyDescendants(Process p, boolean forcibly) {
        try {
            p.descendants().forEach(child -> {
                if (forcibly) {
                    child.destroyForcibly();
                } else {
                    child.destroy();
                }
            });
        } catch (UnsupportedOperationException e) {
            log.debug("进程 {} 不支持枚举子进程: {}", p, e.getMessage());
        }
    }

    private Process requireStarted() {
        Process p = this.process;
        if (p == null) {
            throw new IllegalStateException("进程尚未启动。");
        }
        return p;
    }
}
