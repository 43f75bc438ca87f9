/**
 * RunSupervisorService.java
 *
 * 该服务负责管理受监管脚本的运行生命周期，同一时刻最多只有一个活动的运行。
 * 它是运行状态的唯一事实来源：所有启动、停止和进程退出引起的状态迁移都在同一把锁内串行进行，
 * 而 status() 只读取一个 volatile 的不可变快照，永远不会阻塞。
 * 阻塞操作（读取输出流、等待进程退出）都在专用的I/O线程中进行，从不持有状态锁。
 * 停止请求先发送优雅停止信号，宽限期后强制终止，再不退出则放弃回收，保证总能回到可启动的状态。
 */
package club.ppmc.launcher.service;

import club.ppmc.launcher.exception.AlreadyRunningException;
import club.ppmc.launcher.exception.InvalidConfigException;
import club.ppmc.launcher.exception.NotRunningException;
import club.ppmc.launcher.exception.SpawnFailureException;
import club.ppmc.launcher.model.LogRecord;
import club.ppmc.launcher.model.RunConfig;
import club.ppmc.launcher.model.RunState;
import club.ppmc.launcher.model.RunStateChange;
import club.ppmc.launcher.model.RunStatus;
import club.ppmc.launcher.process.LogPump;
import club.ppmc.launcher.process.ManagedProcess;
import club.ppmc.launcher.process.ProcessLauncher;
import club.ppmc.launcher.util.LineDecoder;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class RunSupervisorService {

    static final Duration MAX_GRACE_PERIOD = Duration.ofMinutes(10);

    private final ProcessLauncher processLauncher;
    private final ProfileService profileService;
    private final LogBroadcaster broadcaster;
    private final LogClassifier classifier;
    private final LineDecoder lineDecoder;
    private final WebSocketNotificationService notificationService;
    private final Duration killTimeout;
    private final Duration drainTimeout;

    private final ExecutorService ioExecutor = Executors.newCachedThreadPool(threadFactory("run-io-%d"));
    private final ScheduledExecutorService timer =
            Executors.newSingleThreadScheduledExecutor(threadFactory("run-timer-%d"));
    private final ExecutorService eventExecutor = Executors.newSingleThreadExecutor(threadFactory("run-events-%d"));

    private final Object lock = new Object();
    private volatile Snapshot current = new Snapshot(RunState.IDLE, null);

    public RunSupervisorService(
            ProcessLauncher processLauncher,
            ProfileService profileService,
            LogBroadcaster broadcaster,
            LogClassifier classifier,
            LineDecoder lineDecoder,
            WebSocketNotificationService notificationService,
            @Value("${app.supervisor.kill-timeout-ms:5000}") long killTimeoutMs,
            @Value("${app.supervisor.drain-timeout-ms:2000}") long drainTimeoutMs) {
        this.processLauncher = processLauncher;
        this.profileService = profileService;
        this.broadcaster = broadcaster;
        this.classifier = classifier;
        this.lineDecoder = lineDecoder;
        this.notificationService = notificationService;
        this.killTimeout = Duration.ofMillis(killTimeoutMs);
        this.drainTimeout = Duration.ofMillis(drainTimeoutMs);
    }

    /**
     * 按档案名称启动一次运行。档案在检查运行状态之后才读取，因此已有运行时不会触碰配置文件。
     *
     * @param configRef 配置档案名称。
     * @return 新运行的ID。
     */
    public String start(String configRef) {
        RunState state = current.state();
        if (state.isActive()) {
            log.warn("拒绝启动请求 (配置: {})：已有运行处于 {} 状态。", configRef, state);
            throw new AlreadyRunningException(state);
        }
        return start(profileService.resolve(configRef));
    }

    /**
     * 使用给定的配置快照启动一次运行。
     *
     * @return 新运行的ID。
     * @throws AlreadyRunningException 已有运行处于 STARTING、RUNNING 或 STOPPING 状态。
     * @throws InvalidConfigException  配置未通过校验。
     * @throws SpawnFailureException   进程无法创建，此时状态回到 IDLE。
     */
    public String start(RunConfig config) {
        synchronized (lock) {
            RunState state = current.state();
            if (state.isActive()) {
                log.warn("拒绝启动请求：已有运行处于 {} 状态。", state);
                throw new AlreadyRunningException(state);
            }
            validate(config);

            var run = new ActiveRun(UUID.randomUUID().toString(), config, new ManagedProcess(processLauncher));
            transition(RunState.STARTING, run, "正在启动脚本 (配置: " + config.profile() + ")");
            try {
                run.process.spawn(config.command(), config.environment(), config.workingDirectory());
                run.pid = run.process.pid();
                run.startedAt = run.process.startedAt();

                // 序号随新的 LogPump 从 0 开始计数，第一条记录为 1
                broadcaster.beginRun(run.runId);
                run.pump = new LogPump(run.runId, classifier, lineDecoder, broadcaster::publish);
                run.pump.start(run.process.stdout(), run.process.stderr(), ioExecutor);
            } catch (RuntimeException e) {
                SpawnFailureException failure = e instanceof SpawnFailureException spawnFailure
                        ? spawnFailure
                        : new SpawnFailureException(config.command(), e);
                abortStart(run);
                transition(RunState.IDLE, run, "[致命错误] " + failure.getMessage());
                throw failure;
            }

            transition(RunState.RUNNING, run, "脚本已启动，PID: " + run.pid);

            // 进程退出后在I/O线程中等待日志排空，再统一收尾
            run.process.onExit().whenCompleteAsync(
                    (exitCode, error) -> handleProcessExit(run, exitCode, error), ioExecutor);
            return run.runId;
        }
    }

    /**
     * 停止当前运行。
     * RUNNING 状态下迁移到 STOPPING 并发送优雅停止信号，宽限期后仍未退出则强制终止。
     * 已处于 STOPPING，或进程已自然退出但尚未完成收尾时，视为重复请求直接确认。
     *
     * @param reason 停止原因，可以为 null。
     * @return 确认时的状态快照。
     * @throws NotRunningException 当前没有活动的运行。
     */
    public RunStatus stop(String reason) {
        synchronized (lock) {
            Snapshot snapshot = current;
            ActiveRun run = snapshot.run();
            if (snapshot.state() == RunState.STOPPING) {
                log.info("运行 {} 已在停止中，忽略重复的停止请求。", run.runId);
                return status();
            }
            if (snapshot.state() != RunState.RUNNING) {
                throw new NotRunningException(snapshot.state());
            }
            if (!run.process.isAlive()) {
                log.info("运行 {} 的进程已经退出，停止请求视为已确认。", run.runId);
                return status();
            }

            run.stopRequested = true;
            run.stopReason = reason;
            transition(RunState.STOPPING, run,
                    reason != null && !reason.isBlank() ? "正在停止脚本: " + reason : "正在停止脚本");
            run.process.terminate();
            run.escalation = timer.schedule(
                    () -> escalate(run), run.config.gracePeriod().toMillis(), TimeUnit.MILLISECONDS);
            return status();
        }
    }

    /**
     * 返回当前状态的快照。不获取任何锁，永远不会失败。
     */
    public RunStatus status() {
        Snapshot snapshot = current;
        ActiveRun run = snapshot.run();
        if (run == null) {
            return RunStatus.idle();
        }
        Instant startedAt = run.startedAt;
        Instant endedAt = run.endedAt;
        long elapsed = 0L;
        if (startedAt != null) {
            elapsed = Duration.between(startedAt, endedAt != null ? endedAt : Instant.now()).toMillis();
        }
        return new RunStatus(
                snapshot.state(),
                run.runId,
                run.config.profile(),
                run.pid,
                startedAt,
                endedAt,
                elapsed,
                run.exitCode,
                run.stopReason);
    }

    /**
     * 当前运行回放缓冲区中的日志（最近的若干条）。
     */
    public List<LogRecord> recentLogs() {
        return broadcaster.replaySnapshot();
    }

    /**
     * 等待当前运行进入终态。没有活动运行时立即返回。
     *
     * @return 等待结束时的状态快照。
     */
    public RunStatus awaitTermination(Duration timeout) throws InterruptedException {
        ActiveRun run = current.run();
        if (run != null) {
            try {
                run.finished.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.debug("等待运行 {} 结束超时 ({} ms)", run.runId, timeout.toMillis());
            } catch (ExecutionException e) {
                log.warn("运行 {} 的收尾过程异常", run.runId, e.getCause());
            }
        }
        return status();
    }

    /**
     * 启动中途失败时清理已创建的进程和日志读取器。调用方必须持有 lock。
     */
    private void abortStart(ActiveRun run) {
        if (run.pump != null) {
            run.pump.close();
        }
        if (run.process.isAlive()) {
            log.warn("启动运行 {} 失败，正在终止已创建的进程 PID {}", run.runId, run.pid);
            run.process.kill();
        }
    }

    private void handleProcessExit(ActiveRun run, Integer exitCode, Throwable error) {
        if (error != null) {
            log.error("等待运行 {} 的进程退出时出错", run.runId, error);
        }
        if (!run.pump.awaitDrained(drainTimeout)) {
            // 输出流可能仍被脚本派生的子进程占用，不能无限等待
            log.warn("进程 PID {} 已退出，但输出流在 {} ms 内未读取完毕，将强制关闭。", run.pid, drainTimeout.toMillis());
            run.pump.close();
        }
        log.info("进程 PID {} 已退出 (退出码: {})，且其输出流已处理完毕，共 {} 条日志。",
                run.pid, exitCode, run.pump.emittedCount());
        completeRun(run, exitCode);
    }

    private void escalate(ActiveRun run) {
        synchronized (lock) {
            if (current.run() != run || current.state() != RunState.STOPPING || !run.process.isAlive()) {
                return;
            }
            log.warn("进程 PID {} 在 {} ms 的宽限期内未退出，将强制终止。", run.pid, run.config.gracePeriod().toMillis());
            run.process.kill();
            run.escalation = timer.schedule(() -> abandon(run), killTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void abandon(ActiveRun run) {
        if (current.run() != run || !current.state().isActive()) {
            return;
        }
        log.error("进程 PID {} 在强制终止后 {} ms 内仍未退出，放弃回收并结束本次运行。", run.pid, killTimeout.toMillis());
        run.pump.close();
        completeRun(run, null);
    }

    private void completeRun(ActiveRun run, Integer exitCode) {
        RunState terminal;
        synchronized (lock) {
            Snapshot snapshot = current;
            if (snapshot.run() != run || !snapshot.state().isActive()) {
                log.debug("收到运行 {} 的过期结束事件，将忽略。", run.runId);
                return;
            }
            if (run.escalation != null) {
                run.escalation.cancel(false);
            }
            run.exitCode = exitCode;
            run.endedAt = Instant.now();

            String message;
            if (run.stopRequested) {
                terminal = RunState.STOPPED;
                message = "脚本已手动停止" + (exitCode != null ? "，退出码: " + exitCode : "");
            } else if (exitCode != null && exitCode == 0) {
                terminal = RunState.COMPLETED;
                message = "脚本执行完成，退出码: 0";
            } else {
                terminal = RunState.FAILED;
                message = "脚本执行失败，退出码: " + exitCode;
                log.warn("运行 {} 的进程异常结束，退出码: {}", run.runId, exitCode);
            }
            transition(terminal, run, message);
        }
        run.pump.close();
        run.finished.complete(terminal);
    }

    /**
     * 推进状态并按顺序派发 state-changed 事件。调用方必须持有 lock。
     */
    private void transition(RunState next, ActiveRun run, String message) {
        RunState previous = current.state();
        current = new Snapshot(next, next == RunState.IDLE ? null : run);
        log.info("运行 {} 状态变更: {} -> {}", run.runId, previous, next);

        var event = RunStateChange.of(run.runId, next, next.isTerminal() ? run.exitCode : null, message);
        try {
            eventExecutor.execute(() -> publishEvent(event));
        } catch (RejectedExecutionException e) {
            log.debug("服务正在关闭，未推送状态事件: {}", event);
        }
    }

    private void publishEvent(RunStateChange event) {
        try {
            notificationService.sendRunStateChange(event);
        } catch (RuntimeException e) {
            log.error("推送状态事件 {} 失败", event.state(), e);
        }
    }

    private void validate(RunConfig config) {
        List<String> violations = new ArrayList<>();
        if (config == null) {
            throw new InvalidConfigException(List.of("运行配置不能为空"));
        }
        List<String> command = config.command();
        if (command == null || command.isEmpty()) {
            violations.add("command 不能为空");
        } else if (command.stream().anyMatch(Objects::isNull)) {
            violations.add("command 中不能包含 null 参数");
        } else if (command.get(0).isBlank()) {
            violations.add("可执行文件不能为空");
        }
        if (config.environment() == null) {
            violations.add("environment 不能为 null");
        } else {
            for (Map.Entry<String, String> entry : config.environment().entrySet()) {
                String key = entry.getKey();
                if (key == null || key.isBlank() || key.contains("=") || key.indexOf('\0') >= 0) {
                    violations.add("环境变量名无效: '" + key + "'");
                } else if (entry.getValue() == null) {
                    violations.add("环境变量 " + key + " 的值不能为 null");
                } else if (entry.getValue().indexOf('\0') >= 0) {
                    violations.add("环境变量 " + key + " 的值不能包含 NUL 字符");
                }
            }
        }
        if (config.workingDirectory() != null && !Files.isDirectory(config.workingDirectory())) {
            violations.add("工作目录不存在或不是目录: " + config.workingDirectory());
        }
        Duration grace = config.gracePeriod();
        if (grace == null || grace.isNegative() || grace.isZero() || grace.compareTo(MAX_GRACE_PERIOD) > 0) {
            violations.add("停止宽限期必须大于 0 且不超过 " + MAX_GRACE_PERIOD.toMinutes() + " 分钟");
        }
        if (!violations.isEmpty()) {
            log.warn("拒绝启动请求：运行配置 '{}' 无效: {}", config.profile(), violations);
            throw new InvalidConfigException(violations);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("正在关闭 RunSupervisorService...");
        try {
            stop("服务关闭");
        } catch (NotRunningException e) {
            log.debug("关闭时没有活动的运行: {}", e.getMessage());
        }
        ActiveRun run = current.run();
        if (run != null && current.state().isActive()) {
            Duration budget = run.config.gracePeriod().plus(killTimeout).plus(drainTimeout).plusSeconds(1);
            try {
                awaitTermination(budget);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        for (ExecutorService executor : List.of(timer, eventExecutor, ioExecutor)) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private static ThreadFactory threadFactory(String nameFormat) {
        return new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
    }

    private record Snapshot(RunState state, ActiveRun run) {}

    /**
     * 一次运行的内部状态。可变字段在 lock 内写入，以 volatile 方式供 status() 无锁读取。
     */
    private static final class ActiveRun {
        final String runId;
        final RunConfig config;
        final ManagedProcess process;
        final CompletableFuture<RunState> finished = new CompletableFuture<>();
        volatile LogPump pump;
        volatile Long pid;
        volatile Instant startedAt;
        volatile Instant endedAt;
        volatile Integer exitCode;
        volatile boolean stopRequested;
        volatile String stopReason;
        volatile ScheduledFuture<?> escalation;

        ActiveRun(String runId, RunConfig config, ManagedProcess process) {
            this.runId = runId;
            this.config = config;
            this.process = process;
        }
    }
}
