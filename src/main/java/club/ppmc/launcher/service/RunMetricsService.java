/**
 * RunMetricsService.java
 *
 * 该服务负责周期性地采集受监管脚本进程的资源占用（CPU、常驻内存、线程数）以及主机内存，
 * 并通过WebSocket将这些指标实时推送到前端。没有运行中的进程时不推送任何内容。
 * 它依赖于 Oshi 库进行跨平台的进程信息获取。
 */
package club.ppmc.launcher.service;

import club.ppmc.launcher.model.ProcessMetrics;
import club.ppmc.launcher.model.RunState;
import club.ppmc.launcher.model.RunStatus;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import oshi.SystemInfo;
import oshi.hardware.GlobalMemory;
import oshi.software.os.OSProcess;
import oshi.software.os.OperatingSystem;

@Service
@Slf4j
public class RunMetricsService {

    private final RunSupervisorService supervisorService;
    private final WebSocketNotificationService notificationService;
    private final OperatingSystem operatingSystem;
    private final GlobalMemory memory;

    // 用于计算进程CPU使用率的上一次采样
    private OSProcess previousSample;

    public RunMetricsService(
            RunSupervisorService supervisorService, WebSocketNotificationService notificationService) {
        this.supervisorService = supervisorService;
        this.notificationService = notificationService;
        var systemInfo = new SystemInfo();
        this.operatingSystem = systemInfo.getOperatingSystem();
        this.memory = systemInfo.getHardware().getMemory();
    }

    /**
     * 定时任务，采集当前运行进程的指标并通过WebSocket发送。
     */
    @Scheduled(fixedRateString = "${app.metrics.interval-ms:2000}")
    public void collectAndPushMetrics() {
        try {
            collect().ifPresent(notificationService::sendMetrics);
        } catch (Exception e) {
            log.error("采集或推送进程指标时出错", e);
        }
    }

    /**
     * 采集一次指标。当前没有运行中的进程或进程已不存在时返回空。
     */
    synchronized Optional<ProcessMetrics> collect() {
        RunStatus status = supervisorService.status();
        if ((status.state() != RunState.RUNNING && status.state() != RunState.STOPPING) || status.pid() == null) {
            previousSample = null;
            return Optional.empty();
        }
        int pid = status.pid().intValue();
        OSProcess process = operatingSystem.getProcess(pid);
        if (process == null) {
            previousSample = null;
            return Optional.empty();
        }
        double cpuLoad = previousSample != null && previousSample.getProcessID() == pid
                ? process.getProcessCpuLoadBetweenTicks(previousSample) * 100.0
                : 0.0;
        this.previousSample = process;

        long memoryTotal = memory.getTotal();
        return Optional.of(new ProcessMetrics(
                status.runId(),
                pid,
                cpuLoad,
                process.getResidentSetSize(),
                process.getThreadCount(),
                memoryTotal - memory.getAvailable(),
                memoryTotal,
                System.currentTimeMillis()));
    }
}
