/**
 * ProcessMetrics.java
 *
 * 受监管进程的资源指标，由 RunMetricsService 周期性采集并推送到 /topic/run/metrics。
 */
package club.ppmc.launcher.model;

/**
 * @param runId          所属运行的ID。
 * @param pid            子进程PID。
 * @param cpuUsage       子进程在两次采样之间的CPU使用率 (百分比)。
 * @param residentMemory 子进程常驻内存 (字节)。
 * @param threadCount    子进程线程数。
 * @param memoryUsed     主机已用内存 (字节)。
 * @param memoryTotal    主机总内存 (字节)。
 * @param timestamp      采样时间戳 (毫秒)。
 */
public record ProcessMetrics(
        String runId,
        long pid,
        double cpuUsage,
        long residentMemory,
        int threadCount,
        long memoryUsed,
        long memoryTotal,
        long timestamp
) {}
