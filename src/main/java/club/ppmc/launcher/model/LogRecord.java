/**
 * LogRecord.java
 *
 * 该文件定义了一条不可变的日志记录，由 LogPump 从子进程输出中逐行生成，
 * 再经由 LogBroadcaster 分发给所有观察者。
 * 同一次运行内 sequence 严格递增且从 1 开始，是日志的规范顺序。
 */
package club.ppmc.launcher.model;

import java.time.Instant;

/**
 * 一条分类后的日志行。
 *
 * @param runId     所属运行的ID。
 * @param sequence  运行内的单调递增序号，从 1 开始。
 * @param timestamp 读取到该行时的服务器时间。
 * @param level     分类得到的级别。
 * @param stream    来源输出流。
 * @param text      解码并去除首尾空白后的行文本。
 */
public record LogRecord(
        String runId,
        long sequence,
        Instant timestamp,
        LogLevel level,
        LogStream stream,
        String text
) {}
