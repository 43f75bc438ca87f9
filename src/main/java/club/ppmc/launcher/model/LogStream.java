/**
 * LogStream.java
 *
 * 标识一条日志来自子进程的哪个输出流。
 */
package club.ppmc.launcher.model;

public enum LogStream {
    STDOUT,
    STDERR
}
